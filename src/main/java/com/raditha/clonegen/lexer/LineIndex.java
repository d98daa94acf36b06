package com.raditha.clonegen.lexer;

import com.raditha.clonegen.model.Token;
import com.raditha.clonegen.model.TokenKind;
import com.raditha.clonegen.model.TokenStream;

import java.util.ArrayList;
import java.util.List;

/**
 * Line-oriented view of a token stream.
 * <p>
 * Lines are 1-based and split on {@code \n}. A line "starts inside a token"
 * when a multi-line string or comment that began on an earlier line is still
 * open at its first character; such lines must never be edited as text.
 */
public class LineIndex {

    private final TokenStream stream;
    private final String source;
    private final int[] lineStarts;
    private final boolean[] insideToken;
    private final List<List<Token>> codeByLine;
    private final List<List<Token>> tokensByLine;
    private final int[] bracketDepthAtStart;

    public LineIndex(TokenStream stream) {
        this.stream = stream;
        this.source = stream.text();
        this.lineStarts = computeLineStarts(source);
        int lines = lineStarts.length;
        this.insideToken = new boolean[lines + 2];
        this.bracketDepthAtStart = new int[lines + 2];
        this.codeByLine = new ArrayList<>(lines + 1);
        this.tokensByLine = new ArrayList<>(lines + 1);
        for (int i = 0; i <= lines; i++) {
            codeByLine.add(new ArrayList<>());
            tokensByLine.add(new ArrayList<>());
        }
        index();
    }

    private static int[] computeLineStarts(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }

    private void index() {
        int depth = 0;
        int currentLine = 1;
        for (Token token : stream.tokens()) {
            while (currentLine < token.line()) {
                currentLine++;
                bracketDepthAtStart[currentLine] = depth;
            }
            if (token.kind() != TokenKind.WHITESPACE) {
                tokensByLine.get(token.line()).add(token);
                for (int l = token.line() + 1; l <= token.endLine(); l++) {
                    insideToken[l] = true;
                }
            }
            if (token.isCode()) {
                codeByLine.get(token.line()).add(token);
                if (token.kind() == TokenKind.PUNCTUATION) {
                    depth += bracketDelta(token.text());
                }
            }
        }
        while (currentLine < lineStarts.length) {
            currentLine++;
            bracketDepthAtStart[currentLine] = depth;
        }
    }

    public static int bracketDelta(String text) {
        return switch (text) {
            case "(", "[", "{" -> 1;
            case ")", "]", "}" -> -1;
            default -> 0;
        };
    }

    public TokenStream stream() {
        return stream;
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /**
     * Text of the line without its terminating newline.
     */
    public String lineText(int line) {
        int start = lineStarts[line - 1];
        int end = line < lineStarts.length ? lineStarts[line] - 1 : source.length();
        return source.substring(start, end);
    }

    public int lineStartOffset(int line) {
        return lineStarts[line - 1];
    }

    /**
     * True when the line begins inside a string or comment opened on an
     * earlier line.
     */
    public boolean startsInsideToken(int line) {
        return line >= 1 && line < insideToken.length && insideToken[line];
    }

    /**
     * True when a string or comment that is open at the end of this line
     * continues on the next one.
     */
    public boolean endsInsideToken(int line) {
        return startsInsideToken(line + 1);
    }

    /**
     * Code tokens that start on the line.
     */
    public List<Token> codeTokensOn(int line) {
        return codeByLine.get(line);
    }

    /**
     * Non-whitespace tokens (code and comments) that start on the line.
     */
    public List<Token> tokensOn(int line) {
        return tokensByLine.get(line);
    }

    public boolean hasCode(int line) {
        return !codeByLine.get(line).isEmpty();
    }

    public boolean isBlank(int line) {
        return tokensByLine.get(line).isEmpty() && !startsInsideToken(line);
    }

    /**
     * Combined {@code () [] {}} nesting depth before the first token of the line.
     */
    public int bracketDepthAtStart(int line) {
        return bracketDepthAtStart[line];
    }

    public Token firstCode(int line) {
        List<Token> code = codeByLine.get(line);
        return code.isEmpty() ? null : code.get(0);
    }

    public Token lastCode(int line) {
        List<Token> code = codeByLine.get(line);
        return code.isEmpty() ? null : code.get(code.size() - 1);
    }

    /**
     * Leading whitespace of the line.
     */
    public String indentation(int line) {
        String text = lineText(line);
        int i = 0;
        while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            i++;
        }
        return text.substring(0, i);
    }
}
