package com.raditha.clonegen.formatting;

import com.raditha.clonegen.lexer.LanguageProfile;
import com.raditha.clonegen.lexer.LineIndex;
import com.raditha.clonegen.lexer.Tokenizer;
import com.raditha.clonegen.model.Language;
import com.raditha.clonegen.model.Token;
import com.raditha.clonegen.model.TokenKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.regex.Pattern;

/**
 * Removes, rewords and adds comments.
 * <p>
 * Only comments that start and end on the same line are edited. A removed
 * whole-line comment takes its line with it, a removed trailing comment takes
 * the spaces before it, and a removed block comment between two code tokens
 * leaves a single space so the tokens stay apart. Shebang and encoding
 * declarations are kept.
 */
public class CommentStep implements FormattingStep {

    static final double REMOVE_PROBABILITY = 0.3;
    static final double REWORD_PROBABILITY = 0.2;
    static final double ADD_PROBABILITY = 0.1;
    static final List<String> COMMENT_WORDS = List.of("Modified", "Changed", "Updated", "Reformatted", "TODO");

    private static final Pattern ENCODING = Pattern.compile("coding[:=]\\s*[-\\w.]+");

    private final Tokenizer tokenizer;

    public CommentStep(Tokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    @Override
    public FormattingOperation operation() {
        return FormattingOperation.COMMENTS;
    }

    @Override
    public String apply(String source, Language language, Random random) {
        LineIndex index = new LineIndex(tokenizer.tokenize(source, language));
        LanguageProfile profile = LanguageProfile.of(language);
        List<String> out = new ArrayList<>(index.lineCount() + 4);

        for (int line = 1; line <= index.lineCount(); line++) {
            String text = index.lineText(line);
            if (index.startsInsideToken(line)) {
                out.add(text);
                continue;
            }
            boolean afterBackslash = line > 1 && index.lineText(line - 1).stripTrailing().endsWith("\\");
            if (index.hasCode(line) && !afterBackslash && random.nextDouble() < ADD_PROBABILITY) {
                out.add(index.indentation(line) + profile.lineCommentPrefix() + " " + pick(random));
            }
            String edited = editLine(index, line, afterBackslash, profile, random);
            if (edited != null) {
                out.add(edited);
            }
        }
        return String.join("\n", out);
    }

    /**
     * The line with its comments edited, or null when the whole line goes.
     */
    private String editLine(LineIndex index, int line, boolean afterBackslash, LanguageProfile profile,
            Random random) {
        String text = index.lineText(line);
        List<Token> onLine = index.tokensOn(line);
        int lineStart = index.lineStartOffset(line);

        if (onLine.size() == 1 && isEditable(onLine.get(0), line)) {
            double roll = random.nextDouble();
            if (roll < REMOVE_PROBABILITY && !afterBackslash) {
                return null;
            }
            if (roll < REMOVE_PROBABILITY + REWORD_PROBABILITY) {
                return replace(text, onLine.get(0), lineStart, reword(onLine.get(0), profile, random));
            }
            return text;
        }

        // right to left, so earlier offsets stay valid
        for (int i = onLine.size() - 1; i >= 0; i--) {
            Token token = onLine.get(i);
            if (!isEditable(token, line)) {
                continue;
            }
            double roll = random.nextDouble();
            if (roll < REMOVE_PROBABILITY) {
                text = remove(text, token, lineStart, i == 0, i == onLine.size() - 1);
            } else if (roll < REMOVE_PROBABILITY + REWORD_PROBABILITY) {
                text = replace(text, token, lineStart, reword(token, profile, random));
            }
        }
        return text;
    }

    private boolean isEditable(Token token, int line) {
        if (token.kind() != TokenKind.COMMENT || token.endLine() != line) {
            return false;
        }
        String body = token.text().stripTrailing();
        if (body.endsWith("\\")) {
            return false;
        }
        if (line == 1 && body.startsWith("#!")) {
            return false;
        }
        return !(line <= 2 && ENCODING.matcher(body).find());
    }

    private static String remove(String text, Token comment, int lineStart, boolean first, boolean last) {
        int from = comment.startOffset() - lineStart;
        int to = comment.endOffset() - lineStart;
        String before = text.substring(0, from);
        String after = text.substring(to);
        if (last) {
            String carriageReturn = comment.text().endsWith("\r") ? "\r" : "";
            return stripTrailingBlanks(before) + carriageReturn + after;
        }
        if (first) {
            return before + stripLeadingBlanks(after);
        }
        return before + " " + after;
    }

    private static String replace(String text, Token comment, int lineStart, String replacement) {
        int from = comment.startOffset() - lineStart;
        int to = comment.endOffset() - lineStart;
        String carriageReturn = comment.text().endsWith("\r") ? "\r" : "";
        return text.substring(0, from) + replacement + carriageReturn + text.substring(to);
    }

    private static String reword(Token comment, LanguageProfile profile, Random random) {
        String word = pick(random);
        if (comment.text().startsWith("/*")) {
            return "/* " + word + " */";
        }
        return profile.lineCommentPrefix() + " " + word;
    }

    private static String pick(Random random) {
        return COMMENT_WORDS.get(random.nextInt(COMMENT_WORDS.size()));
    }

    private static String stripTrailingBlanks(String text) {
        int end = text.length();
        while (end > 0 && (text.charAt(end - 1) == ' ' || text.charAt(end - 1) == '\t')) {
            end--;
        }
        return text.substring(0, end);
    }

    private static String stripLeadingBlanks(String text) {
        int start = 0;
        while (start < text.length() && (text.charAt(start) == ' ' || text.charAt(start) == '\t')) {
            start++;
        }
        return text.substring(start);
    }
}
