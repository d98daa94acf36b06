package com.raditha.clonegen.formatting;

import com.raditha.clonegen.lexer.LanguageProfile;
import com.raditha.clonegen.lexer.LineIndex;
import com.raditha.clonegen.lexer.Tokenizer;
import com.raditha.clonegen.model.Language;
import com.raditha.clonegen.model.Token;
import com.raditha.clonegen.model.TokenKind;
import com.raditha.clonegen.model.TokenStream;

import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Moves block-opening braces between the end of the header line and a line
 * of their own. Only braces that follow {@code )}, {@code else}, {@code do},
 * {@code try}, {@code finally} or a type declaration header are moved, so
 * initializer and object-literal braces stay where they are.
 */
public class BracePositionStep implements FormattingStep {

    private static final Set<String> BRACE_KEYWORDS = Set.of("else", "do", "try", "finally");

    private final Tokenizer tokenizer;

    public BracePositionStep(Tokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    @Override
    public FormattingOperation operation() {
        return FormattingOperation.BRACE_POSITION;
    }

    @Override
    public boolean appliesTo(Language language) {
        return language.isCFamily();
    }

    @Override
    public String apply(String source, Language language, Random random) {
        TokenStream stream = tokenizer.tokenize(source, language);
        LineIndex index = new LineIndex(stream);
        LanguageProfile profile = LanguageProfile.of(language);
        List<Token> tokens = stream.tokens();
        boolean ownLine = random.nextBoolean();

        String[] texts = new String[tokens.size()];
        for (int i = 0; i < tokens.size(); i++) {
            texts[i] = tokens.get(i).text();
        }

        for (int i = 0; i < tokens.size(); i++) {
            Token brace = tokens.get(i);
            if (brace.kind() != TokenKind.PUNCTUATION || !brace.is("{")) {
                continue;
            }
            int gap = i > 0 && tokens.get(i - 1).kind() == TokenKind.WHITESPACE ? i - 1 : -1;
            int header = gap >= 0 ? gap - 1 : i - 1;
            if (header < 0) {
                continue;
            }
            Token previous = tokens.get(header);
            if (!previous.isCode() || !opensBlock(previous, index, profile)
                    || isDirective(index, previous.line()) || isDirective(index, brace.line())) {
                continue;
            }
            boolean onOwnLine = gap >= 0 && tokens.get(gap).text().indexOf('\n') >= 0;
            if (ownLine && !onOwnLine) {
                String newline = "\n" + index.indentation(previous.line());
                if (gap >= 0) {
                    texts[gap] = newline;
                } else {
                    texts[header] = texts[header] + newline;
                }
            } else if (!ownLine && onOwnLine && countNewlines(tokens.get(gap).text()) == 1
                    && canJoin(previous, index, language)) {
                texts[gap] = " ";
            }
        }
        return String.join("", texts);
    }

    private static boolean opensBlock(Token previous, LineIndex index, LanguageProfile profile) {
        if (previous.is(")")) {
            return true;
        }
        if (previous.kind() == TokenKind.KEYWORD && BRACE_KEYWORDS.contains(previous.text())) {
            return true;
        }
        if (previous.kind() == TokenKind.IDENTIFIER || previous.is(">")) {
            for (Token token : index.codeTokensOn(previous.line())) {
                if (token.kind() == TokenKind.KEYWORD && profile.isTypeDeclarationKeyword(token.text())) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * In JavaScript a {@code )} followed by a newline and a block may rely on
     * automatic semicolon insertion; only join when a keyword such as
     * {@code if} or {@code function} owns the header.
     */
    private static boolean canJoin(Token previous, LineIndex index, Language language) {
        if (language != Language.JAVASCRIPT || !previous.is(")")) {
            return true;
        }
        return index.codeTokensOn(previous.line()).stream().anyMatch(t -> t.kind() == TokenKind.KEYWORD);
    }

    private static boolean isDirective(LineIndex index, int line) {
        Language language = index.stream().language();
        if (language != Language.C && language != Language.CPP) {
            return false;
        }
        for (int l = line; l >= 1; l--) {
            Token first = index.firstCode(l);
            if (first != null && first.is("#")) {
                return true;
            }
            if (l == 1 || !index.lineText(l - 1).stripTrailing().endsWith("\\")) {
                return false;
            }
        }
        return false;
    }

    private static int countNewlines(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }
}
