package com.raditha.clonegen.formatting;

import com.raditha.clonegen.config.SpacingStyle;
import com.raditha.clonegen.lexer.LineIndex;
import com.raditha.clonegen.lexer.Tokenizer;
import com.raditha.clonegen.model.Language;
import com.raditha.clonegen.model.Token;
import com.raditha.clonegen.model.TokenKind;
import com.raditha.clonegen.model.TokenStream;

import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Tightens or loosens the spacing around operators and after commas.
 * <p>
 * Works on token junctions, never on raw text: only the gap between two code
 * tokens on the same line is rewritten, and a gap is closed only when the two
 * tokens glued together still lex as the same two tokens. That keeps
 * {@code a - -b}, {@code a / *p} and {@code x = a + b} intact.
 */
public class OperatorSpacingStep implements FormattingStep {

    private static final Set<String> OPENERS = Set.of("(", "[", "{");
    private static final Set<String> NO_SPACE_BEFORE = Set.of(",", ";", ")", "]", "}");

    private final Tokenizer tokenizer;
    private final SpacingStyle style;

    public OperatorSpacingStep(Tokenizer tokenizer, SpacingStyle style) {
        this.tokenizer = tokenizer;
        this.style = style == null ? SpacingStyle.RANDOM : style;
    }

    @Override
    public FormattingOperation operation() {
        return FormattingOperation.OPERATOR_SPACING;
    }

    @Override
    public String apply(String source, Language language, Random random) {
        SpacingStyle chosen = style;
        if (chosen == SpacingStyle.RANDOM) {
            chosen = random.nextBoolean() ? SpacingStyle.COMPACT : SpacingStyle.SPACED;
        }
        TokenStream stream = tokenizer.tokenize(source, language);
        Set<Integer> directiveLines = directiveLines(stream);
        List<Token> tokens = stream.tokens();

        StringBuilder out = new StringBuilder(source.length() + 16);
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            Token left = i > 0 ? tokens.get(i - 1) : null;
            Token right = i + 1 < tokens.size() ? tokens.get(i + 1) : null;

            if (token.kind() == TokenKind.WHITESPACE) {
                if (left != null && right != null && isJunction(left, right, directiveLines)
                        && token.text().indexOf('\n') < 0) {
                    out.append(respace(left, right, token.text(), chosen, language));
                } else {
                    out.append(token.text());
                }
                continue;
            }

            out.append(token.text());
            if (chosen == SpacingStyle.SPACED && right != null && right.kind() != TokenKind.WHITESPACE
                    && isJunction(token, right, directiveLines) && spaceAllowed(token, right)) {
                out.append(' ');
            }
        }
        return out.toString();
    }

    private String respace(Token left, Token right, String gap, SpacingStyle chosen, Language language) {
        if (chosen == SpacingStyle.COMPACT) {
            return glues(left, right, language) ? "" : gap;
        }
        return spaceAllowed(left, right) ? " " : gap;
    }

    /**
     * Two code tokens on the same line, at least one of them an operator or
     * the left one a comma, and neither of them a keyword.
     */
    private static boolean isJunction(Token left, Token right, Set<Integer> directiveLines) {
        if (!left.isCode() || !right.isCode()) {
            return false;
        }
        if (left.kind() == TokenKind.KEYWORD || right.kind() == TokenKind.KEYWORD) {
            return false;
        }
        if (directiveLines.contains(left.line()) || directiveLines.contains(right.line())) {
            return false;
        }
        return left.kind() == TokenKind.OPERATOR || right.kind() == TokenKind.OPERATOR || left.is(",");
    }

    private static boolean spaceAllowed(Token left, Token right) {
        return !OPENERS.contains(left.text()) && !NO_SPACE_BEFORE.contains(right.text());
    }

    /**
     * True when {@code left + right} with no gap lexes back to the same two
     * tokens.
     */
    private boolean glues(Token left, Token right, Language language) {
        List<Token> glued = tokenizer.tokenize(left.text() + right.text(), language).tokens();
        return glued.size() == 2 && glued.get(0).sameAs(left) && glued.get(1).sameAs(right);
    }

    /**
     * Lines of C and C++ preprocessor directives, including backslash
     * continuations.
     */
    private static Set<Integer> directiveLines(TokenStream stream) {
        Set<Integer> lines = new HashSet<>();
        if (stream.language() != Language.C && stream.language() != Language.CPP) {
            return lines;
        }
        LineIndex index = new LineIndex(stream);
        boolean inDirective = false;
        for (int line = 1; line <= index.lineCount(); line++) {
            Token first = index.firstCode(line);
            boolean continued = inDirective && line > 1
                    && index.lineText(line - 1).stripTrailing().endsWith("\\");
            inDirective = continued || (first != null && first.is("#") && !index.startsInsideToken(line));
            if (inDirective) {
                lines.add(line);
            }
        }
        return lines;
    }
}
