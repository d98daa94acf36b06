package com.raditha.clonegen.validation;

import com.raditha.clonegen.lexer.LineIndex;
import com.raditha.clonegen.model.MutationGuard;
import com.raditha.clonegen.model.Token;
import com.raditha.clonegen.model.TokenKind;
import com.raditha.clonegen.model.TokenStream;
import com.raditha.clonegen.model.Violation;
import com.raditha.clonegen.model.ViolationKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Token- and line-level structure checks shared by the validator and the
 * Type-3 engine's output check.
 */
public class StructureChecker {

    private static final String[][] BRACKET_PAIRS = { { "(", ")" }, { "[", "]" }, { "{", "}" } };
    private static final int TAB_WIDTH = 8;

    /**
     * The variant must leave every bracket type with the same net delta as
     * the original, and must not close a bracket that was never opened
     * unless the original already does.
     */
    public List<Violation> checkBrackets(TokenStream original, TokenStream variant) {
        List<Violation> violations = new ArrayList<>();
        for (String[] pair : BRACKET_PAIRS) {
            BracketBalance expected = balance(original, pair[0], pair[1]);
            BracketBalance actual = balance(variant, pair[0], pair[1]);
            if (expected.delta != actual.delta) {
                violations.add(new Violation(ViolationKind.UNBALANCED_BRACKETS,
                        String.format("'%s%s' delta is %d, original has %d", pair[0], pair[1], actual.delta,
                                expected.delta)));
            } else if (actual.minimum < 0 && expected.minimum >= 0) {
                violations.add(new Violation(ViolationKind.UNBALANCED_BRACKETS,
                        String.format("'%s' closed before it was opened", pair[1])));
            }
        }
        return violations;
    }

    private static BracketBalance balance(TokenStream stream, String open, String close) {
        int depth = 0;
        int minimum = 0;
        for (Token token : stream.codeTokens()) {
            if (token.kind() != TokenKind.PUNCTUATION) {
                continue;
            }
            if (token.is(open)) {
                depth++;
            } else if (token.is(close)) {
                depth--;
                minimum = Math.min(minimum, depth);
            }
        }
        return new BracketBalance(depth, minimum);
    }

    /**
     * Every critical line of the original must still appear verbatim in the
     * variant. Trailing whitespace is ignored and duplicate lines must all
     * survive.
     */
    public List<Violation> checkCriticalLines(String original, String variant, List<MutationGuard> guards) {
        String[] originalLines = original.split("\n", -1);
        Map<String, Integer> available = new HashMap<>();
        for (String line : variant.split("\n", -1)) {
            available.merge(line.stripTrailing(), 1, Integer::sum);
        }

        List<Violation> violations = new ArrayList<>();
        for (MutationGuard guard : guards) {
            if (!guard.isCritical() || guard.lineNumber() > originalLines.length) {
                continue;
            }
            String line = originalLines[guard.lineNumber() - 1].stripTrailing();
            int left = available.getOrDefault(line, 0);
            if (left == 0) {
                violations.add(new Violation(ViolationKind.MISSING_CRITICAL_LINE,
                        String.format("line %d (%s) is missing: %s", guard.lineNumber(),
                                guard.role().name().toLowerCase(), line.strip())));
            } else {
                available.put(line, left - 1);
            }
        }
        return violations;
    }

    /**
     * Python block structure: every logical line must either match an open
     * indentation level or open a new one right after a line ending in
     * {@code :}. The first logical line sets the base level, so fragments
     * cut out of a nested scope are accepted.
     */
    public List<Violation> checkPythonIndentation(TokenStream stream) {
        LineIndex index = new LineIndex(stream);
        List<Violation> violations = new ArrayList<>();
        Deque<Integer> levels = new ArrayDeque<>();
        Token lastCode = null;
        int opener = 0;

        for (int line = 1; line <= index.lineCount(); line++) {
            if (!index.hasCode(line) || index.startsInsideToken(line) || index.bracketDepthAtStart(line) > 0
                    || (lastCode != null && lastCode.is("\\"))) {
                if (index.hasCode(line)) {
                    lastCode = index.lastCode(line);
                }
                continue;
            }
            int width = width(index.indentation(line));
            boolean expectIndent = lastCode != null && lastCode.is(":");

            if (levels.isEmpty()) {
                levels.push(width);
            } else if (expectIndent) {
                if (width <= levels.peek()) {
                    violations.add(indentation("expected an indented block after line %d, found line %d",
                            opener, line));
                } else {
                    levels.push(width);
                }
            } else if (width > levels.peek()) {
                violations.add(indentation("unexpected indent at line %d", line));
            } else if (width < levels.peek()) {
                while (!levels.isEmpty() && levels.peek() > width) {
                    levels.pop();
                }
                if (levels.isEmpty() || levels.peek() != width) {
                    violations.add(indentation("unindent does not match any outer level at line %d", line));
                    levels.push(width);
                }
            }
            lastCode = index.lastCode(line);
            opener = line;
        }
        if (lastCode != null && lastCode.is(":")) {
            violations.add(indentation("expected an indented block after line %d, found end of input", opener));
        }
        return violations;
    }

    private static Violation indentation(String format, Object... args) {
        return new Violation(ViolationKind.INDENTATION_INCONSISTENT, String.format(format, args));
    }

    static int width(String indentation) {
        int width = 0;
        for (int i = 0; i < indentation.length(); i++) {
            if (indentation.charAt(i) == '\t') {
                width = (width / TAB_WIDTH + 1) * TAB_WIDTH;
            } else {
                width++;
            }
        }
        return width;
    }

    private record BracketBalance(int delta, int minimum) {
    }
}
