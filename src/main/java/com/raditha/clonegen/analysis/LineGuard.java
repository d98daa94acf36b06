package com.raditha.clonegen.analysis;

import com.raditha.clonegen.lexer.LanguageProfile;
import com.raditha.clonegen.lexer.LineIndex;
import com.raditha.clonegen.lexer.Tokenizer;
import com.raditha.clonegen.model.Language;
import com.raditha.clonegen.model.LineRole;
import com.raditha.clonegen.model.MutationGuard;
import com.raditha.clonegen.model.Token;
import com.raditha.clonegen.model.TokenKind;
import com.raditha.clonegen.model.TokenStream;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Tags every source line with a {@link LineRole}.
 * <p>
 * This is the single place that decides which lines structural mutation may
 * touch. A line is {@link LineRole#STATEMENT} only when it holds one complete,
 * self-contained statement inside executable code; anything that is part of
 * a signature, a multi-line construct, a type body or block structure gets a
 * critical role instead.
 */
public class LineGuard {

    private static final Set<String> CLOSERS = Set.of("}", ")", "]");
    private static final Set<String> STATEMENT_ENDS = Set.of(";", "{", "}", ":");
    private static final Set<String> PYTHON_DECLARATIONS = Set.of("class", "def", "global", "nonlocal");

    private final Tokenizer tokenizer;

    public LineGuard() {
        this(new Tokenizer());
    }

    public LineGuard(Tokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    public List<MutationGuard> tag(String source, Language language) {
        return tag(tokenizer.tokenize(source, language));
    }

    /**
     * One guard per line, in line order (index {@code i} holds line {@code i + 1}).
     */
    public List<MutationGuard> tag(TokenStream stream) {
        LineIndex index = new LineIndex(stream);
        if (stream.language() == Language.PYTHON) {
            return tagPython(index);
        }
        return tagCFamily(index, LanguageProfile.of(stream.language()));
    }

    private List<MutationGuard> tagPython(LineIndex index) {
        LanguageProfile profile = LanguageProfile.of(Language.PYTHON);
        List<MutationGuard> guards = new ArrayList<>();
        Token previousLast = null;
        for (int line = 1; line <= index.lineCount(); line++) {
            LineRole role = pythonRole(index, line, previousLast, profile);
            guards.add(new MutationGuard(line, role));
            if (index.hasCode(line)) {
                previousLast = index.lastCode(line);
            }
        }
        return guards;
    }

    private LineRole pythonRole(LineIndex index, int line, Token previousLast, LanguageProfile profile) {
        LineRole structural = commonRole(index, line);
        if (structural != null) {
            return structural;
        }
        if (index.bracketDepthAtStart(line) > 0 || (previousLast != null && previousLast.is("\\"))) {
            return LineRole.CONTINUATION;
        }
        List<Token> code = index.codeTokensOn(line);
        Token first = code.get(0);
        Token last = code.get(code.size() - 1);

        if (first.is("@")) {
            return LineRole.DECORATOR;
        }
        if (first.kind() == TokenKind.KEYWORD && profile.isImportKeyword(first.text())) {
            return LineRole.IMPORT;
        }
        if (PYTHON_DECLARATIONS.contains(first.text())
                || (first.is("async") && code.size() > 1 && code.get(1).is("def"))) {
            return LineRole.DECLARATION;
        }
        if (first.kind() == TokenKind.KEYWORD && (profile.isControlKeyword(first.text()) || first.is("async"))) {
            return LineRole.CONTROL;
        }
        if (first.kind() == TokenKind.KEYWORD && profile.isExitKeyword(first.text())) {
            return LineRole.EXIT;
        }
        if (last.is(":")) {
            return LineRole.CONTROL;
        }
        if (lineDelta(code) != 0 || last.is("\\") || index.endsInsideToken(line)) {
            return LineRole.CONTINUATION;
        }
        if (code.size() == 1 && first.kind() == TokenKind.LITERAL_STRING) {
            return LineRole.OTHER;
        }
        return LineRole.STATEMENT;
    }

    private List<MutationGuard> tagCFamily(LineIndex index, LanguageProfile profile) {
        List<MutationGuard> guards = new ArrayList<>();
        BlockTracker blocks = new BlockTracker(profile);
        Token previousLast = null;
        boolean previousDirective = false;

        for (int line = 1; line <= index.lineCount(); line++) {
            LineRole role = commonRole(index, line);
            if (role == null) {
                role = cFamilyRole(index, line, previousLast, previousDirective, blocks, profile);
            }
            guards.add(new MutationGuard(line, role));
            if (index.hasCode(line)) {
                Token first = index.firstCode(line);
                previousDirective = (first.is("#") && role == LineRole.IMPORT)
                        || (previousDirective && previousLast != null && previousLast.is("\\"))
                        || role == LineRole.DECORATOR;
                previousLast = index.lastCode(line);
                for (Token token : index.codeTokensOn(line)) {
                    blocks.accept(token);
                }
            }
        }
        return guards;
    }

    private LineRole cFamilyRole(LineIndex index, int line, Token previousLast, boolean previousDirective,
            BlockTracker blocks, LanguageProfile profile) {
        List<Token> code = index.codeTokensOn(line);
        Token first = code.get(0);
        Token last = code.get(code.size() - 1);
        boolean preprocessorLanguage = profile.language() == Language.C || profile.language() == Language.CPP;

        if (previousLast != null && previousLast.is("\\")) {
            return LineRole.CONTINUATION;
        }
        if (first.is("#") && preprocessorLanguage) {
            return LineRole.IMPORT;
        }
        if (blocks.parenDepth() > 0) {
            return LineRole.CONTINUATION;
        }
        boolean previousComplete = previousLast == null || previousDirective
                || STATEMENT_ENDS.contains(previousLast.text());
        if (!previousComplete && !first.is("{")) {
            return LineRole.CONTINUATION;
        }
        if (first.is("@")) {
            return LineRole.DECORATOR;
        }
        if (first.kind() == TokenKind.KEYWORD && profile.isImportKeyword(first.text())) {
            return LineRole.IMPORT;
        }
        if (CLOSERS.contains(first.text())) {
            return LineRole.CLOSING;
        }
        if (first.kind() == TokenKind.KEYWORD && profile.isControlKeyword(first.text())) {
            return LineRole.CONTROL;
        }
        if (first.kind() == TokenKind.KEYWORD && profile.isExitKeyword(first.text())) {
            return LineRole.EXIT;
        }
        if (code.stream().anyMatch(t -> t.kind() == TokenKind.KEYWORD
                && profile.isTypeDeclarationKeyword(t.text()))) {
            return LineRole.DECLARATION;
        }
        if (last.is("{") || first.is("{")) {
            return LineRole.DECLARATION;
        }
        if (lineDelta(code) != 0) {
            return LineRole.CONTINUATION;
        }
        if (last.is(";")) {
            return switch (blocks.current()) {
                case CODE -> LineRole.STATEMENT;
                case TOP -> profile.language() == Language.JAVASCRIPT ? LineRole.STATEMENT : LineRole.DECLARATION;
                default -> LineRole.DECLARATION;
            };
        }
        if (last.is(":")) {
            return LineRole.CONTROL;
        }
        return LineRole.OTHER;
    }

    /**
     * Roles that depend only on the line's layout, shared by all languages.
     * Returns null when the line holds code that needs language rules.
     */
    private LineRole commonRole(LineIndex index, int line) {
        if (index.startsInsideToken(line)) {
            return LineRole.CONTINUATION;
        }
        if (index.isBlank(line)) {
            return LineRole.BLANK;
        }
        if (!index.hasCode(line)) {
            return LineRole.COMMENT;
        }
        return null;
    }

    private static int lineDelta(List<Token> code) {
        int delta = 0;
        for (Token token : code) {
            if (token.kind() == TokenKind.PUNCTUATION) {
                delta += LineIndex.bracketDelta(token.text());
            }
        }
        return delta;
    }

    /**
     * Kind of brace block enclosing a position.
     */
    enum BlockKind {
        /** Outside any brace. */
        TOP,
        /** Function, method, lambda or control-statement body. */
        CODE,
        /** Class, struct, enum, namespace or other declaration body. */
        TYPE,
        /** Array, object or aggregate initializer. */
        INITIALIZER
    }

    /**
     * Follows brace nesting and classifies each opened block.
     */
    static final class BlockTracker {
        private static final Set<String> INITIALIZER_PRECEDERS = Set.of("=", ",", "(", "[", "return", ":", "?");
        private static final Set<String> CODE_PRECEDERS = Set.of(")", "->", "=>", "else", "do", "try", "finally");

        private final LanguageProfile profile;
        private final Deque<BlockKind> stack = new ArrayDeque<>();
        private final Deque<Integer> savedParenDepths = new ArrayDeque<>();
        private int parenDepth;
        private boolean typeKeywordSeen;
        private Token previous;

        BlockTracker(LanguageProfile profile) {
            this.profile = profile;
        }

        BlockKind current() {
            return stack.isEmpty() ? BlockKind.TOP : stack.peek();
        }

        int parenDepth() {
            return parenDepth;
        }

        void accept(Token token) {
            if (declaresType(token)) {
                typeKeywordSeen = true;
            }
            if (token.is("(") || token.is("[")) {
                parenDepth++;
            } else if ((token.is(")") || token.is("]")) && parenDepth > 0) {
                parenDepth--;
            } else if (token.is("{")) {
                stack.push(kindOfOpening());
                savedParenDepths.push(parenDepth);
                parenDepth = 0;
                typeKeywordSeen = false;
            } else if (token.is("}")) {
                if (!stack.isEmpty()) {
                    stack.pop();
                    parenDepth = savedParenDepths.pop();
                }
                typeKeywordSeen = false;
            } else if (token.is(";") && parenDepth == 0) {
                typeKeywordSeen = false;
            }
            previous = token;
        }

        private boolean declaresType(Token token) {
            if (token.kind() == TokenKind.KEYWORD) {
                return profile.isTypeDeclarationKeyword(token.text());
            }
            return profile.language() == Language.JAVA && token.kind() == TokenKind.IDENTIFIER
                    && token.is("record");
        }

        private BlockKind kindOfOpening() {
            BlockKind parent = current();
            if (previous == null) {
                return BlockKind.TYPE;
            }
            String p = previous.text();
            if (parent == BlockKind.INITIALIZER || (parenDepth > 0 && !CODE_PRECEDERS.contains(p))) {
                return BlockKind.INITIALIZER;
            }
            if (p.equals(":") && parent == BlockKind.CODE) {
                return BlockKind.CODE;
            }
            if (INITIALIZER_PRECEDERS.contains(p)) {
                return BlockKind.INITIALIZER;
            }
            if (typeKeywordSeen) {
                return BlockKind.TYPE;
            }
            if (CODE_PRECEDERS.contains(p)) {
                return BlockKind.CODE;
            }
            if (p.equals(";") || p.equals("{") || p.equals("}")) {
                return parent == BlockKind.TOP ? BlockKind.CODE : parent;
            }
            return parent == BlockKind.CODE ? BlockKind.CODE : BlockKind.TYPE;
        }
    }
}
