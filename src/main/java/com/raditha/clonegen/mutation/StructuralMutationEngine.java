package com.raditha.clonegen.mutation;

import com.raditha.clonegen.analysis.IdentifierAnalyzer;
import com.raditha.clonegen.analysis.LineGuard;
import com.raditha.clonegen.config.MutationOptions;
import com.raditha.clonegen.config.ValidationThresholds;
import com.raditha.clonegen.lexer.LineIndex;
import com.raditha.clonegen.lexer.Tokenizer;
import com.raditha.clonegen.model.Language;
import com.raditha.clonegen.model.MutationGuard;
import com.raditha.clonegen.model.Token;
import com.raditha.clonegen.model.TokenKind;
import com.raditha.clonegen.model.TokenStream;
import com.raditha.clonegen.model.TransformationResult;
import com.raditha.clonegen.model.Violation;
import com.raditha.clonegen.util.SeedSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Type-3 engine: a bounded number of statement-level edits.
 * <p>
 * Lines are tagged once with {@link LineGuard}; only lines tagged
 * {@code STATEMENT} in the original are edit targets, and a target that has
 * been deleted or wrapped is not touched again. Every edit is checked with
 * {@link OutputValidator} and rolled back when it breaks bracket balance,
 * Python indentation, the length floor, a critical line or the similarity
 * floor.
 */
public class StructuralMutationEngine {
    private static final Logger logger = LoggerFactory.getLogger(StructuralMutationEngine.class);

    public static final String NO_MUTABLE_LINES = "skipped:no_mutable_lines";
    public static final String RETRIES_EXHAUSTED = "skipped:retry_budget_exhausted";

    private static final Set<String> DECLARATION_STARTERS = Set.of(
            "int", "long", "char", "float", "double", "short", "byte", "boolean", "bool", "auto", "var", "let",
            "const", "final", "unsigned", "signed", "static", "struct", "enum", "union", "register", "volatile",
            "extern", "typedef", "export", "void");
    private static final Set<String> ASSIGNMENT_OPERATORS = Set.of(
            "=", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "<<=", ">>=", ">>>=", "**=", "//=", ":=", "??=",
            "||=", "&&=");
    private static final List<MutationKind> KINDS = List.of(MutationKind.values());

    private final Tokenizer tokenizer;
    private final LineGuard lineGuard;
    private final IdentifierAnalyzer identifierAnalyzer;

    public StructuralMutationEngine() {
        this(new Tokenizer());
    }

    public StructuralMutationEngine(Tokenizer tokenizer) {
        this.tokenizer = tokenizer;
        this.lineGuard = new LineGuard(tokenizer);
        this.identifierAnalyzer = new IdentifierAnalyzer();
    }

    public TransformationResult mutate(String source, Language language, long seed, MutationOptions options,
            ValidationThresholds thresholds) {
        TokenStream originalStream = tokenizer.tokenize(source, language);
        List<MutationGuard> guards = lineGuard.tag(originalStream);
        LineIndex index = new LineIndex(originalStream);
        List<Integer> targets = mutableLines(guards, index, language);
        if (targets.isEmpty()) {
            logger.debug("No mutable lines in {} snippet", language.tag());
            return TransformationResult.unchanged(source, List.of(NO_MUTABLE_LINES));
        }

        Random random = SeedSupport.random(seed, "type3:mutate");
        Document document = new Document(source, language, index, targets,
                identifierAnalyzer.allNames(originalStream));
        OutputValidator validator = new OutputValidator(tokenizer, originalStream, guards,
                options.minLengthRatio(), thresholds);

        int goal = 1 + random.nextInt(Math.min(options.maxTransformations(), targets.size()));
        int applied = 0;
        int attempts = 0;
        boolean codeChanged = false;
        List<String> provenance = new ArrayList<>();

        while (applied < options.maxTransformations() && (applied < goal || !codeChanged)
                && attempts < options.maxRetries()) {
            attempts++;
            Edit edit = document.propose(random, applied >= goal);
            if (edit == null) {
                continue;
            }
            List<Violation> violations = validator.check(join(edit.lines()));
            if (!violations.isEmpty()) {
                logger.debug("Rolled back {} on line {}: {}", edit.kind().label(), edit.target(), violations.get(0));
                continue;
            }
            document.commit(edit);
            applied++;
            codeChanged |= edit.changesCode();
            provenance.add(edit.kind().label());
        }

        if (applied == 0) {
            provenance.add(RETRIES_EXHAUSTED);
        }
        logger.debug("Applied {} of {} structural edit(s) in {} attempt(s)", applied, goal, attempts);
        return new TransformationResult(join(document.lines), provenance);
    }

    private List<Integer> mutableLines(List<MutationGuard> guards, LineIndex index, Language language) {
        List<Integer> lines = new ArrayList<>();
        for (MutationGuard guard : guards) {
            if (!guard.isMutable()) {
                continue;
            }
            List<Token> code = index.codeTokensOn(guard.lineNumber());
            boolean constructorCall = language == Language.JAVA && code.size() > 1
                    && (code.get(0).is("this") || code.get(0).is("super")) && code.get(1).is("(");
            if (!constructorCall) {
                lines.add(guard.lineNumber());
            }
        }
        return lines;
    }

    private static String join(List<Line> lines) {
        return lines.stream().map(Line::text).collect(Collectors.joining("\n"));
    }

    /**
     * A line of the working copy. {@code origin} is the 1-based line number
     * in the original, or 0 for inserted lines.
     */
    private record Line(String text, int origin) {
    }

    private record Edit(MutationKind kind, int target, List<Line> lines, boolean changesCode, String newName) {
    }

    /**
     * Working copy of the snippet plus the bookkeeping needed to pick the
     * next edit.
     */
    private final class Document {
        private final Language language;
        private final LineIndex originalIndex;
        private final List<Integer> targets;
        private final Set<String> names;
        private final Set<Integer> retired = new HashSet<>();
        private final String indentUnit;
        private final boolean hasSwitch;
        private List<Line> lines = new ArrayList<>();
        private int tempCounter;

        Document(String source, Language language, LineIndex originalIndex, List<Integer> targets,
                Set<String> names) {
            this.language = language;
            this.originalIndex = originalIndex;
            this.targets = targets;
            this.names = new HashSet<>(names);
            String[] split = source.split("\n", -1);
            for (int i = 0; i < split.length; i++) {
                lines.add(new Line(split[i], i + 1));
            }
            this.indentUnit = StatementTemplates.indentUnit(List.of(split));
            this.hasSwitch = originalIndex.stream().codeTokens().stream()
                    .anyMatch(t -> t.kind() == TokenKind.KEYWORD && t.is("switch"));
        }

        Edit propose(Random random, boolean forceCode) {
            List<Integer> available = new ArrayList<>();
            for (Integer target : targets) {
                if (!retired.contains(target)) {
                    available.add(target);
                }
            }
            if (available.isEmpty()) {
                return null;
            }
            int target = available.get(random.nextInt(available.size()));
            MutationKind kind = KINDS.get(random.nextInt(KINDS.size()));
            int position = positionOf(target);
            String indent = StatementTemplates.leadingWhitespace(lines.get(position).text());

            return switch (kind) {
                case STATEMENT_INSERT -> {
                    if (forceCode || random.nextBoolean()) {
                        String name = nextTempName();
                        String text = StatementTemplates.declaration(language, name, declarationUnsafe(position));
                        yield insert(kind, target, position, indent + text, true, name);
                    }
                    String comment = StatementTemplates.INSERT_COMMENTS.get(
                            random.nextInt(StatementTemplates.INSERT_COMMENTS.size()));
                    yield insert(kind, target, position, indent + StatementTemplates.comment(language, comment),
                            false, null);
                }
                case VALIDATION_INSERT -> {
                    boolean code = forceCode || random.nextBoolean();
                    String text = code
                            ? StatementTemplates.check(language)
                            : StatementTemplates.comment(language, StatementTemplates.VALIDATION_COMMENT);
                    yield insert(kind, target, position, indent + text, code, null);
                }
                case STATEMENT_DELETE -> available.size() < 2 || !isNonEssential(target, position)
                        ? null
                        : delete(target, position);
                case CONDITIONAL_PADDING -> language.isCFamily() && isLocalDeclaration(target)
                        ? null
                        : wrap(target, position, indent);
            };
        }

        void commit(Edit edit) {
            lines = edit.lines();
            if (edit.kind() == MutationKind.STATEMENT_DELETE || edit.kind() == MutationKind.CONDITIONAL_PADDING) {
                retired.add(edit.target());
            }
            if (edit.newName() != null) {
                names.add(edit.newName());
            }
        }

        private Edit insert(MutationKind kind, int target, int position, String text, boolean code,
                String newName) {
            List<Line> copy = new ArrayList<>(lines);
            copy.add(position, new Line(text, 0));
            return new Edit(kind, target, copy, code, newName);
        }

        private Edit delete(int target, int position) {
            List<Line> copy = new ArrayList<>(lines);
            copy.remove(position);
            return new Edit(MutationKind.STATEMENT_DELETE, target, copy, true, null);
        }

        private Edit wrap(int target, int position, String indent) {
            List<Line> copy = new ArrayList<>(lines);
            Line line = copy.get(position);
            String body = line.text().substring(indent.length());
            copy.set(position, new Line(indent + indentUnit + body, target));
            copy.add(position, new Line(indent + StatementTemplates.guardOpen(language), 0));
            String close = StatementTemplates.guardClose(language);
            if (close != null) {
                copy.add(position + 2, new Line(indent + close, 0));
            }
            return new Edit(MutationKind.CONDITIONAL_PADDING, target, copy, true, null);
        }

        private int positionOf(int origin) {
            for (int i = 0; i < lines.size(); i++) {
                if (lines.get(i).origin() == origin) {
                    return i;
                }
            }
            throw new IllegalStateException("Line " + origin + " is no longer in the working copy");
        }

        private String nextTempName() {
            String name = StatementTemplates.tempName(language, tempCounter++);
            while (names.contains(name)) {
                name = StatementTemplates.tempName(language, tempCounter++);
            }
            return name;
        }

        private boolean declarationUnsafe(int position) {
            if (language != Language.C && language != Language.CPP) {
                return false;
            }
            return hasSwitch || (position > 0 && lines.get(position - 1).text().stripTrailing().endsWith(":"));
        }

        /**
         * A line may be deleted when it is a bare call, or when every name it
         * assigns is not referenced anywhere else in the working copy.
         */
        private boolean isNonEssential(int target, int position) {
            List<Token> code = originalIndex.codeTokensOn(target);
            Set<String> assigned = assignedNames(code);
            if (assigned.isEmpty()) {
                return isBareCall(code);
            }
            List<Line> others = new ArrayList<>(lines);
            others.remove(position);
            for (Token token : tokenizer.tokenize(join(others), language).codeTokens()) {
                if (token.kind() == TokenKind.IDENTIFIER && assigned.contains(token.text())) {
                    return false;
                }
            }
            return true;
        }

        private Set<String> assignedNames(List<Token> code) {
            Set<String> assigned = new HashSet<>();
            int depth = 0;
            for (int i = 0; i < code.size(); i++) {
                Token token = code.get(i);
                if (token.kind() == TokenKind.PUNCTUATION) {
                    depth += LineIndex.bracketDelta(token.text());
                }
                if (token.kind() != TokenKind.OPERATOR) {
                    continue;
                }
                boolean assignment = depth == 0 && ASSIGNMENT_OPERATORS.contains(token.text());
                boolean step = token.is("++") || token.is("--");
                if (assignment || step) {
                    addIfIdentifier(code, i - 1, assigned);
                }
                if (step) {
                    addIfIdentifier(code, i + 1, assigned);
                }
            }
            return assigned;
        }

        private void addIfIdentifier(List<Token> code, int i, Set<String> names) {
            if (i >= 0 && i < code.size() && code.get(i).kind() == TokenKind.IDENTIFIER) {
                names.add(code.get(i).text());
            }
        }

        private boolean isBareCall(List<Token> code) {
            if (code.isEmpty() || code.get(0).kind() != TokenKind.IDENTIFIER) {
                return false;
            }
            int last = code.size() - 1;
            if (code.get(last).is(";")) {
                last--;
            }
            return last > 0 && code.get(last).is(")") && code.stream().anyMatch(t -> t.is("("));
        }

        /**
         * C-family local declarations: wrapping them in a block would hide
         * the name from the lines that follow.
         */
        private boolean isLocalDeclaration(int target) {
            List<Token> code = originalIndex.codeTokensOn(target);
            if (code.isEmpty()) {
                return false;
            }
            if (DECLARATION_STARTERS.contains(code.get(0).text())) {
                return true;
            }
            if (code.get(0).kind() != TokenKind.IDENTIFIER) {
                return false;
            }
            int j = 1;
            while (j + 1 < code.size() && (code.get(j).is("::") || code.get(j).is("."))
                    && code.get(j + 1).kind() == TokenKind.IDENTIFIER) {
                j += 2;
            }
            if (j >= code.size()) {
                return false;
            }
            Token next = code.get(j);
            if (next.kind() == TokenKind.IDENTIFIER || next.is("<")) {
                return true;
            }
            if (next.is("[") && j + 1 < code.size() && code.get(j + 1).is("]")) {
                return true;
            }
            return (next.is("*") || next.is("&")) && j + 2 < code.size()
                    && code.get(j + 1).kind() == TokenKind.IDENTIFIER
                    && Set.of("=", ";", ",", "[").contains(code.get(j + 2).text());
        }
    }
}
