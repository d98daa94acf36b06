package com.raditha.clonegen.validation;

import com.raditha.clonegen.analysis.LineGuard;
import com.raditha.clonegen.analysis.LiteralAnalyzer;
import com.raditha.clonegen.config.ValidationThresholds;
import com.raditha.clonegen.lexer.LanguageProfile;
import com.raditha.clonegen.lexer.Tokenizer;
import com.raditha.clonegen.model.CloneType;
import com.raditha.clonegen.model.InputException;
import com.raditha.clonegen.model.Language;
import com.raditha.clonegen.model.LiteralKind;
import com.raditha.clonegen.model.Token;
import com.raditha.clonegen.model.TokenKind;
import com.raditha.clonegen.model.TokenStream;
import com.raditha.clonegen.model.ValidationReport;
import com.raditha.clonegen.model.Violation;
import com.raditha.clonegen.model.ViolationKind;
import com.raditha.clonegen.similarity.LCSSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Certifies that a variant satisfies the contract of a clone type.
 * <p>
 * Validation is a pure function of its arguments. The token similarity and
 * the Type-1 token match are reported for every claimed type, so a single
 * report is enough to see how far a variant is from its original.
 */
public class CloneValidator {
    private static final Logger logger = LoggerFactory.getLogger(CloneValidator.class);

    private final Tokenizer tokenizer;
    private final LineGuard lineGuard;
    private final LiteralAnalyzer literalAnalyzer;
    private final StructureChecker structureChecker;
    private final LCSSimilarity similarity;

    public CloneValidator() {
        this(new Tokenizer());
    }

    public CloneValidator(Tokenizer tokenizer) {
        this.tokenizer = tokenizer;
        this.lineGuard = new LineGuard(tokenizer);
        this.literalAnalyzer = new LiteralAnalyzer();
        this.structureChecker = new StructureChecker();
        this.similarity = new LCSSimilarity();
    }

    public ValidationReport validate(String original, String variant, Language language, CloneType claimedType) {
        return validate(original, variant, language, claimedType, ValidationThresholds.defaults());
    }

    /**
     * Validate {@code variant} against {@code original} for {@code claimedType}.
     *
     * @throws InputException if any argument is null
     */
    public ValidationReport validate(String original, String variant, Language language, CloneType claimedType,
            ValidationThresholds thresholds) {
        if (original == null || variant == null) {
            throw new InputException("Original and variant sources are required");
        }
        if (language == null || claimedType == null) {
            throw new InputException("Language and clone type are required");
        }
        ValidationThresholds window = thresholds == null ? ValidationThresholds.defaults() : thresholds;

        TokenStream originalStream = tokenizer.tokenize(original, language);
        TokenStream variantStream = tokenizer.tokenize(variant, language);
        List<Token> originalCode = originalStream.codeTokens();
        List<Token> variantCode = variantStream.codeTokens();

        List<Violation> violations = switch (claimedType) {
            case TYPE_1 -> checkType1(originalCode, variantCode);
            case TYPE_2 -> checkType2(originalCode, variantCode, language);
            case TYPE_3 -> checkType3(original, variant, originalStream, variantStream, window);
        };

        double score = similarity.calculate(originalCode, variantCode);
        ValidationReport report = new ValidationReport(claimedType, violations.isEmpty(),
                originalStream.codeEquals(variantStream), violations, originalCode.size(), variantCode.size(),
                score);
        logger.debug("{}", report.summary());
        return report;
    }

    private List<Violation> checkType1(List<Token> original, List<Token> variant) {
        List<Violation> violations = new ArrayList<>();
        int common = Math.min(original.size(), variant.size());
        for (int i = 0; i < common; i++) {
            Token expected = original.get(i);
            Token actual = variant.get(i);
            if (!expected.sameAs(actual)) {
                violations.add(new Violation(ViolationKind.TOKEN_MISMATCH,
                        String.format("token %d: expected %s '%s', found %s '%s'", i, expected.kind(),
                                expected.text(), actual.kind(), actual.text())));
            }
        }
        if (original.size() != variant.size()) {
            violations.add(countMismatch(original, variant));
        }
        return violations;
    }

    private List<Violation> checkType2(List<Token> original, List<Token> variant, Language language) {
        List<Violation> violations = new ArrayList<>();
        if (original.size() != variant.size()) {
            violations.add(countMismatch(original, variant));
            return violations;
        }
        LanguageProfile profile = LanguageProfile.of(language);
        for (int i = 0; i < original.size(); i++) {
            Token expected = original.get(i);
            Token actual = variant.get(i);
            if (expected.kind() != actual.kind()) {
                violations.add(new Violation(ViolationKind.KIND_MISMATCH,
                        String.format("token %d: expected %s, found %s '%s'", i, expected.kind(), actual.kind(),
                                actual.text())));
            } else if (expected.kind().isLiteral()) {
                LiteralKind expectedKind = literalAnalyzer.classify(expected, language);
                LiteralKind actualKind = literalAnalyzer.classify(actual, language);
                if (expectedKind != actualKind) {
                    violations.add(new Violation(ViolationKind.KIND_MISMATCH,
                            String.format("token %d: literal '%s' (%s) became '%s' (%s)", i, expected.text(),
                                    expectedKind, actual.text(), actualKind)));
                }
            } else if (expected.kind() != TokenKind.IDENTIFIER && !expected.sameAs(actual)) {
                ViolationKind kind = expected.kind() == TokenKind.KEYWORD
                        && profile.isControlFlowKeyword(expected.text())
                                ? ViolationKind.CONTROL_FLOW_MISMATCH
                                : ViolationKind.STRUCTURE_MISMATCH;
                violations.add(new Violation(kind,
                        String.format("token %d: expected '%s', found '%s'", i, expected.text(), actual.text())));
            }
        }
        return violations;
    }

    private List<Violation> checkType3(String original, String variant, TokenStream originalStream,
            TokenStream variantStream, ValidationThresholds thresholds) {
        List<Violation> violations = new ArrayList<>(structureChecker.checkBrackets(originalStream, variantStream));
        violations.addAll(structureChecker.checkCriticalLines(original, variant, lineGuard.tag(originalStream)));
        if (originalStream.language() == Language.PYTHON
                && structureChecker.checkPythonIndentation(originalStream).isEmpty()) {
            violations.addAll(structureChecker.checkPythonIndentation(variantStream));
        }
        double score = similarity.calculate(originalStream.codeTokens(), variantStream.codeTokens());
        if (!thresholds.accepts(score)) {
            violations.add(new Violation(ViolationKind.SIMILARITY_OUT_OF_WINDOW,
                    String.format("similarity %.3f outside [%.2f, %.2f)", score, thresholds.minSimilarity(),
                            thresholds.maxSimilarity())));
        }
        return violations;
    }

    private static Violation countMismatch(List<Token> original, List<Token> variant) {
        return new Violation(ViolationKind.TOKEN_COUNT_MISMATCH,
                String.format("expected %d code tokens, found %d", original.size(), variant.size()));
    }
}
