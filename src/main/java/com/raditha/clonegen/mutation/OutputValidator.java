package com.raditha.clonegen.mutation;

import com.raditha.clonegen.config.ValidationThresholds;
import com.raditha.clonegen.lexer.Tokenizer;
import com.raditha.clonegen.model.Language;
import com.raditha.clonegen.model.MutationGuard;
import com.raditha.clonegen.model.TokenStream;
import com.raditha.clonegen.model.Violation;
import com.raditha.clonegen.model.ViolationKind;
import com.raditha.clonegen.similarity.LCSSimilarity;
import com.raditha.clonegen.validation.StructureChecker;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks a partially mutated snippet after every edit. An edit whose output
 * produces any violation is rolled back by the engine.
 */
class OutputValidator {

    private final Tokenizer tokenizer;
    private final StructureChecker structureChecker = new StructureChecker();
    private final LCSSimilarity similarity = new LCSSimilarity();
    private final String original;
    private final TokenStream originalStream;
    private final List<MutationGuard> guards;
    private final double minLengthRatio;
    private final double minSimilarity;
    private final boolean checkIndentation;

    OutputValidator(Tokenizer tokenizer, TokenStream originalStream, List<MutationGuard> guards,
            double minLengthRatio, ValidationThresholds thresholds) {
        this.tokenizer = tokenizer;
        this.originalStream = originalStream;
        this.original = originalStream.text();
        this.guards = guards;
        this.minLengthRatio = minLengthRatio;
        this.minSimilarity = thresholds.minSimilarity();
        this.checkIndentation = originalStream.language() == Language.PYTHON
                && structureChecker.checkPythonIndentation(originalStream).isEmpty();
    }

    List<Violation> check(String candidate) {
        TokenStream stream = tokenizer.tokenize(candidate, originalStream.language());
        List<Violation> violations = new ArrayList<>(structureChecker.checkBrackets(originalStream, stream));
        if (checkIndentation) {
            violations.addAll(structureChecker.checkPythonIndentation(stream));
        }
        if (!original.isEmpty() && (double) candidate.length() / original.length() < minLengthRatio) {
            violations.add(new Violation(ViolationKind.LENGTH_BELOW_MINIMUM,
                    String.format("length %d is below %.0f%% of %d", candidate.length(), minLengthRatio * 100,
                            original.length())));
        }
        violations.addAll(structureChecker.checkCriticalLines(original, candidate, guards));
        double score = similarity.calculate(originalStream.codeTokens(), stream.codeTokens());
        if (score < minSimilarity) {
            violations.add(new Violation(ViolationKind.SIMILARITY_OUT_OF_WINDOW,
                    String.format("similarity %.3f below %.2f", score, minSimilarity)));
        }
        return violations;
    }
}
