package com.raditha.clonegen.formatting;

import com.raditha.clonegen.config.FormattingOptions;
import com.raditha.clonegen.lexer.Tokenizer;
import com.raditha.clonegen.model.Language;
import com.raditha.clonegen.model.TokenStream;
import com.raditha.clonegen.model.TransformationResult;
import com.raditha.clonegen.util.SeedSupport;
import com.raditha.clonegen.validation.StructureChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Type-1 engine: a fixed pipeline of formatting steps.
 * <p>
 * Steps run in the order indentation, blank lines, comments, operator
 * spacing, brace position. After each step the output is re-tokenized and
 * compared with the original's code tokens (and, for Python, checked for
 * consistent block indentation). A step that fails the check is dropped and
 * recorded as {@code skipped:<step>}; the pipeline carries on with the
 * previous text.
 */
public class FormattingEngine {
    private static final Logger logger = LoggerFactory.getLogger(FormattingEngine.class);

    private final Tokenizer tokenizer;
    private final StructureChecker structureChecker;

    public FormattingEngine() {
        this(new Tokenizer());
    }

    public FormattingEngine(Tokenizer tokenizer) {
        this.tokenizer = tokenizer;
        this.structureChecker = new StructureChecker();
    }

    public TransformationResult format(String source, Language language, long seed, FormattingOptions options) {
        TokenStream original = tokenizer.tokenize(source, language);
        boolean checkIndentation = language == Language.PYTHON
                && structureChecker.checkPythonIndentation(original).isEmpty();

        List<String> provenance = new ArrayList<>();
        String current = source;
        for (FormattingStep step : pipeline(options)) {
            if (!step.appliesTo(language)) {
                continue;
            }
            String label = step.operation().label();
            String candidate;
            try {
                candidate = step.apply(current, language, SeedSupport.random(seed, "type1:" + label));
            } catch (RuntimeException e) {
                logger.warn("Formatting step {} failed, skipping: {}", label, e.getMessage());
                provenance.add("skipped:" + label);
                continue;
            }
            if (candidate.equals(current)) {
                continue;
            }
            if (!preservesCode(original, candidate, language, checkIndentation)) {
                logger.debug("Formatting step {} changed code tokens, skipping", label);
                provenance.add("skipped:" + label);
                continue;
            }
            current = candidate;
            provenance.add(label);
        }
        return new TransformationResult(current, provenance);
    }

    /**
     * Steps enabled by {@code options}, in pipeline order.
     */
    List<FormattingStep> pipeline(FormattingOptions options) {
        List<FormattingStep> steps = new ArrayList<>();
        if (options.indentation()) {
            steps.add(new IndentationStep(tokenizer));
        }
        if (options.blankLines()) {
            steps.add(new BlankLineStep(tokenizer));
        }
        if (options.comments()) {
            steps.add(new CommentStep(tokenizer));
        }
        if (options.operatorSpacing()) {
            steps.add(new OperatorSpacingStep(tokenizer, options.spacingStyle()));
        }
        if (options.bracePosition()) {
            steps.add(new BracePositionStep(tokenizer));
        }
        return steps;
    }

    private boolean preservesCode(TokenStream original, String candidate, Language language,
            boolean checkIndentation) {
        TokenStream rewritten = tokenizer.tokenize(candidate, language);
        if (!original.codeEquals(rewritten)) {
            return false;
        }
        return !checkIndentation || structureChecker.checkPythonIndentation(rewritten).isEmpty();
    }
}
