package com.raditha.clonegen.workflow;

import com.raditha.clonegen.ai.CandidateGenerator;
import com.raditha.clonegen.ai.CandidateSource;
import com.raditha.clonegen.config.GenerationOptions;
import com.raditha.clonegen.config.RenamingOptions;
import com.raditha.clonegen.formatting.FormattingEngine;
import com.raditha.clonegen.lexer.Tokenizer;
import com.raditha.clonegen.model.CloneType;
import com.raditha.clonegen.model.GenerationResult;
import com.raditha.clonegen.model.InputException;
import com.raditha.clonegen.model.Language;
import com.raditha.clonegen.model.TransformationResult;
import com.raditha.clonegen.model.ValidationReport;
import com.raditha.clonegen.mutation.StructuralMutationEngine;
import com.raditha.clonegen.renaming.RenameEngine;
import com.raditha.clonegen.util.SeedSupport;
import com.raditha.clonegen.validation.CloneValidator;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Entry point for clone generation and validation.
 * <p>
 * {@link #generate} runs the engine for the requested clone type, certifies
 * the variant with {@link CloneValidator} and retries with derived seeds.
 * When every attempt fails it degrades to a Type-1 variant, and as a last
 * resort to the unchanged source certified as Type-1.
 */
public class CloneGenerator implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(CloneGenerator.class);

    static final String CANDIDATE_ACCEPTED = "external_candidate:accepted";
    static final String CANDIDATE_REJECTED = "external_candidate:rejected";
    static final String CANDIDATE_FAILED = "external_candidate:failed";
    static final String CANDIDATE_UNAVAILABLE = "skipped:external_candidate";

    private final FormattingEngine formattingEngine;
    private final RenameEngine renameEngine;
    private final StructuralMutationEngine mutationEngine;
    private final CloneValidator validator;
    private final @Nullable CandidateSource candidateSource;

    public CloneGenerator() {
        this(null, null);
    }

    /**
     * @param candidateGenerator optional Type-3 candidate source, may be null
     * @param timeout            how long to wait for a candidate
     */
    public CloneGenerator(@Nullable CandidateGenerator candidateGenerator, @Nullable Duration timeout) {
        Tokenizer tokenizer = new Tokenizer();
        this.formattingEngine = new FormattingEngine(tokenizer);
        this.renameEngine = new RenameEngine(tokenizer, formattingEngine);
        this.mutationEngine = new StructuralMutationEngine(tokenizer);
        this.validator = new CloneValidator(tokenizer);
        this.candidateSource = candidateGenerator == null ? null
                : new CandidateSource(candidateGenerator, timeout != null ? timeout : Duration.ofSeconds(60));
    }

    public GenerationResult generate(String source, Language language, CloneType cloneType) {
        return generate(source, language, cloneType, null, GenerationOptions.defaults());
    }

    /**
     * Generate a certified variant of {@code source}.
     *
     * @param seed    explicit seed, or null to derive one from the source alone
     * @param options generation options, or null for defaults
     * @throws InputException for a missing language or clone type, a blank
     *                        source, or fewer non-blank lines than
     *                        {@code minSourceLines}
     */
    public GenerationResult generate(String source, Language language, CloneType cloneType, @Nullable Long seed,
            @Nullable GenerationOptions options) {
        GenerationOptions opts = options != null ? options : GenerationOptions.defaults();
        checkInput(source, language, cloneType, opts);

        long baseSeed = SeedSupport.baseSeed(source, seed);
        List<String> provenance = new ArrayList<>();

        if (cloneType == CloneType.TYPE_3 && opts.mutation().useCandidateGenerator()) {
            Optional<GenerationResult> external = tryCandidate(source, language, baseSeed, opts, provenance);
            if (external.isPresent()) {
                return external.get();
            }
        }

        for (int attempt = 0; attempt < opts.maxAttempts(); attempt++) {
            long attemptSeed = SeedSupport.forAttempt(baseSeed, attempt);
            if (attempt > 0) {
                provenance.add("retry:" + attempt);
            }
            boolean dropLiterals = attempt > 0 && attempt == opts.maxAttempts() - 1;
            TransformationResult result = run(source, language, cloneType, attemptSeed, opts, dropLiterals);
            ValidationReport report = validator.validate(source, result.variant(), language, cloneType,
                    opts.thresholds());
            if (report.valid()) {
                provenance.addAll(result.provenance());
                logger.info("Generated {} {} clone (seed {}, attempt {}, similarity {})", language.tag(),
                        cloneType.label(), attemptSeed, attempt + 1, String.format("%.3f", report.similarity()));
                return new GenerationResult(result.variant(), provenance, cloneType, cloneType, attemptSeed, report,
                        result.renameStats());
            }
            logger.debug("Attempt {} rejected: {}", attempt + 1, report.summary());
            if (result.provenance().contains(StructuralMutationEngine.NO_MUTABLE_LINES)) {
                break;
            }
        }
        return degrade(source, language, cloneType, baseSeed, opts, provenance);
    }

    /**
     * Generate up to {@code count} certified variants that differ from each
     * other and from the source. Each draw uses its own seed derived from
     * {@code seed}; drawing stops after {@code count * maxAttempts} tries, so
     * a snippet with few possible variants yields a shorter list.
     *
     * @throws InputException if {@code count} is not positive, or for the
     *                        inputs {@link #generate} rejects
     */
    public List<GenerationResult> generateVariants(String source, Language language, CloneType cloneType,
            int count, @Nullable Long seed, @Nullable GenerationOptions options) {
        if (count < 1) {
            throw new InputException("Variant count must be positive, got: " + count);
        }
        GenerationOptions opts = options != null ? options : GenerationOptions.defaults();
        checkInput(source, language, cloneType, opts);

        List<GenerationResult> variants = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        seen.add(source);
        int draws = count * opts.maxAttempts();
        for (int i = 0; i < draws && variants.size() < count; i++) {
            GenerationResult result = generate(source, language, cloneType, SeedSupport.forVariant(seed, i), opts);
            if (seen.add(result.variant())) {
                variants.add(result);
            }
        }
        if (variants.size() < count) {
            logger.warn("Found {} distinct {} variant(s) of {} requested after {} draws", variants.size(),
                    cloneType.label(), count, draws);
        }
        return variants;
    }

    /**
     * Check a variant against a claimed clone type with default thresholds.
     */
    public ValidationReport validate(String original, String variant, Language language, CloneType claimedType) {
        return validator.validate(original, variant, language, claimedType);
    }

    private TransformationResult run(String source, Language language, CloneType cloneType, long seed,
            GenerationOptions options, boolean withoutLiterals) {
        return switch (cloneType) {
            case TYPE_1 -> formattingEngine.format(source, language, seed, options.formatting());
            case TYPE_2 -> {
                RenamingOptions renaming = withoutLiterals ? options.renaming().withoutLiterals() : options.renaming();
                yield renameEngine.transform(source, language, seed, renaming, options.formatting());
            }
            case TYPE_3 -> mutationEngine.mutate(source, language, seed, options.mutation(), options.thresholds());
        };
    }

    private Optional<GenerationResult> tryCandidate(String source, Language language, long seed,
            GenerationOptions options, List<String> provenance) {
        if (candidateSource == null) {
            logger.debug("Candidate generation requested but no generator is configured");
            provenance.add(CANDIDATE_UNAVAILABLE);
            return Optional.empty();
        }
        Optional<String> candidate = candidateSource.fetch(source, language);
        if (candidate.isEmpty()) {
            provenance.add(CANDIDATE_FAILED);
            return Optional.empty();
        }
        ValidationReport report = validator.validate(source, candidate.get(), language, CloneType.TYPE_3,
                options.thresholds());
        if (!report.valid()) {
            logger.warn("External candidate rejected: {}", report.summary());
            provenance.add(CANDIDATE_REJECTED);
            return Optional.empty();
        }
        provenance.add(CANDIDATE_ACCEPTED);
        logger.info("Accepted external {} type3 candidate (similarity {})", language.tag(),
                String.format("%.3f", report.similarity()));
        return Optional.of(new GenerationResult(candidate.get(), provenance, CloneType.TYPE_3, CloneType.TYPE_3,
                seed, report));
    }

    private GenerationResult degrade(String source, Language language, CloneType requested, long seed,
            GenerationOptions options, List<String> provenance) {
        if (requested != CloneType.TYPE_1) {
            TransformationResult fallback = formattingEngine.format(source, language, seed, options.formatting());
            ValidationReport report = validator.validate(source, fallback.variant(), language, CloneType.TYPE_1);
            if (report.valid()) {
                provenance.add("degraded:" + requested.label() + "->type1");
                provenance.addAll(fallback.provenance());
                logger.warn("Could not certify a {} clone after {} attempt(s), returning a type1 variant",
                        requested.label(), options.maxAttempts());
                return new GenerationResult(fallback.variant(), provenance, requested, CloneType.TYPE_1, seed, report);
            }
        }
        provenance.add("degraded:" + requested.label() + "->identity");
        logger.warn("Could not certify a {} clone, returning the source unchanged", requested.label());
        ValidationReport report = validator.validate(source, source, language, CloneType.TYPE_1);
        return new GenerationResult(source, provenance, requested, CloneType.TYPE_1, seed, report);
    }

    private static void checkInput(String source, Language language, CloneType cloneType, GenerationOptions options) {
        if (language == null) {
            throw new InputException("Language is required");
        }
        if (cloneType == null) {
            throw new InputException("Clone type is required");
        }
        if (source == null || source.isBlank()) {
            throw new InputException("Source code is required");
        }
        long lines = source.lines().filter(line -> !line.isBlank()).count();
        if (lines < options.minSourceLines()) {
            throw new InputException("Source has " + lines + " non-blank line(s), at least "
                    + options.minSourceLines() + " required");
        }
    }

    @Override
    public void close() {
        if (candidateSource != null) {
            candidateSource.close();
        }
    }
}
