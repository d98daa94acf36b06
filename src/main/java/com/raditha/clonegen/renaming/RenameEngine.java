package com.raditha.clonegen.renaming;

import com.raditha.clonegen.analysis.IdentifierAnalyzer;
import com.raditha.clonegen.analysis.LiteralAnalyzer;
import com.raditha.clonegen.analysis.NamingConventionHeuristic;
import com.raditha.clonegen.config.FormattingOptions;
import com.raditha.clonegen.config.RenamingOptions;
import com.raditha.clonegen.formatting.FormattingEngine;
import com.raditha.clonegen.lexer.Tokenizer;
import com.raditha.clonegen.model.IdentifierCategory;
import com.raditha.clonegen.model.IdentifierOccurrence;
import com.raditha.clonegen.model.Language;
import com.raditha.clonegen.model.LiteralKind;
import com.raditha.clonegen.model.LiteralOccurrence;
import com.raditha.clonegen.model.RenameMap;
import com.raditha.clonegen.model.RenameStats;
import com.raditha.clonegen.model.TokenStream;
import com.raditha.clonegen.model.TransformationResult;
import com.raditha.clonegen.util.SeedSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Type-2 engine: consistent identifier renaming and literal substitution.
 * <p>
 * All edits are token replacements, so keywords, operators, punctuation and
 * the text of strings and comments outside the replaced tokens are never
 * touched, and the code-token count and kind sequence stay the same.
 * Literals that name an external resource (import and include lines,
 * annotation arguments, {@code require("fs")}) keep their value.
 */
public class RenameEngine {
    private static final Logger logger = LoggerFactory.getLogger(RenameEngine.class);

    public static final String RENAME_IDENTIFIERS = "rename_identifiers";
    public static final String MUTATE_LITERALS = "mutate_literals";

    private final Tokenizer tokenizer;
    private final FormattingEngine formattingEngine;
    private final LiteralAnalyzer literalAnalyzer;
    private final IdentifierRenamer renamer;

    public RenameEngine() {
        this(new Tokenizer());
    }

    public RenameEngine(Tokenizer tokenizer) {
        this(tokenizer, new FormattingEngine(tokenizer));
    }

    public RenameEngine(Tokenizer tokenizer, FormattingEngine formattingEngine) {
        this.tokenizer = tokenizer;
        this.formattingEngine = formattingEngine;
        this.literalAnalyzer = new LiteralAnalyzer();
        this.renamer = new IdentifierRenamer();
    }

    public TransformationResult transform(String source, Language language, long seed, RenamingOptions options,
            FormattingOptions formatting) {
        if (!options.renameIdentifiers() && !options.mutateLiterals()) {
            logger.debug("Renaming and literal mutation disabled, running the formatting pipeline");
            return formattingEngine.format(source, language, seed, formatting);
        }

        TokenStream stream = tokenizer.tokenize(source, language);
        Map<Integer, String> replacements = new HashMap<>();
        List<String> provenance = new ArrayList<>();
        RenameMap renameMap = RenameMap.empty();
        Map<IdentifierCategory, Integer> categoryCounts = new EnumMap<>(IdentifierCategory.class);
        int literalsChanged = 0;

        if (options.renameIdentifiers()) {
            IdentifierAnalyzer analyzer = new IdentifierAnalyzer(
                    new NamingConventionHeuristic(options.functionPrefixes()));
            List<IdentifierOccurrence> occurrences = analyzer.extractIdentifiers(stream);
            renameMap = renamer.buildRenameMap(occurrences, analyzer.allNames(stream),
                    SeedSupport.random(seed, "type2:rename"));
            logger.debug("Rename map: {}", renameMap);
            replacements.putAll(renamer.replacements(occurrences, renameMap));
            categoryCounts.putAll(renamer.countByCategory(occurrences, renameMap));
            provenance.add(renameMap.isEmpty() ? "skipped:" + RENAME_IDENTIFIERS : RENAME_IDENTIFIERS);
        }

        if (options.mutateLiterals()) {
            literalsChanged = mutateLiterals(stream, options, SeedSupport.random(seed, "type2:literals"),
                    replacements);
            provenance.add(literalsChanged == 0 ? "skipped:" + MUTATE_LITERALS : MUTATE_LITERALS);
        }
        RenameStats stats = new RenameStats(renameMap.asMap(), categoryCounts, literalsChanged);

        String variant = rebuild(stream, replacements);
        if (options.applyFormatting()) {
            TransformationResult formatted = formattingEngine.format(variant, language, seed, formatting);
            variant = formatted.variant();
            provenance.addAll(formatted.provenance());
        }
        return new TransformationResult(variant, provenance, stats);
    }

    private int mutateLiterals(TokenStream stream, RenamingOptions options, Random random,
            Map<Integer, String> replacements) {
        LiteralMutator mutator = new LiteralMutator(options.mutateBooleans());
        Set<Integer> fixed = literalAnalyzer.fixedLiterals(stream);
        int changed = 0;
        for (LiteralOccurrence literal : literalAnalyzer.extractLiterals(stream)) {
            if (random.nextDouble() >= options.literalProbability() || literal.valueKind() == LiteralKind.NULL
                    || fixed.contains(literal.tokenIndex())) {
                continue;
            }
            String mutated = mutator.mutate(literal.rawText(), literal.valueKind(), stream.language(), random);
            if (!mutated.equals(literal.rawText())) {
                replacements.put(literal.tokenIndex(), mutated);
                changed++;
            }
        }
        logger.debug("Mutated {} literal(s)", changed);
        return changed;
    }

    private static String rebuild(TokenStream stream, Map<Integer, String> replacements) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < stream.size(); i++) {
            out.append(replacements.getOrDefault(i, stream.get(i).text()));
        }
        return out.toString();
    }
}
