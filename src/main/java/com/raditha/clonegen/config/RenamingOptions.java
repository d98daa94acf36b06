package com.raditha.clonegen.config;

import com.raditha.clonegen.analysis.NamingConventionHeuristic;

import java.util.List;

/**
 * Options for the Type-2 engine.
 *
 * @param renameIdentifiers  Rename identifiers by category
 * @param mutateLiterals     Replace literal values
 * @param literalProbability Independent chance that each literal is replaced (0.0-1.0)
 * @param mutateBooleans     Also flip boolean literals
 * @param applyFormatting    Run the formatting pipeline after substitution
 * @param functionPrefixes   Verb prefixes that mark a name as a function
 */
public record RenamingOptions(
        boolean renameIdentifiers,
        boolean mutateLiterals,
        double literalProbability,
        boolean mutateBooleans,
        boolean applyFormatting,
        List<String> functionPrefixes) {

    public RenamingOptions {
        if (literalProbability < 0.0 || literalProbability > 1.0) {
            throw new IllegalArgumentException("literalProbability must be between 0.0 and 1.0");
        }
        functionPrefixes = functionPrefixes == null || functionPrefixes.isEmpty()
                ? NamingConventionHeuristic.DEFAULT_FUNCTION_PREFIXES
                : List.copyOf(functionPrefixes);
    }

    public static RenamingOptions defaults() {
        return new RenamingOptions(true, true, 0.5, false, false, null);
    }

    public static RenamingOptions renameOnly() {
        return new RenamingOptions(true, false, 0.0, false, false, null);
    }

    public RenamingOptions withoutLiterals() {
        return new RenamingOptions(renameIdentifiers, false, literalProbability, mutateBooleans, applyFormatting,
                functionPrefixes);
    }

    public RenamingOptions withLiteralProbability(double probability) {
        return new RenamingOptions(renameIdentifiers, mutateLiterals, probability, mutateBooleans, applyFormatting,
                functionPrefixes);
    }

    public RenamingOptions withMutateBooleans(boolean flag) {
        return new RenamingOptions(renameIdentifiers, mutateLiterals, literalProbability, flag, applyFormatting,
                functionPrefixes);
    }
}
