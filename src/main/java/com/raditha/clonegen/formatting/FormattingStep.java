package com.raditha.clonegen.formatting;

import com.raditha.clonegen.model.Language;

import java.util.Random;

/**
 * One whitespace/comment-only rewrite of a snippet.
 * <p>
 * Implementations must leave the code-token sequence untouched. The engine
 * re-tokenizes every output and discards a step whose output breaks that
 * rule, so a step may be best effort on unusual input.
 */
public interface FormattingStep {

    FormattingOperation operation();

    default boolean appliesTo(Language language) {
        return true;
    }

    /**
     * Rewrite {@code source}. Returns the input unchanged when there is
     * nothing to do.
     */
    String apply(String source, Language language, Random random);
}
