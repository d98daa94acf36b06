package com.raditha.clonegen.ai;

import com.raditha.clonegen.model.Language;

/**
 * External text-to-text source of Type-3 candidates, typically an LLM.
 * <p>
 * The reply is untrusted: callers strip markdown fences and validate it as a
 * Type-3 clone before using it.
 */
public interface CandidateGenerator {

    /**
     * Propose a structurally modified variant of {@code source}.
     *
     * @throws CandidateGenerationException when no reply could be obtained
     */
    String propose(String source, Language language) throws CandidateGenerationException;
}
