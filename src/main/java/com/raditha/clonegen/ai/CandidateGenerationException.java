package com.raditha.clonegen.ai;

/**
 * A candidate generator could not produce a reply.
 */
public class CandidateGenerationException extends Exception {

    public CandidateGenerationException(String message) {
        super(message);
    }

    public CandidateGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
