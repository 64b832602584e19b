package com.unifiedcalendar.backend.classifier;

/**
 * External inference collaborator consulted for ambiguous candidates.
 * Answers are short free text and must be treated as unreliable.
 */
public interface InferenceOracle {

    /**
     * @return whether {@link #ask(String)} can currently be called
     */
    boolean isAvailable();

    /**
     * Sends one closed question prefixed by the oracle's fixed few-shot preamble.
     *
     * @param question the question text
     * @return the raw verdict text
     * @throws OracleUnavailableException if the oracle cannot answer
     */
    String ask(String question);
}
