package com.refinement_copilot.service.observability;

/**
 * Failures the pipeline recovers from, each with its own degraded outcome
 */
public enum FailureKind {
    /** Classifier output was malformed; classification degrades to confidence 0.4 */
    CLASSIFICATION_PARSE_FAILURE,
    /** Classifier capability threw; classification degrades to confidence 0.3 */
    CLASSIFICATION_CAPABILITY_FAILURE,
    /** Generator capability threw or returned nothing; the answer becomes the generation apology */
    GENERATION_CAPABILITY_FAILURE,
    /** Anything else; the answer becomes the pipeline apology */
    UNEXPECTED_PIPELINE_FAILURE
}
