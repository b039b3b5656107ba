package org.broadinstitute.featureparser.engine;

/**
 * Life cycle of an {@link AnnotationParser}.
 *
 * A parser starts {@link #UNOPENED}, becomes {@link #OPEN} once its file is open, and enters either
 * {@link #STREAMING} or {@link #MATERIALIZING} with the first retrieval call. Both end in {@link #EXHAUSTED}.
 */
public enum ParserState {
    UNOPENED,
    OPEN,
    STREAMING,
    MATERIALIZING,
    EXHAUSTED
}
