package org.broadinstitute.featureparser.codecs;

/**
 * Turns one tab-delimited data line of a known dialect into a decoded record.
 *
 * Implementations are stateless apart from their configuration and never keep references to earlier lines.
 *
 * @param <T> the decoded record type
 */
public interface AnnotationLineDecoder<T> {

    /**
     * @param line data line without its terminator
     * @param lineNumber 1-based line number, used in error messages
     * @throws org.broadinstitute.featureparser.exceptions.UserException.MalformedLine if the line does not fit the dialect
     */
    T decode(String line, int lineNumber);
}
