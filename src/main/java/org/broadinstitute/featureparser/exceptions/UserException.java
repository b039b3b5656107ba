package org.broadinstitute.featureparser.exceptions;

import java.nio.file.Path;

/**
 * <p/>
 * Class UserException.
 * <p/>
 * This exception is for errors that are due to user mistakes, such as non-existent, unrecognized or malformed files.
 */
public class UserException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public UserException() {
        super();
    }

    public UserException(final String msg) {
        super(msg);
    }

    public UserException(final String message, final Throwable throwable) {
        super(message, throwable);
    }

    protected static String getMessage(final Throwable t) {
        final String message = t.getMessage();
        return message != null ? message : t.getClass().getName();
    }

    /**
     * Subtypes of UserException for common kinds of errors
     */

    /**
     * <p/>
     * Class UserException.CouldNotReadInputFile
     * <p/>
     * For generic errors opening/reading from input files
     */
    public static class CouldNotReadInputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotReadInputFile(Path file) {
            super(String.format("Couldn't read file %s", file.toAbsolutePath().toUri()));
        }

        public CouldNotReadInputFile(Path file, String message) {
            super(String.format("Couldn't read file %s. Error was: %s", file.toAbsolutePath().toUri(), message));
        }

        public CouldNotReadInputFile(Path file, String message, Throwable cause) {
            super(String.format("Couldn't read file %s. Error was: %s", file.toAbsolutePath().toUri(), message), cause);
        }

        public CouldNotReadInputFile(Path path, Exception e) {
            this(path, getMessage(e), e);
        }
    }

    /**
     * Neither the file extension nor the content of the first data line match a known annotation dialect.
     */
    public static class UnrecognizedFormat extends UserException {
        private static final long serialVersionUID = 0L;

        public UnrecognizedFormat(final Path file, final String message) {
            super(String.format("Unrecognized annotation format for file %s. %s", file.toAbsolutePath().toUri(), message));
        }
    }

    /**
     * A data line does not have the shape its detected dialect requires: wrong column count,
     * non-numeric coordinate, inconsistent comma list.
     */
    public static class MalformedLine extends UserException {
        private static final long serialVersionUID = 0L;

        private final int lineNumber;
        private final String line;

        public MalformedLine(final int lineNumber, final String line, final String message) {
            super(String.format("Malformed line %d '%s': %s", lineNumber, line, message));
            this.lineNumber = lineNumber;
            this.line = line;
        }

        public MalformedLine(final int lineNumber, final String line, final String message, final Throwable cause) {
            super(String.format("Malformed line %d '%s': %s", lineNumber, line, message), cause);
            this.lineNumber = lineNumber;
            this.line = line;
        }

        public int getLineNumber() {
            return lineNumber;
        }

        public String getLine() {
            return line;
        }
    }

    /**
     * Two independent GFF3 records share an {@code ID}.
     */
    public static class DuplicateIdentifier extends UserException {
        private static final long serialVersionUID = 0L;

        public DuplicateIdentifier(final String id, final int lineNumber) {
            super(String.format("The ID %s at line %d was already used by another feature. IDs must be unique within a GFF3 file.", id, lineNumber));
        }
    }

    public static class BadInput extends UserException {
        private static final long serialVersionUID = 0L;

        public BadInput(String message) {
            super(String.format("Bad input: %s", message));
        }

        public BadInput(String message, Throwable throwable) {
            super(String.format("Bad input: %s", message), throwable);
        }
    }
}
