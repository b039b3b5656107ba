package org.broadinstitute.featureparser.exceptions;

/**
 * <p/>
 * Class ParserException.
 * <p/>
 * This exception is for errors that are beyond the user's control, such as internal pre/post condition failures,
 * misuse of the parser API by calling code, and "this should never happen" kinds of scenarios.
 */
public class ParserException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public ParserException( String msg ) {
        super(msg);
    }

    public ParserException( String message, Throwable throwable ) {
        super(message, throwable);
    }

    /*
      Subtypes of ParserException for common kinds of errors
     */

    /**
     * <p/>
     * For wrapping errors that are believed to never be reachable
     */
    public static class ShouldNeverReachHereException extends ParserException {
        private static final long serialVersionUID = 0L;
        public ShouldNeverReachHereException( final String s ) {
            super(s);
        }
        public ShouldNeverReachHereException( final String s, final Throwable throwable ) {
            super(s, throwable);
        }
        public ShouldNeverReachHereException( final Throwable throwable) {this("Should never reach here.", throwable);}
    }

    /**
     * Thrown when a caller mixes the streaming ({@code nextFeature}) and materializing
     * ({@code parseFile}, {@code getTopFeatures}, {@code fetch}) retrieval modes on one parser.
     */
    public static class InvalidModeTransition extends ParserException {
        private static final long serialVersionUID = 0L;

        public InvalidModeTransition( final String fromMode, final String requested ) {
            super(String.format("Cannot %s: this parser is already in %s mode. Streaming and materializing retrieval " +
                    "cannot be mixed on one parser, open a new parser instead.", requested, fromMode));
        }
    }
}
