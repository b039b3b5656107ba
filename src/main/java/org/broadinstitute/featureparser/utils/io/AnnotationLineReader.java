package org.broadinstitute.featureparser.utils.io;

import org.broadinstitute.featureparser.exceptions.UserException;
import org.broadinstitute.featureparser.utils.Utils;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Reads the data lines of an annotation file one at a time, handing every non-data line
 * (blank lines excluded) to a comment consumer as it goes by.
 *
 * Non-data lines are those starting with {@code #}, {@code track} or {@code browser}. Lines are read lazily with no
 * read-ahead, so a comment is always delivered after the data line preceding it was returned and before the data line
 * following it is returned. The file may be gzipped. The reader closes itself when the end of the file is reached.
 */
public final class AnnotationLineReader implements Closeable {
    private final Path path;
    private final BufferedReader in;
    private final Consumer<String> commentConsumer;
    private int lineNumber = 0;
    private boolean closed = false;

    /**
     * @param path file to read
     * @param commentConsumer receives each non-data line verbatim, may be {@code null} to drop them
     */
    public AnnotationLineReader(final Path path, final Consumer<String> commentConsumer) {
        this.path = Utils.nonNull(path);
        IOUtils.assertFileIsReadable(path);
        this.commentConsumer = commentConsumer;
        try {
            this.in = IOUtils.makeReaderMaybeGzipped(path);
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(path, e);
        }
    }

    /**
     * @return true if {@code line} is a comment, track or browser line
     */
    public static boolean isCommentLine(final String line) {
        return line.startsWith("#") || line.startsWith("track") || line.startsWith("browser");
    }

    /**
     * @return the next data line, without its line terminator, or {@code null} at the end of the file
     */
    public String readDataLine() {
        if (closed) {
            return null;
        }
        try {
            String line;
            while ((line = in.readLine()) != null) {
                lineNumber++;
                if (line.endsWith("\r")) {
                    line = line.substring(0, line.length() - 1);
                }
                if (line.trim().isEmpty()) {
                    continue;
                }
                if (isCommentLine(line)) {
                    if (commentConsumer != null) {
                        commentConsumer.accept(line);
                    }
                    continue;
                }
                return line;
            }
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(path, "Error at line " + lineNumber, e);
        }
        close();
        return null;
    }

    /**
     * @return the 1-based number of the line read last
     */
    public int getLineNumber() {
        return lineNumber;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            in.close();
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(path, "Error closing file", e);
        }
    }
}
