package org.broadinstitute.featureparser.utils.io;

import htsjdk.samtools.util.BlockCompressedInputStream;
import htsjdk.samtools.util.IOUtil;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.featureparser.exceptions.ParserException;
import org.broadinstitute.featureparser.exceptions.UserException;
import org.broadinstitute.featureparser.utils.Utils;

import java.io.BufferedInputStream;
import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.zip.GZIPInputStream;

public final class IOUtils {
    private static final Logger logger = LogManager.getLogger(IOUtils.class);

    public static final String GZIP_EXTENSION = ".gz";

    private IOUtils(){}

    /**
     * Makes a buffered reader for a file, unzipping if the content of the file is gzipped (whatever its name).
     */
    public static BufferedReader makeReaderMaybeGzipped(final Path path) throws IOException {
        Utils.nonNull(path);
        final InputStream in = new BufferedInputStream(Files.newInputStream(path));
        // mark/reset on the buffered stream lets us peek at the magic number
        final boolean zipped = IOUtil.isGZIPInputStream(in);
        if (zipped) {
            logger.debug("Reading " + path + " as a gzip compressed stream");
        }
        return new BufferedReader(new InputStreamReader(zipped ? makeZippedInputStream(in) : in, StandardCharsets.UTF_8));
    }

    /**
     * creates an input stream from a zipped stream
     * @return tries to create a block gzipped input stream and if it's not block gzipped it produces to a gzipped stream instead
     */
    public static InputStream makeZippedInputStream(InputStream in) throws IOException {
        Utils.nonNull(in);
        if (BlockCompressedInputStream.isValidFile(in)) {
            return new BlockCompressedInputStream(in);
        } else {
            return new GZIPInputStream(in);
        }
    }

    /**
     * @param path Path to test
     * @throws UserException.CouldNotReadInputFile if the file isn't readable and a regular file
     */
    public static void assertFileIsReadable(final Path path) {
        Utils.nonNull(path);
        if ( ! Files.exists(path) ) {
            throw new UserException.CouldNotReadInputFile(path, "It doesn't exist.");
        }
        if ( ! Files.isRegularFile(path) ) {
            throw new UserException.CouldNotReadInputFile(path, "It isn't a regular file");
        }
        if ( ! Files.isReadable(path) ) {
            throw new UserException.CouldNotReadInputFile(path, "It is not readable, check the file permissions");
        }
    }

    /**
     * Returns the file name of {@code path} with a trailing {@code .gz} removed.
     */
    public static String getFileNameWithoutCompression(final Path path) {
        Utils.nonNull(path);
        final String name = path.getFileName().toString();
        return StringUtils.endsWithIgnoreCase(name, GZIP_EXTENSION) ? name.substring(0, name.length() - GZIP_EXTENSION.length()) : name;
    }

    /**
     * Returns the extension of {@code path} including the leading dot, ignoring any {@code .gz} suffix,
     * or an empty string when there is none.
     */
    public static String getExtension(final Path path) {
        final String name = getFileNameWithoutCompression(path);
        final int dot = name.lastIndexOf('.');
        return dot <= 0 ? "" : name.substring(dot);
    }

    /**
     * Returns the file name of {@code path} with its extension (and any {@code .gz} suffix) removed,
     * e.g. {@code peaks} for {@code /data/peaks.narrowPeak.gz}.
     */
    public static String getBaseName(final Path path) {
        final String name = getFileNameWithoutCompression(path);
        final String extension = getExtension(path);
        return name.substring(0, name.length() - extension.length());
    }

    /**
     * Decodes the %XX escapes of a URL-escaped string. A literal {@code +} is preserved.
     */
    public static String urlDecode(final String string) {
        Utils.nonNull(string);
        if (string.indexOf('%') < 0) {
            return string;
        }
        try {
            return URLDecoder.decode(string.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (final IllegalArgumentException e) {
            throw new UserException.BadInput("Could not decode escaped value " + string, e);
        }
    }

    /**
     * Creates a temp file that will be deleted on exit
     *
     * @param name Prefix of the file.
     * @param extension Extension to concat to the end of the file.
     * @return A file in the temporary directory starting with name, ending with extension, which will be deleted after the program exits.
     */
    public static File createTempFile(String name, String extension) {
        try {
            if ( !extension.startsWith(".") ) {
                extension = "." + extension;
            }
            final File file = File.createTempFile(name, extension);
            file.deleteOnExit();
            return file;
        } catch (IOException ex) {
            throw new ParserException("Cannot create temp file: " + ex.getMessage(), ex);
        }
    }

    /**
     * Writes content to a temp file and returns the path to the temporary file.
     *
     * @param content   lines to write.
     * @param prefix    Prefix for the temp file.
     * @param suffix    Suffix for the temp file.
     * @return the path to the temp file.
     */
    public static Path writeTempFile(final List<String> content, final String prefix, final String suffix) {
        final Path tempFile = createTempFile(prefix, suffix).toPath();
        try {
            Files.write(tempFile, content, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new ParserException("Cannot write temp file " + tempFile, ex);
        }
        return tempFile;
    }
}
