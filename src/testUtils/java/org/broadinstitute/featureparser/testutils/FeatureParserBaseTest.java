package org.broadinstitute.featureparser.testutils;

import htsjdk.samtools.util.Log;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.featureparser.utils.LoggingUtils;
import org.broadinstitute.featureparser.utils.io.IOUtils;
import org.testng.annotations.BeforeSuite;

import java.io.File;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

/**
 * This is the base test class for all of our test cases.  All test cases should extend from this
 * class; it sets up the logger, and resolves the location of directories that we rely on.
 */
public abstract class FeatureParserBaseTest {

    public static final String TEST_RESOURCES = "src/test/resources/org/broadinstitute/featureparser/";

    public static final Logger logger = LogManager.getLogger("org.broadinstitute.featureparser");

    @BeforeSuite
    public void setTestVerbosity(){
        LoggingUtils.setLoggingLevel(Log.LogLevel.WARNING);
    }

    /**
     * @param fileName the name of a file in the shared test resource directory
     * @return its path
     */
    public static Path getTestPath(final String fileName) {
        return Paths.get(TEST_RESOURCES, fileName);
    }

    /**
     * Creates a temp file that will be deleted on exit after tests are complete.
     * @param name Prefix of the file.
     * @param extension Extension to concat to the end of the file.
     * @return A file in the temporary directory starting with name, ending with extension, which will be deleted after the program exits.
     */
    public static File createTempFile(final String name, final String extension) {
        return IOUtils.createTempFile(name, extension);
    }

    /**
     * Writes {@code lines} to a temp file ending in {@code extension}, deleted on exit.
     */
    public static Path writeLines(final String extension, final String... lines) {
        return writeLines(extension, Arrays.asList(lines));
    }

    public static Path writeLines(final String extension, final List<String> lines) {
        return IOUtils.writeTempFile(lines, "featureParserTest", extension);
    }

    /**
     * Joins {@code columns} with tabs.
     */
    public static String tabs(final Object... columns) {
        final StringBuilder builder = new StringBuilder();
        for (int i = 0; i < columns.length; i++) {
            if (i > 0) {
                builder.append('\t');
            }
            builder.append(columns[i]);
        }
        return builder.toString();
    }
}
