package org.broadinstitute.featureparser.utils.io;

import htsjdk.samtools.util.BlockCompressedOutputStream;
import org.broadinstitute.featureparser.exceptions.UserException;
import org.broadinstitute.featureparser.testutils.FeatureParserBaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.zip.GZIPOutputStream;

public final class IOUtilsUnitTest extends FeatureParserBaseTest {

    @DataProvider(name = "fileNames")
    public Object[][] fileNames() {
        return new Object[][] {
                {"/data/peaks.narrowPeak.gz", "peaks.narrowPeak", ".narrowPeak", "peaks"},
                {"/data/genes.gff3", "genes.gff3", ".gff3", "genes"},
                {"refFlat.txt.GZ", "refFlat.txt", ".txt", "refFlat"},
                {"/data/noextension", "noextension", "", "noextension"},
                {"/data/.hidden", ".hidden", "", ".hidden"}};
    }

    @Test(dataProvider = "fileNames")
    public void testFileNameParts(final String path, final String withoutCompression, final String extension, final String baseName) {
        Assert.assertEquals(IOUtils.getFileNameWithoutCompression(Paths.get(path)), withoutCompression);
        Assert.assertEquals(IOUtils.getExtension(Paths.get(path)), extension);
        Assert.assertEquals(IOUtils.getBaseName(Paths.get(path)), baseName);
    }

    @DataProvider(name = "escapes")
    public Object[][] escapes() {
        return new Object[][] {
                {"plain", "plain"},
                {"Alpha%3BOne", "Alpha;One"},
                {"a%2Cb%3Dc", "a,b=c"},
                {"50%25+more", "50%+more"}};
    }

    @Test(dataProvider = "escapes")
    public void testUrlDecode(final String escaped, final String expected) {
        Assert.assertEquals(IOUtils.urlDecode(escaped), expected);
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testUrlDecodeBadEscape() {
        IOUtils.urlDecode("broken%zz");
    }

    @Test
    public void testReadPlainGzipAndBgzip() throws IOException {
        final List<String> lines = Arrays.asList("first", "second");
        final Path plain = writeLines(".txt", lines);

        final File gzip = createTempFile("gzipped", ".txt.gz");
        try (final PrintStream out = new PrintStream(new GZIPOutputStream(Files.newOutputStream(gzip.toPath())), false, "UTF-8")) {
            lines.forEach(out::println);
        }

        final File bgzip = createTempFile("bgzipped", ".txt.gz");
        try (final OutputStream out = new BlockCompressedOutputStream(bgzip)) {
            out.write(String.join("\n", lines).concat("\n").getBytes(StandardCharsets.UTF_8));
        }

        for (final Path path : Arrays.asList(plain, gzip.toPath(), bgzip.toPath())) {
            try (final BufferedReader reader = IOUtils.makeReaderMaybeGzipped(path)) {
                Assert.assertEquals(reader.readLine(), "first", path.toString());
                Assert.assertEquals(reader.readLine(), "second", path.toString());
                Assert.assertNull(reader.readLine(), path.toString());
            }
        }
    }

    @Test(expectedExceptions = UserException.CouldNotReadInputFile.class)
    public void testAssertFileIsReadableMissing() {
        IOUtils.assertFileIsReadable(Paths.get("/this/file/does/not/exist.bed"));
    }

    @Test(expectedExceptions = UserException.CouldNotReadInputFile.class)
    public void testAssertFileIsReadableDirectory() {
        IOUtils.assertFileIsReadable(Paths.get(TEST_RESOURCES));
    }

    @Test
    public void testWriteTempFile() throws IOException {
        final Path path = IOUtils.writeTempFile(Arrays.asList("a", "b"), "prefix", "bed");
        Assert.assertTrue(path.getFileName().toString().endsWith(".bed"));
        Assert.assertEquals(Files.readAllLines(path), Arrays.asList("a", "b"));
    }
}
