package org.broadinstitute.featureparser.format;

import com.google.common.collect.ImmutableMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.featureparser.codecs.CodecUtils;
import org.broadinstitute.featureparser.codecs.ucsc.GenePredLayout;
import org.broadinstitute.featureparser.exceptions.UserException;
import org.broadinstitute.featureparser.utils.Utils;
import org.broadinstitute.featureparser.utils.io.AnnotationLineReader;
import org.broadinstitute.featureparser.utils.io.IOUtils;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Classifies an annotation file into its {@link AnnotationFileType} from the file extension and the first data line.
 *
 * Extensions that name one dialect ({@code .narrowPeak}, {@code .gtf}, ...) are trusted as is. For the others the
 * tab-delimited columns of the first line that is not a comment, track or browser line are inspected: how many there
 * are and which of them hold integers, strands or comma separated integer lists.
 */
public final class FormatTaster {
    private static final Logger logger = LogManager.getLogger(FormatTaster.class);

    private static final Map<String, AnnotationFileType> EXACT_EXTENSIONS = ImmutableMap.<String, AnnotationFileType>builder()
            .put(".narrowpeak", AnnotationFileType.NARROW_PEAK)
            .put(".broadpeak", AnnotationFileType.BROAD_PEAK)
            .put(".gappedpeak", AnnotationFileType.GAPPED_PEAK)
            .put(".bedgraph", AnnotationFileType.BED_GRAPH)
            .put(".bdg", AnnotationFileType.BED_GRAPH)
            .put(".gtf", AnnotationFileType.GTF)
            .put(".gff3", AnnotationFileType.GFF3)
            .build();

    private static final String BED_EXTENSION = ".bed";
    private static final String GFF_EXTENSION = ".gff";

    // key "value" as the first GTF attribute
    private static final Pattern GTF_ATTRIBUTE = Pattern.compile("^\\s*[\\w.]+\\s+\"[^\"]*\"");
    private static final Pattern RGB = Pattern.compile("^\\d{1,3}(,\\d{1,3}){2},?$|^0$");

    private FormatTaster(){}

    /**
     * @return the dialect of the annotation file at {@code path}
     * @throws UserException.UnrecognizedFormat if neither the extension nor the content identify a dialect
     * @throws UserException.CouldNotReadInputFile if the file can not be read
     */
    public static AnnotationFileType taste(final Path path) {
        Utils.nonNull(path);
        final String extension = IOUtils.getExtension(path).toLowerCase(Locale.ROOT);
        final AnnotationFileType exact = EXACT_EXTENSIONS.get(extension);
        if (exact != null) {
            logger.debug(String.format("%s is %s by its extension", path, exact));
            return exact;
        }

        final List<String> headers = new ArrayList<>();
        final String firstDataLine;
        try (final AnnotationLineReader reader = new AnnotationLineReader(path, headers::add)) {
            firstDataLine = reader.readDataLine();
        }

        if (firstDataLine == null) {
            if (BED_EXTENSION.equals(extension)) {
                return AnnotationFileType.BED3;
            }
            if (GFF_EXTENSION.equals(extension) && headers.stream().anyMatch(h -> h.startsWith("##gff-version"))) {
                return AnnotationFileType.GFF3;
            }
            throw new UserException.UnrecognizedFormat(path, "The file has no data lines.");
        }

        final Optional<AnnotationFileType> tasted = tasteLine(extension, firstDataLine);
        logger.debug(String.format("%s tasted as %s from line '%s'", path, tasted.map(AnnotationFileType::getTypeName).orElse("nothing"), firstDataLine));
        return tasted.orElseThrow(() -> new UserException.UnrecognizedFormat(path,
                "The extension '" + extension + "' and the first data line '" + firstDataLine + "' do not match any supported dialect."));
    }

    /**
     * Classifies one data line, using the lower-cased {@code extension} (with its dot, may be empty) to decide the
     * order in which the dialect families are tried.
     */
    public static Optional<AnnotationFileType> tasteLine(final String extension, final String line) {
        Utils.nonNull(extension);
        Utils.nonNull(line);
        final AnnotationFileType exact = EXACT_EXTENSIONS.get(extension);
        if (exact != null) {
            return Optional.of(exact);
        }
        final List<String> columns = CodecUtils.splitColumns(line);
        if (BED_EXTENSION.equals(extension)) {
            return or(tasteBed(columns, false), () -> tasteUcsc(columns), () -> tasteGff(columns));
        }
        if (GFF_EXTENSION.equals(extension)) {
            return or(tasteGff(columns), () -> tasteBed(columns, true), () -> tasteUcsc(columns));
        }
        return or(tasteUcsc(columns), () -> tasteBed(columns, true), () -> tasteGff(columns));
    }

    @SafeVarargs
    private static Optional<AnnotationFileType> or(final Optional<AnnotationFileType> first,
                                                   final Supplier<Optional<AnnotationFileType>>... rest) {
        Optional<AnnotationFileType> result = first;
        for (final Supplier<Optional<AnnotationFileType>> next : rest) {
            if (result.isPresent()) {
                return result;
            }
            result = next.get();
        }
        return result;
    }

    /**
     * @param allowBedGraph whether a 4 column line with a numeric last column is bedGraph rather than bed4
     */
    static Optional<AnnotationFileType> tasteBed(final List<String> columns, final boolean allowBedGraph) {
        final int n = columns.size();
        if (n < 3 || !CodecUtils.isInteger(columns.get(1)) || !CodecUtils.isInteger(columns.get(2))) {
            return Optional.empty();
        }
        if (n >= 6 && !CodecUtils.isStrand(columns.get(5))) {
            return Optional.empty();
        }
        switch (n) {
            case 4:
                return Optional.of(allowBedGraph && CodecUtils.isNumber(columns.get(3)) ? AnnotationFileType.BED_GRAPH : AnnotationFileType.BED4);
            case 9:
                if (hasThickAndRgb(columns)) {
                    return Optional.of(AnnotationFileType.BED9);
                }
                return allNumbers(columns, 6, 9) ? Optional.of(AnnotationFileType.BROAD_PEAK) : Optional.empty();
            case 10:
                if (hasThickAndRgb(columns) && CodecUtils.isInteger(columns.get(9))) {
                    return Optional.of(AnnotationFileType.BED10);
                }
                return allNumbers(columns, 6, 9) && isSignedInteger(columns.get(9)) ? Optional.of(AnnotationFileType.NARROW_PEAK) : Optional.empty();
            case 12:
                return hasBlocks(columns) ? Optional.of(AnnotationFileType.BED12) : Optional.empty();
            case 15:
                return hasBlocks(columns) && allNumbers(columns, 12, 15) ? Optional.of(AnnotationFileType.GAPPED_PEAK) : Optional.empty();
            default:
                return AnnotationFileType.plainBed(n);
        }
    }

    static Optional<AnnotationFileType> tasteUcsc(final List<String> columns) {
        final Optional<AnnotationFileType> type = AnnotationFileType.ucscTable(columns.size());
        if (!type.isPresent()) {
            return Optional.empty();
        }
        final GenePredLayout layout = GenePredLayout.forFileType(type.get());
        final boolean matches = CodecUtils.isStrand(columns.get(layout.strandColumn()))
                && CodecUtils.isInteger(columns.get(layout.txStartColumn()))
                && CodecUtils.isInteger(columns.get(layout.txEndColumn()))
                && CodecUtils.isInteger(columns.get(layout.cdsStartColumn()))
                && CodecUtils.isInteger(columns.get(layout.cdsEndColumn()))
                && CodecUtils.isInteger(columns.get(layout.exonCountColumn()))
                && CodecUtils.isIntegerList(columns.get(layout.exonStartsColumn()))
                && CodecUtils.isIntegerList(columns.get(layout.exonEndsColumn()));
        return matches ? type : Optional.empty();
    }

    static Optional<AnnotationFileType> tasteGff(final List<String> columns) {
        if (columns.size() != 9 || !CodecUtils.isInteger(columns.get(3)) || !CodecUtils.isInteger(columns.get(4))) {
            return Optional.empty();
        }
        final String strand = columns.get(6);
        if (!CodecUtils.isStrand(strand) && !"?".equals(strand)) {
            return Optional.empty();
        }
        return Optional.of(GTF_ATTRIBUTE.matcher(columns.get(8)).find() ? AnnotationFileType.GTF : AnnotationFileType.GFF3);
    }

    // thickStart and thickEnd inside [chromStart, chromEnd] followed by an itemRgb value
    private static boolean hasThickAndRgb(final List<String> columns) {
        if (!CodecUtils.isInteger(columns.get(6)) || !CodecUtils.isInteger(columns.get(7))
                || !RGB.matcher(columns.get(8)).matches()) {
            return false;
        }
        final long start = Long.parseLong(columns.get(1));
        final long end = Long.parseLong(columns.get(2));
        final long thickStart = Long.parseLong(columns.get(6));
        final long thickEnd = Long.parseLong(columns.get(7));
        return start <= thickStart && thickStart <= thickEnd && thickEnd <= end;
    }

    private static boolean hasBlocks(final List<String> columns) {
        return CodecUtils.isInteger(columns.get(6)) && CodecUtils.isInteger(columns.get(7))
                && CodecUtils.isInteger(columns.get(9))
                && CodecUtils.isIntegerList(columns.get(10)) && CodecUtils.isIntegerList(columns.get(11));
    }

    private static boolean allNumbers(final List<String> columns, final int from, final int to) {
        for (int i = from; i < to; i++) {
            if (!CodecUtils.isNumber(columns.get(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean isSignedInteger(final String value) {
        return CodecUtils.isInteger(value.startsWith("-") ? value.substring(1) : value);
    }
}
