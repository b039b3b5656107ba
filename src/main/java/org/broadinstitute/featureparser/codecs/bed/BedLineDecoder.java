package org.broadinstitute.featureparser.codecs.bed;

import htsjdk.tribble.annotation.Strand;
import org.broadinstitute.featureparser.assembly.SubfeatureFlags;
import org.broadinstitute.featureparser.assembly.TranscriptBlockBuilder;
import org.broadinstitute.featureparser.assembly.TranscriptBlocks;
import org.broadinstitute.featureparser.codecs.AnnotationLineDecoder;
import org.broadinstitute.featureparser.codecs.CodecUtils;
import org.broadinstitute.featureparser.exceptions.UserException;
import org.broadinstitute.featureparser.feature.FeatureNode;
import org.broadinstitute.featureparser.feature.FeatureNodeFactory;
import org.broadinstitute.featureparser.feature.FeatureTypes;
import org.broadinstitute.featureparser.format.AnnotationFileType;
import org.broadinstitute.featureparser.format.AnnotationFlavor;
import org.broadinstitute.featureparser.utils.Utils;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes one line of a BED-family file into a feature.
 *
 * BED coordinates are 0-based half-open and become {@code start + 1} to {@code end}. The primary id is always
 * {@code chrom:start-end} with the original 0-based start, whatever the name column says. BED12 and gappedPeak blocks
 * are decomposed by the {@link TranscriptBlockBuilder}.
 */
public final class BedLineDecoder implements AnnotationLineDecoder<FeatureNode> {
    public static final String ITEM_RGB = "itemRGB";
    public static final String SIGNAL_VALUE = "signalValue";
    public static final String P_VALUE = "pValue";
    public static final String Q_VALUE = "qValue";
    public static final String PEAK = "peak";

    private final AnnotationFileType fileType;
    private final FeatureNodeFactory factory;
    private final SubfeatureFlags flags;
    private final TranscriptBlockBuilder blockBuilder;

    /**
     * @param flags subfeatures produced for BED12 blocks; gapped peaks always get their blocks as sub-peaks only
     */
    public BedLineDecoder(final AnnotationFileType fileType, final FeatureNodeFactory factory, final SubfeatureFlags flags) {
        Utils.nonNull(fileType);
        Utils.validateArg(fileType.getFlavor() == AnnotationFlavor.BED, () -> fileType + " is not a BED type");
        this.fileType = fileType;
        this.factory = Utils.nonNull(factory);
        this.flags = fileType == AnnotationFileType.GAPPED_PEAK ? SubfeatureFlags.EXONS_ONLY : Utils.nonNull(flags);
        this.blockBuilder = new TranscriptBlockBuilder(factory);
    }

    @Override
    public FeatureNode decode(final String line, final int lineNumber) {
        Utils.nonNull(line);
        final List<String> columns = CodecUtils.splitColumns(line);
        if (columns.size() != fileType.getColumnCount()) {
            throw new UserException.MalformedLine(lineNumber, line,
                    String.format("%s lines must have %d columns but this one has %d", fileType, fileType.getColumnCount(), columns.size()));
        }
        final String seqId = columns.get(0);
        if (seqId.isEmpty()) {
            throw new UserException.MalformedLine(lineNumber, line, "the chromosome column is empty");
        }
        final int start0 = CodecUtils.parseInteger(columns, 1, "chromStart", lineNumber, line);
        final int end = CodecUtils.parseInteger(columns, 2, "chromEnd", lineNumber, line);
        if (end <= start0) {
            throw new UserException.MalformedLine(lineNumber, line,
                    String.format("chromEnd %d must be greater than chromStart %d", end, start0));
        }
        final String id = String.format("%s:%d-%d", seqId, start0, end);

        switch (fileType) {
            case BED12:
            case GAPPED_PEAK:
                return decodeBlocks(columns, id, seqId, start0, end, lineNumber, line);
            default:
                return decodeSimple(columns, id, seqId, start0, end, lineNumber, line);
        }
    }

    private FeatureNode decodeSimple(final List<String> columns, final String id, final String seqId,
                                     final int start0, final int end, final int lineNumber, final String line) {
        final FeatureNode feature = factory.newFeature();
        feature.setLocation(seqId, start0 + 1, end);
        feature.setPrimaryId(id);

        if (fileType == AnnotationFileType.BED_GRAPH) {
            feature.setScore(CodecUtils.parseOptionalDouble(columns.get(3), "score", lineNumber, line));
            return feature;
        }
        if (columns.size() > 3) {
            feature.setDisplayName(optional(columns.get(3)));
        }
        if (columns.size() > 4) {
            feature.setScore(CodecUtils.parseOptionalDouble(columns.get(4), "score", lineNumber, line));
        }
        if (columns.size() > 5) {
            feature.setStrand(strand(columns.get(5), lineNumber, line));
        }

        switch (fileType) {
            case NARROW_PEAK:
                feature.setPrimaryTag(FeatureTypes.PEAK);
                addPeakStatistics(feature, columns, 6);
                feature.addAttribute(PEAK, columns.get(9));
                break;
            case BROAD_PEAK:
                feature.setPrimaryTag(FeatureTypes.PEAK);
                addPeakStatistics(feature, columns, 6);
                break;
            case BED9:
            case BED10:
            case BED11:
                feature.addAttribute(ITEM_RGB, columns.get(8));
                break;
            default:
                break;
        }
        return feature;
    }

    private FeatureNode decodeBlocks(final List<String> columns, final String id, final String seqId,
                                     final int start0, final int end, final int lineNumber, final String line) {
        final Strand strand = strand(columns.get(5), lineNumber, line);
        final int thickStart = thickPosition(columns.get(6), start0, end, "thickStart", lineNumber, line);
        final int thickEnd = thickPosition(columns.get(7), start0, end, "thickEnd", lineNumber, line);
        final int blockCount = CodecUtils.parseInteger(columns, 9, "blockCount", lineNumber, line);
        final List<Integer> blockSizes = CodecUtils.parseIntegerList(columns.get(10), "blockSizes", lineNumber, line);
        final List<Integer> blockStarts = CodecUtils.parseIntegerList(columns.get(11), "blockStarts", lineNumber, line);
        if (blockCount < 1 || blockSizes.size() != blockCount || blockStarts.size() != blockCount) {
            throw new UserException.MalformedLine(lineNumber, line, String.format(
                    "blockCount is %d but there are %d block sizes and %d block starts", blockCount, blockSizes.size(), blockStarts.size()));
        }

        final List<Integer> exonStarts = new ArrayList<>(blockCount);
        final List<Integer> exonEnds = new ArrayList<>(blockCount);
        for (int i = 0; i < blockCount; i++) {
            if (blockSizes.get(i) == 0) {
                throw new UserException.MalformedLine(lineNumber, line, "block " + (i + 1) + " has size 0");
            }
            final int exonStart = start0 + blockStarts.get(i);
            final int exonEnd = exonStart + blockSizes.get(i);
            if (exonEnd > end) {
                throw new UserException.MalformedLine(lineNumber, line, "block " + (i + 1) + " ends after chromEnd");
            }
            exonStarts.add(exonStart);
            exonEnds.add(exonEnd);
        }

        final TranscriptBlocks blocks = TranscriptBlocks.fromHalfOpen(id, optional(columns.get(3)), seqId, strand,
                start0, end, thickStart, thickEnd, exonStarts, exonEnds, FeatureTypes.NCRNA);
        final FeatureNode feature = blockBuilder.build(blocks, flags);
        feature.addAttribute(ITEM_RGB, columns.get(8));
        feature.setScore(CodecUtils.parseOptionalDouble(columns.get(4), "score", lineNumber, line));

        if (fileType == AnnotationFileType.GAPPED_PEAK) {
            feature.setPrimaryTag(FeatureTypes.GAPPED_PEAK);
            int number = 1;
            for (final FeatureNode subPeak : feature.getChildren()) {
                subPeak.setPrimaryTag(FeatureTypes.PEAK);
                subPeak.setPrimaryId(id + ".peak" + number++);
            }
            addPeakStatistics(feature, columns, 12);
        }
        return feature;
    }

    // an empty or zero thick position means no coding range, except a zero that is the chromStart itself
    private static int thickPosition(final String value, final int start0, final int end, final String columnName,
                                     final int lineNumber, final String line) {
        if (value.isEmpty() || ("0".equals(value) && start0 != 0)) {
            return end;
        }
        final int position = CodecUtils.parseInteger(value, columnName, lineNumber, line);
        if (position < start0 || position > end) {
            throw new UserException.MalformedLine(lineNumber, line,
                    String.format("%s %d is outside %d-%d", columnName, position, start0, end));
        }
        return position;
    }

    private static void addPeakStatistics(final FeatureNode feature, final List<String> columns, final int first) {
        feature.addAttribute(SIGNAL_VALUE, columns.get(first));
        feature.addAttribute(P_VALUE, columns.get(first + 1));
        feature.addAttribute(Q_VALUE, columns.get(first + 2));
    }

    private static Strand strand(final String value, final int lineNumber, final String line) {
        try {
            return FeatureNode.decodeStrand(value);
        } catch (final IllegalArgumentException e) {
            throw new UserException.MalformedLine(lineNumber, line, e.getMessage(), e);
        }
    }

    private static String optional(final String value) {
        return value.isEmpty() || ".".equals(value) ? null : value;
    }

    /**
     * Encodes the location of {@code feature} back into the first three BED columns, 0-based half-open.
     */
    public static String toHalfOpen(final FeatureNode feature) {
        Utils.nonNull(feature);
        return feature.getContig() + CodecUtils.COLUMN_DELIMITER + (feature.getStart() - 1) + CodecUtils.COLUMN_DELIMITER + feature.getEnd();
    }

    public AnnotationFileType getFileType() {
        return fileType;
    }
}
