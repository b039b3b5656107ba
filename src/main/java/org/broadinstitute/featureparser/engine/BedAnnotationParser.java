package org.broadinstitute.featureparser.engine;

import org.broadinstitute.featureparser.cmdline.argumentcollections.ParserArgumentCollection;
import org.broadinstitute.featureparser.codecs.bed.BedLineDecoder;
import org.broadinstitute.featureparser.feature.FeatureNode;
import org.broadinstitute.featureparser.feature.FeatureTypes;
import org.broadinstitute.featureparser.format.AnnotationFileType;
import org.broadinstitute.featureparser.format.AnnotationFlavor;
import org.broadinstitute.featureparser.utils.Utils;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parser for the BED family: BED3 to BED12, bedGraph, narrowPeak, broadPeak and gappedPeak.
 * Every line is one top level feature, so both retrieval modes see the same features.
 */
public final class BedAnnotationParser extends AnnotationParser {
    private final BedLineDecoder decoder;

    public BedAnnotationParser(final Path file, final AnnotationFileType fileType, final ParserArgumentCollection arguments) {
        super(file, fileType, arguments);
        Utils.validateArg(fileType.getFlavor() == AnnotationFlavor.BED, () -> fileType + " is not a BED type");
        this.decoder = new BedLineDecoder(fileType, factory, flags);
        if (arguments.isDoGeneGiven()) {
            logger.warn(String.format("--%s does not apply to BED files and is ignored for %s",
                    ParserArgumentCollection.DO_GENE_LONG_NAME, file));
        }
    }

    @Override
    protected List<FeatureNode> readUnit() {
        final String line = readDataLine();
        return line == null ? null : Collections.singletonList(decoder.decode(line, getLineNumber()));
    }

    @Override
    protected List<FeatureNode> readAllFeatures() {
        final List<FeatureNode> features = new ArrayList<>();
        String line;
        while ((line = readDataLine()) != null) {
            features.add(decoder.decode(line, getLineNumber()));
        }
        return features;
    }

    @Override
    public String getTypeList() {
        switch (getFileType()) {
            case BED12:
                return String.join(",", transcriptTypes(false, flags));
            case NARROW_PEAK:
            case BROAD_PEAK:
                return FeatureTypes.PEAK;
            case GAPPED_PEAK:
                return FeatureTypes.GAPPED_PEAK + "," + FeatureTypes.PEAK;
            default:
                return FeatureTypes.REGION;
        }
    }
}
