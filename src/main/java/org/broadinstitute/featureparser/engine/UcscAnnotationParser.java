package org.broadinstitute.featureparser.engine;

import org.broadinstitute.featureparser.assembly.GeneAssembler;
import org.broadinstitute.featureparser.cmdline.argumentcollections.ParserArgumentCollection;
import org.broadinstitute.featureparser.codecs.ucsc.GenePredLayout;
import org.broadinstitute.featureparser.codecs.ucsc.GenePredLineDecoder;
import org.broadinstitute.featureparser.codecs.ucsc.TranscriptRecord;
import org.broadinstitute.featureparser.codecs.ucsc.UcscAuxiliaryTables;
import org.broadinstitute.featureparser.feature.FeatureNode;
import org.broadinstitute.featureparser.format.AnnotationFileType;
import org.broadinstitute.featureparser.format.AnnotationFlavor;
import org.broadinstitute.featureparser.utils.Utils;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Parser for UCSC gene prediction tables. Each line is a transcript; with {@code do-gene} the transcripts are
 * grouped under genes by name and overlap.
 *
 * When materializing, a transcript joins any earlier overlapping gene of its name. When streaming, only consecutive
 * lines are grouped, so a sorted table yields the same genes in both modes.
 */
public final class UcscAnnotationParser extends AnnotationParser {
    private final GenePredLineDecoder decoder;
    private final UcscAuxiliaryTables tables;
    private final boolean doGene;
    private final GeneAssembler geneAssembler;
    private final List<FeatureNode> transcripts = new ArrayList<>();
    private TranscriptRecord heldRecord;

    public UcscAnnotationParser(final Path file, final AnnotationFileType fileType, final ParserArgumentCollection arguments) {
        super(file, fileType, arguments);
        Utils.validateArg(fileType.getFlavor() == AnnotationFlavor.UCSC, () -> fileType + " is not a UCSC table type");
        this.tables = UcscAuxiliaryTables.load(arguments);
        this.decoder = new GenePredLineDecoder(GenePredLayout.forFileType(fileType), factory, flags, tables);
        this.doGene = arguments.isDoGene();
        this.geneAssembler = new GeneAssembler(factory);
    }

    private TranscriptRecord readRecord() {
        final String line = readDataLine();
        return line == null ? null : decoder.decode(line, getLineNumber());
    }

    @Override
    protected List<FeatureNode> readUnit() {
        final TranscriptRecord first = heldRecord != null ? heldRecord : readRecord();
        heldRecord = null;
        if (first == null) {
            return null;
        }
        if (!doGene) {
            return Collections.singletonList(first.getTranscript());
        }
        final FeatureNode gene = geneAssembler.newGene(first.getTranscript(), first.getGeneName());
        TranscriptRecord next;
        while ((next = readRecord()) != null) {
            if (GeneAssembler.belongsTo(gene, next.getTranscript(), next.getGeneName())) {
                GeneAssembler.join(gene, next.getTranscript());
            } else {
                heldRecord = next;
                break;
            }
        }
        return Collections.singletonList(gene);
    }

    @Override
    protected List<FeatureNode> readAllFeatures() {
        TranscriptRecord record;
        while ((record = readRecord()) != null) {
            transcripts.add(record.getTranscript());
            if (doGene) {
                geneAssembler.add(record.getTranscript(), record.getGeneName());
            }
        }
        return doGene ? geneAssembler.getGenes() : new ArrayList<>(transcripts);
    }

    @Override
    protected Collection<FeatureNode> getLookupFeatures() {
        return doGene ? Collections.unmodifiableList(transcripts) : Collections.emptyList();
    }

    @Override
    public String getTypeList() {
        return String.join(",", transcriptTypes(doGene, flags));
    }

    public UcscAuxiliaryTables getAuxiliaryTables() {
        return tables;
    }
}
