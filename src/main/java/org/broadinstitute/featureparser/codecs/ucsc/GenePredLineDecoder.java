package org.broadinstitute.featureparser.codecs.ucsc;

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
import org.broadinstitute.featureparser.utils.Utils;

import java.util.List;

/**
 * Decodes one line of a UCSC gene prediction table (genePred, refFlat, knownGene, genePredExt or genePredExtBin)
 * into a transcript with its subfeatures, plus the name of the gene it belongs to.
 *
 * <p>The gene name is taken from the first of: the refFlat geneName column, the genePredExt name2 column, the kgXref
 * gene symbol, the ensemblToGeneName table, and finally the transcript name itself.</p>
 *
 * <p>A transcript without coding sequence is tagged from the refSeqStatus molecule type or the ensemblSource biotype,
 * {@code ncRNA} when neither knows it.</p>
 */
public final class GenePredLineDecoder implements AnnotationLineDecoder<TranscriptRecord> {
    public static final String STATUS = "status";
    public static final String COMPLETENESS = "completeness";
    public static final String SUMMARY = "summary";
    public static final String NOTE = "Note";
    public static final String PROTEIN_ID = "proteinID";
    public static final String BIOTYPE = "biotype";

    private final GenePredLayout layout;
    private final SubfeatureFlags flags;
    private final UcscAuxiliaryTables tables;
    private final TranscriptBlockBuilder blockBuilder;

    public GenePredLineDecoder(final GenePredLayout layout, final FeatureNodeFactory factory,
                               final SubfeatureFlags flags, final UcscAuxiliaryTables tables) {
        this.layout = Utils.nonNull(layout);
        this.flags = Utils.nonNull(flags);
        this.tables = Utils.nonNull(tables);
        this.blockBuilder = new TranscriptBlockBuilder(Utils.nonNull(factory));
    }

    @Override
    public TranscriptRecord decode(final String line, final int lineNumber) {
        Utils.nonNull(line);
        final List<String> columns = CodecUtils.splitColumns(line);
        if (columns.size() != layout.getColumnCount()) {
            throw new UserException.MalformedLine(lineNumber, line, String.format("%s lines must have %d columns but this one has %d",
                    layout.getFileType(), layout.getColumnCount(), columns.size()));
        }

        final String name = columns.get(layout.nameColumn());
        final String chrom = columns.get(layout.chromColumn());
        if (name.isEmpty() || chrom.isEmpty()) {
            throw new UserException.MalformedLine(lineNumber, line, "the name and chrom columns must not be empty");
        }
        final Strand strand;
        try {
            strand = FeatureNode.decodeStrand(columns.get(layout.strandColumn()));
        } catch (final IllegalArgumentException e) {
            throw new UserException.MalformedLine(lineNumber, line, e.getMessage(), e);
        }
        final int txStart = CodecUtils.parseInteger(columns, layout.txStartColumn(), "txStart", lineNumber, line);
        final int txEnd = CodecUtils.parseInteger(columns, layout.txEndColumn(), "txEnd", lineNumber, line);
        final int cdsStart = CodecUtils.parseInteger(columns, layout.cdsStartColumn(), "cdsStart", lineNumber, line);
        final int cdsEnd = CodecUtils.parseInteger(columns, layout.cdsEndColumn(), "cdsEnd", lineNumber, line);
        final int exonCount = CodecUtils.parseInteger(columns, layout.exonCountColumn(), "exonCount", lineNumber, line);
        final List<Integer> exonStarts = CodecUtils.parseIntegerList(columns.get(layout.exonStartsColumn()), "exonStarts", lineNumber, line);
        final List<Integer> exonEnds = CodecUtils.parseIntegerList(columns.get(layout.exonEndsColumn()), "exonEnds", lineNumber, line);

        if (txEnd <= txStart) {
            throw new UserException.MalformedLine(lineNumber, line, String.format("txEnd %d must be greater than txStart %d", txEnd, txStart));
        }
        if (exonCount < 1 || exonStarts.size() != exonCount || exonEnds.size() != exonCount) {
            throw new UserException.MalformedLine(lineNumber, line, String.format(
                    "exonCount is %d but there are %d exon starts and %d exon ends", exonCount, exonStarts.size(), exonEnds.size()));
        }
        for (int i = 0; i < exonCount; i++) {
            if (exonEnds.get(i) <= exonStarts.get(i) || exonStarts.get(i) < txStart || exonEnds.get(i) > txEnd) {
                throw new UserException.MalformedLine(lineNumber, line, String.format(
                        "exon %d (%d-%d) is empty or outside the transcript", i + 1, exonStarts.get(i), exonEnds.get(i)));
            }
        }

        final UcscAuxiliaryTables.RefSeqStatus status = tables.getRefSeqStatus(name);
        final String ensemblSource = tables.getEnsemblSource(name);
        final String noncodingTag = FeatureTypes.noncodingTagFor(status != null ? status.getMolecule() : ensemblSource);

        final TranscriptBlocks blocks = TranscriptBlocks.fromHalfOpen(name, name, chrom, strand, txStart, txEnd,
                cdsStart, cdsEnd, exonStarts, exonEnds, noncodingTag);
        final FeatureNode transcript = blockBuilder.build(blocks, flags);
        addAnnotations(transcript, name, columns, status, ensemblSource);
        return new TranscriptRecord(transcript, geneName(name, columns));
    }

    private void addAnnotations(final FeatureNode transcript, final String name, final List<String> columns,
                                final UcscAuxiliaryTables.RefSeqStatus status, final String ensemblSource) {
        if (status != null) {
            transcript.addAttribute(STATUS, status.getStatus());
        }
        final UcscAuxiliaryTables.RefSeqSummary summary = tables.getRefSeqSummary(name);
        if (summary != null) {
            transcript.addAttribute(COMPLETENESS, summary.getCompleteness());
            if (!summary.getSummary().isEmpty()) {
                transcript.addAttribute(SUMMARY, summary.getSummary());
            }
        }
        final UcscAuxiliaryTables.KgXref xref = tables.getKgXref(name);
        if (xref != null && !xref.getDescription().isEmpty()) {
            transcript.addAttribute(NOTE, xref.getDescription());
        }
        if (ensemblSource != null) {
            transcript.addAttribute(BIOTYPE, ensemblSource);
        }
        if (layout.proteinIdColumn() >= 0 && !columns.get(layout.proteinIdColumn()).isEmpty()) {
            transcript.addAttribute(PROTEIN_ID, columns.get(layout.proteinIdColumn()));
        }
    }

    private String geneName(final String name, final List<String> columns) {
        if (layout.geneNameColumn() >= 0 && !columns.get(layout.geneNameColumn()).isEmpty()) {
            return columns.get(layout.geneNameColumn());
        }
        if (layout.name2Column() >= 0 && !columns.get(layout.name2Column()).isEmpty()) {
            return columns.get(layout.name2Column());
        }
        final UcscAuxiliaryTables.KgXref xref = tables.getKgXref(name);
        if (xref != null && !xref.getGeneSymbol().isEmpty()) {
            return xref.getGeneSymbol();
        }
        final String ensemblName = tables.getEnsemblGeneName(name);
        if (ensemblName != null && !ensemblName.isEmpty()) {
            return ensemblName;
        }
        return name;
    }
}
