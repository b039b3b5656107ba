package org.broadinstitute.featureparser.format;

import org.broadinstitute.featureparser.utils.Utils;

import java.util.Arrays;
import java.util.Optional;

/**
 * The exact dialect of an annotation file, with the number of tab-delimited columns a data line must have.
 */
public enum AnnotationFileType {
    BED3(AnnotationFlavor.BED, "bed3", 3),
    BED4(AnnotationFlavor.BED, "bed4", 4),
    BED5(AnnotationFlavor.BED, "bed5", 5),
    BED6(AnnotationFlavor.BED, "bed6", 6),
    BED7(AnnotationFlavor.BED, "bed7", 7),
    BED8(AnnotationFlavor.BED, "bed8", 8),
    BED9(AnnotationFlavor.BED, "bed9", 9),
    BED10(AnnotationFlavor.BED, "bed10", 10),
    BED11(AnnotationFlavor.BED, "bed11", 11),
    BED12(AnnotationFlavor.BED, "bed12", 12),
    BED_GRAPH(AnnotationFlavor.BED, "bedGraph", 4),
    NARROW_PEAK(AnnotationFlavor.BED, "narrowPeak", 10),
    BROAD_PEAK(AnnotationFlavor.BED, "broadPeak", 9),
    GAPPED_PEAK(AnnotationFlavor.BED, "gappedPeak", 15),

    GFF3(AnnotationFlavor.GFF, "gff3", 9),
    GTF(AnnotationFlavor.GFF, "gtf", 9),

    GENE_PRED(AnnotationFlavor.UCSC, "genePred", 10),
    REF_FLAT(AnnotationFlavor.UCSC, "refFlat", 11),
    KNOWN_GENE(AnnotationFlavor.UCSC, "knownGene", 12),
    GENE_PRED_EXT(AnnotationFlavor.UCSC, "genePredExt", 15),
    GENE_PRED_EXT_BIN(AnnotationFlavor.UCSC, "genePredExtBin", 16);

    private final AnnotationFlavor flavor;
    private final String typeName;
    private final int columnCount;

    AnnotationFileType(final AnnotationFlavor flavor, final String typeName, final int columnCount) {
        this.flavor = flavor;
        this.typeName = typeName;
        this.columnCount = columnCount;
    }

    public AnnotationFlavor getFlavor() {
        return flavor;
    }

    /**
     * @return the conventional name of the dialect, e.g. {@code narrowPeak} or {@code genePredExt}
     */
    public String getTypeName() {
        return typeName;
    }

    public int getColumnCount() {
        return columnCount;
    }

    /**
     * @return true for the types whose lines carry exon blocks that are decomposed into child features
     */
    public boolean hasBlocks() {
        return this == BED12 || this == GAPPED_PEAK || flavor == AnnotationFlavor.UCSC;
    }

    /**
     * @return the plain {@code bed<N>} type for {@code columnCount} columns
     */
    public static Optional<AnnotationFileType> plainBed(final int columnCount) {
        return Arrays.stream(values())
                .filter(t -> t.typeName.equals("bed" + columnCount))
                .findFirst();
    }

    /**
     * @return the UCSC table type with {@code columnCount} columns
     */
    public static Optional<AnnotationFileType> ucscTable(final int columnCount) {
        return Arrays.stream(values())
                .filter(t -> t.flavor == AnnotationFlavor.UCSC && t.columnCount == columnCount)
                .findFirst();
    }

    /**
     * Looks a type up by its conventional name, ignoring case.
     */
    public static AnnotationFileType fromTypeName(final String typeName) {
        Utils.nonNull(typeName);
        return Arrays.stream(values())
                .filter(t -> t.typeName.equalsIgnoreCase(typeName))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown annotation file type " + typeName));
    }

    @Override
    public String toString() {
        return typeName;
    }
}
