package org.broadinstitute.featureparser.codecs.ucsc;

import org.broadinstitute.featureparser.format.AnnotationFileType;
import org.broadinstitute.featureparser.format.AnnotationFlavor;
import org.broadinstitute.featureparser.utils.Utils;

/**
 * Column offsets of the UCSC gene prediction table dialects.
 *
 * All dialects share the ten genePred columns {@code name chrom strand txStart txEnd cdsStart cdsEnd exonCount
 * exonStarts exonEnds}, shifted right by one column in refFlat (leading geneName) and genePredExtBin (leading bin).
 */
public enum GenePredLayout {
    GENE_PRED(AnnotationFileType.GENE_PRED, 0, -1, -1, -1),
    REF_FLAT(AnnotationFileType.REF_FLAT, 1, 0, -1, -1),
    KNOWN_GENE(AnnotationFileType.KNOWN_GENE, 0, -1, -1, 10),
    GENE_PRED_EXT(AnnotationFileType.GENE_PRED_EXT, 0, -1, 11, -1),
    GENE_PRED_EXT_BIN(AnnotationFileType.GENE_PRED_EXT_BIN, 1, -1, 12, -1);

    private final AnnotationFileType fileType;
    private final int offset;
    private final int geneNameColumn;
    private final int name2Column;
    private final int proteinIdColumn;

    GenePredLayout(final AnnotationFileType fileType, final int offset, final int geneNameColumn,
                   final int name2Column, final int proteinIdColumn) {
        this.fileType = fileType;
        this.offset = offset;
        this.geneNameColumn = geneNameColumn;
        this.name2Column = name2Column;
        this.proteinIdColumn = proteinIdColumn;
    }

    public static GenePredLayout forFileType(final AnnotationFileType fileType) {
        Utils.validateArg(fileType.getFlavor() == AnnotationFlavor.UCSC, () -> fileType + " is not a UCSC table type");
        for (final GenePredLayout layout : values()) {
            if (layout.fileType == fileType) {
                return layout;
            }
        }
        throw new IllegalArgumentException("No column layout for " + fileType);
    }

    public AnnotationFileType getFileType() {
        return fileType;
    }

    public int getColumnCount() {
        return fileType.getColumnCount();
    }

    public int nameColumn()       { return offset; }
    public int chromColumn()      { return offset + 1; }
    public int strandColumn()     { return offset + 2; }
    public int txStartColumn()    { return offset + 3; }
    public int txEndColumn()      { return offset + 4; }
    public int cdsStartColumn()   { return offset + 5; }
    public int cdsEndColumn()     { return offset + 6; }
    public int exonCountColumn()  { return offset + 7; }
    public int exonStartsColumn() { return offset + 8; }
    public int exonEndsColumn()   { return offset + 9; }

    /** @return the refFlat gene name column, or -1 */
    public int geneNameColumn()   { return geneNameColumn; }

    /** @return the genePredExt alternate (gene) name column, or -1 */
    public int name2Column()      { return name2Column; }

    /** @return the knownGene protein id column, or -1 */
    public int proteinIdColumn()  { return proteinIdColumn; }
}
