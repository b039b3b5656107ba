package org.broadinstitute.featureparser.format;

/**
 * Coarse family of an annotation file, selecting which parser decodes it.
 */
public enum AnnotationFlavor {
    /** BED3 to BED12, bedGraph and the ENCODE peak formats, 0-based half-open. */
    BED,
    /** GFF3 and GTF, 1-based closed. */
    GFF,
    /** UCSC gene prediction tables, 0-based half-open. */
    UCSC
}
