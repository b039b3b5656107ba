package org.broadinstitute.featureparser.feature;

import java.util.Locale;

/**
 * Primary tags produced by the decoders and assemblers.
 */
public final class FeatureTypes {
    private FeatureTypes(){}

    public static final String GENE = "gene";
    public static final String MRNA = "mRNA";
    public static final String NCRNA = "ncRNA";
    public static final String TRANSCRIPT = "transcript";
    public static final String EXON = "exon";
    public static final String CDS = "CDS";
    public static final String FIVE_PRIME_UTR = "five_prime_UTR";
    public static final String THREE_PRIME_UTR = "three_prime_UTR";
    public static final String START_CODON = "start_codon";
    public static final String STOP_CODON = "stop_codon";
    public static final String REGION = "region";
    public static final String PEAK = "peak";
    public static final String GAPPED_PEAK = "gappedPeak";

    public static final String RRNA = "rRNA";
    public static final String TRNA = "tRNA";
    public static final String SNRNA = "snRNA";
    public static final String SNORNA = "snoRNA";
    public static final String MIRNA = "miRNA";
    public static final String LNC_RNA = "lnc_RNA";
    public static final String PSEUDOGENIC_TRANSCRIPT = "pseudogenic_transcript";

    /**
     * Chooses the primary tag of a transcript without coding sequence from a molecule type or biotype,
     * as found in the UCSC refSeqStatus and ensemblSource tables or the GTF {@code transcript_type} attribute.
     *
     * @param moleculeOrBiotype may be {@code null}
     * @return a noncoding RNA tag, {@link #NCRNA} when nothing more specific is known
     */
    public static String noncodingTagFor(final String moleculeOrBiotype) {
        if (moleculeOrBiotype == null) {
            return NCRNA;
        }
        final String type = moleculeOrBiotype.toLowerCase(Locale.ROOT);
        if (type.contains("pseudogene")) {
            return PSEUDOGENIC_TRANSCRIPT;
        } else if (type.contains("snorna")) {
            return SNORNA;
        } else if (type.contains("snrna")) {
            return SNRNA;
        } else if (type.contains("mirna") || type.contains("microrna")) {
            return MIRNA;
        } else if (type.contains("trna")) {
            return TRNA;
        } else if (type.contains("rrna")) {
            return RRNA;
        } else if (type.contains("lincrna") || type.contains("lncrna") || type.contains("lnc_rna")
                || type.equals("antisense") || type.equals("processed_transcript")) {
            return LNC_RNA;
        }
        return NCRNA;
    }

    /**
     * @return true for the tags that may be assigned to a transcript root built from an exon list
     */
    public static boolean isTranscriptTag(final String primaryTag) {
        return MRNA.equals(primaryTag) || TRANSCRIPT.equals(primaryTag) || primaryTag.endsWith("RNA")
                || primaryTag.endsWith("transcript");
    }
}
