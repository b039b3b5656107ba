package org.broadinstitute.featureparser.cmdline.argumentcollections;

import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.featureparser.feature.FeatureNode;
import org.broadinstitute.featureparser.utils.ClassUtils;

import java.io.Serializable;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Switches accepted by an annotation parser. Intended to be used as an @ArgumentCollection by command line tools
 * that read annotation files, or populated directly by calling code.
 */
public class ParserArgumentCollection implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final String DO_GENE_LONG_NAME = "do-gene";
    public static final String DO_EXON_LONG_NAME = "do-exon";
    public static final String DO_CDS_LONG_NAME = "do-cds";
    public static final String DO_UTR_LONG_NAME = "do-utr";
    public static final String DO_CODON_LONG_NAME = "do-codon";
    public static final String SIMPLIFY_LONG_NAME = "simplify";
    public static final String SOURCE_LONG_NAME = "source";
    public static final String FEATURE_CLASS_LONG_NAME = "feature-class";
    public static final String REFSEQ_SUMMARY_LONG_NAME = "refseq-summary";
    public static final String REFSEQ_STATUS_LONG_NAME = "refseq-status";
    public static final String KGXREF_LONG_NAME = "kgxref";
    public static final String ENSEMBL_TO_GENE_NAME_LONG_NAME = "ensembl-to-gene-name";
    public static final String ENSEMBL_SOURCE_LONG_NAME = "ensembl-source";

    /**
     * Group transcripts under gene features (UCSC tables and GTF). Has no effect on BED files. When not given,
     * genes are assembled.
     */
    @Argument(fullName = DO_GENE_LONG_NAME, doc = "Assemble gene level parent features", optional = true)
    public Boolean doGene = null;

    @Argument(fullName = DO_EXON_LONG_NAME, doc = "Include exon subfeatures", optional = true)
    public boolean doExon = false;

    @Argument(fullName = DO_CDS_LONG_NAME, doc = "Include CDS subfeatures", optional = true)
    public boolean doCds = false;

    @Argument(fullName = DO_UTR_LONG_NAME, doc = "Include five and three prime UTR subfeatures", optional = true)
    public boolean doUtr = false;

    @Argument(fullName = DO_CODON_LONG_NAME, doc = "Include start and stop codon subfeatures", optional = true)
    public boolean doCodon = false;

    /**
     * Drops every GFF attribute that does not carry structure or naming (e.g. {@code Dbxref}, {@code Ontology_term}).
     */
    @Argument(fullName = SIMPLIFY_LONG_NAME, doc = "Keep only the identifier, parent and name attributes of GFF features", optional = true)
    public boolean simplify = false;

    @Argument(fullName = SOURCE_LONG_NAME, doc = "Source tag given to every feature, by default the file base name (or the GFF source column)", optional = true)
    public String source = null;

    /**
     * Fully qualified name of a {@link FeatureNode} subclass with a public no-arg constructor.
     */
    @Argument(fullName = FEATURE_CLASS_LONG_NAME, doc = "Feature implementation class to instantiate", optional = true)
    public String featureClass = null;

    @Argument(fullName = REFSEQ_SUMMARY_LONG_NAME, doc = "UCSC refSeqSummary table, adds completeness and summary to RefSeq transcripts", optional = true)
    public String refSeqSummary = null;

    @Argument(fullName = REFSEQ_STATUS_LONG_NAME, doc = "UCSC refSeqStatus table, adds status and molecule type to RefSeq transcripts", optional = true)
    public String refSeqStatus = null;

    @Argument(fullName = KGXREF_LONG_NAME, doc = "UCSC kgXref table, adds gene symbols and descriptions to knownGene transcripts", optional = true)
    public String kgXref = null;

    @Argument(fullName = ENSEMBL_TO_GENE_NAME_LONG_NAME, doc = "UCSC ensemblToGeneName table, adds gene names to Ensembl transcripts", optional = true)
    public String ensemblToGeneName = null;

    @Argument(fullName = ENSEMBL_SOURCE_LONG_NAME, doc = "UCSC ensemblSource table, adds biotypes to Ensembl transcripts", optional = true)
    public String ensemblSource = null;

    public boolean isDoGene() {
        return doGene == null || doGene;
    }

    public boolean isDoGeneGiven() {
        return doGene != null;
    }

    public boolean hasUcscTables() {
        return refSeqSummary != null || refSeqStatus != null || kgXref != null || ensemblToGeneName != null || ensemblSource != null;
    }

    /**
     * @return the feature class to instantiate
     * @throws org.broadinstitute.featureparser.exceptions.UserException.BadInput if the class can not be used
     */
    public Class<? extends FeatureNode> getFeatureClass() {
        return featureClass == null ? FeatureNode.class : ClassUtils.forName(featureClass, FeatureNode.class);
    }

    public static Path toPath(final String table) {
        return table == null ? null : Paths.get(table);
    }
}
