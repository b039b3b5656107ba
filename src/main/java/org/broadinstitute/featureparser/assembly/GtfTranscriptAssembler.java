package org.broadinstitute.featureparser.assembly;

import com.google.common.collect.ImmutableMap;
import org.broadinstitute.featureparser.exceptions.UserException;
import org.broadinstitute.featureparser.feature.FeatureNode;
import org.broadinstitute.featureparser.feature.FeatureNodeFactory;
import org.broadinstitute.featureparser.feature.FeatureTypes;
import org.broadinstitute.featureparser.utils.Utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds gene and transcript trees from GTF records, which name their gene and transcript through the
 * {@code gene_id} and {@code transcript_id} attributes instead of pointing at a parent record.
 *
 * <p>Genes and transcripts that have no record of their own are synthesized from the first record naming them and
 * widened to cover all of their records. A gene or transcript record arriving after its synthesized stand-in takes
 * over the stand-in's place and children.</p>
 *
 * <p>After {@link #finish()}, a transcript with at least one CDS record is tagged mRNA, any other transcript gets a
 * noncoding tag from its {@code transcript_type} or {@code transcript_biotype} attribute.</p>
 */
public final class GtfTranscriptAssembler {
    public static final String GENE_ID = "gene_id";
    public static final String TRANSCRIPT_ID = "transcript_id";
    public static final String GENE_NAME = "gene_name";
    public static final String TRANSCRIPT_NAME = "transcript_name";
    private static final List<String> BIOTYPE_ATTRIBUTES = Collections.unmodifiableList(Arrays.asList(
            "transcript_type", "transcript_biotype", "gene_type", "gene_biotype"));

    private static final Map<String, String> SUBFEATURE_TAGS = ImmutableMap.<String, String>builder()
            .put("exon", FeatureTypes.EXON)
            .put("cds", FeatureTypes.CDS)
            .put("start_codon", FeatureTypes.START_CODON)
            .put("stop_codon", FeatureTypes.STOP_CODON)
            .put("five_prime_utr", FeatureTypes.FIVE_PRIME_UTR)
            .put("5utr", FeatureTypes.FIVE_PRIME_UTR)
            .put("three_prime_utr", FeatureTypes.THREE_PRIME_UTR)
            .put("3utr", FeatureTypes.THREE_PRIME_UTR)
            .put("utr", "UTR")
            .build();

    private final FeatureNodeFactory factory;
    private final SubfeatureFlags flags;
    private final boolean doGene;

    private final List<FeatureNode> topLevel = new ArrayList<>();
    private final Map<String, FeatureNode> genes = new LinkedHashMap<>();
    private final Map<String, FeatureNode> transcripts = new LinkedHashMap<>();
    private final Set<FeatureNode> synthesized = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Set<String> codingTranscripts = new HashSet<>();

    /**
     * @param doGene whether transcripts are grouped under genes; when false, gene records are ignored and transcripts
     *               are the top level features
     */
    public GtfTranscriptAssembler(final FeatureNodeFactory factory, final SubfeatureFlags flags, final boolean doGene) {
        this.factory = Utils.nonNull(factory);
        this.flags = Utils.nonNull(flags);
        this.doGene = doGene;
    }

    /**
     * Adds one decoded GTF record.
     *
     * @param geneId value of {@code gene_id}, may be {@code null}
     * @param transcriptId value of {@code transcript_id}, may be {@code null}
     */
    public void add(final FeatureNode record, final String geneId, final String transcriptId) {
        Utils.nonNull(record);
        final String type = record.getPrimaryTag();
        if (FeatureTypes.GENE.equalsIgnoreCase(type) && geneId != null) {
            if (doGene) {
                addGene(record, geneId);
            }
        } else if (FeatureTypes.isTranscriptTag(type) && transcriptId != null) {
            addTranscript(record, geneId, transcriptId);
        } else if (transcriptId != null) {
            addSubfeature(record, geneId, transcriptId);
        } else if (geneId != null && doGene) {
            gene(geneId, record).addChild(record);
        } else {
            topLevel.add(record);
        }
    }

    private void addGene(final FeatureNode record, final String geneId) {
        final FeatureNode existing = genes.get(geneId);
        if (existing == null) {
            genes.put(geneId, record);
            topLevel.add(record);
        } else if (synthesized.contains(existing)) {
            replace(existing, record);
            genes.put(geneId, record);
        } else {
            cover(existing, record);
        }
    }

    private void addTranscript(final FeatureNode record, final String geneId, final String transcriptId) {
        final FeatureNode existing = transcripts.get(transcriptId);
        if (existing == null) {
            transcripts.put(transcriptId, record);
            attachTranscript(record, geneId);
        } else if (synthesized.contains(existing)) {
            replace(existing, record);
            transcripts.put(transcriptId, record);
        } else {
            cover(existing, record);
        }
    }

    private void addSubfeature(final FeatureNode record, final String geneId, final String transcriptId) {
        final String tag = SUBFEATURE_TAGS.get(record.getPrimaryTag().toLowerCase(Locale.ROOT));
        if (tag != null) {
            record.setPrimaryTag(tag);
        }
        final FeatureNode transcript = transcript(transcriptId, geneId, record);
        if (FeatureTypes.CDS.equals(record.getPrimaryTag())) {
            codingTranscripts.add(transcriptId);
        }
        if (keep(record.getPrimaryTag())) {
            transcript.addChild(record);
        }
    }

    private boolean keep(final String tag) {
        switch (tag) {
            case FeatureTypes.EXON:
                return flags.doExon();
            case FeatureTypes.CDS:
                return flags.doCds();
            case FeatureTypes.FIVE_PRIME_UTR:
            case FeatureTypes.THREE_PRIME_UTR:
            case "UTR":
                return flags.doUtr();
            case FeatureTypes.START_CODON:
            case FeatureTypes.STOP_CODON:
                return flags.doCodon();
            default:
                return true;
        }
    }

    private FeatureNode transcript(final String transcriptId, final String geneId, final FeatureNode record) {
        FeatureNode transcript = transcripts.get(transcriptId);
        if (transcript == null) {
            transcript = synthesize(record, FeatureTypes.TRANSCRIPT, transcriptId, TRANSCRIPT_NAME);
            transcripts.put(transcriptId, transcript);
            attachTranscript(transcript, geneId);
        } else if (synthesized.contains(transcript)) {
            widen(transcript, record);
        }
        return transcript;
    }

    private void attachTranscript(final FeatureNode transcript, final String geneId) {
        if (doGene && geneId != null) {
            gene(geneId, transcript).addChild(transcript);
        } else {
            topLevel.add(transcript);
        }
    }

    private FeatureNode gene(final String geneId, final FeatureNode record) {
        FeatureNode gene = genes.get(geneId);
        if (gene == null) {
            gene = synthesize(record, FeatureTypes.GENE, geneId, GENE_NAME);
            genes.put(geneId, gene);
            topLevel.add(gene);
        } else if (synthesized.contains(gene)) {
            widen(gene, record);
        }
        return gene;
    }

    private FeatureNode synthesize(final FeatureNode record, final String tag, final String id, final String nameAttribute) {
        final FeatureNode node = factory.newFeature(record.getContig(), record.getStart(), record.getEnd(), record.getStrand(), tag);
        node.setPrimaryId(id);
        node.setSourceTag(record.getSourceTag());
        node.setDisplayName(record.getAttribute(nameAttribute));
        copyAttribute(record, node, GENE_ID);
        copyAttribute(record, node, GENE_NAME);
        if (FeatureTypes.TRANSCRIPT.equals(tag)) {
            copyAttribute(record, node, TRANSCRIPT_ID);
            copyAttribute(record, node, TRANSCRIPT_NAME);
            BIOTYPE_ATTRIBUTES.forEach(a -> copyAttribute(record, node, a));
        }
        synthesized.add(node);
        return node;
    }

    private static void copyAttribute(final FeatureNode from, final FeatureNode to, final String tag) {
        from.getAttributeValues(tag).forEach(v -> to.addAttribute(tag, v));
    }

    // widens a synthesized node and, transitively, its synthesized parent
    private void widen(final FeatureNode node, final FeatureNode record) {
        for (FeatureNode current = node; current != null && synthesized.contains(current); current = current.getParent()) {
            cover(current, record);
        }
    }

    private static void cover(final FeatureNode node, final FeatureNode record) {
        if (!node.getContig().equals(record.getContig())) {
            throw new UserException.BadInput(String.format("%s %s has records on both %s and %s",
                    node.getPrimaryTag(), node.getPrimaryId(), node.getContig(), record.getContig()));
        }
        node.extendTo(record);
    }

    private void replace(final FeatureNode standIn, final FeatureNode record) {
        for (final FeatureNode child : standIn.removeChildren()) {
            record.addChild(child);
        }
        final FeatureNode parent = standIn.getParent();
        if (parent != null) {
            parent.removeChild(standIn);
            widen(parent, record);
            parent.addChild(record);
        } else {
            topLevel.set(topLevel.indexOf(standIn), record);
        }
        synthesized.remove(standIn);
    }

    /**
     * Tags the transcripts and returns the top level features in order of first appearance.
     */
    public List<FeatureNode> finish() {
        for (final Map.Entry<String, FeatureNode> entry : transcripts.entrySet()) {
            final FeatureNode transcript = entry.getValue();
            if (codingTranscripts.contains(entry.getKey())) {
                transcript.setPrimaryTag(FeatureTypes.MRNA);
            } else {
                transcript.setPrimaryTag(FeatureTypes.noncodingTagFor(biotype(transcript)));
            }
        }
        return new ArrayList<>(topLevel);
    }

    private static String biotype(final FeatureNode transcript) {
        for (final String attribute : BIOTYPE_ATTRIBUTES) {
            final String value = transcript.getAttribute(attribute);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    /**
     * @return every gene and transcript by its id, for lookup
     */
    public Map<String, FeatureNode> getIdentifiedFeatures() {
        final Map<String, FeatureNode> identified = new LinkedHashMap<>(genes);
        identified.putAll(transcripts);
        return identified;
    }
}
