package org.broadinstitute.featureparser.assembly;

import org.broadinstitute.featureparser.feature.FeatureNode;
import org.broadinstitute.featureparser.feature.FeatureNodeFactory;
import org.broadinstitute.featureparser.feature.FeatureTypes;
import org.broadinstitute.featureparser.utils.Utils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Groups transcripts under gene features. Transcripts belong to the same gene when they carry the same gene name,
 * lie on the same sequence and strand, and overlap the extent of the gene built so far. The gene spans the union of
 * its transcripts.
 *
 * {@link #add} groups across the whole input, genes are returned in order of their first transcript.
 * {@link #newGene}, {@link #belongsTo} and {@link #join} let a streaming reader group adjacent transcripts only.
 */
public final class GeneAssembler {
    private final FeatureNodeFactory factory;
    private final List<FeatureNode> genes = new ArrayList<>();
    private final Map<String, List<FeatureNode>> genesByKey = new HashMap<>();

    public GeneAssembler(final FeatureNodeFactory factory) {
        this.factory = Utils.nonNull(factory);
    }

    /**
     * Adds {@code transcript} to an existing overlapping gene named {@code geneName}, or to a new gene.
     * A transcript bridging two genes of the same name merges them.
     */
    public void add(final FeatureNode transcript, final String geneName) {
        Utils.nonNull(transcript);
        Utils.nonEmpty(geneName, "gene name");
        final List<FeatureNode> candidates = genesByKey.computeIfAbsent(key(transcript, geneName), k -> new ArrayList<>());
        FeatureNode target = null;
        for (final Iterator<FeatureNode> it = candidates.iterator(); it.hasNext(); ) {
            final FeatureNode gene = it.next();
            if (!overlaps(gene, transcript)) {
                continue;
            }
            if (target == null) {
                target = gene;
            } else {
                for (final FeatureNode moved : gene.removeChildren()) {
                    join(target, moved);
                }
                it.remove();
                genes.remove(gene);
            }
        }
        if (target == null) {
            target = newGene(transcript, geneName);
            candidates.add(target);
            genes.add(target);
        } else {
            join(target, transcript);
        }
    }

    /**
     * @return the genes assembled so far
     */
    public List<FeatureNode> getGenes() {
        return new ArrayList<>(genes);
    }

    /**
     * @return a new gene named {@code geneName} holding {@code transcript}
     */
    public FeatureNode newGene(final FeatureNode transcript, final String geneName) {
        final FeatureNode gene = factory.newFeature(transcript.getContig(), transcript.getStart(), transcript.getEnd(),
                transcript.getStrand(), FeatureTypes.GENE);
        gene.setPrimaryId(geneName);
        gene.setDisplayName(geneName);
        gene.addChild(transcript);
        return gene;
    }

    /**
     * @return true if {@code transcript} with gene name {@code geneName} may be added to {@code gene}
     */
    public static boolean belongsTo(final FeatureNode gene, final FeatureNode transcript, final String geneName) {
        return gene.getDisplayName().equals(geneName)
                && gene.getContig().equals(transcript.getContig())
                && gene.getStrand() == transcript.getStrand()
                && overlaps(gene, transcript);
    }

    /**
     * Adds {@code transcript} to {@code gene}, widening the gene as needed.
     */
    public static void join(final FeatureNode gene, final FeatureNode transcript) {
        gene.extendTo(transcript);
        gene.addChild(transcript);
    }

    private static boolean overlaps(final FeatureNode a, final FeatureNode b) {
        return a.getStart() <= b.getEnd() && b.getStart() <= a.getEnd();
    }

    private static String key(final FeatureNode transcript, final String geneName) {
        return geneName + '\t' + transcript.getContig() + '\t' + transcript.getStrand().encode();
    }
}
