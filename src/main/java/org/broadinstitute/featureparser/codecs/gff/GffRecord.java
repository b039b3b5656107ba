package org.broadinstitute.featureparser.codecs.gff;

import org.broadinstitute.featureparser.feature.FeatureNode;
import org.broadinstitute.featureparser.utils.Utils;

import java.util.Collections;
import java.util.List;

/**
 * A feature decoded from one GFF3 or GTF line together with its linkage hints, which the assemblers resolve.
 */
public final class GffRecord {
    private final FeatureNode feature;
    private final String id;
    private final List<String> parentIds;
    private final String geneId;
    private final String transcriptId;

    public GffRecord(final FeatureNode feature, final String id, final List<String> parentIds,
                     final String geneId, final String transcriptId) {
        this.feature = Utils.nonNull(feature);
        this.id = id;
        this.parentIds = Collections.unmodifiableList(Utils.nonNull(parentIds));
        this.geneId = geneId;
        this.transcriptId = transcriptId;
    }

    public FeatureNode getFeature() {
        return feature;
    }

    /**
     * @return the GFF3 {@code ID}, or {@code null}
     */
    public String getId() {
        return id;
    }

    /**
     * @return the GFF3 {@code Parent} values, empty for top level records and for GTF
     */
    public List<String> getParentIds() {
        return parentIds;
    }

    public boolean isRoot() {
        return parentIds.isEmpty();
    }

    /**
     * @return the GTF {@code gene_id}, or {@code null}
     */
    public String getGeneId() {
        return geneId;
    }

    /**
     * @return the GTF {@code transcript_id}, or {@code null}
     */
    public String getTranscriptId() {
        return transcriptId;
    }
}
