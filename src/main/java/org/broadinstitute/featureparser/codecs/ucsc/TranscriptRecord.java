package org.broadinstitute.featureparser.codecs.ucsc;

import org.broadinstitute.featureparser.feature.FeatureNode;
import org.broadinstitute.featureparser.utils.Utils;

/**
 * A transcript decoded from one gene prediction line, with the name of the gene it belongs to.
 */
public final class TranscriptRecord {
    private final FeatureNode transcript;
    private final String geneName;

    public TranscriptRecord(final FeatureNode transcript, final String geneName) {
        this.transcript = Utils.nonNull(transcript);
        this.geneName = Utils.nonEmpty(geneName, "gene name");
    }

    public FeatureNode getTranscript() {
        return transcript;
    }

    public String getGeneName() {
        return geneName;
    }
}
