package org.broadinstitute.featureparser.feature;

import htsjdk.tribble.annotation.Strand;
import org.broadinstitute.featureparser.utils.ClassUtils;
import org.broadinstitute.featureparser.utils.Utils;

/**
 * Creates {@link FeatureNode}s of one concrete class, stamped with one source tag.
 */
public final class FeatureNodeFactory {
    private final Class<? extends FeatureNode> featureClass;
    private final String sourceTag;

    public FeatureNodeFactory(final Class<? extends FeatureNode> featureClass, final String sourceTag) {
        Utils.nonNull(featureClass, "feature class");
        Utils.validateArg(ClassUtils.canMakeInstances(featureClass),
                () -> featureClass.getName() + " needs a public no-arg constructor");
        this.featureClass = featureClass;
        this.sourceTag = sourceTag;
    }

    public FeatureNodeFactory(final String sourceTag) {
        this(FeatureNode.class, sourceTag);
    }

    public FeatureNode newFeature() {
        final FeatureNode node = ClassUtils.makeInstanceOf(featureClass);
        node.setSourceTag(sourceTag);
        return node;
    }

    /**
     * @param start 1-based inclusive start
     * @param end 1-based inclusive end
     */
    public FeatureNode newFeature(final String seqId, final int start, final int end, final Strand strand, final String primaryTag) {
        final FeatureNode node = newFeature();
        node.setLocation(seqId, start, end);
        node.setStrand(strand);
        node.setPrimaryTag(primaryTag);
        return node;
    }

    public Class<? extends FeatureNode> getFeatureClass() {
        return featureClass;
    }

    public String getSourceTag() {
        return sourceTag;
    }
}
