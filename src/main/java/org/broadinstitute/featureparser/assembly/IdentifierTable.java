package org.broadinstitute.featureparser.assembly;

import org.broadinstitute.featureparser.feature.FeatureNode;
import org.broadinstitute.featureparser.utils.Utils;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Primary id to feature lookup for one parsed file.
 *
 * Colliding ids are made unique by appending {@code .1}, {@code .2}, ... to the later feature's id.
 */
public final class IdentifierTable {
    private final Map<String, FeatureNode> features = new LinkedHashMap<>();

    /**
     * Registers {@code feature}, renaming it (and the descendants whose ids derive from its id) if its
     * primary id is already taken by another feature.
     *
     * @return the id the feature was registered under
     */
    public String register(final FeatureNode feature) {
        Utils.nonNull(feature);
        final String id = Utils.nonNull(feature.getPrimaryId(), () -> "feature without a primary id: " + feature);
        final FeatureNode existing = features.get(id);
        if (existing == feature) {
            return id;
        }
        if (existing == null) {
            features.put(id, feature);
            return id;
        }
        final String unique = uniqueId(id);
        feature.renamePrimaryId(unique);
        features.put(unique, feature);
        return unique;
    }

    /**
     * Registers {@code feature} under its primary id unless that id is already taken, in which case the earlier
     * feature keeps it and {@code feature} is not renamed.
     *
     * @return true if the feature was registered
     */
    public boolean registerIfAbsent(final FeatureNode feature) {
        Utils.nonNull(feature);
        final String id = feature.getPrimaryId();
        if (id == null || features.containsKey(id)) {
            return false;
        }
        features.put(id, feature);
        return true;
    }

    /**
     * @return {@code id} if unused, otherwise the first of {@code id.1}, {@code id.2}, ... that is unused
     */
    public String uniqueId(final String id) {
        if (!features.containsKey(id)) {
            return id;
        }
        int suffix = 1;
        while (features.containsKey(id + "." + suffix)) {
            suffix++;
        }
        return id + "." + suffix;
    }

    public boolean contains(final String id) {
        return features.containsKey(id);
    }

    /**
     * @return the feature registered as {@code id} or {@code null}
     */
    public FeatureNode get(final String id) {
        return features.get(id);
    }

    public int size() {
        return features.size();
    }

    public Collection<FeatureNode> getFeatures() {
        return Collections.unmodifiableCollection(features.values());
    }
}
