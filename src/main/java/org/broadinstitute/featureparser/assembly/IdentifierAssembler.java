package org.broadinstitute.featureparser.assembly;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.featureparser.exceptions.UserException;
import org.broadinstitute.featureparser.feature.FeatureNode;
import org.broadinstitute.featureparser.utils.Utils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Links features to their parents by identifier, as GFF3 {@code ID} and {@code Parent} attributes do.
 *
 * <p>Linking happens in two phases. While features are added, a feature whose parent is already known is attached
 * at once; one whose parent has not been seen yet is queued as an orphan. {@link #reconcile()} then retries the queue
 * against the complete identifier table and drops the orphans that are still unresolved, counting them. The caller
 * reconciles at each {@code ###} directive and at the end of the input.</p>
 *
 * <p>A feature with several parents is linked at reconciliation time: the original goes under the first parent and a
 * deep copy under each other one, so every feature keeps a single owner.</p>
 *
 * <p>When orphans are not deferred (streaming), a feature whose parents are not all known when it is added is
 * counted as an orphan and dropped immediately.</p>
 */
public final class IdentifierAssembler {
    private static final Logger logger = LogManager.getLogger(IdentifierAssembler.class);

    private final boolean deferOrphans;
    private final Map<String, FeatureNode> featuresById = new LinkedHashMap<>();
    private final Map<String, LinkedRecord> recordsById = new HashMap<>();
    private final Map<String, Integer> segmentCounts = new HashMap<>();
    private final List<FeatureNode> roots = new ArrayList<>();
    private final List<LinkedRecord> pending = new ArrayList<>();
    private int numberOfOrphans = 0;

    private static final class LinkedRecord {
        private final FeatureNode feature;
        private final List<String> parentIds;
        private final int lineNumber;

        private LinkedRecord(final FeatureNode feature, final List<String> parentIds, final int lineNumber) {
            this.feature = feature;
            this.parentIds = parentIds;
            this.lineNumber = lineNumber;
        }
    }

    /**
     * @param deferOrphans whether unresolved parents are retried by {@link #reconcile()} rather than dropped at once
     */
    public IdentifierAssembler(final boolean deferOrphans) {
        this.deferOrphans = deferOrphans;
    }

    /**
     * Adds one decoded feature.
     *
     * @param id the feature's {@code ID}, or {@code null}
     * @param parentIds the feature's {@code Parent} values, empty for a top level feature
     * @throws UserException.DuplicateIdentifier if {@code id} was used by a feature that is not another segment of the
     *         same feature (same type, sequence and parents)
     * @throws UserException.BadInput if the feature names itself as a parent
     */
    public void add(final FeatureNode feature, final String id, final List<String> parentIds, final int lineNumber) {
        Utils.nonNull(feature);
        Utils.nonNull(parentIds);
        if (id != null && parentIds.contains(id)) {
            throw new UserException.BadInput(String.format("The feature %s at line %d names itself as its parent", id, lineNumber));
        }
        final LinkedRecord record = new LinkedRecord(feature, new ArrayList<>(parentIds), lineNumber);
        if (id != null) {
            registerId(record, id, lineNumber);
        }

        if (parentIds.isEmpty()) {
            roots.add(feature);
        } else if (parentIds.size() == 1 && featuresById.containsKey(parentIds.get(0))) {
            linkToParents(record);
        } else if (deferOrphans) {
            pending.add(record);
        } else if (featuresById.keySet().containsAll(parentIds)) {
            linkToParents(record);
        } else {
            numberOfOrphans++;
            forget(feature);
        }
    }

    private void registerId(final LinkedRecord record, final String id, final int lineNumber) {
        final LinkedRecord first = recordsById.get(id);
        if (first == null) {
            featuresById.put(id, record.feature);
            recordsById.put(id, record);
            return;
        }
        final FeatureNode firstFeature = first.feature;
        final boolean segment = firstFeature.getPrimaryTag().equals(record.feature.getPrimaryTag())
                && Objects.equals(firstFeature.getContig(), record.feature.getContig())
                && first.parentIds.equals(record.parentIds);
        if (!segment) {
            throw new UserException.DuplicateIdentifier(id, lineNumber);
        }
        final int count = segmentCounts.merge(id, 1, Integer::sum);
        record.feature.setPrimaryId(id + "." + count);
    }

    /**
     * Retries every queued orphan against the identifiers seen so far, then drops and counts the ones still
     * unresolved.
     *
     * @return the number of orphans dropped by this sweep
     */
    public int reconcile() {
        int resolved = 0;
        boolean progress = true;
        // a resolved orphan may itself be the parent of a queued one
        while (progress) {
            progress = false;
            for (final Iterator<LinkedRecord> it = pending.iterator(); it.hasNext(); ) {
                final LinkedRecord record = it.next();
                if (featuresById.keySet().containsAll(record.parentIds)
                        && !(record.parentIds.size() > 1 && dependsOnPending(record))) {
                    linkToParents(record);
                    it.remove();
                    resolved++;
                    progress = true;
                }
            }
        }
        final int dropped = pending.size();
        for (final LinkedRecord orphan : pending) {
            forget(orphan.feature);
        }
        pending.clear();
        numberOfOrphans += dropped;
        logger.debug(String.format("Reconciled %d queued features, dropped %d orphans", resolved, dropped));
        return dropped;
    }

    // copies are only made once every parent is attached, a queued parent may still be dropped
    private boolean dependsOnPending(final LinkedRecord record) {
        for (final String parentId : record.parentIds) {
            final FeatureNode parent = featuresById.get(parentId);
            for (final LinkedRecord other : pending) {
                if (other != record && isWithin(parent, other.feature)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean isWithin(final FeatureNode node, final FeatureNode ancestor) {
        for (FeatureNode current = node; current != null; current = current.getParent()) {
            if (current == ancestor) {
                return true;
            }
        }
        return false;
    }

    /**
     * @throws UserException.BadInput if a parent already lies within the record's own subtree
     */
    private void linkToParents(final LinkedRecord record) {
        for (final String parentId : record.parentIds) {
            if (isWithin(featuresById.get(parentId), record.feature)) {
                throw new UserException.BadInput(String.format(
                        "The Parent %s of the feature %s at line %d is also one of its descendants, parent links must not form a cycle",
                        parentId, record.feature.getPrimaryId(), record.lineNumber));
            }
        }
        boolean first = true;
        for (final String parentId : record.parentIds) {
            final FeatureNode parent = featuresById.get(parentId);
            parent.addChild(first ? record.feature : record.feature.deepCopy());
            first = false;
        }
    }

    // removes the ids of a dropped subtree so that later references to them become orphans too
    private void forget(final FeatureNode dropped) {
        featuresById.values().removeIf(f -> isWithin(f, dropped));
        recordsById.values().removeIf(r -> isWithin(r.feature, dropped));
    }

    /**
     * @return the top level features, in input order
     */
    public List<FeatureNode> getRoots() {
        return Collections.unmodifiableList(roots);
    }

    /**
     * @return the features that carried an {@code ID}, by that id
     */
    public Collection<FeatureNode> getIdentifiedFeatures() {
        return Collections.unmodifiableCollection(featuresById.values());
    }

    public boolean hasPending() {
        return !pending.isEmpty();
    }

    public int getNumberOfOrphans() {
        return numberOfOrphans;
    }
}
