package org.broadinstitute.featureparser.feature;

import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import htsjdk.tribble.Feature;
import htsjdk.tribble.annotation.Strand;
import org.broadinstitute.featureparser.utils.ClassUtils;
import org.broadinstitute.featureparser.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One annotated genomic interval with an ordered list of owned children.
 *
 * Coordinates are always 1-based and closed, whatever the convention of the file the node was decoded from.
 * A child has exactly one parent; children are kept ordered by position along the parent's strand.
 *
 * Subclasses may be substituted through the {@code feature-class} parser argument, they must provide a public
 * no-arg constructor.
 */
public class FeatureNode implements Feature {

    /** Orders by start then end, ascending. */
    public static final Comparator<FeatureNode> FORWARD_ORDER =
            Comparator.comparingInt(FeatureNode::getStart).thenComparingInt(FeatureNode::getEnd);

    /** Orders by end then start, descending. */
    public static final Comparator<FeatureNode> REVERSE_ORDER =
            Comparator.comparingInt(FeatureNode::getEnd).thenComparingInt(FeatureNode::getStart).reversed();

    private String primaryId;
    private String displayName;
    private String seqId;
    private int start;
    private int end;
    private Strand strand = Strand.NONE;
    private String primaryTag = FeatureTypes.REGION;
    private String sourceTag;
    private Double score;
    private final ListMultimap<String, String> attributes = MultimapBuilder.linkedHashKeys().arrayListValues().build();
    private final List<FeatureNode> children = new ArrayList<>();
    private FeatureNode parent;

    public FeatureNode() {}

    /**
     * Sets the location of this node.
     * @param seqId chromosome or contig name, never {@code null}
     * @param start 1-based inclusive start
     * @param end 1-based inclusive end, never less than {@code start}
     */
    public void setLocation(final String seqId, final int start, final int end) {
        Utils.nonEmpty(seqId, "seq_id");
        Utils.validateArg(start >= 1, () -> "start must be 1 or greater but was " + start);
        Utils.validateArg(end >= start, () -> String.format("end %d is less than start %d for %s", end, start, seqId));
        this.seqId = seqId;
        this.start = start;
        this.end = end;
    }

    /**
     * Widens this node so that it also covers {@code other}, which must be on the same sequence.
     */
    public void extendTo(final FeatureNode other) {
        Utils.nonNull(other);
        if (seqId == null) {
            setLocation(other.getContig(), other.getStart(), other.getEnd());
            return;
        }
        Utils.validateArg(seqId.equals(other.getContig()),
                () -> "cannot extend " + this + " to a feature on another sequence: " + other);
        setLocation(seqId, Math.min(start, other.getStart()), Math.max(end, other.getEnd()));
    }

    @Override
    public String getContig() {
        return seqId;
    }

    public String getSeqId() {
        return seqId;
    }

    @Override
    public int getStart() {
        return start;
    }

    @Override
    public int getEnd() {
        return end;
    }

    public int getLength() {
        return end - start + 1;
    }

    public Strand getStrand() {
        return strand;
    }

    public void setStrand(final Strand strand) {
        this.strand = Utils.nonNull(strand);
    }

    public String getPrimaryId() {
        return primaryId;
    }

    public void setPrimaryId(final String primaryId) {
        this.primaryId = primaryId;
    }

    /**
     * Renames this node and the descendants whose ids were derived from their parent's id
     * (i.e. start with the parent's old id followed by a dot). A child whose id is not derived from its parent's
     * keeps it, and so does its subtree.
     */
    public void renamePrimaryId(final String newId) {
        Utils.nonEmpty(newId, "primary id");
        final String oldId = primaryId;
        primaryId = newId;
        if (oldId != null) {
            renameDerivedChildren(oldId, newId);
        }
    }

    private void renameDerivedChildren(final String oldId, final String newId) {
        final String oldPrefix = oldId + ".";
        for (final FeatureNode child : children) {
            final String childId = child.getPrimaryId();
            if (childId != null && childId.startsWith(oldPrefix)) {
                final String newChildId = newId + "." + childId.substring(oldPrefix.length());
                child.primaryId = newChildId;
                child.renameDerivedChildren(childId, newChildId);
            }
        }
    }

    /**
     * @return the display name, or the primary id when no name was given
     */
    public String getDisplayName() {
        return displayName != null ? displayName : primaryId;
    }

    public boolean hasDisplayName() {
        return displayName != null;
    }

    public void setDisplayName(final String displayName) {
        this.displayName = displayName;
    }

    public String getPrimaryTag() {
        return primaryTag;
    }

    public void setPrimaryTag(final String primaryTag) {
        this.primaryTag = Utils.nonEmpty(primaryTag, "primary tag");
    }

    public String getSourceTag() {
        return sourceTag;
    }

    public void setSourceTag(final String sourceTag) {
        this.sourceTag = sourceTag;
    }

    /**
     * @return the score or {@code null} when the record carried none
     */
    public Double getScore() {
        return score;
    }

    public void setScore(final Double score) {
        this.score = score;
    }

    public void addAttribute(final String tag, final String value) {
        Utils.nonEmpty(tag, "attribute tag");
        attributes.put(tag, Utils.nonNull(value, "attribute value"));
    }

    public boolean hasAttribute(final String tag) {
        return attributes.containsKey(tag);
    }

    /**
     * @return all values of {@code tag} in insertion order, empty if absent
     */
    public List<String> getAttributeValues(final String tag) {
        return Collections.unmodifiableList(attributes.get(tag));
    }

    /**
     * @return the first value of {@code tag} or {@code null}
     */
    public String getAttribute(final String tag) {
        final List<String> values = attributes.get(tag);
        return values.isEmpty() ? null : values.get(0);
    }

    public List<String> removeAttribute(final String tag) {
        return attributes.removeAll(tag);
    }

    public List<String> getAttributeTags() {
        return new ArrayList<>(attributes.keySet());
    }

    /**
     * Attaches {@code child} to this node, keeping children ordered along this node's strand.
     * Nodes with equal positions keep their insertion order.
     *
     * @throws IllegalArgumentException if the child already has a parent
     */
    public void addChild(final FeatureNode child) {
        Utils.nonNull(child, "child");
        Utils.validateArg(child.parent == null, () -> "feature " + child.getPrimaryId() + " already belongs to " + child.parent.getPrimaryId());
        Utils.validateArg(child != this, "a feature cannot be its own child");
        final Comparator<FeatureNode> order = strand == Strand.NEGATIVE ? REVERSE_ORDER : FORWARD_ORDER;
        int insertAt = children.size();
        while (insertAt > 0 && order.compare(children.get(insertAt - 1), child) > 0) {
            insertAt--;
        }
        children.add(insertAt, child);
        child.parent = this;
    }

    /**
     * Detaches {@code child} from this node.
     * @return true if it was a child of this node
     */
    public boolean removeChild(final FeatureNode child) {
        Utils.nonNull(child);
        if (child.parent != this) {
            return false;
        }
        children.remove(child);
        child.parent = null;
        return true;
    }

    /**
     * Detaches and returns all children of this node.
     */
    public List<FeatureNode> removeChildren() {
        final List<FeatureNode> removed = new ArrayList<>(children);
        children.clear();
        removed.forEach(c -> c.parent = null);
        return removed;
    }

    public List<FeatureNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public List<FeatureNode> getChildren(final String primaryTag) {
        return children.stream().filter(c -> c.getPrimaryTag().equals(primaryTag)).collect(Collectors.toList());
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    public FeatureNode getParent() {
        return parent;
    }

    /**
     * Returns a detached copy of this node and all its descendants, made with the same concrete class.
     */
    public FeatureNode deepCopy() {
        final FeatureNode copy = ClassUtils.makeInstanceOf(getClass());
        copy.primaryId = primaryId;
        copy.displayName = displayName;
        copy.seqId = seqId;
        copy.start = start;
        copy.end = end;
        copy.strand = strand;
        copy.primaryTag = primaryTag;
        copy.sourceTag = sourceTag;
        copy.score = score;
        copy.attributes.putAll(attributes);
        for (final FeatureNode child : children) {
            copy.addChild(child.deepCopy());
        }
        return copy;
    }

    /**
     * Decodes a strand column: {@code +} or {@code 1} is forward, {@code -} or {@code -1} is reverse,
     * {@code .}, {@code 0}, {@code ?} or an empty value is unknown.
     *
     * @throws IllegalArgumentException for any other value
     */
    public static Strand decodeStrand(final String value) {
        if (value == null) {
            return Strand.NONE;
        }
        switch (value) {
            case "+":
            case "1":
                return Strand.POSITIVE;
            case "-":
            case "-1":
                return Strand.NEGATIVE;
            case ".":
            case "0":
            case "?":
            case "":
                return Strand.NONE;
            default:
                throw new IllegalArgumentException("Invalid strand value " + value);
        }
    }

    @Override
    public String toString() {
        return String.format("%s %s %s:%d-%d(%s)", primaryTag, primaryId, seqId, start, end, strand.encode());
    }
}
