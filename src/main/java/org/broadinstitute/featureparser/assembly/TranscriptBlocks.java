package org.broadinstitute.featureparser.assembly;

import htsjdk.samtools.util.Interval;
import htsjdk.tribble.annotation.Strand;
import org.broadinstitute.featureparser.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The flat description of a transcript shared by BED12, gappedPeak and UCSC gene prediction lines: its extent,
 * its coding range and its exons. All coordinates are 1-based and closed.
 */
public final class TranscriptBlocks {
    private final String id;
    private final String name;
    private final String seqId;
    private final Strand strand;
    private final int txStart;
    private final int txEnd;
    private final int cdsStart;
    private final int cdsEnd;
    private final List<Interval> exons;
    private final String noncodingTag;

    /**
     * @param id primary id given to the transcript
     * @param name display name, may be {@code null}
     * @param cdsStart first coding base; a transcript with {@code cdsStart > cdsEnd} has no coding sequence
     * @param cdsEnd last coding base
     * @param exons exon intervals, in any order
     * @param noncodingTag primary tag used when the transcript has no coding sequence
     */
    public TranscriptBlocks(final String id, final String name, final String seqId, final Strand strand,
                            final int txStart, final int txEnd, final int cdsStart, final int cdsEnd,
                            final List<Interval> exons, final String noncodingTag) {
        this.id = Utils.nonEmpty(id, "transcript id");
        this.name = name;
        this.seqId = Utils.nonEmpty(seqId, "seq_id");
        this.strand = Utils.nonNull(strand);
        Utils.validateArg(txStart <= txEnd, () -> String.format("transcript %s ends (%d) before it starts (%d)", id, txEnd, txStart));
        this.txStart = txStart;
        this.txEnd = txEnd;
        this.cdsStart = cdsStart;
        this.cdsEnd = cdsEnd;
        Utils.nonEmpty(exons, "exons of " + id);
        final List<Interval> sorted = new ArrayList<>(exons);
        sorted.sort((a, b) -> a.getStart() != b.getStart() ? Integer.compare(a.getStart(), b.getStart()) : Integer.compare(a.getEnd(), b.getEnd()));
        this.exons = Collections.unmodifiableList(sorted);
        this.noncodingTag = Utils.nonEmpty(noncodingTag, "noncoding tag");
    }

    /**
     * Builds the blocks from 0-based half-open coordinates, as found in BED and UCSC tables.
     * A coding range with {@code cdsStart0 >= cdsEnd} means no coding sequence.
     */
    public static TranscriptBlocks fromHalfOpen(final String id, final String name, final String seqId, final Strand strand,
                                                final int txStart0, final int txEnd, final int cdsStart0, final int cdsEnd,
                                                final List<Integer> exonStarts0, final List<Integer> exonEnds,
                                                final String noncodingTag) {
        Utils.validateArg(exonStarts0.size() == exonEnds.size(),
                () -> String.format("%d exon starts but %d exon ends", exonStarts0.size(), exonEnds.size()));
        final List<Interval> exons = new ArrayList<>(exonStarts0.size());
        for (int i = 0; i < exonStarts0.size(); i++) {
            exons.add(new Interval(seqId, exonStarts0.get(i) + 1, exonEnds.get(i)));
        }
        final boolean coding = cdsStart0 < cdsEnd;
        return new TranscriptBlocks(id, name, seqId, strand, txStart0 + 1, txEnd,
                coding ? cdsStart0 + 1 : cdsEnd + 1, cdsEnd, exons, noncodingTag);
    }

    public boolean isCoding() {
        return cdsStart <= cdsEnd;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getSeqId() {
        return seqId;
    }

    public Strand getStrand() {
        return strand;
    }

    public int getTxStart() {
        return txStart;
    }

    public int getTxEnd() {
        return txEnd;
    }

    public int getCdsStart() {
        return cdsStart;
    }

    public int getCdsEnd() {
        return cdsEnd;
    }

    /**
     * @return the exons sorted by start
     */
    public List<Interval> getExons() {
        return exons;
    }

    public String getNoncodingTag() {
        return noncodingTag;
    }
}
