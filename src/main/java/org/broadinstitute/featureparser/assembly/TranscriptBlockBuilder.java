package org.broadinstitute.featureparser.assembly;

import htsjdk.samtools.util.Interval;
import htsjdk.tribble.annotation.Strand;
import org.broadinstitute.featureparser.feature.FeatureNode;
import org.broadinstitute.featureparser.feature.FeatureNodeFactory;
import org.broadinstitute.featureparser.feature.FeatureTypes;
import org.broadinstitute.featureparser.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Decomposes {@link TranscriptBlocks} into a transcript feature with exon, CDS, UTR and codon children.
 *
 * <p>Each exon is cut at the coding range into up to three pieces: the part before the coding range, the coding part
 * and the part after it. On the forward strand the part before is the 5' UTR, on the reverse strand it is the 3' UTR.
 * No piece is ever empty, so a coding boundary that falls on an exon boundary yields whole-exon pieces.</p>
 *
 * <p>Start and stop codons are the first and last three coding bases along the strand and may span an intron.
 * When codons are requested they are cut out of the CDS pieces, so that with every subfeature kind requested the
 * UTR, CDS and codon children exactly tile the exons. A coding sequence shorter than six bases only gets a start
 * codon, one shorter than three bases gets neither.</p>
 *
 * This class holds no per-transcript state and may be shared.
 */
public final class TranscriptBlockBuilder {
    public static final int CODON_LENGTH = 3;

    private final FeatureNodeFactory factory;

    public TranscriptBlockBuilder(final FeatureNodeFactory factory) {
        this.factory = Utils.nonNull(factory);
    }

    /**
     * @return a new transcript feature, tagged mRNA when coding and with the noncoding tag of {@code blocks} otherwise
     */
    public FeatureNode build(final TranscriptBlocks blocks, final SubfeatureFlags flags) {
        Utils.nonNull(blocks);
        Utils.nonNull(flags);
        final FeatureNode transcript = factory.newFeature(blocks.getSeqId(), blocks.getTxStart(), blocks.getTxEnd(),
                blocks.getStrand(), blocks.isCoding() ? FeatureTypes.MRNA : blocks.getNoncodingTag());
        transcript.setPrimaryId(blocks.getId());
        transcript.setDisplayName(blocks.getName());

        final boolean reverse = blocks.getStrand() == Strand.NEGATIVE;
        if (flags.doExon()) {
            addChildren(transcript, transcriptionOrder(blocks.getExons(), reverse), FeatureTypes.EXON, ".exon");
        }
        if (!blocks.isCoding()) {
            return transcript;
        }
        if (flags.doUtr()) {
            addUtrs(transcript, blocks, reverse);
        }
        if (flags.doCds() || flags.doCodon()) {
            addCodingPieces(transcript, blocks, flags, reverse);
        }
        return transcript;
    }

    private void addUtrs(final FeatureNode transcript, final TranscriptBlocks blocks, final boolean reverse) {
        final String lowTag = reverse ? FeatureTypes.THREE_PRIME_UTR : FeatureTypes.FIVE_PRIME_UTR;
        final String highTag = reverse ? FeatureTypes.FIVE_PRIME_UTR : FeatureTypes.THREE_PRIME_UTR;
        int number = 1;
        for (final Interval exon : transcriptionOrder(blocks.getExons(), reverse)) {
            final Interval low = exon.getStart() < blocks.getCdsStart()
                    ? new Interval(exon.getContig(), exon.getStart(), Math.min(exon.getEnd(), blocks.getCdsStart() - 1)) : null;
            final Interval high = exon.getEnd() > blocks.getCdsEnd()
                    ? new Interval(exon.getContig(), Math.max(exon.getStart(), blocks.getCdsEnd() + 1), exon.getEnd()) : null;
            final Interval first = reverse ? high : low;
            final Interval second = reverse ? low : high;
            if (first != null) {
                transcript.addChild(child(transcript, first, first == low ? lowTag : highTag, ".utr" + number++));
            }
            if (second != null) {
                transcript.addChild(child(transcript, second, second == low ? lowTag : highTag, ".utr" + number++));
            }
        }
    }

    private void addCodingPieces(final FeatureNode transcript, final TranscriptBlocks blocks,
                                 final SubfeatureFlags flags, final boolean reverse) {
        final List<Interval> segments = new ArrayList<>();
        for (final Interval exon : blocks.getExons()) {
            final int start = Math.max(exon.getStart(), blocks.getCdsStart());
            final int end = Math.min(exon.getEnd(), blocks.getCdsEnd());
            if (start <= end) {
                segments.add(new Interval(exon.getContig(), start, end));
            }
        }
        final int length = segments.stream().mapToInt(Interval::length).sum();

        int startCodonLength = 0;
        int stopCodonLength = 0;
        if (flags.doCodon() && length >= CODON_LENGTH) {
            startCodonLength = CODON_LENGTH;
            stopCodonLength = length >= 2 * CODON_LENGTH ? CODON_LENGTH : 0;
        }
        final int lowTrim = reverse ? stopCodonLength : startCodonLength;
        final int highTrim = reverse ? startCodonLength : stopCodonLength;

        if (flags.doCds()) {
            addChildren(transcript, transcriptionOrder(slice(segments, lowTrim, length - highTrim), reverse), FeatureTypes.CDS, ".cds");
        }
        if (startCodonLength > 0) {
            final List<Interval> startCodon = reverse ? slice(segments, length - highTrim, length) : slice(segments, 0, lowTrim);
            addChildren(transcript, transcriptionOrder(startCodon, reverse), FeatureTypes.START_CODON, "." + FeatureTypes.START_CODON);
        }
        if (stopCodonLength > 0) {
            final List<Interval> stopCodon = reverse ? slice(segments, 0, lowTrim) : slice(segments, length - highTrim, length);
            addChildren(transcript, transcriptionOrder(stopCodon, reverse), FeatureTypes.STOP_CODON, "." + FeatureTypes.STOP_CODON);
        }
    }

    /**
     * Returns the genomic pieces holding bases {@code from} (inclusive) to {@code to} (exclusive) of the concatenated
     * {@code segments}, counted from the lowest coordinate.
     */
    static List<Interval> slice(final List<Interval> segments, final int from, final int to) {
        final List<Interval> pieces = new ArrayList<>();
        int offset = 0;
        for (final Interval segment : segments) {
            final int segmentLength = segment.length();
            final int pieceFrom = Math.max(from, offset);
            final int pieceTo = Math.min(to, offset + segmentLength);
            if (pieceFrom < pieceTo) {
                pieces.add(new Interval(segment.getContig(),
                        segment.getStart() + pieceFrom - offset,
                        segment.getStart() + pieceTo - offset - 1));
            }
            offset += segmentLength;
        }
        return pieces;
    }

    // ids are numbered along the strand; a single codon piece keeps the bare suffix
    private void addChildren(final FeatureNode transcript, final List<Interval> pieces, final String tag, final String idSuffix) {
        final boolean numbered = !idSuffix.endsWith("codon") || pieces.size() > 1;
        int number = 1;
        for (final Interval piece : pieces) {
            transcript.addChild(child(transcript, piece, tag, numbered ? idSuffix + number++ : idSuffix));
        }
    }

    private FeatureNode child(final FeatureNode transcript, final Interval piece, final String tag, final String idSuffix) {
        final FeatureNode node = factory.newFeature(piece.getContig(), piece.getStart(), piece.getEnd(), transcript.getStrand(), tag);
        node.setPrimaryId(transcript.getPrimaryId() + idSuffix);
        return node;
    }

    private static List<Interval> transcriptionOrder(final List<Interval> ascending, final boolean reverse) {
        if (!reverse) {
            return ascending;
        }
        final List<Interval> reversed = new ArrayList<>(ascending);
        Collections.reverse(reversed);
        return reversed;
    }
}
