package org.broadinstitute.featureparser.codecs.bed;

import htsjdk.tribble.annotation.Strand;
import org.broadinstitute.featureparser.assembly.SubfeatureFlags;
import org.broadinstitute.featureparser.exceptions.UserException;
import org.broadinstitute.featureparser.feature.FeatureNode;
import org.broadinstitute.featureparser.feature.FeatureNodeFactory;
import org.broadinstitute.featureparser.feature.FeatureTypes;
import org.broadinstitute.featureparser.format.AnnotationFileType;
import org.broadinstitute.featureparser.testutils.FeatureParserBaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.List;

public final class BedLineDecoderUnitTest extends FeatureParserBaseTest {
    private static final FeatureNodeFactory FACTORY = new FeatureNodeFactory("test");
    private static final SubfeatureFlags CDS_AND_UTR = new SubfeatureFlags(true, true, true, false);

    private static FeatureNode decode(final AnnotationFileType type, final SubfeatureFlags flags, final String line) {
        return new BedLineDecoder(type, FACTORY, flags).decode(line, 1);
    }

    private static void assertSpan(final FeatureNode feature, final int start, final int end) {
        Assert.assertEquals(feature.getStart(), start, feature.toString());
        Assert.assertEquals(feature.getEnd(), end, feature.toString());
    }

    @Test
    public void testBed6() {
        final FeatureNode feature = decode(AnnotationFileType.BED6, SubfeatureFlags.NONE, tabs("chr1", 999, 1500, "foo", 500, "+"));
        Assert.assertEquals(feature.getContig(), "chr1");
        assertSpan(feature, 1000, 1500);
        Assert.assertEquals(feature.getDisplayName(), "foo");
        Assert.assertEquals(feature.getScore(), 500.0);
        Assert.assertEquals(feature.getStrand(), Strand.POSITIVE);
        Assert.assertEquals(feature.getPrimaryId(), "chr1:999-1500");
        Assert.assertEquals(feature.getPrimaryTag(), FeatureTypes.REGION);
        Assert.assertEquals(feature.getSourceTag(), "test");
        Assert.assertFalse(feature.hasChildren());
        Assert.assertEquals(BedLineDecoder.toHalfOpen(feature), tabs("chr1", 999, 1500));
    }

    @Test
    public void testBed3() {
        final FeatureNode feature = decode(AnnotationFileType.BED3, SubfeatureFlags.NONE, tabs("chrX", 0, 1));
        assertSpan(feature, 1, 1);
        Assert.assertEquals(feature.getStrand(), Strand.NONE);
        Assert.assertNull(feature.getScore());
        Assert.assertFalse(feature.hasDisplayName());
    }

    @Test
    public void testBed9KeepsRgb() {
        final FeatureNode feature = decode(AnnotationFileType.BED9, SubfeatureFlags.NONE,
                tabs("chr1", 10, 90, "n", ".", "-", 20, 80, "255,0,0"));
        Assert.assertNull(feature.getScore());
        Assert.assertEquals(feature.getStrand(), Strand.NEGATIVE);
        Assert.assertEquals(feature.getAttribute(BedLineDecoder.ITEM_RGB), "255,0,0");
    }

    @Test
    public void testBedGraph() {
        final FeatureNode feature = decode(AnnotationFileType.BED_GRAPH, SubfeatureFlags.NONE, tabs("chr1", 0, 100, 1.5));
        assertSpan(feature, 1, 100);
        Assert.assertEquals(feature.getScore(), 1.5);
        Assert.assertEquals(feature.getPrimaryId(), "chr1:0-100");
    }

    @Test
    public void testNarrowPeak() {
        final FeatureNode feature = decode(AnnotationFileType.NARROW_PEAK, SubfeatureFlags.ALL,
                tabs("chr1", 100, 200, "peak1", 900, ".", 12.5, 8.2, 6.1, 50));
        assertSpan(feature, 101, 200);
        Assert.assertEquals(feature.getPrimaryTag(), FeatureTypes.PEAK);
        Assert.assertEquals(feature.getAttribute(BedLineDecoder.SIGNAL_VALUE), "12.5");
        Assert.assertEquals(feature.getAttribute(BedLineDecoder.P_VALUE), "8.2");
        Assert.assertEquals(feature.getAttribute(BedLineDecoder.Q_VALUE), "6.1");
        Assert.assertEquals(feature.getAttribute(BedLineDecoder.PEAK), "50");
    }

    @Test
    public void testBroadPeakHasNoSummit() {
        final FeatureNode feature = decode(AnnotationFileType.BROAD_PEAK, SubfeatureFlags.NONE,
                tabs("chr3", 1000, 5000, "broad1", 300, ".", 4.5, 3.2, 2.1));
        Assert.assertEquals(feature.getPrimaryTag(), FeatureTypes.PEAK);
        Assert.assertFalse(feature.hasAttribute(BedLineDecoder.PEAK));
        Assert.assertEquals(feature.getAttribute(BedLineDecoder.Q_VALUE), "2.1");
    }

    @Test
    public void testBed12CodingBoundaryInsideExons() {
        final FeatureNode transcript = decode(AnnotationFileType.BED12, CDS_AND_UTR,
                tabs("chr1", 1000, 2000, "tx1", 0, "+", 1100, 1800, 0, 2, "300,400,", "0,600,"));
        Assert.assertEquals(transcript.getPrimaryTag(), FeatureTypes.MRNA);
        Assert.assertEquals(transcript.getDisplayName(), "tx1");
        Assert.assertEquals(transcript.getPrimaryId(), "chr1:1000-2000");
        assertSpan(transcript, 1001, 2000);

        final List<FeatureNode> exons = transcript.getChildren(FeatureTypes.EXON);
        Assert.assertEquals(exons.size(), 2);
        assertSpan(exons.get(0), 1001, 1300);
        assertSpan(exons.get(1), 1601, 2000);
        Assert.assertEquals(exons.get(0).getPrimaryId(), "chr1:1000-2000.exon1");

        final List<FeatureNode> cds = transcript.getChildren(FeatureTypes.CDS);
        Assert.assertEquals(cds.size(), 2);
        assertSpan(cds.get(0), 1101, 1300);
        assertSpan(cds.get(1), 1601, 1800);

        final List<FeatureNode> fivePrime = transcript.getChildren(FeatureTypes.FIVE_PRIME_UTR);
        Assert.assertEquals(fivePrime.size(), 1);
        assertSpan(fivePrime.get(0), 1001, 1100);
        final List<FeatureNode> threePrime = transcript.getChildren(FeatureTypes.THREE_PRIME_UTR);
        Assert.assertEquals(threePrime.size(), 1);
        assertSpan(threePrime.get(0), 1801, 2000);
    }

    @Test
    public void testBed12CodingBoundaryOnExonBoundary() {
        final FeatureNode transcript = decode(AnnotationFileType.BED12, CDS_AND_UTR,
                tabs("chr1", 1000, 2000, "tx", 0, "+", 1000, 1300, 0, 2, "300,400", "0,600"));
        Assert.assertEquals(transcript.getChildren(FeatureTypes.EXON).size(), 2);
        final List<FeatureNode> cds = transcript.getChildren(FeatureTypes.CDS);
        Assert.assertEquals(cds.size(), 1);
        assertSpan(cds.get(0), 1001, 1300);
        Assert.assertTrue(transcript.getChildren(FeatureTypes.FIVE_PRIME_UTR).isEmpty());
        final List<FeatureNode> threePrime = transcript.getChildren(FeatureTypes.THREE_PRIME_UTR);
        Assert.assertEquals(threePrime.size(), 1);
        assertSpan(threePrime.get(0), 1601, 2000);
    }

    @Test
    public void testBed12WithoutSubfeatures() {
        final FeatureNode transcript = decode(AnnotationFileType.BED12, SubfeatureFlags.NONE,
                tabs("chr1", 1000, 2000, "tx1", 0, "+", 1100, 1800, 0, 2, "300,400,", "0,600,"));
        Assert.assertFalse(transcript.hasChildren());
    }

    @DataProvider(name = "noncoding")
    public Object[][] noncoding() {
        return new Object[][] {
                {tabs("chr2", 100, 500, "nc1", 0, "+", 500, 500, 0, 1, 400, 0)},
                {tabs("chr2", 100, 500, "nc1", 0, "+", 0, 0, 0, 1, 400, 0)}};
    }

    @Test(dataProvider = "noncoding")
    public void testBed12Noncoding(final String line) {
        final FeatureNode transcript = decode(AnnotationFileType.BED12, CDS_AND_UTR, line);
        Assert.assertEquals(transcript.getPrimaryTag(), FeatureTypes.NCRNA);
        Assert.assertEquals(transcript.getChildren().size(), 1);
        Assert.assertEquals(transcript.getChildren().get(0).getPrimaryTag(), FeatureTypes.EXON);
    }

    @Test
    public void testThickStartZeroAtChromStartIsCoding() {
        final FeatureNode transcript = decode(AnnotationFileType.BED12, CDS_AND_UTR,
                tabs("chr1", 0, 100, "tx", 0, "+", 0, 60, 0, 1, 100, 0));
        Assert.assertEquals(transcript.getPrimaryTag(), FeatureTypes.MRNA);
        assertSpan(transcript.getChildren(FeatureTypes.CDS).get(0), 1, 60);
    }

    @Test
    public void testGappedPeak() {
        final FeatureNode peak = decode(AnnotationFileType.GAPPED_PEAK, SubfeatureFlags.ALL,
                tabs("chr1", 1000, 2000, "gp1", 500, "+", 1000, 2000, 0, 2, "100,200", "0,800", 5.5, 4.4, 3.3));
        Assert.assertEquals(peak.getPrimaryTag(), FeatureTypes.GAPPED_PEAK);
        Assert.assertEquals(peak.getScore(), 500.0);
        Assert.assertEquals(peak.getAttribute(BedLineDecoder.SIGNAL_VALUE), "5.5");
        final List<FeatureNode> subPeaks = peak.getChildren();
        Assert.assertEquals(subPeaks.size(), 2);
        assertSpan(subPeaks.get(0), 1001, 1100);
        assertSpan(subPeaks.get(1), 1801, 2000);
        Assert.assertEquals(subPeaks.get(0).getPrimaryId(), "chr1:1000-2000.peak1");
        Assert.assertEquals(subPeaks.get(1).getPrimaryId(), "chr1:1000-2000.peak2");
        subPeaks.forEach(p -> Assert.assertEquals(p.getPrimaryTag(), FeatureTypes.PEAK));
    }

    @DataProvider(name = "malformed")
    public Object[][] malformed() {
        return new Object[][] {
                {AnnotationFileType.BED6, tabs("chr1", 0, 100, "n", 0)},
                {AnnotationFileType.BED6, tabs("chr1", "zero", 100, "n", 0, "+")},
                {AnnotationFileType.BED6, tabs("chr1", 100, 100, "n", 0, "+")},
                {AnnotationFileType.BED6, tabs("chr1", 0, 100, "n", 0, "x")},
                {AnnotationFileType.BED6, tabs("", 0, 100, "n", 0, "+")},
                {AnnotationFileType.BED5, tabs("chr1", 0, 100, "n", "high")},
                {AnnotationFileType.BED12, tabs("chr1", 0, 100, "n", 0, "+", 0, 100, 0, 2, "10", "0")},
                {AnnotationFileType.BED12, tabs("chr1", 0, 100, "n", 0, "+", 0, 100, 0, 1, "200", "0")},
                {AnnotationFileType.BED12, tabs("chr1", 0, 100, "n", 0, "+", 0, 100, 0, 1, "0", "0")},
                {AnnotationFileType.BED12, tabs("chr1", 10, 100, "n", 0, "+", 5, 100, 0, 1, "90", "0")}};
    }

    @Test(dataProvider = "malformed", expectedExceptions = UserException.MalformedLine.class)
    public void testMalformed(final AnnotationFileType type, final String line) {
        decode(type, SubfeatureFlags.ALL, line);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testRejectsNonBedType() {
        new BedLineDecoder(AnnotationFileType.GTF, FACTORY, SubfeatureFlags.NONE);
    }
}
