package org.broadinstitute.featureparser.assembly;

import htsjdk.tribble.annotation.Strand;
import org.broadinstitute.featureparser.exceptions.UserException;
import org.broadinstitute.featureparser.feature.FeatureNode;
import org.broadinstitute.featureparser.feature.FeatureNodeFactory;
import org.broadinstitute.featureparser.feature.FeatureTypes;
import org.broadinstitute.featureparser.testutils.FeatureParserBaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

public final class IdentifierAssemblerUnitTest extends FeatureParserBaseTest {
    private static final FeatureNodeFactory FACTORY = new FeatureNodeFactory("test");

    private int lineNumber = 0;

    private FeatureNode add(final IdentifierAssembler assembler, final String type, final int start, final int end,
                            final String id, final String... parents) {
        final FeatureNode feature = FACTORY.newFeature("chr1", start, end, Strand.POSITIVE, type);
        feature.setPrimaryId(id != null ? id : "chr1:" + start + "-" + end);
        assembler.add(feature, id, Arrays.asList(parents), ++lineNumber);
        return feature;
    }

    private static List<String> ids(final List<FeatureNode> features) {
        return features.stream().map(FeatureNode::getPrimaryId).collect(Collectors.toList());
    }

    @Test
    public void testParentsBeforeChildren() {
        final IdentifierAssembler assembler = new IdentifierAssembler(true);
        final FeatureNode gene = add(assembler, FeatureTypes.GENE, 1, 1000, "g1");
        final FeatureNode mrna = add(assembler, FeatureTypes.MRNA, 1, 1000, "t1", "g1");
        add(assembler, FeatureTypes.EXON, 1, 100, "e1", "t1");
        Assert.assertFalse(assembler.hasPending());
        Assert.assertEquals(assembler.reconcile(), 0);
        Assert.assertEquals(assembler.getRoots(), Collections.singletonList(gene));
        Assert.assertSame(mrna.getParent(), gene);
        Assert.assertEquals(ids(mrna.getChildren()), Collections.singletonList("e1"));
        Assert.assertEquals(assembler.getIdentifiedFeatures().size(), 3);
    }

    @Test
    public void testChildrenBeforeParentsAreResolvedOnReconcile() {
        final IdentifierAssembler assembler = new IdentifierAssembler(true);
        final FeatureNode exon = add(assembler, FeatureTypes.EXON, 1, 100, null, "t1");
        final FeatureNode mrna = add(assembler, FeatureTypes.MRNA, 1, 1000, "t1", "g1");
        final FeatureNode gene = add(assembler, FeatureTypes.GENE, 1, 1000, "g1");
        Assert.assertTrue(assembler.hasPending());
        Assert.assertEquals(assembler.reconcile(), 0);
        Assert.assertSame(exon.getParent(), mrna);
        Assert.assertSame(mrna.getParent(), gene);
        Assert.assertEquals(assembler.getNumberOfOrphans(), 0);
    }

    @Test
    public void testUnresolvedOrphansAreCountedAndDropped() {
        final IdentifierAssembler assembler = new IdentifierAssembler(true);
        final FeatureNode gene = add(assembler, FeatureTypes.GENE, 1, 1000, "g1");
        add(assembler, FeatureTypes.MRNA, 1, 1000, "t1", "g1");
        add(assembler, FeatureTypes.EXON, 1, 100, null, "missing1");
        add(assembler, FeatureTypes.EXON, 200, 300, null, "missing2");
        final FeatureNode e4 = add(assembler, FeatureTypes.EXON, 400, 500, "e4", "missing1");
        final FeatureNode cds = add(assembler, FeatureTypes.CDS, 400, 450, null, "e4");
        Assert.assertSame(cds.getParent(), e4);

        Assert.assertEquals(assembler.reconcile(), 3);
        Assert.assertEquals(assembler.getNumberOfOrphans(), 3);
        Assert.assertEquals(assembler.getRoots(), Collections.singletonList(gene));
        Assert.assertEquals(gene.getChildren().size(), 1);
        Assert.assertFalse(gene.getChildren().get(0).hasChildren());
        Assert.assertEquals(ids(assembler.getIdentifiedFeatures().stream().collect(Collectors.toList())), Arrays.asList("g1", "t1"));

        // the dropped e4 can no longer be referenced
        add(assembler, FeatureTypes.CDS, 460, 500, null, "e4");
        Assert.assertEquals(assembler.reconcile(), 1);
        Assert.assertEquals(assembler.getNumberOfOrphans(), 4);
    }

    @Test
    public void testStreamingDropsOrphansAtOnce() {
        final IdentifierAssembler assembler = new IdentifierAssembler(false);
        add(assembler, FeatureTypes.EXON, 1, 100, null, "t1");
        Assert.assertEquals(assembler.getNumberOfOrphans(), 1);
        Assert.assertFalse(assembler.hasPending());
        final FeatureNode mrna = add(assembler, FeatureTypes.MRNA, 1, 1000, "t1");
        Assert.assertFalse(mrna.hasChildren());
        Assert.assertEquals(assembler.getRoots(), Collections.singletonList(mrna));
    }

    @Test
    public void testSegmentsShareAnIdentifier() {
        final IdentifierAssembler assembler = new IdentifierAssembler(true);
        final FeatureNode mrna = add(assembler, FeatureTypes.MRNA, 1, 1000, "t1");
        add(assembler, FeatureTypes.CDS, 100, 200, "cds1", "t1");
        add(assembler, FeatureTypes.CDS, 300, 400, "cds1", "t1");
        add(assembler, FeatureTypes.CDS, 500, 600, "cds1", "t1");
        assembler.reconcile();
        Assert.assertEquals(ids(mrna.getChildren()), Arrays.asList("cds1", "cds1.1", "cds1.2"));
    }

    @Test(expectedExceptions = UserException.DuplicateIdentifier.class)
    public void testDuplicateIdentifier() {
        final IdentifierAssembler assembler = new IdentifierAssembler(true);
        add(assembler, FeatureTypes.GENE, 1, 1000, "x");
        add(assembler, FeatureTypes.MRNA, 1, 1000, "x");
    }

    @Test(expectedExceptions = UserException.DuplicateIdentifier.class)
    public void testSegmentsMustShareParents() {
        final IdentifierAssembler assembler = new IdentifierAssembler(true);
        add(assembler, FeatureTypes.MRNA, 1, 1000, "t1");
        add(assembler, FeatureTypes.MRNA, 1, 1000, "t2");
        add(assembler, FeatureTypes.CDS, 100, 200, "cds1", "t1");
        add(assembler, FeatureTypes.CDS, 300, 400, "cds1", "t2");
    }

    @Test
    public void testMultipleParentsGetCopies() {
        final IdentifierAssembler assembler = new IdentifierAssembler(true);
        final FeatureNode gene = add(assembler, FeatureTypes.GENE, 1, 1000, "g1");
        final FeatureNode first = add(assembler, FeatureTypes.MRNA, 1, 1000, "t1", "g1");
        final FeatureNode exon = add(assembler, FeatureTypes.EXON, 500, 900, null, "t1", "t2");
        final FeatureNode second = add(assembler, FeatureTypes.MRNA, 1, 1000, "t2", "g1");
        Assert.assertEquals(assembler.reconcile(), 0);

        Assert.assertEquals(gene.getChildren(), Arrays.asList(first, second));
        Assert.assertEquals(first.getChildren(), Collections.singletonList(exon));
        Assert.assertEquals(second.getChildren().size(), 1);
        final FeatureNode copy = second.getChildren().get(0);
        Assert.assertNotSame(copy, exon);
        Assert.assertEquals(copy.getPrimaryId(), exon.getPrimaryId());
        Assert.assertEquals(copy.getStart(), 500);
    }

    @Test
    public void testStreamingLinksMultipleKnownParents() {
        final IdentifierAssembler assembler = new IdentifierAssembler(false);
        final FeatureNode first = add(assembler, FeatureTypes.MRNA, 1, 1000, "t1");
        final FeatureNode second = add(assembler, FeatureTypes.MRNA, 1, 1000, "t2");
        add(assembler, FeatureTypes.EXON, 1, 100, null, "t1", "t2");
        Assert.assertEquals(first.getChildren().size(), 1);
        Assert.assertEquals(second.getChildren().size(), 1);
        Assert.assertEquals(assembler.getNumberOfOrphans(), 0);
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testTwoFeaturesNamingEachOtherAsParentAreRejected() {
        final IdentifierAssembler assembler = new IdentifierAssembler(true);
        add(assembler, FeatureTypes.GENE, 1, 1000, "root");
        add(assembler, FeatureTypes.MRNA, 1, 1000, "a", "b");
        add(assembler, FeatureTypes.MRNA, 1, 1000, "b", "a");
        assembler.reconcile();
    }

    @Test
    public void testLongerParentCycleIsRejected() {
        final IdentifierAssembler assembler = new IdentifierAssembler(true);
        add(assembler, FeatureTypes.MRNA, 1, 1000, "a", "b");
        add(assembler, FeatureTypes.MRNA, 1, 1000, "b", "c");
        add(assembler, FeatureTypes.MRNA, 1, 1000, "c", "a");
        try {
            assembler.reconcile();
            Assert.fail("expected the parent cycle to be rejected");
        } catch (final UserException.BadInput e) {
            Assert.assertTrue(e.getMessage().contains("cycle"), e.getMessage());
        }
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testFeatureNamingItselfAsParentIsRejected() {
        final IdentifierAssembler assembler = new IdentifierAssembler(true);
        add(assembler, FeatureTypes.MRNA, 1, 1000, "a", "a");
    }
}
