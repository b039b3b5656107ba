package org.broadinstitute.featureparser.assembly;

import org.broadinstitute.featureparser.feature.FeatureNode;
import org.broadinstitute.featureparser.testutils.FeatureParserBaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

public final class IdentifierTableUnitTest extends FeatureParserBaseTest {

    private static FeatureNode feature(final String id) {
        final FeatureNode node = new FeatureNode();
        node.setLocation("chr1", 1, 100);
        node.setPrimaryId(id);
        return node;
    }

    @Test
    public void testRegisterRenamesCollisions() {
        final IdentifierTable table = new IdentifierTable();
        final FeatureNode first = feature("chr1:0-100");
        final FeatureNode second = feature("chr1:0-100");
        final FeatureNode third = feature("chr1:0-100");
        final FeatureNode exon = feature("chr1:0-100.exon1");
        third.addChild(exon);

        Assert.assertEquals(table.register(first), "chr1:0-100");
        Assert.assertEquals(table.register(second), "chr1:0-100.1");
        Assert.assertEquals(table.register(third), "chr1:0-100.2");
        Assert.assertEquals(exon.getPrimaryId(), "chr1:0-100.2.exon1");
        Assert.assertEquals(table.register(first), "chr1:0-100");
        Assert.assertEquals(table.size(), 3);
        Assert.assertSame(table.get("chr1:0-100.1"), second);
        Assert.assertNull(table.get("nope"));
    }

    @Test
    public void testRegisterLeavesTranscriptNamedLikeItsGene() {
        final IdentifierTable table = new IdentifierTable();
        table.register(feature("NM_1"));
        final FeatureNode gene = feature("NM_1");
        final FeatureNode transcript = feature("NM_1");
        final FeatureNode exon = feature("NM_1.exon1");
        gene.addChild(transcript);
        transcript.addChild(exon);

        Assert.assertEquals(table.register(gene), "NM_1.1");
        Assert.assertEquals(transcript.getPrimaryId(), "NM_1");
        Assert.assertEquals(exon.getPrimaryId(), "NM_1.exon1");
    }

    @Test
    public void testRegisterIfAbsentNeverRenames() {
        final IdentifierTable table = new IdentifierTable();
        final FeatureNode gene = feature("NM_1");
        final FeatureNode transcript = feature("NM_1");
        Assert.assertTrue(table.registerIfAbsent(gene));
        Assert.assertFalse(table.registerIfAbsent(transcript));
        Assert.assertEquals(transcript.getPrimaryId(), "NM_1");
        Assert.assertSame(table.get("NM_1"), gene);
        Assert.assertFalse(table.registerIfAbsent(new FeatureNode()));
    }

    @Test
    public void testUniqueId() {
        final IdentifierTable table = new IdentifierTable();
        Assert.assertEquals(table.uniqueId("a"), "a");
        table.register(feature("a"));
        table.register(feature("a.1"));
        Assert.assertEquals(table.uniqueId("a"), "a.2");
        Assert.assertTrue(table.contains("a.1"));
        Assert.assertEquals(table.getFeatures().size(), 2);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testRegisterRequiresId() {
        new IdentifierTable().register(new FeatureNode());
    }
}
