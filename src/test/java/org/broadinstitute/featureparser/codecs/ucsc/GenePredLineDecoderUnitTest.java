package org.broadinstitute.featureparser.codecs.ucsc;

import htsjdk.tribble.annotation.Strand;
import org.broadinstitute.featureparser.assembly.SubfeatureFlags;
import org.broadinstitute.featureparser.exceptions.UserException;
import org.broadinstitute.featureparser.feature.FeatureNode;
import org.broadinstitute.featureparser.feature.FeatureNodeFactory;
import org.broadinstitute.featureparser.feature.FeatureTypes;
import org.broadinstitute.featureparser.format.AnnotationFileType;
import org.broadinstitute.featureparser.testutils.FeatureParserBaseTest;
import org.testng.Assert;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

public final class GenePredLineDecoderUnitTest extends FeatureParserBaseTest {
    private static final FeatureNodeFactory FACTORY = new FeatureNodeFactory("ucsc");
    private static final SubfeatureFlags EXON_AND_CDS = new SubfeatureFlags(true, true, false, false);

    private UcscAuxiliaryTables tables;

    @BeforeClass
    public void loadTables() {
        tables = UcscAuxiliaryTables.load(UcscAuxiliaryTablesUnitTest.argumentsWithTables());
    }

    private GenePredLineDecoder decoder(final AnnotationFileType type, final SubfeatureFlags flags, final UcscAuxiliaryTables tables) {
        return new GenePredLineDecoder(GenePredLayout.forFileType(type), FACTORY, flags, tables);
    }

    private static List<String> spans(final List<FeatureNode> features) {
        return features.stream().map(f -> f.getStart() + "-" + f.getEnd()).collect(Collectors.toList());
    }

    @Test
    public void testRefFlatWithRefSeqTables() {
        final TranscriptRecord record = decoder(AnnotationFileType.REF_FLAT, SubfeatureFlags.EXONS_ONLY, tables).decode(
                tabs("GENEA", "NM_0001", "chr1", "+", 1000, 5000, 1200, 4800, 3, "1000,2000,4000,", "1500,2500,5000,"), 1);
        Assert.assertEquals(record.getGeneName(), "GENEA");
        final FeatureNode transcript = record.getTranscript();
        Assert.assertEquals(transcript.getPrimaryId(), "NM_0001");
        Assert.assertEquals(transcript.getDisplayName(), "NM_0001");
        Assert.assertEquals(transcript.getPrimaryTag(), FeatureTypes.MRNA);
        Assert.assertEquals(transcript.getSourceTag(), "ucsc");
        Assert.assertEquals(transcript.getStart(), 1001);
        Assert.assertEquals(transcript.getEnd(), 5000);
        Assert.assertEquals(spans(transcript.getChildren()), Arrays.asList("1001-1500", "2001-2500", "4001-5000"));
        Assert.assertEquals(transcript.getAttribute(GenePredLineDecoder.STATUS), "Reviewed");
        Assert.assertEquals(transcript.getAttribute(GenePredLineDecoder.COMPLETENESS), "Complete5End");
        Assert.assertEquals(transcript.getAttribute(GenePredLineDecoder.SUMMARY), "GENEA is a gene used for testing.");
    }

    @Test
    public void testNoncodingTagFromRefSeqStatus() {
        final FeatureNode transcript = decoder(AnnotationFileType.REF_FLAT, SubfeatureFlags.ALL, tables).decode(
                tabs("GENEB", "NR_0003", "chr2", "-", 100, 900, 900, 900, 2, "100,600,", "300,900,"), 1).getTranscript();
        Assert.assertEquals(transcript.getPrimaryTag(), FeatureTypes.RRNA);
        Assert.assertEquals(transcript.getAttribute(GenePredLineDecoder.STATUS), "Validated");
        Assert.assertEquals(spans(transcript.getChildren()), Arrays.asList("601-900", "101-300"));
    }

    @Test
    public void testNoncodingWithoutTablesIsNcRna() {
        final FeatureNode transcript = decoder(AnnotationFileType.REF_FLAT, SubfeatureFlags.NONE, UcscAuxiliaryTables.EMPTY).decode(
                tabs("GENEB", "NR_0003", "chr2", "-", 100, 900, 900, 900, 2, "100,600,", "300,900,"), 1).getTranscript();
        Assert.assertEquals(transcript.getPrimaryTag(), FeatureTypes.NCRNA);
        Assert.assertFalse(transcript.hasAttribute(GenePredLineDecoder.STATUS));
    }

    @Test
    public void testGenePredExtMinusStrand() {
        final TranscriptRecord record = decoder(AnnotationFileType.GENE_PRED_EXT, EXON_AND_CDS, tables).decode(
                tabs("ENST01", "chr5", "-", 100, 1000, 200, 900, 2, "100,700,", "400,1000,", 0, "GENEX", "cmpl", "cmpl", "1,0,"), 1);
        Assert.assertEquals(record.getGeneName(), "GENEX");
        final FeatureNode transcript = record.getTranscript();
        Assert.assertEquals(transcript.getStrand(), Strand.NEGATIVE);
        Assert.assertEquals(transcript.getAttribute(GenePredLineDecoder.BIOTYPE), "protein_coding");
        Assert.assertEquals(spans(transcript.getChildren(FeatureTypes.EXON)), Arrays.asList("701-1000", "101-400"));
        Assert.assertEquals(spans(transcript.getChildren(FeatureTypes.CDS)), Arrays.asList("701-900", "201-400"));
    }

    @Test
    public void testGenePredExtBin() {
        final TranscriptRecord record = decoder(AnnotationFileType.GENE_PRED_EXT_BIN, SubfeatureFlags.NONE, UcscAuxiliaryTables.EMPTY).decode(
                tabs(585, "ENST02", "chr5", "+", 100, 1000, 200, 900, 2, "100,700,", "400,1000,", 0, "GENEY", "cmpl", "cmpl", "0,1,"), 1);
        Assert.assertEquals(record.getGeneName(), "GENEY");
        Assert.assertEquals(record.getTranscript().getPrimaryId(), "ENST02");
        Assert.assertEquals(record.getTranscript().getContig(), "chr5");
    }

    @Test
    public void testKnownGeneWithKgXref() {
        final TranscriptRecord record = decoder(AnnotationFileType.KNOWN_GENE, SubfeatureFlags.NONE, tables).decode(
                tabs("uc010nxq.1", "chr1", "+", 11873, 14409, 12189, 13639, 3, "11873,12594,13402,", "12227,12721,14409,", "B7ZGX9", "uc010nxq.1"), 1);
        Assert.assertEquals(record.getGeneName(), "DDX11L1");
        final FeatureNode transcript = record.getTranscript();
        Assert.assertEquals(transcript.getAttribute(GenePredLineDecoder.NOTE), "DEAD/H box polypeptide 11 like 1");
        Assert.assertEquals(transcript.getAttribute(GenePredLineDecoder.PROTEIN_ID), "B7ZGX9");
        Assert.assertEquals(transcript.getPrimaryTag(), FeatureTypes.MRNA);
    }

    @Test
    public void testEnsemblTablesForPlainGenePred() {
        final TranscriptRecord record = decoder(AnnotationFileType.GENE_PRED, SubfeatureFlags.NONE, tables).decode(
                tabs("ENST03", "chr1", "+", 0, 100, 100, 100, 1, "0,", "100,"), 1);
        Assert.assertEquals(record.getGeneName(), "OTHER");
        Assert.assertEquals(record.getTranscript().getPrimaryTag(), FeatureTypes.SNRNA);
    }

    @Test
    public void testGeneNameDefaultsToTranscriptName() {
        final TranscriptRecord record = decoder(AnnotationFileType.GENE_PRED, SubfeatureFlags.NONE, UcscAuxiliaryTables.EMPTY).decode(
                tabs("NM_0100", "chr7", "+", 0, 300, 0, 300, 1, "0,", "300,"), 1);
        Assert.assertEquals(record.getGeneName(), "NM_0100");
        Assert.assertEquals(record.getTranscript().getStart(), 1);
    }

    @DataProvider(name = "malformed")
    public Object[][] malformed() {
        return new Object[][] {
                {tabs("NM_1", "chr1", "+", 0, 100, 0, 100, 1, "0,")},
                {tabs("NM_1", "chr1", "*", 0, 100, 0, 100, 1, "0,", "100,")},
                {tabs("NM_1", "chr1", "+", 100, 100, 100, 100, 1, "100,", "100,")},
                {tabs("NM_1", "chr1", "+", 0, 100, 0, 100, 2, "0,", "100,")},
                {tabs("NM_1", "chr1", "+", 0, 100, 0, 100, 1, "0,", "150,")},
                {tabs("NM_1", "chr1", "+", 0, 100, 0, 100, 1, "50,", "50,")},
                {tabs("NM_1", "chr1", "+", "start", 100, 0, 100, 1, "0,", "100,")},
                {tabs("", "chr1", "+", 0, 100, 0, 100, 1, "0,", "100,")}};
    }

    @Test(dataProvider = "malformed", expectedExceptions = UserException.MalformedLine.class)
    public void testMalformed(final String line) {
        decoder(AnnotationFileType.GENE_PRED, SubfeatureFlags.ALL, UcscAuxiliaryTables.EMPTY).decode(line, 4);
    }
}
