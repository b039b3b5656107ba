package org.broadinstitute.featureparser.engine;

import org.broadinstitute.featureparser.assembly.GtfTranscriptAssembler;
import org.broadinstitute.featureparser.assembly.IdentifierAssembler;
import org.broadinstitute.featureparser.cmdline.argumentcollections.ParserArgumentCollection;
import org.broadinstitute.featureparser.codecs.gff.GffLineDecoder;
import org.broadinstitute.featureparser.codecs.gff.GffRecord;
import org.broadinstitute.featureparser.exceptions.UserException;
import org.broadinstitute.featureparser.feature.FeatureNode;
import org.broadinstitute.featureparser.format.AnnotationFileType;
import org.broadinstitute.featureparser.format.AnnotationFlavor;
import org.broadinstitute.featureparser.utils.Utils;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Parser for GFF3 and GTF files.
 *
 * <p>GFF3 features are linked through their {@code ID} and {@code Parent} attributes. When materializing, a child
 * may come before its parent: unresolved children are retried at every {@code ###} directive and at the end of the
 * file, and the ones still unresolved are dropped and counted. When streaming, a top level feature and the lines
 * following it up to the next top level feature or {@code ###} make one unit, and a child naming a parent outside its
 * unit is dropped at once. Identifiers are still checked for uniqueness across the whole file, only the identifier
 * strings of earlier units are kept for that.</p>
 *
 * <p>GTF features are grouped into transcripts and genes by their {@code transcript_id} and {@code gene_id}
 * attributes. When streaming, consecutive lines with the same gene (or transcript without {@code do-gene}) make one
 * unit.</p>
 *
 * <p>Everything after a {@code ##FASTA} directive is ignored.</p>
 */
public final class GffAnnotationParser extends AnnotationParser {
    public static final String END_OF_FEATURES_DIRECTIVE = "###";
    public static final String FASTA_DIRECTIVE = "##FASTA";

    private final GffLineDecoder decoder;
    private final boolean gtf;
    private final boolean doGene;
    private final Set<String> types = new LinkedHashSet<>();
    // id to the type, sequence and parents of its first streamed record
    private final Map<String, String> streamedIds = new HashMap<>();
    private final Map<String, Integer> streamedSegmentCounts = new HashMap<>();

    private IdentifierAssembler fileAssembler;
    private GtfTranscriptAssembler gtfAssembler;
    private int numberOfOrphans = 0;
    private boolean unitBoundary = false;
    private GffRecord heldRecord;
    private int heldLineNumber;

    public GffAnnotationParser(final Path file, final AnnotationFileType fileType, final ParserArgumentCollection arguments) {
        super(file, fileType, arguments);
        Utils.validateArg(fileType.getFlavor() == AnnotationFlavor.GFF, () -> fileType + " is not a GFF type");
        this.decoder = new GffLineDecoder(fileType, factory, arguments.source, arguments.simplify);
        this.gtf = fileType == AnnotationFileType.GTF;
        this.doGene = arguments.isDoGene();
    }

    @Override
    protected void onComment(final String line) {
        super.onComment(line);
        if (END_OF_FEATURES_DIRECTIVE.equals(line.trim())) {
            if (fileAssembler != null) {
                numberOfOrphans += fileAssembler.reconcile();
            } else {
                unitBoundary = true;
            }
        } else if (line.startsWith(FASTA_DIRECTIVE)) {
            endFeatures();
        }
    }

    private GffRecord readRecord() {
        final String line = readDataLine();
        return line == null ? null : decoder.decode(line, getLineNumber());
    }

    @Override
    protected List<FeatureNode> readUnit() {
        final List<FeatureNode> unit = gtf ? readGtfUnit() : readGff3Unit();
        if (unit != null) {
            unit.forEach(this::collectTypes);
        }
        return unit;
    }

    private List<FeatureNode> readGff3Unit() {
        final IdentifierAssembler assembler = new IdentifierAssembler(false);
        boolean empty = true;
        boolean hasRoot = false;
        if (heldRecord != null) {
            addStreamedRecord(assembler, heldRecord, heldLineNumber);
            hasRoot = heldRecord.isRoot();
            heldRecord = null;
            empty = false;
        }
        while (true) {
            unitBoundary = false;
            final GffRecord record = readRecord();
            if (record == null) {
                break;
            }
            if (!empty && (unitBoundary || (record.isRoot() && hasRoot))) {
                heldRecord = record;
                heldLineNumber = getLineNumber();
                break;
            }
            addStreamedRecord(assembler, record, getLineNumber());
            hasRoot |= record.isRoot();
            empty = false;
        }
        numberOfOrphans += assembler.getNumberOfOrphans();
        return empty ? null : new ArrayList<>(assembler.getRoots());
    }

    /**
     * Adds {@code record} to the unit being streamed. A later segment of a multi-line feature is suffixed
     * {@code .1}, {@code .2}, ... even when its first segment was streamed in an earlier unit.
     *
     * @throws UserException.DuplicateIdentifier if the record's id was streamed earlier by a record that is not
     *         another segment of the same feature
     */
    private void addStreamedRecord(final IdentifierAssembler assembler, final GffRecord record, final int lineNumber) {
        final String id = record.getId();
        int segment = 0;
        if (id != null) {
            final FeatureNode feature = record.getFeature();
            final String key = feature.getPrimaryTag() + '\t' + feature.getContig() + '\t' + String.join(",", record.getParentIds());
            final String first = streamedIds.putIfAbsent(id, key);
            if (first != null && !first.equals(key)) {
                throw new UserException.DuplicateIdentifier(id, lineNumber);
            }
            if (first != null) {
                segment = streamedSegmentCounts.merge(id, 1, Integer::sum);
            }
        }
        assembler.add(record.getFeature(), id, record.getParentIds(), lineNumber);
        if (segment > 0) {
            record.getFeature().setPrimaryId(id + "." + segment);
        }
    }

    private List<FeatureNode> readGtfUnit() {
        final GtfTranscriptAssembler assembler = new GtfTranscriptAssembler(factory, flags, doGene);
        boolean empty = true;
        String unitKey = null;
        if (heldRecord != null) {
            addGtfRecord(assembler, heldRecord);
            unitKey = unitKey(heldRecord);
            heldRecord = null;
            empty = false;
        }
        GffRecord record;
        while ((record = readRecord()) != null) {
            final String key = unitKey(record);
            if (!empty && !Objects.equals(key, unitKey)) {
                heldRecord = record;
                break;
            }
            addGtfRecord(assembler, record);
            unitKey = key;
            empty = false;
        }
        return empty ? null : assembler.finish();
    }

    private String unitKey(final GffRecord record) {
        return doGene ? record.getGeneId() : record.getTranscriptId();
    }

    private static void addGtfRecord(final GtfTranscriptAssembler assembler, final GffRecord record) {
        assembler.add(record.getFeature(), record.getGeneId(), record.getTranscriptId());
    }

    @Override
    protected List<FeatureNode> readAllFeatures() {
        final List<FeatureNode> features;
        GffRecord record;
        if (gtf) {
            gtfAssembler = new GtfTranscriptAssembler(factory, flags, doGene);
            while ((record = readRecord()) != null) {
                addGtfRecord(gtfAssembler, record);
            }
            features = gtfAssembler.finish();
        } else {
            fileAssembler = new IdentifierAssembler(true);
            while ((record = readRecord()) != null) {
                fileAssembler.add(record.getFeature(), record.getId(), record.getParentIds(), getLineNumber());
            }
            numberOfOrphans += fileAssembler.reconcile();
            features = new ArrayList<>(fileAssembler.getRoots());
        }
        features.forEach(this::collectTypes);
        return features;
    }

    @Override
    protected Collection<FeatureNode> getLookupFeatures() {
        if (gtfAssembler != null) {
            return gtfAssembler.getIdentifiedFeatures().values();
        }
        return fileAssembler != null ? fileAssembler.getIdentifiedFeatures() : Collections.emptyList();
    }

    private void collectTypes(final FeatureNode feature) {
        types.add(feature.getPrimaryTag());
        feature.getChildren().forEach(this::collectTypes);
    }

    @Override
    public int getNumberOfOrphans() {
        return numberOfOrphans;
    }

    /**
     * @return the primary tags of the features read so far, in order of first appearance. The file is parsed first
     * if no feature was retrieved yet.
     */
    @Override
    public String getTypeList() {
        if (!hasStarted()) {
            parseFile();
        }
        return String.join(",", types);
    }
}
