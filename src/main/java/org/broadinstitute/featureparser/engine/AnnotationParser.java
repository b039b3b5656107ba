package org.broadinstitute.featureparser.engine;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.featureparser.assembly.IdentifierTable;
import org.broadinstitute.featureparser.assembly.SubfeatureFlags;
import org.broadinstitute.featureparser.cmdline.argumentcollections.ParserArgumentCollection;
import org.broadinstitute.featureparser.exceptions.ParserException;
import org.broadinstitute.featureparser.feature.FeatureNode;
import org.broadinstitute.featureparser.feature.FeatureNodeFactory;
import org.broadinstitute.featureparser.feature.FeatureTypes;
import org.broadinstitute.featureparser.format.AnnotationFileType;
import org.broadinstitute.featureparser.format.AnnotationFlavor;
import org.broadinstitute.featureparser.format.FormatTaster;
import org.broadinstitute.featureparser.utils.Utils;
import org.broadinstitute.featureparser.utils.io.AnnotationLineReader;
import org.broadinstitute.featureparser.utils.io.IOUtils;

import java.io.Closeable;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads one annotation file into trees of {@link FeatureNode}s.
 *
 * <p>Features are retrieved in one of two modes, chosen by the first retrieval call:</p>
 * <ul>
 *     <li>streaming: {@link #nextFeature()} decodes and returns one top level feature at a time and holds on to
 *     nothing, so memory stays bounded. A child whose parent has not been read yet can not be linked and is
 *     dropped as an orphan.</li>
 *     <li>materializing: {@link #parseFile()}, {@link #getTopFeatures()}, {@link #nextTopFeature()} and
 *     {@link #fetch(String)} read the whole file once, resolving forward references, and keep every top level
 *     feature for lookup.</li>
 * </ul>
 * <p>Mixing the two modes on one parser fails with {@link ParserException.InvalidModeTransition}.</p>
 *
 * <p>Use {@link #open(Path, ParserArgumentCollection)} to get the parser matching the dialect of a file.
 * A parser is not thread safe; parse several files concurrently with one parser per file.</p>
 */
public abstract class AnnotationParser implements Closeable {
    protected static final Logger logger = LogManager.getLogger(AnnotationParser.class);

    private final Path file;
    private final AnnotationFileType fileType;
    protected final ParserArgumentCollection arguments;
    protected final FeatureNodeFactory factory;
    protected final SubfeatureFlags flags;

    private ParserState state = ParserState.UNOPENED;
    private AnnotationLineReader reader;
    private boolean endOfFeatures = false;
    private boolean closedEarly = false;
    private boolean streamed = false;
    private boolean materialized = false;

    private final List<String> comments = new ArrayList<>();
    private final Map<String, Integer> seqIdLengths = new LinkedHashMap<>();
    private final IdentifierTable loaded = new IdentifierTable();
    private final List<FeatureNode> topFeatures = new ArrayList<>();
    private final Deque<FeatureNode> ready = new ArrayDeque<>();
    private int nextTopFeatureIndex = 0;

    protected AnnotationParser(final Path file, final AnnotationFileType fileType, final ParserArgumentCollection arguments) {
        this.file = Utils.nonNull(file);
        this.fileType = Utils.nonNull(fileType);
        this.arguments = Utils.nonNull(arguments);
        final String sourceTag = arguments.source != null ? arguments.source : IOUtils.getBaseName(file);
        this.factory = new FeatureNodeFactory(arguments.getFeatureClass(), sourceTag);
        this.flags = SubfeatureFlags.fromArguments(arguments);
    }

    /**
     * Opens {@code file} with the default switches.
     */
    public static AnnotationParser open(final Path file) {
        return open(file, new ParserArgumentCollection());
    }

    /**
     * Tastes {@code file} and opens it with the parser for its dialect.
     *
     * @throws org.broadinstitute.featureparser.exceptions.UserException.UnrecognizedFormat if the dialect is unknown
     * @throws org.broadinstitute.featureparser.exceptions.UserException.CouldNotReadInputFile if the file can not be read
     */
    public static AnnotationParser open(final Path file, final ParserArgumentCollection arguments) {
        Utils.nonNull(file);
        Utils.nonNull(arguments);
        return open(file, FormatTaster.taste(file), arguments);
    }

    /**
     * Opens {@code file} as {@code fileType} without tasting it.
     */
    public static AnnotationParser open(final Path file, final AnnotationFileType fileType, final ParserArgumentCollection arguments) {
        final AnnotationParser parser;
        switch (fileType.getFlavor()) {
            case BED:
                parser = new BedAnnotationParser(file, fileType, arguments);
                break;
            case UCSC:
                parser = new UcscAnnotationParser(file, fileType, arguments);
                break;
            case GFF:
                parser = new GffAnnotationParser(file, fileType, arguments);
                break;
            default:
                throw new ParserException.ShouldNeverReachHereException("Unknown flavor " + fileType.getFlavor());
        }
        parser.openFile();
        return parser;
    }

    private void openFile() {
        if (state == ParserState.UNOPENED) {
            reader = new AnnotationLineReader(file, this::onComment);
            state = ParserState.OPEN;
        }
    }

    /**
     * @return the next top level feature with all of its children, or {@code null} once the file is exhausted, at
     * which point the file is closed
     * @throws ParserException.InvalidModeTransition if features were already retrieved in materializing mode
     */
    public FeatureNode nextFeature() {
        checkMode(ParserState.STREAMING, "stream features with nextFeature");
        if (state == ParserState.EXHAUSTED) {
            return null;
        }
        openFile();
        state = ParserState.STREAMING;
        while (ready.isEmpty()) {
            final List<FeatureNode> unit = readUnitOrClose();
            if (unit == null) {
                finish();
                return null;
            }
            ready.addAll(unit);
        }
        final FeatureNode feature = ready.removeFirst();
        recordExtent(feature);
        return feature;
    }

    /**
     * Reads the whole file, resolving every parent reference. Calling it again does nothing.
     *
     * @throws ParserException.InvalidModeTransition if features were already retrieved in streaming mode
     */
    public void parseFile() {
        checkMode(ParserState.MATERIALIZING, "parse the whole file");
        if (state == ParserState.EXHAUSTED) {
            return;
        }
        openFile();
        state = ParserState.MATERIALIZING;
        logger.info(String.format("Parsing %s format file %s....", fileType, file));

        final List<FeatureNode> features;
        try {
            features = readAllFeatures();
        } catch (final RuntimeException e) {
            close();
            throw e;
        }
        for (final FeatureNode feature : features) {
            loaded.register(feature);
            topFeatures.add(feature);
            recordExtent(feature);
        }
        for (final FeatureNode feature : getLookupFeatures()) {
            loaded.registerIfAbsent(feature);
        }
        finish();

        final int orphans = getNumberOfOrphans();
        if (orphans > 0) {
            logger.warn(String.format("Dropped %d features of %s whose parents were never found", orphans, file));
        }
        logger.info(String.format("Loaded %d top level features from %s", topFeatures.size(), file));
    }

    /**
     * @return every top level feature in file order, parsing the file first if needed
     */
    public List<FeatureNode> getTopFeatures() {
        parseFile();
        return Collections.unmodifiableList(topFeatures);
    }

    /**
     * Iterates over the top level features, parsing the file first if needed.
     *
     * @return the next top level feature, or {@code null} after the last one, in which case the following call
     * starts over from the first
     */
    public FeatureNode nextTopFeature() {
        parseFile();
        if (nextTopFeatureIndex >= topFeatures.size()) {
            nextTopFeatureIndex = 0;
            return null;
        }
        return topFeatures.get(nextTopFeatureIndex++);
    }

    /**
     * @return the feature loaded with primary id {@code id}, or {@code null}, parsing the file first if needed
     */
    public FeatureNode fetch(final String id) {
        Utils.nonNull(id);
        parseFile();
        return loaded.get(id);
    }

    /**
     * @return the number of features that can be fetched, parsing the file first if needed
     */
    public int getNumberLoaded() {
        parseFile();
        return loaded.size();
    }

    /**
     * @return the greatest end coordinate seen on each sequence, in order of first appearance. The file is parsed
     * first unless it is being streamed, in which case the features streamed so far are covered.
     */
    public Map<String, Integer> getSeqIdLengths() {
        if (state == ParserState.UNOPENED || state == ParserState.OPEN) {
            parseFile();
        }
        return Collections.unmodifiableMap(seqIdLengths);
    }

    public List<String> getSeqIds() {
        return new ArrayList<>(getSeqIdLengths().keySet());
    }

    /**
     * @return the comment, track, browser and directive lines read so far, verbatim
     */
    public List<String> getComments() {
        return Collections.unmodifiableList(comments);
    }

    /**
     * @return the number of features dropped because a parent they name was never found
     */
    public int getNumberOfOrphans() {
        return 0;
    }

    /**
     * @return comma separated primary tags of the features this parser produces
     */
    public abstract String getTypeList();

    public AnnotationFileType getFileType() {
        return fileType;
    }

    public AnnotationFlavor getFlavor() {
        return fileType.getFlavor();
    }

    public Path getFile() {
        return file;
    }

    public ParserState getState() {
        return state;
    }

    public SubfeatureFlags getSubfeatureFlags() {
        return flags;
    }

    /**
     * Closes the file. Features already materialized stay available, further reading fails.
     */
    @Override
    public void close() {
        if (state != ParserState.EXHAUSTED) {
            closedEarly = true;
            state = ParserState.EXHAUSTED;
        }
        if (reader != null) {
            reader.close();
        }
    }

    /**
     * Reads the next group of lines that make up complete top level features.
     *
     * @return the top level features of the group, possibly none, or {@code null} at the end of the file
     */
    protected abstract List<FeatureNode> readUnit();

    /**
     * @return every top level feature of the file, with parent references resolved
     */
    protected abstract List<FeatureNode> readAllFeatures();

    /**
     * @return nested features that may be fetched by id in addition to the top level ones
     */
    protected Collection<FeatureNode> getLookupFeatures() {
        return Collections.emptyList();
    }

    /**
     * Receives every non-data line as it is read.
     */
    protected void onComment(final String line) {
        comments.add(line);
    }

    /**
     * @return the next data line, or {@code null} at the end of the features
     */
    protected final String readDataLine() {
        if (reader == null || reader.isClosed()) {
            return null;
        }
        final String line = reader.readDataLine();
        if (line != null && endOfFeatures) {
            reader.close();
            return null;
        }
        return line;
    }

    /**
     * Marks the rest of the file as something other than features, e.g. the sequences after a GFF3 {@code ##FASTA}.
     */
    protected final void endFeatures() {
        endOfFeatures = true;
    }

    /**
     * @return the number of the line returned last by {@link #readDataLine()}
     */
    protected final int getLineNumber() {
        return reader == null ? 0 : reader.getLineNumber();
    }

    /**
     * @return true once a retrieval mode has been chosen
     */
    protected final boolean hasStarted() {
        return state != ParserState.UNOPENED && state != ParserState.OPEN;
    }

    private void checkMode(final ParserState requested, final String action) {
        if (closedEarly) {
            throw new ParserException(String.format("Cannot %s: the parser for %s was closed.", action, file));
        }
        if (requested == ParserState.STREAMING && (materialized || state == ParserState.MATERIALIZING)) {
            throw new ParserException.InvalidModeTransition("materializing", action);
        }
        if (requested == ParserState.MATERIALIZING && (streamed || state == ParserState.STREAMING)) {
            throw new ParserException.InvalidModeTransition("streaming", action);
        }
        if (requested == ParserState.STREAMING) {
            streamed = true;
        } else {
            materialized = true;
        }
    }

    // a failed read leaves the file at an unknown position, so it can not be resumed
    private List<FeatureNode> readUnitOrClose() {
        try {
            return readUnit();
        } catch (final RuntimeException e) {
            close();
            throw e;
        }
    }

    private void finish() {
        state = ParserState.EXHAUSTED;
        if (reader != null) {
            reader.close();
        }
    }

    private void recordExtent(final FeatureNode feature) {
        seqIdLengths.merge(feature.getContig(), feature.getEnd(), Math::max);
        for (final FeatureNode child : feature.getChildren()) {
            recordExtent(child);
        }
    }

    /**
     * @return the primary tags produced for transcripts decoded from exon blocks with the given switches
     */
    protected static List<String> transcriptTypes(final boolean doGene, final SubfeatureFlags flags) {
        final List<String> types = new ArrayList<>();
        if (doGene) {
            types.add(FeatureTypes.GENE);
        }
        types.add(FeatureTypes.MRNA);
        types.add(FeatureTypes.NCRNA);
        if (flags.doExon()) {
            types.add(FeatureTypes.EXON);
        }
        if (flags.doCds()) {
            types.add(FeatureTypes.CDS);
        }
        if (flags.doUtr()) {
            types.add(FeatureTypes.FIVE_PRIME_UTR);
            types.add(FeatureTypes.THREE_PRIME_UTR);
        }
        if (flags.doCodon()) {
            types.add(FeatureTypes.START_CODON);
            types.add(FeatureTypes.STOP_CODON);
        }
        return types;
    }
}
