package org.broadinstitute.featureparser.codecs.gff;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import htsjdk.tribble.annotation.Strand;
import org.broadinstitute.featureparser.codecs.AnnotationLineDecoder;
import org.broadinstitute.featureparser.codecs.CodecUtils;
import org.broadinstitute.featureparser.exceptions.UserException;
import org.broadinstitute.featureparser.feature.FeatureNode;
import org.broadinstitute.featureparser.feature.FeatureNodeFactory;
import org.broadinstitute.featureparser.feature.FeatureTypes;
import org.broadinstitute.featureparser.format.AnnotationFileType;
import org.broadinstitute.featureparser.format.AnnotationFlavor;
import org.broadinstitute.featureparser.utils.Utils;
import org.broadinstitute.featureparser.utils.io.IOUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes one 9-column GFF3 or GTF line. Coordinates are already 1-based closed and are kept as they are.
 *
 * <p>GFF3 attributes are {@code key=value} pairs separated by {@code ;}, with multiple values separated by {@code ,}
 * and URL escaping. GTF attributes are {@code key "value";} pairs, a key may repeat.</p>
 *
 * <p>The GFF3 {@code ID} and {@code Parent} attributes, or the GTF {@code gene_id} and {@code transcript_id}, are
 * returned as linkage hints in the {@link GffRecord} and are not resolved here.</p>
 */
public final class GffLineDecoder implements AnnotationLineDecoder<GffRecord> {
    public static final String ID = "ID";
    public static final String PARENT = "Parent";
    public static final String NAME = "Name";
    public static final String PHASE = "phase";

    /** Attributes kept when simplifying: identifiers, parents, names and biotypes. */
    public static final Set<String> STRUCTURAL_ATTRIBUTES = ImmutableSet.of(ID, PARENT, NAME,
            "gene_id", "transcript_id", "gene_name", "transcript_name",
            "gene_type", "gene_biotype", "transcript_type", "transcript_biotype", "biotype");

    private static final Splitter ATTRIBUTE_SPLITTER = Splitter.on(';').trimResults().omitEmptyStrings();
    private static final Splitter VALUE_SPLITTER = Splitter.on(',');
    private static final Pattern GTF_ATTRIBUTE = Pattern.compile("\\s*([^\\s;\"]+)\\s+(?:\"([^\"]*)\"|([^;\\s]+))\\s*;?");

    private final boolean gtf;
    private final FeatureNodeFactory factory;
    private final String sourceOverride;
    private final boolean simplify;

    /**
     * @param factory creates the features; its source tag is used when the source column is empty
     * @param sourceOverride source tag given to every feature instead of the source column, may be {@code null}
     * @param simplify whether to keep only {@link #STRUCTURAL_ATTRIBUTES}
     */
    public GffLineDecoder(final AnnotationFileType fileType, final FeatureNodeFactory factory,
                          final String sourceOverride, final boolean simplify) {
        Utils.nonNull(fileType);
        Utils.validateArg(fileType.getFlavor() == AnnotationFlavor.GFF, () -> fileType + " is not a GFF type");
        this.gtf = fileType == AnnotationFileType.GTF;
        this.factory = Utils.nonNull(factory);
        this.sourceOverride = sourceOverride;
        this.simplify = simplify;
    }

    @Override
    public GffRecord decode(final String line, final int lineNumber) {
        Utils.nonNull(line);
        final List<String> columns = CodecUtils.splitColumns(line);
        if (columns.size() != 9) {
            throw new UserException.MalformedLine(lineNumber, line,
                    String.format("%s lines must have 9 columns but this one has %d", gtf ? "GTF" : "GFF3", columns.size()));
        }
        final String seqId = columns.get(0);
        final String type = columns.get(2);
        if (seqId.isEmpty() || type.isEmpty()) {
            throw new UserException.MalformedLine(lineNumber, line, "the seqid and type columns must not be empty");
        }
        final int start = CodecUtils.parseInteger(columns, 3, "start", lineNumber, line);
        final int end = CodecUtils.parseInteger(columns, 4, "end", lineNumber, line);
        if (start < 1 || end < start) {
            throw new UserException.MalformedLine(lineNumber, line, String.format("start %d and end %d do not make a 1-based interval", start, end));
        }
        final Strand strand;
        try {
            strand = FeatureNode.decodeStrand(columns.get(6));
        } catch (final IllegalArgumentException e) {
            throw new UserException.MalformedLine(lineNumber, line, e.getMessage(), e);
        }

        final FeatureNode feature = factory.newFeature(seqId, start, end, strand, type);
        feature.setSourceTag(source(columns.get(1)));
        feature.setScore(CodecUtils.parseOptionalDouble(columns.get(5), "score", lineNumber, line));
        if (!".".equals(columns.get(7)) && !columns.get(7).isEmpty()) {
            feature.addAttribute(PHASE, columns.get(7));
        }
        if (gtf) {
            parseGtfAttributes(feature, columns.get(8), lineNumber, line);
        } else {
            parseGff3Attributes(feature, columns.get(8), lineNumber, line);
        }

        final String id;
        final List<String> parentIds;
        final String geneId = feature.getAttribute("gene_id");
        final String transcriptId = feature.getAttribute("transcript_id");
        if (gtf) {
            parentIds = Collections.emptyList();
            if (FeatureTypes.GENE.equalsIgnoreCase(type)) {
                id = geneId;
                feature.setDisplayName(feature.getAttribute("gene_name"));
            } else if (FeatureTypes.isTranscriptTag(type)) {
                id = transcriptId;
                feature.setDisplayName(feature.getAttribute("transcript_name"));
            } else {
                id = null;
            }
        } else {
            id = feature.getAttribute(ID);
            parentIds = new ArrayList<>(feature.getAttributeValues(PARENT));
            if (id != null && parentIds.contains(id)) {
                throw new UserException.MalformedLine(lineNumber, line, "the feature " + id + " names itself as its Parent");
            }
            feature.setDisplayName(feature.getAttribute(NAME));
        }
        feature.setPrimaryId(id != null ? id : String.format("%s:%d-%d", seqId, start, end));

        if (simplify) {
            for (final String tag : feature.getAttributeTags()) {
                if (!STRUCTURAL_ATTRIBUTES.contains(tag)) {
                    feature.removeAttribute(tag);
                }
            }
        }
        return new GffRecord(feature, id, parentIds, geneId, transcriptId);
    }

    private String source(final String column) {
        if (sourceOverride != null) {
            return sourceOverride;
        }
        return column.isEmpty() || ".".equals(column) ? factory.getSourceTag() : column;
    }

    private static void parseGff3Attributes(final FeatureNode feature, final String attributes, final int lineNumber, final String line) {
        if (".".equals(attributes)) {
            return;
        }
        for (final String attribute : ATTRIBUTE_SPLITTER.split(attributes)) {
            final int equals = attribute.indexOf('=');
            if (equals <= 0) {
                throw new UserException.MalformedLine(lineNumber, line, "attribute '" + attribute + "' is not a key=value pair");
            }
            final String key = IOUtils.urlDecode(attribute.substring(0, equals).trim());
            for (final String value : VALUE_SPLITTER.split(attribute.substring(equals + 1))) {
                feature.addAttribute(key, IOUtils.urlDecode(value.trim()));
            }
        }
    }

    private static void parseGtfAttributes(final FeatureNode feature, final String attributes, final int lineNumber, final String line) {
        if (".".equals(attributes) || attributes.trim().isEmpty()) {
            return;
        }
        final Matcher matcher = GTF_ATTRIBUTE.matcher(attributes);
        int position = 0;
        while (position < attributes.length() && matcher.find(position) && matcher.start() == position) {
            final String value = matcher.group(2) != null ? matcher.group(2) : matcher.group(3);
            feature.addAttribute(matcher.group(1), value);
            position = matcher.end();
        }
        if (!attributes.substring(position).trim().isEmpty()) {
            throw new UserException.MalformedLine(lineNumber, line,
                    "could not parse GTF attributes from '" + attributes.substring(position) + "'");
        }
    }
}
