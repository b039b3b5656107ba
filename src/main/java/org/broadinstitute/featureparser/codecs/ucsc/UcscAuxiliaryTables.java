package org.broadinstitute.featureparser.codecs.ucsc;

import com.google.common.collect.ImmutableMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.featureparser.cmdline.argumentcollections.ParserArgumentCollection;
import org.broadinstitute.featureparser.codecs.CodecUtils;
import org.broadinstitute.featureparser.utils.Utils;
import org.broadinstitute.featureparser.utils.io.AnnotationLineReader;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Read-only lookup tables that enrich UCSC gene prediction transcripts: refSeqSummary, refSeqStatus, kgXref,
 * ensemblToGeneName and ensemblSource. Each is a tab-delimited dump keyed by transcript accession in its first
 * column, optionally gzipped. Rows with too few columns are skipped with one warning per table.
 *
 * Lookups try the exact accession first, then the accession without its {@code .version} suffix.
 */
public final class UcscAuxiliaryTables {
    private static final Logger logger = LogManager.getLogger(UcscAuxiliaryTables.class);

    public static final UcscAuxiliaryTables EMPTY = new UcscAuxiliaryTables(ImmutableMap.of(), ImmutableMap.of(),
            ImmutableMap.of(), ImmutableMap.of(), ImmutableMap.of());

    /** A refSeqSummary row: {@code mrnaAcc completeness summary}. */
    public static final class RefSeqSummary {
        private final String completeness;
        private final String summary;

        public RefSeqSummary(final String completeness, final String summary) {
            this.completeness = completeness;
            this.summary = summary;
        }

        public String getCompleteness() {
            return completeness;
        }

        public String getSummary() {
            return summary;
        }
    }

    /** A refSeqStatus row: {@code mrnaAcc status mol}. */
    public static final class RefSeqStatus {
        private final String status;
        private final String molecule;

        public RefSeqStatus(final String status, final String molecule) {
            this.status = status;
            this.molecule = molecule;
        }

        public String getStatus() {
            return status;
        }

        public String getMolecule() {
            return molecule;
        }
    }

    /** A kgXref row: {@code kgID mRNA spID spDisplayID geneSymbol refseq protAcc description ...}. */
    public static final class KgXref {
        private final String geneSymbol;
        private final String description;

        public KgXref(final String geneSymbol, final String description) {
            this.geneSymbol = geneSymbol;
            this.description = description;
        }

        public String getGeneSymbol() {
            return geneSymbol;
        }

        public String getDescription() {
            return description;
        }
    }

    private final Map<String, RefSeqSummary> refSeqSummaries;
    private final Map<String, RefSeqStatus> refSeqStatuses;
    private final Map<String, KgXref> kgXrefs;
    private final Map<String, String> ensemblGeneNames;
    private final Map<String, String> ensemblSources;

    public UcscAuxiliaryTables(final Map<String, RefSeqSummary> refSeqSummaries,
                               final Map<String, RefSeqStatus> refSeqStatuses,
                               final Map<String, KgXref> kgXrefs,
                               final Map<String, String> ensemblGeneNames,
                               final Map<String, String> ensemblSources) {
        this.refSeqSummaries = ImmutableMap.copyOf(refSeqSummaries);
        this.refSeqStatuses = ImmutableMap.copyOf(refSeqStatuses);
        this.kgXrefs = ImmutableMap.copyOf(kgXrefs);
        this.ensemblGeneNames = ImmutableMap.copyOf(ensemblGeneNames);
        this.ensemblSources = ImmutableMap.copyOf(ensemblSources);
    }

    /**
     * Loads the tables named in {@code args}, each of which may be absent.
     */
    public static UcscAuxiliaryTables load(final ParserArgumentCollection args) {
        Utils.nonNull(args);
        if (!args.hasUcscTables()) {
            return EMPTY;
        }
        return new UcscAuxiliaryTables(
                loadTable(ParserArgumentCollection.toPath(args.refSeqSummary), 3, c -> new RefSeqSummary(c.get(1), c.get(2))),
                loadTable(ParserArgumentCollection.toPath(args.refSeqStatus), 3, c -> new RefSeqStatus(c.get(1), c.get(2))),
                loadTable(ParserArgumentCollection.toPath(args.kgXref), 8, c -> new KgXref(c.get(4), c.get(7))),
                loadTable(ParserArgumentCollection.toPath(args.ensemblToGeneName), 2, c -> c.get(1)),
                loadTable(ParserArgumentCollection.toPath(args.ensemblSource), 2, c -> c.get(1)));
    }

    static <T> Map<String, T> loadTable(final Path path, final int minimumColumns, final Function<List<String>, T> rowMapper) {
        if (path == null) {
            return ImmutableMap.of();
        }
        final ImmutableMap.Builder<String, T> table = ImmutableMap.builder();
        final Set<String> seen = new HashSet<>();
        int skipped = 0;
        try (final AnnotationLineReader reader = new AnnotationLineReader(path, null)) {
            String line;
            while ((line = reader.readDataLine()) != null) {
                final List<String> columns = CodecUtils.splitColumns(line);
                if (columns.size() < minimumColumns || columns.get(0).isEmpty()) {
                    skipped++;
                    continue;
                }
                if (seen.add(columns.get(0))) {
                    table.put(columns.get(0), rowMapper.apply(columns));
                }
            }
        }
        if (skipped > 0) {
            logger.warn(String.format("Skipped %d rows of %s with fewer than %d columns", skipped, path, minimumColumns));
        }
        final Map<String, T> loaded = table.build();
        logger.info(String.format("Loaded %d rows from %s", loaded.size(), path));
        return loaded;
    }

    private static <T> T lookup(final Map<String, T> table, final String accession) {
        if (accession == null) {
            return null;
        }
        final T exact = table.get(accession);
        if (exact != null) {
            return exact;
        }
        final int dot = accession.lastIndexOf('.');
        return dot > 0 ? table.get(accession.substring(0, dot)) : null;
    }

    public RefSeqSummary getRefSeqSummary(final String accession) {
        return lookup(refSeqSummaries, accession);
    }

    public RefSeqStatus getRefSeqStatus(final String accession) {
        return lookup(refSeqStatuses, accession);
    }

    public KgXref getKgXref(final String accession) {
        return lookup(kgXrefs, accession);
    }

    public String getEnsemblGeneName(final String accession) {
        return lookup(ensemblGeneNames, accession);
    }

    public String getEnsemblSource(final String accession) {
        return lookup(ensemblSources, accession);
    }

    public boolean isEmpty() {
        return refSeqSummaries.isEmpty() && refSeqStatuses.isEmpty() && kgXrefs.isEmpty()
                && ensemblGeneNames.isEmpty() && ensemblSources.isEmpty();
    }
}
