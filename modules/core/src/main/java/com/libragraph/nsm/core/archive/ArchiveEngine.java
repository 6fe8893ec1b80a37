package com.libragraph.nsm.core.archive;

import com.libragraph.nsm.core.ledger.UsageLedger;
import com.libragraph.nsm.core.search.OccurrenceCounter;
import com.libragraph.nsm.core.search.Tokenizer;
import com.libragraph.nsm.formats.api.ArchiveError;
import com.libragraph.nsm.formats.api.ArchiveException;
import com.libragraph.nsm.formats.archive.ArchiveHeader;
import com.libragraph.nsm.formats.archive.ArchiveIndex;
import com.libragraph.nsm.formats.archive.IndexEntry;
import com.libragraph.nsm.formats.archive.SearchIndex;
import com.libragraph.nsm.formats.compress.CompressionEngine;
import com.libragraph.nsm.formats.crypto.FrameCipher;
import org.apache.commons.io.output.NullOutputStream;
import org.jboss.logging.Logger;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Create, extract, search, inspect and verify archives.
 *
 * <p>Only {@link #create} touches the {@link UsageLedger}: it takes one token
 * after the inputs are planned and before anything is written. The token is
 * not refunded if the create fails later on.
 */
public class ArchiveEngine {

    private static final Logger log = Logger.getLogger(ArchiveEngine.class);

    private final CompressionEngine compression;
    private final UsageLedger ledger;
    private final int defaultMaxResults;

    public ArchiveEngine(CompressionEngine compression, UsageLedger ledger) {
        this(compression, ledger, SearchOptions.DEFAULT_MAX_RESULTS);
    }

    public ArchiveEngine(CompressionEngine compression, UsageLedger ledger, int defaultMaxResults) {
        this.compression = Objects.requireNonNull(compression, "compression");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.defaultMaxResults = defaultMaxResults;
    }

    public SearchOptions defaultSearchOptions() {
        return new SearchOptions(false, defaultMaxResults);
    }

    // --- Create ---

    public ArchiveSummary create(Path output, List<Path> inputs, CreateOptions options) {
        Objects.requireNonNull(output, "output");
        List<InputPlanner.PlannedInput> plan = InputPlanner.plan(inputs);

        int remaining = ledger.consumeToken();
        log.infof("Creating archive %s from %d files (%s%s)", output, plan.size(),
                options.compression().label(), options.cipher() != null ? ", encrypted" : "");

        ArchiveWriter.Written written = new ArchiveWriter(compression, options).write(output, plan);
        ArchiveIndex index = written.index();
        ArchiveSummary summary = new ArchiveSummary(output, index.size(), index.totalUncompressed(),
                written.header().dataBlockLength(), written.archiveSize(), options.compression(),
                written.header().encrypted(), index.searchIndex().map(SearchIndex::tokenCount).orElse(0),
                remaining);
        log.infof("Created archive %s: %d entries, %d -> %d bytes", output, summary.entryCount(),
                summary.totalUncompressed(), summary.archiveSize());
        return summary;
    }

    public ArchiveSummary create(Path output, List<Path> inputs) {
        return create(output, inputs, CreateOptions.defaults());
    }

    // --- Extract ---

    public ExtractResult extract(Path archive, EntrySelection selection, Path destination, FrameCipher cipher) {
        Path root = destination.toAbsolutePath().normalize();
        try (ArchiveReader reader = ArchiveReader.open(archive, compression, cipher)) {
            reader.verifyDataChecksum();
            ArchiveIndex index = reader.index();

            List<String> extracted = new ArrayList<>();
            List<EntryFailure> failures = new ArrayList<>();
            long bytes = 0;
            for (IndexEntry entry : index.entries()) {
                if (!selection.includes(entry.path())) continue;
                Path target = resolveInside(root, entry.path());
                if (target == null) {
                    log.warnf("Skipping unsafe entry path %s in %s", entry.path(), archive);
                    failures.add(new EntryFailure(entry.path(), ArchiveError.UNSAFE_PATH,
                            "Entry path escapes the destination directory"));
                    continue;
                }
                bytes += extractEntry(reader, entry, target);
                extracted.add(entry.path());
            }
            for (String requested : selection.paths()) {
                if (index.find(requested).isEmpty()) {
                    failures.add(new EntryFailure(requested, ArchiveError.ENTRY_NOT_FOUND,
                            "No such entry in archive"));
                }
            }
            log.infof("Extracted %d entries (%d bytes) from %s to %s, %d failed",
                    extracted.size(), bytes, archive, root, failures.size());
            return new ExtractResult(root, extracted, failures, bytes);
        }
    }

    public ExtractResult extract(Path archive, EntrySelection selection, Path destination) {
        return extract(archive, selection, destination, null);
    }

    private long extractEntry(ArchiveReader reader, IndexEntry entry, Path target) {
        Path temp = null;
        try {
            Files.createDirectories(target.getParent());
            temp = Files.createTempFile(target.getParent(), "." + target.getFileName(), ".part");
            long written;
            try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(temp))) {
                written = reader.decode(entry, out);
            }
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            temp = null;
            FileModes.apply(target, entry.mode());
            Files.setLastModifiedTime(target, FileTime.fromMillis(entry.modifiedMillis()));
            return written;
        } catch (IOException e) {
            throw new ArchiveException(ArchiveError.ARCHIVE_WRITE_FAILURE,
                    "Failed to write " + target + ": " + e.getMessage(), e);
        } finally {
            if (temp != null) {
                deleteTemp(temp);
            }
        }
    }

    /**
     * Resolves an entry path below {@code root}, or null if it would escape.
     */
    static Path resolveInside(Path root, String entryPath) {
        if (entryPath.isEmpty() || entryPath.startsWith("/") || entryPath.contains("\\")) {
            return null;
        }
        for (String segment : entryPath.split("/")) {
            if (segment.equals("..")) {
                return null;
            }
        }
        Path target = root.resolve(entryPath).normalize();
        return target.startsWith(root) && !target.equals(root) ? target : null;
    }

    private static void deleteTemp(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warnf(e, "Failed to delete temp file %s", temp);
        }
    }

    // --- Search ---

    public SearchResult search(Path archive, String query, SearchOptions options, FrameCipher cipher) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Search query must not be blank");
        }
        Tokenizer.Query analyzed = Tokenizer.analyze(query);
        try (ArchiveReader reader = ArchiveReader.open(archive, compression, cipher)) {
            ArchiveIndex index = reader.index();
            SearchIndex searchIndex = index.searchIndex().orElse(null);

            SearchResult result;
            if (!options.substring() && searchIndex != null && analyzed.indexable()) {
                result = new SearchResult(query, searchIndexed(reader, searchIndex, analyzed, options), true);
            } else {
                result = new SearchResult(query, scanAll(reader, query, options), false);
            }
            log.debugf("Search '%s' in %s: %d hits (%s)", query, archive, result.hits().size(),
                    result.fromIndex() ? "index" : "scan");
            return result;
        }
    }

    public SearchResult search(Path archive, String query) {
        return search(archive, query, defaultSearchOptions(), null);
    }

    /**
     * Index tier. Every query term keeps only the entries holding an indexed
     * token that could contain it at that position of a verbatim match;
     * unindexed entries are always kept. A single-token query is counted from
     * the postings, anything else by decoding the remaining candidates. Hits
     * are gathered in index order and capped the same way as the scan.
     */
    private List<SearchHit> searchIndexed(ArchiveReader reader, SearchIndex searchIndex,
                                          Tokenizer.Query query, SearchOptions options) {
        Map<Integer, Long> postingMatches = query.singleToken() ? new HashMap<>() : null;
        Set<Integer> candidates = null;
        for (Tokenizer.Term term : query.terms()) {
            Set<Integer> holding = new HashSet<>();
            for (String token : searchIndex.tokens()) {
                if (!term.matches(token)) continue;
                long perOccurrence = postingMatches == null ? 0 : occurrencesWithin(token, term.token());
                for (SearchIndex.Posting p : searchIndex.postings(token)) {
                    holding.add(p.entryOrdinal());
                    if (postingMatches != null) {
                        postingMatches.merge(p.entryOrdinal(), perOccurrence * p.occurrences(), Long::sum);
                    }
                }
            }
            if (candidates == null) {
                candidates = holding;
            } else {
                candidates.retainAll(holding);
            }
        }
        SortedSet<Integer> unindexed = searchIndex.unindexedEntries();
        TreeSet<Integer> ordered = new TreeSet<>(candidates);
        ordered.addAll(unindexed);

        List<SearchHit> hits = new ArrayList<>();
        ArchiveIndex index = reader.index();
        for (int ordinal : ordered) {
            IndexEntry entry = index.get(ordinal);
            long matches = postingMatches != null && !unindexed.contains(ordinal)
                    ? postingMatches.getOrDefault(ordinal, 0L)
                    : countOccurrences(reader, entry, query.text());
            if (matches > 0) {
                hits.add(new SearchHit(entry.path(), matches, entry.uncompressedSize()));
                if (hits.size() >= options.maxResults()) break;
            }
        }
        return rank(hits, options.maxResults());
    }

    /**
     * Non-overlapping occurrences of {@code word} inside one indexed token.
     * Both are lowercased; a match of an all-word query never spans tokens.
     */
    static long occurrencesWithin(String token, String word) {
        long count = 0;
        for (int at = token.indexOf(word); at >= 0; at = token.indexOf(word, at + word.length())) {
            count++;
        }
        return count;
    }

    private List<SearchHit> scanAll(ArchiveReader reader, String query, SearchOptions options) {
        List<SearchHit> hits = new ArrayList<>();
        for (IndexEntry entry : reader.index().entries()) {
            long matches = countOccurrences(reader, entry, query);
            if (matches > 0) {
                hits.add(new SearchHit(entry.path(), matches, entry.uncompressedSize()));
                if (hits.size() >= options.maxResults()) break;
            }
        }
        return rank(hits, options.maxResults());
    }

    private static long countOccurrences(ArchiveReader reader, IndexEntry entry, String query) {
        OccurrenceCounter counter = new OccurrenceCounter(query);
        reader.decode(entry, counter);
        return counter.count();
    }

    private static List<SearchHit> rank(List<SearchHit> hits, int limit) {
        return hits.stream().sorted(SearchHit.RANKING).limit(limit).toList();
    }

    // --- Inspect / Verify ---

    public ArchiveInfo inspect(Path archive, FrameCipher cipher) {
        try (ArchiveReader reader = ArchiveReader.open(archive, compression, cipher)) {
            return describe(archive, reader);
        }
    }

    /**
     * Full integrity pass: data block checksum, then every frame decoded and
     * checked against its content checksum. Writes nothing.
     */
    public ArchiveInfo verify(Path archive, FrameCipher cipher) {
        try (ArchiveReader reader = ArchiveReader.open(archive, compression, cipher)) {
            reader.verifyDataChecksum();
            for (IndexEntry entry : reader.index().entries()) {
                reader.decode(entry, NullOutputStream.INSTANCE);
            }
            log.infof("Verified %s: %d entries OK", archive, reader.index().size());
            return describe(archive, reader);
        }
    }

    private static ArchiveInfo describe(Path archive, ArchiveReader reader) {
        ArchiveHeader header = reader.header();
        ArchiveIndex index = reader.index();
        return new ArchiveInfo(archive, header.version(), header.compression(), header.encryption(),
                Instant.ofEpochMilli(header.createdAtMillis()), header.dataBlockLength(), header.indexLength(),
                reader.size(), header.dataChecksum().toHex(), index.searchIndex().isPresent(),
                index.searchIndex().map(SearchIndex::tokenCount).orElse(0), index.entries());
    }
}
