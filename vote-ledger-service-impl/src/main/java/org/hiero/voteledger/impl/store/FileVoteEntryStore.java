// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.impl.store;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hiero.voteledger.config.StorageConfig;
import org.hiero.voteledger.exceptions.LedgerStorageException;
import org.hiero.voteledger.model.Scope;
import org.hiero.voteledger.model.VoteEntry;

/**
 * Stores each scope's entries in its own JSON-lines journal under {@code <directory>/entries}.
 */
public class FileVoteEntryStore implements VoteEntryStore {
    private static final Logger log = LogManager.getLogger(FileVoteEntryStore.class);

    static final String ENTRIES_DIR = "entries";
    private static final String EXTENSION = ".jsonl";

    private final Path directory;
    private final ObjectMapper mapper;
    private final boolean fsync;
    private final Map<String, JsonLinesJournal<StoredEntry>> journals = new ConcurrentHashMap<>();

    public FileVoteEntryStore(@NonNull final StorageConfig config, @NonNull final ObjectMapper mapper) {
        requireNonNull(config, "config must not be null");
        this.directory = config.directoryPath().resolve(ENTRIES_DIR);
        this.mapper = requireNonNull(mapper, "mapper must not be null");
        this.fsync = config.fsync();
    }

    @NonNull
    @Override
    public List<VoteEntry> load(@NonNull final Scope scope) {
        requireNonNull(scope, "scope must not be null");
        try {
            return journalFor(scope).readAll().stream()
                    .map(StoredEntry::entry)
                    .toList();
        } catch (IOException e) {
            log.error("Failed to read entries of scope {}", scope, e);
            throw new LedgerStorageException("Failed to read entries of scope " + scope, e);
        }
    }

    @Override
    public void append(@NonNull final Scope scope, @NonNull final VoteEntry entry) {
        requireNonNull(scope, "scope must not be null");
        requireNonNull(entry, "entry must not be null");
        try {
            journalFor(scope).append(new StoredEntry(scope, entry));
        } catch (IOException e) {
            log.error("Failed to append entry {} to scope {}", entry.id(), scope, e);
            throw new LedgerStorageException("Failed to append entry to scope " + scope, e);
        }
    }

    @NonNull
    @Override
    public Set<Scope> scopes() {
        if (!Files.isDirectory(directory)) {
            return Set.of();
        }
        final Set<Scope> scopes = new HashSet<>();
        try (final Stream<Path> files = Files.list(directory)) {
            files.map(path -> path.getFileName().toString())
                    .filter(name -> name.endsWith(EXTENSION))
                    .map(name -> parseScopeKey(StoreJson.keyOf(name, EXTENSION)))
                    .forEach(scopes::add);
        } catch (IOException e) {
            log.error("Failed to list entry journals in {}", directory, e);
            throw new LedgerStorageException("Failed to list entry journals", e);
        }
        return scopes;
    }

    private JsonLinesJournal<StoredEntry> journalFor(final Scope scope) {
        return journals.computeIfAbsent(
                scope.key(),
                key -> new JsonLinesJournal<>(
                        directory.resolve(StoreJson.fileNameOf(key, EXTENSION)), StoredEntry.class, mapper, fsync));
    }

    private static Scope parseScopeKey(final String key) {
        final int slash = key.indexOf('/');
        return slash < 0 ? Scope.forElection(key) : Scope.forQuestion(key.substring(0, slash), key.substring(slash + 1));
    }

    /**
     * One journal line; the scope is repeated so a journal file is self-describing.
     */
    public record StoredEntry(@NonNull Scope scope, @NonNull VoteEntry entry) {}
}
