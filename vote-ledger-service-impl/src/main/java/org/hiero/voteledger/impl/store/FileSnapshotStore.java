// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.impl.store;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hiero.voteledger.config.StorageConfig;
import org.hiero.voteledger.exceptions.LedgerStorageException;
import org.hiero.voteledger.model.LedgerSnapshot;
import org.hiero.voteledger.model.Scope;

/**
 * Keeps all published snapshots in {@code <directory>/snapshots.jsonl}.
 */
public class FileSnapshotStore implements SnapshotStore {
    private static final Logger log = LogManager.getLogger(FileSnapshotStore.class);

    static final String FILE_NAME = "snapshots.jsonl";

    private final JsonLinesJournal<LedgerSnapshot> journal;

    public FileSnapshotStore(@NonNull final StorageConfig config, @NonNull final ObjectMapper mapper) {
        requireNonNull(config, "config must not be null");
        requireNonNull(mapper, "mapper must not be null");
        this.journal = new JsonLinesJournal<>(
                config.directoryPath().resolve(FILE_NAME), LedgerSnapshot.class, mapper, config.fsync());
    }

    @Override
    public void append(@NonNull final LedgerSnapshot snapshot) {
        requireNonNull(snapshot, "snapshot must not be null");
        try {
            journal.append(snapshot);
        } catch (IOException e) {
            log.error("Failed to publish snapshot of scope {}", snapshot.scope(), e);
            throw new LedgerStorageException("Failed to publish snapshot of scope " + snapshot.scope(), e);
        }
    }

    @NonNull
    @Override
    public List<LedgerSnapshot> load(@NonNull final Scope scope) {
        requireNonNull(scope, "scope must not be null");
        try {
            return journal.readAll().stream()
                    .filter(snapshot -> snapshot.scope().equals(scope))
                    .toList();
        } catch (IOException e) {
            log.error("Failed to read snapshot log {}", journal.file(), e);
            throw new LedgerStorageException("Failed to read snapshot log", e);
        }
    }
}
