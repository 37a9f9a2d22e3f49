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

/**
 * Keeps the nullifier log in {@code <directory>/nullifiers.jsonl}.
 */
public class FileNullifierStore implements NullifierStore {
    private static final Logger log = LogManager.getLogger(FileNullifierStore.class);

    static final String FILE_NAME = "nullifiers.jsonl";

    private final JsonLinesJournal<NullifierEvent> journal;

    public FileNullifierStore(@NonNull final StorageConfig config, @NonNull final ObjectMapper mapper) {
        requireNonNull(config, "config must not be null");
        requireNonNull(mapper, "mapper must not be null");
        this.journal = new JsonLinesJournal<>(
                config.directoryPath().resolve(FILE_NAME), NullifierEvent.class, mapper, config.fsync());
    }

    @NonNull
    @Override
    public List<NullifierEvent> load() {
        try {
            return journal.readAll();
        } catch (IOException e) {
            log.error("Failed to read nullifier log {}", journal.file(), e);
            throw new LedgerStorageException("Failed to read nullifier log", e);
        }
    }

    @Override
    public void append(@NonNull final NullifierEvent event) {
        requireNonNull(event, "event must not be null");
        try {
            journal.append(event);
        } catch (IOException e) {
            log.error("Failed to record nullifier {} in scope {}", event.type(), event.record().scope(), e);
            throw new LedgerStorageException("Failed to record nullifier " + event.type(), e);
        }
    }
}
