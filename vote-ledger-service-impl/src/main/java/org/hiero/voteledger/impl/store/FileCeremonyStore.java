// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.impl.store;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hiero.voteledger.config.StorageConfig;
import org.hiero.voteledger.exceptions.LedgerStorageException;
import org.hiero.voteledger.model.DecryptionCeremony;

/**
 * Writes each election's attempts to {@code <directory>/ceremonies/<election>.json}. A save writes a temporary
 * file and moves it over the old one atomically, so a reader sees either the old or the new attempts.
 */
public class FileCeremonyStore implements CeremonyStore {
    private static final Logger log = LogManager.getLogger(FileCeremonyStore.class);

    static final String CEREMONIES_DIR = "ceremonies";
    private static final String EXTENSION = ".json";
    private static final String TEMP_EXTENSION = ".tmp";
    private static final TypeReference<List<DecryptionCeremony>> ATTEMPTS = new TypeReference<>() {};

    private final Path directory;
    private final ObjectMapper mapper;
    private final boolean fsync;

    public FileCeremonyStore(@NonNull final StorageConfig config, @NonNull final ObjectMapper mapper) {
        requireNonNull(config, "config must not be null");
        this.directory = config.directoryPath().resolve(CEREMONIES_DIR);
        this.mapper = requireNonNull(mapper, "mapper must not be null");
        this.fsync = config.fsync();
    }

    @Override
    public void save(@NonNull final String electionId, @NonNull final List<DecryptionCeremony> attempts) {
        requireNonNull(electionId, "electionId must not be null");
        requireNonNull(attempts, "attempts must not be null");
        final Path target = directory.resolve(StoreJson.fileNameOf(electionId, EXTENSION));
        final Path temp = directory.resolve(StoreJson.fileNameOf(electionId, EXTENSION + TEMP_EXTENSION));
        try {
            Files.createDirectories(directory);
            Files.write(temp, mapper.writeValueAsBytes(attempts));
            if (fsync) {
                try (final FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE)) {
                    channel.force(true);
                }
            }
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            log.error("Failed to save ceremonies of election {}", electionId, e);
            throw new LedgerStorageException("Failed to save ceremonies of election " + electionId, e);
        }
    }

    @NonNull
    @Override
    public Map<String, List<DecryptionCeremony>> loadAll() {
        final Map<String, List<DecryptionCeremony>> all = new HashMap<>();
        if (!Files.isDirectory(directory)) {
            return all;
        }
        try (final Stream<Path> files = Files.list(directory)) {
            for (final Path file : files.toList()) {
                final String name = file.getFileName().toString();
                if (name.endsWith(EXTENSION)) {
                    all.put(StoreJson.keyOf(name, EXTENSION), mapper.readValue(file.toFile(), ATTEMPTS));
                } else if (name.endsWith(TEMP_EXTENSION)) {
                    log.warn("Removing unfinished ceremony save {}", file);
                    Files.delete(file);
                }
            }
        } catch (IOException e) {
            log.error("Failed to load ceremonies from {}", directory, e);
            throw new LedgerStorageException("Failed to load ceremonies", e);
        }
        return all;
    }
}
