// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.config;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.nio.file.Path;

/**
 * Configuration of the durable stores.
 *
 * @param directory root directory holding the entry, nullifier, snapshot and ceremony files
 * @param fsync     whether every journal append is forced to the storage device before it is acknowledged
 */
public record StorageConfig(@NonNull String directory, boolean fsync) {
    public StorageConfig {
        requireNonNull(directory, "directory must not be null");
    }

    @NonNull
    public Path directoryPath() {
        return Path.of(directory);
    }
}
