// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.impl;

import java.nio.file.Path;
import java.time.Instant;
import java.time.InstantSource;
import java.util.concurrent.atomic.AtomicReference;
import org.hiero.voteledger.config.LedgerConfig;
import org.hiero.voteledger.config.StorageConfig;
import org.hiero.voteledger.model.VoteEntry;

/**
 * Shared values for vote ledger tests.
 */
public final class VoteLedgerTestFixtures {
    public static final Instant BASE_TIME = Instant.parse("2026-03-01T08:00:00Z");
    public static final LedgerConfig LEDGER_CONFIG = new LedgerConfig(128, 256, 1024, 65536, 65536);

    private VoteLedgerTestFixtures() {}

    public static StorageConfig storageIn(final Path directory) {
        return new StorageConfig(directory.toString(), false);
    }

    public static VoteEntry entry(final int n) {
        return entry("entry-" + n, "nullifier-" + n);
    }

    public static VoteEntry entry(final String id, final String nullifier) {
        return new VoteEntry(id, "ciphertext-" + id, "commitment-" + id, "proof-" + id, nullifier, BASE_TIME);
    }

    /**
     * A clock tests can move forward.
     */
    public static final class TestClock implements InstantSource {
        private final AtomicReference<Instant> now = new AtomicReference<>(BASE_TIME);

        @Override
        public Instant instant() {
            return now.get();
        }

        public void set(final Instant instant) {
            now.set(instant);
        }
    }
}
