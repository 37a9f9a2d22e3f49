// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.impl.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hiero.voteledger.impl.VoteLedgerTestFixtures.BASE_TIME;
import static org.hiero.voteledger.impl.VoteLedgerTestFixtures.storageIn;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import org.hiero.voteledger.model.CandidateTally;
import org.hiero.voteledger.model.CeremonyStatus;
import org.hiero.voteledger.model.DecryptionCeremony;
import org.hiero.voteledger.model.Hash;
import org.hiero.voteledger.model.LedgerSnapshot;
import org.hiero.voteledger.model.PartialDecryption;
import org.hiero.voteledger.model.RecordedPartial;
import org.hiero.voteledger.model.Scope;
import org.hiero.voteledger.model.TallyResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileCeremonyStoreTest {
    @TempDir
    Path tempDir;

    private FileCeremonyStore subject;

    @BeforeEach
    void setUp() {
        subject = new FileCeremonyStore(storageIn(tempDir), StoreJson.newObjectMapper());
    }

    @Test
    void keepsEveryAttemptOfEveryElection() {
        final var aborted = ceremony("e/1", 1, CeremonyStatus.ABORTED, "timed out", null);
        final var completed = ceremony(
                "e/1",
                2,
                CeremonyStatus.COMPLETED,
                null,
                new TallyResult(List.of(new CandidateTally("alice", 1)), 1, BASE_TIME, List.of("t1")));
        final var other = ceremony("e-2", 1, CeremonyStatus.IN_PROGRESS, null, null);

        subject.save("e/1", List.of(aborted, completed));
        subject.save("e-2", List.of(other));

        final var loaded = new FileCeremonyStore(storageIn(tempDir), StoreJson.newObjectMapper()).loadAll();
        assertThat(loaded).containsOnlyKeys("e/1", "e-2");
        assertThat(loaded.get("e/1")).containsExactly(aborted, completed);
        assertThat(loaded.get("e-2")).containsExactly(other);
    }

    @Test
    void saveReplacesPreviousAttempts() {
        final var running = ceremony("e", 1, CeremonyStatus.IN_PROGRESS, null, null);
        final var aborted = ceremony("e", 1, CeremonyStatus.ABORTED, "stopped", null);

        subject.save("e", List.of(running));
        subject.save("e", List.of(aborted));

        assertThat(subject.loadAll().get("e")).containsExactly(aborted);
    }

    @Test
    void removesLeftoverTemporaryFiles() throws Exception {
        final Path ceremonies = tempDir.resolve(FileCeremonyStore.CEREMONIES_DIR);
        Files.createDirectories(ceremonies);
        final Path leftover = ceremonies.resolve("e.json.tmp");
        Files.writeString(leftover, "[");

        assertThat(subject.loadAll()).isEmpty();
        assertThat(leftover).doesNotExist();
    }

    private static DecryptionCeremony ceremony(
            final String electionId,
            final int attempt,
            final CeremonyStatus status,
            final String abortReason,
            final TallyResult result) {
        final var partial = new PartialDecryption("t1", "entry-1", "alice", "proof");
        return new DecryptionCeremony(
                electionId,
                attempt,
                status,
                1,
                List.of(new LedgerSnapshot(Scope.forElection("e"), Hash.EMPTY, 0, BASE_TIME)),
                Set.of("alice", "bob"),
                List.of("t1"),
                List.of(RecordedPartial.accepted(partial, BASE_TIME), RecordedPartial.dropped(partial, "bad", BASE_TIME)),
                BASE_TIME,
                BASE_TIME.plus(Duration.ofHours(1)),
                abortReason,
                result);
    }
}
