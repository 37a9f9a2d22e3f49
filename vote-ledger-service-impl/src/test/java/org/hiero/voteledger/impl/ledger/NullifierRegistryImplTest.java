// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.impl.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hiero.voteledger.impl.VoteLedgerTestFixtures.BASE_TIME;
import static org.hiero.voteledger.impl.VoteLedgerTestFixtures.entry;
import static org.hiero.voteledger.impl.VoteLedgerTestFixtures.storageIn;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.hiero.voteledger.exceptions.DuplicateNullifierException;
import org.hiero.voteledger.exceptions.LedgerStorageException;
import org.hiero.voteledger.impl.VoteLedgerTestFixtures.TestClock;
import org.hiero.voteledger.impl.store.FileNullifierStore;
import org.hiero.voteledger.impl.store.NullifierStore;
import org.hiero.voteledger.impl.store.StoreJson;
import org.hiero.voteledger.model.NullifierRecord;
import org.hiero.voteledger.model.Scope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

class NullifierRegistryImplTest {
    private static final Scope ELECTION = Scope.forElection("election-1");
    private static final Scope QUESTION_1 = Scope.forQuestion("election-1", "q1");
    private static final Scope QUESTION_2 = Scope.forQuestion("election-1", "q2");

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = StoreJson.newObjectMapper();
    private final TestClock clock = new TestClock();
    private NullifierRegistryImpl subject;

    @BeforeEach
    void setUp() {
        subject = newRegistry();
    }

    private NullifierRegistryImpl newRegistry() {
        return new NullifierRegistryImpl(new FileNullifierStore(storageIn(tempDir), mapper), clock);
    }

    @Test
    void reservesOncePerScope() {
        final NullifierRecord record = subject.reserve(ELECTION, "n");

        assertThat(record).isEqualTo(new NullifierRecord(ELECTION, "n", BASE_TIME));
        assertThat(subject.query(ELECTION, "n")).isTrue();
        assertThatThrownBy(() -> subject.reserve(ELECTION, "n")).isInstanceOf(DuplicateNullifierException.class);
        assertThat(subject.reservedCount(ELECTION)).isEqualTo(1);
    }

    @Test
    void scopesAreIndependent() {
        subject.reserve(QUESTION_1, "n");
        subject.reserve(QUESTION_2, "n");

        assertThat(subject.query(ELECTION, "n")).isFalse();
        assertThat(subject.reservedCount(QUESTION_1)).isEqualTo(1);
        assertThat(subject.reservedCount(QUESTION_2)).isEqualTo(1);
    }

    @Test
    void queryNeverReserves() {
        assertThat(subject.query(ELECTION, "n")).isFalse();
        assertThat(subject.query(ELECTION, "n")).isFalse();

        subject.reserve(ELECTION, "n");
    }

    @Test
    void exactlyOneOfManyConcurrentReservationsSucceeds() throws Exception {
        final int callers = 32;
        final ExecutorService executor = Executors.newFixedThreadPool(callers);
        final CountDownLatch go = new CountDownLatch(1);
        try {
            final List<Callable<NullifierRecord>> tasks = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                tasks.add(() -> {
                    go.await();
                    return subject.reserve(ELECTION, "contested");
                });
            }
            final List<Future<NullifierRecord>> futures = new ArrayList<>();
            for (final Callable<NullifierRecord> task : tasks) {
                futures.add(executor.submit(task));
            }
            go.countDown();

            int succeeded = 0;
            int rejected = 0;
            for (final Future<NullifierRecord> future : futures) {
                try {
                    future.get(10, TimeUnit.SECONDS);
                    succeeded++;
                } catch (ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(DuplicateNullifierException.class);
                    rejected++;
                }
            }
            assertThat(succeeded).isEqualTo(1);
            assertThat(rejected).isEqualTo(callers - 1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void reservationsSurviveRestart() {
        subject.reserve(ELECTION, "n-1");
        subject.reserve(QUESTION_1, "n-2");

        final NullifierRegistryImpl restarted = newRegistry();

        assertThat(restarted.query(ELECTION, "n-1")).isTrue();
        assertThat(restarted.query(QUESTION_1, "n-2")).isTrue();
        assertThatThrownBy(() -> restarted.reserve(ELECTION, "n-1")).isInstanceOf(DuplicateNullifierException.class);
    }

    @Test
    void releasedReservationsStayReleasedAfterRestart() {
        final NullifierRecord record = subject.reserve(ELECTION, "n");
        subject.release(record);

        assertThat(subject.query(ELECTION, "n")).isFalse();
        assertThat(newRegistry().query(ELECTION, "n")).isFalse();
        subject.reserve(ELECTION, "n");
    }

    @Test
    void repairReReservesOnlyMissingNullifiers() {
        subject.reserve(ELECTION, "nullifier-1");

        assertThat(subject.repair(ELECTION, entry(1))).isFalse();
        assertThat(subject.repair(ELECTION, entry(2))).isTrue();
        assertThat(newRegistry().query(ELECTION, "nullifier-2")).isTrue();
    }

    @Test
    void entryReservationsRememberTheirEntryAcrossRestart() {
        final NullifierRecord record = subject.reserveForEntry(ELECTION, "n", "entry-7");

        assertThat(record).isEqualTo(new NullifierRecord(ELECTION, "n", BASE_TIME, "entry-7"));
        assertThat(newRegistry().releaseUnrecorded(ELECTION, Set.of("entry-7"))).isZero();
    }

    @Test
    void releasesOnlyEntryReservationsWithoutARecordedEntry() {
        subject.reserveForEntry(ELECTION, "recorded", "entry-1");
        subject.reserveForEntry(ELECTION, "lost", "entry-2");
        subject.reserveForEntry(QUESTION_1, "other-scope", "entry-3");
        subject.reserve(ELECTION, "direct");

        final NullifierRegistryImpl restarted = newRegistry();

        assertThat(restarted.releaseUnrecorded(ELECTION, Set.of("entry-1"))).isEqualTo(1);
        assertThat(restarted.query(ELECTION, "recorded")).isTrue();
        assertThat(restarted.query(ELECTION, "lost")).isFalse();
        assertThat(restarted.query(ELECTION, "direct")).isTrue();
        assertThat(restarted.query(QUESTION_1, "other-scope")).isTrue();
        assertThat(newRegistry().query(ELECTION, "lost")).isFalse();
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    class WhenTheLogCannotBeWritten {
        @Mock
        private NullifierStore store;

        @Test
        void reservationIsUndone() {
            given(store.load()).willReturn(List.of());
            willThrow(new LedgerStorageException("io", new IOException("io")))
                    .given(store)
                    .append(any());
            final var registry = new NullifierRegistryImpl(store, clock);

            assertThatThrownBy(() -> registry.reserve(ELECTION, "n")).isInstanceOf(LedgerStorageException.class);
            assertThat(registry.query(ELECTION, "n")).isFalse();
        }
    }
}
