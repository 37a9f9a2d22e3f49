// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.impl.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hiero.voteledger.impl.VoteLedgerTestFixtures.LEDGER_CONFIG;
import static org.hiero.voteledger.impl.VoteLedgerTestFixtures.entry;
import static org.hiero.voteledger.impl.VoteLedgerTestFixtures.storageIn;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import org.hiero.voteledger.VoteLedger;
import org.hiero.voteledger.impl.VoteLedgerTestFixtures.TestClock;
import org.hiero.voteledger.impl.store.FileNullifierStore;
import org.hiero.voteledger.impl.store.FileSnapshotStore;
import org.hiero.voteledger.impl.store.FileVoteEntryStore;
import org.hiero.voteledger.impl.store.StoreJson;
import org.hiero.voteledger.model.Scope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class VoteLedgersImplTest {
    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = StoreJson.newObjectMapper();
    private final TestClock clock = new TestClock();
    private VoteLedgersImpl subject;

    @BeforeEach
    void setUp() {
        subject = newLedgers();
    }

    private VoteLedgersImpl newLedgers() {
        return new VoteLedgersImpl(
                LEDGER_CONFIG,
                new NullifierRegistryImpl(new FileNullifierStore(storageIn(tempDir), mapper), clock),
                new FileVoteEntryStore(storageIn(tempDir), mapper),
                new FileSnapshotStore(storageIn(tempDir), mapper),
                clock);
    }

    @Test
    void returnsTheSameLedgerForAScope() {
        final Scope scope = Scope.forElection("e");

        assertThat(subject.ledger(scope)).isSameAs(subject.ledger(scope));
    }

    @Test
    void listsEveryScopeOfAnElectionInKeyOrder() {
        subject.ledger(Scope.forQuestion("e", "q2")).append(entry(1));
        subject.ledger(Scope.forQuestion("e", "q1")).append(entry(2));
        subject.ledger(Scope.forElection("other")).append(entry(3));

        assertThat(subject.ledgersFor("e"))
                .extracting(VoteLedger::scope)
                .containsExactly(Scope.forQuestion("e", "q1"), Scope.forQuestion("e", "q2"));
    }

    @Test
    void discoversStoredScopesAfterRestart() {
        subject.ledger(Scope.forQuestion("e", "q-with?odd chars")).append(entry(1));

        final VoteLedgersImpl restarted = newLedgers();

        assertThat(restarted.ledgersFor("e")).hasSize(1);
        assertThat(restarted.ledgersFor("e").get(0).getVoteCount()).isEqualTo(1);
        assertThat(restarted.existingLedger(Scope.forElection("never-used"))).isEmpty();
    }
}
