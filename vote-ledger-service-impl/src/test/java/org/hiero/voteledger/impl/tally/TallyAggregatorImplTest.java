// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.impl.tally;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hiero.voteledger.impl.VoteLedgerTestFixtures.BASE_TIME;
import static org.hiero.voteledger.impl.VoteLedgerTestFixtures.entry;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.hiero.voteledger.exceptions.TallyFailureException;
import org.hiero.voteledger.impl.VoteLedgerTestFixtures.TestClock;
import org.hiero.voteledger.model.CandidateTally;
import org.hiero.voteledger.model.PartialDecryption;
import org.hiero.voteledger.model.TallyResult;
import org.hiero.voteledger.model.VoteEntry;
import org.hiero.voteledger.spi.ThresholdDecryptionLibrary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TallyAggregatorImplTest {
    private static final VoteEntry FIRST = entry(1);
    private static final VoteEntry SECOND = entry(2);
    private static final VoteEntry THIRD = entry(3);

    @Mock
    private ThresholdDecryptionLibrary library;

    private TallyAggregatorImpl subject;

    @BeforeEach
    void setUp() {
        subject = new TallyAggregatorImpl(library, new TestClock());
    }

    @Test
    void countsEveryEntryMostVotesFirst() {
        given(library.combinePartials(eq(FIRST.id()), anyList())).willReturn("bob");
        given(library.combinePartials(eq(SECOND.id()), anyList())).willReturn(" alice ");
        given(library.combinePartials(eq(THIRD.id()), anyList())).willReturn("alice");

        final TallyResult result = subject.combine(
                List.of(FIRST, SECOND, THIRD),
                Map.of(
                        FIRST.id(), List.of(partial("t2", FIRST), partial("t1", FIRST)),
                        SECOND.id(), List.of(partial("t1", SECOND), partial("t3", SECOND)),
                        THIRD.id(), List.of(partial("t1", THIRD), partial("t2", THIRD))),
                2,
                Set.of());

        assertThat(result.candidates()).containsExactly(new CandidateTally("alice", 2), new CandidateTally("bob", 1));
        assertThat(result.totalVotes()).isEqualTo(3);
        assertThat(result.completedAt()).isEqualTo(BASE_TIME);
        assertThat(result.participatingTrustees()).containsExactly("t1", "t2", "t3");
    }

    @Test
    void quorumIsTheLowestTrusteeIds() {
        given(library.combinePartials(anyString(), anyList())).willReturn("alice");

        subject.combine(
                List.of(FIRST),
                Map.of(FIRST.id(), List.of(partial("t3", FIRST), partial("t1", FIRST), partial("t2", FIRST))),
                2,
                Set.of());

        verify(library).combinePartials(FIRST.id(), List.of(partial("t1", FIRST), partial("t2", FIRST)));
    }

    @Test
    void entryWithoutQuorumFailsTheWholeTally() {
        assertThatThrownBy(() -> subject.combine(
                        List.of(FIRST, SECOND),
                        Map.of(
                                FIRST.id(), List.of(partial("t1", FIRST), partial("t2", FIRST)),
                                SECOND.id(), List.of(partial("t1", SECOND))),
                        2,
                        Set.of()))
                .isInstanceOf(TallyFailureException.class)
                .hasMessage(TallyFailureException.MESSAGE);
    }

    @Test
    void libraryFailureFailsTheWholeTallyWithoutDetails() {
        given(library.combinePartials(anyString(), anyList())).willThrow(new IllegalStateException("secret detail"));

        assertThatThrownBy(() -> subject.combine(
                        List.of(FIRST), Map.of(FIRST.id(), List.of(partial("t1", FIRST))), 1, Set.of()))
                .isInstanceOf(TallyFailureException.class)
                .hasMessage(TallyFailureException.MESSAGE);
    }

    @Test
    void blankOrUnknownChoicesFailTheTally() {
        given(library.combinePartials(eq(FIRST.id()), anyList())).willReturn("  ");
        given(library.combinePartials(eq(SECOND.id()), anyList())).willReturn("mallory");
        final Map<String, List<PartialDecryption>> partials = Map.of(
                FIRST.id(), List.of(partial("t1", FIRST)),
                SECOND.id(), List.of(partial("t1", SECOND)));

        assertThatThrownBy(() -> subject.combine(List.of(FIRST), partials, 1, Set.of()))
                .isInstanceOf(TallyFailureException.class);
        assertThatThrownBy(() -> subject.combine(List.of(SECOND), partials, 1, Set.of("alice", "bob")))
                .isInstanceOf(TallyFailureException.class);
    }

    @Test
    void candidateSetIncludesCandidatesWithoutVotes() {
        given(library.combinePartials(anyString(), anyList())).willReturn("bob");

        final TallyResult result = subject.combine(
                List.of(FIRST), Map.of(FIRST.id(), List.of(partial("t1", FIRST))), 1, Set.of("alice", "bob"));

        assertThat(result.candidates()).containsExactly(new CandidateTally("bob", 1), new CandidateTally("alice", 0));
    }

    @Test
    void emptyEntrySetTalliesToZero() {
        final TallyResult result = subject.combine(List.of(), Map.of(), 3, Set.of("alice"));

        assertThat(result.totalVotes()).isZero();
        assertThat(result.candidates()).containsExactly(new CandidateTally("alice", 0));
        assertThat(result.participatingTrustees()).isEmpty();
    }

    private static PartialDecryption partial(final String trusteeId, final VoteEntry entry) {
        return new PartialDecryption(trusteeId, entry.id(), "share-" + trusteeId, "proof-" + trusteeId);
    }
}
