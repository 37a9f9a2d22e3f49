// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.impl.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hiero.voteledger.hashing.LedgerHashing.joinHashes;
import static org.hiero.voteledger.hashing.LedgerHashing.leafHash;
import static org.hiero.voteledger.hashing.LedgerHashing.newMessageDigest;
import static org.hiero.voteledger.impl.VoteLedgerTestFixtures.entry;

import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.List;
import org.hiero.voteledger.hashing.InclusionProofs;
import org.hiero.voteledger.model.Hash;
import org.hiero.voteledger.model.InclusionProof;
import org.hiero.voteledger.model.SiblingPosition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class MerkleAccumulatorTest {
    private final MessageDigest digest = newMessageDigest();
    private MerkleAccumulator subject;

    @BeforeEach
    void setUp() {
        subject = new MerkleAccumulator(newMessageDigest());
    }

    @Test
    void emptyAccumulatorHasZeroRoot() {
        assertThat(subject.leafCount()).isZero();
        assertThat(subject.rootHash()).isEqualTo(Hash.EMPTY);
        assertThat(subject.rootAt(0)).isEqualTo(Hash.EMPTY);
    }

    @Test
    void singleLeafIsTheRoot() {
        final Hash a = leaf(0);
        subject.addLeaf(a);

        assertThat(subject.rootHash()).isEqualTo(a);
        assertThat(subject.proof(0).siblings()).isEmpty();
    }

    @Test
    void threeLeavesFoldPeaksRightToLeft() {
        final Hash a = leaf(0);
        final Hash b = leaf(1);
        final Hash c = leaf(2);
        subject.addLeaf(a);
        subject.addLeaf(b);
        subject.addLeaf(c);

        final Hash ab = joinHashes(digest, a, b);
        assertThat(subject.rootHash()).isEqualTo(joinHashes(digest, ab, c));

        final InclusionProof proofOfC = subject.proof(2);
        assertThat(proofOfC.positions()).containsExactly(SiblingPosition.LEFT);
        assertThat(proofOfC.siblings().get(0).hash()).isEqualTo(ab);

        final InclusionProof proofOfA = subject.proof(0);
        assertThat(proofOfA.positions()).containsExactly(SiblingPosition.RIGHT, SiblingPosition.RIGHT);
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 4, 5, 7, 8, 9, 16, 17, 31, 33})
    void everyProofVerifiesAfterEveryAppend(final int size) {
        for (int n = 0; n < size; n++) {
            subject.addLeaf(leaf(n));
            for (int i = 0; i <= n; i++) {
                final InclusionProof proof = subject.proof(i);
                assertThat(proof.root()).isEqualTo(subject.rootHash());
                assertThat(proof.leaf()).isEqualTo(leaf(i));
                assertThat(InclusionProofs.verify(proof))
                        .as("proof of %d among %d leaves", i, n + 1)
                        .isTrue();
            }
        }
    }

    @Test
    void proofsStayLogarithmic() {
        for (int n = 0; n < 1000; n++) {
            subject.addLeaf(leaf(n));
        }
        for (int i = 0; i < 1000; i += 97) {
            assertThat(subject.proof(i).siblings()).hasSizeLessThanOrEqualTo(2 * 10);
        }
    }

    @Test
    void retainsEveryHistoricalRoot() {
        final List<Hash> roots = new ArrayList<>();
        roots.add(subject.rootHash());
        for (int n = 0; n < 6; n++) {
            subject.addLeaf(leaf(n));
            roots.add(subject.rootHash());
        }

        for (int count = 0; count <= 6; count++) {
            assertThat(subject.rootAt(count)).isEqualTo(roots.get(count));
            assertThat(subject.isHistoricalRoot(roots.get(count))).isTrue();
        }
        assertThat(subject.isHistoricalRoot(leaf(99))).isFalse();
        assertThat(roots).doesNotHaveDuplicates();
    }

    @Test
    void rejectsPositionsOutsideTheLeaves() {
        subject.addLeaf(leaf(0));

        assertThatThrownBy(() -> subject.proof(1)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> subject.proof(-1)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> subject.rootAt(2)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    private Hash leaf(final int n) {
        return leafHash(digest, entry(n));
    }
}
