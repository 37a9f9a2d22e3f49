// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.config;

/**
 * Validation limits applied to a vote entry before it is hashed. Lengths are in characters.
 *
 * @param maxIdLength            longest accepted entry id
 * @param maxNullifierLength     longest accepted nullifier
 * @param maxCommitmentLength    longest accepted commitment
 * @param maxEncryptedVoteLength longest accepted ciphertext
 * @param maxZkProofLength       longest accepted proof
 */
public record LedgerConfig(
        int maxIdLength,
        int maxNullifierLength,
        int maxCommitmentLength,
        int maxEncryptedVoteLength,
        int maxZkProofLength) {
    public LedgerConfig {
        if (maxIdLength <= 0
                || maxNullifierLength <= 0
                || maxCommitmentLength <= 0
                || maxEncryptedVoteLength <= 0
                || maxZkProofLength <= 0) {
            throw new IllegalArgumentException("ledger length limits must be positive");
        }
    }
}
