// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.config;

/**
 * How a submitted vote is mapped to the scope its nullifier must be unique in.
 */
public enum NullifierScopePolicy {
    /** One credential casts exactly one vote per election, whatever the number of questions. */
    PER_ELECTION,
    /** One credential casts one vote per question of the election. */
    PER_QUESTION
}
