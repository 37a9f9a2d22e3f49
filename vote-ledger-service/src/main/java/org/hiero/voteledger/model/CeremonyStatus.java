// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.model;

/**
 * The phases of a decryption ceremony. Phases only move forward; {@link #COMPLETED} and {@link #ABORTED} are
 * terminal.
 */
public enum CeremonyStatus {
    PENDING,
    IN_PROGRESS,
    COMBINING,
    COMPLETED,
    ABORTED;

    /**
     * @return whether no further transition is possible
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == ABORTED;
    }
}
