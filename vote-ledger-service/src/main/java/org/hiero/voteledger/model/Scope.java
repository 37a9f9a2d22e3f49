// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.model;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.annotation.JsonIgnore;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The partition in which nullifiers must be unique and in which one ledger accumulates entries. A scope is either
 * a whole election (single-question ballots) or one question of an election (multi-question ballots).
 *
 * @param electionId the election the scope belongs to
 * @param questionId the question, or {@code null} for an election-wide scope
 */
public record Scope(@NonNull String electionId, @Nullable String questionId) {
    private static final char SEPARATOR = '/';

    public Scope {
        requireNonNull(electionId, "electionId must not be null");
        if (electionId.isBlank() || electionId.indexOf(SEPARATOR) >= 0) {
            throw new IllegalArgumentException("invalid election id '" + electionId + "'");
        }
        if (questionId != null && (questionId.isBlank() || questionId.indexOf(SEPARATOR) >= 0)) {
            throw new IllegalArgumentException("invalid question id '" + questionId + "'");
        }
    }

    public static Scope forElection(@NonNull final String electionId) {
        return new Scope(electionId, null);
    }

    public static Scope forQuestion(@NonNull final String electionId, @NonNull final String questionId) {
        return new Scope(electionId, requireNonNull(questionId, "questionId must not be null"));
    }

    /**
     * @return whether this scope covers a whole election
     */
    @JsonIgnore
    public boolean isElectionWide() {
        return questionId == null;
    }

    /**
     * A stable textual key, used for storage file names and as a map key in persisted records.
     *
     * @return {@code electionId} or {@code electionId/questionId}
     */
    @NonNull
    public String key() {
        return questionId == null ? electionId : electionId + SEPARATOR + questionId;
    }

    @Override
    public String toString() {
        return key();
    }
}
