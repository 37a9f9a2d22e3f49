// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger;

import edu.umd.cs.findbugs.annotations.NonNull;
import org.hiero.voteledger.exceptions.DuplicateNullifierException;
import org.hiero.voteledger.exceptions.ValidationException;
import org.hiero.voteledger.model.VoteReceipt;
import org.hiero.voteledger.model.VoteSubmission;

/**
 * Accepts votes from voters' clients.
 */
public interface VoteSubmissionService {

    /**
     * Verifies the credential signature and the ballot proof, then records the vote atomically with its nullifier
     * reservation.
     *
     * @param submission the vote
     * @return the voter's receipt
     * @throws ValidationException if the credential, proof or ballot is invalid
     * @throws DuplicateNullifierException if the credential was already used in the vote's scope
     */
    @NonNull
    VoteReceipt submit(@NonNull VoteSubmission submission);
}
