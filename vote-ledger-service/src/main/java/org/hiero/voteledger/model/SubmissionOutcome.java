// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.model;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * The result of one trustee submission.
 *
 * @param accepted the number of partials that passed validation
 * @param dropped  the number of partials dropped individually
 * @param progress the ceremony summary after the submission was processed
 */
public record SubmissionOutcome(int accepted, int dropped, @NonNull CeremonyProgress progress) {
    public SubmissionOutcome {
        requireNonNull(progress, "progress must not be null");
    }
}
