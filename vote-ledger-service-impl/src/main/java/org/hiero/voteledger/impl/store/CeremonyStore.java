// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.impl.store;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;
import java.util.Map;
import org.hiero.voteledger.model.DecryptionCeremony;

/**
 * Durable storage of every ceremony attempt, keyed by election.
 */
public interface CeremonyStore {

    /**
     * Replaces an election's stored attempts in one atomic step.
     *
     * @param electionId the election
     * @param attempts   all attempts of the election, oldest first
     */
    void save(@NonNull String electionId, @NonNull List<DecryptionCeremony> attempts);

    /**
     * @return the attempts of every stored election
     */
    @NonNull
    Map<String, List<DecryptionCeremony>> loadAll();
}
