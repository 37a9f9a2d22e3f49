// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.hiero.voteledger.exceptions.TallyFailureException;
import org.hiero.voteledger.model.PartialDecryption;
import org.hiero.voteledger.model.TallyResult;
import org.hiero.voteledger.model.VoteEntry;

/**
 * Combines validated partial decryptions into a tally. All or nothing: no partial counts are ever returned.
 */
public interface TallyAggregator {

    /**
     * @param entries         the bound entries, every one of which must be decrypted
     * @param partialsByEntry validated partials keyed by entry id
     * @param requiredShares  the quorum size per entry
     * @param candidateIds    the admissible candidates, or empty to admit any plaintext choice
     * @return the tally over all entries
     * @throws TallyFailureException if any entry cannot be decrypted or decodes to an inadmissible choice
     */
    @NonNull
    TallyResult combine(
            @NonNull List<VoteEntry> entries,
            @NonNull Map<String, List<PartialDecryption>> partialsByEntry,
            int requiredShares,
            @NonNull Set<String> candidateIds);
}
