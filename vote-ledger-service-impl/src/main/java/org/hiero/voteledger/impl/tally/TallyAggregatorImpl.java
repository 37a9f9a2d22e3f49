// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.impl.tally;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.InstantSource;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hiero.voteledger.TallyAggregator;
import org.hiero.voteledger.exceptions.TallyFailureException;
import org.hiero.voteledger.model.CandidateTally;
import org.hiero.voteledger.model.PartialDecryption;
import org.hiero.voteledger.model.TallyResult;
import org.hiero.voteledger.model.VoteEntry;
import org.hiero.voteledger.spi.ThresholdDecryptionLibrary;

/**
 * Recovers every bound entry's choice with the {@link ThresholdDecryptionLibrary} and counts the choices.
 *
 * <p>The quorum for an entry is its first {@code requiredShares} valid partials ordered by trustee id. Nothing
 * is counted until every entry decrypted; failures never reveal which entry failed or what was recovered.</p>
 */
@Singleton
public class TallyAggregatorImpl implements TallyAggregator {
    private static final Logger log = LogManager.getLogger(TallyAggregatorImpl.class);

    private static final Comparator<CandidateTally> MOST_VOTES_FIRST = Comparator.comparingLong(CandidateTally::votes)
            .reversed()
            .thenComparing(CandidateTally::candidateId);

    private final ThresholdDecryptionLibrary library;
    private final InstantSource clock;

    @Inject
    public TallyAggregatorImpl(@NonNull final ThresholdDecryptionLibrary library, @NonNull final InstantSource clock) {
        this.library = requireNonNull(library);
        this.clock = requireNonNull(clock);
    }

    @NonNull
    @Override
    public TallyResult combine(
            @NonNull final List<VoteEntry> entries,
            @NonNull final Map<String, List<PartialDecryption>> partialsByEntry,
            final int requiredShares,
            @NonNull final Set<String> candidateIds) {
        requireNonNull(entries);
        requireNonNull(partialsByEntry);
        requireNonNull(candidateIds);
        if (requiredShares < 1) {
            throw new IllegalArgumentException("requiredShares must be positive");
        }
        final Map<String, Long> counts = new HashMap<>();
        candidateIds.forEach(candidate -> counts.put(candidate, 0L));
        final Set<String> participating = new TreeSet<>();
        for (final var entry : entries) {
            final List<PartialDecryption> quorum = partialsByEntry.getOrDefault(entry.id(), List.of()).stream()
                    .sorted(Comparator.comparing(PartialDecryption::trusteeId))
                    .limit(requiredShares)
                    .toList();
            if (quorum.size() < requiredShares
                    || quorum.stream().map(PartialDecryption::trusteeId).distinct().count() < requiredShares) {
                log.warn("Tally aborted: an entry lacks a quorum of {} partials", requiredShares);
                throw new TallyFailureException();
            }
            final String plaintext;
            try {
                plaintext = library.combinePartials(entry.id(), quorum);
            } catch (RuntimeException e) {
                throw new TallyFailureException(e);
            }
            final String choice = plaintext == null ? "" : plaintext.trim();
            if (choice.isEmpty() || (!candidateIds.isEmpty() && !candidateIds.contains(choice))) {
                log.warn("Tally aborted: an entry decrypted to an inadmissible choice");
                throw new TallyFailureException();
            }
            counts.merge(choice, 1L, Long::sum);
        }
        partialsByEntry.values().forEach(partials -> partials.forEach(p -> participating.add(p.trusteeId())));
        final List<CandidateTally> candidates = counts.entrySet().stream()
                .map(e -> new CandidateTally(e.getKey(), e.getValue()))
                .sorted(MOST_VOTES_FIRST)
                .toList();
        return new TallyResult(candidates, entries.size(), clock.instant(), List.copyOf(participating));
    }
}
