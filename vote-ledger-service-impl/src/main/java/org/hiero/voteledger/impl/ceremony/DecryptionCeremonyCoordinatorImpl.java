// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.impl.ceremony;

import static java.util.Objects.requireNonNull;
import static org.hiero.voteledger.model.CeremonyStatus.ABORTED;
import static org.hiero.voteledger.model.CeremonyStatus.COMBINING;
import static org.hiero.voteledger.model.CeremonyStatus.COMPLETED;
import static org.hiero.voteledger.model.CeremonyStatus.IN_PROGRESS;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.time.Instant;
import java.time.InstantSource;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hiero.voteledger.DecryptionCeremonyCoordinator;
import org.hiero.voteledger.TallyAggregator;
import org.hiero.voteledger.VoteLedger;
import org.hiero.voteledger.VoteLedgers;
import org.hiero.voteledger.config.CeremonyConfig;
import org.hiero.voteledger.exceptions.CeremonyAlreadyCompletedException;
import org.hiero.voteledger.exceptions.CeremonyNotFoundException;
import org.hiero.voteledger.exceptions.CeremonyStateException;
import org.hiero.voteledger.exceptions.DuplicateTrusteeSubmissionException;
import org.hiero.voteledger.exceptions.InvalidPartialProofException;
import org.hiero.voteledger.exceptions.TallyFailureException;
import org.hiero.voteledger.exceptions.ValidationException;
import org.hiero.voteledger.exceptions.VoteLedgerException;
import org.hiero.voteledger.impl.ceremony.CeremonyStateMachine.Transition;
import org.hiero.voteledger.impl.store.CeremonyStore;
import org.hiero.voteledger.model.CeremonyProgress;
import org.hiero.voteledger.model.CeremonyStatus;
import org.hiero.voteledger.model.DecryptionCeremony;
import org.hiero.voteledger.model.LedgerSnapshot;
import org.hiero.voteledger.model.PartialDecryption;
import org.hiero.voteledger.model.RecordedPartial;
import org.hiero.voteledger.model.Scope;
import org.hiero.voteledger.model.SubmissionOutcome;
import org.hiero.voteledger.model.TallyResult;
import org.hiero.voteledger.model.VoteEntry;
import org.hiero.voteledger.spi.ThresholdDecryptionLibrary;
import org.hiero.voteledger.spi.TrusteeDirectory;

/**
 * Default {@link DecryptionCeremonyCoordinator}.
 *
 * <p>Each election has its own lock, so trustee submissions to different elections never contend, and
 * "first submission wins" is decided under that lock. The tally runs synchronously on the thread whose
 * submission reached the threshold. Reads such as {@link #status(String)} never take the lock.</p>
 *
 * <p>Ceremonies interrupted while combining are tallied again when the coordinator is created.</p>
 */
@Singleton
public class DecryptionCeremonyCoordinatorImpl implements DecryptionCeremonyCoordinator {
    private static final Logger log = LogManager.getLogger(DecryptionCeremonyCoordinatorImpl.class);

    static final String TIMEOUT_REASON = "Ceremony deadline passed";
    static final String TALLY_FAILURE_REASON = "Tally failed";

    private final VoteLedgers ledgers;
    private final ThresholdDecryptionLibrary library;
    private final TrusteeDirectory trustees;
    private final TallyAggregator aggregator;
    private final CeremonyStateMachine stateMachine;
    private final CeremonyStore store;
    private final CeremonyConfig config;
    private final InstantSource clock;
    private final Map<String, ElectionCeremonies> elections = new ConcurrentHashMap<>();

    @Inject
    public DecryptionCeremonyCoordinatorImpl(
            @NonNull final VoteLedgers ledgers,
            @NonNull final ThresholdDecryptionLibrary library,
            @NonNull final TrusteeDirectory trustees,
            @NonNull final TallyAggregator aggregator,
            @NonNull final CeremonyStateMachine stateMachine,
            @NonNull final CeremonyStore store,
            @NonNull final CeremonyConfig config,
            @NonNull final InstantSource clock) {
        this.ledgers = requireNonNull(ledgers);
        this.library = requireNonNull(library);
        this.trustees = requireNonNull(trustees);
        this.aggregator = requireNonNull(aggregator);
        this.stateMachine = requireNonNull(stateMachine);
        this.store = requireNonNull(store);
        this.config = requireNonNull(config);
        this.clock = requireNonNull(clock);
        store.loadAll().forEach((electionId, attempts) -> {
            final var ceremonies = new ElectionCeremonies(electionId, attempts);
            elections.put(electionId, ceremonies);
            final var latest = ceremonies.latest();
            if (latest != null && latest.status() == COMBINING) {
                log.info("Resuming interrupted tally of election {} (attempt {})", electionId, latest.attempt());
                withLock(ceremonies, () -> combine(ceremonies, latest));
            }
        });
    }

    @NonNull
    @Override
    public CeremonyProgress start(
            @NonNull final String electionId, final int requiredShares, @NonNull final Set<String> candidateIds) {
        requireNonNull(electionId);
        requireNonNull(candidateIds);
        if (requiredShares < config.minRequiredShares()) {
            throw new ValidationException(
                    "requiredShares must be at least " + config.minRequiredShares() + ", got " + requiredShares);
        }
        if (candidateIds.stream().anyMatch(String::isBlank)) {
            throw new ValidationException("candidate ids must not be blank");
        }
        final var ceremonies = elections.computeIfAbsent(electionId, id -> new ElectionCeremonies(id, List.of()));
        return withLock(ceremonies, () -> {
            final var latest = ceremonies.latest();
            int attempt = 1;
            if (latest != null) {
                switch (latest.status()) {
                    case COMPLETED -> throw new CeremonyAlreadyCompletedException(
                            "Election " + electionId + " was already tallied");
                    case ABORTED -> attempt = latest.attempt() + 1;
                    default -> throw new CeremonyStateException(
                            "A ceremony for election " + electionId + " is already " + latest.status());
                }
            }
            final Instant now = clock.instant();
            final var boundLedgers = ledgersOf(electionId);
            final List<LedgerSnapshot> snapshots =
                    boundLedgers.stream().map(VoteLedger::getSnapshot).toList();
            final var ceremony = new DecryptionCeremony(
                    electionId,
                    attempt,
                    IN_PROGRESS,
                    requiredShares,
                    snapshots,
                    candidateIds,
                    List.of(),
                    List.of(),
                    now,
                    now.plus(config.timeout()),
                    null,
                    null);
            ceremonies.addAttempt(store, ceremony, loadBoundEntries(snapshots));
            log.info(
                    "Started decryption ceremony for election {} (attempt {}): {} votes in {} scopes, {} shares required",
                    electionId,
                    attempt,
                    ceremony.boundVoteCount(),
                    snapshots.size(),
                    requiredShares);
            return ceremony.progress();
        });
    }

    @NonNull
    @Override
    public SubmissionOutcome submitPartials(
            @NonNull final String electionId,
            @NonNull final String trusteeId,
            @NonNull final List<PartialDecryption> partials) {
        requireNonNull(electionId);
        requireNonNull(trusteeId);
        requireNonNull(partials);
        final var ceremonies = ceremoniesOf(electionId);
        return withLock(ceremonies, () -> {
            final var current = requireNonNull(ceremonies.latest());
            if (current.status().isTerminal()) {
                throw new CeremonyAlreadyCompletedException(
                        "Ceremony for election " + electionId + " is " + current.status());
            }
            if (current.status() != IN_PROGRESS) {
                throw new CeremonyStateException(
                        "Ceremony for election " + electionId + " is " + current.status());
            }
            final Instant now = clock.instant();
            if (now.isAfter(current.deadline())) {
                log.warn("Rejected late submission of trustee {} to election {}", trusteeId, electionId);
                abortLocked(ceremonies, TIMEOUT_REASON);
                throw new CeremonyAlreadyCompletedException(
                        "Ceremony for election " + electionId + " passed its deadline " + current.deadline());
            }
            if (current.submittedTrustees().contains(trusteeId)) {
                log.warn("Rejected second submission of trustee {} to election {}", trusteeId, electionId);
                throw new DuplicateTrusteeSubmissionException(trusteeId);
            }
            final String commitment = trustees.commitmentOf(electionId, trusteeId);
            if (commitment == null) {
                throw new ValidationException("Trustee " + trusteeId + " is not a trustee of election " + electionId);
            }
            validateShape(trusteeId, partials);

            final var entries = boundEntriesOf(ceremonies, current);
            final List<PartialDecryption> valid = new ArrayList<>();
            final List<RecordedPartial> recorded = new ArrayList<>(current.partials());
            for (final var partial : partials) {
                try {
                    checkPartial(partial, commitment, entries);
                    valid.add(partial);
                    recorded.add(RecordedPartial.accepted(partial, now));
                } catch (InvalidPartialProofException e) {
                    log.warn(
                            "Dropped partial of trustee {} for entry {}: {}",
                            e.getTrusteeId(),
                            e.getEntryId(),
                            e.getMessage());
                    recorded.add(RecordedPartial.dropped(partial, e.getMessage(), now));
                }
            }

            final Set<String> submitted = new LinkedHashSet<>(current.submittedTrustees());
            final Transition transition = stateMachine.onSubmission(
                    trusteeId,
                    valid,
                    current.status(),
                    current.requiredShares(),
                    submitted,
                    validPartialsByEntry(current));
            var updated = copyOf(
                    current,
                    transition.newStatus(),
                    new ArrayList<>(submitted),
                    recorded,
                    current.abortReason(),
                    current.result());
            ceremonies.replaceLatest(store, updated);
            log.debug(
                    "Trustee {} submitted to election {}: {} accepted, {} dropped",
                    trusteeId,
                    electionId,
                    valid.size(),
                    partials.size() - valid.size());
            if (transition.newStatus() == COMBINING) {
                updated = combine(ceremonies, updated);
            }
            return new SubmissionOutcome(valid.size(), partials.size() - valid.size(), updated.progress());
        });
    }

    @NonNull
    @Override
    public CeremonyProgress status(@NonNull final String electionId) {
        return ceremony(electionId).progress();
    }

    @NonNull
    @Override
    public Optional<TallyResult> result(@NonNull final String electionId) {
        return Optional.ofNullable(ceremony(electionId).result());
    }

    @NonNull
    @Override
    public DecryptionCeremony ceremony(@NonNull final String electionId) {
        requireNonNull(electionId);
        final var latest = ceremoniesOf(electionId).latest();
        if (latest == null) {
            throw new CeremonyNotFoundException(electionId);
        }
        return latest;
    }

    @NonNull
    @Override
    public List<DecryptionCeremony> history(@NonNull final String electionId) {
        requireNonNull(electionId);
        final var ceremonies = elections.get(electionId);
        return ceremonies == null ? List.of() : ceremonies.attempts();
    }

    @NonNull
    @Override
    public CeremonyProgress abort(@NonNull final String electionId, @NonNull final String reason) {
        requireNonNull(electionId);
        requireNonNull(reason);
        final var ceremonies = ceremoniesOf(electionId);
        return withLock(ceremonies, () -> abortLocked(ceremonies, reason).progress());
    }

    @NonNull
    @Override
    public List<String> abortExpired() {
        final Instant now = clock.instant();
        final List<String> aborted = new ArrayList<>();
        for (final var ceremonies : elections.values()) {
            final var latest = ceremonies.latest();
            if (latest == null || latest.status().isTerminal() || !now.isAfter(latest.deadline())) {
                continue;
            }
            final boolean expired = withLock(ceremonies, () -> {
                final var current = requireNonNull(ceremonies.latest());
                if (current.status().isTerminal() || !now.isAfter(current.deadline())) {
                    return false;
                }
                abortLocked(ceremonies, TIMEOUT_REASON);
                return true;
            });
            if (expired) {
                aborted.add(ceremonies.electionId());
            }
        }
        aborted.sort(Comparator.naturalOrder());
        return aborted;
    }

    private DecryptionCeremony abortLocked(final ElectionCeremonies ceremonies, final String reason) {
        final var current = requireNonNull(ceremonies.latest());
        final Transition transition = stateMachine.onAbort(current.status());
        if (!transition.accepted()) {
            throw new CeremonyStateException(
                    "Cannot abort ceremony for election " + ceremonies.electionId() + " in status " + current.status());
        }
        final var updated = copyOf(
                current, ABORTED, current.submittedTrustees(), current.partials(), reason, current.result());
        ceremonies.replaceLatest(store, updated);
        log.info(
                "Aborted decryption ceremony for election {} (attempt {}): {}",
                ceremonies.electionId(),
                current.attempt(),
                reason);
        return updated;
    }

    /**
     * Runs the tally of a ceremony that reached its threshold and records the outcome. Must hold the lock.
     */
    private DecryptionCeremony combine(final ElectionCeremonies ceremonies, final DecryptionCeremony combining) {
        DecryptionCeremony updated;
        try {
            final var entries = boundEntriesOf(ceremonies, combining);
            final Map<String, List<PartialDecryption>> partialsByEntry = new LinkedHashMap<>();
            validPartialsByEntry(combining)
                    .forEach((entryId, byTrustee) -> partialsByEntry.put(entryId, List.copyOf(byTrustee.values())));
            final TallyResult result = aggregator.combine(
                    List.copyOf(entries.values()),
                    partialsByEntry,
                    combining.requiredShares(),
                    combining.candidateIds());
            final Transition transition = stateMachine.onTallyOutcome(combining.status(), true);
            updated = copyOf(
                    combining,
                    transition.newStatus(),
                    combining.submittedTrustees(),
                    combining.partials(),
                    null,
                    result);
            log.info(
                    "Completed decryption ceremony for election {}: {} votes from {} trustees",
                    ceremonies.electionId(),
                    result.totalVotes(),
                    result.participatingTrustees().size());
        } catch (TallyFailureException e) {
            log.warn("Tally of election {} failed, ceremony aborted", ceremonies.electionId(), e);
            final Transition transition = stateMachine.onTallyOutcome(combining.status(), false);
            updated = copyOf(
                    combining,
                    transition.newStatus(),
                    combining.submittedTrustees(),
                    combining.partials(),
                    TALLY_FAILURE_REASON,
                    null);
        }
        ceremonies.replaceLatest(store, updated);
        return updated;
    }

    private void checkPartial(
            final PartialDecryption partial, final String commitment, final Map<String, VoteEntry> entries) {
        if (!entries.containsKey(partial.entryId())) {
            throw new InvalidPartialProofException(
                    partial.trusteeId(), partial.entryId(), "entry is not bound to the ceremony");
        }
        final boolean verified;
        try {
            verified = library.verifyPartialProof(partial, commitment);
        } catch (RuntimeException e) {
            log.debug("Partial proof verification threw for entry {}", partial.entryId(), e);
            throw new InvalidPartialProofException(
                    partial.trusteeId(), partial.entryId(), "correctness proof could not be verified");
        }
        if (!verified) {
            throw new InvalidPartialProofException(
                    partial.trusteeId(), partial.entryId(), "correctness proof rejected");
        }
    }

    private static void validateShape(final String trusteeId, final List<PartialDecryption> partials) {
        final Set<String> entryIds = new HashSet<>();
        for (final var partial : partials) {
            requireNonNull(partial, "partials must not contain null");
            if (!partial.trusteeId().equals(trusteeId)) {
                throw new ValidationException(
                        "Submission of trustee " + trusteeId + " contains a partial of " + partial.trusteeId());
            }
            if (!entryIds.add(partial.entryId())) {
                throw new ValidationException(
                        "Submission of trustee " + trusteeId + " repeats entry " + partial.entryId());
            }
        }
    }

    private List<VoteLedger> ledgersOf(final String electionId) {
        final var existing = ledgers.ledgersFor(electionId);
        return existing.isEmpty() ? List.of(ledgers.ledger(Scope.forElection(electionId))) : existing;
    }

    /**
     * The entries a ceremony decrypts, checked against the roots it bound. Must hold the lock.
     */
    private Map<String, VoteEntry> boundEntriesOf(
            final ElectionCeremonies ceremonies, final DecryptionCeremony ceremony) {
        var entries = ceremonies.boundEntries();
        if (entries == null) {
            entries = loadBoundEntries(ceremony.boundSnapshots());
            ceremonies.setBoundEntries(entries);
        }
        return entries;
    }

    private Map<String, VoteEntry> loadBoundEntries(final List<LedgerSnapshot> snapshots) {
        final Map<String, VoteEntry> entries = new LinkedHashMap<>();
        for (final var snapshot : snapshots) {
            final var ledger = ledgers.ledger(snapshot.scope());
            try {
                if (!ledger.rootAt(snapshot.voteCount()).equals(snapshot.root())) {
                    log.error("Ledger {} no longer matches the root bound by its ceremony", snapshot.scope());
                    throw new TallyFailureException();
                }
            } catch (VoteLedgerException e) {
                if (e instanceof TallyFailureException tallyFailure) {
                    throw tallyFailure;
                }
                throw new TallyFailureException(e);
            }
            ledger.entries(snapshot.voteCount()).forEach(entry -> entries.put(entry.id(), entry));
        }
        return entries;
    }

    private static Map<String, SortedMap<String, PartialDecryption>> validPartialsByEntry(
            final DecryptionCeremony ceremony) {
        final Map<String, SortedMap<String, PartialDecryption>> byEntry = new LinkedHashMap<>();
        for (final var recorded : ceremony.partials()) {
            if (recorded.valid()) {
                final var partial = recorded.partial();
                byEntry.computeIfAbsent(partial.entryId(), id -> new TreeMap<>())
                        .putIfAbsent(partial.trusteeId(), partial);
            }
        }
        return byEntry;
    }

    private static DecryptionCeremony copyOf(
            final DecryptionCeremony ceremony,
            final CeremonyStatus status,
            final List<String> submittedTrustees,
            final List<RecordedPartial> partials,
            @Nullable final String abortReason,
            @Nullable final TallyResult result) {
        return new DecryptionCeremony(
                ceremony.electionId(),
                ceremony.attempt(),
                status,
                ceremony.requiredShares(),
                ceremony.boundSnapshots(),
                ceremony.candidateIds(),
                submittedTrustees,
                partials,
                ceremony.startedAt(),
                ceremony.deadline(),
                abortReason,
                status == COMPLETED ? result : null);
    }

    private ElectionCeremonies ceremoniesOf(final String electionId) {
        final var ceremonies = elections.get(electionId);
        if (ceremonies == null || ceremonies.latest() == null) {
            throw new CeremonyNotFoundException(electionId);
        }
        return ceremonies;
    }

    private static <T> T withLock(final ElectionCeremonies ceremonies, final Supplier<T> action) {
        final ReentrantLock lock = ceremonies.lock();
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
