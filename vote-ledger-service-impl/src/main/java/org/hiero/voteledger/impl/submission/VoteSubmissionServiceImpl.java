// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.impl.submission;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.security.SecureRandom;
import java.time.InstantSource;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hiero.voteledger.VoteLedger;
import org.hiero.voteledger.VoteLedgers;
import org.hiero.voteledger.VoteSubmissionService;
import org.hiero.voteledger.config.NullifierConfig;
import org.hiero.voteledger.exceptions.ValidationException;
import org.hiero.voteledger.model.AppendResult;
import org.hiero.voteledger.model.Scope;
import org.hiero.voteledger.model.VoteEntry;
import org.hiero.voteledger.model.VoteReceipt;
import org.hiero.voteledger.model.VoteSubmission;
import org.hiero.voteledger.spi.CredentialVerifier;
import org.hiero.voteledger.spi.ElectionPublicKeys;
import org.hiero.voteledger.spi.ZkProofVerifier;

/**
 * Verifies a submission and records it in the ledger of its scope.
 */
@Singleton
public class VoteSubmissionServiceImpl implements VoteSubmissionService {
    private static final Logger log = LogManager.getLogger(VoteSubmissionServiceImpl.class);

    static final String ELECTION_ID_INPUT = "electionId";
    static final String QUESTION_ID_INPUT = "questionId";
    static final String COMMITMENT_INPUT = "commitment";
    static final String NULLIFIER_INPUT = "nullifier";

    private static final int CONFIRMATION_CODE_BYTES = 8;
    private static final HexFormat CONFIRMATION_CODE_FORMAT = HexFormat.of().withUpperCase();

    private final VoteLedgers ledgers;
    private final CredentialVerifier credentialVerifier;
    private final ZkProofVerifier zkProofVerifier;
    private final ElectionPublicKeys publicKeys;
    private final NullifierConfig nullifierConfig;
    private final InstantSource clock;
    private final SecureRandom random = new SecureRandom();

    @Inject
    public VoteSubmissionServiceImpl(
            @NonNull final VoteLedgers ledgers,
            @NonNull final CredentialVerifier credentialVerifier,
            @NonNull final ZkProofVerifier zkProofVerifier,
            @NonNull final ElectionPublicKeys publicKeys,
            @NonNull final NullifierConfig nullifierConfig,
            @NonNull final InstantSource clock) {
        this.ledgers = requireNonNull(ledgers);
        this.credentialVerifier = requireNonNull(credentialVerifier);
        this.zkProofVerifier = requireNonNull(zkProofVerifier);
        this.publicKeys = requireNonNull(publicKeys);
        this.nullifierConfig = requireNonNull(nullifierConfig);
        this.clock = requireNonNull(clock);
    }

    @NonNull
    @Override
    public VoteReceipt submit(@NonNull final VoteSubmission submission) {
        requireNonNull(submission);
        final var credential = submission.credential();
        if (!credential.electionId().equals(submission.electionId())) {
            throw new ValidationException("Credential was not issued for election " + submission.electionId());
        }
        final String publicKey = publicKeys.publicKeyOf(submission.electionId());
        if (publicKey == null) {
            throw new ValidationException("No credential key for election " + submission.electionId());
        }
        if (!credentialVerifier.verifyCredentialSignature(credential, publicKey)) {
            throw new ValidationException("Invalid credential signature");
        }
        if (!zkProofVerifier.verifyZkProof(submission.zkProof(), publicInputsOf(submission))) {
            throw new ValidationException("Invalid ballot proof");
        }

        final Scope scope = scopeOf(submission);
        final VoteLedger ledger = ledgers.ledger(scope);
        final var entry = new VoteEntry(
                UUID.randomUUID().toString(),
                submission.encryptedVote(),
                submission.commitment(),
                submission.zkProof(),
                credential.nullifier(),
                clock.instant());
        final AppendResult appended = ledger.append(entry);
        log.debug("Accepted vote {} at position {} of {}", entry.id(), appended.position(), scope);
        return new VoteReceipt(confirmationCode(), scope, entry.id(), appended.position(), appended.proof());
    }

    private Scope scopeOf(final VoteSubmission submission) {
        final String questionId = submission.questionId();
        try {
            return switch (nullifierConfig.scopePolicy()) {
                case PER_ELECTION -> Scope.forElection(submission.electionId());
                case PER_QUESTION -> {
                    if (questionId == null) {
                        throw new ValidationException("A question id is required to vote in a per-question scope");
                    }
                    yield Scope.forQuestion(submission.electionId(), questionId);
                }
            };
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage());
        }
    }

    private static Map<String, String> publicInputsOf(final VoteSubmission submission) {
        final Map<String, String> inputs = new LinkedHashMap<>();
        inputs.put(ELECTION_ID_INPUT, submission.electionId());
        if (submission.questionId() != null) {
            inputs.put(QUESTION_ID_INPUT, submission.questionId());
        }
        inputs.put(COMMITMENT_INPUT, submission.commitment());
        inputs.put(NULLIFIER_INPUT, submission.credential().nullifier());
        return inputs;
    }

    private String confirmationCode() {
        final byte[] bytes = new byte[CONFIRMATION_CODE_BYTES];
        random.nextBytes(bytes);
        return CONFIRMATION_CODE_FORMAT.formatHex(bytes);
    }
}
