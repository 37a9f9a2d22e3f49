// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.impl;

import dagger.BindsInstance;
import dagger.Component;
import java.time.InstantSource;
import javax.inject.Singleton;
import org.hiero.voteledger.DecryptionCeremonyCoordinator;
import org.hiero.voteledger.NullifierRegistry;
import org.hiero.voteledger.VoteLedgers;
import org.hiero.voteledger.VoteSubmissionService;
import org.hiero.voteledger.config.VoteLedgerConfig;
import org.hiero.voteledger.spi.CredentialVerifier;
import org.hiero.voteledger.spi.ElectionPublicKeys;
import org.hiero.voteledger.spi.ThresholdDecryptionLibrary;
import org.hiero.voteledger.spi.TrusteeDirectory;
import org.hiero.voteledger.spi.ZkProofVerifier;

/**
 * The object graph of a vote ledger. The caller owns the component and with it every store; two components
 * must not share a storage directory.
 *
 * <pre>{@code
 * VoteLedgerInjectionComponent component = DaggerVoteLedgerInjectionComponent.builder()
 *         .config(VoteLedgerConfigLoader.load())
 *         .instantSource(InstantSource.system())
 *         ...
 *         .build();
 * }</pre>
 */
@Singleton
@Component(modules = VoteLedgerModule.class)
public interface VoteLedgerInjectionComponent {
    VoteLedgers voteLedgers();

    NullifierRegistry nullifierRegistry();

    DecryptionCeremonyCoordinator ceremonyCoordinator();

    VoteSubmissionService voteSubmissionService();

    @Component.Builder
    interface Builder {
        @BindsInstance
        Builder config(VoteLedgerConfig config);

        @BindsInstance
        Builder instantSource(InstantSource instantSource);

        @BindsInstance
        Builder credentialVerifier(CredentialVerifier credentialVerifier);

        @BindsInstance
        Builder zkProofVerifier(ZkProofVerifier zkProofVerifier);

        @BindsInstance
        Builder electionPublicKeys(ElectionPublicKeys electionPublicKeys);

        @BindsInstance
        Builder thresholdDecryptionLibrary(ThresholdDecryptionLibrary library);

        @BindsInstance
        Builder trusteeDirectory(TrusteeDirectory trusteeDirectory);

        VoteLedgerInjectionComponent build();
    }
}
