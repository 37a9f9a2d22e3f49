// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import dagger.Binds;
import dagger.Module;
import dagger.Provides;
import edu.umd.cs.findbugs.annotations.NonNull;
import javax.inject.Singleton;
import org.hiero.voteledger.DecryptionCeremonyCoordinator;
import org.hiero.voteledger.NullifierRegistry;
import org.hiero.voteledger.TallyAggregator;
import org.hiero.voteledger.VoteLedgers;
import org.hiero.voteledger.VoteSubmissionService;
import org.hiero.voteledger.config.CeremonyConfig;
import org.hiero.voteledger.config.LedgerConfig;
import org.hiero.voteledger.config.NullifierConfig;
import org.hiero.voteledger.config.StorageConfig;
import org.hiero.voteledger.config.VoteLedgerConfig;
import org.hiero.voteledger.impl.ceremony.DecryptionCeremonyCoordinatorImpl;
import org.hiero.voteledger.impl.ledger.NullifierRegistryImpl;
import org.hiero.voteledger.impl.ledger.VoteLedgersImpl;
import org.hiero.voteledger.impl.store.CeremonyStore;
import org.hiero.voteledger.impl.store.FileCeremonyStore;
import org.hiero.voteledger.impl.store.FileNullifierStore;
import org.hiero.voteledger.impl.store.FileSnapshotStore;
import org.hiero.voteledger.impl.store.FileVoteEntryStore;
import org.hiero.voteledger.impl.store.NullifierStore;
import org.hiero.voteledger.impl.store.SnapshotStore;
import org.hiero.voteledger.impl.store.StoreJson;
import org.hiero.voteledger.impl.store.VoteEntryStore;
import org.hiero.voteledger.impl.submission.VoteSubmissionServiceImpl;
import org.hiero.voteledger.impl.tally.TallyAggregatorImpl;

/**
 * Dagger module providing the vote ledger components.
 */
@Module
public interface VoteLedgerModule {
    @Provides
    static StorageConfig provideStorageConfig(@NonNull final VoteLedgerConfig config) {
        return config.storage();
    }

    @Provides
    static LedgerConfig provideLedgerConfig(@NonNull final VoteLedgerConfig config) {
        return config.ledger();
    }

    @Provides
    static NullifierConfig provideNullifierConfig(@NonNull final VoteLedgerConfig config) {
        return config.nullifiers();
    }

    @Provides
    static CeremonyConfig provideCeremonyConfig(@NonNull final VoteLedgerConfig config) {
        return config.ceremony();
    }

    @Provides
    @Singleton
    static ObjectMapper provideObjectMapper() {
        return StoreJson.newObjectMapper();
    }

    @Provides
    @Singleton
    static VoteEntryStore provideVoteEntryStore(
            @NonNull final StorageConfig config, @NonNull final ObjectMapper mapper) {
        return new FileVoteEntryStore(config, mapper);
    }

    @Provides
    @Singleton
    static NullifierStore provideNullifierStore(
            @NonNull final StorageConfig config, @NonNull final ObjectMapper mapper) {
        return new FileNullifierStore(config, mapper);
    }

    @Provides
    @Singleton
    static SnapshotStore provideSnapshotStore(@NonNull final StorageConfig config, @NonNull final ObjectMapper mapper) {
        return new FileSnapshotStore(config, mapper);
    }

    @Provides
    @Singleton
    static CeremonyStore provideCeremonyStore(@NonNull final StorageConfig config, @NonNull final ObjectMapper mapper) {
        return new FileCeremonyStore(config, mapper);
    }

    @Binds
    @Singleton
    NullifierRegistry bindNullifierRegistry(NullifierRegistryImpl registry);

    @Binds
    @Singleton
    VoteLedgers bindVoteLedgers(VoteLedgersImpl ledgers);

    @Binds
    @Singleton
    TallyAggregator bindTallyAggregator(TallyAggregatorImpl aggregator);

    @Binds
    @Singleton
    DecryptionCeremonyCoordinator bindCeremonyCoordinator(DecryptionCeremonyCoordinatorImpl coordinator);

    @Binds
    @Singleton
    VoteSubmissionService bindVoteSubmissionService(VoteSubmissionServiceImpl service);
}
