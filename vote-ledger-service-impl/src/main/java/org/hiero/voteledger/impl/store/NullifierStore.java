// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.impl.store;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;
import org.hiero.voteledger.exceptions.LedgerStorageException;
import org.hiero.voteledger.model.NullifierRecord;

/**
 * Durable log of nullifier reservations and their compensating releases.
 */
public interface NullifierStore {

    /**
     * A reservation or release, in the order it was committed.
     *
     * @param type   what happened
     * @param record the affected nullifier
     */
    record NullifierEvent(@NonNull Type type, @NonNull NullifierRecord record) {
        public NullifierEvent {
            requireNonNull(type, "type must not be null");
            requireNonNull(record, "record must not be null");
        }

        public enum Type {
            RESERVED,
            RELEASED
        }
    }

    /**
     * @return every committed event in commit order
     * @throws LedgerStorageException if the log cannot be read
     */
    @NonNull
    List<NullifierEvent> load();

    /**
     * Durably appends an event.
     *
     * @param event the event
     * @throws LedgerStorageException if the event cannot be written
     */
    void append(@NonNull NullifierEvent event);
}
