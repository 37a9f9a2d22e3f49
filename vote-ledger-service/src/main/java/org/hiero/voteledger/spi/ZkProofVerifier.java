// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.spi;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Map;

/**
 * Verifies zero-knowledge ballot validity proofs. Implemented by the proof subsystem.
 */
@FunctionalInterface
public interface ZkProofVerifier {
    /**
     * @param proof        the serialized proof
     * @param publicInputs the public inputs the proof is bound to, by name
     * @return whether the proof verifies
     */
    boolean verifyZkProof(@NonNull String proof, @NonNull Map<String, String> publicInputs);
}
