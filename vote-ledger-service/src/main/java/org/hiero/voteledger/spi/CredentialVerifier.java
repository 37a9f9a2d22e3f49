// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.spi;

import edu.umd.cs.findbugs.annotations.NonNull;
import org.hiero.voteledger.model.Credential;

/**
 * Verifies blind signatures on voting credentials. Implemented by the credential-issuance subsystem.
 */
@FunctionalInterface
public interface CredentialVerifier {
    /**
     * @param credential the presented credential
     * @param publicKey  the election's credential-signing public key
     * @return whether the signature is valid for the key
     */
    boolean verifyCredentialSignature(@NonNull Credential credential, @NonNull String publicKey);
}
