// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.config;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * @param scopePolicy how submissions map to nullifier scopes; there is no implicit default
 */
public record NullifierConfig(@NonNull NullifierScopePolicy scopePolicy) {
    public NullifierConfig {
        requireNonNull(scopePolicy, "nullifiers.scopePolicy must be configured");
    }
}
