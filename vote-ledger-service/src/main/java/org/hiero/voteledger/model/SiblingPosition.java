// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.model;

/**
 * Which side of the path being proven a sibling hash sits on. Determines the argument order when the sibling is
 * combined with the running hash.
 */
public enum SiblingPosition {
    /** The sibling is the left child: {@code H(sibling ‖ current)}. */
    LEFT,
    /** The sibling is the right child: {@code H(current ‖ sibling)}. */
    RIGHT
}
