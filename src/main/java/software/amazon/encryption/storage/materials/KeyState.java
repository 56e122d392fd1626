// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage.materials;

/**
 * Lifecycle of a key during rotation.
 * <pre>
 * ABSENT -&gt; DECRYPT_ONLY -&gt; ACTIVE -&gt; DECRYPT_ONLY -&gt; REMOVED
 * </pre>
 * A removed key id is never reused.
 */
public enum KeyState {
    ABSENT,
    DECRYPT_ONLY,
    ACTIVE,
    REMOVED;

    public boolean canTransitionTo(KeyState next) {
        switch (this) {
            case ABSENT:
                return next == DECRYPT_ONLY;
            case DECRYPT_ONLY:
                return next == ACTIVE || next == REMOVED;
            case ACTIVE:
                return next == DECRYPT_ONLY;
            default:
                return false;
        }
    }
}
