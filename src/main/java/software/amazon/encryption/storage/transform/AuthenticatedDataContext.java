// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage.transform;

import software.amazon.encryption.storage.StorageTransformException;

import java.nio.charset.StandardCharsets;

/**
 * Supplies the authenticated data bound to a record. The value is derived from where the record
 * lives and is never stored with it, so the same context MUST be supplied on read as on write.
 * <p>
 * Changing how the authenticated data is derived invalidates every existing envelope; treat it
 * like a key rotation.
 */
@FunctionalInterface
public interface AuthenticatedDataContext {

    byte[] authenticatedData();

    /**
     * The default derivation: the UTF-8 bytes of the storage path, e.g. {@code /registry/secrets/ns/name}.
     * @param storagePath the storage key or path of the record
     * @return a context for that path
     */
    static AuthenticatedDataContext forPath(String storagePath) {
        if (storagePath == null) {
            throw new StorageTransformException("Storage path cannot be null!");
        }
        final byte[] authenticatedData = storagePath.getBytes(StandardCharsets.UTF_8);
        return authenticatedData::clone;
    }
}
