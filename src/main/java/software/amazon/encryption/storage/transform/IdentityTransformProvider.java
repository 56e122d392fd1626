// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage.transform;

import software.amazon.encryption.storage.StorageTransformException;

/**
 * Pass-through provider. Used for resource kinds that are not encrypted and, inside a
 * {@link TransformChain}, for reading records written before encryption was enabled.
 * Identity data carries no envelope header.
 */
public final class IdentityTransformProvider implements TransformProvider {

    public static final String PROVIDER_ID = "identity";

    public static final IdentityTransformProvider INSTANCE = new IdentityTransformProvider();

    private IdentityTransformProvider() {
    }

    @Override
    public String providerId() {
        return PROVIDER_ID;
    }

    @Override
    public byte[] toStorage(byte[] plaintext, AuthenticatedDataContext context) {
        if (plaintext == null) {
            throw new StorageTransformException("Plaintext cannot be null!");
        }
        return plaintext.clone();
    }

    @Override
    public TransformResult fromStorage(byte[] stored, AuthenticatedDataContext context) {
        if (stored == null) {
            throw new StorageTransformException("Stored data cannot be null!");
        }
        return TransformResult.of(stored, false);
    }
}
