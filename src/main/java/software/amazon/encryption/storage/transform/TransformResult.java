// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage.transform;

import software.amazon.encryption.storage.StorageTransformException;

/**
 * The outcome of {@link Transformer#fromStorage(byte[], AuthenticatedDataContext)}.
 */
public final class TransformResult {

    private final byte[] _plaintext;
    private final boolean _stale;

    private TransformResult(byte[] plaintext, boolean stale) {
        _plaintext = plaintext;
        _stale = stale;
    }

    public static TransformResult of(byte[] plaintext, boolean stale) {
        if (plaintext == null) {
            throw new StorageTransformException("Plaintext cannot be null!");
        }
        return new TransformResult(plaintext.clone(), stale);
    }

    public byte[] plaintext() {
        return _plaintext.clone();
    }

    /**
     * Returns {@code true} when the record was not written by the active provider and key.
     * Callers should rewrite such records, even if nothing else about them changed.
     * @return whether the record should be rewritten
     */
    public boolean stale() {
        return _stale;
    }

    TransformResult markStale() {
        return _stale ? this : new TransformResult(_plaintext, true);
    }
}
