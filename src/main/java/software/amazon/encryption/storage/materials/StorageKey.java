// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage.materials;

import software.amazon.encryption.storage.StorageTransformException;
import software.amazon.encryption.storage.algorithms.AlgorithmSuite;
import software.amazon.encryption.storage.internal.CryptoFactory;
import software.amazon.encryption.storage.internal.EnvelopeCodec;

import javax.crypto.KeyGenerator;
import java.security.Provider;

/**
 * A symmetric key with a stable identifier. Immutable once created; the secret is copied on the
 * way in and on the way out, and is never part of {@link #toString()}.
 */
public final class StorageKey {

    private static final AlgorithmSuite ALGORITHM_SUITE = AlgorithmSuite.ALG_AES_256_GCM_IV12_TAG16;

    private final String _keyId;
    private final byte[] _secret;

    private StorageKey(String keyId, byte[] secret) {
        EnvelopeCodec.validateIdentifier(keyId, "Key id");
        if (secret == null) {
            throw new StorageTransformException("Secret for key " + keyId + " cannot be null!");
        }
        if (secret.length != ALGORITHM_SUITE.dataKeyLengthBytes()) {
            throw new StorageTransformException("Secret for key " + keyId + " must be "
                    + ALGORITHM_SUITE.dataKeyLengthBytes() + " bytes, found: " + secret.length);
        }
        _keyId = keyId;
        _secret = secret.clone();
    }

    public static StorageKey of(String keyId, byte[] secret) {
        return new StorageKey(keyId, secret);
    }

    /**
     * Generates a fresh random key, e.g. as the next key of a rotation.
     * @param keyId the identifier of the new key
     * @param cryptoProvider the JCA provider to generate with, or null for the default
     * @return a new key
     */
    public static StorageKey generate(String keyId, Provider cryptoProvider) {
        KeyGenerator generator = CryptoFactory.generateKey(ALGORITHM_SUITE.dataKeyAlgorithm(), cryptoProvider);
        generator.init(ALGORITHM_SUITE.dataKeyLengthBits());
        return new StorageKey(keyId, generator.generateKey().getEncoded());
    }

    public String keyId() {
        return _keyId;
    }

    public byte[] secret() {
        return _secret.clone();
    }

    @Override
    public String toString() {
        return "StorageKey{keyId=" + _keyId + "}";
    }
}
