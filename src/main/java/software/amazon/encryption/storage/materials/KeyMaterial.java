// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage.materials;

import software.amazon.encryption.storage.StorageTransformException;
import software.amazon.encryption.storage.internal.EnvelopeCodec;

/**
 * One key as delivered by a {@link KeyMaterialSource}: the provider it belongs to, its id and its
 * secret bytes. The bytes are not validated as a key here, because a source may hand out wrapped
 * keys that a decorating source unwraps later.
 */
public final class KeyMaterial {

    private final String _providerId;
    private final String _keyId;
    private final byte[] _secret;

    private KeyMaterial(String providerId, String keyId, byte[] secret) {
        EnvelopeCodec.validateIdentifier(providerId, "Provider id");
        EnvelopeCodec.validateIdentifier(keyId, "Key id");
        if (secret == null || secret.length == 0) {
            throw new StorageTransformException("Key material for key " + keyId + " cannot be null or empty!");
        }
        _providerId = providerId;
        _keyId = keyId;
        _secret = secret.clone();
    }

    public static KeyMaterial of(String providerId, String keyId, byte[] secret) {
        return new KeyMaterial(providerId, keyId, secret);
    }

    public String providerId() {
        return _providerId;
    }

    public String keyId() {
        return _keyId;
    }

    public byte[] secret() {
        return _secret.clone();
    }

    /**
     * Returns a copy of this material carrying different bytes, e.g. after unwrapping.
     */
    public KeyMaterial withSecret(byte[] secret) {
        return new KeyMaterial(_providerId, _keyId, secret);
    }

    public StorageKey toStorageKey() {
        return StorageKey.of(_keyId, _secret);
    }

    boolean matches(String providerId, String keyId) {
        return _providerId.equals(providerId) && _keyId.equals(keyId);
    }

    @Override
    public String toString() {
        return "KeyMaterial{providerId=" + _providerId + ", keyId=" + _keyId + "}";
    }
}
