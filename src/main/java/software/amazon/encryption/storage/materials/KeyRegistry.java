// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage.materials;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import software.amazon.encryption.storage.StorageTransformException;
import software.amazon.encryption.storage.UnknownKeyException;
import software.amazon.encryption.storage.internal.Aead;
import software.amazon.encryption.storage.internal.AesGcmAead;

import java.security.Provider;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The set of keys known to one transform provider. Exactly one key is active and used for every
 * encryption; all other keys are decrypt-only.
 * <p>
 * A registry is immutable once built. Every key is resolved to its {@link Aead} capability at build
 * time, so lookups never allocate key objects and any number of threads may read concurrently.
 * To change keys, build a new registry and swap the transformer that uses it.
 */
public final class KeyRegistry {

    private final String _activeKeyId;
    private final Map<String, Aead> _aeads;

    private KeyRegistry(Builder builder) {
        _activeKeyId = builder._activeKey.keyId();

        Map<String, Aead> aeads = new LinkedHashMap<>();
        aeads.put(_activeKeyId, builder._aeadFactory.createAead(builder._activeKey.secret(), builder._cryptoProvider));
        for (StorageKey key : builder._decryptionKeys) {
            if (aeads.containsKey(key.keyId())) {
                throw new StorageTransformException("Duplicate key id: " + key.keyId());
            }
            aeads.put(key.keyId(), builder._aeadFactory.createAead(key.secret(), builder._cryptoProvider));
        }
        _aeads = Collections.unmodifiableMap(aeads);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String activeKeyId() {
        return _activeKeyId;
    }

    public Aead activeAead() {
        return _aeads.get(_activeKeyId);
    }

    public boolean isActive(String keyId) {
        return _activeKeyId.equals(keyId);
    }

    public boolean contains(String keyId) {
        return _aeads.containsKey(keyId);
    }

    /**
     * Resolves a key id to its AEAD capability.
     * @param keyId the id read from an envelope
     * @return the capability for that key
     * @throws UnknownKeyException if the registry has no such key
     */
    public Aead resolve(String keyId) {
        Aead aead = _aeads.get(keyId);
        if (aead == null) {
            throw new UnknownKeyException("Key " + keyId + " is not in the key registry");
        }
        return aead;
    }

    /**
     * @return all key ids, the active key first
     */
    public List<String> keyIds() {
        return new ArrayList<>(_aeads.keySet());
    }

    @Override
    public String toString() {
        return "KeyRegistry{activeKeyId=" + _activeKeyId + ", keyIds=" + _aeads.keySet() + "}";
    }

    public static class Builder {
        private StorageKey _activeKey;
        private final List<StorageKey> _decryptionKeys = new ArrayList<>();
        private Provider _cryptoProvider = null;
        private AeadFactory _aeadFactory = AesGcmAead::new;

        private Builder() {
        }

        /**
         * Sets the single key used for all new encryptions. It can also decrypt.
         */
        public Builder activeKey(StorageKey activeKey) {
            if (activeKey == null) {
                throw new StorageTransformException("Active key cannot be null!");
            }
            _activeKey = activeKey;
            return this;
        }

        /**
         * Adds a decrypt-only key.
         */
        public Builder decryptionKey(StorageKey decryptionKey) {
            if (decryptionKey == null) {
                throw new StorageTransformException("Decryption key cannot be null!");
            }
            _decryptionKeys.add(decryptionKey);
            return this;
        }

        public Builder decryptionKeys(Collection<StorageKey> decryptionKeys) {
            if (decryptionKeys == null) {
                throw new StorageTransformException("Decryption keys cannot be null!");
            }
            decryptionKeys.forEach(this::decryptionKey);
            return this;
        }

        /**
         * Allows a JCA {@link Provider} other than the default provider chain to be used.
         * Advanced option; the provider MUST support AES/GCM/NoPadding.
         */
        @SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "JCA providers are shared singletons")
        public Builder cryptoProvider(Provider cryptoProvider) {
            _cryptoProvider = cryptoProvider;
            return this;
        }

        public Builder aeadFactory(AeadFactory aeadFactory) {
            if (aeadFactory == null) {
                throw new StorageTransformException("AeadFactory cannot be null!");
            }
            _aeadFactory = aeadFactory;
            return this;
        }

        public KeyRegistry build() {
            if (_activeKey == null) {
                throw new StorageTransformException("A key registry requires an active key");
            }
            return new KeyRegistry(this);
        }
    }
}
