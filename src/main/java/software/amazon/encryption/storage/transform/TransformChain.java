// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage.transform;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import software.amazon.encryption.storage.MalformedEnvelopeException;
import software.amazon.encryption.storage.StorageTransformException;
import software.amazon.encryption.storage.UnknownProviderException;
import software.amazon.encryption.storage.internal.EnvelopeCodec;
import software.amazon.encryption.storage.internal.EnvelopeEncoding;
import software.amazon.encryption.storage.materials.KeyMaterial;
import software.amazon.encryption.storage.materials.KeyMaterials;
import software.amazon.encryption.storage.materials.KeyRegistry;

import java.security.Provider;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An ordered set of providers, exactly one of which is active for writes.
 * <p>
 * Reads are dispatched on the leading provider id of the stored data alone; the payload is only
 * parsed by the provider that owns it. Records written by any provider other than the active one
 * are reported stale.
 * <p>
 * When the {@link IdentityTransformProvider} is part of the chain, data without an envelope
 * header is returned unchanged. This is how records written before encryption was enabled stay
 * readable while they are being migrated. Data with a {@code providerId:keyId:} header naming an
 * unregistered provider always fails with {@link UnknownProviderException}, and is never read as
 * plaintext.
 */
public final class TransformChain implements Transformer {

    private static final Log LOG = LogFactory.getLog(TransformChain.class);

    private final Map<String, TransformProvider> _providers;
    private final TransformProvider _activeProvider;
    private final StalenessPolicy _stalenessPolicy;
    private final TransformProvider _plaintextFallback;

    private TransformChain(Map<String, TransformProvider> providers, String activeProviderId) {
        _providers = Collections.unmodifiableMap(providers);
        _activeProvider = providers.get(activeProviderId);
        _stalenessPolicy = StalenessPolicy.activeProvider(activeProviderId);
        _plaintextFallback = providers.get(IdentityTransformProvider.PROVIDER_ID);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds one AES-GCM provider per provider id in the key materials. The provider of the primary
     * key is active.
     */
    public static TransformChain fromKeyMaterials(KeyMaterials keyMaterials) {
        return builder().keyMaterials(keyMaterials).build();
    }

    public String activeProviderId() {
        return _activeProvider.providerId();
    }

    public TransformProvider provider(String providerId) {
        return _providers.get(providerId);
    }

    /**
     * @return the provider ids in chain order
     */
    public List<String> providerIds() {
        return new ArrayList<>(_providers.keySet());
    }

    @Override
    public byte[] toStorage(byte[] plaintext, AuthenticatedDataContext context) {
        return _activeProvider.toStorage(plaintext, context);
    }

    @Override
    public TransformResult fromStorage(byte[] stored, AuthenticatedDataContext context) {
        if (stored == null) {
            throw new MalformedEnvelopeException("Stored data cannot be null");
        }
        Optional<String> providerId = EnvelopeCodec.providerIdOf(stored);
        TransformProvider provider = providerId.map(_providers::get).orElse(null);

        if (provider == null || provider == _plaintextFallback) {
            return readUnprefixed(stored, context, providerId);
        }

        TransformResult result = provider.fromStorage(stored, context);
        if (_stalenessPolicy.isStale(provider.providerId(), null)) {
            if (LOG.isDebugEnabled()) {
                LOG.debug("Record written by provider " + provider.providerId() + " is stale, active provider is "
                        + _activeProvider.providerId());
            }
            return result.markStale();
        }
        return result;
    }

    private TransformResult readUnprefixed(byte[] stored, AuthenticatedDataContext context, Optional<String> providerId) {
        if (providerId.isPresent() && !providerId.get().equals(IdentityTransformProvider.PROVIDER_ID)
                && EnvelopeCodec.hasHeader(stored)) {
            throw new UnknownProviderException("No provider registered for id " + providerId.get());
        }
        if (_plaintextFallback == null) {
            if (providerId.isPresent()) {
                throw new UnknownProviderException("No provider registered for id " + providerId.get());
            }
            throw new MalformedEnvelopeException("Stored data has no provider id");
        }
        TransformResult result = _plaintextFallback.fromStorage(stored, context);
        if (_activeProvider != _plaintextFallback) {
            LOG.debug("Read a record without an envelope header as plaintext");
            return result.markStale();
        }
        return result;
    }

    @Override
    public String toString() {
        return "TransformChain{activeProvider=" + _activeProvider.providerId() + ", providers=" + _providers.keySet() + "}";
    }

    public static class Builder {
        private final Map<String, TransformProvider> _providers = new LinkedHashMap<>();
        private String _activeProviderId;
        private KeyMaterials _keyMaterials;
        private boolean _enableLegacyPlaintextReads = false;
        private EnvelopeEncoding _encoding = EnvelopeEncoding.BINARY;
        private SecureRandom _secureRandom;
        private Provider _cryptoProvider;

        private Builder() {
        }

        /**
         * Adds a provider. Providers are kept in the order they are added.
         */
        public Builder provider(TransformProvider provider) {
            if (provider == null) {
                throw new StorageTransformException("TransformProvider cannot be null!");
            }
            if (_providers.containsKey(provider.providerId())) {
                throw new StorageTransformException("Duplicate provider id: " + provider.providerId());
            }
            _providers.put(provider.providerId(), provider);
            return this;
        }

        /**
         * Selects the provider used for writes. Defaults to the provider of the primary key when key
         * materials are set, otherwise to the first provider added.
         */
        public Builder activeProvider(String activeProviderId) {
            EnvelopeCodec.validateIdentifier(activeProviderId, "Active provider id");
            _activeProviderId = activeProviderId;
            return this;
        }

        /**
         * Creates AES-GCM providers from key materials when the chain is built. They follow any
         * providers added directly.
         */
        public Builder keyMaterials(KeyMaterials keyMaterials) {
            if (keyMaterials == null) {
                throw new StorageTransformException("Key materials cannot be null!");
            }
            _keyMaterials = keyMaterials;
            return this;
        }

        /**
         * When enabled, data without an envelope header is read as plaintext and reported stale,
         * so it gets rewritten under the active provider. Envelopes of unregistered providers
         * still fail. Off by default.
         */
        public Builder enableLegacyPlaintextReads(boolean shouldEnableLegacyPlaintextReads) {
            _enableLegacyPlaintextReads = shouldEnableLegacyPlaintextReads;
            return this;
        }

        public Builder encoding(EnvelopeEncoding encoding) {
            if (encoding == null) {
                throw new StorageTransformException("Envelope encoding cannot be null!");
            }
            _encoding = encoding;
            return this;
        }

        /**
         * Note that this does NOT create a defensive copy of the SecureRandom object. Any modifications to the
         * object will be reflected in this Builder.
         */
        @SuppressFBWarnings(value = "EI_EXPOSE_REP2")
        public Builder secureRandom(SecureRandom secureRandom) {
            if (secureRandom == null) {
                throw new StorageTransformException("SecureRandom provided to TransformChain cannot be null");
            }
            _secureRandom = secureRandom;
            return this;
        }

        @SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "JCA providers are shared singletons")
        public Builder cryptoProvider(Provider cryptoProvider) {
            _cryptoProvider = cryptoProvider;
            return this;
        }

        public TransformChain build() {
            Map<String, TransformProvider> providers = new LinkedHashMap<>(_providers);
            String activeProviderId = _activeProviderId;

            if (_keyMaterials != null) {
                for (String providerId : _keyMaterials.providerIds()) {
                    if (providers.containsKey(providerId)) {
                        throw new StorageTransformException("Duplicate provider id: " + providerId);
                    }
                    providers.put(providerId, aesGcmProvider(providerId));
                }
                if (activeProviderId == null) {
                    activeProviderId = _keyMaterials.primaryProviderId();
                }
            }
            if (_enableLegacyPlaintextReads) {
                providers.putIfAbsent(IdentityTransformProvider.PROVIDER_ID, IdentityTransformProvider.INSTANCE);
            }

            if (providers.isEmpty()) {
                throw new StorageTransformException("A transform chain requires at least one provider");
            }
            if (activeProviderId == null) {
                activeProviderId = providers.keySet().iterator().next();
            }
            if (!providers.containsKey(activeProviderId)) {
                throw new StorageTransformException("Active provider " + activeProviderId + " is not in the chain");
            }
            return new TransformChain(providers, activeProviderId);
        }

        private AesGcmTransformProvider aesGcmProvider(String providerId) {
            if (IdentityTransformProvider.PROVIDER_ID.equals(providerId)) {
                throw new StorageTransformException("Provider id " + providerId + " is reserved");
            }
            List<KeyMaterial> materials = _keyMaterials.forProvider(providerId);
            KeyMaterial active = providerId.equals(_keyMaterials.primaryProviderId())
                    ? _keyMaterials.primary()
                    : materials.get(0);

            KeyRegistry.Builder registry = KeyRegistry.builder()
                    .activeKey(active.toStorageKey())
                    .cryptoProvider(_cryptoProvider);
            for (KeyMaterial material : materials) {
                if (material != active) {
                    registry.decryptionKey(material.toStorageKey());
                }
            }

            AesGcmTransformProvider.Builder provider = AesGcmTransformProvider.builder()
                    .providerId(providerId)
                    .keyRegistry(registry.build())
                    .encoding(_encoding);
            if (_secureRandom != null) {
                provider.secureRandom(_secureRandom);
            }
            return provider.build();
        }
    }
}
