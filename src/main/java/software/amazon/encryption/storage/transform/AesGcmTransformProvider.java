// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage.transform;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import software.amazon.encryption.storage.CryptoPrimitiveException;
import software.amazon.encryption.storage.MalformedEnvelopeException;
import software.amazon.encryption.storage.StorageTransformException;
import software.amazon.encryption.storage.UnknownProviderException;
import software.amazon.encryption.storage.algorithms.AlgorithmSuite;
import software.amazon.encryption.storage.internal.Aead;
import software.amazon.encryption.storage.internal.Envelope;
import software.amazon.encryption.storage.internal.EnvelopeCodec;
import software.amazon.encryption.storage.internal.EnvelopeEncoding;
import software.amazon.encryption.storage.materials.KeyRegistry;

import java.security.SecureRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The reference encryption provider. Records are sealed with AES-256-GCM under the active key of
 * the {@link KeyRegistry} and stored as {@code providerId:keyId:nonce||ciphertext}.
 * <p>
 * Decoding goes through four steps: parse the envelope, resolve its key, open the AEAD payload,
 * and determine staleness. Each failing step raises its own exception type.
 * <p>
 * The provider counts its encryptions and logs a warning once the suite's per-key limit is
 * reached. The count lives in this instance only: it starts from zero on every reload or restart
 * and is not shared between processes, so it undercounts keys that stay active across them. Rotate
 * keys on a schedule rather than relying on the warning.
 */
public class AesGcmTransformProvider implements TransformProvider {

    private static final Log LOG = LogFactory.getLog(AesGcmTransformProvider.class);

    private final String _providerId;
    private final KeyRegistry _keyRegistry;
    private final EnvelopeCodec _codec;
    private final SecureRandom _secureRandom;
    private final StalenessPolicy _stalenessPolicy;
    private final AtomicLong _encryptions = new AtomicLong();

    private AesGcmTransformProvider(Builder builder) {
        _providerId = builder._providerId;
        _keyRegistry = builder._keyRegistry;
        _codec = new EnvelopeCodec(builder._encoding);
        _secureRandom = builder._secureRandom;
        _stalenessPolicy = StalenessPolicy.of(_providerId, _keyRegistry.activeKeyId());
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String providerId() {
        return _providerId;
    }

    public KeyRegistry keyRegistry() {
        return _keyRegistry;
    }

    @Override
    public byte[] toStorage(byte[] plaintext, AuthenticatedDataContext context) {
        if (plaintext == null) {
            throw new StorageTransformException("Plaintext cannot be null!");
        }
        final byte[] authenticatedData = authenticatedDataOf(context);
        final Aead aead = _keyRegistry.activeAead();
        final AlgorithmSuite algorithmSuite = aead.algorithmSuite();

        final byte[] nonce = new byte[algorithmSuite.nonceLengthBytes()];
        try {
            _secureRandom.nextBytes(nonce);
        } catch (RuntimeException e) {
            throw new CryptoPrimitiveException("Unable to generate a nonce", e);
        }
        final byte[] ciphertext = aead.seal(nonce, plaintext, authenticatedData);

        // The payload is the nonce prepended to the ciphertext
        byte[] payload = new byte[nonce.length + ciphertext.length];
        System.arraycopy(nonce, 0, payload, 0, nonce.length);
        System.arraycopy(ciphertext, 0, payload, nonce.length, ciphertext.length);

        countEncryption(algorithmSuite);

        return _codec.encode(Envelope.builder()
                .providerId(_providerId)
                .keyId(_keyRegistry.activeKeyId())
                .payload(payload)
                .build());
    }

    @Override
    public TransformResult fromStorage(byte[] stored, AuthenticatedDataContext context) {
        final byte[] authenticatedData = authenticatedDataOf(context);
        final Envelope envelope = _codec.decode(stored);
        if (!_providerId.equals(envelope.providerId())) {
            throw new UnknownProviderException("Provider " + _providerId
                    + " cannot decode data written by provider " + envelope.providerId());
        }

        final Aead aead = _keyRegistry.resolve(envelope.keyId());
        final AlgorithmSuite algorithmSuite = aead.algorithmSuite();

        final byte[] payload = envelope.payload();
        final int nonceLength = algorithmSuite.nonceLengthBytes();
        if (payload.length < nonceLength + algorithmSuite.cipherTagLengthBytes()) {
            throw new MalformedEnvelopeException("Envelope payload is too short: " + payload.length + " bytes");
        }
        byte[] nonce = new byte[nonceLength];
        byte[] ciphertext = new byte[payload.length - nonceLength];
        System.arraycopy(payload, 0, nonce, 0, nonceLength);
        System.arraycopy(payload, nonceLength, ciphertext, 0, ciphertext.length);

        byte[] plaintext = aead.open(nonce, ciphertext, authenticatedData);

        boolean stale = _stalenessPolicy.isStale(envelope.providerId(), envelope.keyId());
        if (stale && LOG.isDebugEnabled()) {
            LOG.debug("Record written with key " + envelope.keyId() + " is stale, active key is "
                    + _keyRegistry.activeKeyId());
        }
        return TransformResult.of(plaintext, stale);
    }

    /**
     * @return the number of encryptions this instance performed under its active key, since it was built
     */
    public long encryptionCount() {
        return _encryptions.get();
    }

    @Override
    public String toString() {
        return "AesGcmTransformProvider{providerId=" + _providerId
                + ", suite=" + _keyRegistry.activeAead().algorithmSuite().id()
                + ", activeKeyId=" + _keyRegistry.activeKeyId() + "}";
    }

    private static byte[] authenticatedDataOf(AuthenticatedDataContext context) {
        if (context == null) {
            throw new StorageTransformException("AuthenticatedDataContext cannot be null!");
        }
        final byte[] authenticatedData = context.authenticatedData();
        if (authenticatedData == null) {
            throw new StorageTransformException("Authenticated data cannot be null!");
        }
        return authenticatedData;
    }

    private void countEncryption(AlgorithmSuite algorithmSuite) {
        if (_encryptions.incrementAndGet() == algorithmSuite.maxEncryptionsPerKey()) {
            LOG.warn("Key " + _keyRegistry.activeKeyId() + " of provider " + _providerId + " has reached "
                    + algorithmSuite.maxEncryptionsPerKey() + " encryptions; rotate it to keep nonces unique.");
        }
    }

    public static class Builder {
        private String _providerId;
        private KeyRegistry _keyRegistry;
        private EnvelopeEncoding _encoding = EnvelopeEncoding.BINARY;
        private SecureRandom _secureRandom = new SecureRandom();

        private Builder() {
        }

        public Builder providerId(String providerId) {
            EnvelopeCodec.validateIdentifier(providerId, "Provider id");
            _providerId = providerId;
            return this;
        }

        public Builder keyRegistry(KeyRegistry keyRegistry) {
            if (keyRegistry == null) {
                throw new StorageTransformException("KeyRegistry cannot be null!");
            }
            _keyRegistry = keyRegistry;
            return this;
        }

        /**
         * Sets how the payload is written. Defaults to {@link EnvelopeEncoding#BINARY};
         * use {@link EnvelopeEncoding#TEXT} for backends that only accept text-safe values.
         */
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
        public Builder secureRandom(final SecureRandom secureRandom) {
            if (secureRandom == null) {
                throw new StorageTransformException("SecureRandom provided to AesGcmTransformProvider cannot be null");
            }
            _secureRandom = secureRandom;
            return this;
        }

        public AesGcmTransformProvider build() {
            if (_providerId == null) {
                throw new StorageTransformException("Provider id must be set");
            }
            if (_keyRegistry == null) {
                throw new StorageTransformException("KeyRegistry must be set");
            }
            return new AesGcmTransformProvider(this);
        }
    }
}
