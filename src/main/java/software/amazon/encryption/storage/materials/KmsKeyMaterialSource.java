// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage.materials;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.kms.KmsClient;
import software.amazon.awssdk.services.kms.model.DecryptRequest;
import software.amazon.awssdk.services.kms.model.DecryptResponse;
import software.amazon.encryption.storage.StorageTransformException;
import software.amazon.encryption.storage.internal.ApiNameVersion;

import java.util.HashMap;
import java.util.Map;

/**
 * Decorates another {@link KeyMaterialSource} whose materials are AWS KMS ciphertext blobs.
 * Each blob is decrypted once, at load time, so no KMS call happens on the transform path.
 * <p>
 * The provider id and key id are bound as KMS encryption context, so a blob wrapped for one key
 * cannot be loaded as another.
 */
public class KmsKeyMaterialSource implements KeyMaterialSource {

    private static final Log LOG = LogFactory.getLog(KmsKeyMaterialSource.class);

    public static final String ENCRYPTION_CONTEXT_PROVIDER_ID = "storage_transform_provider_id";
    public static final String ENCRYPTION_CONTEXT_KEY_ID = "storage_transform_key_id";

    private final KmsClient _kmsClient;
    private final KeyMaterialSource _delegate;
    private final String _wrappingKeyId;

    private KmsKeyMaterialSource(Builder builder) {
        _kmsClient = builder._kmsClient;
        _delegate = builder._delegate;
        _wrappingKeyId = builder._wrappingKeyId;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the encryption context a blob for the given key must have been wrapped with
     */
    public static Map<String, String> encryptionContext(String providerId, String keyId) {
        Map<String, String> encryptionContext = new HashMap<>();
        encryptionContext.put(ENCRYPTION_CONTEXT_PROVIDER_ID, providerId);
        encryptionContext.put(ENCRYPTION_CONTEXT_KEY_ID, keyId);
        return encryptionContext;
    }

    @Override
    public KeyMaterials load() {
        KeyMaterials wrapped = _delegate.load();
        KeyMaterials.Builder unwrapped = KeyMaterials.builder();
        for (KeyMaterial material : wrapped.materials()) {
            unwrapped.material(material.withSecret(unwrap(material)));
        }
        return unwrapped
                .primary(wrapped.primaryProviderId(), wrapped.primaryKeyId())
                .build();
    }

    private byte[] unwrap(KeyMaterial material) {
        DecryptRequest.Builder request = DecryptRequest.builder()
                .encryptionContext(encryptionContext(material.providerId(), material.keyId()))
                .ciphertextBlob(SdkBytes.fromByteArray(material.secret()))
                .overrideConfiguration(ApiNameVersion.API_NAME_INTERCEPTOR);
        if (_wrappingKeyId != null) {
            request.keyId(_wrappingKeyId);
        }

        final DecryptResponse response;
        try {
            response = _kmsClient.decrypt(request.build());
        } catch (SdkException e) {
            throw new StorageTransformException("Unable to unwrap key " + material.keyId() + " of provider "
                    + material.providerId() + " with AWS KMS", e);
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("Unwrapped key " + material.keyId() + " of provider " + material.providerId()
                    + " with " + response.keyId());
        }
        return response.plaintext().asByteArray();
    }

    public static class Builder {
        private KmsClient _kmsClient;
        private KeyMaterialSource _delegate;
        private String _wrappingKeyId;

        private Builder() {
        }

        /**
         * Note that this does NOT create a defensive clone of KmsClient. Any modifications made to the wrapped
         * client will be reflected in this Builder.
         */
        @SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Pass mutability into wrapping client")
        public Builder kmsClient(KmsClient kmsClient) {
            _kmsClient = kmsClient;
            return this;
        }

        public Builder delegate(KeyMaterialSource delegate) {
            if (delegate == null) {
                throw new StorageTransformException("Delegate key material source cannot be null!");
            }
            _delegate = delegate;
            return this;
        }

        /**
         * Restricts decryption to one KMS key. Optional for symmetric KMS keys, which KMS
         * identifies from the blob itself.
         */
        public Builder wrappingKeyId(String wrappingKeyId) {
            if (wrappingKeyId == null || wrappingKeyId.isEmpty()) {
                throw new StorageTransformException("Kms Key ID cannot be empty or null");
            }
            _wrappingKeyId = wrappingKeyId;
            return this;
        }

        public KmsKeyMaterialSource build() {
            if (_delegate == null) {
                throw new StorageTransformException("A delegate key material source is required");
            }
            if (_kmsClient == null) {
                _kmsClient = KmsClient.create();
            }
            return new KmsKeyMaterialSource(this);
        }
    }
}
