// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage.materials;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.kms.KmsClient;
import software.amazon.awssdk.services.kms.model.DecryptRequest;
import software.amazon.awssdk.services.kms.model.DecryptResponse;
import software.amazon.awssdk.services.kms.model.KmsException;
import software.amazon.encryption.storage.StorageTransformException;
import software.amazon.encryption.storage.internal.ApiNameVersion;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static software.amazon.encryption.storage.utils.StorageTransformTestResources.PROVIDER_ID;
import static software.amazon.encryption.storage.utils.StorageTransformTestResources.keyBytes;
import static software.amazon.encryption.storage.utils.StorageTransformTestResources.utf8;

public class KmsKeyMaterialSourceTest {

    private static final String WRAPPING_KEY_ID = "arn:aws:kms:us-west-2:123456789012:key/test";

    private KmsClient kmsClient;
    private KeyMaterialSource wrappedSource;

    @BeforeEach
    public void setUp() {
        kmsClient = mock(KmsClient.class);
        wrappedSource = () -> KeyMaterials.builder()
                .material(KeyMaterial.of(PROVIDER_ID, "k1", utf8("wrapped-k1")))
                .material(KeyMaterial.of(PROVIDER_ID, "k2", utf8("wrapped-k2")))
                .primary(PROVIDER_ID, "k2")
                .build();
    }

    @Test
    public void unwrapsEveryKeyOnceWithItsEncryptionContext() {
        when(kmsClient.decrypt(any(DecryptRequest.class))).thenAnswer(invocation -> {
            DecryptRequest request = invocation.getArgument(0);
            int fill = "wrapped-k1".equals(request.ciphertextBlob().asUtf8String()) ? 1 : 2;
            return DecryptResponse.builder()
                    .keyId(WRAPPING_KEY_ID)
                    .plaintext(SdkBytes.fromByteArray(keyBytes(fill)))
                    .build();
        });

        KeyMaterials materials = KmsKeyMaterialSource.builder()
                .kmsClient(kmsClient)
                .delegate(wrappedSource)
                .wrappingKeyId(WRAPPING_KEY_ID)
                .build()
                .load();

        assertEquals("k2", materials.primaryKeyId());
        assertArrayEquals(keyBytes(1), materials.materials().get(0).secret());
        assertArrayEquals(keyBytes(2), materials.primary().secret());

        ArgumentCaptor<DecryptRequest> captor = ArgumentCaptor.forClass(DecryptRequest.class);
        verify(kmsClient, times(2)).decrypt(captor.capture());
        List<DecryptRequest> requests = captor.getAllValues();
        assertEquals(KmsKeyMaterialSource.encryptionContext(PROVIDER_ID, "k1"), requests.get(0).encryptionContext());
        assertEquals("k2", requests.get(1).encryptionContext().get(KmsKeyMaterialSource.ENCRYPTION_CONTEXT_KEY_ID));
        assertEquals(WRAPPING_KEY_ID, requests.get(0).keyId());
        assertTrue(requests.get(0).overrideConfiguration().isPresent());
        assertEquals(ApiNameVersion.NAME, requests.get(0).overrideConfiguration().get().apiNames().get(0).name());
    }

    @Test
    public void kmsFailureIsWrapped() {
        when(kmsClient.decrypt(any(DecryptRequest.class)))
                .thenThrow(KmsException.builder().message("Access denied").build());

        KmsKeyMaterialSource source = KmsKeyMaterialSource.builder()
                .kmsClient(kmsClient)
                .delegate(wrappedSource)
                .build();

        StorageTransformException exception = assertThrows(StorageTransformException.class, source::load);
        assertTrue(exception.getCause() instanceof KmsException);
    }

    @Test
    public void buildWithNullValuesFails() {
        assertThrows(StorageTransformException.class, () -> KmsKeyMaterialSource.builder().delegate(null));
        assertThrows(StorageTransformException.class, () -> KmsKeyMaterialSource.builder().wrappingKeyId(""));
        assertThrows(StorageTransformException.class,
                () -> KmsKeyMaterialSource.builder().kmsClient(kmsClient).build());
    }
}
