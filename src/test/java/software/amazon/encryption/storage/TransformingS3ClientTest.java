// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.core.sync.ResponseTransformer;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.ServerSideEncryption;
import software.amazon.awssdk.services.s3.model.StorageClass;
import software.amazon.encryption.storage.materials.KeyMaterial;
import software.amazon.encryption.storage.materials.KeyMaterials;
import software.amazon.encryption.storage.materials.KeyRotation;
import software.amazon.encryption.storage.transform.ResourceTransformers;
import software.amazon.encryption.storage.transform.TransformChain;
import software.amazon.encryption.storage.transform.TransformResult;
import software.amazon.encryption.storage.utils.InMemoryS3Client;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static software.amazon.encryption.storage.utils.StorageTransformTestResources.BUCKET;
import static software.amazon.encryption.storage.utils.StorageTransformTestResources.PROVIDER_ID;
import static software.amazon.encryption.storage.utils.StorageTransformTestResources.SECONDARY_PROVIDER_ID;
import static software.amazon.encryption.storage.utils.StorageTransformTestResources.keyBytes;
import static software.amazon.encryption.storage.utils.StorageTransformTestResources.utf8;

public class TransformingS3ClientTest {

    private static final String SECRET_KEY = "secrets/ns/name";

    private static final KeyMaterials K1 = KeyMaterials.builder()
            .material(KeyMaterial.of(PROVIDER_ID, "k1", keyBytes(1)))
            .build();

    private InMemoryS3Client s3;

    @BeforeEach
    public void setUp() {
        s3 = new InMemoryS3Client();
    }

    private TransformingS3Client client(KeyMaterials keyMaterials, boolean rewriteStaleObjects) {
        return TransformingS3Client.builder()
                .wrappedClient(s3)
                .resourceTransformers(ResourceTransformers.builder()
                        .transformer("secrets", TransformChain.fromKeyMaterials(keyMaterials))
                        .build())
                .rewriteStaleObjects(rewriteStaleObjects)
                .build();
    }

    private static KeyMaterials rotatedToK2() {
        return KeyRotation.of(K1)
                .addDecryptOnly(KeyMaterial.of(PROVIDER_ID, "k2", keyBytes(2)))
                .promote(PROVIDER_ID, "k2")
                .keyMaterials();
    }

    private static GetObjectRequest get(String key) {
        return GetObjectRequest.builder().bucket(BUCKET).key(key).build();
    }

    private static void put(S3Client client, String key, String content) {
        client.putObject(PutObjectRequest.builder().bucket(BUCKET).key(key).build(), RequestBody.fromString(content));
    }

    @Test
    public void encryptsConfiguredKindsOnly() {
        TransformingS3Client client = client(K1, false);
        put(client, SECRET_KEY, "top-secret");
        put(client, "configmaps/ns/name", "public");

        assertTrue(utf8(s3.rawObject(SECRET_KEY)).startsWith(PROVIDER_ID + ":k1:"));
        assertFalse(utf8(s3.rawObject(SECRET_KEY)).contains("top-secret"));
        assertEquals("public", utf8(s3.rawObject("configmaps/ns/name")));

        ResponseBytes<GetObjectResponse> secret = client.getObject(get(SECRET_KEY), ResponseTransformer.toBytes());
        assertEquals("top-secret", secret.asUtf8String());
        assertEquals(10L, secret.response().contentLength());
        assertEquals("public", client.getObjectAsBytes(get("configmaps/ns/name")).asUtf8String());
    }

    @Test
    public void objectsAreBoundToTheirPath() {
        TransformingS3Client client = client(K1, false);
        put(client, SECRET_KEY, "top-secret");
        s3.putRawObject("secrets/ns/other", s3.rawObject(SECRET_KEY));

        StorageTransformException exception = assertThrows(StorageTransformException.class,
                () -> client.getObject(get("secrets/ns/other"), ResponseTransformer.toBytes()));
        assertTrue(exception instanceof IntegrityException);
    }

    @Test
    public void staleObjectsAreReportedAndOptionallyRewritten() {
        put(client(K1, false), SECRET_KEY, "top-secret");

        TransformingS3Client reporting = client(rotatedToK2(), false);
        TransformResult result = reporting.getObjectWithStaleness(get(SECRET_KEY));
        assertTrue(result.stale());
        assertEquals("top-secret", utf8(result.plaintext()));
        assertTrue(utf8(s3.rawObject(SECRET_KEY)).startsWith(PROVIDER_ID + ":k1:"));

        TransformingS3Client rewriting = client(rotatedToK2(), true);
        assertEquals("top-secret", rewriting.getObjectAsBytes(get(SECRET_KEY)).asUtf8String());
        assertTrue(utf8(s3.rawObject(SECRET_KEY)).startsWith(PROVIDER_ID + ":k2:"));
        assertFalse(rewriting.getObjectWithStaleness(get(SECRET_KEY)).stale());
    }

    @Test
    public void rewriteIfStaleIsIdempotent() {
        put(client(K1, false), SECRET_KEY, "top-secret");
        TransformingS3Client client = client(rotatedToK2(), false);
        int putsBefore = s3.putCount();

        assertTrue(client.rewriteIfStale(BUCKET, SECRET_KEY));
        String eTag = s3.eTag(SECRET_KEY);
        assertFalse(client.rewriteIfStale(BUCKET, SECRET_KEY));

        assertEquals(putsBefore + 1, s3.putCount());
        assertEquals(eTag, s3.eTag(SECRET_KEY));
    }

    @Test
    public void concurrentUpdateWinsOverRewrite() {
        S3Client wrapped = mock(S3Client.class);
        byte[] stale = TransformChain.fromKeyMaterials(K1)
                .toStorage(utf8("top-secret"), TransformingS3Client.contextFor(BUCKET, SECRET_KEY));
        doReturn(ResponseBytes.fromByteArray(GetObjectResponse.builder().eTag("\"1\"").build(), stale))
                .when(wrapped).getObject(any(GetObjectRequest.class), any(ResponseTransformer.class));
        when(wrapped.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenThrow(S3Exception.builder().statusCode(412).message("Precondition Failed").build());

        TransformingS3Client client = TransformingS3Client.builder()
                .wrappedClient(wrapped)
                .resourceTransformers(ResourceTransformers.builder()
                        .transformer("secrets", TransformChain.fromKeyMaterials(rotatedToK2()))
                        .build())
                .build();

        assertFalse(client.rewriteIfStale(BUCKET, SECRET_KEY));
    }

    @Test
    public void failedRewriteDoesNotFailTheRead() {
        S3Client wrapped = mock(S3Client.class);
        byte[] stale = TransformChain.fromKeyMaterials(K1)
                .toStorage(utf8("top-secret"), TransformingS3Client.contextFor(BUCKET, SECRET_KEY));
        GetObjectResponse response = GetObjectResponse.builder()
                .eTag("\"1\"")
                .contentType("application/json")
                .contentEncoding("identity")
                .cacheControl("no-store")
                .storageClass(StorageClass.STANDARD_IA)
                .serverSideEncryption(ServerSideEncryption.AWS_KMS)
                .ssekmsKeyId("bucket-key")
                .build();
        doReturn(ResponseBytes.fromByteArray(response, stale))
                .when(wrapped).getObject(any(GetObjectRequest.class), any(ResponseTransformer.class));
        when(wrapped.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenThrow(S3Exception.builder().statusCode(500).message("Internal Error").build());

        TransformingS3Client client = TransformingS3Client.builder()
                .wrappedClient(wrapped)
                .resourceTransformers(ResourceTransformers.builder()
                        .transformer("secrets", TransformChain.fromKeyMaterials(rotatedToK2()))
                        .build())
                .rewriteStaleObjects(true)
                .build();

        assertEquals("top-secret", client.getObjectAsBytes(get(SECRET_KEY)).asUtf8String());

        ArgumentCaptor<PutObjectRequest> rewrite = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(wrapped).putObject(rewrite.capture(), any(RequestBody.class));
        assertEquals("\"1\"", rewrite.getValue().ifMatch());
        assertEquals("application/json", rewrite.getValue().contentType());
        assertEquals("identity", rewrite.getValue().contentEncoding());
        assertEquals("no-store", rewrite.getValue().cacheControl());
        assertEquals(StorageClass.STANDARD_IA, rewrite.getValue().storageClass());
        assertEquals(ServerSideEncryption.AWS_KMS, rewrite.getValue().serverSideEncryption());
        assertEquals("bucket-key", rewrite.getValue().ssekmsKeyId());

        // an explicit rewrite still reports the failure
        assertThrows(StorageTransformException.class, () -> client.rewriteIfStale(BUCKET, SECRET_KEY));
    }

    @Test
    public void foreignEnvelopeIsNeverRewrittenAsPlaintext() {
        byte[] foreign = TransformChain.fromKeyMaterials(KeyMaterials.builder()
                        .material(KeyMaterial.of(SECONDARY_PROVIDER_ID, "k9", keyBytes(9)))
                        .build())
                .toStorage(utf8("top-secret"), TransformingS3Client.contextFor(BUCKET, SECRET_KEY));
        s3.putRawObject(SECRET_KEY, foreign);

        TransformingS3Client client = TransformingS3Client.builder()
                .wrappedClient(s3)
                .resourceTransformers(ResourceTransformers.builder()
                        .transformer("secrets", TransformChain.builder()
                                .keyMaterials(K1)
                                .enableLegacyPlaintextReads(true)
                                .build())
                        .build())
                .rewriteStaleObjects(true)
                .build();
        int putsBefore = s3.putCount();

        assertThrows(UnknownProviderException.class, () -> client.getObjectAsBytes(get(SECRET_KEY)));
        assertEquals(putsBefore, s3.putCount());
        assertArrayEquals(foreign, s3.rawObject(SECRET_KEY));
    }

    @Test
    public void storageFailuresAreWrapped() {
        S3Client wrapped = mock(S3Client.class);
        S3Exception unavailable = (S3Exception) S3Exception.builder().statusCode(503).message("Slow Down").build();
        when(wrapped.putObject(any(PutObjectRequest.class), any(RequestBody.class))).thenThrow(unavailable);

        TransformingS3Client client = TransformingS3Client.builder()
                .wrappedClient(wrapped)
                .resourceTransformers(ResourceTransformers.builder().build())
                .build();

        StorageTransformException exception = assertThrows(StorageTransformException.class,
                () -> put(client, SECRET_KEY, "top-secret"));
        assertSame(unavailable, exception.getCause());
    }

    @Test
    public void resourceKindIsTheFirstPathSegment() {
        assertEquals("secrets", TransformingS3Client.resourceKindOf("secrets/ns/name"));
        assertEquals("secrets", TransformingS3Client.resourceKindOf("/secrets/name"));
        assertEquals("", TransformingS3Client.resourceKindOf("toplevel"));
        assertNotEquals("secrets", TransformingS3Client.resourceKindOf("secretsx/name"));
    }

    @Test
    public void buildValidation() {
        assertThrows(StorageTransformException.class, () -> TransformingS3Client.builder().resourceTransformers(null));
        assertThrows(StorageTransformException.class, () -> TransformingS3Client.builder().wrappedClient(s3).build());
        TransformingS3Client client = client(K1, false);
        assertThrows(StorageTransformException.class, () -> TransformingS3Client.builder().wrappedClient(client));
    }
}
