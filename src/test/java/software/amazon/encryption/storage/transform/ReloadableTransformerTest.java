// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage.transform;

import org.junit.jupiter.api.Test;
import software.amazon.encryption.storage.StorageTransformException;
import software.amazon.encryption.storage.materials.KeyMaterial;
import software.amazon.encryption.storage.materials.KeyMaterialSource;
import software.amazon.encryption.storage.materials.KeyMaterials;
import software.amazon.encryption.storage.materials.KeyRotation;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static software.amazon.encryption.storage.utils.StorageTransformTestResources.PROVIDER_ID;
import static software.amazon.encryption.storage.utils.StorageTransformTestResources.keyBytes;
import static software.amazon.encryption.storage.utils.StorageTransformTestResources.utf8;

public class ReloadableTransformerTest {

    private static final AuthenticatedDataContext CONTEXT = AuthenticatedDataContext.forPath("/registry/secrets/ns/name");

    private static final KeyMaterials INITIAL = KeyMaterials.builder()
            .material(KeyMaterial.of(PROVIDER_ID, "k1", keyBytes(1)))
            .build();

    @Test
    public void reloadSwapsTheWholeChain() {
        ReloadableTransformer transformer = ReloadableTransformer.fromSource(() -> INITIAL);
        byte[] underK1 = transformer.toStorage(utf8("hello"), CONTEXT);

        KeyRotation rotation = KeyRotation.of(INITIAL)
                .addDecryptOnly(KeyMaterial.of(PROVIDER_ID, "k2", keyBytes(2)))
                .promote(PROVIDER_ID, "k2");
        KeyMaterialSource rotated = rotation::keyMaterials;
        Transformer previous = transformer.current();

        assertSame(previous, transformer.reload(rotated));

        TransformResult result = transformer.fromStorage(underK1, CONTEXT);
        assertArrayEquals(utf8("hello"), result.plaintext());
        assertTrue(result.stale());
        assertTrue(utf8(transformer.toStorage(utf8("hello"), CONTEXT)).startsWith(PROVIDER_ID + ":k2:"));
    }

    @Test
    public void failedLoadKeepsCurrentChain() {
        ReloadableTransformer transformer = ReloadableTransformer.fromSource(() -> INITIAL);
        Transformer current = transformer.current();

        assertThrows(StorageTransformException.class, () -> transformer.reload((KeyMaterialSource) () -> {
            throw new StorageTransformException("Unable to read key");
        }));
        assertSame(current, transformer.current());
    }

    @Test
    public void concurrentCallsSurviveReloads() throws Exception {
        KeyMaterials both = KeyMaterials.builder()
                .material(KeyMaterial.of(PROVIDER_ID, "k1", keyBytes(1)))
                .material(KeyMaterial.of(PROVIDER_ID, "k2", keyBytes(2)))
                .build();
        KeyMaterials promoted = KeyRotation.of(both).promote(PROVIDER_ID, "k2").keyMaterials();
        TransformChain first = TransformChain.fromKeyMaterials(both);
        TransformChain second = TransformChain.fromKeyMaterials(promoted);

        ReloadableTransformer transformer = new ReloadableTransformer(first);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < 4; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    for (int j = 0; j < 500; j++) {
                        byte[] stored = transformer.toStorage(utf8("hello"), CONTEXT);
                        if (!"hello".equals(utf8(transformer.fromStorage(stored, CONTEXT).plaintext()))) {
                            return false;
                        }
                    }
                    return true;
                }));
            }
            start.countDown();
            for (int i = 0; i < 200; i++) {
                transformer.reload(i % 2 == 0 ? second : first);
            }
            for (Future<Boolean> result : results) {
                assertTrue(result.get(30, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void nullTransformerIsRejected() {
        assertThrows(StorageTransformException.class, () -> new ReloadableTransformer(null));
        ReloadableTransformer transformer = new ReloadableTransformer(IdentityTransformProvider.INSTANCE);
        assertThrows(StorageTransformException.class, () -> transformer.reload((Transformer) null));
        assertFalse(transformer.fromStorage(utf8("hello"), CONTEXT).stale());
    }
}
