// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage.materials;

/**
 * Delivers key materials at startup or on reload. Implementations may read files, call a KMS, or
 * decorate another source.
 */
@FunctionalInterface
public interface KeyMaterialSource {

    /**
     * @return the complete key configuration
     * @throws software.amazon.encryption.storage.StorageTransformException if any key cannot be loaded
     */
    KeyMaterials load();
}
