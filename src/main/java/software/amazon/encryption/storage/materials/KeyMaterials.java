// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage.materials;

import software.amazon.encryption.storage.StorageTransformException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * An ordered, immutable set of key materials with one primary key. The primary key is the active
 * key of the active provider. Every other provider's active key is its first listed key.
 */
public final class KeyMaterials {

    private final List<KeyMaterial> _materials;
    private final String _primaryProviderId;
    private final String _primaryKeyId;

    private KeyMaterials(Builder builder) {
        _materials = Collections.unmodifiableList(new ArrayList<>(builder._materials));
        _primaryProviderId = builder._primaryProviderId;
        _primaryKeyId = builder._primaryKeyId;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .materials(_materials)
                .primary(_primaryProviderId, _primaryKeyId);
    }

    public List<KeyMaterial> materials() {
        return _materials;
    }

    public KeyMaterial primary() {
        return find(_primaryProviderId, _primaryKeyId);
    }

    public String primaryProviderId() {
        return _primaryProviderId;
    }

    public String primaryKeyId() {
        return _primaryKeyId;
    }

    /**
     * @return the provider ids in order of first appearance
     */
    public Set<String> providerIds() {
        Set<String> providerIds = new LinkedHashSet<>();
        _materials.forEach(material -> providerIds.add(material.providerId()));
        return Collections.unmodifiableSet(providerIds);
    }

    public List<KeyMaterial> forProvider(String providerId) {
        return _materials.stream()
                .filter(material -> material.providerId().equals(providerId))
                .collect(Collectors.toList());
    }

    public boolean contains(String providerId, String keyId) {
        return find(providerId, keyId) != null;
    }

    KeyMaterial find(String providerId, String keyId) {
        for (KeyMaterial material : _materials) {
            if (material.matches(providerId, keyId)) {
                return material;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "KeyMaterials{primary=" + _primaryProviderId + ":" + _primaryKeyId + ", materials=" + _materials + "}";
    }

    public static class Builder {
        private final List<KeyMaterial> _materials = new ArrayList<>();
        private String _primaryProviderId;
        private String _primaryKeyId;

        private Builder() {
        }

        public Builder material(KeyMaterial material) {
            if (material == null) {
                throw new StorageTransformException("Key material cannot be null!");
            }
            for (KeyMaterial existing : _materials) {
                if (existing.matches(material.providerId(), material.keyId())) {
                    throw new StorageTransformException("Duplicate key " + material.keyId()
                            + " for provider " + material.providerId());
                }
            }
            _materials.add(material);
            return this;
        }

        public Builder materials(Collection<KeyMaterial> materials) {
            if (materials == null) {
                throw new StorageTransformException("Key materials cannot be null!");
            }
            materials.forEach(this::material);
            return this;
        }

        /**
         * Selects the key used for all new writes. Defaults to the first material.
         */
        public Builder primary(String providerId, String keyId) {
            if (providerId == null || keyId == null) {
                throw new StorageTransformException("Primary provider id and key id cannot be null!");
            }
            _primaryProviderId = providerId;
            _primaryKeyId = keyId;
            return this;
        }

        public KeyMaterials build() {
            if (_materials.isEmpty()) {
                throw new StorageTransformException("At least one key material is required");
            }
            if (_primaryProviderId == null) {
                _primaryProviderId = _materials.get(0).providerId();
                _primaryKeyId = _materials.get(0).keyId();
            }
            boolean primaryListed = _materials.stream()
                    .anyMatch(material -> material.matches(_primaryProviderId, _primaryKeyId));
            if (!primaryListed) {
                throw new StorageTransformException("Primary key " + _primaryKeyId + " of provider "
                        + _primaryProviderId + " is not among the key materials");
            }
            return new KeyMaterials(this);
        }
    }
}
