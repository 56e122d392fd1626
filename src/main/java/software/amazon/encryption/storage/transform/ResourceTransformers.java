// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage.transform;

import software.amazon.encryption.storage.StorageTransformException;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Maps resource kinds to the transformer the storage layer applies to them. Kinds without an
 * entry pass through unchanged.
 */
public final class ResourceTransformers {

    private final Map<String, Transformer> _transformers;
    private final Transformer _defaultTransformer;

    private ResourceTransformers(Builder builder) {
        _transformers = Collections.unmodifiableMap(new HashMap<>(builder._transformers));
        _defaultTransformer = builder._defaultTransformer;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Transformer forKind(String resourceKind) {
        return _transformers.getOrDefault(resourceKind, _defaultTransformer);
    }

    /**
     * @return whether the kind has its own transformer rather than the default one
     */
    public boolean isEncrypted(String resourceKind) {
        return _transformers.containsKey(resourceKind);
    }

    public Set<String> resourceKinds() {
        return _transformers.keySet();
    }

    public static class Builder {
        private final Map<String, Transformer> _transformers = new HashMap<>();
        private Transformer _defaultTransformer = IdentityTransformProvider.INSTANCE;

        private Builder() {
        }

        public Builder transformer(String resourceKind, Transformer transformer) {
            if (resourceKind == null || resourceKind.isEmpty()) {
                throw new StorageTransformException("Resource kind cannot be null or empty!");
            }
            if (transformer == null) {
                throw new StorageTransformException("Transformer for " + resourceKind + " cannot be null!");
            }
            _transformers.put(resourceKind, transformer);
            return this;
        }

        /**
         * Sets the transformer for unlisted kinds. Defaults to {@link IdentityTransformProvider}.
         */
        public Builder defaultTransformer(Transformer defaultTransformer) {
            if (defaultTransformer == null) {
                throw new StorageTransformException("Default transformer cannot be null!");
            }
            _defaultTransformer = defaultTransformer;
            return this;
        }

        public ResourceTransformers build() {
            return new ResourceTransformers(this);
        }
    }
}
