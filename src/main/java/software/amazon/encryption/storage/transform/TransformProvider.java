// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage.transform;

/**
 * A {@link Transformer} bound to a provider id. The provider id is permanently bound to one
 * algorithm and envelope layout; a provider MUST be able to read everything any earlier release
 * of the same provider id wrote.
 */
public interface TransformProvider extends Transformer {

    String providerId();
}
