// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage.materials;

import software.amazon.encryption.storage.internal.Aead;

import java.security.Provider;

/**
 * Turns raw key material into an {@link Aead} capability. Implementations may decorate the
 * default AES-GCM capability, e.g. to delegate sealing to a hardware module.
 */
@FunctionalInterface
public interface AeadFactory {
    Aead createAead(byte[] secret, Provider cryptoProvider);
}
