// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage.internal;

import software.amazon.encryption.storage.algorithms.AlgorithmSuite;

/**
 * A seal/open capability bound to a single symmetric key.
 * Implementations MUST be safe for concurrent use; the same instance is shared by every
 * request thread that resolves its key.
 */
public interface Aead {

    AlgorithmSuite algorithmSuite();

    /**
     * Encrypts and authenticates the plaintext together with the authenticated data.
     * @param nonce a nonce of {@link AlgorithmSuite#nonceLengthBytes()} bytes, never reused with this key
     * @param plaintext the bytes to encrypt
     * @param authenticatedData bytes which are authenticated but not encrypted
     * @return the ciphertext with the authentication tag appended
     */
    byte[] seal(byte[] nonce, byte[] plaintext, byte[] authenticatedData);

    /**
     * Verifies and decrypts a ciphertext produced by {@link #seal(byte[], byte[], byte[])}.
     * @param nonce the nonce used when sealing
     * @param ciphertext the ciphertext with the authentication tag appended
     * @param authenticatedData the authenticated data used when sealing
     * @return the plaintext
     * @throws software.amazon.encryption.storage.IntegrityException if authentication fails
     */
    byte[] open(byte[] nonce, byte[] ciphertext, byte[] authenticatedData);
}
