// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage;

/**
 * Thrown when AEAD authentication fails: the ciphertext or nonce was altered, or the
 * authenticated data context supplied on read differs from the one used on write.
 */
public class IntegrityException extends StorageTransformSecurityException {

    /**
     * Constructs a new IntegrityException with the specified error message.
     * @param message a description of the error
     */
    public IntegrityException(String message) {
        super(message);
    }

    /**
     * Constructs a new IntegrityException with the specified error message and cause.
     * @param message a description of the error
     * @param cause the underlying cause of this exception
     */
    public IntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
