// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage;

/**
 * Thrown when stored data cannot be opened by any registered provider or key.
 * Subclasses identify which step of the decode failed. A decryption failure is never
 * treated as missing data and is never retried with a plaintext interpretation.
 */
public class DecryptionException extends StorageTransformException {

    /**
     * Constructs a new DecryptionException with the specified error message.
     * @param message a description of the error
     */
    public DecryptionException(String message) {
        super(message);
    }

    /**
     * Constructs a new DecryptionException with the specified error message and cause.
     * @param message a description of the error
     * @param cause the underlying cause of this exception
     */
    public DecryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
