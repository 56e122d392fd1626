// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage;

/**
 * Exception class for security-related errors in the storage transform.
 * This exception is thrown when cryptographic verification fails in a way that could indicate
 * tampering or corruption of stored data.
 */
public class StorageTransformSecurityException extends StorageTransformException {

    /**
     * Constructs a new StorageTransformSecurityException with the specified error message.
     * @param message a description of the error
     */
    public StorageTransformSecurityException(String message) {
        super(message);
    }

    /**
     * Constructs a new StorageTransformSecurityException with the specified error message and cause.
     * @param message a description of the error
     * @param cause the underlying cause of this exception
     */
    public StorageTransformSecurityException(String message, Throwable cause) {
        super(message, cause);
    }
}
