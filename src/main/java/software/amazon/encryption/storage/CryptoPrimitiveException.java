// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage;

/**
 * Thrown when a cryptographic primitive cannot be initialized or used, for example when the
 * JCA provider lacks AES/GCM or the random source fails. The process cannot safely keep
 * encrypting when this is raised.
 */
public class CryptoPrimitiveException extends StorageTransformException {

    /**
     * Constructs a new CryptoPrimitiveException with the specified error message.
     * @param message a description of the error
     */
    public CryptoPrimitiveException(String message) {
        super(message);
    }

    /**
     * Constructs a new CryptoPrimitiveException with the specified error message and cause.
     * @param message a description of the error
     * @param cause the underlying cause of this exception
     */
    public CryptoPrimitiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
