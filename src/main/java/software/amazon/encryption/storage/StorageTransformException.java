// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage;

import software.amazon.awssdk.core.exception.SdkClientException;

/**
 * Base exception class for all storage transform specific exceptions.
 * This exception is thrown when errors occur while transforming records to or from storage,
 * during configuration validation, or in other library-specific scenarios.
 * <p>
 * Messages name providers, keys and storage paths. They never carry key material, plaintext or
 * payload bytes.
 */
public class StorageTransformException extends SdkClientException {

    /**
     * Constructs a new StorageTransformException with the specified error message.
     * @param message a description of the error
     */
    public StorageTransformException(String message) {
        super(SdkClientException.builder()
                .message(message));
    }

    /**
     * Constructs a new StorageTransformException with the specified error message and cause.
     * @param message a description of the error
     * @param cause the underlying cause of this exception
     */
    public StorageTransformException(String message, Throwable cause) {
        super(SdkClientException.builder()
                .message(message)
                .cause(cause));
    }
}
