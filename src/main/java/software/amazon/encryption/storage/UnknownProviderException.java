// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage;

/**
 * Thrown when the provider id of an envelope is not registered with the transform chain.
 * Typically seen after a downgrade to a release which does not know the provider.
 */
public class UnknownProviderException extends DecryptionException {

    /**
     * Constructs a new UnknownProviderException with the specified error message.
     * @param message a description of the error
     */
    public UnknownProviderException(String message) {
        super(message);
    }

    /**
     * Constructs a new UnknownProviderException with the specified error message and cause.
     * @param message a description of the error
     * @param cause the underlying cause of this exception
     */
    public UnknownProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
