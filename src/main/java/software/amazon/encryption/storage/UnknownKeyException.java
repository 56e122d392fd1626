// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage;

/**
 * Thrown when the key id of an envelope is not present in the key registry, for example
 * when a key was removed before every record written under it was rewritten.
 */
public class UnknownKeyException extends DecryptionException {

    /**
     * Constructs a new UnknownKeyException with the specified error message.
     * @param message a description of the error
     */
    public UnknownKeyException(String message) {
        super(message);
    }

    /**
     * Constructs a new UnknownKeyException with the specified error message and cause.
     * @param message a description of the error
     * @param cause the underlying cause of this exception
     */
    public UnknownKeyException(String message, Throwable cause) {
        super(message, cause);
    }
}
