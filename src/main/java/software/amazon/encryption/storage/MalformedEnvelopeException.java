// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage;

/**
 * Thrown when stored bytes do not follow the {@code providerId:keyId:payload} layout, or when
 * the payload cannot hold a nonce and an authentication tag. This usually means corrupted data,
 * or unencrypted data read through an encrypting transformer.
 */
public class MalformedEnvelopeException extends DecryptionException {

    /**
     * Constructs a new MalformedEnvelopeException with the specified error message.
     * @param message a description of the error
     */
    public MalformedEnvelopeException(String message) {
        super(message);
    }

    /**
     * Constructs a new MalformedEnvelopeException with the specified error message and cause.
     * @param message a description of the error
     * @param cause the underlying cause of this exception
     */
    public MalformedEnvelopeException(String message, Throwable cause) {
        super(message, cause);
    }
}
