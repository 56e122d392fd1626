// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage.internal;

import software.amazon.encryption.storage.IntegrityException;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * How the payload of an envelope is written after the {@code providerId:keyId:} header.
 */
public enum EnvelopeEncoding {
    /**
     * Payload is standard base64, for backends that only accept text-safe values. Only the canonical
     * encoding of a payload is accepted, so every altered character changes the decoded bytes or
     * fails to decode. Either way the payload does not authenticate, and both fail with
     * {@link IntegrityException}.
     */
    TEXT {
        @Override
        byte[] encodePayload(byte[] payload) {
            return Base64.getEncoder().encodeToString(payload).getBytes(StandardCharsets.US_ASCII);
        }

        @Override
        byte[] decodePayload(byte[] encoded, int offset) {
            String text = new String(encoded, offset, encoded.length - offset, StandardCharsets.US_ASCII);
            final byte[] payload;
            try {
                payload = Base64.getDecoder().decode(text);
            } catch (IllegalArgumentException e) {
                throw new IntegrityException("Envelope payload is not valid base64", e);
            }
            // The decoder ignores non-zero trailing bits, which would let an altered payload decode unchanged
            if (!Base64.getEncoder().encodeToString(payload).equals(text)) {
                throw new IntegrityException("Envelope payload is not canonical base64");
            }
            return payload;
        }
    },
    /**
     * Payload bytes are written as-is.
     */
    BINARY {
        @Override
        byte[] encodePayload(byte[] payload) {
            return payload;
        }

        @Override
        byte[] decodePayload(byte[] encoded, int offset) {
            byte[] payload = new byte[encoded.length - offset];
            System.arraycopy(encoded, offset, payload, 0, payload.length);
            return payload;
        }
    };

    abstract byte[] encodePayload(byte[] payload);

    abstract byte[] decodePayload(byte[] encoded, int offset);
}
