// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage.internal;

import software.amazon.encryption.storage.MalformedEnvelopeException;
import software.amazon.encryption.storage.StorageTransformException;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Serializes and parses the stored layout {@code <providerId>:<keyId>:<payload>}.
 * Only the first two delimiters are significant, so binary payloads may contain the delimiter byte.
 * The codec knows nothing about cryptography.
 */
public class EnvelopeCodec {

    public static final char DELIMITER = ':';
    private static final byte DELIMITER_BYTE = (byte) DELIMITER;
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9._-]+");

    private final EnvelopeEncoding _encoding;

    public EnvelopeCodec(EnvelopeEncoding encoding) {
        if (encoding == null) {
            throw new StorageTransformException("Envelope encoding cannot be null!");
        }
        _encoding = encoding;
    }

    public EnvelopeEncoding encoding() {
        return _encoding;
    }

    public byte[] encode(Envelope envelope) {
        byte[] header = (envelope.providerId() + DELIMITER + envelope.keyId() + DELIMITER)
                .getBytes(StandardCharsets.UTF_8);
        byte[] payload = _encoding.encodePayload(envelope.payload());

        byte[] encoded = new byte[header.length + payload.length];
        System.arraycopy(header, 0, encoded, 0, header.length);
        System.arraycopy(payload, 0, encoded, header.length, payload.length);
        return encoded;
    }

    public Envelope decode(byte[] stored) {
        if (stored == null) {
            throw new MalformedEnvelopeException("Stored data cannot be null");
        }
        int first = indexOfDelimiter(stored, 0);
        if (first <= 0) {
            throw new MalformedEnvelopeException("Envelope is missing a provider id");
        }
        int second = indexOfDelimiter(stored, first + 1);
        if (second < 0) {
            throw new MalformedEnvelopeException("Envelope is missing a key id delimiter");
        }
        if (second == first + 1) {
            throw new MalformedEnvelopeException("Envelope has an empty key id");
        }

        String providerId = new String(stored, 0, first, StandardCharsets.UTF_8);
        String keyId = new String(stored, first + 1, second - first - 1, StandardCharsets.UTF_8);
        if (!isIdentifier(providerId) || !isIdentifier(keyId)) {
            throw new MalformedEnvelopeException("Envelope header contains an invalid identifier");
        }
        return Envelope.builder()
                .providerId(providerId)
                .keyId(keyId)
                .payload(_encoding.decodePayload(stored, second + 1))
                .build();
    }

    /**
     * Reads only the leading provider id segment, without looking at the rest of the data.
     * @param stored the stored bytes
     * @return the provider id, or empty if the data has no non-empty leading segment
     */
    public static Optional<String> providerIdOf(byte[] stored) {
        if (stored == null) {
            return Optional.empty();
        }
        int first = indexOfDelimiter(stored, 0);
        if (first <= 0) {
            return Optional.empty();
        }
        return Optional.of(new String(stored, 0, first, StandardCharsets.UTF_8));
    }

    /**
     * @param stored the stored bytes
     * @return true if the data starts with a {@code providerId:keyId:} header of valid identifiers,
     * whether or not the provider is known
     */
    public static boolean hasHeader(byte[] stored) {
        if (stored == null) {
            return false;
        }
        int first = indexOfDelimiter(stored, 0);
        if (first <= 0) {
            return false;
        }
        int second = indexOfDelimiter(stored, first + 1);
        if (second <= first + 1) {
            return false;
        }
        return isIdentifier(new String(stored, 0, first, StandardCharsets.UTF_8))
                && isIdentifier(new String(stored, first + 1, second - first - 1, StandardCharsets.UTF_8));
    }

    /**
     * Validates a provider or key id: it must be non-empty and may only contain ASCII letters,
     * digits, {@code .}, {@code _} and {@code -}. In particular it never contains the delimiter.
     */
    public static void validateIdentifier(String identifier, String what) {
        if (identifier == null || identifier.isEmpty()) {
            throw new StorageTransformException(what + " cannot be null or empty!");
        }
        if (identifier.indexOf(DELIMITER) >= 0) {
            throw new StorageTransformException(what + " cannot contain '" + DELIMITER + "': " + identifier);
        }
        if (!isIdentifier(identifier)) {
            throw new StorageTransformException(what + " may only contain letters, digits, '.', '_' and '-': "
                    + identifier);
        }
    }

    private static boolean isIdentifier(String value) {
        return IDENTIFIER.matcher(value).matches();
    }

    private static int indexOfDelimiter(byte[] bytes, int from) {
        for (int i = from; i < bytes.length; i++) {
            if (bytes[i] == DELIMITER_BYTE) {
                return i;
            }
        }
        return -1;
    }
}
