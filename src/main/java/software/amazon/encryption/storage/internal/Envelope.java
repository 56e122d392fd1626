// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage.internal;

import software.amazon.encryption.storage.StorageTransformException;

/**
 * The parsed form of stored data: {@code providerId ":" keyId ":" payload}.
 * The payload is algorithm specific and opaque to the codec.
 */
public final class Envelope {

    private final String _providerId;
    private final String _keyId;
    private final byte[] _payload;

    private Envelope(Builder builder) {
        this._providerId = builder._providerId;
        this._keyId = builder._keyId;
        this._payload = builder._payload;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String providerId() {
        return _providerId;
    }

    public String keyId() {
        return _keyId;
    }

    public byte[] payload() {
        return _payload.clone();
    }

    /**
     * @return the payload length without copying it
     */
    public int payloadLength() {
        return _payload.length;
    }

    @Override
    public String toString() {
        // payload is ciphertext; ids are stored in the clear anyway
        return "Envelope{providerId=" + _providerId + ", keyId=" + _keyId
                + ", payloadLength=" + _payload.length + "}";
    }

    public static class Builder {
        private String _providerId;
        private String _keyId;
        private byte[] _payload;

        private Builder() {
        }

        public Builder providerId(String providerId) {
            _providerId = providerId;
            return this;
        }

        public Builder keyId(String keyId) {
            _keyId = keyId;
            return this;
        }

        public Builder payload(byte[] payload) {
            _payload = payload == null ? null : payload.clone();
            return this;
        }

        public Envelope build() {
            EnvelopeCodec.validateIdentifier(_providerId, "Provider id");
            EnvelopeCodec.validateIdentifier(_keyId, "Key id");
            if (_payload == null) {
                throw new StorageTransformException("Payload cannot be null!");
            }
            return new Envelope(this);
        }
    }
}
