// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage.algorithms;

/**
 * Defines the authenticated encryption algorithms a transform provider can be bound to.
 * A provider id is permanently bound to exactly one suite, so the parameters of an existing
 * suite MUST never change; a new algorithm gets a new suite and a new provider id.
 */
public enum AlgorithmSuite {
    /**
     * AES-256-GCM with a random 96-bit nonce and a 128-bit tag appended to the ciphertext.
     * This is the reference suite used by the AES-GCM transform provider.
     */
    ALG_AES_256_GCM_IV12_TAG16("aes-gcm",
            "AES",
            256,
            "AES/GCM/NoPadding",
            96,
            128,
            AlgorithmConstants.GCM_RANDOM_NONCE_MAX_ENCRYPTIONS_PER_KEY);

    private final String _id;
    private final String _dataKeyAlgorithm;
    private final int _dataKeyLengthBits;
    private final String _cipherName;
    private final int _cipherIvLengthBits;
    private final int _cipherTagLengthBits;
    private final long _maxEncryptionsPerKey;

    AlgorithmSuite(String id,
                   String dataKeyAlgorithm,
                   int dataKeyLengthBits,
                   String cipherName,
                   int cipherIvLengthBits,
                   int cipherTagLengthBits,
                   long maxEncryptionsPerKey) {
        this._id = id;
        this._dataKeyAlgorithm = dataKeyAlgorithm;
        this._dataKeyLengthBits = dataKeyLengthBits;
        this._cipherName = cipherName;
        this._cipherIvLengthBits = cipherIvLengthBits;
        this._cipherTagLengthBits = cipherTagLengthBits;
        this._maxEncryptionsPerKey = maxEncryptionsPerKey;
    }

    /**
     * @return the short, stable name of this suite, e.g. {@code aes-gcm}
     */
    public String id() {
        return _id;
    }

    /**
     * @return the JCA key algorithm, e.g. "AES"
     */
    public String dataKeyAlgorithm() {
        return _dataKeyAlgorithm;
    }

    public int dataKeyLengthBits() {
        return _dataKeyLengthBits;
    }

    public int dataKeyLengthBytes() {
        return _dataKeyLengthBits / 8;
    }

    /**
     * @return the cipher transformation string, e.g. "AES/GCM/NoPadding"
     */
    public String cipherName() {
        return _cipherName;
    }

    public int cipherTagLengthBits() {
        return _cipherTagLengthBits;
    }

    public int cipherTagLengthBytes() {
        return _cipherTagLengthBits / 8;
    }

    public int nonceLengthBytes() {
        return _cipherIvLengthBits / 8;
    }

    /**
     * Returns the number of encryptions a single key may perform before it has to be rotated
     * to keep the (key, nonce) pairs unique with acceptable probability.
     * @return the per-key encryption limit
     */
    public long maxEncryptionsPerKey() {
        return _maxEncryptionsPerKey;
    }
}
