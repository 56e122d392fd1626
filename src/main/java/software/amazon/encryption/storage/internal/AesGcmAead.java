// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage.internal;

import software.amazon.encryption.storage.CryptoPrimitiveException;
import software.amazon.encryption.storage.IntegrityException;
import software.amazon.encryption.storage.StorageTransformException;
import software.amazon.encryption.storage.algorithms.AlgorithmSuite;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.Provider;
import java.util.Arrays;

/**
 * AES-GCM implementation of {@link Aead}. A fresh {@link Cipher} is created for every call,
 * so a single instance can be shared across threads.
 */
public class AesGcmAead implements Aead {

    private static final AlgorithmSuite ALGORITHM_SUITE = AlgorithmSuite.ALG_AES_256_GCM_IV12_TAG16;

    private final SecretKey _key;
    private final Provider _cryptoProvider;

    /**
     * @param secret raw key bytes, {@link AlgorithmSuite#dataKeyLengthBytes()} long
     * @param cryptoProvider the JCA provider to use, or null for the default provider chain
     */
    public AesGcmAead(byte[] secret, Provider cryptoProvider) {
        if (secret == null || secret.length != ALGORITHM_SUITE.dataKeyLengthBytes()) {
            throw new StorageTransformException("AES-GCM requires a key of "
                    + ALGORITHM_SUITE.dataKeyLengthBytes() + " bytes");
        }
        _key = new SecretKeySpec(secret, ALGORITHM_SUITE.dataKeyAlgorithm());
        _cryptoProvider = cryptoProvider;
    }

    @Override
    public AlgorithmSuite algorithmSuite() {
        return ALGORITHM_SUITE;
    }

    @Override
    public byte[] seal(byte[] nonce, byte[] plaintext, byte[] authenticatedData) {
        checkNonceLength(nonce);
        checkAuthenticatedData(authenticatedData);
        // An all-zero nonce means the random source was never consulted.
        if (Arrays.equals(nonce, new byte[nonce.length])) {
            throw new CryptoPrimitiveException("Nonce has not been initialized!");
        }
        try {
            Cipher cipher = initCipher(Cipher.ENCRYPT_MODE, nonce);
            cipher.updateAAD(authenticatedData);
            return cipher.doFinal(plaintext);
        } catch (GeneralSecurityException e) {
            throw new CryptoPrimitiveException("Unable to " + ALGORITHM_SUITE.cipherName() + " seal", e);
        }
    }

    @Override
    public byte[] open(byte[] nonce, byte[] ciphertext, byte[] authenticatedData) {
        checkNonceLength(nonce);
        checkAuthenticatedData(authenticatedData);
        try {
            Cipher cipher = initCipher(Cipher.DECRYPT_MODE, nonce);
            cipher.updateAAD(authenticatedData);
            return cipher.doFinal(ciphertext);
        } catch (AEADBadTagException e) {
            throw new IntegrityException("Authentication of the stored data failed", e);
        } catch (GeneralSecurityException e) {
            throw new CryptoPrimitiveException("Unable to " + ALGORITHM_SUITE.cipherName() + " open", e);
        }
    }

    private Cipher initCipher(int opMode, byte[] nonce) throws GeneralSecurityException {
        final Cipher cipher = CryptoFactory.createCipher(ALGORITHM_SUITE.cipherName(), _cryptoProvider);
        cipher.init(opMode, _key, new GCMParameterSpec(ALGORITHM_SUITE.cipherTagLengthBits(), nonce));
        return cipher;
    }

    private static void checkAuthenticatedData(byte[] authenticatedData) {
        if (authenticatedData == null) {
            throw new StorageTransformException("Authenticated data cannot be null!");
        }
    }

    private static void checkNonceLength(byte[] nonce) {
        if (nonce == null || nonce.length != ALGORITHM_SUITE.nonceLengthBytes()) {
            throw new StorageTransformException("Nonce must be " + ALGORITHM_SUITE.nonceLengthBytes() + " bytes");
        }
    }
}
