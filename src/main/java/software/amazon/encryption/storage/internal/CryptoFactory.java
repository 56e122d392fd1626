// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage.internal;

import software.amazon.encryption.storage.CryptoPrimitiveException;

import javax.crypto.Cipher;
import javax.crypto.KeyGenerator;
import javax.crypto.NoSuchPaddingException;
import java.security.NoSuchAlgorithmException;
import java.security.Provider;

public class CryptoFactory {
    public static Cipher createCipher(String algorithm, Provider provider) {
        try {
            // if the user has specified a provider, go with that.
            if (provider != null) {
                return Cipher.getInstance(algorithm, provider);
            }

            // Otherwise, go with the default provider.
            return Cipher.getInstance(algorithm);
        } catch (NoSuchAlgorithmException | NoSuchPaddingException e) {
            throw new CryptoPrimitiveException("Unable to create a(n) " + algorithm + " cipher", e);
        }
    }

    public static KeyGenerator generateKey(String algorithm, Provider provider) {
        KeyGenerator generator;
        try {
            if (provider == null) {
                generator = KeyGenerator.getInstance(algorithm);
            } else {
                generator = KeyGenerator.getInstance(algorithm, provider);
            }
        } catch (NoSuchAlgorithmException e) {
            throw new CryptoPrimitiveException("Unable to generate a(n) " + algorithm + " key", e);
        }
        return generator;
    }

    private CryptoFactory() {
    }
}
