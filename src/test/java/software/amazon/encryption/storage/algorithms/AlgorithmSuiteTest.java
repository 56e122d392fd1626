// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage.algorithms;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class AlgorithmSuiteTest {

    @Test
    public void aesGcmParametersAreFixed() {
        AlgorithmSuite suite = AlgorithmSuite.ALG_AES_256_GCM_IV12_TAG16;

        assertEquals("aes-gcm", suite.id());
        assertEquals("AES", suite.dataKeyAlgorithm());
        assertEquals(32, suite.dataKeyLengthBytes());
        assertEquals("AES/GCM/NoPadding", suite.cipherName());
        assertEquals(12, suite.nonceLengthBytes());
        assertEquals(16, suite.cipherTagLengthBytes());
        assertEquals(1L << 32, suite.maxEncryptionsPerKey());
    }
}
