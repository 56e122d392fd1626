// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage.algorithms;

class AlgorithmConstants {
    /**
     * The number of encryptions with random 96-bit nonces after which a single key MUST be rotated.
     * Keeping below 2^32 invocations holds the nonce collision probability under 2^-32 (SP 800-38D, 8.3).
     */
    static final long GCM_RANDOM_NONCE_MAX_ENCRYPTIONS_PER_KEY = 1L << 32;
}
