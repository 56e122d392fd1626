// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage.transform;

/**
 * Transforms records between their plaintext form and the form that is written to storage.
 * The two operations are mutually inverse: for any plaintext {@code p} and context {@code ctx},
 * {@code fromStorage(toStorage(p, ctx), ctx)} yields {@code p} with {@code stale == false}
 * as long as the active key has not changed in between.
 * <p>
 * Implementations are invoked in-line with storage reads and writes from many threads at once.
 * They MUST be thread safe and MUST NOT block.
 */
public interface Transformer {

    /**
     * Transforms a plaintext record into its stored form, always with the currently active
     * provider and key.
     * @param plaintext the serialized record
     * @param context the storage location the record is written to
     * @return the bytes to store
     * @throws software.amazon.encryption.storage.CryptoPrimitiveException if a cryptographic primitive
     *         fails; the write MUST fail and MUST NOT be retried in plaintext
     */
    byte[] toStorage(byte[] plaintext, AuthenticatedDataContext context);

    /**
     * Transforms stored bytes back into the plaintext record.
     * @param stored the bytes read from storage
     * @param context the storage location the record was read from
     * @return the plaintext and whether the record should be rewritten
     * @throws software.amazon.encryption.storage.DecryptionException if no provider or key can open the data
     * @throws software.amazon.encryption.storage.IntegrityException if authentication of the data fails
     */
    TransformResult fromStorage(byte[] stored, AuthenticatedDataContext context);
}
