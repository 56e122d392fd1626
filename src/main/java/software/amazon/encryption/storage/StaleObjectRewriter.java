// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.util.ArrayList;
import java.util.List;

import static software.amazon.encryption.storage.internal.ApiNameVersion.API_NAME_INTERCEPTOR;

/**
 * Rewrites every stale object under a prefix, the third step of a key rotation. Objects that fail
 * are logged and reported in the {@link RewriteSummary}; the run carries on with the next object.
 * Running it again is safe: objects already written with the active key are not touched.
 */
public class StaleObjectRewriter {

    private static final Log LOG = LogFactory.getLog(StaleObjectRewriter.class);

    private final TransformingS3Client _client;

    public StaleObjectRewriter(TransformingS3Client client) {
        if (client == null) {
            throw new StorageTransformException("TransformingS3Client cannot be null!");
        }
        _client = client;
    }

    public RewriteSummary rewrite(String bucket, String prefix) {
        ListObjectsV2Request request = ListObjectsV2Request.builder()
                .bucket(bucket)
                .prefix(prefix)
                .overrideConfiguration(API_NAME_INTERCEPTOR)
                .build();

        long scanned = 0;
        long rewritten = 0;
        List<String> failedKeys = new ArrayList<>();
        for (S3Object object : _client.listObjectsV2Paginator(request).contents()) {
            scanned++;
            try {
                if (_client.rewriteIfStale(bucket, object.key())) {
                    rewritten++;
                }
            } catch (SdkException e) {
                LOG.warn("Unable to rewrite object " + object.key() + ": " + e.getMessage(), e);
                failedKeys.add(object.key());
            }
        }

        RewriteSummary summary = new RewriteSummary(scanned, rewritten, failedKeys);
        LOG.info("Rewrite of s3://" + bucket + "/" + (prefix == null ? "" : prefix) + " finished: " + summary);
        return summary;
    }
}
