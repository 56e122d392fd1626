// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.core.sync.ResponseTransformer;
import software.amazon.awssdk.http.AbortableInputStream;
import software.amazon.awssdk.services.s3.DelegatingS3Client;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.utils.IoUtils;
import software.amazon.encryption.storage.transform.AuthenticatedDataContext;
import software.amazon.encryption.storage.transform.ResourceTransformers;
import software.amazon.encryption.storage.transform.TransformResult;
import software.amazon.encryption.storage.transform.Transformer;

import java.io.ByteArrayInputStream;
import java.io.InputStream;

import static software.amazon.encryption.storage.internal.ApiNameVersion.API_NAME_INTERCEPTOR;

/**
 * An S3 client that encrypts objects at rest. Every object key is {@code <resourceKind>/<rest>};
 * the resource kind selects the {@link Transformer} from {@link ResourceTransformers}, and the
 * path {@code /<bucket>/<key>} is bound to the ciphertext as authenticated data. An object copied
 * to another key therefore no longer decrypts.
 * <p>
 * Operations other than putObject and getObject pass through to the wrapped client unchanged.
 */
public class TransformingS3Client extends DelegatingS3Client {

    private static final Log LOG = LogFactory.getLog(TransformingS3Client.class);

    private static final int PRECONDITION_FAILED = 412;

    private final S3Client _wrappedClient;
    private final ResourceTransformers _resourceTransformers;
    private final boolean _rewriteStaleObjects;

    private TransformingS3Client(Builder builder) {
        super(builder._wrappedClient);
        _wrappedClient = builder._wrappedClient;
        _resourceTransformers = builder._resourceTransformers;
        _rewriteStaleObjects = builder._rewriteStaleObjects;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * The resource kind of an object key is its first path segment. Keys without a
     * {@code /} have no kind and are left untransformed, unless a default transformer says otherwise.
     */
    public static String resourceKindOf(String key) {
        String path = key.startsWith("/") ? key.substring(1) : key;
        int slash = path.indexOf('/');
        return slash < 0 ? "" : path.substring(0, slash);
    }

    /**
     * @return the authenticated data context for an object, {@code /<bucket>/<key>}
     */
    public static AuthenticatedDataContext contextFor(String bucket, String key) {
        return AuthenticatedDataContext.forPath("/" + bucket + "/" + key);
    }

    /**
     * See {@link S3Client#putObject(PutObjectRequest, RequestBody)}.
     * <p>
     * In the TransformingS3Client, putObject transforms the content with the transformer of the
     * key's resource kind before it is written to S3.
     * </p>
     * @param putObjectRequest the request instance
     * @param requestBody the content to send to the service
     * @return Result of the PutObject operation returned by the service.
     * @throws SdkClientException If any client side error occurs such as an IO related failure, failure to get credentials, etc.
     * @throws StorageTransformException Base class for all storage transform exceptions.
     */
    @Override
    public PutObjectResponse putObject(PutObjectRequest putObjectRequest, RequestBody requestBody)
            throws AwsServiceException, SdkClientException {
        try (InputStream content = requestBody.contentStreamProvider().newStream()) {
            return putPlaintext(putObjectRequest, IoUtils.toByteArray(content));
        } catch (StorageTransformException e) {
            throw e;
        } catch (Exception e) {
            throw new StorageTransformException("Unable to put object " + putObjectRequest.key(), e);
        }
    }

    /**
     * See {@link S3Client#getObject(GetObjectRequest, ResponseTransformer)}.
     * <p>
     * In the TransformingS3Client, getObject reverses the transform before the content reaches the
     * response transformer. Stale objects are written back under the active key when
     * {@link Builder#rewriteStaleObjects(boolean)} is enabled. A failed write-back is logged and
     * does not fail the read.
     * </p>
     * @param getObjectRequest the request instance
     * @param responseTransformer processes the plaintext content
     * @return The transformed result of the ResponseTransformer.
     * @throws SdkClientException If any client side error occurs such as an IO related failure, failure to get credentials, etc.
     * @throws StorageTransformException Base class for all storage transform exceptions.
     */
    @Override
    public <T> T getObject(GetObjectRequest getObjectRequest,
                           ResponseTransformer<GetObjectResponse, T> responseTransformer)
            throws AwsServiceException, SdkClientException {
        try {
            StoredObject stored = read(getObjectRequest);
            TransformResult result = stored.transform();
            byte[] plaintext = result.plaintext();
            if (result.stale() && _rewriteStaleObjects) {
                rewriteAfterRead(stored, plaintext);
            }
            GetObjectResponse response = stored._response.toBuilder()
                    .contentLength((long) plaintext.length)
                    .build();
            return responseTransformer.transform(response,
                    AbortableInputStream.create(new ByteArrayInputStream(plaintext)));
        } catch (StorageTransformException e) {
            throw e;
        } catch (Exception e) {
            throw new StorageTransformException("Unable to transform response.", e);
        }
    }

    /**
     * Reads an object and reports whether it was written with the current configuration.
     * @param getObjectRequest the request instance
     * @return the plaintext and its staleness
     */
    public TransformResult getObjectWithStaleness(GetObjectRequest getObjectRequest) {
        try {
            return read(getObjectRequest).transform();
        } catch (StorageTransformException e) {
            throw e;
        } catch (Exception e) {
            throw new StorageTransformException("Unable to get object " + getObjectRequest.key(), e);
        }
    }

    /**
     * Reads an object and writes it back if it is stale. The write is conditional on the object
     * being unchanged since the read, so a concurrent update is never overwritten.
     * @return {@code true} if the object was rewritten
     */
    public boolean rewriteIfStale(String bucket, String key) {
        try {
            StoredObject stored = read(GetObjectRequest.builder().bucket(bucket).key(key).build());
            TransformResult result = stored.transform();
            return result.stale() && rewrite(stored, result.plaintext());
        } catch (StorageTransformException e) {
            throw e;
        } catch (Exception e) {
            throw new StorageTransformException("Unable to rewrite object " + key, e);
        }
    }

    private PutObjectResponse putPlaintext(PutObjectRequest putObjectRequest, byte[] plaintext) {
        Transformer transformer = _resourceTransformers.forKind(resourceKindOf(putObjectRequest.key()));
        byte[] stored = transformer.toStorage(plaintext,
                contextFor(putObjectRequest.bucket(), putObjectRequest.key()));

        PutObjectRequest actualRequest = putObjectRequest.toBuilder()
                .contentLength((long) stored.length)
                .overrideConfiguration(API_NAME_INTERCEPTOR)
                .build();
        return _wrappedClient.putObject(actualRequest, RequestBody.fromBytes(stored));
    }

    private StoredObject read(GetObjectRequest getObjectRequest) {
        GetObjectRequest actualRequest = getObjectRequest.toBuilder()
                .overrideConfiguration(API_NAME_INTERCEPTOR)
                .build();
        ResponseBytes<GetObjectResponse> bytes = _wrappedClient.getObject(actualRequest, ResponseTransformer.toBytes());
        return new StoredObject(getObjectRequest.bucket(), getObjectRequest.key(), bytes.response(), bytes.asByteArray());
    }

    private void rewriteAfterRead(StoredObject stored, byte[] plaintext) {
        try {
            rewrite(stored, plaintext);
        } catch (StorageTransformException e) {
            throw e;
        } catch (SdkException e) {
            LOG.warn("Unable to rewrite stale object " + stored._key + ", it stays under its previous key", e);
        }
    }

    private boolean rewrite(StoredObject stored, byte[] plaintext) {
        GetObjectResponse response = stored._response;
        PutObjectRequest.Builder request = PutObjectRequest.builder()
                .bucket(stored._bucket)
                .key(stored._key)
                .contentType(response.contentType())
                .contentEncoding(response.contentEncoding())
                .cacheControl(response.cacheControl())
                .storageClass(response.storageClass())
                .serverSideEncryption(response.serverSideEncryption())
                .ssekmsKeyId(response.ssekmsKeyId())
                .metadata(response.metadata());
        if (response.eTag() != null) {
            request.ifMatch(response.eTag());
        }
        try {
            putPlaintext(request.build(), plaintext);
        } catch (S3Exception e) {
            if (e.statusCode() != PRECONDITION_FAILED) {
                throw e;
            }
            LOG.debug("Object " + stored._key + " changed since it was read, leaving the newer version in place");
            return false;
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("Rewrote stale object " + stored._key);
        }
        return true;
    }

    /**
     * Closes the wrapped client.
     */
    @Override
    public void close() {
        _wrappedClient.close();
    }

    private final class StoredObject {
        private final String _bucket;
        private final String _key;
        private final GetObjectResponse _response;
        private final byte[] _content;

        private StoredObject(String bucket, String key, GetObjectResponse response, byte[] content) {
            _bucket = bucket;
            _key = key;
            _response = response;
            _content = content;
        }

        private TransformResult transform() {
            return _resourceTransformers.forKind(resourceKindOf(_key))
                    .fromStorage(_content, contextFor(_bucket, _key));
        }
    }

    public static class Builder {
        private S3Client _wrappedClient;
        private ResourceTransformers _resourceTransformers;
        private boolean _rewriteStaleObjects = false;

        private Builder() {
        }

        /**
         * Sets the client that performs the actual S3 requests.
         */
        /*
         * Note that this does NOT create a defensive clone of S3Client. Any modifications made to the wrapped
         * S3Client will be reflected in this Builder.
         */
        @SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Pass mutability into wrapping client")
        public Builder wrappedClient(S3Client wrappedClient) {
            if (wrappedClient instanceof TransformingS3Client) {
                throw new StorageTransformException("Cannot use TransformingS3Client as wrapped client");
            }
            _wrappedClient = wrappedClient;
            return this;
        }

        public Builder resourceTransformers(ResourceTransformers resourceTransformers) {
            if (resourceTransformers == null) {
                throw new StorageTransformException("ResourceTransformers cannot be null!");
            }
            _resourceTransformers = resourceTransformers;
            return this;
        }

        /**
         * When enabled, getObject writes stale objects back under the active configuration.
         * Disabled by default.
         */
        public Builder rewriteStaleObjects(boolean shouldRewriteStaleObjects) {
            _rewriteStaleObjects = shouldRewriteStaleObjects;
            return this;
        }

        public TransformingS3Client build() {
            if (_resourceTransformers == null) {
                throw new StorageTransformException("ResourceTransformers must be set");
            }
            if (_wrappedClient == null) {
                _wrappedClient = S3Client.create();
            }
            return new TransformingS3Client(this);
        }
    }
}
