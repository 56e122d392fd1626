// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage.materials;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import software.amazon.encryption.storage.StorageTransformException;
import software.amazon.encryption.storage.algorithms.AlgorithmSuite;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Loads keys from files, one file per key. A file holds either the raw secret bytes or their
 * standard base64 encoding; surrounding whitespace in text files is ignored. Each file is read
 * once per {@link #load()}.
 * <p>
 * A file exactly as long as a key is always read as raw bytes. Anything else that is not base64
 * text is also returned raw, so wrapped keys can be unwrapped by {@link KmsKeyMaterialSource}.
 */
public class FileKeyMaterialSource implements KeyMaterialSource {

    private static final Log LOG = LogFactory.getLog(FileKeyMaterialSource.class);
    private static final Pattern BASE64_TEXT = Pattern.compile("^(?:[A-Za-z0-9+/]{4})*(?:[A-Za-z0-9+/]{2}==|[A-Za-z0-9+/]{3}=)?$");
    private static final int RAW_KEY_LENGTH = AlgorithmSuite.ALG_AES_256_GCM_IV12_TAG16.dataKeyLengthBytes();

    private final List<KeyFile> _keyFiles;
    private final String _primaryProviderId;
    private final String _primaryKeyId;

    private FileKeyMaterialSource(Builder builder) {
        _keyFiles = new ArrayList<>(builder._keyFiles);
        _primaryProviderId = builder._primaryProviderId;
        _primaryKeyId = builder._primaryKeyId;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public KeyMaterials load() {
        KeyMaterials.Builder materials = KeyMaterials.builder();
        for (KeyFile keyFile : _keyFiles) {
            materials.material(KeyMaterial.of(keyFile._providerId, keyFile._keyId, read(keyFile)));
        }
        if (_primaryProviderId != null) {
            materials.primary(_primaryProviderId, _primaryKeyId);
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("Loaded " + _keyFiles.size() + " key file(s)");
        }
        return materials.build();
    }

    private static byte[] read(KeyFile keyFile) {
        final byte[] contents;
        try {
            contents = Files.readAllBytes(keyFile._path);
        } catch (IOException e) {
            // The message only names the file, never its contents
            throw new StorageTransformException("Unable to read key " + keyFile._keyId + " of provider "
                    + keyFile._providerId + " from " + keyFile._path, e);
        }
        if (contents.length == RAW_KEY_LENGTH) {
            return contents;
        }
        String text = new String(contents, StandardCharsets.US_ASCII).trim();
        if (!text.isEmpty() && BASE64_TEXT.matcher(text).matches()) {
            return Base64.getDecoder().decode(text);
        }
        return contents;
    }

    private static final class KeyFile {
        private final String _providerId;
        private final String _keyId;
        private final Path _path;

        private KeyFile(String providerId, String keyId, Path path) {
            _providerId = providerId;
            _keyId = keyId;
            _path = path;
        }
    }

    public static class Builder {
        private final List<KeyFile> _keyFiles = new ArrayList<>();
        private String _primaryProviderId;
        private String _primaryKeyId;

        private Builder() {
        }

        /**
         * Adds a key file. Keys are listed in the order they are added.
         */
        public Builder key(String providerId, String keyId, Path path) {
            if (providerId == null || keyId == null || path == null) {
                throw new StorageTransformException("Provider id, key id and path cannot be null!");
            }
            _keyFiles.add(new KeyFile(providerId, keyId, path));
            return this;
        }

        /**
         * Selects the key for new writes. Defaults to the first key added.
         */
        public Builder primary(String providerId, String keyId) {
            if (providerId == null || keyId == null) {
                throw new StorageTransformException("Primary provider id and key id cannot be null!");
            }
            _primaryProviderId = providerId;
            _primaryKeyId = keyId;
            return this;
        }

        public FileKeyMaterialSource build() {
            if (_keyFiles.isEmpty()) {
                throw new StorageTransformException("At least one key file is required");
            }
            return new FileKeyMaterialSource(this);
        }
    }
}
