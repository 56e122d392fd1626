// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage.materials;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import software.amazon.encryption.storage.StorageTransformException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Drives a key configuration through the rotation steps:
 * <ol>
 *     <li>{@link #addDecryptOnly(KeyMaterial)} deploys the new key everywhere before anyone writes with it</li>
 *     <li>{@link #promote(String, String)} makes it the write key; the old write key stays readable</li>
 *     <li>stale records are rewritten, e.g. with {@code StaleObjectRewriter}</li>
 *     <li>{@link #remove(String, String)} drops the old key</li>
 * </ol>
 * Each step returns a new rotation; the current one is never modified. Deploy
 * {@link #keyMaterials()} after every step before starting the next.
 */
public final class KeyRotation {

    private static final Log LOG = LogFactory.getLog(KeyRotation.class);

    private final KeyMaterials _keyMaterials;
    private final Set<String> _removed;

    private KeyRotation(KeyMaterials keyMaterials, Set<String> removed) {
        _keyMaterials = keyMaterials;
        _removed = Collections.unmodifiableSet(removed);
    }

    public static KeyRotation of(KeyMaterials keyMaterials) {
        if (keyMaterials == null) {
            throw new StorageTransformException("Key materials cannot be null!");
        }
        return new KeyRotation(keyMaterials, new HashSet<>());
    }

    public KeyMaterials keyMaterials() {
        return _keyMaterials;
    }

    public KeyState stateOf(String providerId, String keyId) {
        if (_keyMaterials.primaryProviderId().equals(providerId) && _keyMaterials.primaryKeyId().equals(keyId)) {
            return KeyState.ACTIVE;
        }
        if (_keyMaterials.contains(providerId, keyId)) {
            return KeyState.DECRYPT_ONLY;
        }
        if (_removed.contains(qualified(providerId, keyId))) {
            return KeyState.REMOVED;
        }
        return KeyState.ABSENT;
    }

    public KeyRotation addDecryptOnly(KeyMaterial material) {
        if (material == null) {
            throw new StorageTransformException("Key material cannot be null!");
        }
        checkTransition(material.providerId(), material.keyId(), KeyState.DECRYPT_ONLY);
        KeyMaterials next = _keyMaterials.toBuilder()
                .material(material)
                .build();
        log("Added decrypt-only", material.providerId(), material.keyId());
        return new KeyRotation(next, new HashSet<>(_removed));
    }

    public KeyRotation promote(String providerId, String keyId) {
        checkTransition(providerId, keyId, KeyState.ACTIVE);
        KeyMaterial promoted = _keyMaterials.find(providerId, keyId);
        KeyMaterial previous = _keyMaterials.primary();

        // Keep each provider's current key first so a demoted provider still resolves its newest key
        List<KeyMaterial> ordered = new ArrayList<>();
        ordered.add(promoted);
        ordered.add(previous);
        for (KeyMaterial material : _keyMaterials.materials()) {
            if (material != promoted && material != previous) {
                ordered.add(material);
            }
        }
        KeyMaterials next = KeyMaterials.builder()
                .materials(ordered)
                .primary(providerId, keyId)
                .build();
        log("Promoted", providerId, keyId);
        return new KeyRotation(next, new HashSet<>(_removed));
    }

    public KeyRotation remove(String providerId, String keyId) {
        checkTransition(providerId, keyId, KeyState.REMOVED);
        List<KeyMaterial> remaining = new ArrayList<>(_keyMaterials.materials());
        remaining.remove(_keyMaterials.find(providerId, keyId));
        KeyMaterials next = KeyMaterials.builder()
                .materials(remaining)
                .primary(_keyMaterials.primaryProviderId(), _keyMaterials.primaryKeyId())
                .build();

        Set<String> removed = new HashSet<>(_removed);
        removed.add(qualified(providerId, keyId));
        log("Removed", providerId, keyId);
        return new KeyRotation(next, removed);
    }

    private void checkTransition(String providerId, String keyId, KeyState next) {
        KeyState current = stateOf(providerId, keyId);
        if (!current.canTransitionTo(next)) {
            throw new StorageTransformException("Key " + keyId + " of provider " + providerId
                    + " cannot move from " + current + " to " + next);
        }
    }

    private static String qualified(String providerId, String keyId) {
        return providerId + ":" + keyId;
    }

    private static void log(String step, String providerId, String keyId) {
        if (LOG.isDebugEnabled()) {
            LOG.debug(step + " key " + keyId + " of provider " + providerId);
        }
    }
}
