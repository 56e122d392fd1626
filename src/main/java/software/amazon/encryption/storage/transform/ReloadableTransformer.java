// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage.transform;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import software.amazon.encryption.storage.StorageTransformException;
import software.amazon.encryption.storage.materials.KeyMaterialSource;

import java.util.concurrent.atomic.AtomicReference;

/**
 * A transformer whose whole configuration can be replaced at runtime. Every call reads the
 * current delegate exactly once, so a call never mixes keys from two configurations.
 */
public final class ReloadableTransformer implements Transformer {

    private static final Log LOG = LogFactory.getLog(ReloadableTransformer.class);

    private final AtomicReference<Transformer> _current;

    public ReloadableTransformer(Transformer initial) {
        _current = new AtomicReference<>(requireTransformer(initial));
    }

    public static ReloadableTransformer fromSource(KeyMaterialSource source) {
        return new ReloadableTransformer(TransformChain.fromKeyMaterials(source.load()));
    }

    public Transformer current() {
        return _current.get();
    }

    /**
     * Replaces the delegate for all subsequent calls. Calls already in progress finish with the
     * delegate they started with.
     * @return the replaced delegate
     */
    public Transformer reload(Transformer next) {
        Transformer previous = _current.getAndSet(requireTransformer(next));
        if (LOG.isDebugEnabled()) {
            LOG.debug("Reloaded transformer: " + previous + " -> " + next);
        }
        return previous;
    }

    /**
     * Loads the source and swaps in the resulting chain. If loading fails the current delegate
     * stays in place.
     */
    public Transformer reload(KeyMaterialSource source) {
        return reload(TransformChain.fromKeyMaterials(source.load()));
    }

    @Override
    public byte[] toStorage(byte[] plaintext, AuthenticatedDataContext context) {
        return _current.get().toStorage(plaintext, context);
    }

    @Override
    public TransformResult fromStorage(byte[] stored, AuthenticatedDataContext context) {
        return _current.get().fromStorage(stored, context);
    }

    private static Transformer requireTransformer(Transformer transformer) {
        if (transformer == null) {
            throw new StorageTransformException("Transformer cannot be null!");
        }
        return transformer;
    }
}
