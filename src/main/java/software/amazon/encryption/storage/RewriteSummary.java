// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage;

import java.util.Collections;
import java.util.List;

/**
 * The outcome of a {@link StaleObjectRewriter} run.
 */
public final class RewriteSummary {

    private final long _scanned;
    private final long _rewritten;
    private final List<String> _failedKeys;

    RewriteSummary(long scanned, long rewritten, List<String> failedKeys) {
        _scanned = scanned;
        _rewritten = rewritten;
        _failedKeys = Collections.unmodifiableList(failedKeys);
    }

    public long scanned() {
        return _scanned;
    }

    public long rewritten() {
        return _rewritten;
    }

    public long failed() {
        return _failedKeys.size();
    }

    /**
     * @return the keys of the objects that could not be read or rewritten
     */
    public List<String> failedKeys() {
        return _failedKeys;
    }

    /**
     * A rotation may only drop its old key once a run completed without failures.
     */
    public boolean isComplete() {
        return _failedKeys.isEmpty();
    }

    @Override
    public String toString() {
        return "RewriteSummary{scanned=" + _scanned + ", rewritten=" + _rewritten + ", failed=" + failed() + "}";
    }
}
