// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage.transform;

/**
 * Decides whether a successfully decoded record should be rewritten: it is stale when it was not
 * produced by the active provider, or not by the active key of that provider.
 * A {@code null} expectation is not checked.
 */
public final class StalenessPolicy {

    private final String _activeProviderId;
    private final String _activeKeyId;

    private StalenessPolicy(String activeProviderId, String activeKeyId) {
        _activeProviderId = activeProviderId;
        _activeKeyId = activeKeyId;
    }

    public static StalenessPolicy of(String activeProviderId, String activeKeyId) {
        return new StalenessPolicy(activeProviderId, activeKeyId);
    }

    /**
     * A policy that only checks the provider, as used by a chain of providers.
     */
    public static StalenessPolicy activeProvider(String activeProviderId) {
        return new StalenessPolicy(activeProviderId, null);
    }

    public boolean isStale(String providerId, String keyId) {
        if (_activeProviderId != null && !_activeProviderId.equals(providerId)) {
            return true;
        }
        return _activeKeyId != null && !_activeKeyId.equals(keyId);
    }
}
