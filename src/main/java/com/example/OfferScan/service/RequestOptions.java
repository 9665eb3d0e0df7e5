package com.example.OfferScan.service;

import java.time.Duration;

/**
 * Per-call knobs of {@link AnalysisHttpClient}.
 *
 * @param organizationId    override of the configured organization, ignored when blank
 * @param includeAuthHeader {@code false} for pre-signed archive downloads
 * @param timeout           per-attempt timeout, configured default when {@code null}
 */
public record RequestOptions(
        String organizationId,
        boolean includeAuthHeader,
        Duration timeout
) {
    public static RequestOptions defaults() {
        return new RequestOptions(null, true, null);
    }

    public static RequestOptions forOrganization(String organizationId) {
        return new RequestOptions(organizationId, true, null);
    }

    public static RequestOptions download() {
        return new RequestOptions(null, false, null);
    }
}
