package cz.vut.fit.zoneguard.models.results;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The result of scanning a batch of domains.
 *
 * @param results   The per-domain results in the order the domains were requested.
 * @param summary   The summary computed from {@code results}.
 * @param skipped   The domains that were not scanned because the batch was cancelled, in request order.
 * @param cancelled True if the batch was cancelled before all domains were scanned.
 */
public record BatchResult(@NotNull Map<String, DomainScanResult> results,
                          @NotNull BatchSummary summary,
                          @NotNull List<String> skipped,
                          boolean cancelled
) {
    public BatchResult {
        results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        skipped = List.copyOf(skipped);
    }
}
