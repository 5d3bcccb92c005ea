package cz.vut.fit.zoneguard.standalone.scanner;

import cz.vut.fit.zoneguard.models.results.BatchSummary;
import cz.vut.fit.zoneguard.models.results.DomainScanResult;
import org.jetbrains.annotations.NotNull;

import java.util.Collection;

/**
 * Reduces per-domain results into the batch summary. The summary is always recomputed from the results.
 */
public final class ReportAggregator {
    private ReportAggregator() {
    }

    public static @NotNull BatchSummary aggregate(@NotNull Collection<DomainScanResult> results) {
        int critical = 0, warning = 0, info = 0;
        int ok = 0, partial = 0, failed = 0;

        for (var result : results) {
            for (var finding : result.findings()) {
                switch (finding.severity()) {
                    case CRITICAL -> critical++;
                    case WARNING -> warning++;
                    case INFO -> info++;
                }
            }

            switch (result.status()) {
                case OK -> ok++;
                case PARTIAL -> partial++;
                case FAILED -> failed++;
            }
        }

        return new BatchSummary(critical, warning, info, ok, partial, failed);
    }
}
