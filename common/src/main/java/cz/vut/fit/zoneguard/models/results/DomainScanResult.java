package cz.vut.fit.zoneguard.models.results;

import cz.vut.fit.zoneguard.models.DomainSnapshot;
import cz.vut.fit.zoneguard.models.ScanStatus;
import cz.vut.fit.zoneguard.models.findings.Finding;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * The result of scanning a single domain.
 *
 * @param domain   The normalized domain name.
 * @param snapshot The collected data.
 * @param findings The findings, ordered by severity and then by rule order. Empty if the status is FAILED.
 * @param status   The scan status.
 * @param errors   The failed collector calls.
 */
public record DomainScanResult(@NotNull String domain,
                               @NotNull DomainSnapshot snapshot,
                               @NotNull List<Finding> findings,
                               @NotNull ScanStatus status,
                               @NotNull List<CollectorError> errors
) {
    public DomainScanResult {
        findings = List.copyOf(findings);
        errors = List.copyOf(errors);
    }
}
