package cz.vut.fit.zoneguard.standalone.scanner;

import cz.vut.fit.zoneguard.models.DomainSnapshot;
import cz.vut.fit.zoneguard.models.ScanStatus;
import cz.vut.fit.zoneguard.models.Severity;
import cz.vut.fit.zoneguard.models.findings.Finding;
import cz.vut.fit.zoneguard.models.results.BatchSummary;
import cz.vut.fit.zoneguard.models.results.DomainScanResult;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ReportAggregatorTest {
    private static DomainScanResult result(String domain, ScanStatus status, Severity... severities) {
        final var findings = new ArrayList<Finding>();
        for (var severity : severities) {
            findings.add(new Finding("rule_" + severity, severity, "Title", "Description", List.of()));
        }
        return new DomainScanResult(domain, new DomainSnapshot(domain, Instant.EPOCH, null, null), findings,
                status, List.of());
    }

    @Test
    void emptyBatchHasZeroSummary() {
        assertEquals(new BatchSummary(0, 0, 0, 0, 0, 0), ReportAggregator.aggregate(List.of()));
    }

    @Test
    void countsFindingsAndStatuses() {
        final var summary = ReportAggregator.aggregate(List.of(
                result("a.com", ScanStatus.OK, Severity.CRITICAL, Severity.INFO, Severity.INFO),
                result("b.com", ScanStatus.PARTIAL, Severity.WARNING),
                result("c.com", ScanStatus.FAILED)));

        assertEquals(new BatchSummary(1, 1, 2, 1, 1, 1), summary);
        assertEquals(4, summary.totalFindings());
        assertEquals(3, summary.totalDomains());
    }

    @Test
    void summaryMatchesResultsForRandomBatches() {
        final var random = new Random(20261019L);
        final var severities = Severity.values();
        final var statuses = ScanStatus.values();

        for (var round = 0; round < 200; round++) {
            final var results = new ArrayList<DomainScanResult>();
            final var expectedBySeverity = new int[severities.length];
            final var expectedByStatus = new int[statuses.length];

            final var domains = random.nextInt(20);
            for (var d = 0; d < domains; d++) {
                final var status = statuses[random.nextInt(statuses.length)];
                expectedByStatus[status.ordinal()]++;

                final var findings = new Severity[status == ScanStatus.FAILED ? 0 : random.nextInt(8)];
                for (var f = 0; f < findings.length; f++) {
                    findings[f] = severities[random.nextInt(severities.length)];
                    expectedBySeverity[findings[f].ordinal()]++;
                }
                results.add(result("d" + d + ".com", status, findings));
            }

            final var summary = ReportAggregator.aggregate(results);
            assertEquals(expectedBySeverity[Severity.CRITICAL.ordinal()], summary.criticalCount());
            assertEquals(expectedBySeverity[Severity.WARNING.ordinal()], summary.warningCount());
            assertEquals(expectedBySeverity[Severity.INFO.ordinal()], summary.infoCount());
            assertEquals(expectedByStatus[ScanStatus.OK.ordinal()], summary.domainsOk());
            assertEquals(expectedByStatus[ScanStatus.PARTIAL.ordinal()], summary.domainsPartial());
            assertEquals(expectedByStatus[ScanStatus.FAILED.ordinal()], summary.domainsFailed());
            assertEquals(domains, summary.totalDomains());
            assertEquals(results.stream().mapToInt(r -> r.findings().size()).sum(), summary.totalFindings());
        }
    }
}
