package cz.vut.fit.zoneguard.standalone.report;

import cz.vut.fit.zoneguard.models.ResultCodes;
import cz.vut.fit.zoneguard.models.Severity;
import cz.vut.fit.zoneguard.models.findings.Finding;
import cz.vut.fit.zoneguard.models.results.BatchResult;
import cz.vut.fit.zoneguard.models.results.DomainScanResult;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders a batch result as a human-readable Markdown report.
 * <p>
 * The report contains an executive summary, a section per domain with the findings grouped by severity,
 * the collector errors and a remediation section with the recommendation for every rule that produced a finding.
 */
public class MarkdownReportWriter {
    private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(MarkdownReportWriter.class);

    private final Map<String, String> _remediations;
    private final RecommendationEnricher _enricher;
    private final Clock _clock;

    /**
     * @param remediations The canonical recommendation per rule identifier, in rule order.
     * @param enricher     An optional recommendation enricher.
     * @param clock        The clock used for the report timestamp.
     */
    public MarkdownReportWriter(@NotNull Map<String, String> remediations,
                                @Nullable RecommendationEnricher enricher,
                                @NotNull Clock clock) {
        _remediations = Collections.unmodifiableMap(new LinkedHashMap<>(remediations));
        _enricher = enricher;
        _clock = clock;
    }

    public MarkdownReportWriter(@NotNull Map<String, String> remediations) {
        this(remediations, null, Clock.systemUTC());
    }

    public @NotNull String render(@NotNull BatchResult batch) {
        final var out = new StringBuilder();
        out.append("# ZoneGuard security report\n\n");
        out.append("Generated at ").append(Instant.now(_clock)).append(".\n\n");

        writeSummary(out, batch);
        for (var result : batch.results().values()) {
            writeDomain(out, result);
        }
        writeRemediation(out, batch);

        return out.toString();
    }

    /**
     * Writes the report into a file, replacing it if it exists.
     *
     * @throws IOException if the file cannot be written.
     */
    public void write(@NotNull BatchResult batch, @NotNull Path target) throws IOException {
        final var parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, render(batch), StandardCharsets.UTF_8);
    }

    private static void writeSummary(StringBuilder out, BatchResult batch) {
        final var summary = batch.summary();
        out.append("## Executive summary\n\n");
        out.append("Scanned ").append(summary.totalDomains()).append(" domains: ")
                .append(summary.domainsOk()).append(" complete, ")
                .append(summary.domainsPartial()).append(" partial, ")
                .append(summary.domainsFailed()).append(" failed.\n\n");

        if (batch.cancelled()) {
            out.append("**The scan was cancelled.** ");
            if (!batch.skipped().isEmpty()) {
                out.append("Not scanned: ").append(String.join(", ", batch.skipped())).append('.');
            }
            out.append("\n\n");
        }

        out.append("| Severity | Findings |\n");
        out.append("|----------|----------|\n");
        out.append("| CRITICAL | ").append(summary.criticalCount()).append(" |\n");
        out.append("| WARNING | ").append(summary.warningCount()).append(" |\n");
        out.append("| INFO | ").append(summary.infoCount()).append(" |\n\n");
    }

    private static void writeDomain(StringBuilder out, DomainScanResult result) {
        out.append("## ").append(result.domain()).append("\n\n");
        out.append("Status: **").append(result.status()).append("**, collected at ")
                .append(result.snapshot().collectedAt()).append(".\n\n");

        if (result.findings().isEmpty()) {
            out.append("No findings.\n\n");
        }

        for (var severity : Severity.values()) {
            final var findings = result.findings().stream()
                    .filter(finding -> finding.severity() == severity)
                    .toList();
            if (findings.isEmpty())
                continue;

            out.append("### ").append(severity).append("\n\n");
            out.append("| Rule | Finding | Details | Evidence |\n");
            out.append("|------|---------|---------|----------|\n");
            for (var finding : findings) {
                out.append("| ").append(cell(finding.ruleId()))
                        .append(" | ").append(cell(finding.title()))
                        .append(" | ").append(cell(finding.description()))
                        .append(" | ").append(cell(evidenceOf(finding)))
                        .append(" |\n");
            }
            out.append('\n');
        }

        if (!result.errors().isEmpty()) {
            out.append("### Errors\n\n");
            for (var error : result.errors()) {
                out.append("- ").append(error.collector()).append(": ")
                        .append(ResultCodes.nameOf(error.code()));
                if (error.message() != null) {
                    out.append(" (").append(error.message()).append(')');
                }
                out.append('\n');
            }
            out.append('\n');
        }
    }

    private void writeRemediation(StringBuilder out, BatchResult batch) {
        final var fired = new LinkedHashSet<String>();
        batch.results().values().forEach(result -> result.findings().forEach(f -> fired.add(f.ruleId())));
        if (fired.isEmpty())
            return;

        // Keep the rule order, unknown rules go last
        final var recommendations = new LinkedHashMap<String, String>();
        _remediations.forEach((ruleId, text) -> {
            if (fired.contains(ruleId)) {
                recommendations.put(ruleId, text);
            }
        });
        fired.forEach(ruleId -> recommendations.putIfAbsent(ruleId, "No recommendation available."));

        if (_enricher != null) {
            try {
                final var enriched = _enricher.enrich(batch, Collections.unmodifiableMap(recommendations));
                enriched.forEach((ruleId, text) -> {
                    if (recommendations.containsKey(ruleId) && text != null && !text.isBlank()) {
                        recommendations.put(ruleId, text);
                    }
                });
            } catch (RuntimeException e) {
                Logger.warn("The recommendation enricher failed, using the canonical recommendations", e);
            }
        }

        out.append("## Remediation\n\n");
        recommendations.forEach((ruleId, text) ->
                out.append("- **").append(ruleId).append("**: ").append(text).append('\n'));
        out.append('\n');
    }

    private static String evidenceOf(Finding finding) {
        return finding.evidence().stream()
                .map(evidence -> evidence.value().isEmpty()
                        ? evidence.field() + " (none)"
                        : evidence.field() + " = " + evidence.value())
                .collect(Collectors.joining("; "));
    }

    private static String cell(String text) {
        return text.replace("|", "\\|").replaceAll("\\R", " ");
    }
}
