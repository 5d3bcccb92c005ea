package cz.vut.fit.zoneguard.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import cz.vut.fit.zoneguard.Common;
import cz.vut.fit.zoneguard.models.ResultCodes;
import cz.vut.fit.zoneguard.models.dns.DNSRecords;
import cz.vut.fit.zoneguard.models.findings.Finding;
import cz.vut.fit.zoneguard.models.results.BatchResult;
import cz.vut.fit.zoneguard.models.results.BatchSummary;
import cz.vut.fit.zoneguard.models.results.DomainScanResult;
import cz.vut.fit.zoneguard.models.whois.WhoisRecord;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Serializes a {@link BatchResult} into the machine-readable JSON report.
 * <p>
 * The document has the top-level keys {@code generated_at}, {@code cancelled}, {@code skipped}, {@code summary}
 * and {@code domains}. The {@code domains} object maps each domain, in scan request order, to its
 * {@code status}, {@code collected_at}, {@code dns}, {@code whois}, {@code findings} and {@code errors}.
 * Absent DNS or WHOIS data is written as {@code null}.
 */
public class JsonReportSerializer {
    protected final ObjectMapper _objectMapper;
    private final Clock _clock;

    public JsonReportSerializer() {
        this(Common.makeMapper().build(), Clock.systemUTC());
    }

    public JsonReportSerializer(@NotNull ObjectMapper objectMapper, @NotNull Clock clock) {
        _objectMapper = objectMapper;
        _clock = clock;
    }

    /**
     * Builds the report as a JSON tree.
     *
     * @param batch The batch result.
     * @return The report root node.
     */
    public @NotNull ObjectNode toTree(@NotNull BatchResult batch) {
        final var root = _objectMapper.createObjectNode();
        root.put("generated_at", Instant.now(_clock).toString());
        root.put("cancelled", batch.cancelled());
        writeStrings(root.putArray("skipped"), batch.skipped());
        writeSummary(root.putObject("summary"), batch.summary());

        final var domains = root.putObject("domains");
        for (var entry : batch.results().entrySet()) {
            writeDomain(domains.putObject(entry.getKey()), entry.getValue());
        }

        return root;
    }

    /**
     * Serializes the report into pretty-printed UTF-8 JSON.
     *
     * @param batch The batch result.
     * @return The JSON bytes.
     */
    public byte[] serialize(@NotNull BatchResult batch) {
        try {
            return _objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValueAsBytes(toTree(batch));
        } catch (JsonProcessingException e) {
            // Only plain tree nodes are written
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Writes the report into a file, replacing it if it exists.
     *
     * @param batch  The batch result.
     * @param target The target file.
     * @throws IOException if the file cannot be written.
     */
    public void write(@NotNull BatchResult batch, @NotNull Path target) throws IOException {
        final var parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(target, serialize(batch));
    }

    private static void writeSummary(ObjectNode node, BatchSummary summary) {
        node.put("critical_count", summary.criticalCount());
        node.put("warning_count", summary.warningCount());
        node.put("info_count", summary.infoCount());
        node.put("domains_ok", summary.domainsOk());
        node.put("domains_partial", summary.domainsPartial());
        node.put("domains_failed", summary.domainsFailed());
    }

    private static void writeDomain(ObjectNode node, DomainScanResult result) {
        node.put("status", result.status().name());
        node.put("collected_at", result.snapshot().collectedAt().toString());
        writeDns(node, result.snapshot().dns());
        writeWhois(node, result.snapshot().whois());

        final var findings = node.putArray("findings");
        for (var finding : result.findings()) {
            writeFinding(findings.addObject(), finding);
        }

        final var errors = node.putArray("errors");
        for (var error : result.errors()) {
            errors.addObject()
                    .put("collector", error.collector())
                    .put("code", ResultCodes.nameOf(error.code()))
                    .put("message", error.message());
        }
    }

    private static void writeDns(ObjectNode parent, @Nullable DNSRecords dns) {
        if (dns == null) {
            parent.putNull("dns");
            return;
        }

        final var node = parent.putObject("dns");
        for (var entry : dns.records().entrySet()) {
            writeStrings(node.putArray(entry.getKey()), entry.getValue());
        }

        // Named after the evidence fields that point here
        final var relatedIps = node.putObject("relatedIps");
        for (var entry : dns.relatedIps().entrySet()) {
            writeStrings(relatedIps.putArray(entry.getKey()), entry.getValue());
        }
        writeStrings(node.putArray("zoneTransferServers"), dns.zoneTransferServers());
    }

    private static void writeWhois(ObjectNode parent, @Nullable WhoisRecord whois) {
        if (whois == null) {
            parent.putNull("whois");
            return;
        }

        final var node = parent.putObject("whois");
        node.put("registrar", whois.registrar());
        node.put("created", whois.created() == null ? null : whois.created().toString());
        node.put("expires", whois.expires().toString());
        node.put("privacy_protected", whois.privacyProtected());
        writeStrings(node.putArray("name_servers"), whois.nameServers());
    }

    private static void writeFinding(ObjectNode node, Finding finding) {
        node.put("rule_id", finding.ruleId());
        node.put("severity", finding.severity().name());
        node.put("title", finding.title());
        node.put("description", finding.description());

        final var evidence = node.putArray("evidence");
        for (var item : finding.evidence()) {
            evidence.addObject()
                    .put("field", item.field())
                    .put("value", item.value());
        }
    }

    private static void writeStrings(ArrayNode node, List<String> values) {
        values.forEach(node::add);
    }
}
