package cz.vut.fit.zoneguard.serialization;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import cz.vut.fit.zoneguard.Common;
import cz.vut.fit.zoneguard.models.DomainSnapshot;
import cz.vut.fit.zoneguard.models.ResultCodes;
import cz.vut.fit.zoneguard.models.ScanStatus;
import cz.vut.fit.zoneguard.models.Severity;
import cz.vut.fit.zoneguard.models.dns.DNSRecords;
import cz.vut.fit.zoneguard.models.findings.Evidence;
import cz.vut.fit.zoneguard.models.findings.Finding;
import cz.vut.fit.zoneguard.models.results.BatchResult;
import cz.vut.fit.zoneguard.models.results.BatchSummary;
import cz.vut.fit.zoneguard.models.results.CollectorError;
import cz.vut.fit.zoneguard.models.results.DomainScanResult;
import cz.vut.fit.zoneguard.models.whois.WhoisRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonReportSerializerTest {
    private static final Instant NOW = Instant.parse("2026-10-19T08:00:00Z");

    private final ObjectMapper mapper = Common.makeMapper().build();
    private JsonReportSerializer serializer;

    @BeforeEach
    void setUp() {
        serializer = new JsonReportSerializer(mapper, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static BatchResult sampleBatch() {
        var dns = new DNSRecords(
                Map.of(DNSRecords.A, List.of("192.0.2.1"), DNSRecords.TXT, List.of(),
                        DNSRecords.CNAME, List.of("gone.example-cloud.net")),
                Map.of("gone.example-cloud.net", List.of(), "ns1.example.com", List.of("192.0.2.53")),
                List.of("ns1.example.com"));
        var whois = new WhoisRecord("Example Registrar, Inc.", LocalDate.of(2001, 3, 4),
                LocalDate.of(2026, 11, 1), List.of("ns1.example.com", "ns2.example.com"), false,
                "whois.example-registry.com");
        var okSnapshot = new DomainSnapshot("example.com", NOW, dns, whois);
        var finding = new Finding("spf_policy", Severity.WARNING, "SPF record missing",
                "No SPF record was found.", List.of(new Evidence("dns.TXT", "")));

        var failedSnapshot = new DomainSnapshot("broken.org", NOW, null, null);
        var errors = List.of(
                new CollectorError("dns", "broken.org", ResultCodes.NOT_FOUND, "NXDOMAIN"),
                new CollectorError("whois", "broken.org", ResultCodes.TIMEOUT, "Timed out"));

        var results = new LinkedHashMap<String, DomainScanResult>();
        results.put("example.com", new DomainScanResult("example.com", okSnapshot, List.of(finding),
                ScanStatus.OK, List.of()));
        results.put("broken.org", new DomainScanResult("broken.org", failedSnapshot, List.of(),
                ScanStatus.FAILED, errors));

        return new BatchResult(results, new BatchSummary(0, 1, 0, 1, 0, 1), List.of("late.net"), true);
    }

    @Test
    void writesTopLevelBlocks() {
        JsonNode root = serializer.toTree(sampleBatch());

        assertEquals(NOW.toString(), root.get("generated_at").asText());
        assertTrue(root.get("cancelled").asBoolean());
        assertEquals("late.net", root.get("skipped").get(0).asText());

        var summary = root.get("summary");
        assertEquals(0, summary.get("critical_count").asInt());
        assertEquals(1, summary.get("warning_count").asInt());
        assertEquals(0, summary.get("info_count").asInt());
        assertEquals(1, summary.get("domains_ok").asInt());
        assertEquals(0, summary.get("domains_partial").asInt());
        assertEquals(1, summary.get("domains_failed").asInt());
    }

    @Test
    void keepsDomainOrder() {
        var names = new ArrayList<String>();
        serializer.toTree(sampleBatch()).get("domains").fieldNames().forEachRemaining(names::add);
        assertEquals(List.of("example.com", "broken.org"), names);
    }

    @Test
    void writesDomainDetails() {
        var domain = serializer.toTree(sampleBatch()).get("domains").get("example.com");

        assertEquals("OK", domain.get("status").asText());
        assertEquals("192.0.2.1", domain.get("dns").get("A").get(0).asText());
        assertTrue(domain.get("dns").get("TXT").isArray());
        assertEquals(0, domain.get("dns").get("TXT").size());

        var whois = domain.get("whois");
        assertEquals("Example Registrar, Inc.", whois.get("registrar").asText());
        assertEquals("2001-03-04", whois.get("created").asText());
        assertEquals("2026-11-01", whois.get("expires").asText());
        assertFalse(whois.get("privacy_protected").asBoolean());
        assertEquals(2, whois.get("name_servers").size());

        var finding = domain.get("findings").get(0);
        assertEquals("spf_policy", finding.get("rule_id").asText());
        assertEquals("WARNING", finding.get("severity").asText());
        assertEquals("dns.TXT", finding.get("evidence").get(0).get("field").asText());
    }

    @Test
    void writesEvidenceTargetsOfDnsFindings() {
        var dns = serializer.toTree(sampleBatch()).get("domains").get("example.com").get("dns");

        var relatedIps = dns.get("relatedIps");
        assertTrue(relatedIps.get("gone.example-cloud.net").isArray());
        assertEquals(0, relatedIps.get("gone.example-cloud.net").size());
        assertEquals("192.0.2.53", relatedIps.get("ns1.example.com").get(0).asText());
        assertEquals(1, dns.get("zoneTransferServers").size());
        assertEquals("ns1.example.com", dns.get("zoneTransferServers").get(0).asText());
    }

    @Test
    void writesAbsentDataAsNullAndErrors() {
        var domain = serializer.toTree(sampleBatch()).get("domains").get("broken.org");

        assertEquals("FAILED", domain.get("status").asText());
        assertTrue(domain.get("dns").isNull());
        assertTrue(domain.get("whois").isNull());
        assertEquals(0, domain.get("findings").size());
        assertEquals("NOT_FOUND", domain.get("errors").get(0).get("code").asText());
        assertEquals("whois", domain.get("errors").get(1).get("collector").asText());
    }

    @Test
    void writesReadableFile(@TempDir Path dir) throws Exception {
        var target = dir.resolve("reports").resolve("report.json");
        serializer.write(sampleBatch(), target);

        assertTrue(Files.exists(target));
        var parsed = mapper.readTree(target.toFile());
        assertEquals(2, parsed.get("domains").size());
    }
}
