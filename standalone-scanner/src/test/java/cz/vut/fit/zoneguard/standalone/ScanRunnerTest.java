package cz.vut.fit.zoneguard.standalone;

import com.fasterxml.jackson.databind.ObjectMapper;
import cz.vut.fit.zoneguard.ScannerConfig;
import cz.vut.fit.zoneguard.errors.DNSLookupException;
import cz.vut.fit.zoneguard.errors.WhoisLookupException;
import cz.vut.fit.zoneguard.models.DomainSnapshot;
import cz.vut.fit.zoneguard.models.ResultCodes;
import cz.vut.fit.zoneguard.models.ScanStatus;
import cz.vut.fit.zoneguard.models.dns.DNSRecords;
import cz.vut.fit.zoneguard.models.results.BatchResult;
import cz.vut.fit.zoneguard.models.results.DomainScanResult;
import cz.vut.fit.zoneguard.models.whois.WhoisRecord;
import cz.vut.fit.zoneguard.standalone.collectors.Collector;
import cz.vut.fit.zoneguard.standalone.scanner.DomainScanner;
import cz.vut.fit.zoneguard.standalone.scanner.ReportAggregator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static cz.vut.fit.zoneguard.standalone.rules.SnapshotFixtures.healthyDns;
import static cz.vut.fit.zoneguard.standalone.rules.SnapshotFixtures.whois;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
public class ScanRunnerTest {
    @Mock
    private Collector<DNSRecords, DNSLookupException> dnsCollector;
    @Mock
    private Collector<WhoisRecord, WhoisLookupException> whoisCollector;

    private final ByteArrayOutputStream output = new ByteArrayOutputStream();
    private final AtomicInteger scannersCreated = new AtomicInteger();

    @BeforeEach
    void setUp() throws Exception {
        when(dnsCollector.getName()).thenReturn("dns");
        when(whoisCollector.getName()).thenReturn("whois");
        when(dnsCollector.collect(anyString(), any())).thenReturn(healthyDns().build());
        when(whoisCollector.collect(anyString(), any())).thenReturn(whois(LocalDate.now().plusDays(400)));
    }

    private int run(String... args) {
        final var out = new PrintStream(output, true, StandardCharsets.UTF_8);
        return ScanRunner.run(args, properties -> {
            scannersCreated.incrementAndGet();
            return new DomainScanner(dnsCollector, whoisCollector);
        }, out);
    }

    private String output() {
        return output.toString(StandardCharsets.UTF_8);
    }

    @Test
    void printsHelp() {
        assertEquals(ScanRunner.EXIT_OK, run("--help"));
        assertTrue(output().contains("zoneguard -d <domain[,domain...]> [options]"));
        assertTrue(output().contains("--json-out"));
        assertEquals(0, scannersCreated.get());
    }

    @Test
    void missingDomainsIsConfigurationError() {
        assertEquals(ScanRunner.EXIT_CONFIGURATION_ERROR, run("-t", "2"));
        assertTrue(output().contains("usage"));
        assertEquals(0, scannersCreated.get());
    }

    @Test
    void invalidThreadCountIsConfigurationError() {
        assertEquals(ScanRunner.EXIT_CONFIGURATION_ERROR, run("-d", "example.com", "-t", "many"));
        assertEquals(ScanRunner.EXIT_CONFIGURATION_ERROR, run("-d", "example.com", "-t", "0"));
        assertEquals(0, scannersCreated.get());
    }

    @Test
    void optionOverridesAreValidated() {
        assertEquals(ScanRunner.EXIT_CONFIGURATION_ERROR,
                run("-d", "example.com", "-o", ScannerConfig.THREADS_CONFIG + "=0"));
    }

    @Test
    void unreadablePropertiesFileIsConfigurationError(@TempDir Path tempDir) {
        assertEquals(ScanRunner.EXIT_CONFIGURATION_ERROR,
                run("-d", "example.com", "-p", tempDir.resolve("missing.properties").toString()));
    }

    @Test
    void propertiesFileIsLoaded(@TempDir Path tempDir) throws Exception {
        final var file = tempDir.resolve("scanner.properties");
        Files.writeString(file, ScannerConfig.TIMEOUT_PER_DOMAIN_MS_CONFIG + "=-1\n");

        assertEquals(ScanRunner.EXIT_CONFIGURATION_ERROR, run("-d", "example.com", "-p", file.toString()));
    }

    @Test
    void invalidDomainIsConfigurationError() throws Exception {
        assertEquals(ScanRunner.EXIT_CONFIGURATION_ERROR, run("-d", "example.com,not a domain"));

        verify(dnsCollector, never()).collect(anyString(), any());
        verify(dnsCollector).close();
        verify(whoisCollector).close();
    }

    @Test
    void printsJsonReportWithoutOutputFiles() throws Exception {
        assertEquals(ScanRunner.EXIT_OK, run("-d", "example.com,example.org", "-t", "2"));

        final var json = new ObjectMapper().readTree(output());
        assertEquals("OK", json.get("domains").get("example.com").get("status").asText());
        assertEquals(2, json.get("summary").get("domains_ok").asInt());
        verify(dnsCollector).close();
    }

    @Test
    void writesBothReports(@TempDir Path tempDir) throws Exception {
        final var jsonPath = tempDir.resolve("out").resolve("report.json");
        final var reportPath = tempDir.resolve("out").resolve("report.md");

        assertEquals(ScanRunner.EXIT_OK, run("-d", "example.com", "--timeout", "3000",
                "-j", jsonPath.toString(), "-r", reportPath.toString()));

        final var json = new ObjectMapper().readTree(jsonPath.toFile());
        assertTrue(json.get("domains").has("example.com"));
        assertTrue(Files.readString(reportPath).startsWith("# ZoneGuard security report"));
        assertEquals("", output());
        verify(dnsCollector).collect("example.com", Duration.ofMillis(3000));
    }

    @Test
    void allDomainsFailing() throws Exception {
        when(dnsCollector.collect(anyString(), any()))
                .thenThrow(new DNSLookupException("example.com", ResultCodes.NOT_FOUND, "NXDOMAIN"));
        when(whoisCollector.collect(anyString(), any()))
                .thenThrow(new WhoisLookupException("example.com", ResultCodes.NOT_FOUND, "No match"));

        assertEquals(ScanRunner.EXIT_ALL_FAILED, run("-d", "example.com"));
    }

    @Test
    void partialResultIsSuccess() throws Exception {
        when(whoisCollector.collect(anyString(), any()))
                .thenThrow(new WhoisLookupException("example.com", ResultCodes.TIMEOUT, "Timed out"));

        assertEquals(ScanRunner.EXIT_OK, run("-d", "example.com"));
    }

    @Test
    void unwritableReportIsReportError(@TempDir Path tempDir) throws Exception {
        final var blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "not a directory");

        assertEquals(ScanRunner.EXIT_REPORT_ERROR,
                run("-d", "example.com", "-j", blocker.resolve("report.json").toString()));
    }

    private static DomainScanResult result(String domain, ScanStatus status) {
        return new DomainScanResult(domain, new DomainSnapshot(domain, Instant.EPOCH, null, null), List.of(),
                status, List.of());
    }

    private static BatchResult batch(boolean cancelled, DomainScanResult... results) {
        final Map<String, DomainScanResult> map = new LinkedHashMap<>();
        for (var result : results) {
            map.put(result.domain(), result);
        }
        return new BatchResult(map, ReportAggregator.aggregate(map.values()), List.of(), cancelled);
    }

    @Test
    void exitCodeFollowsDomainStatuses() {
        assertEquals(ScanRunner.EXIT_OK, ScanRunner.exitCodeFor(batch(false,
                result("a.com", ScanStatus.FAILED), result("b.com", ScanStatus.PARTIAL))));
        assertEquals(ScanRunner.EXIT_ALL_FAILED, ScanRunner.exitCodeFor(batch(false,
                result("a.com", ScanStatus.FAILED), result("b.com", ScanStatus.FAILED))));
        assertEquals(ScanRunner.EXIT_OK, ScanRunner.exitCodeFor(batch(true, result("a.com", ScanStatus.OK))));
        assertEquals(ScanRunner.EXIT_CANCELLED, ScanRunner.exitCodeFor(batch(true)));
        assertEquals(ScanRunner.EXIT_ALL_FAILED, ScanRunner.exitCodeFor(batch(false)));
    }
}
