package cz.vut.fit.zoneguard.standalone.scanner;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import cz.vut.fit.zoneguard.Common;
import cz.vut.fit.zoneguard.ScanSettings;
import cz.vut.fit.zoneguard.errors.CollectorException;
import cz.vut.fit.zoneguard.errors.ConfigurationException;
import cz.vut.fit.zoneguard.errors.DNSLookupException;
import cz.vut.fit.zoneguard.errors.WhoisLookupException;
import cz.vut.fit.zoneguard.models.DomainSnapshot;
import cz.vut.fit.zoneguard.models.ResultCodes;
import cz.vut.fit.zoneguard.models.ScanStatus;
import cz.vut.fit.zoneguard.models.dns.DNSRecords;
import cz.vut.fit.zoneguard.models.findings.Finding;
import cz.vut.fit.zoneguard.models.results.BatchResult;
import cz.vut.fit.zoneguard.models.results.CollectorError;
import cz.vut.fit.zoneguard.models.results.DomainScanResult;
import cz.vut.fit.zoneguard.models.whois.WhoisRecord;
import cz.vut.fit.zoneguard.standalone.collectors.Collector;
import cz.vut.fit.zoneguard.standalone.rules.RuleEngine;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.Function;

/**
 * Scans batches of domains: collects the DNS and WHOIS data of each domain, classifies it with the rule engine and
 * collects the per-domain results in the order the domains were given.
 * <p>
 * Each domain is scanned by a single task on a fixed-size worker pool. A failed collector call only marks its domain
 * as partial or failed; the batch always continues.
 */
public class DomainScanner implements Closeable {
    private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(DomainScanner.class);

    /**
     * The collector name of the errors that are not caused by a collector.
     */
    public static final String SCANNER = "scanner";

    private final Collector<DNSRecords, DNSLookupException> _dnsCollector;
    private final Collector<WhoisRecord, WhoisLookupException> _whoisCollector;
    private final Function<ScanSettings, RuleEngine> _ruleEngineFactory;
    private final Clock _clock;

    public DomainScanner(@NotNull Collector<DNSRecords, DNSLookupException> dnsCollector,
                         @NotNull Collector<WhoisRecord, WhoisLookupException> whoisCollector) {
        this(dnsCollector, whoisCollector, RuleEngine::withDefaultRules, Clock.systemUTC());
    }

    /**
     * @param dnsCollector      The DNS collector.
     * @param whoisCollector    The WHOIS collector.
     * @param ruleEngineFactory Creates the rule engine for the settings of a batch.
     * @param clock             The clock that timestamps the snapshots.
     */
    public DomainScanner(@NotNull Collector<DNSRecords, DNSLookupException> dnsCollector,
                         @NotNull Collector<WhoisRecord, WhoisLookupException> whoisCollector,
                         @NotNull Function<ScanSettings, RuleEngine> ruleEngineFactory,
                         @NotNull Clock clock) {
        _dnsCollector = Objects.requireNonNull(dnsCollector);
        _whoisCollector = Objects.requireNonNull(whoisCollector);
        _ruleEngineFactory = Objects.requireNonNull(ruleEngineFactory);
        _clock = Objects.requireNonNull(clock);
    }

    /**
     * Scans the domains and waits for the result.
     *
     * @param domains  The domain names.
     * @param settings The scan settings.
     * @return The batch result.
     * @throws ConfigurationException if the settings or any of the domain names are invalid. Nothing is scanned then.
     * @see #start(List, ScanSettings)
     */
    public @NotNull BatchResult scan(@NotNull List<String> domains, @NotNull ScanSettings settings)
            throws ConfigurationException {
        return start(domains, settings).await();
    }

    /**
     * Validates the input and starts scanning the domains in the background.
     * <p>
     * The domain names are normalized (trimmed, lower-cased, without the trailing dot); a name that appears again
     * after normalization is scanned only once, at its first position.
     *
     * @param domains  The domain names.
     * @param settings The scan settings.
     * @return The handle of the running batch.
     * @throws ConfigurationException if the settings or any of the domain names are invalid. Nothing is scanned then.
     */
    public @NotNull ScanHandle start(@NotNull List<String> domains, @NotNull ScanSettings settings)
            throws ConfigurationException {
        settings.validate();
        final var toScan = normalizeDomains(domains);
        final var ruleEngine = _ruleEngineFactory.apply(settings);

        final var executor = Executors.newFixedThreadPool(settings.threadCount(), new ThreadFactoryBuilder()
                .setNameFormat("zoneguard-scan-%d")
                .build());
        final var slots = new AtomicReferenceArray<DomainScanResult>(toScan.size());

        Logger.info("Scanning {} domains using {} threads", toScan.size(), settings.threadCount());
        for (var i = 0; i < toScan.size(); i++) {
            final var index = i;
            final var domain = toScan.get(i);
            executor.execute(() -> {
                try {
                    slots.set(index, scanDomain(domain, settings.perDomainTimeout(), ruleEngine));
                } catch (InterruptedException e) {
                    Logger.debug("Scan of {} cancelled", domain);
                } catch (RuntimeException e) {
                    Logger.error("Unexpected failure when scanning {}", domain, e);
                    slots.set(index, internalFailure(domain, e));
                }
            });
        }
        executor.shutdown();

        return new ScanHandle(toScan, executor, slots);
    }

    /**
     * Scans a single domain. Both collectors are always called; the rules are only evaluated if at least one
     * of them succeeded.
     */
    DomainScanResult scanDomain(String domain, Duration timeout, RuleEngine ruleEngine) throws InterruptedException {
        Logger.debug("Scanning {}", domain);
        final var collectedAt = Instant.now(_clock);
        final var errors = new ArrayList<CollectorError>();

        final var dns = collect(_dnsCollector, domain, timeout, errors);
        final var whois = collect(_whoisCollector, domain, timeout, errors);
        final var snapshot = new DomainSnapshot(domain, collectedAt, dns, whois);

        final ScanStatus status;
        final List<Finding> findings;
        if (snapshot.isEmpty()) {
            status = ScanStatus.FAILED;
            findings = List.of();
        } else {
            status = errors.isEmpty() ? ScanStatus.OK : ScanStatus.PARTIAL;
            findings = ruleEngine.evaluate(snapshot);
        }

        Logger.debug("Scanned {}: {}, {} findings", domain, status, findings.size());
        return new DomainScanResult(domain, snapshot, findings, status, errors);
    }

    /**
     * The result of a domain whose scan task failed outside the collectors.
     */
    DomainScanResult internalFailure(String domain, RuntimeException e) {
        final var error = new CollectorError(SCANNER, domain, ResultCodes.INTERNAL_ERROR,
                e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        return new DomainScanResult(domain, new DomainSnapshot(domain, Instant.now(_clock), null, null),
                List.of(), ScanStatus.FAILED, List.of(error));
    }

    private static <T, E extends CollectorException> @Nullable T collect(Collector<T, E> collector, String domain,
                                                                         Duration timeout,
                                                                         List<CollectorError> errors)
            throws InterruptedException {
        try {
            return collector.collect(domain, timeout);
        } catch (CollectorException e) {
            Logger.debug("Collector {} failed for {}: {}", collector.getName(), domain, e.getMessage());
            errors.add(e.toCollectorError());
        } catch (RuntimeException e) {
            Logger.warn("Unexpected error in collector {} for {}", collector.getName(), domain, e);
            errors.add(new CollectorError(collector.getName(), domain, ResultCodes.INTERNAL_ERROR,
                    e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage()));
        }
        return null;
    }

    static List<String> normalizeDomains(@Nullable List<String> domains) throws ConfigurationException {
        if (domains == null || domains.isEmpty())
            throw new ConfigurationException("No domains to scan");

        final var unique = new LinkedHashSet<String>();
        for (var raw : domains) {
            final var domain = Common.normalizeName(raw);
            if (!Common.isScannableDomainName(domain))
                throw new ConfigurationException("Invalid domain name: '" + raw + "'");

            if (!unique.add(domain)) {
                Logger.info("Domain {} is listed more than once, scanning it once", domain);
            }
        }

        return List.copyOf(unique);
    }

    @Override
    public void close() throws IOException {
        try {
            _dnsCollector.close();
        } finally {
            _whoisCollector.close();
        }
    }
}
