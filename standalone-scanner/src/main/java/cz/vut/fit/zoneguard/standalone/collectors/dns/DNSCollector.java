package cz.vut.fit.zoneguard.standalone.collectors.dns;

import com.google.common.net.InetAddresses;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import cz.vut.fit.zoneguard.Common;
import cz.vut.fit.zoneguard.ScannerConfig;
import cz.vut.fit.zoneguard.errors.ConfigurationException;
import cz.vut.fit.zoneguard.errors.DNSLookupException;
import cz.vut.fit.zoneguard.models.ResultCodes;
import cz.vut.fit.zoneguard.models.dns.DNSRecords;
import cz.vut.fit.zoneguard.standalone.collectors.Collector;
import org.jetbrains.annotations.NotNull;
import org.slf4j.LoggerFactory;
import org.xbill.DNS.AAAARecord;
import org.xbill.DNS.ARecord;
import org.xbill.DNS.CNAMERecord;
import org.xbill.DNS.ExtendedResolver;
import org.xbill.DNS.MXRecord;
import org.xbill.DNS.NSRecord;
import org.xbill.DNS.Name;
import org.xbill.DNS.Record;
import org.xbill.DNS.TXTRecord;
import org.xbill.DNS.TextParseException;
import org.xbill.DNS.Type;
import org.xbill.DNS.lookup.LookupSession;

import java.io.IOException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Collects the DNS records of a domain: the apex records of all {@link DNSRecords#APEX_TYPES}, the DMARC and DKIM
 * TXT records, the addresses of the CNAME, MX and NS targets and the list of name servers that allow zone transfers.
 */
public class DNSCollector implements Collector<DNSRecords, DNSLookupException> {
    private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(DNSCollector.class);

    public static final String NAME = DNSLookupException.COLLECTOR;

    private final RecordLookup _lookup;
    private final ZoneTransferProbe _zoneTransferProbe;
    private final List<String> _dkimSelectors;
    private final boolean _axfrEnabled;
    private final Duration _axfrTimeout;
    private final ExecutorService _executor;

    /**
     * @param lookup            The DNS query implementation.
     * @param zoneTransferProbe The zone transfer probe.
     * @param dkimSelectors     The DKIM selectors to look up.
     * @param axfrEnabled       Whether the name servers are probed for zone transfers.
     * @param axfrTimeout       The timeout of a single zone transfer attempt.
     * @param executor          The executor that runs the zone transfer probes. It is shut down by {@link #close()}.
     */
    public DNSCollector(@NotNull RecordLookup lookup,
                        @NotNull ZoneTransferProbe zoneTransferProbe,
                        @NotNull List<String> dkimSelectors,
                        boolean axfrEnabled,
                        @NotNull Duration axfrTimeout,
                        @NotNull ExecutorService executor) {
        _lookup = Objects.requireNonNull(lookup);
        _zoneTransferProbe = Objects.requireNonNull(zoneTransferProbe);
        _dkimSelectors = List.copyOf(dkimSelectors);
        _axfrEnabled = axfrEnabled;
        _axfrTimeout = Objects.requireNonNull(axfrTimeout);
        _executor = Objects.requireNonNull(executor);
    }

    /**
     * Creates a collector that queries the resolvers configured in the properties.
     *
     * @param properties The configuration properties, see {@link ScannerConfig}.
     * @return The collector.
     * @throws ConfigurationException if a value is invalid.
     */
    public static DNSCollector fromProperties(@NotNull Properties properties) throws ConfigurationException {
        final var resolver = makeMainResolver(properties);

        final List<String> selectors = Arrays.stream(properties.getProperty(ScannerConfig.DNS_DKIM_SELECTORS_CONFIG,
                        ScannerConfig.DNS_DKIM_SELECTORS_DEFAULT).split(","))
                .map(String::trim)
                .filter(selector -> !selector.isEmpty())
                .toList();
        final var axfrEnabled = Boolean.parseBoolean(properties.getProperty(ScannerConfig.DNS_AXFR_ENABLED_CONFIG,
                ScannerConfig.DNS_AXFR_ENABLED_DEFAULT).trim());
        final var axfrTimeout = Duration.ofMillis(parseInt(properties, ScannerConfig.DNS_AXFR_TIMEOUT_MS_CONFIG,
                ScannerConfig.DNS_AXFR_TIMEOUT_MS_DEFAULT));

        final var executor = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                .setNameFormat("zoneguard-dns-%d")
                .setDaemon(true)
                .build());
        final var session = LookupSession.builder()
                .resolver(resolver)
                .executor(executor)
                .build();

        return new DNSCollector(RecordLookup.of(session), ZoneTransferProbe.axfr(), selectors,
                axfrEnabled, axfrTimeout, executor);
    }

    /**
     * Creates the resolver that distributes the queries over the configured DNS servers.
     *
     * @param properties The configuration properties.
     * @return The resolver.
     * @throws ConfigurationException if a resolver address is invalid or a number cannot be parsed.
     */
    public static ExtendedResolver makeMainResolver(@NotNull Properties properties) throws ConfigurationException {
        final var dnsServers = Arrays.stream(properties.getProperty(ScannerConfig.DNS_MAIN_RESOLVER_IPS_CONFIG,
                        ScannerConfig.DNS_MAIN_RESOLVER_IPS_DEFAULT).split(","))
                .map(String::trim)
                .filter(ip -> !ip.isEmpty())
                .toArray(String[]::new);
        if (dnsServers.length == 0)
            throw new ConfigurationException("No DNS resolvers configured in " + ScannerConfig.DNS_MAIN_RESOLVER_IPS_CONFIG);

        for (var ip : dnsServers) {
            if (!InetAddresses.isInetAddress(ip))
                throw new ConfigurationException("Invalid DNS resolver address: '" + ip + "'");
        }

        final var randomize = Boolean.parseBoolean(properties.getProperty(
                ScannerConfig.DNS_MAIN_RESOLVER_RANDOMIZE_CONFIG, ScannerConfig.DNS_MAIN_RESOLVER_RANDOMIZE_DEFAULT));
        final var timeoutForEach = Duration.ofMillis(parseInt(properties,
                ScannerConfig.DNS_MAIN_RESOLVER_TIMEOUT_PER_NS_MS_CONFIG,
                ScannerConfig.DNS_MAIN_RESOLVER_TIMEOUT_PER_NS_MS_DEFAULT));
        final var retries = Math.max(1, parseInt(properties, ScannerConfig.DNS_MAIN_RESOLVER_RETRIES_CONFIG,
                ScannerConfig.DNS_MAIN_RESOLVER_RETRIES_DEFAULT));

        if (randomize) {
            Collections.shuffle(Arrays.asList(dnsServers));
        }

        final ExtendedResolver resolver;
        try {
            resolver = new ExtendedResolver(dnsServers);
        } catch (UnknownHostException e) {
            // Only IP literals get here
            throw new ConfigurationException("Invalid DNS resolver address", e);
        }

        for (var inResolver : resolver.getResolvers()) {
            inResolver.setTimeout(timeoutForEach);
        }

        resolver.setRetries(retries);
        resolver.setTimeout(timeoutForEach.multipliedBy((long) dnsServers.length * retries));
        resolver.setLoadBalance(Boolean.parseBoolean(properties.getProperty(
                ScannerConfig.DNS_MAIN_RESOLVER_ROUND_ROBIN_CONFIG, ScannerConfig.DNS_MAIN_RESOLVER_ROUND_ROBIN_DEFAULT)));

        return resolver;
    }

    @Override
    public @NotNull String getName() {
        return NAME;
    }

    @Override
    public @NotNull DNSRecords collect(@NotNull String domain, @NotNull Duration timeout)
            throws DNSLookupException, InterruptedException {
        final var lookups = new Lookups(domain, System.nanoTime() + timeout.toNanos());
        final var apex = toName(domain, domain);

        // Start all queries that only depend on the domain name
        final var apexStages = new LinkedHashMap<String, CompletableFuture<LookupAnswer>>();
        for (var type : DNSRecords.APEX_TYPES) {
            apexStages.put(type, lookups.start(apex, Type.value(type)));
        }
        final var dmarcStage = lookups.start(toName(domain, "_dmarc." + domain), Type.TXT);
        final var dkimStages = new LinkedHashMap<String, CompletableFuture<LookupAnswer>>();
        for (var selector : _dkimSelectors) {
            dkimStages.put(selector, lookups.start(toName(domain, selector + "._domainkey." + domain), Type.TXT));
        }

        final var apexRecords = new LinkedHashMap<String, List<Record>>();
        var nxdomain = false;
        for (var entry : apexStages.entrySet()) {
            final var answer = lookups.get(entry.getValue(), entry.getKey());
            nxdomain |= answer.nxdomain();

            final var type = Type.value(entry.getKey());
            apexRecords.put(entry.getKey(), answer.records().stream()
                    // Sanity check: you never know what the DNS returns
                    .filter(record -> record.getType() == type)
                    .filter(record -> record.getName().equals(apex))
                    .toList());
        }

        // An alias exists even when its target does not
        if (nxdomain && apexRecords.getOrDefault(DNSRecords.CNAME, List.of()).isEmpty()) {
            lookups.cancelAll();
            throw new DNSLookupException(domain, ResultCodes.NOT_FOUND, "The domain name does not exist");
        }

        final var records = new LinkedHashMap<String, List<String>>();
        apexRecords.forEach((type, typeRecords) -> records.put(type, formatValues(typeRecords)));
        records.put(DNSRecords.DMARC, txtValues(lookups.get(dmarcStage, "DMARC")));

        final var dkim = new ArrayList<String>();
        for (var entry : dkimStages.entrySet()) {
            for (var value : txtValues(lookups.get(entry.getValue(), "DKIM " + entry.getKey()))) {
                dkim.add(entry.getKey() + ": " + value);
            }
        }
        Collections.sort(dkim);
        records.put(DNSRecords.DKIM, dkim);

        final var relatedIps = resolveTargets(lookups, apexRecords);

        final var nameServers = records.get(DNSRecords.NS);
        final var zoneTransferServers = _axfrEnabled && !nameServers.isEmpty()
                ? probeZoneTransfers(lookups, apex, nameServers)
                : List.<String>of();

        Logger.debug("Collected DNS data of {}", domain);
        return new DNSRecords(records, relatedIps, zoneTransferServers);
    }

    @Override
    public void close() {
        _executor.shutdownNow();
    }

    /**
     * Resolves the A and AAAA records of every CNAME, MX and NS target.
     */
    private Map<String, List<String>> resolveTargets(Lookups lookups, Map<String, List<Record>> apexRecords)
            throws DNSLookupException, InterruptedException {
        final var targets = new TreeMap<String, Name>();
        for (var record : apexRecords.getOrDefault(DNSRecords.CNAME, List.of())) {
            addTarget(targets, ((CNAMERecord) record).getTarget());
        }
        for (var record : apexRecords.getOrDefault(DNSRecords.MX, List.of())) {
            addTarget(targets, ((MXRecord) record).getTarget());
        }
        for (var record : apexRecords.getOrDefault(DNSRecords.NS, List.of())) {
            addTarget(targets, ((NSRecord) record).getTarget());
        }

        final var stages = new LinkedHashMap<String, List<CompletableFuture<LookupAnswer>>>();
        targets.forEach((host, name) -> stages.put(host,
                List.of(lookups.start(name, Type.A), lookups.start(name, Type.AAAA))));

        final var relatedIps = new LinkedHashMap<String, List<String>>();
        for (var entry : stages.entrySet()) {
            final var addresses = new ArrayList<Record>();
            for (var stage : entry.getValue()) {
                // A target may be an alias itself, so the owner name is not checked here
                lookups.get(stage, "address of " + entry.getKey()).records().stream()
                        .filter(record -> record.getType() == Type.A || record.getType() == Type.AAAA)
                        .forEach(addresses::add);
            }
            relatedIps.put(entry.getKey(), formatValues(addresses));
        }

        return relatedIps;
    }

    private static void addTarget(Map<String, Name> targets, Name target) {
        // MX "." means the domain accepts no mail
        if (!target.equals(Name.root)) {
            targets.putIfAbsent(hostName(target), target);
        }
    }

    /**
     * Asks every name server for a zone transfer. Failed, refused or late attempts count as not allowed.
     */
    private List<String> probeZoneTransfers(Lookups lookups, Name apex, List<String> nameServers)
            throws InterruptedException {
        final var remaining = lookups.remaining();
        if (remaining.isZero()) {
            Logger.debug("Skipping the zone transfer probe of {}, no time left", lookups.domain());
            return List.of();
        }

        final var probeTimeout = remaining.compareTo(_axfrTimeout) < 0 ? remaining : _axfrTimeout;
        final var probes = new LinkedHashMap<String, CompletableFuture<Boolean>>();
        for (var nameServer : nameServers) {
            probes.put(nameServer, CompletableFuture.supplyAsync(
                    () -> _zoneTransferProbe.allowsTransfer(apex, nameServer, probeTimeout), _executor));
        }

        final var allowed = new ArrayList<String>();
        try {
            for (var entry : probes.entrySet()) {
                if (lookups.tryGet(entry.getValue(), entry.getKey())) {
                    allowed.add(entry.getKey());
                }
            }
        } finally {
            probes.values().forEach(probe -> probe.cancel(true));
        }

        if (!allowed.isEmpty()) {
            Logger.debug("Name servers of {} allow zone transfers: {}", lookups.domain(), allowed);
        }
        return allowed;
    }

    private static List<String> txtValues(LookupAnswer answer) {
        return formatValues(answer.records().stream()
                .filter(record -> record.getType() == Type.TXT)
                .toList());
    }

    /**
     * Formats the records into their sorted string values. MX values are ordered by priority, then by host name;
     * all other values lexicographically.
     */
    static List<String> formatValues(List<Record> records) {
        if (!records.isEmpty() && records.get(0).getType() == Type.MX) {
            return records.stream()
                    .map(record -> (MXRecord) record)
                    .sorted(Comparator.comparingInt(MXRecord::getPriority)
                            .thenComparing(record -> hostName(record.getTarget())))
                    .map(DNSCollector::formatValue)
                    .distinct()
                    .toList();
        }

        return records.stream()
                .map(DNSCollector::formatValue)
                .distinct()
                .sorted()
                .toList();
    }

    static String formatValue(Record record) {
        return switch (record.getType()) {
            case Type.A -> InetAddresses.toAddrString(((ARecord) record).getAddress());
            case Type.AAAA -> InetAddresses.toAddrString(((AAAARecord) record).getAddress());
            case Type.CNAME -> hostName(((CNAMERecord) record).getTarget());
            case Type.NS -> hostName(((NSRecord) record).getTarget());
            case Type.MX -> ((MXRecord) record).getPriority() + " " + hostName(((MXRecord) record).getTarget());
            // Long TXT values are split into several strings on the wire
            case Type.TXT -> String.join("", ((TXTRecord) record).getStrings());
            default -> record.rdataToString();
        };
    }

    static String hostName(Name name) {
        return Common.normalizeName(name.toString(true));
    }

    private static Name toName(String domain, String name) throws DNSLookupException {
        try {
            return Name.fromString(name, Name.root);
        } catch (TextParseException e) {
            throw new DNSLookupException(domain, ResultCodes.INVALID_DOMAIN_NAME,
                    "Invalid DNS name: " + e.getMessage(), e);
        }
    }

    private static int parseInt(Properties properties, String key, String defaultValue)
            throws ConfigurationException {
        final var value = properties.getProperty(key, defaultValue).trim();
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid value of " + key + ": '" + value + "'", e);
        }
    }

    /**
     * The queries started during a single {@link #collect(String, Duration)} call, sharing its deadline.
     */
    private final class Lookups {
        private final String _domain;
        private final long _deadline;
        private final List<CompletableFuture<LookupAnswer>> _started = new ArrayList<>();

        private Lookups(String domain, long deadline) {
            _domain = domain;
            _deadline = deadline;
        }

        String domain() {
            return _domain;
        }

        Duration remaining() {
            return Duration.ofNanos(Math.max(0, _deadline - System.nanoTime()));
        }

        CompletableFuture<LookupAnswer> start(Name name, int type) {
            CompletableFuture<LookupAnswer> future;
            try {
                future = _lookup.lookup(name, type).toCompletableFuture();
            } catch (RuntimeException e) {
                // Failures thrown outside the stage chain are handled like the others
                future = CompletableFuture.failedFuture(e);
            }
            _started.add(future);
            return future;
        }

        LookupAnswer get(CompletableFuture<LookupAnswer> future, String what)
                throws DNSLookupException, InterruptedException {
            try {
                return future.get(remaining().toNanos(), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                cancelAll();
                throw new DNSLookupException(_domain, ResultCodes.TIMEOUT,
                        "The DNS lookups did not finish in time (waiting for " + what + ")", e);
            } catch (ExecutionException e) {
                cancelAll();
                throw translate(e.getCause(), what);
            } catch (InterruptedException e) {
                cancelAll();
                throw e;
            }
        }

        /**
         * Waits for a zone transfer probe; failures and timeouts count as a refusal.
         */
        boolean tryGet(CompletableFuture<Boolean> probe, String nameServer) throws InterruptedException {
            try {
                return probe.get(remaining().toNanos(), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                Logger.debug("Zone transfer probe of {} at {} did not finish in time", _domain, nameServer);
                return false;
            } catch (ExecutionException | CancellationException e) {
                Logger.debug("Zone transfer probe of {} at {} failed", _domain, nameServer, e);
                return false;
            }
        }

        void cancelAll() {
            _started.forEach(future -> future.cancel(true));
        }

        private DNSLookupException translate(Throwable cause, String what) {
            if (cause instanceof CompletionException && cause.getCause() != null) {
                cause = cause.getCause();
            }

            final var message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
            if (cause instanceof IOException) {
                return new DNSLookupException(_domain, ResultCodes.CANNOT_FETCH,
                        "DNS query failed (" + what + "): " + message, cause);
            }

            return new DNSLookupException(_domain, ResultCodes.OTHER_DNS_ERROR,
                    "DNS query failed (" + what + "): " + message, cause);
        }
    }
}
