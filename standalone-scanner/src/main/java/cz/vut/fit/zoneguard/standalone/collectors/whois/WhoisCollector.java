package cz.vut.fit.zoneguard.standalone.collectors.whois;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import cz.vut.fit.zoneguard.ScannerConfig;
import cz.vut.fit.zoneguard.errors.WhoisLookupException;
import cz.vut.fit.zoneguard.models.ResultCodes;
import cz.vut.fit.zoneguard.models.whois.WhoisRecord;
import cz.vut.fit.zoneguard.standalone.collectors.Collector;
import org.jetbrains.annotations.NotNull;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Collects the registration data of a domain over the WHOIS protocol.
 * <p>
 * The registry WHOIS server of the domain's TLD is found through the root server ({@code whois.iana.org} by default)
 * and cached. If the registry response refers to a registrar WHOIS server, the referral is followed once and
 * the two responses are merged; a failed referral leaves the registry data in place.
 */
public class WhoisCollector implements Collector<WhoisRecord, WhoisLookupException> {
    private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(WhoisCollector.class);

    public static final String NAME = WhoisLookupException.COLLECTOR;

    private final WhoisTransport _transport;
    private final String _rootServer;
    private final boolean _followReferrals;
    private final ExecutorService _executor;
    private final ConcurrentMap<String, String> _registryServers = new ConcurrentHashMap<>();

    /**
     * @param transport       The WHOIS query implementation.
     * @param rootServer      The server that knows the registry WHOIS servers of all TLDs.
     * @param followReferrals Whether registrar WHOIS server referrals are followed.
     * @param executor        The executor that runs the blocking queries. It is shut down by {@link #close()}.
     */
    public WhoisCollector(@NotNull WhoisTransport transport,
                          @NotNull String rootServer,
                          boolean followReferrals,
                          @NotNull ExecutorService executor) {
        _transport = Objects.requireNonNull(transport);
        _rootServer = Objects.requireNonNull(rootServer);
        _followReferrals = followReferrals;
        _executor = Objects.requireNonNull(executor);
    }

    public static WhoisCollector fromProperties(@NotNull Properties properties) {
        final var rootServer = properties.getProperty(ScannerConfig.WHOIS_ROOT_SERVER_CONFIG,
                ScannerConfig.WHOIS_ROOT_SERVER_DEFAULT).trim();
        final var followReferrals = Boolean.parseBoolean(properties.getProperty(
                ScannerConfig.WHOIS_FOLLOW_REFERRALS_CONFIG, ScannerConfig.WHOIS_FOLLOW_REFERRALS_DEFAULT).trim());

        final var executor = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                .setNameFormat("zoneguard-whois-%d")
                .setDaemon(true)
                .build());

        return new WhoisCollector(WhoisTransport.tcp(), rootServer, followReferrals, executor);
    }

    @Override
    public @NotNull String getName() {
        return NAME;
    }

    @Override
    public @NotNull WhoisRecord collect(@NotNull String domain, @NotNull Duration timeout)
            throws WhoisLookupException, InterruptedException {
        final var deadline = System.nanoTime() + timeout.toNanos();
        final var tld = domain.substring(domain.lastIndexOf('.') + 1);

        final var registryServer = registryServerFor(domain, tld, deadline);
        final var registryResponse = query(domain, registryServer, domain, deadline);

        WhoisRecord registryRecord = null;
        WhoisLookupException registryFailure = null;
        try {
            registryRecord = WhoisParser.parse(domain, registryServer, registryResponse);
        } catch (WhoisLookupException e) {
            // Thin registries may only carry the referral, other failures are final
            if (e.getCode() != ResultCodes.INVALID_FORMAT)
                throw e;
            registryFailure = e;
        }

        final var registrarServer = _followReferrals ? WhoisParser.findRegistrarServer(registryResponse) : null;
        if (registrarServer != null && !registrarServer.equalsIgnoreCase(registryServer)) {
            try {
                final var registrarRecord = WhoisParser.parse(domain, registrarServer,
                        query(domain, registrarServer, domain, deadline));
                return registryRecord == null ? registrarRecord : merge(registryRecord, registrarRecord);
            } catch (WhoisLookupException e) {
                Logger.debug("Registrar WHOIS referral of {} to {} failed: {}", domain, registrarServer,
                        e.getMessage());
            }
        }

        if (registryRecord == null)
            throw registryFailure;

        return registryRecord;
    }

    @Override
    public void close() {
        _executor.shutdownNow();
    }

    /**
     * Finds the registry WHOIS server for a TLD, asking the root server on the first use.
     */
    private String registryServerFor(String domain, String tld, long deadline)
            throws WhoisLookupException, InterruptedException {
        final var cached = _registryServers.get(tld);
        if (cached != null)
            return cached;

        final var server = WhoisParser.findRegistryServer(query(domain, _rootServer, tld, deadline));
        if (server == null)
            throw new WhoisLookupException(domain, ResultCodes.NOT_FOUND,
                    "No WHOIS server is known for the TLD '" + tld + "'");

        Logger.debug("Registry WHOIS server of .{} is {}", tld, server);
        _registryServers.putIfAbsent(tld, server);
        return server;
    }

    private String query(String domain, String server, String query, long deadline)
            throws WhoisLookupException, InterruptedException {
        final var remaining = deadline - System.nanoTime();
        if (remaining <= 0)
            throw new WhoisLookupException(domain, ResultCodes.TIMEOUT,
                    "The WHOIS lookup did not finish in time (before querying " + server + ")");

        final var future = _executor.submit(() -> _transport.query(server, query, Duration.ofNanos(remaining)));
        try {
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new WhoisLookupException(domain, ResultCodes.TIMEOUT,
                    "The WHOIS server " + server + " did not respond in time", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            final var cause = e.getCause();
            if (cause instanceof InterruptedIOException)
                throw new WhoisLookupException(domain, ResultCodes.TIMEOUT,
                        "The WHOIS server " + server + " did not respond in time", cause);
            if (cause instanceof IOException)
                throw new WhoisLookupException(domain, ResultCodes.CANNOT_FETCH,
                        "Cannot query the WHOIS server " + server + ": " + cause.getMessage(), cause);
            if (cause instanceof RuntimeException runtimeException)
                throw runtimeException;
            if (cause instanceof Error error)
                throw error;
            throw new WhoisLookupException(domain, ResultCodes.OTHER_EXTERNAL_ERROR,
                    "Cannot query the WHOIS server " + server, cause);
        }
    }

    /**
     * Combines the registry record with the registrar record. The registry is authoritative for the dates and
     * name servers; the registrar holds the registrant contact data.
     */
    static WhoisRecord merge(WhoisRecord registry, WhoisRecord registrar) {
        return new WhoisRecord(
                registry.registrar() != null ? registry.registrar() : registrar.registrar(),
                registry.created() != null ? registry.created() : registrar.created(),
                registry.expires(),
                registry.nameServers().isEmpty() ? registrar.nameServers() : registry.nameServers(),
                registrar.privacyProtected(),
                registrar.whoisServer());
    }
}
