package cz.vut.fit.zoneguard.standalone.collectors.whois;

import org.apache.commons.net.whois.WhoisClient;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Sends a single query to a WHOIS server (RFC 3912) and returns the raw response.
 */
@FunctionalInterface
public interface WhoisTransport {
    /**
     * @param server  The WHOIS server host name.
     * @param query   The query, usually a domain name or a TLD.
     * @param timeout The connect and read timeout.
     * @return The response text.
     * @throws IOException if the server cannot be reached or the connection fails.
     */
    @NotNull String query(@NotNull String server, @NotNull String query, @NotNull Duration timeout)
            throws IOException;

    /**
     * Creates a transport using the Apache Commons Net WHOIS client on TCP port 43.
     */
    static WhoisTransport tcp() {
        return tcp(WhoisClient.DEFAULT_PORT);
    }

    /**
     * Creates a transport using the Apache Commons Net WHOIS client on the given port. Responses are decoded
     * as UTF-8.
     */
    static WhoisTransport tcp(int port) {
        return (server, query, timeout) -> {
            final var timeoutMs = (int) Math.min(Integer.MAX_VALUE, Math.max(1, timeout.toMillis()));
            final var client = new WhoisClient();
            client.setDefaultTimeout(timeoutMs);
            client.setConnectTimeout(timeoutMs);
            client.setCharset(StandardCharsets.UTF_8);
            try {
                client.connect(server, port);
                client.setSoTimeout(timeoutMs);
                return client.query(query);
            } finally {
                if (client.isConnected()) {
                    client.disconnect();
                }
            }
        };
    }
}
