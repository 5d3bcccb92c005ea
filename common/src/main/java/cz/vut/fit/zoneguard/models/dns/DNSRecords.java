package cz.vut.fit.zoneguard.models.dns;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The normalized DNS records of a domain.
 *
 * @param records             A mapping of record types (including the pseudo types {@link #DMARC} and {@link #DKIM})
 *                            to the ordered record values. Every collected type has an entry; a type with no records
 *                            maps to an empty list.
 * @param relatedIps          The addresses of the host names that CNAME, MX and NS records point to. A target that
 *                            does not resolve maps to an empty list.
 * @param zoneTransferServers The name servers that answered a zone transfer request.
 */
public record DNSRecords(@NotNull Map<String, List<String>> records,
                         @NotNull Map<String, List<String>> relatedIps,
                         @NotNull List<String> zoneTransferServers
) {
    public static final String A = "A";
    public static final String AAAA = "AAAA";
    public static final String CNAME = "CNAME";
    public static final String MX = "MX";
    public static final String NS = "NS";
    public static final String TXT = "TXT";
    public static final String SOA = "SOA";
    public static final String CAA = "CAA";
    public static final String DNSKEY = "DNSKEY";
    public static final String DS = "DS";
    /**
     * TXT records at {@code _dmarc.<domain>}.
     */
    public static final String DMARC = "DMARC";
    /**
     * TXT records at {@code <selector>._domainkey.<domain>}, prefixed with {@code <selector>: }.
     */
    public static final String DKIM = "DKIM";

    /**
     * The record types queried at the domain apex, in query order.
     */
    public static final List<String> APEX_TYPES = List.of(A, AAAA, CNAME, MX, NS, TXT, SOA, CAA, DNSKEY, DS);

    public DNSRecords {
        records = copyOf(records);
        relatedIps = copyOf(relatedIps);
        zoneTransferServers = List.copyOf(zoneTransferServers);
    }

    /**
     * Returns the values of the given record type.
     *
     * @param type The record type.
     * @return The values, or an empty list if there are none.
     */
    public @NotNull List<String> get(@NotNull String type) {
        return records.getOrDefault(type, List.of());
    }

    /**
     * Returns the addresses of a host name that a CNAME, MX or NS record points to.
     *
     * @param host The normalized host name.
     * @return The addresses, or an empty list if the host was not resolved or has no address.
     */
    public @NotNull List<String> ipsOf(@NotNull String host) {
        return relatedIps.getOrDefault(host, List.of());
    }

    private static Map<String, List<String>> copyOf(Map<String, List<String>> source) {
        final var copy = new LinkedHashMap<String, List<String>>();
        source.forEach((key, values) -> copy.put(key, List.copyOf(values)));
        return Collections.unmodifiableMap(copy);
    }
}
