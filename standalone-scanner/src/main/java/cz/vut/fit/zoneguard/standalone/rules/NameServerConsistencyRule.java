package cz.vut.fit.zoneguard.standalone.rules;

import com.google.common.net.InetAddresses;
import cz.vut.fit.zoneguard.models.DomainSnapshot;
import cz.vut.fit.zoneguard.models.Severity;
import cz.vut.fit.zoneguard.models.dns.DNSRecords;
import cz.vut.fit.zoneguard.models.findings.Finding;
import org.jetbrains.annotations.NotNull;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Checks that the delegation recorded at the registry matches the NS records of the zone and that every name server
 * resolves to a publicly routable address. Each problem yields its own finding.
 */
public class NameServerConsistencyRule extends DNSRule {
    public static final String ID = "ns_inconsistent";

    public NameServerConsistencyRule() {
        super(ID, "Make the name servers registered at the registrar identical to the NS records published in the "
                + "zone, and make sure every name server has a public A or AAAA record.");
    }

    @Override
    protected @NotNull List<Finding> evaluate(@NotNull DNSRecords dns, @NotNull DomainSnapshot snapshot) {
        final var findings = new ArrayList<Finding>();
        final var dnsNameServers = new TreeSet<>(dns.get(DNSRecords.NS));

        final var whois = snapshot.whois();
        if (whois != null && !whois.nameServers().isEmpty() && !dnsNameServers.isEmpty()) {
            final var whoisNameServers = new TreeSet<>(whois.nameServers());
            if (!whoisNameServers.equals(dnsNameServers)) {
                findings.add(finding(Severity.CRITICAL, "Name server delegation mismatch",
                        "The name servers registered for the domain differ from the NS records in its zone.",
                        evidence("dns.NS", dnsNameServers),
                        evidence("whois.nameServers", whoisNameServers)));
            }
        }

        for (var host : dnsNameServers) {
            final var addresses = dns.ipsOf(host);
            if (addresses.isEmpty()) {
                findings.add(finding(Severity.CRITICAL, "Name server does not resolve",
                        "The name server " + host + " has no A or AAAA record, so it cannot answer queries.",
                        evidence("dns.relatedIps." + host, "")));
                continue;
            }

            final var nonPublic = addresses.stream()
                    .filter(NameServerConsistencyRule::isNonPublicAddress)
                    .toList();
            if (!nonPublic.isEmpty()) {
                findings.add(finding(Severity.CRITICAL, "Name server resolves to a non-public address",
                        "The name server " + host + " resolves to an address that is not reachable from "
                                + "the Internet.",
                        evidence("dns.relatedIps." + host, nonPublic)));
            }
        }

        return findings;
    }

    /**
     * @return true for private, loopback, link-local, unspecified and IPv6 unique local addresses
     */
    static boolean isNonPublicAddress(String ip) {
        if (!InetAddresses.isInetAddress(ip))
            return false;

        final InetAddress address = InetAddresses.forString(ip);
        return address.isAnyLocalAddress()
                || address.isLoopbackAddress()
                || address.isLinkLocalAddress()
                || address.isSiteLocalAddress()
                || (address instanceof Inet6Address && (address.getAddress()[0] & 0xfe) == 0xfc);
    }
}
