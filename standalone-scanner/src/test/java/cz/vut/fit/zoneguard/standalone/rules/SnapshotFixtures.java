package cz.vut.fit.zoneguard.standalone.rules;

import cz.vut.fit.zoneguard.models.DomainSnapshot;
import cz.vut.fit.zoneguard.models.dns.DNSRecords;
import cz.vut.fit.zoneguard.models.whois.WhoisRecord;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshots of a well-configured domain that tests modify to trigger single rules.
 */
public final class SnapshotFixtures {
    public static final String DOMAIN = "example.com";
    public static final Instant NOW = Instant.parse("2026-10-19T08:00:00Z");
    public static final LocalDate TODAY = LocalDate.of(2026, 10, 19);

    private SnapshotFixtures() {
    }

    public static DNSBuilder healthyDns() {
        return new DNSBuilder()
                .with(DNSRecords.A, "192.0.2.10")
                .with(DNSRecords.AAAA, "2001:db8::10")
                .with(DNSRecords.MX, "10 mail.example.com")
                .with(DNSRecords.NS, "ns1.example.net", "ns2.example.org")
                .with(DNSRecords.TXT, "v=spf1 mx -all")
                .with(DNSRecords.SOA, "ns1.example.net. hostmaster.example.com. 2026101901 7200 3600 1209600 3600")
                .with(DNSRecords.CAA, "0 issue \"letsencrypt.org\"")
                .with(DNSRecords.DNSKEY, "257 3 13 mdsswUyr3DPW132mOi8V9xESWE8jTo0d")
                .with(DNSRecords.DS, "370 13 2 BE74359954660069D5C63D200C39F5603827D7DD02B56F120EE9F3A86764247C")
                .with(DNSRecords.DMARC, "v=DMARC1; p=reject; rua=mailto:dmarc@example.com")
                .with(DNSRecords.DKIM, "selector1: v=DKIM1; k=rsa; p=MIGfMA0GCSqGSIb3DQEBAQUAA4GNADCBiQKBgQC")
                .ips("mail.example.com", "192.0.2.25")
                .ips("ns1.example.net", "198.51.100.1")
                .ips("ns2.example.org", "203.0.113.1");
    }

    public static WhoisRecord whois(LocalDate expires) {
        return new WhoisRecord("Example Registrar, Inc.", LocalDate.of(2001, 3, 4), expires,
                List.of("ns1.example.net", "ns2.example.org"), true, "whois.example-registrar.com");
    }

    public static WhoisRecord healthyWhois() {
        return whois(TODAY.plusDays(365));
    }

    public static DomainSnapshot snapshot(DNSRecords dns, WhoisRecord whois) {
        return new DomainSnapshot(DOMAIN, NOW, dns, whois);
    }

    public static DomainSnapshot healthySnapshot() {
        return snapshot(healthyDns().build(), healthyWhois());
    }

    public static final class DNSBuilder {
        private final Map<String, List<String>> _records = new LinkedHashMap<>();
        private final Map<String, List<String>> _relatedIps = new LinkedHashMap<>();
        private final List<String> _zoneTransferServers = new ArrayList<>();

        public DNSBuilder() {
            DNSRecords.APEX_TYPES.forEach(type -> _records.put(type, List.of()));
            _records.put(DNSRecords.DMARC, List.of());
            _records.put(DNSRecords.DKIM, List.of());
        }

        public DNSBuilder with(String type, String... values) {
            _records.put(type, List.of(values));
            return this;
        }

        public DNSBuilder ips(String host, String... ips) {
            _relatedIps.put(host, List.of(ips));
            return this;
        }

        public DNSBuilder zoneTransfer(String... servers) {
            _zoneTransferServers.addAll(List.of(servers));
            return this;
        }

        public DNSRecords build() {
            return new DNSRecords(_records, _relatedIps, _zoneTransferServers);
        }
    }
}
