package cz.vut.fit.zoneguard.standalone.rules;

import cz.vut.fit.zoneguard.models.Severity;
import cz.vut.fit.zoneguard.models.dns.DNSRecords;
import cz.vut.fit.zoneguard.models.whois.WhoisRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static cz.vut.fit.zoneguard.standalone.rules.SnapshotFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class NameServerRulesTest {
    private final NameServerConsistencyRule consistency = new NameServerConsistencyRule();

    @Test
    void zoneTransferIsCritical() {
        final var dns = healthyDns().zoneTransfer("ns1.example.net").build();

        final var findings = new ZoneTransferRule().evaluate(snapshot(dns, healthyWhois()));

        assertEquals(1, findings.size());
        assertEquals(Severity.CRITICAL, findings.get(0).severity());
        assertEquals("zone_transfer_allowed", findings.get(0).ruleId());
        assertEquals("ns1.example.net", findings.get(0).evidence().get(0).value());
    }

    @Test
    void singleNameServerIsWarning() {
        final var dns = healthyDns().with(DNSRecords.NS, "ns1.example.net").build();

        final var findings = new NameServerRedundancyRule().evaluate(snapshot(dns, null));

        assertEquals(1, findings.size());
        assertEquals(Severity.WARNING, findings.get(0).severity());
    }

    @Test
    void noNameServersIsNotARedundancyProblem() {
        final var dns = healthyDns().with(DNSRecords.NS).build();
        assertTrue(new NameServerRedundancyRule().evaluate(snapshot(dns, null)).isEmpty());
    }

    @Test
    void consistentDelegationIsFine() {
        assertTrue(consistency.evaluate(healthySnapshot()).isEmpty());
    }

    @Test
    void delegationMismatchIsCritical() {
        final var whois = new WhoisRecord("Example Registrar, Inc.", null, TODAY.plusDays(365),
                List.of("ns1.example.net", "ns3.example.org"), true, "whois.example");

        final var findings = consistency.evaluate(snapshot(healthyDns().build(), whois));

        assertEquals(1, findings.size());
        assertEquals(Severity.CRITICAL, findings.get(0).severity());
        assertEquals("Name server delegation mismatch", findings.get(0).title());
        assertEquals("ns1.example.net, ns2.example.org", findings.get(0).evidence().get(0).value());
        assertEquals("ns1.example.net, ns3.example.org", findings.get(0).evidence().get(1).value());
    }

    @Test
    void whoisWithoutNameServersIsNotCompared() {
        final var whois = new WhoisRecord(null, null, TODAY.plusDays(365), List.of(), true, "whois.example");
        assertTrue(consistency.evaluate(snapshot(healthyDns().build(), whois)).isEmpty());
    }

    @Test
    void unresolvedNameServerIsCritical() {
        final var dns = healthyDns().ips("ns2.example.org").build();

        final var findings = consistency.evaluate(snapshot(dns, healthyWhois()));

        assertEquals(1, findings.size());
        assertEquals("Name server does not resolve", findings.get(0).title());
        assertEquals("dns.relatedIps.ns2.example.org", findings.get(0).evidence().get(0).field());
    }

    @ParameterizedTest
    @ValueSource(strings = {"10.0.0.53", "172.16.5.5", "192.168.1.1", "127.0.0.1", "169.254.10.10", "0.0.0.0",
            "::1", "fe80::1", "fd00::53"})
    void nonPublicNameServerAddressIsCritical(String address) {
        final var dns = healthyDns().ips("ns1.example.net", "198.51.100.1", address).build();

        final var findings = consistency.evaluate(snapshot(dns, healthyWhois()));

        assertEquals(1, findings.size());
        assertEquals(Severity.CRITICAL, findings.get(0).severity());
        assertEquals(address, findings.get(0).evidence().get(0).value());
    }

    @ParameterizedTest
    @ValueSource(strings = {"198.51.100.1", "8.8.8.8", "2001:db8::53", "2a00:1450:4014:80b::200e", "not-an-ip"})
    void publicAddressesAreAccepted(String address) {
        assertFalse(NameServerConsistencyRule.isNonPublicAddress(address));
    }
}
