package cz.vut.fit.zoneguard.standalone.rules;

import cz.vut.fit.zoneguard.models.DomainSnapshot;
import cz.vut.fit.zoneguard.models.Severity;
import cz.vut.fit.zoneguard.models.dns.DNSRecords;
import cz.vut.fit.zoneguard.models.findings.Finding;
import org.jetbrains.annotations.NotNull;

import java.util.List;

public class NameServerRedundancyRule extends DNSRule {
    public static final String ID = "ns_redundancy";

    public NameServerRedundancyRule() {
        super(ID, "Delegate the domain to at least two name servers, preferably in different networks.");
    }

    @Override
    protected @NotNull List<Finding> evaluate(@NotNull DNSRecords dns, @NotNull DomainSnapshot snapshot) {
        final var nameServers = dns.get(DNSRecords.NS);
        if (nameServers.size() != 1)
            return List.of();

        return List.of(finding(Severity.WARNING, "Single name server",
                "The domain is served by only one name server. Its outage makes the whole domain unreachable.",
                evidence("dns.NS", nameServers)));
    }
}
