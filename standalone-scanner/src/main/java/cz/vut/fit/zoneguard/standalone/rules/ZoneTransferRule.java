package cz.vut.fit.zoneguard.standalone.rules;

import cz.vut.fit.zoneguard.models.DomainSnapshot;
import cz.vut.fit.zoneguard.models.Severity;
import cz.vut.fit.zoneguard.models.dns.DNSRecords;
import cz.vut.fit.zoneguard.models.findings.Finding;
import org.jetbrains.annotations.NotNull;

import java.util.List;

public class ZoneTransferRule extends DNSRule {
    public static final String ID = "zone_transfer_allowed";

    public ZoneTransferRule() {
        super(ID, "Restrict zone transfers (AXFR) on all authoritative name servers to the IP addresses of "
                + "the secondary servers, ideally authenticated with TSIG keys.");
    }

    @Override
    protected @NotNull List<Finding> evaluate(@NotNull DNSRecords dns, @NotNull DomainSnapshot snapshot) {
        if (dns.zoneTransferServers().isEmpty())
            return List.of();

        return List.of(finding(Severity.CRITICAL, "Zone transfer allowed",
                "At least one name server sent the complete zone of " + snapshot.domain()
                        + " to an anonymous client. This exposes every host name in the zone.",
                evidence("dns.zoneTransferServers", dns.zoneTransferServers())));
    }
}
