package cz.vut.fit.zoneguard.standalone.rules;

import cz.vut.fit.zoneguard.models.DomainSnapshot;
import cz.vut.fit.zoneguard.models.Severity;
import cz.vut.fit.zoneguard.models.dns.DNSRecords;
import cz.vut.fit.zoneguard.models.findings.Finding;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

public class DanglingCnameRule extends DNSRule {
    public static final String ID = "dangling_cname";

    public DanglingCnameRule() {
        super(ID, "Remove CNAME records that point to names which no longer resolve, or reclaim the target "
                + "resource, to prevent subdomain takeover.");
    }

    @Override
    protected @NotNull List<Finding> evaluate(@NotNull DNSRecords dns, @NotNull DomainSnapshot snapshot) {
        final var findings = new ArrayList<Finding>();
        for (var target : dns.get(DNSRecords.CNAME)) {
            if (dns.ipsOf(target).isEmpty()) {
                findings.add(finding(Severity.WARNING, "Dangling CNAME",
                        "The CNAME target " + target + " has no address. Whoever registers the target controls "
                                + "the content served under " + snapshot.domain() + ".",
                        evidence("dns.CNAME", target),
                        evidence("dns.relatedIps." + target, "")));
            }
        }
        return findings;
    }
}
