package cz.vut.fit.zoneguard.standalone.rules;

import cz.vut.fit.zoneguard.models.DomainSnapshot;
import cz.vut.fit.zoneguard.models.dns.DNSRecords;
import cz.vut.fit.zoneguard.models.findings.Finding;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * A rule that needs the DNS part of the snapshot. It yields nothing when the DNS collection failed.
 */
public abstract class DNSRule extends AbstractRule {
    protected DNSRule(@NotNull String id, @NotNull String remediation) {
        super(id, remediation);
    }

    @Override
    public final @NotNull List<Finding> evaluate(@NotNull DomainSnapshot snapshot) {
        final var dns = snapshot.dns();
        return dns == null ? List.of() : evaluate(dns, snapshot);
    }

    protected abstract @NotNull List<Finding> evaluate(@NotNull DNSRecords dns, @NotNull DomainSnapshot snapshot);
}
