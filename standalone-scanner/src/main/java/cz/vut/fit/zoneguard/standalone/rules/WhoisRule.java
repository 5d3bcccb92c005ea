package cz.vut.fit.zoneguard.standalone.rules;

import cz.vut.fit.zoneguard.models.DomainSnapshot;
import cz.vut.fit.zoneguard.models.findings.Finding;
import cz.vut.fit.zoneguard.models.whois.WhoisRecord;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * A rule that needs the WHOIS part of the snapshot. It yields nothing when the WHOIS collection failed.
 */
public abstract class WhoisRule extends AbstractRule {
    protected WhoisRule(@NotNull String id, @NotNull String remediation) {
        super(id, remediation);
    }

    @Override
    public final @NotNull List<Finding> evaluate(@NotNull DomainSnapshot snapshot) {
        final var whois = snapshot.whois();
        return whois == null ? List.of() : evaluate(whois, snapshot);
    }

    protected abstract @NotNull List<Finding> evaluate(@NotNull WhoisRecord whois, @NotNull DomainSnapshot snapshot);
}
