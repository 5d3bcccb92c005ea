package cz.vut.fit.zoneguard.standalone.rules;

import cz.vut.fit.zoneguard.models.DomainSnapshot;
import cz.vut.fit.zoneguard.models.Severity;
import cz.vut.fit.zoneguard.models.findings.Finding;
import cz.vut.fit.zoneguard.models.whois.WhoisRecord;
import org.jetbrains.annotations.NotNull;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Reports a registration that expires within the warning horizon. The days are counted from the UTC date of
 * {@link DomainSnapshot#collectedAt()}, so the result does not depend on when the rule runs.
 */
public class DomainExpiryRule extends WhoisRule {
    public static final String ID = "domain_expiry";

    private final int _warningDays;
    private final int _criticalDays;

    public DomainExpiryRule(int warningDays, int criticalDays) {
        super(ID, "Renew the domain registration and enable automatic renewal at the registrar.");
        if (criticalDays > warningDays)
            throw new IllegalArgumentException("The critical horizon must not exceed the warning horizon");

        _warningDays = warningDays;
        _criticalDays = criticalDays;
    }

    @Override
    protected @NotNull List<Finding> evaluate(@NotNull WhoisRecord whois, @NotNull DomainSnapshot snapshot) {
        final var today = LocalDate.ofInstant(snapshot.collectedAt(), ZoneOffset.UTC);
        final var days = ChronoUnit.DAYS.between(today, whois.expires());
        final var evidence = evidence("whois.expires", whois.expires().toString());

        if (days < 0) {
            return List.of(finding(Severity.CRITICAL, "Domain registration expired",
                    "The registration expired " + (-days) + " days ago. The domain can be lost to another "
                            + "registrant.", evidence));
        }
        if (days <= _criticalDays) {
            return List.of(finding(Severity.CRITICAL, "Domain registration expires in " + days + " days",
                    "The registration expires very soon. If it lapses, all services of the domain stop working.",
                    evidence));
        }
        if (days <= _warningDays) {
            return List.of(finding(Severity.WARNING, "Domain registration expires in " + days + " days",
                    "The registration expires within " + _warningDays + " days.", evidence));
        }

        return List.of();
    }
}
