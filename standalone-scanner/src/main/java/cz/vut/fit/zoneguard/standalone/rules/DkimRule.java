package cz.vut.fit.zoneguard.standalone.rules;

import cz.vut.fit.zoneguard.models.DomainSnapshot;
import cz.vut.fit.zoneguard.models.Severity;
import cz.vut.fit.zoneguard.models.dns.DNSRecords;
import cz.vut.fit.zoneguard.models.findings.Finding;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Locale;

/**
 * Only the selectors configured for the DNS collector are probed, so a domain using another selector is reported
 * as well.
 */
public class DkimRule extends DNSRule {
    public static final String ID = "dkim_missing";

    public DkimRule() {
        super(ID, "Sign outgoing mail with DKIM and publish the public key at <selector>._domainkey.<domain>.");
    }

    @Override
    protected @NotNull List<Finding> evaluate(@NotNull DNSRecords dns, @NotNull DomainSnapshot snapshot) {
        final var hasKey = dns.get(DNSRecords.DKIM).stream()
                .map(value -> value.substring(value.indexOf(':') + 1))
                .anyMatch(DkimRule::publishesKey);
        if (hasKey)
            return List.of();

        return List.of(finding(Severity.WARNING, "DKIM record missing",
                "No DKIM public key was found for the common selectors. Mail from the domain may not be signed.",
                evidence("dns.DKIM", dns.get(DNSRecords.DKIM))));
    }

    /**
     * @return true if the record has a non-empty {@code p=} tag; an empty one marks a revoked key
     */
    static boolean publishesKey(@NotNull String value) {
        for (var tag : value.split(";")) {
            final var separator = tag.indexOf('=');
            if (separator > 0 && tag.substring(0, separator).strip().toLowerCase(Locale.ROOT).equals("p")) {
                return !tag.substring(separator + 1).strip().isEmpty();
            }
        }
        return false;
    }
}
