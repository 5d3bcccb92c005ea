package cz.vut.fit.zoneguard.standalone.rules;

import cz.vut.fit.zoneguard.models.DomainSnapshot;
import cz.vut.fit.zoneguard.models.Severity;
import cz.vut.fit.zoneguard.models.dns.DNSRecords;
import cz.vut.fit.zoneguard.models.findings.Finding;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Locale;

public class DmarcPolicyRule extends DNSRule {
    public static final String ID = "dmarc_policy";

    public DmarcPolicyRule() {
        super(ID, "Publish a DMARC record at _dmarc.<domain> with p=quarantine or p=reject and a rua= address "
                + "for aggregate reports.");
    }

    @Override
    protected @NotNull List<Finding> evaluate(@NotNull DNSRecords dns, @NotNull DomainSnapshot snapshot) {
        final var record = dns.get(DNSRecords.DMARC).stream()
                .filter(value -> value.strip().toLowerCase(Locale.ROOT).startsWith("v=dmarc1"))
                .findFirst()
                .orElse(null);

        if (record == null) {
            return List.of(finding(Severity.WARNING, "DMARC record missing",
                    "No DMARC record was found at _dmarc." + snapshot.domain()
                            + ". Receivers get no instructions for mail that fails SPF and DKIM checks.",
                    evidence("dns.DMARC", dns.get(DNSRecords.DMARC))));
        }

        final var policy = policyOf(record);
        if (policy == null) {
            return List.of(finding(Severity.WARNING, "DMARC record without policy",
                    "The DMARC record has no p= tag and is ignored by receivers.",
                    evidence("dns.DMARC", record)));
        }

        if (policy.equals("none")) {
            return List.of(finding(Severity.CRITICAL, "DMARC policy set to none",
                    "The DMARC policy only monitors. Spoofed mail is still delivered.",
                    evidence("dns.DMARC", record)));
        }

        return List.of();
    }

    static @Nullable String policyOf(String record) {
        for (var tag : record.split(";")) {
            final var parts = tag.split("=", 2);
            if (parts.length == 2 && parts[0].strip().equalsIgnoreCase("p")) {
                return parts[1].strip().toLowerCase(Locale.ROOT);
            }
        }
        return null;
    }
}
