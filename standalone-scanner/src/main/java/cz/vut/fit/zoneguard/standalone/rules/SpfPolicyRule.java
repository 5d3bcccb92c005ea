package cz.vut.fit.zoneguard.standalone.rules;

import cz.vut.fit.zoneguard.models.DomainSnapshot;
import cz.vut.fit.zoneguard.models.Severity;
import cz.vut.fit.zoneguard.models.dns.DNSRecords;
import cz.vut.fit.zoneguard.models.findings.Finding;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

public class SpfPolicyRule extends DNSRule {
    public static final String ID = "spf_policy";

    public SpfPolicyRule() {
        super(ID, "Publish exactly one SPF TXT record listing the permitted senders and ending with -all "
                + "(or ~all while testing).");
    }

    @Override
    protected @NotNull List<Finding> evaluate(@NotNull DNSRecords dns, @NotNull DomainSnapshot snapshot) {
        final var spfRecords = dns.get(DNSRecords.TXT).stream()
                .filter(SpfPolicyRule::isSpfRecord)
                .toList();

        if (spfRecords.isEmpty()) {
            return List.of(finding(Severity.WARNING, "SPF record missing",
                    "No SPF record was found, so receivers cannot tell which servers may send mail for the domain.",
                    evidence("dns.TXT", dns.get(DNSRecords.TXT))));
        }

        final var findings = new ArrayList<Finding>();
        if (spfRecords.size() > 1) {
            findings.add(finding(Severity.WARNING, "Multiple SPF records",
                    "More than one SPF record is published. Receivers treat this as a permanent error and "
                            + "ignore SPF completely.",
                    evidence("dns.TXT", spfRecords)));
        }

        for (var record : spfRecords) {
            if (isPermissive(record)) {
                findings.add(finding(Severity.CRITICAL, "Permissive SPF policy",
                        "The SPF record allows any server to send mail for the domain.",
                        evidence("dns.TXT", record)));
            }
        }

        return findings;
    }

    static boolean isSpfRecord(String value) {
        final var lower = value.strip().toLowerCase(Locale.ROOT);
        return lower.equals("v=spf1") || lower.startsWith("v=spf1 ");
    }

    /**
     * @return true if the record ends with {@code +all}, {@code ?all} or an unqualified {@code all}
     */
    static boolean isPermissive(String record) {
        return Arrays.stream(record.strip().toLowerCase(Locale.ROOT).split("\\s+"))
                .anyMatch(term -> term.equals("+all") || term.equals("?all") || term.equals("all"));
    }
}
