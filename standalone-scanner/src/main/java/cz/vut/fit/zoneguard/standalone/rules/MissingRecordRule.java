package cz.vut.fit.zoneguard.standalone.rules;

import cz.vut.fit.zoneguard.models.DomainSnapshot;
import cz.vut.fit.zoneguard.models.Severity;
import cz.vut.fit.zoneguard.models.dns.DNSRecords;
import cz.vut.fit.zoneguard.models.findings.Evidence;
import cz.vut.fit.zoneguard.models.findings.Finding;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Reports a domain that has no record of any of the given types.
 */
public class MissingRecordRule extends DNSRule {
    private final List<String> _types;
    private final Severity _severity;
    private final String _title;
    private final String _description;

    public MissingRecordRule(@NotNull String id, @NotNull List<String> types, @NotNull Severity severity,
                             @NotNull String title, @NotNull String description, @NotNull String remediation) {
        super(id, remediation);
        _types = List.copyOf(types);
        _severity = severity;
        _title = title;
        _description = description;
    }

    public static MissingRecordRule caa() {
        return new MissingRecordRule("caa_missing", List.of(DNSRecords.CAA), Severity.INFO,
                "CAA record missing",
                "Any certificate authority may issue certificates for the domain.",
                "Publish CAA records naming the certificate authorities allowed to issue certificates "
                        + "for the domain.");
    }

    public static MissingRecordRule soa() {
        return new MissingRecordRule("soa_missing", List.of(DNSRecords.SOA), Severity.WARNING,
                "SOA record missing",
                "The domain has no SOA record at its apex, so it is not a properly configured zone.",
                "Make sure the authoritative servers serve the zone with a valid SOA record.");
    }

    public static MissingRecordRule address() {
        return new MissingRecordRule("address_missing", List.of(DNSRecords.A, DNSRecords.AAAA, DNSRecords.CNAME),
                Severity.INFO, "No address record",
                "The domain has no A, AAAA or CNAME record, so it does not point to any host.",
                "Add A or AAAA records if the domain should serve web or other traffic.");
    }

    public static MissingRecordRule mx() {
        return new MissingRecordRule("mx_missing", List.of(DNSRecords.MX), Severity.INFO,
                "MX record missing",
                "The domain publishes no mail exchanger.",
                "Publish MX records if the domain receives mail, or a null MX record (\"0 .\") if it does not.");
    }

    public static MissingRecordRule dnssec() {
        return new MissingRecordRule("dnssec_disabled", List.of(DNSRecords.DNSKEY, DNSRecords.DS), Severity.INFO,
                "DNSSEC not enabled",
                "The zone is not signed, so resolvers cannot detect forged answers.",
                "Sign the zone with DNSSEC and publish the DS record at the registrar.");
    }

    @Override
    protected @NotNull List<Finding> evaluate(@NotNull DNSRecords dns, @NotNull DomainSnapshot snapshot) {
        for (var type : _types) {
            if (!dns.get(type).isEmpty())
                return List.of();
        }

        return List.of(finding(_severity, _title, _description,
                _types.stream().map(type -> evidence("dns." + type, "")).toArray(Evidence[]::new)));
    }
}
