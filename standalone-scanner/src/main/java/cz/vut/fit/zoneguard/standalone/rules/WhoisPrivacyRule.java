package cz.vut.fit.zoneguard.standalone.rules;

import cz.vut.fit.zoneguard.models.DomainSnapshot;
import cz.vut.fit.zoneguard.models.Severity;
import cz.vut.fit.zoneguard.models.findings.Finding;
import cz.vut.fit.zoneguard.models.whois.WhoisRecord;
import org.jetbrains.annotations.NotNull;

import java.util.List;

public class WhoisPrivacyRule extends WhoisRule {
    public static final String ID = "whois_privacy_disabled";

    public WhoisPrivacyRule() {
        super(ID, "Enable the registrar's WHOIS privacy or redaction service to hide the registrant's "
                + "personal contact data.");
    }

    @Override
    protected @NotNull List<Finding> evaluate(@NotNull WhoisRecord whois, @NotNull DomainSnapshot snapshot) {
        if (whois.privacyProtected())
            return List.of();

        return List.of(finding(Severity.INFO, "WHOIS privacy disabled",
                "The WHOIS response of " + whois.whoisServer() + " exposes registrant contact data that can be "
                        + "used for phishing and social engineering.",
                evidence("whois.privacyProtected", "false")));
    }
}
