package cz.vut.fit.zoneguard.standalone.rules;

import cz.vut.fit.zoneguard.ScanSettings;
import cz.vut.fit.zoneguard.models.DomainSnapshot;
import cz.vut.fit.zoneguard.models.findings.Finding;
import org.jetbrains.annotations.NotNull;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates an ordered list of rules against domain snapshots.
 * <p>
 * The engine is stateless: the same snapshot always yields the same findings in the same order. Findings are sorted
 * by severity, and findings of the same severity keep the order of the rules that produced them.
 */
public class RuleEngine {
    private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(RuleEngine.class);

    private final List<Rule> _rules;

    /**
     * @param rules The rules in evaluation order.
     * @throws IllegalArgumentException if two rules share an identifier.
     */
    public RuleEngine(@NotNull List<Rule> rules) {
        final var ids = new HashSet<String>();
        for (var rule : rules) {
            if (!ids.add(rule.id()))
                throw new IllegalArgumentException("Duplicate rule identifier: " + rule.id());
        }

        _rules = List.copyOf(rules);
    }

    /**
     * Creates an engine with the built-in rules, using the expiry horizons from the settings.
     */
    public static RuleEngine withDefaultRules(@NotNull ScanSettings settings) {
        return new RuleEngine(defaultRules(settings.expiryWarningDays(), settings.expiryCriticalDays()));
    }

    /**
     * @return the built-in rules in their evaluation order
     */
    public static List<Rule> defaultRules(int expiryWarningDays, int expiryCriticalDays) {
        return List.of(
                new ZoneTransferRule(),
                new NameServerConsistencyRule(),
                new NameServerRedundancyRule(),
                new SpfPolicyRule(),
                new DmarcPolicyRule(),
                new DkimRule(),
                new DomainExpiryRule(expiryWarningDays, expiryCriticalDays),
                new WhoisPrivacyRule(),
                new DanglingCnameRule(),
                MissingRecordRule.caa(),
                MissingRecordRule.soa(),
                MissingRecordRule.address(),
                MissingRecordRule.mx(),
                MissingRecordRule.dnssec());
    }

    /**
     * Evaluates all rules against the snapshot.
     * <p>
     * A rule that fails with an exception is logged and contributes no findings; the other rules still run.
     *
     * @param snapshot The domain snapshot.
     * @return The findings ordered by severity, then by rule order.
     */
    public @NotNull List<Finding> evaluate(@NotNull DomainSnapshot snapshot) {
        final var findings = new ArrayList<Finding>();
        for (var rule : _rules) {
            try {
                findings.addAll(rule.evaluate(snapshot));
            } catch (RuntimeException e) {
                Logger.error("Rule {} failed for {}", rule.id(), snapshot.domain(), e);
            }
        }

        // List.sort is stable
        findings.sort(Comparator.comparing(Finding::severity));
        return Collections.unmodifiableList(findings);
    }

    /**
     * @return the canonical recommendation of every rule, keyed by rule identifier, in rule order
     */
    public @NotNull Map<String, String> remediations() {
        final var remediations = new LinkedHashMap<String, String>();
        _rules.forEach(rule -> remediations.put(rule.id(), rule.remediation()));
        return Collections.unmodifiableMap(remediations);
    }

    public @NotNull List<Rule> getRules() {
        return _rules;
    }
}
