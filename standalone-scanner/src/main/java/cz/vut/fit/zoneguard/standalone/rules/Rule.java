package cz.vut.fit.zoneguard.standalone.rules;

import cz.vut.fit.zoneguard.models.DomainSnapshot;
import cz.vut.fit.zoneguard.models.findings.Finding;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * A single classification rule. Rules are pure functions of the snapshot: they read no clock, perform no I/O and
 * keep no state between calls.
 */
public interface Rule {
    /**
     * @return the stable identifier used as {@link Finding#ruleId()}
     */
    @NotNull String id();

    /**
     * @return the canonical recommendation for the findings of this rule
     */
    @NotNull String remediation();

    /**
     * Evaluates the rule. A rule whose input is absent from the snapshot returns no findings.
     *
     * @param snapshot The domain snapshot.
     * @return The findings, possibly empty.
     */
    @NotNull List<Finding> evaluate(@NotNull DomainSnapshot snapshot);
}
