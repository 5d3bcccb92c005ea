package cz.vut.fit.zoneguard.models.findings;

import cz.vut.fit.zoneguard.models.Severity;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * A single classified security observation.
 *
 * @param ruleId      The identifier of the rule that produced the finding.
 * @param severity    The severity.
 * @param title       A short, one-line title.
 * @param description A description of the problem and its impact.
 * @param evidence    The snapshot values that triggered the finding.
 */
public record Finding(@NotNull String ruleId,
                      @NotNull Severity severity,
                      @NotNull String title,
                      @NotNull String description,
                      @NotNull List<Evidence> evidence
) {
    public Finding {
        Objects.requireNonNull(ruleId);
        Objects.requireNonNull(severity);
        evidence = List.copyOf(evidence);
    }
}
