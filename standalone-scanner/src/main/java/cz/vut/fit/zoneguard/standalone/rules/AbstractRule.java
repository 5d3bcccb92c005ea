package cz.vut.fit.zoneguard.standalone.rules;

import cz.vut.fit.zoneguard.models.Severity;
import cz.vut.fit.zoneguard.models.findings.Evidence;
import cz.vut.fit.zoneguard.models.findings.Finding;
import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.List;

public abstract class AbstractRule implements Rule {
    private final String _id;
    private final String _remediation;

    protected AbstractRule(@NotNull String id, @NotNull String remediation) {
        _id = id;
        _remediation = remediation;
    }

    @Override
    public @NotNull String id() {
        return _id;
    }

    @Override
    public @NotNull String remediation() {
        return _remediation;
    }

    protected Finding finding(Severity severity, String title, String description, Evidence... evidence) {
        return new Finding(_id, severity, title, description, List.of(evidence));
    }

    protected static Evidence evidence(String field, Collection<String> values) {
        return new Evidence(field, String.join(", ", values));
    }

    protected static Evidence evidence(String field, String value) {
        return new Evidence(field, value);
    }
}
