package cz.vut.fit.zoneguard.models;

/**
 * The ordinal risk level of a finding. The declaration order is the presentation order:
 * {@code CRITICAL > WARNING > INFO}.
 */
public enum Severity {
    CRITICAL,
    WARNING,
    INFO
}
