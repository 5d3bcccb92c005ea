package cz.vut.fit.zoneguard.models.findings;

import org.jetbrains.annotations.NotNull;

/**
 * A reference to the snapshot value that triggered a finding.
 *
 * @param field The snapshot path, e.g. {@code dns.TXT}, {@code dns.relatedIps.mail.example.com} or
 *              {@code whois.expires}.
 * @param value The value found at that path (an empty string if the path was empty).
 */
public record Evidence(@NotNull String field, @NotNull String value) {
}
