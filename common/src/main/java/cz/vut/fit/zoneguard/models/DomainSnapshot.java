package cz.vut.fit.zoneguard.models;

import cz.vut.fit.zoneguard.models.dns.DNSRecords;
import cz.vut.fit.zoneguard.models.whois.WhoisRecord;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Objects;

/**
 * An immutable point-in-time collection of the DNS and WHOIS facts for one domain.
 * <p>
 * A collector that failed leaves its part absent ({@code null}); a collector that succeeded but found
 * no records of some type leaves an empty list in its part. The rules rely on this distinction.
 *
 * @param domain      The normalized domain name.
 * @param collectedAt The time the scan attempt started. Time-based rules use it as "now".
 * @param dns         The DNS records, or null if the DNS collection failed.
 * @param whois       The registration data, or null if the WHOIS collection failed.
 */
public record DomainSnapshot(@NotNull String domain,
                             @NotNull Instant collectedAt,
                             @Nullable DNSRecords dns,
                             @Nullable WhoisRecord whois
) {
    public DomainSnapshot {
        Objects.requireNonNull(domain);
        Objects.requireNonNull(collectedAt);
    }

    /**
     * @return true if neither DNS nor WHOIS data is present
     */
    public boolean isEmpty() {
        return dns == null && whois == null;
    }
}
