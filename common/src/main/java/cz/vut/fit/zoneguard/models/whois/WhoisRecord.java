package cz.vut.fit.zoneguard.models.whois;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Normalized domain registration metadata.
 *
 * @param registrar        The sponsoring registrar, if stated.
 * @param created          The registration date, if stated.
 * @param expires          The expiry date. Always present; a response without it is not a valid record.
 * @param nameServers      The delegated name servers (lower case, sorted).
 * @param privacyProtected True if no registrant personal data is exposed.
 * @param whoisServer      The server that provided the parsed response.
 */
public record WhoisRecord(@Nullable String registrar,
                          @Nullable LocalDate created,
                          @NotNull LocalDate expires,
                          @NotNull List<String> nameServers,
                          boolean privacyProtected,
                          @NotNull String whoisServer
) {
    public WhoisRecord {
        Objects.requireNonNull(expires);
        nameServers = List.copyOf(nameServers);
    }
}
