package cz.vut.fit.zoneguard.models.results;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A failed collector call recorded in a domain scan result.
 *
 * @param collector The collector identifier ({@code dns} or {@code whois}), or {@code scanner} for a failure
 *                  outside the collectors.
 * @param domain    The domain the call was made for.
 * @param code      The error code, see {@link cz.vut.fit.zoneguard.models.ResultCodes}.
 * @param message   The error message.
 */
public record CollectorError(@NotNull String collector,
                             @NotNull String domain,
                             int code,
                             @Nullable String message
) {
}
