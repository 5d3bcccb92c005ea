package cz.vut.fit.zoneguard.errors;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The WHOIS collection for a domain failed, was rate limited or returned a response that could not be parsed.
 */
public class WhoisLookupException extends CollectorException {
    public static final String COLLECTOR = "whois";

    public WhoisLookupException(@NotNull String domain, int code, @NotNull String message) {
        this(domain, code, message, null);
    }

    public WhoisLookupException(@NotNull String domain, int code, @NotNull String message,
                                @Nullable Throwable cause) {
        super(domain, code, message, cause);
    }

    @Override
    public @NotNull String getCollector() {
        return COLLECTOR;
    }
}
