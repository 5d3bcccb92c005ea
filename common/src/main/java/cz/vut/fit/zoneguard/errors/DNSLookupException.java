package cz.vut.fit.zoneguard.errors;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The DNS collection for a domain failed at the transport level or the domain does not exist.
 */
public class DNSLookupException extends CollectorException {
    public static final String COLLECTOR = "dns";

    public DNSLookupException(@NotNull String domain, int code, @NotNull String message) {
        this(domain, code, message, null);
    }

    public DNSLookupException(@NotNull String domain, int code, @NotNull String message,
                              @Nullable Throwable cause) {
        super(domain, code, message, cause);
    }

    @Override
    public @NotNull String getCollector() {
        return COLLECTOR;
    }
}
