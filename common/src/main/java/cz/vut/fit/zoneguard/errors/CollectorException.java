package cz.vut.fit.zoneguard.errors;

import cz.vut.fit.zoneguard.models.ResultCodes;
import cz.vut.fit.zoneguard.models.results.CollectorError;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A failure of a single collector call for a single domain. These never abort a batch; the scanner records them
 * in the domain's result.
 */
public abstract class CollectorException extends Exception {
    private final String _domain;
    private final int _code;

    protected CollectorException(@NotNull String domain, int code, @NotNull String message,
                                 @Nullable Throwable cause) {
        super(message, cause);
        _domain = domain;
        _code = code;
    }

    /**
     * @return the identifier of the collector that failed
     */
    public abstract @NotNull String getCollector();

    public @NotNull String getDomain() {
        return _domain;
    }

    /**
     * @return the error code, see {@link ResultCodes}
     */
    public int getCode() {
        return _code;
    }

    public @NotNull CollectorError toCollectorError() {
        return new CollectorError(getCollector(), _domain, _code, getMessage());
    }
}
