package cz.vut.fit.zoneguard.standalone.collectors;

import cz.vut.fit.zoneguard.errors.CollectorException;
import org.jetbrains.annotations.NotNull;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;

/**
 * Fetches one kind of raw data about a domain.
 * <p>
 * Implementations must be safe to call from multiple scan workers at once. A call that is interrupted should abort
 * its network operations and throw {@link InterruptedException}.
 *
 * @param <T> The type of the collected data.
 * @param <E> The type of the collector's failure.
 */
public interface Collector<T, E extends CollectorException> extends Closeable {
    /**
     * @return the collector identifier used in error reports
     */
    @NotNull String getName();

    /**
     * Collects the data for a single domain.
     *
     * @param domain  The normalized domain name.
     * @param timeout The maximum duration of the whole call.
     * @return The collected data.
     * @throws E                    if the data cannot be collected.
     * @throws InterruptedException if the calling thread was interrupted.
     */
    @NotNull T collect(@NotNull String domain, @NotNull Duration timeout) throws E, InterruptedException;

    @Override
    default void close() throws IOException {
    }
}
