package cz.vut.fit.zoneguard;

import cz.vut.fit.zoneguard.errors.ConfigurationException;
import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * The settings of a single batch scan.
 *
 * @param threadCount        The number of domains scanned in parallel.
 * @param perDomainTimeout   The maximum duration of a single collector call for one domain.
 * @param expiryWarningDays  A domain expiring within this number of days yields a WARNING finding.
 * @param expiryCriticalDays A domain expiring within this number of days yields a CRITICAL finding.
 */
public record ScanSettings(int threadCount,
                           @NotNull Duration perDomainTimeout,
                           int expiryWarningDays,
                           int expiryCriticalDays
) {
    public ScanSettings {
        Objects.requireNonNull(perDomainTimeout);
    }

    /**
     * @return the settings with all values set to their defaults from {@link ScannerConfig}
     */
    public static ScanSettings defaults() {
        return new ScanSettings(
                Integer.parseInt(ScannerConfig.THREADS_DEFAULT),
                Duration.ofMillis(Long.parseLong(ScannerConfig.TIMEOUT_PER_DOMAIN_MS_DEFAULT)),
                Integer.parseInt(ScannerConfig.EXPIRY_WARNING_DAYS_DEFAULT),
                Integer.parseInt(ScannerConfig.EXPIRY_CRITICAL_DAYS_DEFAULT));
    }

    /**
     * Reads the settings from the given properties, using the defaults for the missing keys.
     * The returned settings are validated.
     *
     * @param properties The properties.
     * @return The settings.
     * @throws ConfigurationException if a value is not a number or the settings are not valid.
     */
    public static ScanSettings fromProperties(@NotNull Properties properties) throws ConfigurationException {
        final var settings = new ScanSettings(
                parseInt(properties, ScannerConfig.THREADS_CONFIG, ScannerConfig.THREADS_DEFAULT),
                Duration.ofMillis(parseInt(properties, ScannerConfig.TIMEOUT_PER_DOMAIN_MS_CONFIG,
                        ScannerConfig.TIMEOUT_PER_DOMAIN_MS_DEFAULT)),
                parseInt(properties, ScannerConfig.EXPIRY_WARNING_DAYS_CONFIG,
                        ScannerConfig.EXPIRY_WARNING_DAYS_DEFAULT),
                parseInt(properties, ScannerConfig.EXPIRY_CRITICAL_DAYS_CONFIG,
                        ScannerConfig.EXPIRY_CRITICAL_DAYS_DEFAULT));

        settings.validate();
        return settings;
    }

    /**
     * Checks that the settings can be used for a scan.
     *
     * @throws ConfigurationException if any of the values is out of range.
     */
    public void validate() throws ConfigurationException {
        if (threadCount < 1)
            throw new ConfigurationException("The thread count must be at least 1, got " + threadCount);
        if (perDomainTimeout.isNegative() || perDomainTimeout.isZero())
            throw new ConfigurationException("The per-domain timeout must be positive, got " + perDomainTimeout);
        if (expiryCriticalDays < 1)
            throw new ConfigurationException("The critical expiry horizon must be at least 1 day, got "
                    + expiryCriticalDays);
        if (expiryWarningDays < expiryCriticalDays)
            throw new ConfigurationException("The warning expiry horizon (" + expiryWarningDays
                    + " days) must not be shorter than the critical one (" + expiryCriticalDays + " days)");
    }

    public ScanSettings withThreadCount(int threadCount) {
        return new ScanSettings(threadCount, perDomainTimeout, expiryWarningDays, expiryCriticalDays);
    }

    public ScanSettings withPerDomainTimeout(@NotNull Duration perDomainTimeout) {
        return new ScanSettings(threadCount, perDomainTimeout, expiryWarningDays, expiryCriticalDays);
    }

    private static int parseInt(Properties properties, String key, String defaultValue)
            throws ConfigurationException {
        final var value = properties.getProperty(key, defaultValue).trim();
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid value of " + key + ": '" + value + "'", e);
        }
    }
}
