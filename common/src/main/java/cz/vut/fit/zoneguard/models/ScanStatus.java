package cz.vut.fit.zoneguard.models;

/**
 * The outcome of scanning a single domain.
 */
public enum ScanStatus {
    /**
     * All collectors succeeded.
     */
    OK,
    /**
     * At least one collector failed and at least one succeeded.
     */
    PARTIAL,
    /**
     * All collectors failed, no data was collected.
     */
    FAILED
}
