package cz.vut.fit.zoneguard.models;

public final class ResultCodes {
    /**
     * The operation was successful.
     */
    public static final int OK = 0;

    /**
     * A generic error not caused inside the scanner.
     */
    public static final int OTHER_EXTERNAL_ERROR = 10;

    /**
     * A generic error caused inside the scanner (e.g. invalid state, unexpected exception).
     */
    public static final int INTERNAL_ERROR = 20;

    /**
     * Object does not exist (NXDOMAIN, no WHOIS match).
     */
    public static final int NOT_FOUND = 30;

    /**
     * Invalid format of remote source's response.
     */
    public static final int INVALID_FORMAT = 40;

    /**
     * Error fetching from remote source.
     */
    public static final int CANNOT_FETCH = 50;

    /**
     * We are rate limited at the remote source.
     */
    public static final int RATE_LIMITED = 51;

    /**
     * The operation did not finish in time.
     */
    public static final int TIMEOUT = 52;

    /**
     * Invalid domain name.
     */
    public static final int INVALID_DOMAIN_NAME = 60;

    /**
     * Unexpected DNS error.
     */
    public static final int OTHER_DNS_ERROR = 70;

    private ResultCodes() {
    }

    /**
     * Returns a short symbolic name of a result code, used in reports.
     *
     * @param code the result code
     * @return the symbolic name, or {@code UNKNOWN_<code>} for codes not defined here
     */
    public static String nameOf(int code) {
        return switch (code) {
            case OK -> "OK";
            case OTHER_EXTERNAL_ERROR -> "OTHER_EXTERNAL_ERROR";
            case INTERNAL_ERROR -> "INTERNAL_ERROR";
            case NOT_FOUND -> "NOT_FOUND";
            case INVALID_FORMAT -> "INVALID_FORMAT";
            case CANNOT_FETCH -> "CANNOT_FETCH";
            case RATE_LIMITED -> "RATE_LIMITED";
            case TIMEOUT -> "TIMEOUT";
            case INVALID_DOMAIN_NAME -> "INVALID_DOMAIN_NAME";
            case OTHER_DNS_ERROR -> "OTHER_DNS_ERROR";
            default -> "UNKNOWN_" + code;
        };
    }
}
