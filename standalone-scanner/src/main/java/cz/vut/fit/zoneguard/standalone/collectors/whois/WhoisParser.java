package cz.vut.fit.zoneguard.standalone.collectors.whois;

import cz.vut.fit.zoneguard.Common;
import cz.vut.fit.zoneguard.errors.WhoisLookupException;
import cz.vut.fit.zoneguard.models.ResultCodes;
import cz.vut.fit.zoneguard.models.whois.WhoisRecord;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the free-text responses of WHOIS servers.
 * <p>
 * Responses are read as {@code key: value} lines (and the {@code [key] value} lines used by some ccTLD registries).
 * Keys are matched case-insensitively against the spellings used by the common gTLD and ccTLD registries.
 */
public final class WhoisParser {
    private static final List<String> REGISTRAR_KEYS = List.of(
            "registrar", "registrar name", "sponsoring registrar", "registrar organization");
    private static final List<String> CREATED_KEYS = List.of(
            "creation date", "created", "created on", "created date", "registered on", "registration time",
            "domain registration date", "registered", "domain record activated");
    private static final List<String> EXPIRES_KEYS = List.of(
            "registry expiry date", "registrar registration expiration date", "expiration date", "expiry date",
            "expires", "expires on", "expire date", "paid-till", "expiration time", "domain expiration date",
            "renewal date", "valid until", "expire");
    private static final List<String> NAME_SERVER_KEYS = List.of(
            "name server", "nameserver", "nserver", "name servers", "nameservers");
    private static final List<String> REGISTRANT_KEYS = List.of(
            "registrant name", "registrant", "registrant contact name", "registrant email", "registrant e-mail",
            "registrant phone", "registrant phone number", "registrant street", "registrant address");
    private static final List<String> REGISTRY_REFERRAL_KEYS = List.of("refer", "whois");
    private static final String REGISTRAR_REFERRAL_KEY = "registrar whois server";

    private static final List<String> REDACTION_MARKERS = List.of(
            "redacted", "privacy", "proxy", "protected", "withheld", "not disclosed", "gdpr", "whoisguard",
            "data protected", "contact privacy", "rdds");
    private static final List<String> RATE_LIMIT_MARKERS = List.of(
            "rate limit", "limit exceeded", "too many requests", "query rate", "exceeded the maximum",
            "quota exceeded", "try again later");
    private static final List<String> NOT_FOUND_MARKERS = List.of(
            "no match", "not found", "no data found", "no entries found", "no object found", "status: free",
            "status: available", "domain is available");

    private static final Pattern BRACKET_LINE = Pattern.compile("^\\[(.+?)]\\s*(.*)$");
    private static final Pattern YMD_DATE = Pattern.compile("(\\d{4})[-./](\\d{1,2})[-./](\\d{1,2})");
    private static final Pattern DMY_NAMED_DATE = Pattern.compile("(\\d{1,2})[- ]([A-Za-z]{3})[A-Za-z]*[- ](\\d{4})");
    private static final Pattern DMY_DATE = Pattern.compile("(\\d{1,2})[./](\\d{1,2})[./](\\d{4})");
    private static final List<String> MONTHS = List.of(
            "jan", "feb", "mar", "apr", "may", "jun", "jul", "aug", "sep", "oct", "nov", "dec");

    private WhoisParser() {
    }

    /**
     * Parses a domain WHOIS response.
     *
     * @param domain   The queried domain.
     * @param server   The server that sent the response.
     * @param response The response text.
     * @return The parsed record.
     * @throws WhoisLookupException with {@link ResultCodes#RATE_LIMITED} or {@link ResultCodes#NOT_FOUND} if the
     *                              response is such a banner, or {@link ResultCodes#INVALID_FORMAT} if it does not
     *                              contain an expiration date.
     */
    public static @NotNull WhoisRecord parse(@NotNull String domain, @NotNull String server,
                                             @NotNull String response) throws WhoisLookupException {
        final var fields = readFields(response);
        final var expires = firstDate(fields, EXPIRES_KEYS);

        if (expires == null) {
            final var lower = response.toLowerCase(Locale.ROOT);
            if (containsAny(lower, RATE_LIMIT_MARKERS))
                throw new WhoisLookupException(domain, ResultCodes.RATE_LIMITED,
                        "Rate limited by WHOIS server " + server);
            if (containsAny(lower, NOT_FOUND_MARKERS))
                throw new WhoisLookupException(domain, ResultCodes.NOT_FOUND,
                        "No WHOIS data for the domain at " + server);
            throw new WhoisLookupException(domain, ResultCodes.INVALID_FORMAT,
                    "The response of " + server + " contains no expiration date");
        }

        final var nameServers = new TreeSet<String>();
        for (var key : NAME_SERVER_KEYS) {
            for (var value : fields.getOrDefault(key, List.of())) {
                // Some registries append the glue addresses
                final var host = Common.normalizeName(value.split("\\s+")[0]);
                if (!host.isEmpty()) {
                    nameServers.add(host);
                }
            }
        }

        return new WhoisRecord(
                firstValue(fields, REGISTRAR_KEYS),
                firstDate(fields, CREATED_KEYS),
                expires,
                List.copyOf(nameServers),
                isPrivacyProtected(fields),
                server);
    }

    /**
     * Finds the registry WHOIS server in a response of the IANA root WHOIS server.
     *
     * @param response The response to a TLD query.
     * @return The host name of the server, or null if the response names none.
     */
    public static @Nullable String findRegistryServer(@NotNull String response) {
        final var value = firstValue(readFields(response), REGISTRY_REFERRAL_KEYS);
        return value == null ? null : normalizeServer(value);
    }

    /**
     * Finds the {@code Registrar WHOIS Server} referral in a registry response.
     *
     * @param response The registry response.
     * @return The host name of the registrar's server, or null if the response names none.
     */
    public static @Nullable String findRegistrarServer(@NotNull String response) {
        final var value = firstValue(readFields(response), List.of(REGISTRAR_REFERRAL_KEY));
        return value == null ? null : normalizeServer(value);
    }

    /**
     * Strips the URL scheme, port and path that some registries put around the server name.
     */
    static @Nullable String normalizeServer(@NotNull String value) {
        var server = value.trim();
        final var schemeEnd = server.indexOf("://");
        if (schemeEnd >= 0) {
            server = server.substring(schemeEnd + 3);
        }

        final var pathStart = server.indexOf('/');
        if (pathStart >= 0) {
            server = server.substring(0, pathStart);
        }

        final var portStart = server.indexOf(':');
        if (portStart >= 0) {
            server = server.substring(0, portStart);
        }

        server = Common.normalizeName(server);
        return server.isEmpty() ? null : server;
    }

    /**
     * Parses a WHOIS date value. Supported are year-first dates with any time suffix
     * ({@code 2026-10-19T04:00:00Z}, {@code 2026.10.19}, {@code 2026/10/19}), day-first dates with a month name
     * ({@code 19-Oct-2026}, {@code 19 October 2026}) and numeric day-first dates ({@code 19.10.2026}).
     *
     * @param value The value.
     * @return The date, or null if the value is not a date.
     */
    static @Nullable LocalDate parseDate(@NotNull String value) {
        try {
            Matcher matcher = YMD_DATE.matcher(value);
            if (matcher.find()) {
                return LocalDate.of(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)),
                        Integer.parseInt(matcher.group(3)));
            }

            matcher = DMY_NAMED_DATE.matcher(value);
            if (matcher.find()) {
                final var month = MONTHS.indexOf(matcher.group(2).toLowerCase(Locale.ROOT));
                if (month >= 0) {
                    return LocalDate.of(Integer.parseInt(matcher.group(3)), month + 1,
                            Integer.parseInt(matcher.group(1)));
                }
            }

            matcher = DMY_DATE.matcher(value);
            if (matcher.find()) {
                return LocalDate.of(Integer.parseInt(matcher.group(3)), Integer.parseInt(matcher.group(2)),
                        Integer.parseInt(matcher.group(1)));
            }
        } catch (DateTimeException e) {
            return null;
        }

        return null;
    }

    /**
     * A registrant is considered visible if any of its name, e-mail, phone or street values is present
     * and does not contain a redaction marker.
     */
    private static boolean isPrivacyProtected(Map<String, List<String>> fields) {
        for (var key : REGISTRANT_KEYS) {
            for (var value : fields.getOrDefault(key, List.of())) {
                final var lower = value.toLowerCase(Locale.ROOT);
                if (!lower.isBlank() && !containsAny(lower, REDACTION_MARKERS)) {
                    return false;
                }
            }
        }
        return true;
    }

    private static Map<String, List<String>> readFields(String response) {
        final var fields = new LinkedHashMap<String, List<String>>();

        for (var rawLine : response.split("\\R")) {
            final var line = rawLine.strip();
            if (line.isEmpty() || line.startsWith("%") || line.startsWith("#")) {
                continue;
            }

            String key, value;
            final var bracket = BRACKET_LINE.matcher(line);
            if (bracket.matches()) {
                key = bracket.group(1);
                value = bracket.group(2);
            } else {
                final var separator = line.indexOf(':');
                if (separator <= 0) {
                    continue;
                }
                key = line.substring(0, separator);
                value = line.substring(separator + 1);
            }

            value = value.strip();
            if (!value.isEmpty()) {
                fields.computeIfAbsent(key.strip().toLowerCase(Locale.ROOT), k -> new ArrayList<>()).add(value);
            }
        }

        return fields;
    }

    private static @Nullable String firstValue(Map<String, List<String>> fields, List<String> keys) {
        for (var key : keys) {
            final var values = fields.get(key);
            if (values != null && !values.isEmpty()) {
                return values.get(0);
            }
        }
        return null;
    }

    private static @Nullable LocalDate firstDate(Map<String, List<String>> fields, List<String> keys) {
        for (var key : keys) {
            for (var value : fields.getOrDefault(key, List.of())) {
                final var date = parseDate(value);
                if (date != null) {
                    return date;
                }
            }
        }
        return null;
    }

    private static boolean containsAny(String text, List<String> markers) {
        for (var marker : markers) {
            if (text.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
