package cz.vut.fit.zoneguard;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.cfg.MapperBuilder;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.common.net.InternetDomainName;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;

/**
 * Common utility functions and constants.
 */
public final class Common {
    private Common() {
    }

    /**
     * Creates a new Jackson JSON {@link ObjectMapper} builder with the following settings:
     * <ul>
     *     <li>Include the JavaTimeModule to support Java 8 date/time datatypes.</li>
     *     <li>Include source locations in exceptions.</li>
     *     <li>Write dates as ISO-8601 strings, not as timestamps.</li>
     *     <li>Do not fail on unknown properties.</li>
     * </ul>
     *
     * @return a new {@link MapperBuilder} instance
     */
    public static MapperBuilder<? extends ObjectMapper, ?> makeMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .configure(JsonParser.Feature.INCLUDE_SOURCE_IN_LOCATION, true)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Normalizes a host or domain name: trims whitespace, converts it to lower case and strips
     * the trailing dot of an absolute name.
     *
     * @param name the name to normalize
     * @return the normalized name, or an empty string if the input is {@code null}
     */
    public static @NotNull String normalizeName(@Nullable String name) {
        if (name == null)
            return "";

        var result = name.trim().toLowerCase(Locale.ROOT);
        while (result.endsWith(".")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    /**
     * Checks whether the given (normalized) name is a syntactically valid domain name under a public suffix.
     * Public suffixes themselves (e.g. {@code co.uk}) are not accepted as scan targets.
     *
     * @param domainName the domain name to check
     * @return true if the name can be scanned
     */
    public static boolean isScannableDomainName(@NotNull String domainName) {
        if (domainName.isEmpty() || !InternetDomainName.isValid(domainName))
            return false;

        final var name = InternetDomainName.from(domainName);
        return name.hasPublicSuffix() && !name.isPublicSuffix();
    }
}
