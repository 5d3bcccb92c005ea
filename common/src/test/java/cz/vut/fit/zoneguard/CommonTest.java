package cz.vut.fit.zoneguard;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;


public class CommonTest {

    @ParameterizedTest(name = "{index} => input={0}, expected={1}")
    @MethodSource("normalizeNameTestCases")
    void testNormalizeName(String input, String expected, String description) {
        assertEquals(expected, Common.normalizeName(input), description);
    }

    private static Stream<Arguments> normalizeNameTestCases() {
        return Stream.of(
                Arguments.of("Example.COM", "example.com", "Should convert the name to lower case."),
                Arguments.of("example.com.", "example.com", "Should strip the trailing dot of an absolute name."),
                Arguments.of("  example.com \t", "example.com", "Should trim surrounding whitespace."),
                Arguments.of("ns1.Example.net..", "ns1.example.net", "Should strip repeated trailing dots."),
                Arguments.of(null, "", "Should return an empty string for null.")
        );
    }

    @ParameterizedTest
    @ValueSource(strings = {"example.com", "www.example.co.uk", "xn--bcher-kva.de", "a.b.c.example.org"})
    void acceptsRegistrableNames(String name) {
        assertTrue(Common.isScannableDomainName(name));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "com", "co.uk", "localhost", "exa mple.com", "-bad-.com", "example..com"})
    void rejectsInvalidNamesAndPublicSuffixes(String name) {
        assertFalse(Common.isScannableDomainName(name));
    }

    @Test
    void mapperWritesDatesAsStrings() throws Exception {
        var mapper = Common.makeMapper().build();
        var json = mapper.writeValueAsString(java.time.LocalDate.of(2026, 10, 19));
        assertEquals("\"2026-10-19\"", json);
    }
}
