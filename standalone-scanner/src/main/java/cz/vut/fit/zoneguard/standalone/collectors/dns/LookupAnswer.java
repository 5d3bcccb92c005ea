package cz.vut.fit.zoneguard.standalone.collectors.dns;

import org.jetbrains.annotations.NotNull;
import org.xbill.DNS.Record;

import java.util.List;

/**
 * The outcome of a single DNS query that did not fail.
 *
 * @param records  The records in the answer; empty for NODATA and NXDOMAIN.
 * @param nxdomain True if the queried name does not exist.
 */
public record LookupAnswer(@NotNull List<Record> records, boolean nxdomain) {
    public static final LookupAnswer NXDOMAIN = new LookupAnswer(List.of(), true);
    public static final LookupAnswer NODATA = new LookupAnswer(List.of(), false);

    public LookupAnswer {
        records = List.copyOf(records);
    }

    public static LookupAnswer of(@NotNull List<Record> records) {
        return new LookupAnswer(records, false);
    }
}
