package cz.vut.fit.zoneguard.standalone.collectors.dns;

import org.jetbrains.annotations.NotNull;
import org.xbill.DNS.Name;
import org.xbill.DNS.lookup.LookupSession;
import org.xbill.DNS.lookup.NoSuchDomainException;
import org.xbill.DNS.lookup.NoSuchRRSetException;

import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

/**
 * Performs asynchronous DNS queries for the {@link DNSCollector}.
 */
@FunctionalInterface
public interface RecordLookup {
    /**
     * Queries the records of a type for a name. Non-existent names and empty answers complete normally with
     * {@link LookupAnswer#NXDOMAIN} and {@link LookupAnswer#NODATA}; every other failure completes the stage
     * exceptionally.
     *
     * @param name The absolute name to query.
     * @param type The record type, see {@link org.xbill.DNS.Type}.
     * @return A stage completed with the answer.
     */
    CompletionStage<LookupAnswer> lookup(@NotNull Name name, int type);

    /**
     * Creates a lookup backed by a dnsjava lookup session.
     * <p>
     * The session follows CNAME and DNAME records, so a non-existent name reported by the session may be the
     * target of an alias. Only the queried name itself missing is reported as {@link LookupAnswer#NXDOMAIN};
     * an alias to a missing target is an empty answer.
     */
    static RecordLookup of(@NotNull LookupSession session) {
        return (name, type) -> session.lookupAsync(name, type)
                .handle((result, exc) -> {
                    if (exc == null) {
                        return result == null ? LookupAnswer.NODATA : LookupAnswer.of(result.getRecords());
                    }

                    // Extract the actual exception
                    final var cause = exc instanceof CompletionException && exc.getCause() != null
                            ? exc.getCause() : exc;
                    if (cause instanceof NoSuchDomainException noSuchDomain) {
                        return name.equals(noSuchDomain.getName()) ? LookupAnswer.NXDOMAIN : LookupAnswer.NODATA;
                    }
                    if (cause instanceof NoSuchRRSetException) {
                        return LookupAnswer.NODATA;
                    }
                    throw new CompletionException(cause);
                });
    }
}
