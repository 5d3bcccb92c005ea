package cz.vut.fit.zoneguard.standalone.collectors.dns;

import org.junit.jupiter.api.Test;
import org.xbill.DNS.ARecord;
import org.xbill.DNS.DClass;
import org.xbill.DNS.Name;
import org.xbill.DNS.Record;
import org.xbill.DNS.Type;
import org.xbill.DNS.lookup.LookupResult;
import org.xbill.DNS.lookup.LookupSession;
import org.xbill.DNS.lookup.NoSuchDomainException;
import org.xbill.DNS.lookup.NoSuchRRSetException;

import java.io.IOException;
import java.net.InetAddress;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class RecordLookupTest {
    private static final Name NAME = Name.fromConstantString("example.com.");

    private final LookupSession session = mock(LookupSession.class);
    private final RecordLookup lookup = RecordLookup.of(session);

    @Test
    void returnsAnswerRecords() throws Exception {
        final Record record = new ARecord(NAME, DClass.IN, 300,
                InetAddress.getByAddress(new byte[]{(byte) 192, 0, 2, 1}));
        final var result = mock(LookupResult.class);
        when(result.getRecords()).thenReturn(List.of(record));
        when(session.lookupAsync(NAME, Type.A)).thenReturn(CompletableFuture.completedFuture(result));

        final var answer = lookup.lookup(NAME, Type.A).toCompletableFuture().get();

        assertEquals(List.of(record), answer.records());
        assertFalse(answer.nxdomain());
    }

    @Test
    void mapsNonExistentNameToNxdomain() throws Exception {
        when(session.lookupAsync(NAME, Type.A))
                .thenReturn(CompletableFuture.failedFuture(new NoSuchDomainException(NAME, Type.A)));

        assertSame(LookupAnswer.NXDOMAIN, lookup.lookup(NAME, Type.A).toCompletableFuture().get());
    }

    @Test
    void mapsMissingAliasTargetToNodata() throws Exception {
        final var target = Name.fromConstantString("orphan.example.net.");
        when(session.lookupAsync(NAME, Type.A))
                .thenReturn(CompletableFuture.failedFuture(new NoSuchDomainException(target, Type.A)));

        final var answer = lookup.lookup(NAME, Type.A).toCompletableFuture().get();

        assertSame(LookupAnswer.NODATA, answer);
        assertFalse(answer.nxdomain());
    }

    @Test
    void mapsMissingRecordSetToNodata() throws Exception {
        when(session.lookupAsync(NAME, Type.CAA))
                .thenReturn(CompletableFuture.failedFuture(new NoSuchRRSetException(NAME, Type.CAA)));

        assertSame(LookupAnswer.NODATA, lookup.lookup(NAME, Type.CAA).toCompletableFuture().get());
    }

    @Test
    void passesOtherFailuresOn() {
        when(session.lookupAsync(NAME, Type.MX))
                .thenReturn(CompletableFuture.failedFuture(new IOException("Timed out while trying to resolve")));

        final var e = assertThrows(ExecutionException.class,
                () -> lookup.lookup(NAME, Type.MX).toCompletableFuture().get());

        assertInstanceOf(IOException.class, e.getCause());
    }
}
