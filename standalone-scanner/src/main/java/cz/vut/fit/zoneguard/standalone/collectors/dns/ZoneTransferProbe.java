package cz.vut.fit.zoneguard.standalone.collectors.dns;

import org.jetbrains.annotations.NotNull;
import org.slf4j.LoggerFactory;
import org.xbill.DNS.Name;
import org.xbill.DNS.ZoneTransferException;
import org.xbill.DNS.ZoneTransferIn;

import java.io.IOException;
import java.time.Duration;

/**
 * Checks whether a name server answers a full zone transfer (AXFR) request for a zone.
 */
@FunctionalInterface
public interface ZoneTransferProbe {
    /**
     * @param zone       The absolute zone name.
     * @param nameServer The host name or address of the name server.
     * @param timeout    The maximum duration of the transfer.
     * @return true if the server sent the zone contents; false if it refused or the transfer failed.
     */
    boolean allowsTransfer(@NotNull Name zone, @NotNull String nameServer, @NotNull Duration timeout);

    /**
     * Creates a probe that performs a real AXFR using dnsjava. The transferred records are discarded.
     */
    static ZoneTransferProbe axfr() {
        final var logger = LoggerFactory.getLogger(ZoneTransferProbe.class);
        return (zone, nameServer, timeout) -> {
            try {
                final var transfer = ZoneTransferIn.newAXFR(zone, nameServer, null);
                transfer.setTimeout(timeout);
                transfer.run();
                return transfer.isAXFR() && !transfer.getAXFR().isEmpty();
            } catch (ZoneTransferException | IOException e) {
                // Refusals are the expected outcome
                logger.debug("AXFR of {} at {} failed: {}", zone, nameServer, e.getMessage());
                return false;
            }
        };
    }
}
