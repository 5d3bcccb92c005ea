package cz.vut.fit.zoneguard.standalone.scanner;

import cz.vut.fit.zoneguard.models.results.BatchResult;
import cz.vut.fit.zoneguard.models.results.DomainScanResult;
import org.jetbrains.annotations.NotNull;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * A running batch scan started by {@link DomainScanner#start}.
 */
public class ScanHandle {
    private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(ScanHandle.class);

    private final List<String> _domains;
    private final ExecutorService _executor;
    private final AtomicReferenceArray<DomainScanResult> _slots;
    private final AtomicBoolean _cancelled = new AtomicBoolean();

    ScanHandle(@NotNull List<String> domains, @NotNull ExecutorService executor,
               @NotNull AtomicReferenceArray<DomainScanResult> slots) {
        _domains = domains;
        _executor = executor;
        _slots = slots;
    }

    /**
     * @return the normalized, de-duplicated domains of the batch in scan order
     */
    public @NotNull List<String> getDomains() {
        return _domains;
    }

    /**
     * @return true if all domain scans have finished or were cancelled
     */
    public boolean isDone() {
        return _executor.isTerminated();
    }

    public boolean isCancelled() {
        return _cancelled.get();
    }

    /**
     * Cancels the batch. Domains that have not started are skipped and the running scans are interrupted.
     * The results of the domains that have already finished are kept. Has no effect on a finished batch.
     */
    public void cancel() {
        if (_executor.isTerminated())
            return;

        if (_cancelled.compareAndSet(false, true)) {
            Logger.info("Cancelling the scan");
        }
        _executor.shutdownNow();
    }

    /**
     * Waits until the batch finishes and returns its result. If the waiting thread is interrupted, the batch is
     * cancelled, the result of the cancelled batch is returned and the thread's interrupt status is restored.
     *
     * @return The batch result.
     */
    public @NotNull BatchResult await() {
        var interrupted = false;
        while (!_executor.isTerminated()) {
            try {
                //noinspection ResultOfMethodCallIgnored
                _executor.awaitTermination(1, TimeUnit.MINUTES);
            } catch (InterruptedException e) {
                interrupted = true;
                cancel();
            }
        }

        if (interrupted) {
            Thread.currentThread().interrupt();
        }

        return buildResult();
    }

    private BatchResult buildResult() {
        final var results = new LinkedHashMap<String, DomainScanResult>();
        final var skipped = new ArrayList<String>();

        for (var i = 0; i < _domains.size(); i++) {
            final var result = _slots.get(i);
            if (result != null) {
                results.put(_domains.get(i), result);
            } else {
                skipped.add(_domains.get(i));
            }
        }

        Logger.info("Scan finished: {} domains scanned, {} skipped", results.size(), skipped.size());
        return new BatchResult(results, ReportAggregator.aggregate(results.values()), skipped, _cancelled.get());
    }
}
