package org.tsappend.datapipeline.merge;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

import org.tsappend.datapipeline.api.dataset.Coordinate;
import org.tsappend.datapipeline.api.dataset.Dataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Enforces a rolling retention window along the ordering dimension.
 * <p>
 * When the span between the first and last ordinal exceeds the maximum duration, the oldest
 * samples are dropped until it no longer does. Only a contiguous prefix is ever removed, and
 * at least one sample always survives.
 */
public class WindowTrimmer {

    private static final Logger log = LoggerFactory.getLogger(WindowTrimmer.class);

    /**
     * Outcome of {@link #trim(Dataset, String, Optional)}.
     *
     * @param dataset the trimmed dataset
     * @param trimmed number of samples dropped from the front
     */
    public record TrimResult(Dataset dataset, int trimmed) {
    }

    /**
     * Trims {@code dataset} to at most {@code maxDuration} along {@code orderingDim}.
     *
     * @param dataset     dataset sorted along {@code orderingDim}
     * @param orderingDim name of the ordering dimension
     * @param maxDuration retention window; empty keeps everything
     * @return the trimmed dataset and the number of dropped samples
     */
    public TrimResult trim(Dataset dataset, String orderingDim, Optional<Duration> maxDuration) {
        if (maxDuration.isEmpty()) {
            return new TrimResult(dataset, 0);
        }
        Coordinate coordinate = OrderingCoordinates.find(dataset, orderingDim);
        long[] ordinals = coordinate.getOrdinals();
        if (ordinals.length == 0) {
            return new TrimResult(dataset, 0);
        }

        Duration max = maxDuration.get();
        ChronoUnit unit = coordinate.getUnit();
        int last = ordinals.length - 1;
        Optional<Duration> span = spanOf(ordinals[0], ordinals[last], unit);
        log.info("New dataset duration: {}", describe(span));
        if (fits(span, max)) {
            return new TrimResult(dataset, 0);
        }

        log.info("Dataset duration {} exceeds max duration {}", describe(span), max);
        int idx = firstWithin(ordinals, unit, max);
        Dataset trimmed = dataset.slice(orderingDim, idx, ordinals.length);
        log.info("Dropped {} time steps. New dataset duration: {}",
                String.format("%,d", idx), describe(spanOf(ordinals[idx], ordinals[last], unit)));
        return new TrimResult(trimmed, idx);
    }

    /**
     * Binary search for the smallest index whose distance to the last ordinal fits in
     * {@code max}. Returns the last index if none does (zero or negative {@code max}).
     */
    static int firstWithin(long[] ordinals, ChronoUnit unit, Duration max) {
        int last = ordinals.length - 1;
        int lo = 0;
        int hi = last;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (fits(spanOf(ordinals[mid], ordinals[last], unit), max)) {
                hi = mid;
            } else {
                lo = mid + 1;
            }
        }
        return lo;
    }

    /**
     * Distance from {@code from} to {@code to} in {@code unit}, or empty when it is too large for
     * a {@link Duration}.
     */
    static Optional<Duration> spanOf(long from, long to, ChronoUnit unit) {
        try {
            return Optional.of(unit.getDuration().multipliedBy(Math.subtractExact(to, from)));
        } catch (ArithmeticException e) {
            return Optional.empty();
        }
    }

    // An unrepresentable span exceeds every window
    private static boolean fits(Optional<Duration> span, Duration max) {
        return span.isPresent() && span.get().compareTo(max) <= 0;
    }

    private static String describe(Optional<Duration> span) {
        return span.map(Duration::toString).orElse("out of Duration range");
    }
}
