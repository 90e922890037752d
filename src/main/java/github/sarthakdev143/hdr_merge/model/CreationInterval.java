package github.sarthakdev143.hdr_merge.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;

/**
 * Capture window of one exposure, from shutter open to shutter close.
 */
public record CreationInterval(Instant start, Instant end) implements Comparable<CreationInterval> {

    private static final Comparator<CreationInterval> ORDER = Comparator
            .comparing(CreationInterval::start)
            .thenComparing(CreationInterval::end);

    public CreationInterval {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Interval bounds are required.");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Interval end must not precede its start.");
        }
    }

    public static CreationInterval endingAt(Instant end, double shutterSeconds) {
        long shutterNanos = Math.round(Math.max(0.0, shutterSeconds) * 1_000_000_000L);
        return new CreationInterval(end.minusNanos(shutterNanos), end);
    }

    /**
     * Seconds between the end of this interval and the start of {@code next}; negative when they overlap.
     */
    public double secondsUntil(CreationInterval next) {
        return Duration.between(end, next.start()).toNanos() / 1_000_000_000.0;
    }

    @Override
    public int compareTo(CreationInterval other) {
        return ORDER.compare(this, other);
    }
}
