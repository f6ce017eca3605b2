package com.snubalink.service.core.cache;

import com.snubalink.query.SnubaQueryParams;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Rounds query bounds down to cache-friendly buckets. Each key gets its own offset inside the
 * hour so that not every cached query expires on the same boundary.
 */
public class TimeQuantizer {

    private final Duration duration;

    public TimeQuantizer(Duration duration) {
        if (duration.isZero() || duration.isNegative() || duration.getSeconds() > 3600) {
            throw new IllegalArgumentException("Quantize duration must be between 1s and 1h: " + duration);
        }
        this.duration = duration;
    }

    /** Never returns a time after {@code time}, and never more than one duration before it. */
    public Instant quantize(Instant time, int keyHash) {
        return quantize(time, keyHash, duration);
    }

    public static Instant quantize(Instant time, int keyHash, Duration duration) {
        long seconds = duration.getSeconds();
        long jitter = Math.floorMod((long) keyHash, seconds);
        Instant hour = time.truncatedTo(ChronoUnit.HOURS);
        long secondsPastHour = time.getEpochSecond() - hour.getEpochSecond();
        long windowStart = secondsPastHour / seconds * seconds + jitter;
        if (windowStart > secondsPastHour) {
            windowStart -= seconds;
        }
        return hour.plusSeconds(windowStart);
    }

    /** Copy of {@code params} with both bounds quantized; absent bounds stay absent. */
    public SnubaQueryParams quantizeWindow(SnubaQueryParams params, int keyHash) {
        SnubaQueryParams.Builder builder = params.toBuilder();
        if (params.getStart() != null) {
            builder.start(quantize(params.getStart(), keyHash));
        }
        if (params.getEnd() != null) {
            builder.end(quantize(params.getEnd(), keyHash));
        }
        return builder.build();
    }
}
