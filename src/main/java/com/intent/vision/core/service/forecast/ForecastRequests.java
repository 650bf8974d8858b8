package com.intent.vision.core.service.forecast;

import com.intent.vision.core.common.exception.InsufficientDataException;
import com.intent.vision.core.common.exception.InvalidParameterException;
import com.intent.vision.core.dto.ForecastRequest;
import com.intent.vision.core.dto.TimeSeriesPoint;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Validation and time helpers shared by every engine.
 */
final class ForecastRequests {

    static final int MIN_POINTS = 2;

    private ForecastRequests() {
    }

    static void validate(ForecastRequest request) {
        if (request == null) {
            throw new InvalidParameterException("ForecastRequest is required");
        }
        if (request.points().size() < MIN_POINTS) {
            throw new InsufficientDataException(request.points().size(), MIN_POINTS);
        }
        if (request.horizonDays() <= 0) {
            throw new InvalidParameterException("horizonDays must be positive, got " + request.horizonDays());
        }
        for (TimeSeriesPoint p : request.points()) {
            if (!Double.isFinite(p.value())) {
                throw new InvalidParameterException("Non-finite value at " + p.timestamp());
            }
        }
    }

    /**
     * Stable ascending copy; callers normally pass sorted data already.
     */
    static List<TimeSeriesPoint> sorted(List<TimeSeriesPoint> points) {
        List<TimeSeriesPoint> copy = new ArrayList<>(points);
        copy.sort(Comparator.comparing(TimeSeriesPoint::timestamp));
        return copy;
    }

    /**
     * Output cadence is always daily, starting the day after the last input point,
     * whatever the input sampling interval was.
     */
    static Instant stepTimestamp(Instant last, int step) {
        return last.plus(step, ChronoUnit.DAYS);
    }
}
