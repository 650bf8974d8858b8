package com.intent.vision.core.service.backend;

import com.intent.vision.core.config.ForecastProperties;
import com.intent.vision.core.core.FastStateStore;
import com.intent.vision.core.dto.UsageCounter;
import com.intent.vision.core.dto.UsageReservation;
import com.intent.vision.core.enums.ForecastBackendType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Per organization, backend and UTC day call counters.
 * <p>
 * Counters live in the {@link FastStateStore} under
 * {@code usage:{orgId}:{backend}:{yyyy-MM-dd}} and expire after the configured
 * retention. A new day is a new key, so quotas reset at UTC midnight.
 */
@Service
@Slf4j
public class UsageTracker {

    private final FastStateStore fast;
    private final ForecastProperties props;
    private final Clock clock;

    public UsageTracker(FastStateStore fast, ForecastProperties props, Clock clock) {
        this.fast = fast;
        this.props = props;
        this.clock = clock;
    }

    public LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
    }

    public long getUsage(String orgId, ForecastBackendType backend) {
        return getUsage(orgId, backend, today());
    }

    public long getUsage(String orgId, ForecastBackendType backend, LocalDate day) {
        return fast.getLong(key(orgId, backend, day));
    }

    /**
     * Counts one successful call for today. Atomic at the store.
     */
    public long incrementUsage(String orgId, ForecastBackendType backend) {
        long count = fast.incr(key(orgId, backend, today()), props.getUsageRetention());
        log.debug("usage org={} backend={} count={}", orgId, backend.code(), count);
        return count;
    }

    /**
     * Reserves one call against {@code limit}. Empty, leaving the counter
     * untouched, when the reservation would go over the limit.
     */
    public Optional<UsageReservation> tryAcquire(String orgId, ForecastBackendType backend, int limit) {
        LocalDate day = today();
        String key = key(orgId, backend, day);
        long count = fast.incr(key, props.getUsageRetention());
        if (count > limit) {
            fast.decr(key);
            log.info("quota reservation refused org={} backend={} limit={}", orgId, backend.code(), limit);
            return Optional.empty();
        }
        return Optional.of(new UsageReservation(orgId, backend, day));
    }

    /**
     * Gives back a reservation on the counter of the day it was taken.
     */
    public void release(UsageReservation reservation) {
        long count = fast.decr(key(reservation.orgId(), reservation.backend(), reservation.day()));
        log.debug("usage released org={} backend={} day={} count={}", reservation.orgId(),
                reservation.backend().code(), reservation.day(), count);
    }

    /**
     * Daily counters of the paid backends, oldest day first, for the last {@code days} days including today.
     */
    public List<UsageCounter> getRecentUsage(String orgId, int days) {
        LocalDate end = today();
        List<UsageCounter> out = new ArrayList<>();
        for (int i = Math.max(1, days) - 1; i >= 0; i--) {
            LocalDate day = end.minusDays(i);
            for (ForecastBackendType backend : ForecastBackendType.values()) {
                if (backend.isPaid()) {
                    out.add(new UsageCounter(orgId, backend, day, getUsage(orgId, backend, day)));
                }
            }
        }
        return out;
    }

    static String key(String orgId, ForecastBackendType backend, LocalDate day) {
        return "usage:" + orgId + ":" + backend.code() + ":" + day;
    }
}
