package com.github.dimitryivaniuta.quota.counter;

import com.github.dimitryivaniuta.quota.limits.Limit;
import com.github.dimitryivaniuta.quota.limits.LimitTriple;
import com.github.dimitryivaniuta.quota.window.InvalidPeriodTypeException;
import com.github.dimitryivaniuta.quota.window.PeriodType;
import com.github.dimitryivaniuta.quota.window.PeriodWindow;
import com.github.dimitryivaniuta.quota.window.TimeWindowCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Check-and-increment engine over {@code rate_limit_counters}.
 *
 * <p>For every finite period (HOURLY, DAILY, MONTHLY, in that order) the window row is created
 * if absent and then locked with {@code SELECT ... FOR UPDATE}. Only when all locked rows are
 * below their limits are they incremented, all in the same transaction, so a denied request
 * changes nothing. The fixed lock order keeps two calls for the same user from deadlocking;
 * different users never share a row.
 *
 * <p>Unbounded periods are skipped and never touch storage. Storage errors propagate as
 * Spring {@code DataAccessException}s; nothing is retried here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CounterStore {

    private final RateLimitCounterRepository repo;

    @Transactional
    public CheckOutcome checkAndIncrement(String userId, LimitTriple limits, Instant subscriptionAnchor, Instant now) {
        requireUserId(userId);

        List<Slot> slots = new ArrayList<>(PeriodType.values().length);
        for (PeriodType type : PeriodType.values()) {
            Limit limit = limits.get(type);
            if (limit.isUnbounded()) {
                continue;
            }

            PeriodWindow window = TimeWindowCalculator.windowFor(type, subscriptionAnchor, now);
            repo.insertIfAbsent(UUID.randomUUID(), userId, type.name(), window.start(), now);
            RateLimitCounter row = repo.findForUpdate(userId, type, window.start())
                    .orElseThrow(() -> new IllegalStateException(
                            "Counter row missing after insert: " + userId + "/" + type + "/" + window.start()));
            slots.add(new Slot(type, limit, window, row.getRequestCount(), row));
        }

        boolean allowed = slots.stream().allMatch(Slot::admits);
        if (allowed) {
            for (Slot s : slots) {
                s.row().setRequestCount(s.row().getRequestCount() + 1);
            }
        } else {
            log.debug("Quota denied for user {} (exhausted: {})", userId, exhausted(slots));
        }
        return outcome(allowed, allowed, slots);
    }

    /**
     * Same decision as {@link #checkAndIncrement} without creating or changing any row.
     */
    @Transactional(readOnly = true)
    public CheckOutcome checkOnly(String userId, LimitTriple limits, Instant subscriptionAnchor, Instant now) {
        requireUserId(userId);

        List<Slot> slots = new ArrayList<>(PeriodType.values().length);
        for (PeriodType type : PeriodType.values()) {
            Limit limit = limits.get(type);
            if (limit.isUnbounded()) {
                continue;
            }

            PeriodWindow window = TimeWindowCalculator.windowFor(type, subscriptionAnchor, now);
            RateLimitCounter row = repo.findByUserIdAndPeriodTypeAndPeriodStart(userId, type, window.start())
                    .orElse(null);
            slots.add(new Slot(type, limit, window, row == null ? 0 : row.getRequestCount(), row));
        }
        return outcome(slots.stream().allMatch(Slot::admits), false, slots);
    }

    /**
     * Stored windows for one period type, most recent first. Windows without a row are not
     * synthesised.
     */
    @Transactional(readOnly = true)
    public List<CounterHistoryEntry> getHistory(String userId, PeriodType periodType, Instant subscriptionAnchor, int limit) {
        requireUserId(userId);
        if (periodType == null) {
            throw new InvalidPeriodTypeException(null);
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, got " + limit);
        }

        return repo.findByUserIdAndPeriodTypeOrderByPeriodStartDesc(userId, periodType, PageRequest.of(0, limit))
                .stream()
                .map(r -> new CounterHistoryEntry(
                        r.getPeriodStart(),
                        TimeWindowCalculator.windowFor(periodType, subscriptionAnchor, r.getPeriodStart()).end(),
                        r.usedCount()))
                .toList();
    }

    private static CheckOutcome outcome(boolean allowed, boolean incremented, List<Slot> slots) {
        LimitTriple remaining = LimitTriple.UNBOUNDED;
        Instant retryAt = null;
        for (Slot s : slots) {
            int used = incremented ? s.countBefore() + 1 : s.countBefore();
            remaining = remaining.with(s.type(), s.limit().remainingAfter(Math.max(0, used)));
            if (!s.admits() && (retryAt == null || s.window().end().isAfter(retryAt))) {
                retryAt = s.window().end();
            }
        }
        return new CheckOutcome(allowed, remaining, exhausted(slots), retryAt);
    }

    private static Set<PeriodType> exhausted(List<Slot> slots) {
        Set<PeriodType> out = EnumSet.noneOf(PeriodType.class);
        for (Slot s : slots) {
            if (!s.admits()) {
                out.add(s.type());
            }
        }
        return out;
    }

    private static void requireUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
    }

    private record Slot(PeriodType type, Limit limit, PeriodWindow window, int countBefore, RateLimitCounter row) {
        boolean admits() {
            return limit.admits(countBefore);
        }
    }
}
