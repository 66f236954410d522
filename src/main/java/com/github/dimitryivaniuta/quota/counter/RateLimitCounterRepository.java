package com.github.dimitryivaniuta.quota.counter;

import com.github.dimitryivaniuta.quota.window.PeriodType;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface RateLimitCounterRepository extends JpaRepository<RateLimitCounter, UUID> {

    /**
     * Creates the window row with a zero count unless it already exists.
     * A concurrent insert of the same key waits on the unique index and then does nothing.
     *
     * @return 1 if this call created the row, 0 otherwise
     */
    @Modifying(flushAutomatically = true)
    @Query(value = """
            insert into rate_limit_counters
                (id, user_id, period_type, period_start, request_count, created_at, updated_at)
            values (:id, :userId, :periodType, :periodStart, 0, :now, :now)
            on conflict (user_id, period_type, period_start) do nothing
            """, nativeQuery = true)
    int insertIfAbsent(@Param("id") UUID id,
                       @Param("userId") String userId,
                       @Param("periodType") String periodType,
                       @Param("periodStart") Instant periodStart,
                       @Param("now") Instant now);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            select c from RateLimitCounter c
            where c.userId = :u and c.periodType = :t and c.periodStart = :s
            """)
    Optional<RateLimitCounter> findForUpdate(@Param("u") String userId,
                                             @Param("t") PeriodType periodType,
                                             @Param("s") Instant periodStart);

    Optional<RateLimitCounter> findByUserIdAndPeriodTypeAndPeriodStart(String userId,
                                                                       PeriodType periodType,
                                                                       Instant periodStart);

    List<RateLimitCounter> findByUserIdAndPeriodTypeOrderByPeriodStartDesc(String userId,
                                                                          PeriodType periodType,
                                                                          Pageable page);
}
