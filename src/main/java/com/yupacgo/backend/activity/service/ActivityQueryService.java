package com.yupacgo.backend.activity.service;

import com.yupacgo.backend.activity.dto.ActivityLogView;
import com.yupacgo.backend.activity.dto.ActivityStats;
import com.yupacgo.backend.activity.entity.ActivityLog;
import com.yupacgo.backend.activity.repo.ActivityLogRepository;
import jakarta.persistence.EntityManager;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

@Service
@Transactional(readOnly = true)
public class ActivityQueryService {

    static final int MAX_LIMIT = 200;

    private final ActivityLogRepository repo;
    private final EntityManager em;
    private final Clock clock;

    public ActivityQueryService(ActivityLogRepository repo, EntityManager em, Clock clock) {
        this.repo = repo;
        this.em = em;
        this.clock = clock;
    }

    /** newest first; skip/limit are raw offsets, not page numbers */
    public List<ActivityLogView> recent(int limit, int skip) {
        return em.createQuery("select a from ActivityLog a order by a.occurredAt desc, a.id desc", ActivityLog.class)
                .setFirstResult(Math.max(0, skip))
                .setMaxResults(clampLimit(limit))
                .getResultList()
                .stream()
                .map(ActivityLogView::of)
                .toList();
    }

    public ActivityStats stats(int days) {
        int period = Math.max(1, days);
        Instant now = clock.instant();
        Instant since = now.minus(Duration.ofDays(period));
        Instant startOfToday = LocalDate.ofInstant(now, ZoneOffset.UTC).atStartOfDay(ZoneOffset.UTC).toInstant();

        return new ActivityStats(
                repo.countByActionSince(since),
                repo.countByOccurredAtGreaterThanEqual(startOfToday),
                period
        );
    }

    public List<ActivityLogView> forUser(Long userId, int limit) {
        return repo.findByUserIdOrderByOccurredAtDesc(userId, PageRequest.of(0, clampLimit(limit)))
                .stream()
                .map(ActivityLogView::of)
                .toList();
    }

    private static int clampLimit(int limit) {
        if (limit <= 0) return 20;
        return Math.min(limit, MAX_LIMIT);
    }
}
