package com.yupacgo.backend.activity.repo;

import com.yupacgo.backend.activity.dto.ActionCount;
import com.yupacgo.backend.activity.entity.ActivityLog;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface ActivityLogRepository extends JpaRepository<ActivityLog, Long> {

    List<ActivityLog> findByUserIdOrderByOccurredAtDesc(Long userId, Pageable pageable);

    @Query("""
           select new com.yupacgo.backend.activity.dto.ActionCount(a.action, count(a))
             from ActivityLog a
            where a.occurredAt >= :since
            group by a.action
            order by count(a) desc
           """)
    List<ActionCount> countByActionSince(@Param("since") Instant since);

    long countByOccurredAtGreaterThanEqual(Instant since);
}
