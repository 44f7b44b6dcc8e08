package com.yupacgo.backend.activity.entity;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Append-only. Identity fields are a snapshot taken when the action happened.
 */
@Data
@Entity
@Immutable
@Table(name = "activity_logs", indexes = {
        @Index(name = "idx_activity_user_time", columnList = "user_id, occurred_at"),
        @Index(name = "idx_activity_action_time", columnList = "action, occurred_at"),
        @Index(name = "idx_activity_time", columnList = "occurred_at")
})
public class ActivityLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(nullable = false, length = 64)
    private String action;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "details")
    private Map<String, Object> details = new LinkedHashMap<>();

    @Column(length = 255)
    private String email;

    @Column(length = 80)
    private String firstname;

    @Column(length = 80)
    private String lastname;

    @Column(name = "ip_address", length = 64)
    private String ipAddress;

    @Column(name = "user_agent", length = 512)
    private String userAgent;

    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;
}
