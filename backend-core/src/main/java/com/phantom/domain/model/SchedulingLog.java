package com.phantom.domain.model;

import com.phantom.domain.enums.SchedulingAction;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "scheduling_logs", indexes = {
        @Index(name = "idx_scheduling_logs_user_created", columnList = "user_id, created_at")
})
public class SchedulingLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SchedulingAction action;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "event_id")
    private Event event;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false)
    private Map<String, Object> details = new LinkedHashMap<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    public static SchedulingLog of(User user, SchedulingAction action, Map<String, Object> details, Clock clock) {
        SchedulingLog log = new SchedulingLog();
        log.setUser(user);
        log.setAction(action);
        log.setDetails(new LinkedHashMap<>(details));
        log.setCreatedAt(OffsetDateTime.now(clock));
        return log;
    }
}
