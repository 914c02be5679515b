package com.phantom.domain.model;

import com.phantom.exception.InvalidEventTimeException;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "events", indexes = {
        @Index(name = "idx_events_user_starts_at", columnList = "user_id, starts_at"),
        @Index(name = "idx_events_category", columnList = "category_id")
})
public class Event extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @Column(nullable = false)
    private String title;

    @Column(columnDefinition = "text")
    private String description;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "category_id", nullable = false)
    private Category category;

    @Column(name = "starts_at", nullable = false)
    private OffsetDateTime startsAt;

    @Column(name = "ends_at", nullable = false)
    private OffsetDateTime endsAt;

    @Column(name = "is_flexible", nullable = false)
    private boolean flexible = true;

    @Column(name = "is_completed", nullable = false)
    private boolean completed;

    @Column(name = "google_event_id")
    private String googleEventId;

    public Duration duration() {
        return Duration.between(startsAt, endsAt);
    }

    // half-open, touching ranges do not conflict
    public boolean overlaps(Event other) {
        return startsAt.isBefore(other.endsAt) && other.startsAt.isBefore(endsAt);
    }

    @PrePersist
    @PreUpdate
    public void validateTimeRange() {
        if (startsAt == null || endsAt == null) {
            throw new InvalidEventTimeException("Event start and end time are required");
        }
        if (!endsAt.isAfter(startsAt)) {
            throw new InvalidEventTimeException(
                    "End time must be after start time: start=" + startsAt + ", end=" + endsAt);
        }
    }

    @Override
    public String toString() {
        return "Event{id=" + id + ", title='" + title + "', startsAt=" + startsAt + ", endsAt=" + endsAt + "}";
    }
}
