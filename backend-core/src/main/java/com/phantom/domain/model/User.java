package com.phantom.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "users", indexes = {
        @Index(name = "idx_users_username", columnList = "username", unique = true)
})
public class User extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, unique = true, length = 150)
    private String username;

    private String name;

    @Column(nullable = false, length = 50)
    private String timezone = "UTC";

    @Column(name = "default_event_duration_minutes", nullable = false)
    private int defaultEventDurationMinutes = 60;
}
