package com.practicetracker.tracker.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.practicetracker.tracker.support.EpochSecondsSerializer;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * Registered account. The password hash never leaves the service.
 */
@Entity
@Table(name = "users")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "username", nullable = false, unique = true)
    private String username;

    @JsonIgnore
    @ToString.Exclude
    @Column(name = "password_hash", nullable = false)
    private String passwordHash;

    @JsonSerialize(using = EpochSecondsSerializer.class)
    @Column(name = "create_time", nullable = false)
    private Instant createTime;

    @PrePersist
    protected void onCreate() {
        if (createTime == null) {
            createTime = Instant.now();
        }
    }
}
