package com.practicetracker.tracker.entity;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.practicetracker.tracker.support.EpochSecondsSerializer;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A named recurring habit owned by one user
 */
@Entity
@Table(name = "practice_action", indexes = @Index(name = "idx_practice_action_user", columnList = "user_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PracticeAction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "name", nullable = false)
    private String name;

    @JsonSerialize(using = EpochSecondsSerializer.class)
    @Column(name = "create_time", nullable = false)
    private Instant createTime;

    // Mirrors the finish time of the newest record; written only by CompletionService.
    @JsonSerialize(using = EpochSecondsSerializer.class)
    @Column(name = "last_finish_time")
    private Instant lastFinishTime;

    @PrePersist
    protected void onCreate() {
        if (createTime == null) {
            createTime = Instant.now();
        }
    }
}
