package com.practicetracker.tracker.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.practicetracker.tracker.support.EpochSecondsSerializer;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One completion of a practice action. Records are append-only.
 */
@Entity
@Table(name = "practice_record",
        uniqueConstraints = @UniqueConstraint(name = "uk_practice_record_action_day",
                columnNames = {"action_id", "finish_day"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PracticeRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "action_id", nullable = false)
    private Long actionId;

    @JsonSerialize(using = EpochSecondsSerializer.class)
    @Column(name = "finish_time", nullable = false)
    private Instant finishTime;

    // UTC date of finishTime
    @JsonIgnore
    @Column(name = "finish_day", nullable = false)
    private LocalDate finishDay;

    @Column(name = "note")
    private String note;
}
