package com.practicetracker.tracker.dto;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.practicetracker.tracker.entity.PracticeAction;
import com.practicetracker.tracker.support.EpochSecondsSerializer;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * A practice action together with its completion statistics. Not persisted.
 */
@Data
@Builder
public class ActionWithStats {
    private Long id;
    private Long userId;
    private String name;
    @JsonSerialize(using = EpochSecondsSerializer.class)
    private Instant createTime;
    @JsonSerialize(using = EpochSecondsSerializer.class)
    private Instant lastFinishTime;
    private long totalFinished;
    private boolean finishedToday;

    public static ActionWithStats of(PracticeAction action, long totalFinished, boolean finishedToday) {
        return ActionWithStats.builder()
                .id(action.getId())
                .userId(action.getUserId())
                .name(action.getName())
                .createTime(action.getCreateTime())
                .lastFinishTime(action.getLastFinishTime())
                .totalFinished(totalFinished)
                .finishedToday(finishedToday)
                .build();
    }
}
