package com.practicetracker.tracker.service;

import com.practicetracker.tracker.repository.PracticeRecordRepository;
import com.practicetracker.tracker.support.UtcDay;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Decides whether an action may be completed on a given UTC calendar day
 */
@Service
public class EligibilityService {

    private final PracticeRecordRepository recordRepository;
    private final Clock clock;

    public EligibilityService(PracticeRecordRepository recordRepository, Clock clock) {
        this.recordRepository = recordRepository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public boolean canFinishToday(Long userId, Long actionId) {
        return canFinishToday(userId, actionId, clock.instant());
    }

    /**
     * True when the action has no record on the UTC date of {@code now}.
     * Joins in the caller's transaction when there is one.
     */
    @Transactional(readOnly = true)
    public boolean canFinishToday(Long userId, Long actionId, Instant now) {
        UtcDay day = UtcDay.of(now);
        return recordRepository.countOwnedBetween(userId, actionId, day.getStart(), day.getEnd()) == 0;
    }
}
