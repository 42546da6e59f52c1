package com.practicetracker.tracker.service;

import com.practicetracker.tracker.entity.PracticeAction;
import com.practicetracker.tracker.entity.PracticeRecord;
import com.practicetracker.tracker.exception.ApiException;
import com.practicetracker.tracker.exception.ErrorCode;
import com.practicetracker.tracker.repository.PracticeActionRepository;
import com.practicetracker.tracker.repository.PracticeRecordRepository;
import com.practicetracker.tracker.support.UtcDay;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Records the completion of a practice action
 */
@Service
public class CompletionService {

    private static final Logger log = LoggerFactory.getLogger(CompletionService.class);

    private final PracticeActionRepository actionRepository;
    private final PracticeRecordRepository recordRepository;
    private final EligibilityService eligibilityService;
    private final Clock clock;

    public CompletionService(PracticeActionRepository actionRepository,
                             PracticeRecordRepository recordRepository,
                             EligibilityService eligibilityService,
                             Clock clock) {
        this.actionRepository = actionRepository;
        this.recordRepository = recordRepository;
        this.eligibilityService = eligibilityService;
        this.clock = clock;
    }

    @Transactional
    public PracticeRecord finish(Long userId, Long actionId, String note) {
        return finish(userId, actionId, clock.instant(), note);
    }

    /**
     * Mark an owned action as finished at {@code now}.
     * <p>
     * The ownership check, the same-day check, the last finish time update and
     * the record insert run in one transaction while the action row is locked,
     * so two concurrent calls for the same day cannot both succeed. The unique
     * (action, day) constraint on the record table backs this up.
     *
     * @throws ApiException NOT_FOUND if the action does not exist or belongs to
     *                      someone else, CONFLICT if it was already finished on
     *                      now's UTC date
     */
    @Transactional
    public PracticeRecord finish(Long userId, Long actionId, Instant now, String note) {
        PracticeAction action = actionRepository.lockByIdAndUserId(actionId, userId)
                .orElseThrow(() -> ApiException.notFound("Action not found"));

        if (!eligibilityService.canFinishToday(userId, actionId, now)) {
            throw ApiException.conflict("Already completed today");
        }

        action.setLastFinishTime(now);
        actionRepository.save(action);

        PracticeRecord record = PracticeRecord.builder()
                .actionId(actionId)
                .finishTime(now)
                .finishDay(UtcDay.of(now).getDate())
                .note(note)
                .build();
        try {
            record = recordRepository.saveAndFlush(record);
        } catch (DataIntegrityViolationException e) {
            throw new ApiException(ErrorCode.CONFLICT,
                    "Already completed today", e);
        }

        log.info("User {} finished action {} (record {})", userId, actionId, record.getId());
        return record;
    }
}
