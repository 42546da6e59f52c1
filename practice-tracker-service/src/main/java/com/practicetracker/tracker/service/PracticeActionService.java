package com.practicetracker.tracker.service;

import com.practicetracker.tracker.entity.PracticeAction;
import com.practicetracker.tracker.entity.PracticeRecord;
import com.practicetracker.tracker.exception.ApiException;
import com.practicetracker.tracker.repository.PracticeActionRepository;
import com.practicetracker.tracker.repository.PracticeRecordRepository;
import com.practicetracker.tracker.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

@Service
public class PracticeActionService {

    private static final Logger log = LoggerFactory.getLogger(PracticeActionService.class);

    private final PracticeActionRepository actionRepository;
    private final PracticeRecordRepository recordRepository;
    private final UserRepository userRepository;
    private final Clock clock;

    public PracticeActionService(PracticeActionRepository actionRepository,
                                 PracticeRecordRepository recordRepository,
                                 UserRepository userRepository,
                                 Clock clock) {
        this.actionRepository = actionRepository;
        this.recordRepository = recordRepository;
        this.userRepository = userRepository;
        this.clock = clock;
    }

    /**
     * Create a new action for the user
     */
    @Transactional
    public PracticeAction create(Long userId, String name) {
        if (name == null || name.isBlank()) {
            throw ApiException.badRequest("Action name must not be blank");
        }
        // A validly signed token does not prove the account still exists.
        if (!userRepository.existsById(userId)) {
            throw ApiException.unauthorized("Unknown user");
        }

        PracticeAction action = actionRepository.save(PracticeAction.builder()
                .userId(userId)
                .name(name.trim())
                .createTime(clock.instant())
                .build());
        log.info("User {} created action {} '{}'", userId, action.getId(), action.getName());
        return action;
    }

    /**
     * Get an action, only if the user owns it
     */
    @Transactional(readOnly = true)
    public Optional<PracticeAction> find(Long userId, Long actionId) {
        return actionRepository.findByIdAndUserId(actionId, userId);
    }

    /**
     * Completion history of an owned action, newest first. Empty for actions
     * the user does not own.
     */
    @Transactional(readOnly = true)
    public List<PracticeRecord> records(Long userId, Long actionId) {
        if (!actionRepository.existsByIdAndUserId(actionId, userId)) {
            return List.of();
        }
        return recordRepository.findByActionIdOrderByFinishTimeDesc(actionId);
    }
}
