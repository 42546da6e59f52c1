package com.practicetracker.tracker.service;

import com.practicetracker.tracker.dto.ActionWithStats;
import com.practicetracker.tracker.entity.PracticeAction;
import com.practicetracker.tracker.repository.PracticeActionRepository;
import com.practicetracker.tracker.repository.PracticeRecordRepository;
import com.practicetracker.tracker.support.UtcDay;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds the per-action statistics shown on a user's action list
 */
@Service
public class ActionStatsService {

    /**
     * Pending today first, then most recently finished (never finished last),
     * then newest.
     */
    static final Comparator<ActionWithStats> DISPLAY_ORDER =
            Comparator.comparing(ActionWithStats::isFinishedToday)
                    .thenComparing(ActionWithStats::getLastFinishTime,
                            Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
                    .thenComparing(ActionWithStats::getCreateTime,
                            Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
                    .thenComparing(ActionWithStats::getId,
                            Comparator.nullsLast(Comparator.<Long>reverseOrder()));

    private final PracticeActionRepository actionRepository;
    private final PracticeRecordRepository recordRepository;
    private final Clock clock;

    public ActionStatsService(PracticeActionRepository actionRepository,
                              PracticeRecordRepository recordRepository,
                              Clock clock) {
        this.actionRepository = actionRepository;
        this.recordRepository = recordRepository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<ActionWithStats> listWithStats(Long userId) {
        return listWithStats(userId, clock.instant());
    }

    /**
     * All actions of a user with their total record count and whether they were
     * finished on the UTC date of {@code now}. Totals come from the record
     * table, not from the cached last finish time.
     */
    @Transactional(readOnly = true)
    public List<ActionWithStats> listWithStats(Long userId, Instant now) {
        List<PracticeAction> actions = actionRepository.findByUserId(userId);
        if (actions.isEmpty()) {
            return List.of();
        }

        Map<Long, Long> totals = recordRepository.countPerActionForUser(userId).stream()
                .collect(Collectors.toMap(
                        PracticeRecordRepository.ActionRecordCount::getActionId,
                        PracticeRecordRepository.ActionRecordCount::getTotal));

        UtcDay today = UtcDay.of(now);
        Set<Long> finishedToday = new HashSet<>(
                recordRepository.findActionIdsFinishedBetween(userId, today.getStart(), today.getEnd()));

        return actions.stream()
                .map(a -> ActionWithStats.of(a,
                        totals.getOrDefault(a.getId(), 0L),
                        finishedToday.contains(a.getId())))
                .sorted(DISPLAY_ORDER)
                .collect(Collectors.toList());
    }
}
