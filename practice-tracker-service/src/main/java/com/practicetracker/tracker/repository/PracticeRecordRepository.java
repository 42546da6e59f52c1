package com.practicetracker.tracker.repository;

import com.practicetracker.tracker.entity.PracticeRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface PracticeRecordRepository extends JpaRepository<PracticeRecord, Long> {

    /**
     * Per-action record total for one user's actions
     */
    interface ActionRecordCount {
        Long getActionId();

        Long getTotal();
    }

    List<PracticeRecord> findByActionIdOrderByFinishTimeDesc(Long actionId);

    @Query("SELECT COUNT(r) FROM PracticeRecord r, PracticeAction a " +
           "WHERE r.actionId = a.id AND r.actionId = :actionId AND a.userId = :userId " +
           "AND r.finishTime >= :start AND r.finishTime < :end")
    long countOwnedBetween(@Param("userId") Long userId,
                           @Param("actionId") Long actionId,
                           @Param("start") Instant start,
                           @Param("end") Instant end);

    @Query("SELECT r.actionId AS actionId, COUNT(r) AS total FROM PracticeRecord r " +
           "WHERE r.actionId IN (SELECT a.id FROM PracticeAction a WHERE a.userId = :userId) " +
           "GROUP BY r.actionId")
    List<ActionRecordCount> countPerActionForUser(@Param("userId") Long userId);

    @Query("SELECT DISTINCT r.actionId FROM PracticeRecord r " +
           "WHERE r.actionId IN (SELECT a.id FROM PracticeAction a WHERE a.userId = :userId) " +
           "AND r.finishTime >= :start AND r.finishTime < :end")
    List<Long> findActionIdsFinishedBetween(@Param("userId") Long userId,
                                            @Param("start") Instant start,
                                            @Param("end") Instant end);
}
