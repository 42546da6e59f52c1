package com.practicetracker.tracker.repository;

import com.practicetracker.tracker.entity.PracticeAction;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PracticeActionRepository extends JpaRepository<PracticeAction, Long> {

    Optional<PracticeAction> findByIdAndUserId(Long id, Long userId);

    boolean existsByIdAndUserId(Long id, Long userId);

    List<PracticeAction> findByUserId(Long userId);

    /**
     * Load an owned action and hold a row lock on it until the transaction ends
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM PracticeAction a WHERE a.id = :id AND a.userId = :userId")
    Optional<PracticeAction> lockByIdAndUserId(@Param("id") Long id, @Param("userId") Long userId);
}
