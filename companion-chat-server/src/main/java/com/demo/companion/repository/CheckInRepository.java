package com.demo.companion.repository;

import com.demo.companion.domain.CheckIn;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Read-only access to daily check-ins
 */
@Repository
public interface CheckInRepository extends JpaRepository<CheckIn, String> {

    /**
     * Completed check-ins dated on or after {@code since}, newest first
     */
    @Query("SELECT c FROM CheckIn c " +
           "WHERE c.userId = :userId " +
           "AND c.completed = true " +
           "AND c.date >= :since " +
           "ORDER BY c.date DESC")
    List<CheckIn> findCompletedSince(
        @Param("userId") String userId,
        @Param("since") Instant since
    );
}
