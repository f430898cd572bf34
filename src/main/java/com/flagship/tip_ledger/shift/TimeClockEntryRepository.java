package com.flagship.tip_ledger.shift;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TimeClockEntryRepository extends JpaRepository<TimeClockEntryEntity, UUID> {

    Optional<TimeClockEntryEntity> findByEmployeeIdAndClockedOutAtIsNull(UUID employeeId);

    /**
     * Stints of an employee in a role that cover {@code at}.
     */
    @Query("""
        SELECT e FROM TimeClockEntryEntity e
        WHERE e.employeeId = :employeeId
          AND e.role = :role
          AND e.clockedInAt <= :at
          AND (e.clockedOutAt IS NULL OR e.clockedOutAt > :at)
        """)
    List<TimeClockEntryEntity> findCovering(@Param("employeeId") UUID employeeId,
                                            @Param("role") String role,
                                            @Param("at") Instant at);

    List<TimeClockEntryEntity> findByEmployeeIdOrderByClockedInAtDesc(UUID employeeId);
}
