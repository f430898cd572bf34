package com.flagship.tip_ledger.shift;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "time_clock_entries")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TimeClockEntryEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "employee_id", nullable = false, updatable = false)
    private UUID employeeId;

    @Column(name = "role", nullable = false, length = 50, updatable = false)
    private String role;

    @Column(name = "section", length = 50, updatable = false)
    private String section;

    @Column(name = "clocked_in_at", nullable = false, updatable = false)
    private Instant clockedInAt;

    @Column(name = "clocked_out_at")
    private Instant clockedOutAt;

    public static TimeClockEntryEntity clockIn(UUID employeeId, String role, String section, Instant at) {
        TimeClockEntryEntity entity = new TimeClockEntryEntity();
        entity.id = UUID.randomUUID();
        entity.employeeId = employeeId;
        entity.role = role;
        entity.section = section;
        entity.clockedInAt = at;
        return entity;
    }

    public void clockOut(Instant at) {
        if (clockedOutAt != null) {
            throw new IllegalStateException("Time clock entry " + id + " is already closed");
        }
        if (at.isBefore(clockedInAt)) {
            throw new IllegalArgumentException("Clock-out " + at + " precedes clock-in " + clockedInAt);
        }
        this.clockedOutAt = at;
    }

    public TimeClockEntry toDomain() {
        return new TimeClockEntry(id, employeeId, role, section, clockedInAt, clockedOutAt);
    }
}
