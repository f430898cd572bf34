package com.flagship.tip_ledger.shift;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "employees")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EmployeeEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "location_id", nullable = false, updatable = false)
    private UUID locationId;

    @Column(name = "display_name", nullable = false, length = 200)
    private String displayName;

    @Column(name = "role", nullable = false, length = 50)
    private String role;

    @Column(name = "section", length = 50)
    private String section;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static EmployeeEntity fromDomain(Employee employee) {
        return new EmployeeEntity(
            employee.getId(),
            employee.getLocationId(),
            employee.getDisplayName(),
            employee.getRole(),
            employee.getSection(),
            employee.isActive(),
            employee.getCreatedAt()
        );
    }

    public Employee toDomain() {
        return new Employee(id, locationId, displayName, role, section, active, createdAt);
    }

    public void reassign(String role, String section) {
        this.role = Roles.normalize(role);
        this.section = Roles.normalizeSection(section);
    }

    public void deactivate() {
        this.active = false;
    }
}
