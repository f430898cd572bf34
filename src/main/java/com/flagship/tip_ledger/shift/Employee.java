package com.flagship.tip_ledger.shift;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A worker who can earn tips at one location.
 * A null {@code section} means the employee floats across sections.
 */
@Value
public class Employee {
    UUID id;
    UUID locationId;
    String displayName;
    String role;
    String section;
    boolean active;
    Instant createdAt;

    public static Employee register(UUID locationId, String displayName, String role, String section) {
        if (locationId == null) {
            throw new IllegalArgumentException("Location is required");
        }
        if (displayName == null || displayName.isBlank()) {
            throw new IllegalArgumentException("Display name is required");
        }
        return new Employee(UUID.randomUUID(), locationId, displayName.trim(),
            Roles.normalize(role), Roles.normalizeSection(section), true, Instant.now());
    }

    /**
     * True when this employee works {@code otherSection}; a null on either side matches.
     */
    public boolean worksSection(String otherSection) {
        return Roles.sectionsMatch(section, otherSection);
    }
}
