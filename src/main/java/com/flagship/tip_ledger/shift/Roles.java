package com.flagship.tip_ledger.shift;

import java.util.Locale;

/**
 * Role and section names are compared case-insensitively and stored upper case.
 */
public final class Roles {

    private Roles() {
    }

    public static String normalize(String role) {
        if (role == null || role.isBlank()) {
            throw new IllegalArgumentException("Role is required");
        }
        return role.trim().toUpperCase(Locale.ROOT);
    }

    public static String normalizeSection(String section) {
        return section == null || section.isBlank() ? null : section.trim().toUpperCase(Locale.ROOT);
    }

    public static boolean sectionsMatch(String a, String b) {
        return a == null || b == null || a.equalsIgnoreCase(b);
    }
}
