package com.flagship.tip_ledger.common;

import java.util.Comparator;
import java.util.UUID;

/**
 * The single deterministic ordering of employee ids: ascending by canonical
 * lowercase string form. Remainder cents, recipient lists and lock order all use it.
 */
public final class IdOrder {

    public static final Comparator<UUID> ASCENDING = Comparator.comparing(UUID::toString);

    private IdOrder() {
    }
}
