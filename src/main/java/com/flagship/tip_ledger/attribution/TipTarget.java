package com.flagship.tip_ledger.attribution;

import com.flagship.tip_ledger.pool.SegmentShare;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Where a collected tip goes: straight to one employee, to whichever segment
 * of a pool covers the collection instant, or split between the co-owners of
 * a table by fixed percentages.
 */
public sealed interface TipTarget {

    String typeName();

    static TipTarget employee(UUID employeeId) {
        return new Employee(employeeId);
    }

    static TipTarget pool(UUID poolId) {
        return new Pool(poolId);
    }

    static TipTarget ownership(List<Owner> owners) {
        return new Ownership(owners);
    }

    record Employee(UUID employeeId) implements TipTarget {
        public Employee {
            if (employeeId == null) {
                throw new IllegalArgumentException("Target employee id is required");
            }
        }

        @Override
        public String typeName() {
            return "EMPLOYEE";
        }
    }

    record Pool(UUID poolId) implements TipTarget {
        public Pool {
            if (poolId == null) {
                throw new IllegalArgumentException("Target pool id is required");
            }
        }

        @Override
        public String typeName() {
            return "POOL";
        }
    }

    /**
     * Co-owned table. Percentages are positive and add up to exactly 100.
     */
    record Ownership(List<Owner> owners) implements TipTarget {
        private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

        public Ownership {
            if (owners == null || owners.isEmpty()) {
                throw new IllegalArgumentException("At least one owner is required");
            }
            Set<UUID> seen = new HashSet<>();
            BigDecimal total = BigDecimal.ZERO;
            for (Owner owner : owners) {
                if (!seen.add(owner.employeeId())) {
                    throw new IllegalArgumentException("Owner listed twice: " + owner.employeeId());
                }
                total = total.add(owner.percent());
            }
            if (total.compareTo(HUNDRED) != 0) {
                throw new IllegalArgumentException("Ownership percentages must add up to 100, got " + total);
            }
            owners = List.copyOf(owners);
        }

        public List<SegmentShare> ratios() {
            return owners.stream()
                .map(owner -> new SegmentShare(owner.employeeId(),
                    owner.percent().divide(HUNDRED, 18, RoundingMode.DOWN)))
                .toList();
        }

        @Override
        public String typeName() {
            return "OWNERSHIP";
        }
    }

    record Owner(UUID employeeId, BigDecimal percent) {
        public Owner {
            if (employeeId == null) {
                throw new IllegalArgumentException("Owner employee id is required");
            }
            if (percent == null || percent.signum() <= 0) {
                throw new IllegalArgumentException("Owner percentage must be positive, got " + percent);
            }
        }
    }
}
