package com.flagship.tip_ledger.pool;

import com.flagship.tip_ledger.common.IdOrder;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Computes a segment's frozen ratios from its live members.
 *
 * Ratios carry {@value #SCALE} decimal places. Every member but the last (in
 * ascending id order) is rounded down; the last takes {@code 1 - sum(others)},
 * so the stored ratios add up to exactly one.
 */
public final class SplitRatios {

    static final int SCALE = 18;
    static final int MAX_WEIGHT_SCALE = 4;
    static final int MAX_WEIGHT_INTEGER_DIGITS = 8;

    private SplitRatios() {
    }

    public static List<SegmentShare> compute(SplitMode mode, List<PoolMembership> liveMembers) {
        if (liveMembers.isEmpty()) {
            return List.of();
        }
        List<PoolMembership> ordered = liveMembers.stream()
            .sorted(Comparator.comparing(PoolMembership::getEmployeeId, IdOrder.ASCENDING))
            .toList();

        BigDecimal totalWeight = mode == SplitMode.EQUAL
            ? BigDecimal.valueOf(ordered.size())
            : ordered.stream().map(PoolMembership::getWeight).reduce(BigDecimal.ZERO, BigDecimal::add);
        if (totalWeight.signum() <= 0) {
            throw new IllegalArgumentException("Pool weights must sum to a positive value");
        }

        List<SegmentShare> shares = new ArrayList<>(ordered.size());
        BigDecimal assigned = BigDecimal.ZERO;
        for (int i = 0; i < ordered.size(); i++) {
            PoolMembership member = ordered.get(i);
            BigDecimal ratio;
            if (i == ordered.size() - 1) {
                ratio = BigDecimal.ONE.setScale(SCALE).subtract(assigned);
            } else {
                BigDecimal weight = mode == SplitMode.EQUAL ? BigDecimal.ONE : member.getWeight();
                ratio = weight.divide(totalWeight, SCALE, RoundingMode.DOWN);
            }
            assigned = assigned.add(ratio);
            shares.add(new SegmentShare(member.getEmployeeId(), ratio));
        }
        return List.copyOf(shares);
    }

    /**
     * Default weight when the caller gives none; equal pools ignore weights entirely.
     * A weight must fit the stored NUMERIC(12, 4): at most 8 integer digits and 4 decimals.
     */
    public static BigDecimal weightFor(SplitMode mode, BigDecimal requested) {
        if (mode == SplitMode.EQUAL || requested == null) {
            return BigDecimal.ONE;
        }
        if (requested.signum() <= 0) {
            throw new IllegalArgumentException("Weight must be positive, got " + requested);
        }
        BigDecimal normalized = requested.stripTrailingZeros();
        if (normalized.scale() > MAX_WEIGHT_SCALE) {
            throw new IllegalArgumentException(
                "Weight " + requested.toPlainString() + " has more than " + MAX_WEIGHT_SCALE + " decimal places");
        }
        if (normalized.precision() - normalized.scale() > MAX_WEIGHT_INTEGER_DIGITS) {
            throw new IllegalArgumentException(
                "Weight " + requested.toPlainString() + " has more than " + MAX_WEIGHT_INTEGER_DIGITS + " integer digits");
        }
        return requested;
    }
}
