package com.flagship.tip_ledger.attribution;

import com.flagship.tip_ledger.common.IdOrder;
import com.flagship.tip_ledger.pool.SegmentShare;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Splits an amount of cents by frozen ratios without losing or inventing a cent.
 *
 * Each member first gets {@code floor(amount * ratio)}. The cents left over are
 * then handed out one at a time in ascending employee id order, so 1001 split
 * three ways yields 334, 334 and 333.
 */
public final class ShareAllocator {

    private ShareAllocator() {
    }

    public static List<EmployeeShare> allocate(long amountCents, List<SegmentShare> ratios) {
        if (amountCents < 0) {
            throw new IllegalArgumentException("Cannot allocate a negative amount: " + amountCents);
        }
        if (ratios.isEmpty()) {
            throw new IllegalArgumentException("Cannot allocate across zero members");
        }
        List<SegmentShare> ordered = ratios.stream()
            .sorted(Comparator.comparing(SegmentShare::getEmployeeId, IdOrder.ASCENDING))
            .toList();

        BigDecimal amount = BigDecimal.valueOf(amountCents);
        long[] cents = new long[ordered.size()];
        long assigned = 0;
        for (int i = 0; i < ordered.size(); i++) {
            BigDecimal ratio = ordered.get(i).getRatio();
            if (ratio.signum() < 0) {
                throw new IllegalArgumentException("Negative ratio for " + ordered.get(i).getEmployeeId());
            }
            cents[i] = amount.multiply(ratio).setScale(0, RoundingMode.FLOOR).longValueExact();
            assigned += cents[i];
        }

        long remainder = amountCents - assigned;
        if (remainder < 0) {
            throw new IllegalStateException("Ratios sum above one: floors reach " + assigned + " of " + amountCents);
        }
        for (int i = 0; remainder > 0; i = (i + 1) % cents.length) {
            cents[i]++;
            remainder--;
        }

        List<EmployeeShare> shares = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            shares.add(new EmployeeShare(ordered.get(i).getEmployeeId(), cents[i]));
        }
        return List.copyOf(shares);
    }

    /**
     * Equal split of {@code amountCents} across {@code employeeIds}, same remainder rule.
     */
    public static List<EmployeeShare> splitEqually(long amountCents, List<UUID> employeeIds) {
        if (employeeIds.isEmpty()) {
            throw new IllegalArgumentException("Cannot split across zero employees");
        }
        List<UUID> ordered = employeeIds.stream().sorted(IdOrder.ASCENDING).toList();
        long base = amountCents / ordered.size();
        long remainder = amountCents % ordered.size();
        List<EmployeeShare> shares = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            shares.add(new EmployeeShare(ordered.get(i), base + (i < remainder ? 1 : 0)));
        }
        return List.copyOf(shares);
    }

    public static long total(List<EmployeeShare> shares) {
        return shares.stream().mapToLong(EmployeeShare::getShareCents).sum();
    }
}
