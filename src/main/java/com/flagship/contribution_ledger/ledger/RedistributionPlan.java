package com.flagship.contribution_ledger.ledger;

import lombok.Value;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Proportional rescaling of an item's contribution rows to a new total.
 *
 * Each row but the last receives floor(newTotal * quantity / currentTotal); the
 * last row absorbs the remainder so the allocations sum exactly to newTotal. If
 * every row is zero the whole total goes to the first row. Rows allocated zero
 * are to be deleted, never stored as zero.
 */
@Value
public class RedistributionPlan {
    long currentTotal;
    long newTotal;
    List<Allocation> allocations;

    /**
     * @param records contribution rows of one item, oldest first
     * @throws InvalidQuantityException if newTotal is negative
     */
    public static RedistributionPlan compute(List<ContributionEvent> records, long newTotal) {
        if (newTotal < 0) {
            throw new InvalidQuantityException("New total cannot be negative, got " + newTotal);
        }
        long currentTotal = 0;
        for (ContributionEvent record : records) {
            currentTotal = Math.addExact(currentTotal, record.getQuantity());
        }

        List<Allocation> allocations = new ArrayList<>(records.size());
        if (records.isEmpty()) {
            return new RedistributionPlan(currentTotal, newTotal, allocations);
        }

        if (currentTotal == 0) {
            for (int i = 0; i < records.size(); i++) {
                ContributionEvent record = records.get(i);
                allocations.add(new Allocation(record.getId(), record.getQuantity(), i == 0 ? newTotal : 0));
            }
            return new RedistributionPlan(currentTotal, newTotal, Collections.unmodifiableList(allocations));
        }

        long remaining = newTotal;
        for (int i = 0; i < records.size(); i++) {
            ContributionEvent record = records.get(i);
            long share;
            if (i == records.size() - 1) {
                share = Math.max(0, remaining);
            } else {
                share = BigInteger.valueOf(newTotal)
                    .multiply(BigInteger.valueOf(record.getQuantity()))
                    .divide(BigInteger.valueOf(currentTotal))
                    .longValueExact();
                remaining -= share;
            }
            allocations.add(new Allocation(record.getId(), record.getQuantity(), share));
        }
        return new RedistributionPlan(currentTotal, newTotal, Collections.unmodifiableList(allocations));
    }

    public boolean isEmpty() {
        return allocations.isEmpty();
    }

    public long getAllocatedTotal() {
        return allocations.stream().mapToLong(Allocation::getNewQuantity).sum();
    }

    /**
     * Rows whose quantity changes to a new positive value.
     */
    public List<Allocation> getUpdates() {
        return allocations.stream()
            .filter(a -> !a.isRemoval() && a.getNewQuantity() != a.getOldQuantity())
            .toList();
    }

    public List<Allocation> getRemovals() {
        return allocations.stream().filter(Allocation::isRemoval).toList();
    }

    @Value
    public static class Allocation {
        long contributionId;
        long oldQuantity;
        long newQuantity;

        public boolean isRemoval() {
            return newQuantity == 0;
        }
    }
}
