package com.flagship.contribution_ledger.ledger;

import lombok.Value;

import java.util.Comparator;

/**
 * Identifies one trackable stock unit: the (category, item name) pair.
 *
 * Matching is exact. No trimming or case folding is applied, so "Rope" and
 * "rope " are different items.
 */
@Value
public class ItemKey implements Comparable<ItemKey> {

    private static final Comparator<ItemKey> ORDER = Comparator
            .comparing(ItemKey::getCategory)
            .thenComparing(ItemKey::getItemName);

    String category;
    String itemName;

    public static ItemKey of(String category, String itemName) {
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("Category is required");
        }
        if (itemName == null || itemName.isBlank()) {
            throw new IllegalArgumentException("Item name is required");
        }
        return new ItemKey(category, itemName);
    }

    @Override
    public int compareTo(ItemKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return category + "::" + itemName;
    }
}
