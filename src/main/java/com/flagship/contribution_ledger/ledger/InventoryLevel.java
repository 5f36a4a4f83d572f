package com.flagship.contribution_ledger.ledger;

import lombok.Value;

@Value
public class InventoryLevel {
    String category;
    String itemName;
    long quantity;

    public boolean isInStock() {
        return quantity > 0;
    }
}
