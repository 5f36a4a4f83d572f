package com.flagship.contribution_ledger.ledger;

/**
 * How an inventory adjustment derives the target stock from the current one.
 */
public enum AdjustmentOperation {
    SET {
        @Override
        public long target(long current, long amount) {
            return amount;
        }

        @Override
        public String describe(long current, long amount) {
            return "Set to " + amount;
        }
    },
    ADD {
        @Override
        public long target(long current, long amount) {
            return Math.addExact(current, amount);
        }

        @Override
        public String describe(long current, long amount) {
            return "Added " + amount + " (" + current + " -> " + target(current, amount) + ")";
        }
    },
    /** Removal floors at zero. */
    REMOVE {
        @Override
        public long target(long current, long amount) {
            return Math.max(0, current - amount);
        }

        @Override
        public String describe(long current, long amount) {
            return "Removed " + amount + " (" + current + " -> " + target(current, amount) + ")";
        }
    };

    public abstract long target(long current, long amount);

    public abstract String describe(long current, long amount);

    /**
     * Prefix stamped on the reason of the resulting quantity change, e.g. "[ADD] restock".
     */
    public String tagReason(String reason) {
        return "[" + name() + "] " + reason;
    }
}
