package com.chainbills.ledger.crosschain;

import java.util.Optional;

/**
 * First byte of every cross-chain payload.
 */
public enum ActionType {
    CREATE_PAYABLE(1),
    CLOSE_PAYABLE(2),
    REOPEN_PAYABLE(3),
    PAY(4),
    WITHDRAW(5);

    private final int id;

    ActionType(int id) {
        this.id = id;
    }

    public int getId() {
        return id;
    }

    public static Optional<ActionType> fromId(int id) {
        for (ActionType type : values()) {
            if (type.id == id) return Optional.of(type);
        }
        return Optional.empty();
    }
}
