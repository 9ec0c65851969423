package de.alive.inboxscan.domain;

public enum UnsubscribeState {
    PENDING,
    LOCATING,
    EXECUTING,
    SUCCESS,
    FAILED,
    MANUAL_REQUIRED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED || this == MANUAL_REQUIRED;
    }

    public static UnsubscribeState of(UnsubscribeOutcome.Result result) {
        return switch (result) {
            case SUCCESS -> SUCCESS;
            case FAILED -> FAILED;
            case MANUAL_REQUIRED -> MANUAL_REQUIRED;
        };
    }
}
