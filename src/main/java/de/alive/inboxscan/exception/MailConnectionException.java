package de.alive.inboxscan.exception;

public class MailConnectionException extends Exception {

    private final ConnectionStage stage;

    public enum ConnectionStage {
        CONNECTION_ESTABLISHMENT,
        AUTHENTICATION,
        FOLDER_ACCESS,
        MESSAGE_SEARCH,
        MESSAGE_FETCH,
        NETWORK_ERROR,
        CONFIGURATION_ERROR
    }

    public MailConnectionException(String message, ConnectionStage stage, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public MailConnectionException(String message, ConnectionStage stage) {
        super(message);
        this.stage = stage;
    }

    public ConnectionStage getStage() {
        return stage;
    }

    public boolean isRecoverable() {
        return stage != ConnectionStage.CONFIGURATION_ERROR &&
                stage != ConnectionStage.AUTHENTICATION;
    }

    @Override
    public String toString() {
        return String.format("MailConnectionException{stage=%s, message='%s'}",
                stage, getMessage());
    }
}
