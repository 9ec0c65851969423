package de.alive.inboxscan.exception;

public class InvalidSelectionException extends Exception {

    private final int rowNumber;

    public InvalidSelectionException(String message, int rowNumber) {
        super(rowNumber > 0 ? String.format("Row %d: %s", rowNumber, message) : message);
        this.rowNumber = rowNumber;
    }

    public InvalidSelectionException(String message, int rowNumber, Throwable cause) {
        super(rowNumber > 0 ? String.format("Row %d: %s", rowNumber, message) : message, cause);
        this.rowNumber = rowNumber;
    }

    // 1-based data row number, or 0 when the problem is in the header
    public int getRowNumber() {
        return rowNumber;
    }
}
