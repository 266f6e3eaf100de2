package io.hearthwarrio.cascadium.webdriver;

/**
 * Thrown when the live DOM cannot be captured or the captured data is inconsistent.
 */
public class DomSnapshotException extends RuntimeException {

    public DomSnapshotException(String message, Throwable cause) {
        super(message, cause);
    }
}
