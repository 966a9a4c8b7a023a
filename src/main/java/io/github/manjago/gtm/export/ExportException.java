package io.github.manjago.gtm.export;

/**
 * The specialized table cannot be written in the target format.
 */
public class ExportException extends Exception {

    public ExportException(String message) {
        super(message);
    }
}
