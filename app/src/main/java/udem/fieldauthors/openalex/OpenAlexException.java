package udem.fieldauthors.openalex;

/**
 * Non-retryable failure talking to OpenAlex: unexpected status, unreadable body,
 * exhausted retry budget or interruption.
 */
public class OpenAlexException extends RuntimeException {
    private final int statusCode;

    public OpenAlexException(String message) {
        this(message, -1, null);
    }

    public OpenAlexException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public OpenAlexException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status of the failing response, or -1 when there was none.
     */
    public int statusCode() {
        return statusCode;
    }
}
