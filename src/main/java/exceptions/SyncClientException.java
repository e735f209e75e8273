package exceptions;

public class SyncClientException extends RuntimeException {

    public SyncClientException(String message) {
        super(message);
    }

    public SyncClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
