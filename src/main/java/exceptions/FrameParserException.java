package exceptions;

public class FrameParserException extends RuntimeException {

    public FrameParserException(String message) {
        super(message);
    }

    public FrameParserException(String message, Throwable cause) {
        super(message, cause);
    }
}
