package at.sv.celestial;

public class JsonOutputException extends RuntimeException {
    public JsonOutputException(String message, Throwable cause) {
        super(message, cause);
    }
}
