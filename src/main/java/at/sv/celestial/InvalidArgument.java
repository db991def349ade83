package at.sv.celestial;

/**
 * Exception to signal a malformed input value, e.g. a latitude outside [-90, 90] or a clock time with an hour of 25.
 * Thrown at construction time, before any astronomical computation takes place.
 */
public class InvalidArgument extends IllegalArgumentException {
    public InvalidArgument(String message) {
        super(message);
    }
}
