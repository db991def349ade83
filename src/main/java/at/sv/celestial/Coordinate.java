package at.sv.celestial;

/**
 * A geographic position in decimal degrees. Latitude is positive north, longitude positive east.
 */
public record Coordinate(double latitude, double longitude) {

    public Coordinate {
        if (Double.isNaN(latitude) || latitude < -90 || latitude > 90) {
            throw new InvalidArgument("Latitude must be between -90 and 90 degrees. Provided value: " + latitude);
        }
        if (Double.isNaN(longitude) || longitude < -180 || longitude > 180) {
            throw new InvalidArgument("Longitude must be between -180 and 180 degrees. Provided value: " + longitude);
        }
    }

    public static Coordinate of(double latitude, double longitude) {
        return new Coordinate(latitude, longitude);
    }

    @Override
    public String toString() {
        return "[" + latitude + "," + longitude + ']';
    }
}
