package ou.capstone.coordconv.geo;

import java.util.Locale;

/**
 * Immutable geographic coordinate (longitude/latitude in degrees).
 * Values are not clamped to the usual ranges; every converter works on
 * whatever finite value it was given. Negative longitude is West,
 * negative latitude is South.
 */
public final class Coordinate {

    private final double longitude;
    private final double latitude;

    /**
     * Constructs a Coordinate.
     *
     * @param longitude longitude in degrees
     * @param latitude latitude in degrees
     * @throws IllegalArgumentException if either component is NaN or infinite
     */
    public Coordinate(final double longitude, final double latitude) {
        if (!Double.isFinite(longitude)) {
            throw new IllegalArgumentException("Longitude must be a finite number");
        }
        if (!Double.isFinite(latitude)) {
            throw new IllegalArgumentException("Latitude must be a finite number");
        }
        this.longitude = longitude;
        this.latitude = latitude;
    }

    /** @return longitude in degrees */
    public double getLongitude() {
        return longitude;
    }

    /** @return latitude in degrees */
    public double getLatitude() {
        return latitude;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Coordinate)) {
            return false;
        }
        final Coordinate other = (Coordinate) o;
        return Double.compare(longitude, other.longitude) == 0
                && Double.compare(latitude, other.latitude) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(longitude) + Double.hashCode(latitude);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "(lon=%.7f, lat=%.7f)", longitude, latitude);
    }
}
