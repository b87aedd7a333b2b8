package ou.capstone.coordconv.detect;

import ou.capstone.coordconv.convert.CoordinateFormat;
import ou.capstone.coordconv.geo.Coordinate;

/** Result of a successful auto-detection: which format matched and what it parsed. */
public record Detection(CoordinateFormat format, String name, Coordinate coordinate) {
}
