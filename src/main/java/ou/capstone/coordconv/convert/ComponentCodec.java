package ou.capstone.coordconv.convert;

/**
 * Converts one component (longitude or latitude) of a pair grammar
 * between its token text and degrees.
 */
public interface ComponentCodec {

    /**
     * @param token the captured token, already matched by the pair grammar
     * @return the value in degrees
     * @throws IllegalArgumentException if the token cannot be decoded
     */
    double decode(String token);

    /** Encodes a value in degrees. Total over finite values. */
    String encode(double degrees);
}
