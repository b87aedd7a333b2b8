package ou.capstone.coordconv.convert;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Reduces free-form degree/minute/second input to single-space separated
 * fields. Digits, '.', '+', '-' and hemisphere letters (N, S, E, W) that
 * are not part of a word survive; everything else (°, ', ", commas,
 * words, extra whitespace) becomes a single separating space.
 */
public final class DmsNormalizer {

    private static final Pattern NOISE = Pattern.compile(
            "(?<=\\p{L})[NSEW]|[NSEW](?=\\p{L})|[^0-9.+\\-NSEW]");

    private static final Pattern SPACES = Pattern.compile(" {2,}");

    private DmsNormalizer() {
        // Utility class
    }

    public static String normalize(final String text) {
        if (text == null) {
            return "";
        }
        final String upper = text.toUpperCase(Locale.ROOT);
        final String spaced = NOISE.matcher(upper).replaceAll(" ");
        return SPACES.matcher(spaced).replaceAll(" ").trim();
    }
}
