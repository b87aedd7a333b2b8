package ou.capstone.coordconv.print;

public final class AnsiOutputHelper {

    private final boolean enabled;

    public AnsiOutputHelper(final boolean enabled) {
        this.enabled = enabled;
    }

    public String colorGreen(final String text)  { return apply(text, "\u001B[32m"); }
    public String bold(final String text)        { return apply(text, "\u001B[1m");  }

    private String apply(final String text, final String code) {
        if (!enabled || text == null) return text;
        return code + text + "\u001B[0m";
    }
}
