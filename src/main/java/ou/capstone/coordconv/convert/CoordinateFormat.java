package ou.capstone.coordconv.convert;

/**
 * The fixed set of supported formats, in detection priority order.
 * Looser grammars come first so that a stricter one cannot shadow them.
 */
public enum CoordinateFormat {

    DECIMAL_DEGREES("Decimal Degrees"),
    WOLFRAM_ALPHA("WolframAlpha Degrees"),
    HEX_FIXED_POINT("Hex Fixed Point"),
    HEX_FIXED_POINT_C("Hex Fixed Point (C)"),
    DECIMAL_FIXED_POINT("Decimal Fixed Point"),
    DMS("Degrees Minutes Seconds"),
    DMS_LFV("DMS (LFV)"),
    DMS_NAVI_DISPLAY("DMS (Navi Display)"),
    RADIAN("Radian"),
    PARCEL_ID("Parcel ID");

    private final String displayName;

    CoordinateFormat(final String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /** @return false for display-only formats that never accept input */
    public boolean isParseable() {
        return this != RADIAN;
    }
}
