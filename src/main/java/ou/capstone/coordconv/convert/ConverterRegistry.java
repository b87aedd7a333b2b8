package ou.capstone.coordconv.convert;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Ordered, immutable list of converters. The order is the detection
 * priority: {@link CoordinateFormat#values()} order.
 */
public final class ConverterRegistry {

    private static final String DECIMAL = "[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)";
    private static final String SEPARATOR = "(?:\\s*,\\s*|\\s+)";

    private static final Pattern DECIMAL_DEGREES = Pattern.compile(
            "^\\s*(" + DECIMAL + ")" + SEPARATOR + "(" + DECIMAL + ")\\s*$");

    private static final Pattern WOLFRAM_ALPHA = Pattern.compile(
            "^\\s*(\\d+(?:\\.\\d+)?\\s*[EW])" + SEPARATOR + "(\\d+(?:\\.\\d+)?\\s*[NS])\\s*$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern HEX_FIXED_POINT = Pattern.compile(
            "^\\s*([0-9a-fA-F]{1,8})\\s*,\\s*([0-9a-fA-F]{1,8})\\s*$");

    private static final Pattern HEX_FIXED_POINT_C = Pattern.compile(
            "^\\s*0[xX]([0-9a-fA-F]{1,8})\\s*,\\s*0[xX]([0-9a-fA-F]{1,8})\\s*$");

    private static final Pattern DECIMAL_FIXED_POINT = Pattern.compile(
            "^\\s*[Dd]\\s*([+-]?\\d{1,10})\\s*,\\s*[Dd]\\s*([+-]?\\d{1,10})\\s*$");

    private static final Pattern PARCEL_ID = Pattern.compile(
            "^\\s*PID\\s*(?:0X)?([0-9A-F]{1,8})\\s*,\\s*(?:0X)?([0-9A-F]{1,8})\\s*$",
            Pattern.CASE_INSENSITIVE);

    private static final ConverterRegistry STANDARD = new ConverterRegistry();

    private final Map<CoordinateFormat, FormatConverter> byFormat;
    private final List<FormatConverter> converters;

    private ConverterRegistry() {
        final Map<CoordinateFormat, FormatConverter> map = new EnumMap<>(CoordinateFormat.class);
        final List<FormatConverter> list = new ArrayList<>();
        for (final CoordinateFormat format : CoordinateFormat.values()) {
            final FormatConverter converter = create(format);
            map.put(format, converter);
            list.add(converter);
        }
        this.byFormat = Collections.unmodifiableMap(map);
        this.converters = List.copyOf(list);
    }

    /** @return the shared registry of all supported formats */
    public static ConverterRegistry standard() {
        return STANDARD;
    }

    static FormatConverter create(final CoordinateFormat format) {
        final String name = format.displayName();
        return switch (format) {
            case DECIMAL_DEGREES -> new PairFormatConverter(name, DECIMAL_DEGREES, "%s, %s",
                    new DecimalDegreesCodec(7), new DecimalDegreesCodec(7));
            case WOLFRAM_ALPHA -> new PairFormatConverter(name, WOLFRAM_ALPHA, "%s %s",
                    new HemisphereDegreesCodec(Axis.LONGITUDE, 8),
                    new HemisphereDegreesCodec(Axis.LATITUDE, 8));
            case HEX_FIXED_POINT -> new PairFormatConverter(name, HEX_FIXED_POINT, "%s, %s",
                    new HexFixedPointCodec(Axis.LONGITUDE),
                    new HexFixedPointCodec(Axis.LATITUDE));
            case HEX_FIXED_POINT_C -> new PairFormatConverter(name, HEX_FIXED_POINT_C, "%s, %s",
                    new HexFixedPointCodec(Axis.LONGITUDE, "0x"),
                    new HexFixedPointCodec(Axis.LATITUDE, "0x"));
            case DECIMAL_FIXED_POINT -> new PairFormatConverter(name, DECIMAL_FIXED_POINT, "D %s, D %s",
                    new DecimalFixedPointCodec(Axis.LONGITUDE),
                    new DecimalFixedPointCodec(Axis.LATITUDE));
            case DMS -> new DmsConverter(name);
            case DMS_LFV -> new LfvDmsConverter(name);
            case DMS_NAVI_DISPLAY -> new NaviDisplayDmsConverter(name);
            case RADIAN -> new RadianConverter(name);
            case PARCEL_ID -> new PairFormatConverter(name, PARCEL_ID, "PID %s, %s",
                    new ParcelIdCodec(), new ParcelIdCodec());
        };
    }

    /** @return all converters in priority order */
    public List<FormatConverter> converters() {
        return converters;
    }

    public FormatConverter get(final CoordinateFormat format) {
        return byFormat.get(format);
    }

    /** @return display names in priority order */
    public List<String> formatNames() {
        final List<String> names = new ArrayList<>(converters.size());
        for (final FormatConverter c : converters) {
            names.add(c.name());
        }
        return Collections.unmodifiableList(names);
    }

    public int size() {
        return converters.size();
    }

    /**
     * Looks up a format by display name, enum constant name (both
     * case-insensitive) or zero-based index.
     */
    public Optional<CoordinateFormat> find(final String nameOrIndex) {
        if (nameOrIndex == null || nameOrIndex.isBlank()) {
            return Optional.empty();
        }
        final String key = nameOrIndex.trim();
        for (final CoordinateFormat format : CoordinateFormat.values()) {
            if (format.displayName().equalsIgnoreCase(key)
                    || format.name().equals(key.toUpperCase(Locale.ROOT))) {
                return Optional.of(format);
            }
        }
        if (key.chars().allMatch(Character::isDigit)) {
            try {
                return find(Integer.parseInt(key));
            } catch (final NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public Optional<CoordinateFormat> find(final int index) {
        final CoordinateFormat[] formats = CoordinateFormat.values();
        if (index < 0 || index >= formats.length) {
            return Optional.empty();
        }
        return Optional.of(formats[index]);
    }
}
