package nl.bytesoflife.deltasexpr.codec;

import nl.bytesoflife.deltasexpr.error.ErrorKind;

import java.awt.Color;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Built-in codecs and the lookup used when a value type is given as a class.
 * <p>
 * Lookup order: built-in codecs, then {@link StringSerializable} types
 * that declare a static {@code deserializeFromString(String)} factory.
 */
public final class ValueCodecs {

    private static final Pattern INTEGER_PATTERN = Pattern.compile("[+-]?[0-9]+");
    private static final Pattern COLOR_PATTERN =
            Pattern.compile("#([0-9a-fA-F]{3}|[0-9a-fA-F]{6}|[0-9a-fA-F]{8})");
    private static final Pattern UUID_PATTERN = Pattern.compile(
            "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

    public static final ValueCodec<String> STRING = ValueCodec.of(s -> s, s -> s);

    public static final ValueCodec<Boolean> BOOLEAN = ValueCodec.of(
            b -> b ? "true" : "false",
            ValueCodecs::parseBoolean);

    public static final ValueCodec<Integer> INTEGER = ValueCodec.of(
            i -> Integer.toString(i),
            ValueCodecs::parseInteger);

    public static final ValueCodec<Long> LONG = ValueCodec.of(
            l -> Long.toString(l),
            ValueCodecs::parseLong);

    /** {@code #aarrggbb}; a {@code null} color is written as empty text. */
    public static final ValueCodec<Color> COLOR = ValueCodec.of(
            c -> c != null ? String.format(Locale.US, "#%08x", c.getRGB()) : "",
            ValueCodecs::parseColor);

    /** Absolute URLs only; a {@code null} or invalid URL is written as empty text. */
    public static final ValueCodec<URL> URL_CODEC = ValueCodec.of(
            ValueCodecs::formatUrl,
            ValueCodecs::parseUrl);

    /** ISO-8601 in UTC, truncated to whole seconds. */
    public static final ValueCodec<Instant> INSTANT = ValueCodec.of(
            i -> DateTimeFormatter.ISO_INSTANT.format(i.truncatedTo(ChronoUnit.SECONDS)),
            ValueCodecs::parseInstant);

    public static final ValueCodec<UUID> UUID_CODEC = ValueCodec.<UUID>of(
            u -> u.toString(),
            ValueCodecs::parseUuid).withNullRepresentation("none");

    private static final Map<Class<?>, ValueCodec<?>> BUILTIN = Map.ofEntries(
            Map.entry(String.class, STRING),
            Map.entry(Boolean.class, BOOLEAN),
            Map.entry(boolean.class, BOOLEAN),
            Map.entry(Integer.class, INTEGER),
            Map.entry(int.class, INTEGER),
            Map.entry(Long.class, LONG),
            Map.entry(long.class, LONG),
            Map.entry(Color.class, COLOR),
            Map.entry(URL.class, URL_CODEC),
            Map.entry(Instant.class, INSTANT),
            Map.entry(UUID.class, UUID_CODEC)
    );

    private static final ClassValue<Optional<ValueCodec<?>>> SERIALIZABLE_CODECS = new ClassValue<>() {
        @Override
        protected Optional<ValueCodec<?>> computeValue(Class<?> type) {
            return Optional.ofNullable(ReflectiveValueCodec.create(type));
        }
    };

    private ValueCodecs() {
    }

    /**
     * @throws IllegalArgumentException if no codec exists for {@code type}
     */
    @SuppressWarnings("unchecked")
    public static <T> ValueCodec<T> forType(Class<T> type) {
        ValueCodec<?> codec = BUILTIN.get(type);
        if (codec == null) {
            codec = SERIALIZABLE_CODECS.get(type).orElseThrow(() -> new IllegalArgumentException(
                    "No codec for " + type.getName() + ": implement StringSerializable and declare a static "
                            + ReflectiveValueCodec.FACTORY_METHOD + "(String) method"));
        }
        return (ValueCodec<T>) codec;
    }

    /**
     * Encodes a value by its runtime type. Subclasses of built-in types and
     * any {@link StringSerializable} are accepted, so no decoding factory is
     * needed just to write a value.
     */
    @SuppressWarnings("unchecked")
    public static String encode(Object value) {
        if (value instanceof Optional) {
            throw new IllegalArgumentException("Optional values need an explicit codec, see ValueCodecs.optional()");
        }
        ValueCodec<Object> codec = (ValueCodec<Object>) BUILTIN.get(value.getClass());
        if (codec != null) {
            return codec.encode(value);
        }
        for (Map.Entry<Class<?>, ValueCodec<?>> entry : BUILTIN.entrySet()) {
            if (entry.getKey().isInstance(value)) {
                return ((ValueCodec<Object>) entry.getValue()).encode(value);
            }
        }
        if (value instanceof StringSerializable serializable) {
            return serializable.serializeToString();
        }
        throw new IllegalArgumentException("No codec for " + value.getClass().getName());
    }

    /**
     * Wraps a codec so that {@link Optional#empty()} is written as the type's
     * null representation.
     *
     * @throws IllegalArgumentException if the codec declares no null representation
     */
    public static <T> ValueCodec<Optional<T>> optional(ValueCodec<T> codec) {
        String nullRepresentation = codec.getNullRepresentation().orElseThrow(() ->
                new IllegalArgumentException("Codec has no null representation and cannot be used optionally"));
        return new OptionalValueCodec<>(codec, nullRepresentation);
    }

    public static <T> ValueCodec<Optional<T>> optional(Class<T> type) {
        return optional(forType(type));
    }

    private static boolean parseBoolean(String text) {
        if ("true".equals(text)) {
            return true;
        } else if ("false".equals(text)) {
            return false;
        }
        throw new ValueDecodeException(ErrorKind.INVALID_BOOLEAN);
    }

    private static int parseInteger(String text) {
        if (!INTEGER_PATTERN.matcher(text).matches()) {
            throw new ValueDecodeException(ErrorKind.INVALID_INTEGER);
        }
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new ValueDecodeException(ErrorKind.INVALID_INTEGER, "Integer out of range", e);
        }
    }

    private static long parseLong(String text) {
        if (!INTEGER_PATTERN.matcher(text).matches()) {
            throw new ValueDecodeException(ErrorKind.INVALID_INTEGER);
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new ValueDecodeException(ErrorKind.INVALID_INTEGER, "Integer out of range", e);
        }
    }

    private static Color parseColor(String text) {
        if (!COLOR_PATTERN.matcher(text).matches()) {
            throw new ValueDecodeException(ErrorKind.INVALID_COLOR);
        }
        String hex = text.substring(1);
        return switch (hex.length()) {
            case 3 -> new Color(
                    Character.digit(hex.charAt(0), 16) * 17,
                    Character.digit(hex.charAt(1), 16) * 17,
                    Character.digit(hex.charAt(2), 16) * 17);
            case 6 -> new Color(Integer.parseInt(hex, 16));
            default -> new Color((int) Long.parseLong(hex, 16), true);
        };
    }

    private static String formatUrl(URL url) {
        if (url == null) {
            return "";
        }
        try {
            return url.toURI().toString();
        } catch (URISyntaxException e) {
            return "";
        }
    }

    private static URL parseUrl(String text) {
        try {
            return new URI(text).toURL();
        } catch (URISyntaxException | MalformedURLException | IllegalArgumentException e) {
            throw new ValueDecodeException(ErrorKind.INVALID_URL, ErrorKind.INVALID_URL.getDescription(), e);
        }
    }

    private static Instant parseInstant(String text) {
        try {
            return OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            throw new ValueDecodeException(ErrorKind.INVALID_DATE_TIME,
                    ErrorKind.INVALID_DATE_TIME.getDescription(), e);
        }
    }

    private static UUID parseUuid(String text) {
        if (!UUID_PATTERN.matcher(text).matches()) {
            throw new ValueDecodeException(ErrorKind.DECODE_FAILURE, "Not a valid UUID");
        }
        return UUID.fromString(text);
    }
}
