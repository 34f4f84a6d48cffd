package nl.bytesoflife.deltasexpr.codec;

import nl.bytesoflife.deltasexpr.error.ErrorKind;

import java.util.Locale;

public enum PadShape implements StringSerializable {
    ROUND,
    RECT,
    OCTAGON;

    @Override
    public String serializeToString() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static PadShape deserializeFromString(String text) {
        return switch (text) {
            case "round" -> ROUND;
            case "rect" -> RECT;
            case "octagon" -> OCTAGON;
            default -> throw new ValueDecodeException(ErrorKind.DECODE_FAILURE, "Unknown pad shape: " + text);
        };
    }
}
