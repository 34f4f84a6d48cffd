package nl.bytesoflife.deltasexpr.codec;

/**
 * Implemented by domain types that can be stored in a token or string leaf
 * without registering a codec.
 * <p>
 * To be readable back, the implementing class must also declare
 * {@code public static T deserializeFromString(String)}; the class itself may
 * be package-private or nested, as long as its package is open to this
 * library when running on the module path. Annotate it with
 * {@link NullRepresentation} to allow {@code Optional} values of the type.
 */
public interface StringSerializable {

    String serializeToString();
}
