package nl.bytesoflife.deltasexpr.codec;

import java.util.Optional;
import java.util.function.Function;

/**
 * Converts values of one type to and from the text of a token or string leaf.
 *
 * @param <T> the value type
 */
public interface ValueCodec<T> {

    String encode(T value);

    /**
     * @throws ValueDecodeException if {@code text} is not a valid representation
     */
    T decode(String text);

    /**
     * The text standing for "no value" when this type is wrapped in an
     * {@link Optional}. Each type picks its own; types without one cannot be
     * used optionally.
     */
    default Optional<String> getNullRepresentation() {
        return Optional.empty();
    }

    default ValueCodec<T> withNullRepresentation(String nullRepresentation) {
        return new FunctionValueCodec<>(this::encode, this::decode, nullRepresentation);
    }

    /**
     * Builds a codec from two functions. Exceptions other than
     * {@link ValueDecodeException} thrown by {@code decoder} are reported as
     * {@link nl.bytesoflife.deltasexpr.error.ErrorKind#DECODE_FAILURE}.
     */
    static <T> ValueCodec<T> of(Function<? super T, String> encoder, Function<String, ? extends T> decoder) {
        return new FunctionValueCodec<>(encoder, decoder, null);
    }
}
