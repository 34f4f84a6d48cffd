package nl.bytesoflife.deltasexpr.codec;

import nl.bytesoflife.deltasexpr.error.ErrorKind;

import java.util.Optional;
import java.util.function.Function;

final class FunctionValueCodec<T> implements ValueCodec<T> {

    private final Function<? super T, String> encoder;
    private final Function<String, ? extends T> decoder;
    private final String nullRepresentation;

    FunctionValueCodec(Function<? super T, String> encoder, Function<String, ? extends T> decoder,
                       String nullRepresentation) {
        this.encoder = encoder;
        this.decoder = decoder;
        this.nullRepresentation = nullRepresentation;
    }

    @Override
    public String encode(T value) {
        return encoder.apply(value);
    }

    @Override
    public T decode(String text) {
        try {
            return decoder.apply(text);
        } catch (ValueDecodeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ValueDecodeException(ErrorKind.DECODE_FAILURE,
                    e.getMessage() != null ? e.getMessage() : ErrorKind.DECODE_FAILURE.getDescription(), e);
        }
    }

    @Override
    public Optional<String> getNullRepresentation() {
        return Optional.ofNullable(nullRepresentation);
    }
}
