package nl.bytesoflife.deltasexpr.codec;

import java.util.Optional;

final class OptionalValueCodec<T> implements ValueCodec<Optional<T>> {

    private final ValueCodec<T> valueCodec;
    private final String nullRepresentation;

    OptionalValueCodec(ValueCodec<T> valueCodec, String nullRepresentation) {
        this.valueCodec = valueCodec;
        this.nullRepresentation = nullRepresentation;
    }

    @Override
    public String encode(Optional<T> value) {
        return value.isPresent() ? valueCodec.encode(value.get()) : nullRepresentation;
    }

    @Override
    public Optional<T> decode(String text) {
        if (nullRepresentation.equals(text)) {
            return Optional.empty();
        }
        return Optional.of(valueCodec.decode(text));
    }
}
