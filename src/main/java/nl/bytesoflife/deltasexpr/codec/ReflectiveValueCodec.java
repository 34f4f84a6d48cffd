package nl.bytesoflife.deltasexpr.codec;

import nl.bytesoflife.deltasexpr.error.ErrorKind;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Optional;

/**
 * Codec for {@link StringSerializable} types, calling their static
 * {@code deserializeFromString(String)} factory to decode.
 */
final class ReflectiveValueCodec<T> implements ValueCodec<T> {

    static final String FACTORY_METHOD = "deserializeFromString";

    private final Class<T> type;
    private final Method factory;
    private final String nullRepresentation;

    private ReflectiveValueCodec(Class<T> type, Method factory, String nullRepresentation) {
        this.type = type;
        this.factory = factory;
        this.nullRepresentation = nullRepresentation;
    }

    /**
     * @return the codec, or {@code null} if {@code type} does not follow the
     *         {@link StringSerializable} contract
     */
    static <T> ReflectiveValueCodec<T> create(Class<T> type) {
        if (!StringSerializable.class.isAssignableFrom(type)) {
            return null;
        }
        Method factory;
        try {
            factory = type.getMethod(FACTORY_METHOD, String.class);
        } catch (NoSuchMethodException e) {
            return null;
        }
        if (!Modifier.isStatic(factory.getModifiers()) || !type.isAssignableFrom(factory.getReturnType())) {
            return null;
        }
        // public factories of non-public classes are not callable without this
        if (!factory.trySetAccessible()) {
            return null;
        }
        NullRepresentation annotation = type.getAnnotation(NullRepresentation.class);
        return new ReflectiveValueCodec<>(type, factory, annotation != null ? annotation.value() : null);
    }

    @Override
    public String encode(T value) {
        return ((StringSerializable) value).serializeToString();
    }

    @Override
    public T decode(String text) {
        try {
            return type.cast(factory.invoke(null, text));
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ValueDecodeException decodeException) {
                throw decodeException;
            }
            String message = cause != null && cause.getMessage() != null
                    ? cause.getMessage()
                    : "Not a valid " + type.getSimpleName();
            throw new ValueDecodeException(ErrorKind.DECODE_FAILURE, message, cause);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot call " + type.getName() + "." + FACTORY_METHOD, e);
        }
    }

    @Override
    public Optional<String> getNullRepresentation() {
        return Optional.ofNullable(nullRepresentation);
    }
}
