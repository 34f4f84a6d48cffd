package nl.bytesoflife.deltasexpr.codec;

import java.util.Objects;

@NullRepresentation("none")
public final class NetName implements StringSerializable {

    private final String name;

    public NetName(String name) {
        if (name.isEmpty() || name.contains(" ")) {
            throw new IllegalArgumentException("Invalid net name: '" + name + "'");
        }
        this.name = name;
    }

    @Override
    public String serializeToString() {
        return name;
    }

    public static NetName deserializeFromString(String text) {
        return new NetName(text);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NetName other && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
