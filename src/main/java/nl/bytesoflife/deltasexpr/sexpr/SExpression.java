package nl.bytesoflife.deltasexpr.sexpr;

import nl.bytesoflife.deltasexpr.codec.ValueCodec;
import nl.bytesoflife.deltasexpr.codec.ValueCodecs;
import nl.bytesoflife.deltasexpr.codec.ValueDecodeException;
import nl.bytesoflife.deltasexpr.error.ErrorKind;
import nl.bytesoflife.deltasexpr.error.FileParseException;
import nl.bytesoflife.deltasexpr.error.SExpressionException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A node of an S-expression document: a named list, a token, a string or a
 * line break.
 * <p>
 * Nodes have value semantics. A child appended with
 * {@link #appendChild(SExpression, boolean)} is copied, so no node ever has
 * two parents and copying a node copies its whole subtree. The source
 * location is kept for error messages only and is ignored by {@link #equals}.
 * <p>
 * Not thread safe; a tree must not be mutated while others read it.
 */
public final class SExpression {

    private final SExpressionType type;
    private final String value; // list name, token or string
    private final List<SExpression> children = new ArrayList<>();
    private final SourceLocation location;

    SExpression(SExpressionType type, String value, SourceLocation location) {
        this.type = type;
        this.value = value;
        this.location = location;
    }

    /**
     * Deep copy.
     */
    public SExpression(SExpression other) {
        this.type = other.type;
        this.value = other.value;
        this.location = other.location;
        for (SExpression child : other.children) {
            children.add(new SExpression(child));
        }
    }

    // --- Factories ---

    /**
     * @throws SExpressionException {@link ErrorKind#INVALID_IDENTIFIER} if {@code name} is not a valid list name
     */
    public static SExpression createList(String name) {
        Objects.requireNonNull(name, "name");
        if (!SExpressionSyntax.isValidListName(name)) {
            throw new SExpressionException(ErrorKind.INVALID_IDENTIFIER, "Invalid list name: \"" + name + "\"");
        }
        return new SExpression(SExpressionType.LIST, name, SourceLocation.unknown());
    }

    /**
     * @throws SExpressionException {@link ErrorKind#INVALID_TOKEN} if {@code token} is not a valid token
     */
    public static SExpression createToken(String token) {
        Objects.requireNonNull(token, "token");
        if (!SExpressionSyntax.isValidToken(token)) {
            throw new SExpressionException(ErrorKind.INVALID_TOKEN, "Invalid token: \"" + token + "\"");
        }
        return new SExpression(SExpressionType.TOKEN, token, SourceLocation.unknown());
    }

    public static SExpression createString(String string) {
        Objects.requireNonNull(string, "string");
        return new SExpression(SExpressionType.STRING, string, SourceLocation.unknown());
    }

    public static SExpression createLineBreak() {
        return new SExpression(SExpressionType.LINE_BREAK, "", SourceLocation.unknown());
    }

    /**
     * Reads a document consisting of exactly one root list.
     *
     * @param file the file the content was read from, used in error messages; may be {@code null}
     * @throws FileParseException if the content is malformed
     */
    public static SExpression parse(String content, Path file) {
        return new SExpressionReader().read(content, file);
    }

    // --- Getters ---

    public SExpressionType getType() {
        return type;
    }

    public boolean isList() {
        return type == SExpressionType.LIST;
    }

    public boolean isToken() {
        return type == SExpressionType.TOKEN;
    }

    public boolean isString() {
        return type == SExpressionType.STRING;
    }

    public boolean isLineBreak() {
        return type == SExpressionType.LINE_BREAK;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public Path getFilePath() {
        return location.file();
    }

    /**
     * True if this list contains a line break, directly or in a nested list.
     */
    public boolean isMultiLineList() {
        for (SExpression child : children) {
            if (child.isLineBreak() || child.isMultiLineList()) {
                return true;
            }
        }
        return false;
    }

    public String getName() {
        if (!isList()) {
            throw error(ErrorKind.NOT_A_LIST, value, "Node is not a list.");
        }
        return value;
    }

    /**
     * All children in order, line breaks included.
     */
    public List<SExpression> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Direct children that are lists named {@code name}, or tokens or strings
     * whose value is {@code name}. Line breaks never match.
     */
    public List<SExpression> getChildren(String name) {
        List<SExpression> result = new ArrayList<>();
        for (SExpression child : children) {
            if (!child.isLineBreak() && child.value.equals(name)) {
                result.add(child);
            }
        }
        return result;
    }

    /**
     * @param index position in {@link #getChildren()}, so line breaks count
     */
    public SExpression getChildByIndex(int index) {
        if (index < 0 || index >= children.size()) {
            throw error(ErrorKind.INDEX_OUT_OF_RANGE, value,
                    "Child index " + index + " out of range, node has " + children.size() + " children.");
        }
        return children.get(index);
    }

    /**
     * Looks up a nested list, see {@link SExpressionPath} for the path syntax.
     */
    public Optional<SExpression> tryGetChildByPath(String path) {
        return SExpressionPath.resolve(this, path);
    }

    public SExpression getChildByPath(String path) {
        return tryGetChildByPath(path).orElseThrow(() ->
                error(ErrorKind.CHILD_NOT_FOUND, path, "Child not found: " + path));
    }

    public <T> T getValue(Class<T> type) {
        return getValue(ValueCodecs.forType(type), false);
    }

    public <T> T getValue(Class<T> type, boolean throwIfEmpty) {
        return getValue(ValueCodecs.forType(type), throwIfEmpty);
    }

    /**
     * Decodes the value of this token or string.
     *
     * @param throwIfEmpty whether empty text is an error instead of being passed to the codec
     * @throws FileParseException with the node's location and text if the node
     *                            is not a token or string, or the value cannot be decoded
     */
    public <T> T getValue(ValueCodec<T> codec, boolean throwIfEmpty) {
        if (!isToken() && !isString()) {
            throw error(ErrorKind.NOT_A_TOKEN_OR_STRING, value, "Node is not a token or string.");
        }
        if (value.isEmpty() && throwIfEmpty) {
            throw error(ErrorKind.EMPTY_VALUE, value, "Node value is empty.");
        }
        try {
            return codec.decode(value);
        } catch (ValueDecodeException e) {
            throw new FileParseException(e.getKind(), location.file(), location.line(), location.column(),
                    value, e.getMessage(), e);
        }
    }

    public <T> T getValueOfFirstChild(Class<T> type) {
        return getValueOfFirstChild(ValueCodecs.forType(type), false);
    }

    public <T> T getValueOfFirstChild(Class<T> type, boolean throwIfEmpty) {
        return getValueOfFirstChild(ValueCodecs.forType(type), throwIfEmpty);
    }

    /**
     * Decodes the first child that is not a line break.
     */
    public <T> T getValueOfFirstChild(ValueCodec<T> codec, boolean throwIfEmpty) {
        for (SExpression child : children) {
            if (!child.isLineBreak()) {
                return child.getValue(codec, throwIfEmpty);
            }
        }
        throw error(ErrorKind.NO_CHILDREN, "", "Node does not have children.");
    }

    public <T> T getValueByPath(String path, Class<T> type) {
        return getValueByPath(path, ValueCodecs.forType(type), false);
    }

    public <T> T getValueByPath(String path, Class<T> type, boolean throwIfEmpty) {
        return getValueByPath(path, ValueCodecs.forType(type), throwIfEmpty);
    }

    public <T> T getValueByPath(String path, ValueCodec<T> codec, boolean throwIfEmpty) {
        return getChildByPath(path).getValueOfFirstChild(codec, throwIfEmpty);
    }

    // --- Builders ---

    /**
     * Appends a new empty list.
     *
     * @return the new child, not this node
     */
    public SExpression appendList(String name, boolean linebreak) {
        SExpression child = createList(name);
        add(child, linebreak);
        return child;
    }

    /**
     * Appends a copy of {@code child}.
     *
     * @return this node
     */
    public SExpression appendChild(SExpression child, boolean linebreak) {
        add(new SExpression(child), linebreak);
        return this;
    }

    public SExpression appendLineBreak() {
        requireList();
        children.add(createLineBreak());
        return this;
    }

    /**
     * Appends {@code value} as a token, encoded by its runtime type.
     *
     * @see ValueCodecs#encode(Object)
     */
    public SExpression appendToken(Object value) {
        add(createToken(ValueCodecs.encode(Objects.requireNonNull(value, "value"))), false);
        return this;
    }

    public <T> SExpression appendToken(T value, ValueCodec<? super T> codec) {
        add(createToken(codec.encode(value)), false);
        return this;
    }

    public SExpression appendString(Object value) {
        add(createString(ValueCodecs.encode(Objects.requireNonNull(value, "value"))), false);
        return this;
    }

    public <T> SExpression appendString(T value, ValueCodec<? super T> codec) {
        add(createString(codec.encode(value)), false);
        return this;
    }

    /**
     * Appends {@code (name value)}.
     *
     * @return the new child list
     */
    public SExpression appendTokenChild(String name, Object value, boolean linebreak) {
        return appendList(name, linebreak).appendToken(value);
    }

    public <T> SExpression appendTokenChild(String name, T value, ValueCodec<? super T> codec, boolean linebreak) {
        return appendList(name, linebreak).appendToken(value, codec);
    }

    /**
     * Appends {@code (name "value")}.
     *
     * @return the new child list
     */
    public SExpression appendStringChild(String name, Object value, boolean linebreak) {
        return appendList(name, linebreak).appendString(value);
    }

    public <T> SExpression appendStringChild(String name, T value, ValueCodec<? super T> codec, boolean linebreak) {
        return appendList(name, linebreak).appendString(value, codec);
    }

    /**
     * Removes all line breaks from this subtree.
     */
    public void removeLineBreaks() {
        children.removeIf(SExpression::isLineBreak);
        for (SExpression child : children) {
            child.removeLineBreaks();
        }
    }

    public SExpression copy() {
        return new SExpression(this);
    }

    /**
     * Renders this node with the default {@link SExpressionWriter}.
     *
     * @param indent nesting level of this node
     */
    public String toString(int indent) {
        return new SExpressionWriter().write(this, indent);
    }

    @Override
    public String toString() {
        return toString(0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SExpression other)) return false;
        return type == other.type && value.equals(other.value) && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value, children);
    }

    // --- Internals used by the reader and writer ---

    String getText() {
        return value;
    }

    void addParsedChild(SExpression child) {
        children.add(child);
    }

    private void add(SExpression child, boolean linebreak) {
        requireList();
        if (linebreak) {
            children.add(createLineBreak());
        }
        children.add(child);
    }

    private void requireList() {
        if (!isList()) {
            throw error(ErrorKind.NOT_A_LIST, value, "Children can only be appended to a list.");
        }
    }

    private FileParseException error(ErrorKind kind, String invalidContent, String reason) {
        return new FileParseException(kind, location.file(), location.line(), location.column(),
                invalidContent, reason);
    }
}
