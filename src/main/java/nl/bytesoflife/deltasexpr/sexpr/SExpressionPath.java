package nl.bytesoflife.deltasexpr.sexpr;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves child paths such as {@code "library/symbol/pin"} or
 * {@code "library.symbol.pin"}.
 * <p>
 * {@code /} always separates levels. {@code .} separates levels too, but
 * since list names may contain dots, each step first tries the longest dotted
 * name that is still possible and falls back to shorter ones: with a child
 * named {@code version.2}, {@code "version.2"} finds that child rather than a
 * list {@code 2} inside {@code version}. Every step takes the first child
 * list with the given name. An empty path denotes the start node itself.
 */
public final class SExpressionPath {

    private SExpressionPath() {
    }

    public static Optional<SExpression> resolve(SExpression start, String path) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(path, "path");
        List<String[]> segments = new ArrayList<>();
        for (String segment : path.split("/")) {
            if (!segment.isEmpty()) {
                segments.add(segment.split("\\.", -1));
            }
        }
        return resolve(start, segments, 0, 0);
    }

    private static Optional<SExpression> resolve(SExpression node, List<String[]> segments, int segment, int piece) {
        if (segment == segments.size()) {
            return Optional.of(node);
        }
        String[] pieces = segments.get(segment);
        for (int end = pieces.length; end > piece; end--) {
            String name = String.join(".", Arrays.copyOfRange(pieces, piece, end));
            Optional<SExpression> child = firstList(node, name);
            if (child.isPresent()) {
                boolean segmentDone = end == pieces.length;
                Optional<SExpression> found = resolve(child.get(), segments,
                        segmentDone ? segment + 1 : segment, segmentDone ? 0 : end);
                if (found.isPresent()) {
                    return found;
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<SExpression> firstList(SExpression node, String name) {
        for (SExpression child : node.getChildren(name)) {
            if (child.isList()) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }
}
