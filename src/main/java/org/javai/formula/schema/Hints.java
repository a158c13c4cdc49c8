package org.javai.formula.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.formula.contrast.Contrasts;
import org.javai.formula.contrast.DummyCoding;
import org.javai.formula.contrast.EffectsCoding;
import org.javai.formula.contrast.FullDummyCoding;
import org.javai.formula.contrast.HelmertCoding;
import org.javai.formula.contrast.SeqDiffCoding;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Hints by variable name.
 *
 * <p>Hints can be built in code or read from JSON, where each variable maps either to
 * {@code "continuous"} or {@code "categorical"}, or to an object selecting a coding:
 * <pre>{@code
 * {
 *   "dose":  "categorical",
 *   "group": {"contrasts": "effects", "base": "control"},
 *   "stage": {"contrasts": "helmert", "levels": ["I", "II", "III"]}
 * }
 * }</pre>
 * Known codings are {@code dummy}, {@code effects}, {@code helmert}, {@code seqdiff}
 * and {@code fulldummy}. JSON numbers become {@code Integer}, {@code Long} or
 * {@code Double} values, and must match the types of the data's values.
 */
public final class Hints {

    private static final Hints NONE = new Hints(Map.of());
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<String, Hint> hints;

    private Hints(Map<String, Hint> hints) {
        this.hints = hints;
    }

    public static Hints none() {
        return NONE;
    }

    public static Hints of(Map<String, Hint> hints) {
        Objects.requireNonNull(hints, "hints must not be null");
        return new Hints(Collections.unmodifiableMap(new LinkedHashMap<>(hints)));
    }

    public static Hints of(String name, Hint hint) {
        return NONE.with(name, hint);
    }

    public Hints with(String name, Hint hint) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(hint, "hint must not be null");
        Map<String, Hint> extended = new LinkedHashMap<>(hints);
        extended.put(name, hint);
        return new Hints(Collections.unmodifiableMap(extended));
    }

    public Optional<Hint> get(String name) {
        return Optional.ofNullable(hints.get(name));
    }

    public Map<String, Hint> asMap() {
        return hints;
    }

    public boolean isEmpty() {
        return hints.isEmpty();
    }

    /**
     * Reads hints from JSON text.
     *
     * @throws IllegalArgumentException if the JSON is malformed or names an unknown kind or coding
     */
    public static Hints fromJson(String json) {
        try {
            return fromJson(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("malformed hints JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static Hints fromJson(InputStream json) {
        try {
            return fromJson(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("malformed hints JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read hints JSON", e);
        }
    }

    static Hints fromJson(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("hints JSON must be an object, got " + root);
        }
        Map<String, Hint> hints = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            hints.put(field.getKey(), hintFor(field.getKey(), field.getValue()));
        }
        return of(hints);
    }

    private static Hint hintFor(String name, JsonNode node) {
        if (node.isTextual()) {
            switch (node.asText()) {
                case "continuous":
                    return Hint.continuous();
                case "categorical":
                    return Hint.categorical();
                default:
                    return Hint.contrasts(coding(name, node.asText(), null, null));
            }
        }
        if (node.isObject()) {
            JsonNode kind = node.path("contrasts");
            if (!kind.isTextual()) {
                throw new IllegalArgumentException("hint for " + name + " needs a \"contrasts\" name: " + node);
            }
            Object base = node.has("base") ? value(node.get("base")) : null;
            List<Object> levels = null;
            if (node.has("levels")) {
                JsonNode levelsNode = node.get("levels");
                if (!levelsNode.isArray()) {
                    throw new IllegalArgumentException("levels for " + name + " must be an array: " + levelsNode);
                }
                levels = new ArrayList<>();
                for (JsonNode level : levelsNode) {
                    levels.add(value(level));
                }
            }
            return Hint.contrasts(coding(name, kind.asText(), base, levels));
        }
        throw new IllegalArgumentException("unsupported hint for " + name + ": " + node);
    }

    private static Contrasts coding(String name, String kind, Object base, List<Object> levels) {
        switch (kind) {
            case "dummy":
                return new DummyCoding(base, levels);
            case "effects":
                return new EffectsCoding(base, levels);
            case "helmert":
                return new HelmertCoding(base, levels);
            case "seqdiff":
                return new SeqDiffCoding(base, levels);
            case "fulldummy":
                if (base != null) {
                    throw new IllegalArgumentException("full dummy coding of " + name + " has no base level");
                }
                return new FullDummyCoding(levels);
            default:
                throw new IllegalArgumentException("unknown hint for " + name + ": " + kind);
        }
    }

    private static Object value(JsonNode node) {
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        throw new IllegalArgumentException("unsupported level value: " + node);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Hints other && hints.equals(other.hints);
    }

    @Override
    public int hashCode() {
        return hints.hashCode();
    }

    @Override
    public String toString() {
        return "Hints" + hints;
    }
}
