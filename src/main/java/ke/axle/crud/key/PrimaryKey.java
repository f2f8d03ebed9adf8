package ke.axle.crud.key;

import java.io.Serializable;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Primary key of a record. A key is either atomic (an integer or a string), an
 * ordered tuple of values or a named mapping of attribute name to value.
 * <p>
 * Keys render to a single line through {@link #format()}, which is what error
 * messages about a missing record show:
 * <pre>
 *     PrimaryKey.of(7L).format()                         // 7
 *     PrimaryKey.tuple("eu", 7).format()                 // eu|7
 *     PrimaryKey.named(Map.of("teamId", "t1")).format()  // teamId:t1
 * </pre>
 */
public abstract class PrimaryKey implements Serializable {

    public enum Kind {
        ATOMIC, TUPLE, NAMED
    }

    PrimaryKey() {
    }

    /**
     * Classifies the given key value.
     *
     * @param key a {@link PrimaryKey}, an integer, a string, a {@link List}, an
     *            array or a {@link Map}
     * @return the matching key variant
     * @throws IllegalArgumentException for any other shape
     */
    public static PrimaryKey of(Object key) {
        if (key instanceof PrimaryKey) {
            return (PrimaryKey) key;
        }
        if (isAtomicValue(key)) {
            return new Atomic(key);
        }
        if (key instanceof List) {
            return new Tuple((List<?>) key);
        }
        if (key instanceof Object[]) {
            return new Tuple(Arrays.asList((Object[]) key));
        }
        if (key instanceof Map) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) key).entrySet()) {
                values.put(String.valueOf(entry.getKey()), entry.getValue());
            }
            return new Named(values);
        }

        throw new IllegalArgumentException("Unrecognized primary key type: "
                + (key == null ? "null" : key.getClass().getName()));
    }

    public static PrimaryKey tuple(Object... values) {
        return new Tuple(Arrays.asList(values));
    }

    public static PrimaryKey named(Map<String, ?> values) {
        return new Named(new LinkedHashMap<String, Object>(values));
    }

    static boolean isAtomicValue(Object value) {
        return value instanceof CharSequence
                || value instanceof Integer
                || value instanceof Long
                || value instanceof Short
                || value instanceof Byte
                || value instanceof BigInteger;
    }

    public abstract Kind getKind();

    /**
     * @return the key rendered for diagnostics
     */
    public abstract String format();

    @Override
    public String toString() {
        return format();
    }

    public static final class Atomic extends PrimaryKey {

        private final Object value;

        Atomic(Object value) {
            this.value = value;
        }

        public Object getValue() {
            return value;
        }

        @Override
        public Kind getKind() {
            return Kind.ATOMIC;
        }

        @Override
        public String format() {
            return String.valueOf(value);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Atomic && Objects.equals(value, ((Atomic) o).value);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(value);
        }
    }

    public static final class Tuple extends PrimaryKey {

        private final List<Object> values;

        Tuple(List<?> values) {
            this.values = Collections.unmodifiableList(new ArrayList<>(values));
        }

        public List<Object> getValues() {
            return values;
        }

        @Override
        public Kind getKind() {
            return Kind.TUPLE;
        }

        @Override
        public String format() {
            return values.stream().map(String::valueOf).collect(Collectors.joining("|"));
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Tuple && values.equals(((Tuple) o).values);
        }

        @Override
        public int hashCode() {
            return values.hashCode();
        }
    }

    public static final class Named extends PrimaryKey {

        private final Map<String, Object> values;

        Named(Map<String, Object> values) {
            this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        }

        public Map<String, Object> getValues() {
            return values;
        }

        @Override
        public Kind getKind() {
            return Kind.NAMED;
        }

        @Override
        public String format() {
            return values.entrySet().stream()
                    .map(e -> e.getKey() + ":" + e.getValue())
                    .collect(Collectors.joining("|"));
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Named && values.equals(((Named) o).values);
        }

        @Override
        public int hashCode() {
            return values.hashCode();
        }
    }
}
