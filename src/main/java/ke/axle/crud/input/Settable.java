package ke.axle.crud.input;

import java.io.Serializable;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * A field of an update input that tells "not provided" apart from "provided".
 * A provided value may itself be {@code null}, which clears the target field.
 * <pre>
 *     public class PlayerUpdate {
 *         private Settable&lt;String&gt; name = Settable.unset();
 *         ...
 *     }
 * </pre>
 *
 * @param <V> type of the wrapped value
 */
public final class Settable<V> implements Serializable {

    private static final Settable<?> UNSET = new Settable<>(null, false);

    private final V value;
    private final boolean set;

    private Settable(V value, boolean set) {
        this.value = value;
        this.set = set;
    }

    @SuppressWarnings("unchecked")
    public static <V> Settable<V> unset() {
        return (Settable<V>) UNSET;
    }

    public static <V> Settable<V> of(V value) {
        return new Settable<>(value, true);
    }

    public boolean isSet() {
        return set;
    }

    /**
     * @return the provided value, possibly {@code null}
     * @throws NoSuchElementException if no value was provided
     */
    public V get() {
        if (!set) {
            throw new NoSuchElementException("Value is not set");
        }
        return value;
    }

    public V orElse(V other) {
        return set ? value : other;
    }

    public void ifSet(Consumer<? super V> action) {
        if (set) {
            action.accept(value);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Settable)) {
            return false;
        }
        Settable<?> other = (Settable<?>) o;
        return set == other.set && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, set);
    }

    @Override
    public String toString() {
        return set ? "Settable[" + value + "]" : "Settable.unset";
    }
}
