package ke.axle.crud.query;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A result row of a joined select: the service's model followed by one
 * instance per joined model type. Subtypes add typed accessors per position.
 */
public abstract class Row {

    private final Object[] values;

    Row(Object[] values) {
        this.values = values;
    }

    public int size() {
        return values.length;
    }

    public Object get(int index) {
        return values[index];
    }

    public List<Object> toList() {
        return Collections.unmodifiableList(Arrays.asList(values));
    }

    @SuppressWarnings("unchecked")
    <X> X value(int index) {
        return (X) values[index];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Arrays.equals(values, ((Row) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return Arrays.toString(values);
    }
}
