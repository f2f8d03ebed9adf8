package ke.axle.crud.query;

/**
 * Row of a select joined with one other model type.
 */
public class Row2<A, B> extends Row {

    public Row2(A a, B b) {
        this(new Object[]{a, b});
    }

    Row2(Object[] values) {
        super(values);
    }

    public A getFirst() {
        return value(0);
    }

    public B getSecond() {
        return value(1);
    }
}
