package ke.axle.crud.query;

public class Row6<A, B, C, D, E, F> extends Row5<A, B, C, D, E> {

    public Row6(A a, B b, C c, D d, E e, F f) {
        this(new Object[]{a, b, c, d, e, f});
    }

    Row6(Object[] values) {
        super(values);
    }

    public F getSixth() {
        return value(5);
    }
}
