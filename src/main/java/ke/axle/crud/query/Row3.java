package ke.axle.crud.query;

public class Row3<A, B, C> extends Row2<A, B> {

    public Row3(A a, B b, C c) {
        this(new Object[]{a, b, c});
    }

    Row3(Object[] values) {
        super(values);
    }

    public C getThird() {
        return value(2);
    }
}
