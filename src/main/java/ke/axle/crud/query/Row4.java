package ke.axle.crud.query;

public class Row4<A, B, C, D> extends Row3<A, B, C> {

    public Row4(A a, B b, C c, D d) {
        this(new Object[]{a, b, c, d});
    }

    Row4(Object[] values) {
        super(values);
    }

    public D getFourth() {
        return value(3);
    }
}
