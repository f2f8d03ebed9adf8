package ke.axle.crud.query;

public class Row5<A, B, C, D, E> extends Row4<A, B, C, D> {

    public Row5(A a, B b, C c, D d, E e) {
        this(new Object[]{a, b, c, d, e});
    }

    Row5(Object[] values) {
        super(values);
    }

    public E getFifth() {
        return value(4);
    }
}
