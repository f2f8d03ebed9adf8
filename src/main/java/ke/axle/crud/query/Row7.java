package ke.axle.crud.query;

public class Row7<A, B, C, D, E, F, G> extends Row6<A, B, C, D, E, F> {

    public Row7(A a, B b, C c, D d, E e, F f, G g) {
        this(new Object[]{a, b, c, d, e, f, g});
    }

    Row7(Object[] values) {
        super(values);
    }

    public G getSeventh() {
        return value(6);
    }
}
