package ke.axle.crud.query;

import org.springframework.data.domain.Sort;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * An immutable, not yet executed select over one model type, optionally joined
 * with further model types. Every builder method returns a new statement.
 * <p>
 * A statement over a single model yields the model itself per row. A joined
 * statement yields a {@link Row2} ... {@link Row7} whose first value is the
 * primary model. Join conditions are not inferred, they must be given through
 * {@link #where(Condition)}:
 * <pre>
 *     SelectStatement&lt;Row2&lt;Player, Team&gt;&gt; stmt = players.select(Team.class)
 *             .where((roots, cb) -&gt; cb.equal(roots.get(Player.class).get("teamId"),
 *                     roots.get(Team.class).get("id")));
 * </pre>
 *
 * @param <R> row type
 */
public final class SelectStatement<R> {

    private final List<Class<?>> types;
    private final Function<Object, R> rowMapper;
    private final List<Condition> conditions;
    private final List<Ordering> orderings;
    private final Integer limit;
    private final Integer offset;

    private SelectStatement(List<Class<?>> types, Function<Object, R> rowMapper, List<Condition> conditions,
                            List<Ordering> orderings, Integer limit, Integer offset) {
        this.types = types;
        this.rowMapper = rowMapper;
        this.conditions = conditions;
        this.orderings = orderings;
        this.limit = limit;
        this.offset = offset;
    }

    private static <R> SelectStatement<R> create(Function<Object, R> rowMapper, Class<?>... types) {
        return new SelectStatement<>(Collections.unmodifiableList(Arrays.asList(types)), rowMapper,
                Collections.emptyList(), Collections.emptyList(), null, null);
    }

    private static Object[] values(Object row) {
        return (Object[]) row;
    }

    public static <T> SelectStatement<T> from(Class<T> model) {
        return create(model::cast, model);
    }

    public static <T, J1> SelectStatement<Row2<T, J1>> from(Class<T> model, Class<J1> j1) {
        return create(row -> new Row2<>(values(row)), model, j1);
    }

    public static <T, J1, J2> SelectStatement<Row3<T, J1, J2>> from(Class<T> model, Class<J1> j1, Class<J2> j2) {
        return create(row -> new Row3<>(values(row)), model, j1, j2);
    }

    public static <T, J1, J2, J3> SelectStatement<Row4<T, J1, J2, J3>> from(Class<T> model, Class<J1> j1,
                                                                            Class<J2> j2, Class<J3> j3) {
        return create(row -> new Row4<>(values(row)), model, j1, j2, j3);
    }

    public static <T, J1, J2, J3, J4> SelectStatement<Row5<T, J1, J2, J3, J4>> from(
            Class<T> model, Class<J1> j1, Class<J2> j2, Class<J3> j3, Class<J4> j4) {
        return create(row -> new Row5<>(values(row)), model, j1, j2, j3, j4);
    }

    public static <T, J1, J2, J3, J4, J5> SelectStatement<Row6<T, J1, J2, J3, J4, J5>> from(
            Class<T> model, Class<J1> j1, Class<J2> j2, Class<J3> j3, Class<J4> j4, Class<J5> j5) {
        return create(row -> new Row6<>(values(row)), model, j1, j2, j3, j4, j5);
    }

    public static <T, J1, J2, J3, J4, J5, J6> SelectStatement<Row7<T, J1, J2, J3, J4, J5, J6>> from(
            Class<T> model, Class<J1> j1, Class<J2> j2, Class<J3> j3, Class<J4> j4, Class<J5> j5, Class<J6> j6) {
        return create(row -> new Row7<>(values(row)), model, j1, j2, j3, j4, j5, j6);
    }

    /**
     * Narrows the statement. Conditions accumulate and are combined with AND.
     */
    public SelectStatement<R> where(Condition condition) {
        List<Condition> next = new ArrayList<>(conditions);
        next.add(condition);
        return new SelectStatement<>(types, rowMapper, Collections.unmodifiableList(next), orderings, limit, offset);
    }

    public <X> SelectStatement<R> where(Class<X> type, Filter<X> filter) {
        return where(Condition.on(type, filter));
    }

    public SelectStatement<R> orderBy(Ordering... orderings) {
        List<Ordering> next = new ArrayList<>(this.orderings);
        next.addAll(Arrays.asList(orderings));
        return new SelectStatement<>(types, rowMapper, conditions, Collections.unmodifiableList(next), limit, offset);
    }

    public SelectStatement<R> orderBy(Sort sort) {
        List<Ordering> next = new ArrayList<>();
        for (Sort.Order order : sort) {
            next.add(Ordering.of(order));
        }
        return orderBy(next.toArray(new Ordering[0]));
    }

    public SelectStatement<R> limit(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }
        return new SelectStatement<>(types, rowMapper, conditions, orderings, limit, offset);
    }

    public SelectStatement<R> offset(int offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        return new SelectStatement<>(types, rowMapper, conditions, orderings, limit, offset);
    }

    /**
     * @return the selected model types, the primary model first
     */
    public List<Class<?>> getTypes() {
        return types;
    }

    public boolean isJoined() {
        return types.size() > 1;
    }

    public List<Condition> getConditions() {
        return conditions;
    }

    public List<Ordering> getOrderings() {
        return orderings;
    }

    public Integer getLimit() {
        return limit;
    }

    public Integer getOffset() {
        return offset;
    }

    /**
     * Converts a raw result row (the model instance, or an {@code Object[]}
     * for joined statements) into this statement's row type.
     */
    public R mapRow(Object row) {
        return rowMapper.apply(row);
    }
}
