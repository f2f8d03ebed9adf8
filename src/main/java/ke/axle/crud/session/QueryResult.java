package ke.axle.crud.session;

import javax.persistence.NoResultException;
import javax.persistence.NonUniqueResultException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Rows returned by {@link Session#execute}, in query order.
 *
 * @param <R> row type: a model, or a {@link ke.axle.crud.query.Row} for joined selects
 */
public class QueryResult<R> implements Iterable<R> {

    private final List<R> rows;

    public QueryResult(List<R> rows) {
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    public List<R> all() {
        return rows;
    }

    /**
     * @throws NoResultException if there are no rows
     * @throws NonUniqueResultException if there is more than one row
     */
    public R one() {
        if (rows.isEmpty()) {
            throw new NoResultException("No row was found when one was required");
        }
        return oneOrNone();
    }

    /**
     * @return the only row, or {@code null} if there are none
     * @throws NonUniqueResultException if there is more than one row
     */
    public R oneOrNone() {
        if (rows.size() > 1) {
            throw new NonUniqueResultException("Multiple rows were found when one or none was required");
        }
        return rows.isEmpty() ? null : rows.get(0);
    }

    public R first() {
        return rows.isEmpty() ? null : rows.get(0);
    }

    public int size() {
        return rows.size();
    }

    public Stream<R> stream() {
        return rows.stream();
    }

    @Override
    public Iterator<R> iterator() {
        return rows.iterator();
    }
}
