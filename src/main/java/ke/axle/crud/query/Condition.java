package ke.axle.crud.query;

import javax.persistence.criteria.CriteriaBuilder;
import javax.persistence.criteria.Predicate;

/**
 * Boolean expression over every root of a statement. Join conditions of a
 * multi-model select are written as conditions.
 */
@FunctionalInterface
public interface Condition {

    Predicate toPredicate(QueryRoots roots, CriteriaBuilder cb);

    /**
     * Applies a single-model filter to the first root of the given type.
     */
    static <X> Condition on(Class<X> type, Filter<X> filter) {
        return (roots, cb) -> filter.toPredicate(roots.get(type), cb);
    }
}
