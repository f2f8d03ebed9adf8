package ke.axle.crud.query;

import javax.persistence.criteria.CriteriaBuilder;
import javax.persistence.criteria.Predicate;
import javax.persistence.criteria.Root;

/**
 * Boolean expression over a single model type, e.g.
 * {@code (root, cb) -> cb.equal(root.get("name"), "Ann")}.
 *
 * @param <T> model type
 */
@FunctionalInterface
public interface Filter<T> {

    Predicate toPredicate(Root<T> root, CriteriaBuilder cb);
}
