package ke.axle.crud.query;

import org.springframework.data.domain.Sort;

import javax.persistence.criteria.CriteriaBuilder;
import javax.persistence.criteria.Expression;
import javax.persistence.criteria.Order;
import javax.persistence.criteria.Path;

/**
 * Ordering expression over the roots of a statement.
 */
@FunctionalInterface
public interface Ordering {

    Order toOrder(QueryRoots roots, CriteriaBuilder cb);

    /**
     * Orders by a property of the primary root. Dotted properties walk
     * through embedded or related attributes.
     */
    static Ordering of(Sort.Order order) {
        return (roots, cb) -> {
            Path<?> path = roots.get(0);
            for (String part : order.getProperty().split("\\.")) {
                path = path.get(part);
            }
            Expression<?> expression = order.isIgnoreCase() ? cb.upper(path.as(String.class)) : path;
            return order.isAscending() ? cb.asc(expression) : cb.desc(expression);
        };
    }
}
