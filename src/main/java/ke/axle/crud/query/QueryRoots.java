package ke.axle.crud.query;

import javax.persistence.criteria.Root;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The roots of a statement being translated, in selection order. Index 0 is
 * the service's own model.
 */
public class QueryRoots {

    private final List<Root<?>> roots;

    public QueryRoots(List<Root<?>> roots) {
        this.roots = Collections.unmodifiableList(new ArrayList<>(roots));
    }

    public Root<?> get(int index) {
        return roots.get(index);
    }

    /**
     * @return the first root selecting the given model type
     * @throws IllegalArgumentException if the statement does not select it
     */
    @SuppressWarnings("unchecked")
    public <X> Root<X> get(Class<X> type) {
        for (Root<?> root : roots) {
            if (root.getJavaType() == type) {
                return (Root<X>) root;
            }
        }
        throw new IllegalArgumentException(type.getSimpleName() + " is not selected by this statement");
    }

    public int size() {
        return roots.size();
    }
}
