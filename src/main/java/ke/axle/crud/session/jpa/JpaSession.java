package ke.axle.crud.session.jpa;

import ke.axle.crud.key.PrimaryKey;
import ke.axle.crud.query.Condition;
import ke.axle.crud.query.Ordering;
import ke.axle.crud.query.QueryRoots;
import ke.axle.crud.query.SelectStatement;
import ke.axle.crud.session.QueryResult;
import ke.axle.crud.session.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeanUtils;
import org.springframework.beans.PropertyAccessor;
import org.springframework.beans.PropertyAccessorFactory;
import org.springframework.core.annotation.AnnotationUtils;

import javax.persistence.EntityManager;
import javax.persistence.EntityNotFoundException;
import javax.persistence.EntityTransaction;
import javax.persistence.IdClass;
import javax.persistence.TypedQuery;
import javax.persistence.criteria.CriteriaBuilder;
import javax.persistence.criteria.CriteriaQuery;
import javax.persistence.criteria.Order;
import javax.persistence.criteria.Predicate;
import javax.persistence.criteria.Root;
import javax.persistence.criteria.Selection;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link Session} over one application-managed {@link EntityManager}.
 * <p>
 * Writes open a resource-local transaction on demand, which {@link #commit()}
 * closes. Managed instances stay managed across commits, so they can be
 * refreshed afterwards.
 * <p>
 * {@link #rollback()} clears the persistence context. Instances the session
 * handed out or accepted before that can still be passed back to
 * {@link #add}, {@link #delete} and {@link #refresh}: their state is merged
 * onto a managed copy, and refreshing copies the stored state back onto them.
 */
public class JpaSession implements Session {

    private static final Logger log = LoggerFactory.getLogger(JpaSession.class);

    private final EntityManager entityManager;

    // instances this session has managed, so they can be told apart from new ones once detached
    private final Set<Object> known = Collections.newSetFromMap(new IdentityHashMap<>());
    // instances persisted in the current transaction
    private final Set<Object> persisted = Collections.newSetFromMap(new IdentityHashMap<>());
    // detached instance -> managed copy it was merged onto
    private final Map<Object, Object> copies = new IdentityHashMap<>();

    public JpaSession(EntityManager entityManager) {
        this.entityManager = entityManager;
    }

    public EntityManager getEntityManager() {
        return entityManager;
    }

    @Override
    public void add(Object item) {
        boolean began = this.beginIfNeeded();
        try {
            if (this.entityManager.contains(item)) {
                return;
            }
            if (this.known.contains(item)) {
                this.managedCopy(item);
            } else {
                this.entityManager.persist(item);
                this.known.add(item);
                this.persisted.add(item);
            }
        } catch (RuntimeException e) {
            this.abort(began, e);
            throw e;
        }
    }

    @Override
    public void addAll(Collection<?> items) {
        for (Object item : items) {
            this.add(item);
        }
    }

    @Override
    public void delete(Object item) {
        boolean began = this.beginIfNeeded();
        try {
            this.entityManager.remove(this.entityManager.contains(item) ? item : this.managedCopy(item));
        } catch (RuntimeException e) {
            this.abort(began, e);
            throw e;
        }
    }

    @Override
    public void commit() {
        this.beginIfNeeded();
        this.entityManager.getTransaction().commit();
        this.persisted.clear();
    }

    @Override
    public void rollback() {
        EntityTransaction transaction = this.entityManager.getTransaction();
        if (transaction.isActive()) {
            transaction.rollback();
        }
        // the provider may still hold the failed writes, only clearing drops them
        this.entityManager.clear();
        this.copies.clear();
        // never stored, so they are new again
        this.known.removeAll(this.persisted);
        this.persisted.clear();
    }

    @Override
    public void refresh(Object item) {
        if (this.entityManager.contains(item)) {
            this.entityManager.refresh(item);
            return;
        }
        Object copy = this.copies.get(item);
        if (copy != null && this.entityManager.contains(copy)) {
            this.entityManager.refresh(copy);
        } else {
            copy = this.find(item);
            if (copy == null) {
                throw new EntityNotFoundException("No stored row for " + item);
            }
            this.copies.put(item, copy);
        }
        BeanUtils.copyProperties(copy, item);
    }

    @Override
    public <T> T get(Class<T> type, Object key) {
        T item = this.entityManager.find(type, this.toIdentifier(type, key));
        if (item != null) {
            this.known.add(item);
        }
        return item;
    }

    @Override
    public <R> QueryResult<R> execute(SelectStatement<R> statement) {
        CriteriaBuilder criteriaBuilder = this.entityManager.getCriteriaBuilder();
        CriteriaQuery<Object> criteriaQuery = criteriaBuilder.createQuery();

        List<Root<?>> roots = new ArrayList<>();
        for (Class<?> type : statement.getTypes()) {
            roots.add(criteriaQuery.from(type));
        }
        QueryRoots queryRoots = new QueryRoots(roots);

        if (statement.isJoined()) {
            criteriaQuery.multiselect(new ArrayList<Selection<?>>(roots));
        } else {
            criteriaQuery.select(roots.get(0));
        }

        List<Predicate> predicates = new ArrayList<>();
        for (Condition condition : statement.getConditions()) {
            predicates.add(condition.toPredicate(queryRoots, criteriaBuilder));
        }
        if (!predicates.isEmpty()) {
            criteriaQuery.where(predicates.toArray(new Predicate[0]));
        }

        List<Order> orders = new ArrayList<>();
        for (Ordering ordering : statement.getOrderings()) {
            orders.add(ordering.toOrder(queryRoots, criteriaBuilder));
        }
        if (!orders.isEmpty()) {
            criteriaQuery.orderBy(orders);
        }

        TypedQuery<Object> query = this.entityManager.createQuery(criteriaQuery);
        if (statement.getLimit() != null) {
            query.setMaxResults(statement.getLimit());
        }
        if (statement.getOffset() != null) {
            query.setFirstResult(statement.getOffset());
        }

        List<R> rows = new ArrayList<>();
        for (Object row : query.getResultList()) {
            if (row instanceof Object[]) {
                this.known.addAll(Arrays.asList((Object[]) row));
            } else {
                this.known.add(row);
            }
            rows.add(statement.mapRow(row));
        }
        log.debug("Select over {} returned {} row(s)", statement.getTypes(), rows.size());
        return new QueryResult<>(rows);
    }

    @Override
    public void close() {
        if (!this.entityManager.isOpen()) {
            return;
        }
        EntityTransaction transaction = this.entityManager.getTransaction();
        if (transaction.isActive()) {
            log.debug("Rolling back uncommitted changes on close");
            transaction.rollback();
        }
        this.entityManager.close();
        this.known.clear();
        this.persisted.clear();
        this.copies.clear();
    }

    /**
     * @return whether a transaction had to be started
     */
    private boolean beginIfNeeded() {
        EntityTransaction transaction = this.entityManager.getTransaction();
        if (transaction.isActive()) {
            return false;
        }
        transaction.begin();
        return true;
    }

    /**
     * Rolls back a transaction that the failed write itself started, so it is
     * not committed later with unrelated work.
     */
    private void abort(boolean began, RuntimeException failure) {
        EntityTransaction transaction = this.entityManager.getTransaction();
        if (!began || !transaction.isActive()) {
            return;
        }
        try {
            transaction.rollback();
        } catch (RuntimeException rollbackFailure) {
            failure.addSuppressed(rollbackFailure);
        }
    }

    /**
     * Merges a detached instance this session managed before onto its managed
     * copy, loading the copy if needed.
     */
    private Object managedCopy(Object item) {
        Object copy = this.entityManager.merge(item);
        this.copies.put(item, copy);
        this.known.add(copy);
        log.debug("Merged detached {} onto its managed copy", item.getClass().getSimpleName());
        return copy;
    }

    private Object find(Object item) {
        Object id = this.entityManager.getEntityManagerFactory().getPersistenceUnitUtil().getIdentifier(item);
        return id == null ? null : this.entityManager.find(item.getClass(), id);
    }

    /**
     * Converts {@link PrimaryKey} values into what {@link EntityManager#find}
     * expects. Maps and lists are read as named and positional keys, named
     * keys are bound onto the entity's {@link IdClass}.
     */
    private Object toIdentifier(Class<?> type, Object key) {
        if (!(key instanceof PrimaryKey || key instanceof Map || key instanceof List || key instanceof Object[])) {
            return key;
        }
        PrimaryKey primaryKey = PrimaryKey.of(key);
        switch (primaryKey.getKind()) {
            case ATOMIC:
                return ((PrimaryKey.Atomic) primaryKey).getValue();
            case NAMED:
                IdClass idClass = AnnotationUtils.findAnnotation(type, IdClass.class);
                if (idClass == null) {
                    throw new IllegalArgumentException(type.getSimpleName()
                            + " declares no @IdClass to bind the key " + primaryKey.format() + " to");
                }
                Object identifier = BeanUtils.instantiateClass(idClass.value());
                PropertyAccessor accessor = PropertyAccessorFactory.forBeanPropertyAccess(identifier);
                accessor.setPropertyValues(((PrimaryKey.Named) primaryKey).getValues());
                return identifier;
            default:
                throw new IllegalArgumentException("Positional key " + primaryKey.format()
                        + " cannot be resolved, pass a named key or the id class instead");
        }
    }
}
