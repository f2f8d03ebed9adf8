package ke.axle.crud;

import ke.axle.crud.exceptions.CommitFailed;
import ke.axle.crud.exceptions.MultipleResultsFound;
import ke.axle.crud.exceptions.NotFound;
import ke.axle.crud.key.PrimaryKey;
import ke.axle.crud.query.Condition;
import ke.axle.crud.query.Filter;
import ke.axle.crud.query.Row2;
import ke.axle.crud.query.Row3;
import ke.axle.crud.query.Row4;
import ke.axle.crud.query.Row5;
import ke.axle.crud.query.Row6;
import ke.axle.crud.query.Row7;
import ke.axle.crud.query.SelectStatement;
import ke.axle.crud.session.QueryResult;
import ke.axle.crud.session.Session;
import ke.axle.crud.utils.Extractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeanUtils;
import org.springframework.beans.BeanWrapper;
import org.springframework.beans.PropertyAccessorFactory;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.util.Pair;

import javax.persistence.IdClass;
import javax.persistence.NoResultException;
import javax.persistence.NonUniqueResultException;
import javax.validation.ConstraintViolation;
import javax.validation.ConstraintViolationException;
import javax.validation.Validation;
import javax.validation.Validator;
import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Create, read, update and delete operations for one model type, run on a
 * {@link Session} the service owns.
 * <p>
 * Once a session is handed to a service it must only be used through that
 * service, and a service must not be reused across requests: uncommitted
 * state would leak from one caller to the next. Close the service when done,
 * which closes the session.
 * <p>
 * Type parameters:
 * <ul>
 * <li>{@code T}: the persisted model (a JPA entity)</li>
 * <li>{@code C}: the creation input. It may be {@code T} itself. Converted by
 * {@link #prepareForCreate(Object)}.</li>
 * <li>{@code U}: the update input. Its {@link ke.axle.crud.input.Settable}
 * fields that hold a value are the changes applied by
 * {@link #prepareForUpdate(Object)}.</li>
 * <li>{@code K}: the primary key, usually {@code Long} or {@code String}</li>
 * </ul>
 * A typical service only fixes the model:
 * <pre>
 * public class PlayerService extends GenericRecordService&lt;Player, PlayerCreate, PlayerUpdate, Long&gt; {
 *     public PlayerService(Session session) {
 *         super(session, Player.class);
 *     }
 * }
 * </pre>
 *
 * @param <T> model
 * @param <C> creation input
 * @param <U> update input
 * @param <K> primary key
 */
public class GenericRecordService<T, C, U, K> implements AutoCloseable {

    protected Logger log = LoggerFactory.getLogger(this.getClass());

    private final Session session;
    private final Class<T> model;
    private final Validator validator;

    /**
     * @param session the session to run on. The service becomes its sole owner.
     * @param model   the persisted model type
     */
    public GenericRecordService(Session session, Class<T> model) {
        this(session, model, DefaultValidator.INSTANCE);
    }

    /**
     * @param session   the session to run on. The service becomes its sole owner.
     * @param model     the persisted model type
     * @param validator validates models built by {@link #prepareForCreate(Object)}
     */
    public GenericRecordService(Session session, Class<T> model, Validator validator) {
        this.session = session;
        this.model = model;
        this.validator = validator;
    }

    protected Session getSession() {
        return session;
    }

    public Class<T> getModel() {
        return model;
    }

    // ---- reads

    public List<T> all() {
        return this.all(null, null, null, null);
    }

    public List<T> all(Filter<T> where) {
        return this.all(where, null, null, null);
    }

    /**
     * Returns the items matching the filter, in query order.
     *
     * @param where   optional filter
     * @param orderBy optional ordering over model properties
     * @param limit   optional maximum number of items
     * @param offset  optional number of items to skip
     */
    public List<T> all(Filter<T> where, Sort orderBy, Integer limit, Integer offset) {
        SelectStatement<T> statement = this.select();

        if (where != null) {
            statement = statement.where(Condition.on(model, where));
        }
        if (orderBy != null && orderBy.isSorted()) {
            statement = statement.orderBy(orderBy);
        }
        if (limit != null) {
            statement = statement.limit(limit);
        }
        if (offset != null) {
            statement = statement.offset(offset);
        }

        return this.execute(statement).all();
    }

    /**
     * Returns one page of the items matching the filter.
     */
    public List<T> all(Filter<T> where, Pageable page) {
        if (page.isUnpaged()) {
            return this.all(where, page.getSort(), null, null);
        }
        // queries take an int offset
        int offset = (int) Math.min(page.getOffset(), Integer.MAX_VALUE);
        return this.all(where, page.getSort(), page.getPageSize(), offset);
    }

    /**
     * Returns all items.
     *
     * @deprecated use {@link #all()}
     */
    @Deprecated
    public List<T> getAll() {
        return this.all();
    }

    /**
     * Returns the single item matching the filter.
     *
     * @throws NotFound             if no item matches
     * @throws MultipleResultsFound if more than one item matches
     */
    public T one(Filter<T> where) throws NotFound, MultipleResultsFound {
        try {
            return this.execute(this.select().where(Condition.on(model, where)).limit(2)).one();
        } catch (NonUniqueResultException e) {
            throw new MultipleResultsFound("Multiple items matched the where clause.", e);
        } catch (NoResultException e) {
            throw new NotFound("No items matched the where clause.", e);
        }
    }

    /**
     * Returns the item matching the filter, or {@code null} if there is none.
     *
     * @throws MultipleResultsFound if more than one item matches
     */
    public T oneOrNone(Filter<T> where) throws MultipleResultsFound {
        try {
            return this.execute(this.select().where(Condition.on(model, where)).limit(2)).oneOrNone();
        } catch (NonUniqueResultException e) {
            throw new MultipleResultsFound("Multiple items matched the where clause.", e);
        }
    }

    /**
     * @return the item with the given key, or {@code null} if it does not exist
     */
    public T getByKey(K key) {
        return session.get(model, key);
    }

    /**
     * Returns the items whose key is among the given ones. Keys without a
     * record are skipped, so the result may be shorter than {@code keys}.
     * {@link PrimaryKey.Atomic} keys are matched by their value.
     *
     * @throws IllegalArgumentException for composite {@link PrimaryKey} keys
     */
    public List<T> getByKeys(Collection<K> keys) {
        if (keys.isEmpty()) {
            return Collections.emptyList();
        }
        List<Object> values = new ArrayList<>(keys.size());
        for (K key : keys) {
            values.add(this.keyValue(key));
        }
        String attribute = this.keyAttribute();
        return this.execute(this.select().where(model, (root, cb) -> root.get(attribute).in(values))).all();
    }

    public SelectStatement<T> select() {
        return SelectStatement.from(model);
    }

    /**
     * Creates a select over the model joined with another model type. Rows
     * hold the model first. The join condition must be added with
     * {@link SelectStatement#where(Condition)}.
     */
    public <J1> SelectStatement<Row2<T, J1>> select(Class<J1> j1) {
        return SelectStatement.from(model, j1);
    }

    public <J1, J2> SelectStatement<Row3<T, J1, J2>> select(Class<J1> j1, Class<J2> j2) {
        return SelectStatement.from(model, j1, j2);
    }

    public <J1, J2, J3> SelectStatement<Row4<T, J1, J2, J3>> select(Class<J1> j1, Class<J2> j2, Class<J3> j3) {
        return SelectStatement.from(model, j1, j2, j3);
    }

    public <J1, J2, J3, J4> SelectStatement<Row5<T, J1, J2, J3, J4>> select(Class<J1> j1, Class<J2> j2,
                                                                           Class<J3> j3, Class<J4> j4) {
        return SelectStatement.from(model, j1, j2, j3, j4);
    }

    public <J1, J2, J3, J4, J5> SelectStatement<Row6<T, J1, J2, J3, J4, J5>> select(
            Class<J1> j1, Class<J2> j2, Class<J3> j3, Class<J4> j4, Class<J5> j5) {
        return SelectStatement.from(model, j1, j2, j3, j4, j5);
    }

    public <J1, J2, J3, J4, J5, J6> SelectStatement<Row7<T, J1, J2, J3, J4, J5, J6>> select(
            Class<J1> j1, Class<J2> j2, Class<J3> j3, Class<J4> j4, Class<J5> j5, Class<J6> j6) {
        return SelectStatement.from(model, j1, j2, j3, j4, j5, j6);
    }

    public <R> QueryResult<R> execute(SelectStatement<R> statement) {
        return session.execute(statement);
    }

    // ---- writes

    /**
     * Creates a record from the given data and refreshes it, so store
     * generated values such as the key are populated.
     *
     * @throws CommitFailed if the session fails to commit
     */
    public T create(C data) throws CommitFailed {
        T item = this.prepareForCreate(data);
        session.add(item);
        this.safeCommit("Commit failed.");
        session.refresh(item);
        log.debug("Created {} {}", model.getSimpleName(), item);
        return item;
    }

    /**
     * Creates records from the given data with a single commit. The returned
     * items are not refreshed.
     *
     * @throws CommitFailed if the session fails to commit
     */
    public List<T> createMultiple(List<? extends C> data) throws CommitFailed {
        List<T> items = new ArrayList<>(data.size());
        for (C entry : data) {
            items.add(this.prepareForCreate(entry));
        }
        session.addAll(items);
        this.safeCommit("Commit failed.");
        return items;
    }

    /**
     * Stages items the way {@link #create(Object)} or {@link #update(Object, Object)}
     * would, depending on {@code operation}: creation inputs for
     * {@link Operation#CREATE}, {@code Pair<T, U>} of item and changes for
     * {@link Operation#UPDATE}.
     * <p>
     * With {@code commit} set the session is committed even if {@code items} is
     * empty, so calls can be chained without tracking when to commit. Staged
     * items are never refreshed.
     *
     * @return the staged items
     * @throws CommitFailed             if the session fails to commit
     * @throws IllegalArgumentException if {@code operation} is missing
     */
    @SuppressWarnings("unchecked")
    public List<T> addToSession(Collection<?> items, boolean commit, Operation operation) throws CommitFailed {
        if (operation == null) {
            throw new IllegalArgumentException("Unsupported operation: null");
        }

        List<T> dbItems = new ArrayList<>(items.size());
        switch (operation) {
            case CREATE:
                for (Object item : items) {
                    dbItems.add(this.prepareForCreate((C) item));
                }
                break;
            case UPDATE:
                for (Object item : items) {
                    Pair<T, U> change = (Pair<T, U>) item;
                    dbItems.add(this.applyChangesToItem(change.getFirst(), change.getSecond()));
                }
                break;
            default:
                throw new IllegalArgumentException("Unsupported operation: " + operation);
        }

        session.addAll(dbItems);
        log.debug("Staged {} {} item(s) for {}", dbItems.size(), model.getSimpleName(), operation);
        if (commit) {
            this.safeCommit("Commit failed.");
        }

        return dbItems;
    }

    public List<T> addToSession(Collection<? extends C> items, boolean commit) throws CommitFailed {
        return this.addToSession(items, commit, Operation.CREATE);
    }

    public List<T> addUpdatesToSession(Collection<Pair<T, U>> changes, boolean commit) throws CommitFailed {
        return this.addToSession(changes, commit, Operation.UPDATE);
    }

    /**
     * Updates the record with the given key.
     *
     * @throws NotFound    if there is no record with the key
     * @throws CommitFailed if the session fails to commit
     */
    public T update(K key, U data) throws NotFound, CommitFailed {
        T item = this.getByKey(key);
        if (item == null) {
            throw new NotFound(this.formatKey(key));
        }

        return this.updateItem(item, data);
    }

    /**
     * Same as {@link #update(Object, Object)} for an item that is already loaded.
     *
     * @throws CommitFailed if the session fails to commit
     */
    public T updateItem(T item, U data) throws CommitFailed {
        this.applyChangesToItem(item, data);
        session.add(item);
        this.safeCommit("Update failed.");

        session.refresh(item);
        return item;
    }

    /**
     * Deletes the record with the given key.
     *
     * @throws NotFound    if there is no record with the key
     * @throws CommitFailed if the session fails to commit
     */
    public void deleteByKey(K key) throws NotFound, CommitFailed {
        T item = this.getByKey(key);
        if (item == null) {
            throw new NotFound(this.formatKey(key));
        }

        session.delete(item);
        this.safeCommit("Failed to delete item.");
        log.debug("Deleted {} {}", model.getSimpleName(), this.formatKey(key));
    }

    /**
     * Reloads the item from the store, dropping uncommitted changes to it.
     */
    public void refresh(T item) {
        session.refresh(item);
    }

    /**
     * Closes the owned session.
     */
    @Override
    public void close() {
        session.close();
    }

    // ---- hooks

    /**
     * Converts creation data into a model instance. Data that already is a
     * model is used as is, a {@link Map} is bound as property values, any
     * other object has its matching properties copied. The result is then
     * validated.
     *
     * @throws ConstraintViolationException if the model is invalid
     */
    protected T prepareForCreate(C data) {
        T item;
        if (model.isInstance(data)) {
            item = model.cast(data);
        } else if (data instanceof Map) {
            item = BeanUtils.instantiateClass(model);
            PropertyAccessorFactory.forBeanPropertyAccess(item).setPropertyValues((Map<?, ?>) data);
        } else {
            item = BeanUtils.instantiateClass(model);
            BeanUtils.copyProperties(data, item);
        }

        Set<ConstraintViolation<T>> violations = validator.validate(item);
        if (!violations.isEmpty()) {
            throw new ConstraintViolationException("Invalid " + model.getSimpleName(), violations);
        }
        return item;
    }

    /**
     * Converts update data into property name / new value pairs. Only values
     * the caller explicitly set are included, everything else is left alone.
     */
    protected Map<String, Object> prepareForUpdate(U data) {
        if (data instanceof Map) {
            Map<String, Object> changes = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) data).entrySet()) {
                changes.put(String.valueOf(entry.getKey()), entry.getValue());
            }
            return changes;
        }
        return Extractor.extractSetValues(data);
    }

    /**
     * Applies the changes to the item without committing.
     *
     * @return the given item
     */
    protected T applyChangesToItem(T item, U data) {
        BeanWrapper wrapper = PropertyAccessorFactory.forBeanPropertyAccess(item);
        for (Map.Entry<String, Object> change : this.prepareForUpdate(data).entrySet()) {
            wrapper.setPropertyValue(change.getKey(), change.getValue());
        }

        return item;
    }

    /**
     * Renders a key for error messages. An instance of the model's
     * {@link IdClass} renders like a named key over its fields, in
     * declaration order.
     *
     * @throws IllegalArgumentException if the key's shape is not recognized
     */
    protected String formatKey(K key) {
        IdClass idClass = AnnotationUtils.findAnnotation(model, IdClass.class);
        if (idClass != null && idClass.value().isInstance(key)) {
            BeanWrapper wrapper = PropertyAccessorFactory.forBeanPropertyAccess(key);
            Map<String, Object> values = new LinkedHashMap<>();
            for (Field field : Extractor.getAllFields(idClass.value())) {
                if (wrapper.isReadableProperty(field.getName())) {
                    values.put(field.getName(), wrapper.getPropertyValue(field.getName()));
                }
            }
            return PrimaryKey.named(values).format();
        }
        return PrimaryKey.of(key).format();
    }

    private Object keyValue(K key) {
        if (!(key instanceof PrimaryKey)) {
            return key;
        }
        PrimaryKey primaryKey = (PrimaryKey) key;
        if (primaryKey.getKind() != PrimaryKey.Kind.ATOMIC) {
            throw new IllegalArgumentException("Only atomic keys can be looked up in bulk, got " + primaryKey.format());
        }
        return ((PrimaryKey.Atomic) primaryKey).getValue();
    }

    /**
     * The model attribute holding the primary key, used by {@link #getByKeys}.
     */
    protected String keyAttribute() {
        return "id";
    }

    /**
     * Commits the session and rolls it back if the commit fails.
     *
     * @throws CommitFailed if committing failed
     */
    protected void safeCommit(String errorMessage) throws CommitFailed {
        try {
            session.commit();
        } catch (RuntimeException e) {
            log.warn("{}: commit failed, rolling back session", model.getSimpleName(), e);
            try {
                session.rollback();
            } catch (RuntimeException rollbackFailure) {
                e.addSuppressed(rollbackFailure);
            }
            throw new CommitFailed(errorMessage, e);
        }
    }

    private static final class DefaultValidator {
        static final Validator INSTANCE = Validation.buildDefaultValidatorFactory().getValidator();
    }
}
