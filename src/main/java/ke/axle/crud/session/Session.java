package ke.axle.crud.session;

import ke.axle.crud.query.SelectStatement;

import java.util.Collection;

/**
 * The persistence session a {@link ke.axle.crud.GenericRecordService} runs on.
 * <p>
 * A session is owned by exactly one service and must not be used elsewhere
 * while that service is alive. Implementations block until the store
 * responds and report store failures as unchecked exceptions.
 */
public interface Session extends AutoCloseable {

    /**
     * Stages an instance for the next commit.
     */
    void add(Object item);

    void addAll(Collection<?> items);

    /**
     * Stages the deletion of a managed instance.
     */
    void delete(Object item);

    /**
     * Persists every staged change.
     */
    void commit();

    /**
     * Reverts uncommitted changes, leaving the session usable.
     */
    void rollback();

    /**
     * Reloads an instance's state from the store, discarding in-memory edits.
     */
    void refresh(Object item);

    /**
     * @return the instance with the given key, or {@code null} if there is none
     */
    <T> T get(Class<T> type, Object key);

    <R> QueryResult<R> execute(SelectStatement<R> statement);

    @Override
    void close();
}
