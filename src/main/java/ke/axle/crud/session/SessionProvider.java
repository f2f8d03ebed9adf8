package ke.axle.crud.session;

/**
 * Opens sessions. Every call returns a new session that nothing else holds,
 * so one can be handed to each service built for a request.
 */
public interface SessionProvider {

    Session openSession();
}
