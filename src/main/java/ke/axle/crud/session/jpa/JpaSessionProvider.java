package ke.axle.crud.session.jpa;

import ke.axle.crud.session.Session;
import ke.axle.crud.session.SessionProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.persistence.EntityManagerFactory;

@Component
public class JpaSessionProvider implements SessionProvider {

    private final EntityManagerFactory entityManagerFactory;

    @Autowired
    public JpaSessionProvider(EntityManagerFactory entityManagerFactory) {
        this.entityManagerFactory = entityManagerFactory;
    }

    @Override
    public Session openSession() {
        return new JpaSession(this.entityManagerFactory.createEntityManager());
    }
}
