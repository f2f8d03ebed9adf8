package ke.axle.crud.entity;

import javax.persistence.Column;
import javax.persistence.Id;
import javax.persistence.MappedSuperclass;
import java.util.UUID;

/**
 * Entity keyed by a random UUID string assigned on instantiation.
 */
@MappedSuperclass
public abstract class BaseUuidEntity implements Identifiable<String> {

    @Id
    @Column(name = "ID", length = 36)
    protected String id;

    public BaseUuidEntity() {
        this.id = UUID.randomUUID().toString();
    }

    @Override
    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }
}
