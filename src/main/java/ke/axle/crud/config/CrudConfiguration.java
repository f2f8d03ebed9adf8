package ke.axle.crud.config;

import com.fasterxml.jackson.databind.Module;
import ke.axle.crud.input.SettableModule;
import ke.axle.crud.session.jpa.JpaSessionProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.beanvalidation.LocalValidatorFactoryBean;

/**
 * Registers the session provider. Applications supply the
 * {@link javax.persistence.EntityManagerFactory} it opens sessions from.
 */
@Configuration
@ComponentScan(basePackageClasses = JpaSessionProvider.class)
public class CrudConfiguration {

    /**
     * Validator to pass to services that should share the application's
     * validation setup.
     */
    @Bean
    public LocalValidatorFactoryBean crudValidator() {
        return new LocalValidatorFactoryBean();
    }

    @Bean
    public Module settableModule() {
        return new SettableModule();
    }
}
