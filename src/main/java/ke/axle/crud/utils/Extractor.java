package ke.axle.crud.utils;

import ke.axle.crud.input.Settable;
import org.springframework.util.ReflectionUtils;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.*;

public abstract class Extractor {

    /**
     * Instance fields of a type and its superclasses, the type's own fields first.
     */
    public static List<Field> getAllFields(Class<?> type) {
        List<Field> fields = new ArrayList<Field>();
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            for (Field field : c.getDeclaredFields()) {
                if (!Modifier.isStatic(field.getModifiers()) && !field.isSynthetic()) {
                    fields.add(field);
                }
            }
        }
        return fields;
    }

    /**
     * Reads every {@link Settable} field of the input that holds a value.
     *
     * @return field name to provided value, in field order
     */
    public static Map<String, Object> extractSetValues(Object input) {
        Map<String, Object> values = new LinkedHashMap<>();

        for (Field field : getAllFields(input.getClass())) {
            if (!Settable.class.isAssignableFrom(field.getType())) {
                continue;
            }
            ReflectionUtils.makeAccessible(field);
            Settable<?> settable = (Settable<?>) ReflectionUtils.getField(field, input);
            if (settable != null && settable.isSet() && !values.containsKey(field.getName())) {
                values.put(field.getName(), settable.get());
            }
        }

        return values;
    }
}
