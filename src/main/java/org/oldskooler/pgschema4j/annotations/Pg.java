package org.oldskooler.pgschema4j.annotations;

import java.lang.annotation.*;

/**
 * Column annotation of a record field, e.g.
 * <pre>{@code @Pg("type=varchar(255),unique_index=uq_customer")}</pre>
 * The value is a comma separated list of {@code key} or {@code key=value} options.
 * Fields without this annotation are not mapped unless they embed annotated fields.
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Pg {
    /** Excludes the field, including any fields it embeds. */
    String SKIP = "-";

    String value();
}
