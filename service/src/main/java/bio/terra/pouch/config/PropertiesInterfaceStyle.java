package bio.terra.pouch.config;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import org.immutables.value.Value;

/**
 * Style for configuration interfaces bound by Spring: {@code FooInterface} generates a modifiable
 * {@code Foo} with a static {@code create()} and chained setters.
 */
@Target({ElementType.PACKAGE, ElementType.TYPE})
@Retention(RetentionPolicy.CLASS)
@Value.Style(
    get = {"is*", "get*"},
    typeAbstract = "*Interface",
    typeModifiable = "*",
    visibility = Value.Style.ImplementationVisibility.PUBLIC)
public @interface PropertiesInterfaceStyle {}
