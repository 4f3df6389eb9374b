package bio.terra.adminauth.config;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import org.immutables.value.Value;

/**
 * Style for configuration property interfaces: {@code FooInterface} generates a modifiable {@code
 * Foo} with bean-style setters that Spring can bind to.
 */
@Target({ElementType.PACKAGE, ElementType.TYPE})
@Retention(RetentionPolicy.CLASS)
@Value.Style(
    get = {"is*", "get*"},
    init = "set*",
    typeAbstract = "*Interface",
    typeModifiable = "*",
    create = "create")
public @interface PropertiesInterfaceStyle {}
