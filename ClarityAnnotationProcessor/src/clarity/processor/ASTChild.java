package clarity.processor;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/** Marks an accessor whose result is visited by {@code visitChildren}, in declaration order. */
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.METHOD)
public @interface ASTChild {}
