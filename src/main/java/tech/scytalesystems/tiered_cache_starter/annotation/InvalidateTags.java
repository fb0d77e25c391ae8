package tech.scytalesystems.tiered_cache_starter.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 1450h
 * <p>Invalidates every cache entry carrying one of the given tags once the annotated method returns.
 *
 * <p>Each value is a SpEL expression evaluated against the method arguments ({@code #p0}, {@code #a0},
 * or the parameter name). A value that is not a valid expression is used as a literal tag.
 *
 * <pre>
 * &#64;InvalidateTags({"'product:' + #id", "'product-list'"})
 * public Product update(String id, ProductUpdate update) { ... }
 * </pre>
 *
 * <p>Nothing is invalidated when the method throws.
 */
@Documented
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface InvalidateTags {
    String[] value();
}
