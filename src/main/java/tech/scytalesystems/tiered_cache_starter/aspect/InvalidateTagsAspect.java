package tech.scytalesystems.tiered_cache_starter.aspect;

import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.StandardEvaluationContext;
import tech.scytalesystems.tiered_cache_starter.annotation.InvalidateTags;
import tech.scytalesystems.tiered_cache_starter.invalidation.InvalidationBroker;
import tech.scytalesystems.tiered_cache_starter.invalidation.InvalidationResult;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 1455h
 * <p>Runs tag invalidation for methods annotated with {@link InvalidateTags}, after they return normally.
 */
@Aspect
public record InvalidateTagsAspect(InvalidationBroker broker) {
    private static final Logger log = LoggerFactory.getLogger(InvalidateTagsAspect.class);
    private static final SpelExpressionParser PARSER = new SpelExpressionParser();

    @SuppressWarnings("unused")
    @Around("@annotation(invalidateTags)")
    public Object aroundInvalidateTags(ProceedingJoinPoint pjp, InvalidateTags invalidateTags) throws Throwable {
        Object result = pjp.proceed();

        Method method = ((MethodSignature) pjp.getSignature()).getMethod();
        try {
            Set<String> tags = resolveTags(pjp, invalidateTags.value());
            if (tags.isEmpty()) return result;

            InvalidationResult outcome = broker.invalidateByTags(tags);
            if (!outcome.isComplete()) {
                log.warn("Partial tag invalidation after {}: failedKeys={}, failedTags={}",
                        method.getName(), outcome.failedKeys(), outcome.failedTags());
            }
        } catch (Exception e) {
            log.warn("Failed to invalidate tags for method: {}", method.getName(), e);
        }

        return result;
    }

    Set<String> resolveTags(ProceedingJoinPoint pjp, String[] expressions) {
        EvaluationContext context = createEvaluationContext(pjp);
        Set<String> tags = new LinkedHashSet<>();

        for (String expression : expressions) {
            if (expression == null || expression.isBlank()) continue;

            for (String tag : evaluate(expression, context)) {
                if (!tag.isBlank()) tags.add(tag);
            }
        }

        return tags;
    }

    /**
     * A collection or array result contributes one tag per element.
     */
    private List<String> evaluate(String expression, EvaluationContext context) {
        Object value;
        try {
            value = PARSER.parseExpression(expression).getValue(context);
        } catch (Exception e) {
            log.debug("Tag expression '{}' did not evaluate ({}), using it as a literal", expression, e.getMessage());
            return List.of(expression);
        }

        List<String> tags = new ArrayList<>();
        if (value instanceof Collection<?> values) {
            values.stream().filter(v -> v != null).forEach(v -> tags.add(v.toString()));
        } else if (value instanceof Object[] values) {
            for (Object v : values) {
                if (v != null) tags.add(v.toString());
            }
        } else if (value != null) {
            tags.add(value.toString());
        }

        return tags;
    }

    private EvaluationContext createEvaluationContext(ProceedingJoinPoint pjp) {
        StandardEvaluationContext context = new StandardEvaluationContext();

        Object[] args = pjp.getArgs();
        String[] paramNames = ((MethodSignature) pjp.getSignature()).getParameterNames();

        for (int i = 0; i < args.length; i++) {
            context.setVariable("p" + i, args[i]);
            context.setVariable("a" + i, args[i]);

            if (paramNames != null && i < paramNames.length) context.setVariable(paramNames[i], args[i]);
        }

        context.setVariable("target", pjp.getTarget());

        return context;
    }
}
