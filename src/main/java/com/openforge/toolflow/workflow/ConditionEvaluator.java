package com.openforge.toolflow.workflow;

import org.springframework.context.expression.MapAccessor;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Evaluates condition steps as SpEL expressions over the workflow context.
 *
 * Context keys are readable as bare names ({@code score > 0.5}) and through
 * {@code context} ({@code context['score'] > 0.5}).  The evaluation context is
 * a {@link SimpleEvaluationContext}: no type references, no constructors, no
 * bean references, and the root map is read-only.
 */
@Component
public class ConditionEvaluator {

    private final ExpressionParser parser = new SpelExpressionParser();

    /**
     * @throws org.springframework.expression.ExpressionException if the expression
     *         does not parse or references an unknown name
     */
    public boolean evaluate(String condition, Map<String, Object> context) {
        Map<String, Object> root = new LinkedHashMap<>(context);
        root.put("context", Collections.unmodifiableMap(new LinkedHashMap<>(context)));

        EvaluationContext evaluationContext = SimpleEvaluationContext
                .forPropertyAccessors(new MapAccessor())
                .withRootObject(Collections.unmodifiableMap(root))
                .build();
        Object value = parser.parseExpression(condition).getValue(evaluationContext);
        return truthy(value);
    }

    /** Null, false, zero and empty strings or collections are false. */
    static boolean truthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0.0;
        }
        if (value instanceof CharSequence text) {
            return text.length() > 0;
        }
        if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        return true;
    }
}
