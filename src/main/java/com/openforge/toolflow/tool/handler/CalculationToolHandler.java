package com.openforge.toolflow.tool.handler;

import com.openforge.toolflow.tool.ToolDescriptor;
import com.openforge.toolflow.tool.ToolExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionException;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Handler for {@code calculation} tools.
 *
 * Two layers:
 *   1. A textual allow/deny filter on the raw expression (characters limited to
 *      {@code [0-9A-Za-z_+\-*}{@code /(). ]}, no forbidden keyword).  Best-effort only.
 *   2. Evaluation by SpEL in a {@link SimpleEvaluationContext} after every
 *      identifier has been rewritten to a SpEL variable, so only the whitelisted
 *      math functions and the caller's numeric variables are reachable.
 *      Integer literals are widened to doubles: {@code 7/2} is {@code 3.5}.
 */
@Slf4j
@Component
public class CalculationToolHandler {

    private static final Pattern ALLOWED_EXPRESSION = Pattern.compile("[0-9A-Za-z_+\\-*/(). ]+");
    private static final List<String> FORBIDDEN_KEYWORDS = List.of("import", "exec", "eval", "open", "file", "__");

    private static final Pattern IDENTIFIER = Pattern.compile(
            "(?<![A-Za-z0-9_.])([A-Za-z_][A-Za-z0-9_]*(?:\\.[A-Za-z_][A-Za-z0-9_]*)*)(\\s*\\()?");
    private static final Pattern INTEGER_LITERAL = Pattern.compile("(?<![A-Za-z0-9_.])(\\d+)(?![\\d.A-Za-z_])");
    private static final Pattern VARIABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final Map<String, Method> FUNCTIONS = MathFunctions.registry();
    private static final Map<String, Double> CONSTANTS = Map.of("pi", Math.PI, "e", Math.E);

    private final ExpressionParser parser = new SpelExpressionParser();

    public Map<String, Object> execute(ToolDescriptor tool, Map<String, Object> parameters) {
        String expression = Values.string(parameters.get("expression"));
        if (expression == null) {
            throw new ToolExecutionException("Expression is required for calculations");
        }
        Map<String, Object> variables = Values.map(parameters.get("variables"));

        validate(expression);
        Map<String, Double> numericVariables = numericVariables(variables);

        Object value = evaluate(expression, numericVariables);
        log.debug("[CalculationTool:{}] {} = {}", tool.name(), expression, value);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("expression", expression);
        result.put("result", value);
        result.put("variables_used", variables);
        return result;
    }

    /** Rejects the expression before any evaluation takes place. */
    public static void validate(String expression) {
        if (!ALLOWED_EXPRESSION.matcher(expression).matches()) {
            throw new ToolExecutionException("Expression contains forbidden characters");
        }
        for (String keyword : FORBIDDEN_KEYWORDS) {
            if (expression.contains(keyword)) {
                throw new ToolExecutionException("Expression contains forbidden keyword: " + keyword);
            }
        }
    }

    // ── Evaluation ───────────────────────────────────────────────────────────

    private Object evaluate(String expression, Map<String, Double> variables) {
        String spel = toSpel(expression.replace("**", "^"), variables);

        SimpleEvaluationContext context = SimpleEvaluationContext.forReadOnlyDataBinding().build();
        FUNCTIONS.forEach(context::setVariable);
        CONSTANTS.forEach(context::setVariable);
        variables.forEach(context::setVariable);

        try {
            Expression parsed = parser.parseExpression(spel);
            return normalize(parsed.getValue(context));
        } catch (ExpressionException | ArithmeticException e) {
            throw new ToolExecutionException("Calculation error: " + e.getMessage(), e);
        }
    }

    /**
     * Rewrites {@code sqrt(x) + math.pi * 2} into {@code #sqrt(#x) + #pi * 2.0}.
     * Any identifier that is neither a whitelisted function (when called) nor a
     * constant or variable (when referenced) is rejected.
     */
    private static String toSpel(String expression, Map<String, Double> variables) {
        String widened = INTEGER_LITERAL.matcher(expression).replaceAll("$1.0");

        Matcher matcher = IDENTIFIER.matcher(widened);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            boolean call = matcher.group(2) != null;
            if (name.startsWith("math.")) {
                name = name.substring("math.".length());
            }
            if (name.contains(".")) {
                throw new ToolExecutionException("Calculation error: attribute access is not allowed: " + name);
            }
            if (call && !FUNCTIONS.containsKey(name)) {
                throw new ToolExecutionException("Calculation error: unknown function '%s'".formatted(name));
            }
            if (!call && !CONSTANTS.containsKey(name) && !variables.containsKey(name)) {
                throw new ToolExecutionException("Calculation error: name '%s' is not defined".formatted(name));
            }
            String replacement = "#" + name + (call ? "(" : "");
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static Map<String, Double> numericVariables(Map<String, Object> variables) {
        Map<String, Double> numeric = new LinkedHashMap<>();
        variables.forEach((name, value) -> {
            if (!VARIABLE_NAME.matcher(name).matches()) {
                throw new ToolExecutionException("Invalid variable name: " + name);
            }
            if (value instanceof Number number) {
                numeric.put(name, number.doubleValue());
            } else if (value instanceof String text) {
                try {
                    numeric.put(name, Double.parseDouble(text.trim()));
                } catch (NumberFormatException e) {
                    throw new ToolExecutionException("Variable '%s' must be numeric".formatted(name));
                }
            } else {
                throw new ToolExecutionException("Variable '%s' must be numeric".formatted(name));
            }
        });
        return numeric;
    }

    /** Whole doubles come back as longs so that {@code 2+3} reads as {@code 5}. */
    private static Object normalize(Object value) {
        if (value instanceof Double number) {
            if (number.isNaN() || number.isInfinite()) {
                throw new ToolExecutionException("Calculation error: result is not a finite number");
            }
            if (number == Math.rint(number) && Math.abs(number) < 1e15) {
                return number.longValue();
            }
        }
        return value;
    }
}
