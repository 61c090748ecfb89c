package com.openforge.toolflow.tool.handler;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The whitelisted functions a calculation may call.  Every public static
 * method of this class is registered under its own name.  Variadic functions take
 * boxed arguments so SpEL can repackage them.
 */
public final class MathFunctions {

    private MathFunctions() {
    }

    public static double abs(double value) {
        return Math.abs(value);
    }

    public static double min(Double... values) {
        return Arrays.stream(requireValues("min", values)).mapToDouble(Double::doubleValue).min().orElseThrow();
    }

    public static double max(Double... values) {
        return Arrays.stream(requireValues("max", values)).mapToDouble(Double::doubleValue).max().orElseThrow();
    }

    public static double sum(Double... values) {
        return Arrays.stream(values).mapToDouble(Double::doubleValue).sum();
    }

    /** round(x) or round(x, digits). */
    public static double round(Double... args) {
        requireValues("round", args);
        if (args.length == 1) {
            return Math.round(args[0]);
        }
        double scale = Math.pow(10, args[1].intValue());
        return Math.round(args[0] * scale) / scale;
    }

    public static double sqrt(double value) {
        return Math.sqrt(value);
    }

    public static double pow(double base, double exponent) {
        return Math.pow(base, exponent);
    }

    public static double floor(double value) {
        return Math.floor(value);
    }

    public static double ceil(double value) {
        return Math.ceil(value);
    }

    public static double log(double value) {
        return Math.log(value);
    }

    public static double log10(double value) {
        return Math.log10(value);
    }

    public static double exp(double value) {
        return Math.exp(value);
    }

    public static double sin(double value) {
        return Math.sin(value);
    }

    public static double cos(double value) {
        return Math.cos(value);
    }

    public static double tan(double value) {
        return Math.tan(value);
    }

    static Map<String, Method> registry() {
        Map<String, Method> functions = new LinkedHashMap<>();
        for (Method method : MathFunctions.class.getDeclaredMethods()) {
            int modifiers = method.getModifiers();
            if (Modifier.isPublic(modifiers) && Modifier.isStatic(modifiers)) {
                functions.put(method.getName(), method);
            }
        }
        return Map.copyOf(functions);
    }

    private static Double[] requireValues(String name, Double[] values) {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException(name + "() expects at least one argument");
        }
        return values;
    }
}
