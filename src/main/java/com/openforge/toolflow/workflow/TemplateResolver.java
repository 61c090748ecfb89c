package com.openforge.toolflow.workflow;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {@code {{path.to.value}}} placeholders against a workflow context.
 *
 * Paths are dotted keys with optional list indices: {@code order.items[0].sku}
 * or {@code order.items.0.sku}.  A string that is exactly one placeholder
 * resolves to the referenced value with its type kept; placeholders embedded
 * in longer text are stringified (maps and lists as JSON).  Placeholders whose
 * path does not resolve are left verbatim.
 */
@Component
@RequiredArgsConstructor
public class TemplateResolver {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([^{}]+?)\\s*}}");
    private static final Pattern WHOLE_PLACEHOLDER = Pattern.compile("\\s*\\{\\{\\s*([^{}]+?)\\s*}}\\s*");
    private static final Pattern SEGMENT = Pattern.compile("([^\\[\\]]*)((?:\\[\\d+])*)");
    private static final Pattern INDEX = Pattern.compile("\\[(\\d+)]");

    private static final Object MISSING = new Object();

    private final ObjectMapper objectMapper;

    /** Resolves every string found in {@code value}, recursing into maps and lists. */
    public Object resolve(Object value, Map<String, Object> context) {
        if (value instanceof String text) {
            return resolveString(text, context);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> resolved = new LinkedHashMap<>();
            map.forEach((key, entry) -> resolved.put(String.valueOf(key), resolve(entry, context)));
            return resolved;
        }
        if (value instanceof List<?> list) {
            List<Object> resolved = new ArrayList<>(list.size());
            list.forEach(entry -> resolved.add(resolve(entry, context)));
            return resolved;
        }
        return value;
    }

    public Map<String, Object> resolveMap(Map<String, Object> parameters, Map<String, Object> context) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        if (parameters != null) {
            parameters.forEach((key, value) -> resolved.put(key, resolve(value, context)));
        }
        return resolved;
    }

    /** Always produces text: every placeholder is stringified. */
    public String render(String template, Map<String, Object> context) {
        if (template == null) {
            return "";
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            Object value = lookup(matcher.group(1), context);
            String replacement = value == MISSING ? matcher.group() : stringify(value);
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private Object resolveString(String text, Map<String, Object> context) {
        Matcher whole = WHOLE_PLACEHOLDER.matcher(text);
        if (whole.matches()) {
            Object value = lookup(whole.group(1), context);
            return value == MISSING ? text : value;
        }
        return render(text, context);
    }

    // ── Path lookup ──────────────────────────────────────────────────────────

    /** @return the value at {@code path}, possibly null, or {@link #MISSING} */
    private static Object lookup(String path, Map<String, Object> context) {
        Object current = context;
        for (String segment : path.trim().split("\\.")) {
            Matcher matcher = SEGMENT.matcher(segment.trim());
            if (!matcher.matches()) {
                return MISSING;
            }
            String key = matcher.group(1);
            if (!key.isEmpty()) {
                current = step(current, key);
                if (current == MISSING) {
                    return MISSING;
                }
            }
            Matcher index = INDEX.matcher(matcher.group(2));
            while (index.find()) {
                current = element(current, index.group(1));
                if (current == MISSING) {
                    return MISSING;
                }
            }
        }
        return current;
    }

    private static Object step(Object current, String key) {
        if (current instanceof Map<?, ?> map) {
            return map.containsKey(key) ? map.get(key) : MISSING;
        }
        if (current instanceof List<?> && key.chars().allMatch(Character::isDigit)) {
            return element(current, key);
        }
        return MISSING;
    }

    private static Object element(Object current, String digits) {
        if (!(current instanceof List<?> list)) {
            return MISSING;
        }
        int index;
        try {
            index = Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return MISSING;
        }
        return index < list.size() ? list.get(index) : MISSING;
    }

    private String stringify(Object value) {
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            try {
                return objectMapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                return String.valueOf(value);
            }
        }
        return String.valueOf(value);
    }
}
