package com.openforge.toolflow.agent;

import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Canned answer used when no model backend is reachable.  The template is
 * chosen by keyword, so the same prompt always yields the same text.
 */
@Component
public class FallbackResponder {

    private static final String PRESSURE = """
            A pressure anomaly has been detected. Carry out the following immediately:
            1. Inspect the pressure sensor
            2. Check the valve state
            3. Inspect the piping for leaks
            4. Run the safety protocol""";

    private static final String TEMPERATURE = """
            A temperature sensor anomaly has been confirmed. Follow this inspection procedure:
            1. Check the sensor cable connection
            2. Check the calibration state
            3. Measure the ambient temperature""";

    private static final String GENERAL = """
            The overall system check is complete. Most parameters are within their normal range, \
            but some parts require scheduled maintenance.""";

    public String respond(String prompt, String modelName) {
        String body = switch (topicOf(prompt)) {
            case "pressure" -> PRESSURE;
            case "temperature" -> TEMPERATURE;
            default -> GENERAL;
        };
        return """
                ## Agent system response (fallback mode)

                %s

                ### Recommended actions:
                - Report to the owner of the affected system immediately
                - Follow the safety protocol
                - Record the actions taken in the system

                ### Additional information:
                - Model: %s (fallback mode)
                """.formatted(body, modelName);
    }

    static String topicOf(String prompt) {
        String text = prompt == null ? "" : prompt.toLowerCase(Locale.ROOT);
        if (text.contains("pressure") || text.contains("압력")) {
            return "pressure";
        }
        if (text.contains("temperature") || text.contains("온도")) {
            return "temperature";
        }
        return "general";
    }
}
