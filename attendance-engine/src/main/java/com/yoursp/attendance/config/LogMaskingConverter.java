package com.yoursp.attendance.config;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

import java.util.regex.Pattern;

/**
 * Logback converter that masks sensitive data in log messages.
 * <ul>
 * <li>Inline image data ({@code data:image/...;base64,...}): "[IMAGE]"</li>
 * <li>Bearer tokens: first 8 chars + "..."</li>
 * <li>Coordinates with more than 2 decimals: truncated to ~1 km precision</li>
 * </ul>
 * <p>
 * Register in logback-spring.xml:
 * {@code <conversionRule conversionWord="mask" converterClass=
 * "com.yoursp.attendance.config.LogMaskingConverter" />}
 * </p>
 */
public class LogMaskingConverter extends CompositeConverter<ILoggingEvent> {

    // Matches data URIs produced by camera capture
    private static final Pattern DATA_URI_PATTERN = Pattern
            .compile("data:image/[a-zA-Z+.-]+;base64,[A-Za-z0-9+/=]+");

    // Matches Bearer tokens: "Bearer <token>"
    private static final Pattern BEARER_PATTERN = Pattern
            .compile("(Bearer\\s+)([A-Za-z0-9_\\-./+=]{8})[A-Za-z0-9_\\-./+=]+");

    // Matches lat/lng style keys followed by a high-precision decimal
    private static final Pattern COORDINATE_PATTERN = Pattern
            .compile("((?:lat|lng|latitude|longitude)[\"=:]+\\s*)(-?\\d{1,3}\\.\\d{2})\\d+",
                    Pattern.CASE_INSENSITIVE);

    @Override
    protected String transform(ILoggingEvent event, String formattedMessage) {
        if (formattedMessage == null || formattedMessage.isEmpty()) {
            return formattedMessage;
        }

        String masked = formattedMessage;
        masked = DATA_URI_PATTERN.matcher(masked).replaceAll("[IMAGE]");
        masked = BEARER_PATTERN.matcher(masked).replaceAll("$1$2...");
        masked = COORDINATE_PATTERN.matcher(masked).replaceAll("$1$2**");

        return masked;
    }
}
