package io.kneo.iptv.service.guide;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * XMLTV timestamps: {@code yyyyMMddHHmmss} (seconds optional) followed by an optional
 * {@code ±HHMM} offset. No offset means UTC.
 */
public final class XmltvTime {
    private static final DateTimeFormatter LOCAL_FORMAT = DateTimeFormatter.ofPattern("uuuuMMddHHmmss");

    private XmltvTime() {
    }

    public static Instant parse(String value) {
        if (value == null || value.isBlank()) {
            throw new DateTimeException("Empty XMLTV timestamp");
        }
        String trimmed = value.trim();
        int digits = 0;
        while (digits < trimmed.length() && Character.isDigit(trimmed.charAt(digits))) {
            digits++;
        }
        String local;
        if (digits == 14) {
            local = trimmed.substring(0, 14);
        } else if (digits == 12) {
            local = trimmed.substring(0, 12) + "00";
        } else {
            throw new DateTimeException("Unexpected XMLTV timestamp: " + value);
        }
        String offset = trimmed.substring(digits).trim();
        ZoneOffset zone = offset.isEmpty() ? ZoneOffset.UTC : ZoneOffset.of(offset);
        return LocalDateTime.parse(local, LOCAL_FORMAT).toInstant(zone);
    }
}
