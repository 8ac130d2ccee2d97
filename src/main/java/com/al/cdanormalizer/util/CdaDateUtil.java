package com.al.cdanormalizer.util;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility class for HL7 v3 timestamp values ({@code TS}) found in clinical documents.
 *
 * <p>
 * Format: YYYY[MM[DD[HH[mm[ss[.S+]]]]]][+/-ZZZZ]
 * Examples:
 * <ul>
 * <li>2023 - year precision, displayed as 2023</li>
 * <li>20230115 - day precision, displayed as 2023-01-15</li>
 * <li>20230115103000+0100 - second precision with offset</li>
 * </ul>
 *
 * @author CDA Normalizer Team
 * @version 1.0.0
 * @since 1.0.0
 */
public final class CdaDateUtil {

    private static final Pattern TS = Pattern.compile(
            "^(\\d{4})(\\d{2})?(\\d{2})?(\\d{2})?(\\d{2})?(\\d{2})?(?:\\.\\d+)?([+-]\\d{4})?$");

    /**
     * Private constructor to prevent instantiation.
     */
    private CdaDateUtil() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    /**
     * Render an HL7 timestamp as ISO-8601 at its own precision.
     *
     * @param hl7Timestamp timestamp as found in the document
     * @return ISO-8601 text, or the input unchanged when it is not a timestamp
     */
    public static String toDisplay(String hl7Timestamp) {
        if (hl7Timestamp == null || hl7Timestamp.isBlank()) {
            return hl7Timestamp;
        }
        String trimmed = hl7Timestamp.trim();
        Matcher m = TS.matcher(trimmed);
        if (!m.matches()) {
            return hl7Timestamp;
        }
        try {
            int year = Integer.parseInt(m.group(1));
            if (m.group(2) == null) {
                return String.format("%04d", year);
            }
            int month = Integer.parseInt(m.group(2));
            if (m.group(3) == null) {
                return YearMonth.of(year, month).toString();
            }
            LocalDate date = LocalDate.of(year, month, Integer.parseInt(m.group(3)));
            if (m.group(4) == null) {
                return date.toString();
            }
            LocalDateTime dateTime = date.atTime(
                    Integer.parseInt(m.group(4)),
                    m.group(5) != null ? Integer.parseInt(m.group(5)) : 0,
                    m.group(6) != null ? Integer.parseInt(m.group(6)) : 0);
            if (m.group(7) == null) {
                return dateTime.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
            }
            ZoneOffset offset = ZoneOffset.of(m.group(7).substring(0, 3) + ":" + m.group(7).substring(3));
            return OffsetDateTime.of(dateTime, offset).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        } catch (DateTimeException e) {
            return hl7Timestamp;
        }
    }
}
