package org.logsplit.pipeline.extract;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;

import org.logsplit.pipeline.ir.ParsedTimestamp;

/**
 * Parses timestamp strings into {@link ParsedTimestamp}s.
 *
 * Patterns may describe a date only, a local date-time, or a date-time with an offset;
 * the most precise form the text supports is used.
 *
 * Parsing is strict: a date that does not exist (February 30th) or an hour of 24 is rejected
 * rather than rolled over into a neighbouring day. Since strict resolution needs a proleptic
 * year, {@code y} in a pattern is read as {@code u}.
 */
public final class TimestampFormat {

    /** Python logging's default {@code asctime} layout, e.g. {@code 2021-03-01 00:00:00,000}. */
    public static final String ASCTIME_PATTERN = "yyyy-MM-dd HH:mm:ss,SSS";

    /** Keyword selecting ISO-8601 parsing with an optional offset. */
    public static final String ISO_KEYWORD = "ISO";

    private final String pattern;
    private final DateTimeFormatter formatter;

    private TimestampFormat(String pattern, DateTimeFormatter formatter) {
        this.pattern = pattern;
        this.formatter = formatter;
    }

    public static TimestampFormat asctime() {
        return of(ASCTIME_PATTERN);
    }

    /**
     * @param pattern a {@link DateTimeFormatter} pattern, or {@code ISO}
     * @throws IllegalArgumentException if the pattern is invalid
     */
    public static TimestampFormat of(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("Timestamp format cannot be null or empty");
        }
        if (ISO_KEYWORD.equalsIgnoreCase(pattern)) {
            return new TimestampFormat(ISO_KEYWORD, DateTimeFormatter.ISO_DATE_TIME);
        }
        if (ASCTIME_PATTERN.equals(pattern)) {
            return new TimestampFormat(pattern, asctimeFormatter());
        }
        return new TimestampFormat(pattern,
            DateTimeFormatter.ofPattern(withProlepticYear(pattern)).withResolverStyle(ResolverStyle.STRICT));
    }

    // y is year-of-era, which STRICT cannot resolve without an era field; quoted literals are left alone
    static String withProlepticYear(String pattern) {
        StringBuilder converted = new StringBuilder(pattern.length());
        boolean quoted = false;
        for (char c : pattern.toCharArray()) {
            if (c == '\'') {
                quoted = !quoted;
            }
            converted.append(!quoted && c == 'y' ? 'u' : c);
        }
        return converted.toString();
    }

    // Accepts any number of fraction digits, like the ",%f" of the log writers that produce asctime
    private static DateTimeFormatter asctimeFormatter() {
        return new DateTimeFormatterBuilder()
            .appendPattern("uuuu-MM-dd HH:mm:ss")
            .optionalStart()
            .appendLiteral(',')
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, false)
            .optionalEnd()
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT);
    }

    /**
     * @throws DateTimeParseException if the text does not match the pattern
     */
    public ParsedTimestamp parse(String text) {
        TemporalAccessor parsed = formatter.parseBest(text, OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
        if (parsed instanceof OffsetDateTime offsetDateTime) {
            return new ParsedTimestamp(offsetDateTime.toLocalDateTime(), offsetDateTime.getOffset());
        }
        if (parsed instanceof LocalDateTime localDateTime) {
            return ParsedTimestamp.of(localDateTime);
        }
        return ParsedTimestamp.of(((LocalDate) parsed).atStartOfDay());
    }

    @Override
    public String toString() {
        return pattern;
    }
}
