package org.logsplit.pipeline.extract;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.stream.Stream;

import org.logsplit.pipeline.ir.ExtractionResult;
import org.logsplit.pipeline.ir.LineTerminator;
import org.logsplit.pipeline.ir.RawRecord;
import org.logsplit.pipeline.ir.SkipReason;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import static org.junit.jupiter.api.Assertions.*;

class JsonTimestampExtractorTest {

    private final JsonTimestampExtractor extractor = JsonTimestampExtractor.asctime();

    private static RawRecord record(String line) {
        return new RawRecord(1, line.getBytes(StandardCharsets.UTF_8), LineTerminator.LF);
    }

    @Test
    void parsesAsctimeField() {
        ExtractionResult result = extractor.extract(record("{\"asctime\": \"2021-03-01 00:00:00,000\", \"message\": \"test\"}"));

        assertTrue(result.isSuccess());
        assertEquals(LocalDateTime.of(2021, 3, 1, 0, 0), result.timestamp().localDateTime());
        assertNull(result.timestamp().offset());
        assertNull(result.skipReason());
    }

    @Test
    void keepsFractionOfSecond() {
        ExtractionResult result = extractor.extract(record("{\"asctime\": \"2021-03-01 23:59:59,123456\"}"));

        assertEquals(LocalDateTime.of(2021, 3, 1, 23, 59, 59, 123_456_000), result.timestamp().localDateTime());
    }

    @Test
    void acceptsAsctimeWithoutFraction() {
        ExtractionResult result = extractor.extract(record("{\"asctime\": \"2021-03-01 10:11:12\"}"));

        assertTrue(result.isSuccess());
        assertEquals(LocalDate.of(2021, 3, 1), result.timestamp().date());
    }

    static Stream<Arguments> skippedLines() {
        return Stream.of(
            Arguments.of("not json at all", SkipReason.MALFORMED),
            Arguments.of("{\"asctime\": \"2021-03-01 00:00:00,000\"", SkipReason.MALFORMED),
            Arguments.of("{\"asctime\": \"2021-03-01 00:00:00,000\"} trailing", SkipReason.MALFORMED),
            Arguments.of("[\"2021-03-01 00:00:00,000\"]", SkipReason.MALFORMED),
            Arguments.of("\"2021-03-01 00:00:00,000\"", SkipReason.MALFORMED),
            Arguments.of("", SkipReason.MALFORMED),
            Arguments.of("{\"message\": \"no timestamp here\"}", SkipReason.MISSING_FIELD),
            Arguments.of("{\"asctime\": null}", SkipReason.MISSING_FIELD),
            Arguments.of("{\"nested\": {\"asctime\": \"2021-03-01 00:00:00,000\"}}", SkipReason.MISSING_FIELD),
            Arguments.of("{\"asctime\": \"yesterday\"}", SkipReason.UNPARSABLE_TIMESTAMP),
            Arguments.of("{\"asctime\": \"2021-13-01 00:00:00,000\"}", SkipReason.UNPARSABLE_TIMESTAMP),
            Arguments.of("{\"asctime\": \"2021-03-01T00:00:00\"}", SkipReason.UNPARSABLE_TIMESTAMP),
            Arguments.of("{\"asctime\": 1614556800}", SkipReason.UNPARSABLE_TIMESTAMP),
            Arguments.of("{\"asctime\": \"2021-02-30 10:00:00,000\"}", SkipReason.UNPARSABLE_TIMESTAMP),
            Arguments.of("{\"asctime\": \"2021-04-31 10:00:00,000\"}", SkipReason.UNPARSABLE_TIMESTAMP),
            Arguments.of("{\"asctime\": \"2021-02-29 10:00:00,000\"}", SkipReason.UNPARSABLE_TIMESTAMP),
            Arguments.of("{\"asctime\": \"2021-03-01 24:00:00,000\"}", SkipReason.UNPARSABLE_TIMESTAMP)
        );
    }

    @ParameterizedTest(name = "{1}: {0}")
    @MethodSource("skippedLines")
    void classifiesSkippedLines(String line, SkipReason expected) {
        ExtractionResult result = extractor.extract(record(line));

        assertFalse(result.isSuccess());
        assertEquals(expected, result.skipReason());
        assertNotNull(result.detail());
    }

    @Test
    void customFieldAndPattern() {
        var custom = new JsonTimestampExtractor("ts", TimestampFormat.of("dd/MM/yyyy HH:mm"));

        ExtractionResult result = custom.extract(record("{\"ts\": \"31/12/2019 23:59\"}"));

        assertEquals(LocalDate.of(2019, 12, 31), result.timestamp().date());
    }

    @Test
    void leapDayIsAcceptedInALeapYear() {
        ExtractionResult result = extractor.extract(record("{\"asctime\": \"2020-02-29 10:00:00,000\"}"));

        assertEquals(LocalDate.of(2020, 2, 29), result.timestamp().date());
    }

    @Test
    void customPatternRejectsImpossibleDates() {
        var custom = new JsonTimestampExtractor("ts", TimestampFormat.of("dd/MM/yyyy HH:mm"));

        ExtractionResult result = custom.extract(record("{\"ts\": \"31/06/2019 10:00\"}"));

        assertEquals(SkipReason.UNPARSABLE_TIMESTAMP, result.skipReason());
    }

    @Test
    void yearLettersOutsideQuotesBecomeProlepticYear() {
        assertEquals("uuuu-MM-dd", TimestampFormat.withProlepticYear("yyyy-MM-dd"));
        assertEquals("'day' dd 'of year' uu", TimestampFormat.withProlepticYear("'day' dd 'of year' yy"));
        assertEquals("uuuu-MM-dd'T'HH 'o''clock'", TimestampFormat.withProlepticYear("yyyy-MM-dd'T'HH 'o''clock'"));
    }

    @Test
    void dateOnlyPattern() {
        var custom = new JsonTimestampExtractor("day", TimestampFormat.of("yyyy-MM-dd"));

        ExtractionResult result = custom.extract(record("{\"day\": \"2020-02-29\"}"));

        assertEquals(LocalDateTime.of(2020, 2, 29, 0, 0), result.timestamp().localDateTime());
    }

    @Test
    void isoTimestampKeepsTheDateAsWrittenRatherThanUtc() {
        var iso = new JsonTimestampExtractor("time", TimestampFormat.of("ISO"));

        ExtractionResult result = iso.extract(record("{\"time\": \"2020-01-01T23:30:00-05:00\"}"));

        // 04:30 UTC on the 2nd, but the log line says the 1st
        assertEquals(LocalDate.of(2020, 1, 1), result.timestamp().date());
        assertEquals(ZoneOffset.ofHours(-5), result.timestamp().offset());
    }

    @Test
    void isoAcceptsLocalDateTimes() {
        var iso = new JsonTimestampExtractor("time", TimestampFormat.of("iso"));

        ExtractionResult result = iso.extract(record("{\"time\": \"2020-01-01T08:00:00.5\"}"));

        assertTrue(result.isSuccess());
        assertNull(result.timestamp().offset());
    }

    @Test
    void rejectsBlankFieldName() {
        assertThrows(IllegalArgumentException.class, () -> new JsonTimestampExtractor(" ", TimestampFormat.asctime()));
    }

    @Test
    void rejectsInvalidPattern() {
        assertThrows(IllegalArgumentException.class, () -> TimestampFormat.of("yyyy-MM-dd {{"));
        assertThrows(IllegalArgumentException.class, () -> TimestampFormat.of(""));
    }
}
