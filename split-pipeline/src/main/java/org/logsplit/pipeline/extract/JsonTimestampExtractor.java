package org.logsplit.pipeline.extract;

import java.io.IOException;
import java.time.format.DateTimeParseException;

import org.logsplit.pipeline.ir.ExtractionResult;
import org.logsplit.pipeline.ir.RawRecord;
import org.logsplit.pipeline.ir.SkipReason;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Extracts the timestamp from a JSON object record.
 *
 * Three steps, each with its own skip reason:
 * decode the payload as a JSON object ({@link SkipReason#MALFORMED}),
 * find the designated field ({@link SkipReason#MISSING_FIELD}),
 * parse its text as a date-time ({@link SkipReason#UNPARSABLE_TIMESTAMP}).
 */
public class JsonTimestampExtractor implements TimestampExtractor {

    public static final String DEFAULT_FIELD = "asctime";

    private static final ObjectMapper objectMapper = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private final String fieldName;
    private final TimestampFormat format;

    public JsonTimestampExtractor(String fieldName, TimestampFormat format) {
        if (fieldName == null || fieldName.isBlank()) {
            throw new IllegalArgumentException("Timestamp field name cannot be null or empty");
        }
        this.fieldName = fieldName;
        this.format = format;
    }

    /** Extractor for the {@code asctime} field in its default layout. */
    public static JsonTimestampExtractor asctime() {
        return new JsonTimestampExtractor(DEFAULT_FIELD, TimestampFormat.asctime());
    }

    @Override
    public ExtractionResult extract(RawRecord record) {
        JsonNode entry;
        try {
            entry = objectMapper.readTree(record.payload());
        } catch (JsonProcessingException e) {
            return ExtractionResult.skipped(SkipReason.MALFORMED, "Could not parse line: " + e.getOriginalMessage());
        } catch (IOException e) {
            return ExtractionResult.skipped(SkipReason.MALFORMED, "Could not parse line: " + e.getMessage());
        }
        if (entry == null || !entry.isObject()) {
            return ExtractionResult.skipped(SkipReason.MALFORMED, "Line is not a JSON object");
        }

        JsonNode field = entry.get(fieldName);
        if (field == null || field.isNull()) {
            return ExtractionResult.skipped(SkipReason.MISSING_FIELD, "No `" + fieldName + "` field found in line");
        }
        if (!field.isTextual()) {
            return ExtractionResult.skipped(SkipReason.UNPARSABLE_TIMESTAMP,
                "Field `" + fieldName + "` is not a string: " + field);
        }

        String text = field.textValue();
        try {
            return ExtractionResult.success(format.parse(text));
        } catch (DateTimeParseException e) {
            return ExtractionResult.skipped(SkipReason.UNPARSABLE_TIMESTAMP,
                "Could not parse timestamp `" + text + "` with format `" + format + "`");
        }
    }
}
