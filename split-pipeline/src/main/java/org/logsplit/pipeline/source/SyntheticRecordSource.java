package org.logsplit.pipeline.source;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import org.logsplit.pipeline.ir.LineTerminator;
import org.logsplit.pipeline.ir.RawRecord;

import reactor.core.publisher.Flux;

/**
 * A RecordSource over lines held in memory, for driving the pipeline without an input file.
 */
public class SyntheticRecordSource implements RecordSource {

    private final List<String> lines;

    public SyntheticRecordSource(List<String> lines) {
        this.lines = List.copyOf(lines);
    }

    /**
     * Lines in Python logging's {@code asctime} layout covering {@code days} consecutive days.
     * Days are interleaved: every line belongs to a different day than the line before it
     * (when {@code days > 1}), which makes a bounded handle pool evict as often as possible.
     */
    public static SyntheticRecordSource spanningDays(LocalDate firstDay, int days, int recordsPerDay) {
        List<String> lines = new ArrayList<>(days * recordsPerDay);
        for (int seq = 0; seq < recordsPerDay; seq++) {
            for (int day = 0; day < days; day++) {
                lines.add(asctimeLine(firstDay.plusDays(day), seq));
            }
        }
        return new SyntheticRecordSource(lines);
    }

    public static String asctimeLine(LocalDate day, int seq) {
        return String.format("{\"asctime\": \"%s 12:00:%02d,000\", \"message\": \"record %d of %s\"}",
            day, seq % 60, seq, day);
    }

    @Override
    public Flux<RawRecord> readRecords() {
        return Flux.defer(() -> {
            var lineNumber = new AtomicLong();
            return Flux.fromIterable(lines)
                .map(line -> new RawRecord(lineNumber.incrementAndGet(),
                    line.getBytes(StandardCharsets.UTF_8), LineTerminator.LF));
        });
    }
}
