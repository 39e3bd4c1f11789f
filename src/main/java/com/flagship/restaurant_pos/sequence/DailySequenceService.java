package com.flagship.restaurant_pos.sequence;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Allocates {@code PREFIX-YYYYMMDD-NNNN} numbers from {@code daily_sequences}.
 *
 * The increment is a single upsert, so concurrent callers on the same day get
 * distinct consecutive values without a read-then-write race. Allocation
 * commits in its own transaction before the caller's business transaction
 * starts: a number is never handed out twice, and a business transaction that
 * later fails leaves a gap.
 */
@Service
@Slf4j
public class DailySequenceService {

    private static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;

    private static final String NEXT_VALUE_SQL =
            "INSERT INTO daily_sequences (prefix, sequence_day, last_value) VALUES (?, ?, 1) " +
            "ON CONFLICT (prefix, sequence_day) DO UPDATE SET last_value = daily_sequences.last_value + 1 " +
            "RETURNING last_value";

    private final JdbcTemplate jdbcTemplate;
    private final ZoneId zone;

    public DailySequenceService(JdbcTemplate jdbcTemplate, ZoneId businessZone) {
        this.jdbcTemplate = jdbcTemplate;
        this.zone = businessZone;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public String next(DocumentNumber document) {
        LocalDate day = LocalDate.now(zone);
        Long value = jdbcTemplate.queryForObject(NEXT_VALUE_SQL, Long.class, document.prefix(), day);
        if (value == null) {
            throw new IllegalStateException("Sequence upsert returned no value for " + document);
        }
        String number = format(document, day, value);
        log.debug("Allocated {}", number);
        return number;
    }

    static String format(DocumentNumber document, LocalDate day, long value) {
        return String.format("%s-%s-%04d", document.prefix(), DAY_FORMAT.format(day), value);
    }
}
