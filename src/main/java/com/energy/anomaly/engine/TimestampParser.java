package com.energy.anomaly.engine;

import com.energy.anomaly.config.DetectionProperties;
import com.energy.anomaly.exception.ConfigException;
import com.energy.anomaly.exception.DataException;
import com.energy.anomaly.model.ColumnType;
import com.energy.anomaly.model.Dataset;
import com.energy.anomaly.model.DatasetColumn;
import com.energy.anomaly.model.DetectionConfig;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.Optional;

/**
 * Turns loader-provided timestamp cells into {@link Instant}s.
 *
 * Accepted: Instant, OffsetDateTime, ZonedDateTime, LocalDateTime / LocalDate (read in the
 * configured zone), java.util.Date, epoch milliseconds, and strings in ISO-8601 or
 * {@code yyyy-MM-dd HH:mm[:ss]} form.
 */
@Component
public class TimestampParser {

    private static final DateTimeFormatter FLEXIBLE_FORMAT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendPattern("['T'][ ]")
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter();

    private final ZoneId zone;

    public TimestampParser(DetectionProperties properties) {
        this.zone = ZoneId.of(properties.getTimeZone());
    }

    public ZoneId getZone() {
        return zone;
    }

    /**
     * The timestamp column a run uses: the configured one, else the first TIMESTAMP column.
     */
    public Optional<String> resolveColumn(Dataset dataset, DetectionConfig config) {
        String named = config.getTimestampColumn();
        if (named != null && !named.isBlank()) {
            DatasetColumn column = dataset.findColumn(named)
                    .orElseThrow(() -> new ConfigException("Timestamp column not found: " + named));
            if (column.getType() == ColumnType.NUMERIC) {
                throw new ConfigException("Timestamp column '" + named + "' is numeric, not a timestamp");
            }
            return Optional.of(named);
        }
        return dataset.columnNames(ColumnType.TIMESTAMP).stream().findFirst();
    }

    /**
     * Parses every cell of the column so a bad value fails the run whatever its score.
     *
     * @return one instant per row, null where the cell is absent
     */
    public Instant[] parseColumn(Dataset dataset, String column) {
        Instant[] parsed = new Instant[dataset.rowCount()];
        for (int i = 0; i < parsed.length; i++) {
            parsed[i] = parse(dataset.value(i, column), i);
        }
        return parsed;
    }

    /**
     * @return the parsed instant, or null for an absent cell
     * @throws DataException when the cell cannot be read as a timestamp
     */
    public Instant parse(Object raw, int row) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Instant instant) {
            return instant;
        }
        if (raw instanceof OffsetDateTime odt) {
            return odt.toInstant();
        }
        if (raw instanceof ZonedDateTime zdt) {
            return zdt.toInstant();
        }
        if (raw instanceof LocalDateTime ldt) {
            return ldt.atZone(zone).toInstant();
        }
        if (raw instanceof LocalDate date) {
            return date.atStartOfDay(zone).toInstant();
        }
        if (raw instanceof Date date) {
            return date.toInstant();
        }
        if (raw instanceof Number epochMillis) {
            return Instant.ofEpochMilli(epochMillis.longValue());
        }
        String text = raw.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        return parseText(text, row);
    }

    private Instant parseText(String text, int row) {
        TemporalAccessor parsed;
        try {
            parsed = FLEXIBLE_FORMAT.parseBest(text, OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
        } catch (DateTimeParseException e) {
            throw new DataException("Unparseable timestamp '" + text + "' at row " + row, e);
        }
        if (parsed instanceof OffsetDateTime odt) {
            return odt.toInstant();
        }
        if (parsed instanceof LocalDateTime ldt) {
            return ldt.atZone(zone).toInstant();
        }
        return ((LocalDate) parsed).atStartOfDay(zone).toInstant();
    }
}
