package com.lesson.reconciliation.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lesson.reconciliation.core.model.SheetLesson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads sheet rows from the JSON export of the lesson sheet.
 *
 * <p>Expected format: a JSON array with one object per sheet row.</p>
 * <pre>
 * [
 *   {"studentName": "Alice Smith", "duration": 30, "teacher": "Maria", "startDate": "15/01/2024", "subject": "Piano"},
 *   {"studentName": "Bob", "duration": "45", "teacher": "", "startDate": "", "subject": "Guitar"}
 * ]
 * </pre>
 *
 * <p>Missing text cells become empty strings. Duration may be a number or numeric text;
 * anything else reads as 0. The first element is sheet row 2, as row 1 holds the header.</p>
 */
public class JsonSheetLessonSource implements SheetLessonSource {
    private static final Logger log = LoggerFactory.getLogger(JsonSheetLessonSource.class);
    private static final Pattern LEADING_INT = Pattern.compile("^\\s*(-?\\d+)");
    private static final int FIRST_DATA_ROW = 2;

    private final SheetFeed feed;
    private final ObjectMapper objectMapper;

    public JsonSheetLessonSource(SheetFeed feed) {
        this(feed, new ObjectMapper());
    }

    public JsonSheetLessonSource(SheetFeed feed, ObjectMapper objectMapper) {
        this.feed = feed;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<SheetLesson> fetchSheetLessons(String tenantId) {
        try (InputStream input = feed.open(tenantId)) {
            if (input == null) {
                throw new LessonSourceException("No lesson data received from the sheet for tenant " + tenantId);
            }
            return parse(input);
        } catch (IOException e) {
            log.error("sheet.fetch.failed tenantId={} error={}", tenantId, e.getMessage());
            throw new LessonSourceException("Failed to read sheet lessons: " + e.getMessage(), e);
        }
    }

    /**
     * Parses a JSON array of sheet rows.
     */
    public List<SheetLesson> parse(InputStream input) throws IOException {
        List<SheetRow> rows = objectMapper.readValue(input, new TypeReference<List<SheetRow>>() {
        });
        if (rows == null) {
            throw new LessonSourceException("No lesson data received from the sheet");
        }
        if (rows.isEmpty()) {
            log.warn("sheet.empty");
        }

        List<SheetLesson> lessons = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            SheetRow row = rows.get(i);
            if (row == null) {
                continue;
            }
            int rowNumber = i + FIRST_DATA_ROW;
            SheetLesson lesson = new SheetLesson(row.studentName(), parseDuration(row.duration()),
                    row.teacher(), row.startDate(), row.subject(), rowNumber);

            if (lesson.studentName().isBlank()) {
                log.warn("sheet.row.missing-student row={}", rowNumber);
            }
            if (lesson.subject().isBlank()) {
                log.warn("sheet.row.missing-subject row={} student='{}'", rowNumber, lesson.studentName());
            }
            lessons.add(lesson);
        }
        log.info("sheet.parsed rows={}", lessons.size());
        return lessons;
    }

    static int parseDuration(JsonNode duration) {
        if (duration == null || duration.isNull()) {
            return 0;
        }
        if (duration.isNumber()) {
            if (!duration.canConvertToInt()) {
                log.debug("Duration '{}' out of range", duration.asText());
                return 0;
            }
            if (!duration.isIntegralNumber()) {
                log.debug("Duration '{}' truncated to {} minutes", duration.asText(), duration.intValue());
            }
            return duration.intValue();
        }
        if (duration.isTextual()) {
            Matcher matcher = LEADING_INT.matcher(duration.asText());
            if (matcher.find()) {
                try {
                    return Integer.parseInt(matcher.group(1));
                } catch (NumberFormatException e) {
                    log.debug("Duration '{}' out of range", duration.asText());
                }
            }
        }
        return 0;
    }

    /**
     * Opens the raw JSON export for a tenant.
     */
    @FunctionalInterface
    public interface SheetFeed {
        InputStream open(String tenantId) throws IOException;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record SheetRow(
            String studentName,
            JsonNode duration,
            String teacher,
            String startDate,
            String subject
    ) {
    }
}
