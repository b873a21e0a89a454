package com.lesson.reconciliation.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Canonicalizes free-text lesson fields from both sources into comparable keys.
 * Normalized values are for comparison only, never for display.
 */
public class LessonNormalizer {
    private static final Logger log = LoggerFactory.getLogger(LessonNormalizer.class);

    private static final Pattern NON_NAME_CHARS = Pattern.compile("[^\\p{L}\\p{N}\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern SLASH_DATE = Pattern.compile("^\\d{1,2}/\\d{1,2}/\\d{4}$");

    private static final DateTimeFormatter ISO = DateTimeFormatter.ofPattern("uuuu-MM-dd")
            .withResolverStyle(ResolverStyle.STRICT);

    // Day-first wins when both readings are valid.
    private static final List<DateTimeFormatter> SLASH_FORMATS = List.of(
            DateTimeFormatter.ofPattern("d/M/uuuu").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("M/d/uuuu").withResolverStyle(ResolverStyle.STRICT)
    );

    /**
     * Lowercases, drops everything but letters, digits and whitespace, collapses
     * whitespace and trims. Applying it twice gives the same result as applying it once.
     */
    public String normalizeName(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String result = text.toLowerCase(Locale.ROOT);
        result = NON_NAME_CHARS.matcher(result).replaceAll("");
        result = WHITESPACE.matcher(result).replaceAll(" ");
        return result.trim();
    }

    /**
     * Normalizes a date to {@code YYYY-MM-DD}.
     *
     * @return the ISO date, null for a blank input, or the trimmed input when it cannot be parsed
     */
    public String normalizeDate(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String trimmed = text.trim();
        Optional<LocalDate> parsed = parse(trimmed);
        if (parsed.isPresent()) {
            return parsed.get().format(ISO);
        }
        log.debug("date.unparseable value='{}'", trimmed);
        return trimmed;
    }

    /**
     * Parses a date using the same formats as {@link #normalizeDate}.
     */
    public Optional<LocalDate> parseDate(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        return parse(text.trim());
    }

    private Optional<LocalDate> parse(String trimmed) {
        if (ISO_DATE.matcher(trimmed).matches()) {
            return tryParse(trimmed, ISO);
        }
        if (SLASH_DATE.matcher(trimmed).matches()) {
            for (DateTimeFormatter format : SLASH_FORMATS) {
                Optional<LocalDate> date = tryParse(trimmed, format);
                if (date.isPresent()) {
                    return date;
                }
            }
        }
        return Optional.empty();
    }

    private Optional<LocalDate> tryParse(String text, DateTimeFormatter format) {
        try {
            return Optional.of(LocalDate.parse(text, format));
        } catch (DateTimeParseException e) {
            log.debug("Date '{}' does not fit {}: {}", text, format, e.getMessage());
            return Optional.empty();
        }
    }
}
