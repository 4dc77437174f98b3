package io.github.yok.flexetl.util;

import com.google.common.collect.ImmutableMap;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.Generated;

/**
 * Shared date/time parsers and pattern helpers.
 *
 * <p>
 * The lenient parsers accept the common spellings found in CSV files and are used by type
 * conversion and codec type inference. {@link #strictFormatter(String)} builds the strict parser
 * used by date validation; it accepts both {@code java.time} patterns ({@code yyyy-MM-dd}) and
 * strftime patterns ({@code %Y-%m-%d}).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class DateTimeFormats {

    /**
     * Date-only formatters tried in order.
     * <ol>
     * <li>{@code yyyy-MM-dd} (ISO)</li>
     * <li>{@code yyyy/MM/dd}</li>
     * <li>{@code yyyyMMdd} (basic ISO)</li>
     * <li>{@code yyyy.MM.dd}</li>
     * </ol>
     */
    public static final DateTimeFormatter[] DATE_ONLY_FORMATTERS =
            {DateTimeFormatter.ISO_LOCAL_DATE, DateTimeFormatter.ofPattern("yyyy/MM/dd"),
                    DateTimeFormatter.BASIC_ISO_DATE, DateTimeFormatter.ofPattern("yyyy.MM.dd")};

    /**
     * Date-time parser accepting {@code yyyy-MM-dd HH:mm}, {@code yyyy-MM-ddTHH:mm}, optional
     * seconds and optional fractional seconds.
     */
    public static final DateTimeFormatter FLEXIBLE_DATE_TIME_PARSER =
            new DateTimeFormatterBuilder().append(DateTimeFormatter.ISO_LOCAL_DATE)
                    .optionalStart().appendLiteral('T').optionalEnd().optionalStart()
                    .appendLiteral(' ').optionalEnd().appendPattern("HH:mm").optionalStart()
                    .appendPattern(":ss").optionalEnd().optionalStart()
                    .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true).optionalEnd()
                    .toFormatter();

    // strftime directive → java.time pattern letters
    private static final Map<Character, String> STRFTIME = ImmutableMap.<Character, String>builder()
            .put('Y', "uuuu").put('y', "uu").put('m', "MM").put('d', "dd").put('H', "HH")
            .put('I', "hh").put('M', "mm").put('S', "ss").put('f', "SSSSSS").put('p', "a")
            .put('b', "MMM").put('B', "MMMM").put('a', "EEE").put('A', "EEEE").put('j', "DDD")
            .build();

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private DateTimeFormats() {}

    /**
     * Parses a date with the lenient date-only formatters, falling back to a date-time whose date
     * part is returned.
     *
     * @param text text to parse
     * @return the date, or empty when no formatter matches
     */
    public static Optional<LocalDate> parseDate(String text) {
        String trimmed = text.trim();
        for (DateTimeFormatter formatter : DATE_ONLY_FORMATTERS) {
            Optional<LocalDate> date = tryParseDate(trimmed, formatter);
            if (date.isPresent()) {
                return date;
            }
        }
        return parseDateTimeOnly(trimmed).map(LocalDateTime::toLocalDate);
    }

    /**
     * Parses a date-time with {@link #FLEXIBLE_DATE_TIME_PARSER}, falling back to a date at start
     * of day.
     *
     * @param text text to parse
     * @return the date-time, or empty when nothing matches
     */
    public static Optional<LocalDateTime> parseDateTime(String text) {
        String trimmed = text.trim();
        Optional<LocalDateTime> dateTime = parseDateTimeOnly(trimmed);
        if (dateTime.isPresent()) {
            return dateTime;
        }
        for (DateTimeFormatter formatter : DATE_ONLY_FORMATTERS) {
            Optional<LocalDate> date = tryParseDate(trimmed, formatter);
            if (date.isPresent()) {
                return date.map(LocalDate::atStartOfDay);
            }
        }
        return Optional.empty();
    }

    private static Optional<LocalDate> tryParseDate(String text, DateTimeFormatter formatter) {
        try {
            return Optional.of(LocalDate.parse(text, formatter));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static Optional<LocalDateTime> parseDateTimeOnly(String text) {
        try {
            return Optional.of(LocalDateTime.parse(text, FLEXIBLE_DATE_TIME_PARSER));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Converts a strftime pattern such as {@code %Y-%m-%d} to a {@code java.time} pattern.
     * Patterns without {@code %} are returned unchanged. Literal text is quoted.
     *
     * @param pattern strftime or {@code java.time} pattern
     * @return {@code java.time} pattern
     * @throws IllegalArgumentException on an unsupported strftime directive
     */
    public static String toJavaPattern(String pattern) {
        if (pattern.indexOf('%') < 0) {
            return pattern;
        }
        StringBuilder out = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c == '%' && i + 1 < pattern.length() && pattern.charAt(i + 1) == '%') {
                literal.append('%');
                i++;
            } else if (c == '%' && i + 1 < pattern.length()) {
                String mapped = STRFTIME.get(pattern.charAt(++i));
                if (mapped == null) {
                    throw new IllegalArgumentException(
                            "Unsupported strftime directive %" + pattern.charAt(i));
                }
                flushLiteral(out, literal);
                out.append(mapped);
            } else {
                literal.append(c);
            }
        }
        flushLiteral(out, literal);
        return out.toString();
    }

    private static void flushLiteral(StringBuilder out, StringBuilder literal) {
        if (literal.length() == 0) {
            return;
        }
        out.append('\'').append(literal.toString().replace("'", "''")).append('\'');
        literal.setLength(0);
    }

    /**
     * Builds a strict formatter: every field must be valid (no February 30th) and the whole text
     * must be consumed.
     *
     * <p>
     * Year-of-era letters ({@code y}) are rewritten to proleptic-year letters ({@code u}) because
     * the strict resolver cannot resolve a year of era without an era.
     * </p>
     *
     * @param pattern strftime or {@code java.time} pattern
     * @return strict formatter
     * @throws IllegalArgumentException if the pattern is invalid
     */
    public static DateTimeFormatter strictFormatter(String pattern) {
        String javaPattern = replaceYearOfEra(toJavaPattern(pattern));
        return DateTimeFormatter.ofPattern(javaPattern, Locale.ROOT)
                .withResolverStyle(ResolverStyle.STRICT);
    }

    private static String replaceYearOfEra(String pattern) {
        StringBuilder out = new StringBuilder(pattern.length());
        boolean quoted = false;
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c == '\'') {
                quoted = !quoted;
            }
            out.append(!quoted && c == 'y' ? 'u' : c);
        }
        return out.toString();
    }
}
