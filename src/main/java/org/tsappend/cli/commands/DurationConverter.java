package org.tsappend.cli.commands;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.TypeConversionException;

/**
 * Parses retention durations: ISO-8601 ({@code P30D}, {@code PT6H}) or a number with a unit
 * suffix ({@code 500ms}, {@code 90s}, {@code 15m}, {@code 36h}, {@code 30d}, {@code 2w}).
 */
public class DurationConverter implements ITypeConverter<Duration> {

    private static final Pattern SHORT_FORM = Pattern.compile("(-?\\d+)\\s*(ns|us|ms|s|m|h|d|w)");

    @Override
    public Duration convert(String value) {
        String trimmed = value.trim();
        if (trimmed.toUpperCase(Locale.ROOT).startsWith("P") || trimmed.toUpperCase(Locale.ROOT).startsWith("-P")) {
            try {
                return Duration.parse(trimmed);
            } catch (DateTimeParseException e) {
                throw new TypeConversionException("Invalid ISO-8601 duration: " + value);
            }
        }
        Matcher matcher = SHORT_FORM.matcher(trimmed.toLowerCase(Locale.ROOT));
        if (!matcher.matches()) {
            throw new TypeConversionException("Invalid duration '" + value
                    + "' (expected ISO-8601 such as P2D or a number with ns/us/ms/s/m/h/d/w)");
        }
        long amount = Long.parseLong(matcher.group(1));
        return switch (matcher.group(2)) {
            case "ns" -> Duration.ofNanos(amount);
            case "us" -> Duration.ofNanos(Math.multiplyExact(amount, 1000L));
            case "ms" -> Duration.ofMillis(amount);
            case "s" -> Duration.ofSeconds(amount);
            case "m" -> Duration.ofMinutes(amount);
            case "h" -> Duration.ofHours(amount);
            case "d" -> Duration.ofDays(amount);
            case "w" -> Duration.ofDays(Math.multiplyExact(amount, 7L));
            default -> throw new TypeConversionException("Unknown duration unit in '" + value + "'");
        };
    }
}
