/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.cubejs.client;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.collect.ImmutableList;

import javax.annotation.concurrent.Immutable;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.cubejs.client.ValidationException.checkField;
import static com.cubejs.client.ValidationException.checkNotBlank;
import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.regex.Pattern.CASE_INSENSITIVE;

/**
 * Date range of a time dimension: either a relative phrase understood by the server
 * ({@code "last 7 days"}), a single date, or an inclusive {@code [start, end]} pair.
 * <p>
 * Absolute values use {@code YYYY-MM-DD} or {@code YYYY-MM-DDTHH:mm:ss[.SSS]}, in the
 * query time zone. Date-only bounds cover the whole day, so {@code start} is padded to
 * the start of its day and {@code end} to the end of its day when ordering is checked.
 */
@Immutable
public final class DateRange
{
    private static final Pattern DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
    private static final Pattern DATE_TIME = Pattern.compile("\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}(\\.\\d{1,3})?");

    private static final String UNIT = "(minute|hour|day|week|month|quarter|year)s?";
    private static final List<Pattern> RELATIVE_PHRASES = ImmutableList.of(
            Pattern.compile("today|yesterday|tomorrow", CASE_INSENSITIVE),
            Pattern.compile("(this|last|next)\\s+(week|month|quarter|year)", CASE_INSENSITIVE),
            Pattern.compile("(last|next)\\s+(?<count>\\d+)\\s+" + UNIT, CASE_INSENSITIVE),
            Pattern.compile("from\\s+(?<count>\\d+)\\s+" + UNIT + "\\s+ago\\s+to\\s+now", CASE_INSENSITIVE),
            Pattern.compile("from\\s+now\\s+to\\s+(?<count>\\d+)\\s+" + UNIT + "\\s+from\\s+now", CASE_INSENSITIVE));

    // relative phrase or single date, exactly as supplied
    private final Optional<String> expression;
    private final List<String> bounds;

    private DateRange(Optional<String> expression, List<String> bounds)
    {
        this.expression = expression;
        this.bounds = ImmutableList.copyOf(bounds);
    }

    /**
     * Parses a relative phrase or a single absolute date.
     */
    public static DateRange parse(String value)
    {
        checkNotBlank(value, "dateRange");
        String trimmed = value.trim();
        if (isAbsolute(trimmed)) {
            parseBound(trimmed, false);
            return new DateRange(Optional.of(trimmed), ImmutableList.of());
        }
        checkField(isRecognizedRelativePhrase(trimmed), "dateRange", "unrecognized relative date range: " + value);
        return new DateRange(Optional.of(trimmed), ImmutableList.of());
    }

    public static DateRange between(String start, String end)
    {
        checkNotBlank(start, "dateRange.start");
        checkNotBlank(end, "dateRange.end");
        LocalDateTime startTime = parseBound(start.trim(), false);
        LocalDateTime endTime = parseBound(end.trim(), true);
        checkField(!startTime.isAfter(endTime), "dateRange", "start " + start + " is after end " + end);
        return new DateRange(Optional.empty(), ImmutableList.of(start.trim(), end.trim()));
    }

    public static DateRange between(LocalDate start, LocalDate end)
    {
        return between(start.toString(), end.toString());
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static DateRange fromJson(Object value)
    {
        if (value instanceof String) {
            return parse((String) value);
        }
        if (value instanceof List) {
            List<?> list = (List<?>) value;
            checkField(list.size() == 2, "dateRange", "must contain exactly two dates, found " + list.size());
            checkField(list.get(0) instanceof String && list.get(1) instanceof String, "dateRange", "dates must be strings");
            return between((String) list.get(0), (String) list.get(1));
        }
        throw new ValidationException("dateRange", "must be a string or a pair of dates");
    }

    @JsonValue
    public Object toJson()
    {
        if (expression.isPresent()) {
            return expression.get();
        }
        return bounds;
    }

    public boolean isRelative()
    {
        return expression.isPresent() && !isAbsolute(expression.get());
    }

    public Optional<String> getExpression()
    {
        return expression;
    }

    /**
     * Start and end of an explicit pair, empty for phrases and single dates.
     */
    public List<String> getBounds()
    {
        return bounds;
    }

    private static boolean isAbsolute(String value)
    {
        return DATE.matcher(value).matches() || DATE_TIME.matcher(value).matches();
    }

    private static boolean isRecognizedRelativePhrase(String value)
    {
        for (Pattern pattern : RELATIVE_PHRASES) {
            Matcher matcher = pattern.matcher(value);
            if (matcher.matches()) {
                if (pattern.pattern().contains("?<count>")) {
                    return isPositive(matcher.group("count"));
                }
                return true;
            }
        }
        return false;
    }

    private static boolean isPositive(String count)
    {
        try {
            return Integer.parseInt(count) > 0;
        }
        catch (NumberFormatException e) {
            return false;
        }
    }

    private static LocalDateTime parseBound(String value, boolean endOfDay)
    {
        try {
            if (DATE.matcher(value).matches()) {
                LocalDate date = LocalDate.parse(value);
                return endOfDay ? date.atTime(LocalTime.MAX) : date.atStartOfDay();
            }
            if (DATE_TIME.matcher(value).matches()) {
                return LocalDateTime.parse(value);
            }
        }
        catch (DateTimeParseException e) {
            throw new ValidationException("dateRange", "invalid date: " + value);
        }
        throw new ValidationException("dateRange", "dates must use YYYY-MM-DD or YYYY-MM-DDTHH:mm:ss[.SSS]: " + value);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DateRange that = (DateRange) o;
        return expression.equals(that.expression) && bounds.equals(that.bounds);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(expression, bounds);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("expression", expression.orElse(null))
                .add("bounds", bounds.isEmpty() ? null : bounds)
                .omitNullValues()
                .toString();
    }
}
