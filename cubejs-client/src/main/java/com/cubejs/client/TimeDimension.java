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
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import java.util.List;
import java.util.Objects;

import static com.cubejs.client.ValidationException.checkField;
import static com.cubejs.client.ValidationException.checkNotBlank;
import static com.google.common.base.MoreObjects.toStringHelper;

/**
 * Filters and optionally groups by a time dimension. Without a granularity the server
 * only filters; {@code compareDateRange} asks for one result set per range and cannot
 * be combined with {@code dateRange}.
 */
@Immutable
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TimeDimension
{
    private final String dimension;
    private final DateRange dateRange;
    private final List<DateRange> compareDateRange;
    private final Granularity granularity;

    @JsonCreator
    public TimeDimension(
            @JsonProperty("dimension") String dimension,
            @JsonProperty("dateRange") @Nullable DateRange dateRange,
            @JsonProperty("compareDateRange") @Nullable List<DateRange> compareDateRange,
            @JsonProperty("granularity") @Nullable Granularity granularity)
    {
        this.dimension = checkNotBlank(dimension, "timeDimensions.dimension");
        checkField(dateRange == null || compareDateRange == null, "timeDimensions.compareDateRange", "cannot be combined with dateRange");
        if (compareDateRange != null) {
            checkField(!compareDateRange.isEmpty(), "timeDimensions.compareDateRange", "must contain at least one date range");
            checkField(compareDateRange.stream().allMatch(Objects::nonNull), "timeDimensions.compareDateRange", "must not contain null date ranges");
        }
        this.dateRange = dateRange;
        this.compareDateRange = compareDateRange == null ? null : ImmutableList.copyOf(compareDateRange);
        this.granularity = granularity;
    }

    public static TimeDimension of(String dimension, Granularity granularity)
    {
        return new TimeDimension(dimension, null, null, granularity);
    }

    public static TimeDimension of(String dimension, DateRange dateRange, @Nullable Granularity granularity)
    {
        return new TimeDimension(dimension, dateRange, null, granularity);
    }

    public static TimeDimension compare(String dimension, List<DateRange> compareDateRange, @Nullable Granularity granularity)
    {
        return new TimeDimension(dimension, null, compareDateRange, granularity);
    }

    @JsonProperty
    public String getDimension()
    {
        return dimension;
    }

    @Nullable
    @JsonProperty
    public DateRange getDateRange()
    {
        return dateRange;
    }

    @Nullable
    @JsonProperty
    public List<DateRange> getCompareDateRange()
    {
        return compareDateRange;
    }

    @Nullable
    @JsonProperty
    public Granularity getGranularity()
    {
        return granularity;
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
        TimeDimension that = (TimeDimension) o;
        return dimension.equals(that.dimension) &&
                Objects.equals(dateRange, that.dateRange) &&
                Objects.equals(compareDateRange, that.compareDateRange) &&
                granularity == that.granularity;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(dimension, dateRange, compareDateRange, granularity);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("dimension", dimension)
                .add("dateRange", dateRange)
                .add("compareDateRange", compareDateRange)
                .add("granularity", granularity)
                .omitNullValues()
                .toString();
    }
}
