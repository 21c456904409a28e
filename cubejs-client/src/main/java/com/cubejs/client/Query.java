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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Objects;
import java.util.Set;

import static com.cubejs.client.ValidationException.checkField;
import static com.cubejs.client.ValidationException.checkNotBlank;
import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

/**
 * An analytical query against the semantic layer.
 * <p>
 * Measures, dimensions and segments drop duplicates and keep first-insertion order.
 * That order is serialized and is part of equality, because the server's default sort
 * uses the first measure or dimension. Time dimensions, filters and ordering keep the
 * order the caller gave them.
 */
@Immutable
public final class Query
{
    private final Set<String> measures;
    private final Set<String> dimensions;
    private final Set<String> segments;
    private final List<TimeDimension> timeDimensions;
    private final List<FilterExpression> filters;
    private final Map<String, OrderDirection> order;
    private final Integer limit;
    private final Integer offset;

    @JsonCreator
    public Query(
            @JsonProperty("measures") @Nullable Collection<String> measures,
            @JsonProperty("dimensions") @Nullable Collection<String> dimensions,
            @JsonProperty("segments") @Nullable Collection<String> segments,
            @JsonProperty("timeDimensions") @Nullable List<TimeDimension> timeDimensions,
            @JsonProperty("filters") @Nullable List<FilterExpression> filters,
            @JsonProperty("order") @Nullable Map<String, OrderDirection> order,
            @JsonProperty("limit") @Nullable Integer limit,
            @JsonProperty("offset") @Nullable Integer offset)
    {
        this.measures = members(measures, "measures");
        this.dimensions = members(dimensions, "dimensions");
        this.segments = members(segments, "segments");
        this.timeDimensions = elements(timeDimensions, "timeDimensions");
        this.filters = elements(filters, "filters");
        this.order = ordering(order);
        checkField(!this.measures.isEmpty() || !this.dimensions.isEmpty(), "measures/dimensions", "query must request at least one measure or dimension");
        checkField(limit == null || limit >= 0, "limit", "must not be negative: " + limit);
        checkField(offset == null || offset >= 0, "offset", "must not be negative: " + offset);
        this.limit = limit;
        this.offset = offset;
    }

    public static Builder builder()
    {
        return new Builder();
    }

    @JsonProperty
    public Set<String> getMeasures()
    {
        return measures;
    }

    @JsonProperty
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public Set<String> getDimensions()
    {
        return dimensions;
    }

    @JsonProperty
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public Set<String> getSegments()
    {
        return segments;
    }

    @JsonProperty
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public List<TimeDimension> getTimeDimensions()
    {
        return timeDimensions;
    }

    @JsonProperty
    public List<FilterExpression> getFilters()
    {
        return filters;
    }

    @JsonProperty
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public Map<String, OrderDirection> getOrder()
    {
        return order;
    }

    @Nullable
    @JsonProperty
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public Integer getLimit()
    {
        return limit;
    }

    @Nullable
    @JsonProperty
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public Integer getOffset()
    {
        return offset;
    }

    private static Set<String> members(@Nullable Collection<String> members, String field)
    {
        if (members == null) {
            return ImmutableSet.of();
        }
        for (String member : members) {
            checkNotBlank(member, field);
        }
        return ImmutableSet.copyOf(members);
    }

    private static <T> List<T> elements(@Nullable List<T> elements, String field)
    {
        if (elements == null) {
            return ImmutableList.of();
        }
        checkField(elements.stream().allMatch(Objects::nonNull), field, "must not contain null elements");
        return ImmutableList.copyOf(elements);
    }

    private static Map<String, OrderDirection> ordering(@Nullable Map<String, OrderDirection> order)
    {
        if (order == null) {
            return ImmutableMap.of();
        }
        for (Entry<String, OrderDirection> entry : order.entrySet()) {
            checkNotBlank(entry.getKey(), "order");
            checkField(entry.getValue() != null, "order", "direction for " + entry.getKey() + " must not be null");
        }
        return ImmutableMap.copyOf(order);
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
        Query that = (Query) o;
        // member order and ordering precedence change the result, so both are significant
        return ImmutableList.copyOf(measures).equals(ImmutableList.copyOf(that.measures)) &&
                ImmutableList.copyOf(dimensions).equals(ImmutableList.copyOf(that.dimensions)) &&
                ImmutableList.copyOf(segments).equals(ImmutableList.copyOf(that.segments)) &&
                timeDimensions.equals(that.timeDimensions) &&
                filters.equals(that.filters) &&
                ImmutableList.copyOf(order.entrySet()).equals(ImmutableList.copyOf(that.order.entrySet())) &&
                Objects.equals(limit, that.limit) &&
                Objects.equals(offset, that.offset);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(
                ImmutableList.copyOf(measures),
                ImmutableList.copyOf(dimensions),
                ImmutableList.copyOf(segments),
                timeDimensions,
                filters,
                ImmutableList.copyOf(order.entrySet()),
                limit,
                offset);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("measures", measures)
                .add("dimensions", dimensions)
                .add("segments", segments)
                .add("timeDimensions", timeDimensions)
                .add("filters", filters)
                .add("order", order)
                .add("limit", limit)
                .add("offset", offset)
                .omitNullValues()
                .toString();
    }

    public static final class Builder
    {
        private final Set<String> measures = new LinkedHashSet<>();
        private final Set<String> dimensions = new LinkedHashSet<>();
        private final Set<String> segments = new LinkedHashSet<>();
        private final List<TimeDimension> timeDimensions = new ArrayList<>();
        private final List<FilterExpression> filters = new ArrayList<>();
        private final Map<String, OrderDirection> order = new LinkedHashMap<>();
        private Integer limit;
        private Integer offset;

        private Builder() {}

        public Builder measures(String... measures)
        {
            for (String measure : measures) {
                this.measures.add(measure);
            }
            return this;
        }

        public Builder dimensions(String... dimensions)
        {
            for (String dimension : dimensions) {
                this.dimensions.add(dimension);
            }
            return this;
        }

        public Builder segments(String... segments)
        {
            for (String segment : segments) {
                this.segments.add(segment);
            }
            return this;
        }

        public Builder timeDimension(TimeDimension timeDimension)
        {
            timeDimensions.add(requireNonNull(timeDimension, "timeDimension is null"));
            return this;
        }

        public Builder filter(FilterExpression filter)
        {
            filters.add(requireNonNull(filter, "filter is null"));
            return this;
        }

        public Builder orderBy(String member, OrderDirection direction)
        {
            order.put(requireNonNull(member, "member is null"), requireNonNull(direction, "direction is null"));
            return this;
        }

        public Builder limit(int limit)
        {
            this.limit = limit;
            return this;
        }

        public Builder offset(int offset)
        {
            this.offset = offset;
            return this;
        }

        public Query build()
        {
            return new Query(measures, dimensions, segments, timeDimensions, filters, order, limit, offset);
        }
    }
}
