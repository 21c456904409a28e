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
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Rows returned by the load endpoint, keyed by member name. Cell values keep their JSON
 * types: the server encodes most numbers as strings, and missing values are {@code null}.
 */
@Immutable
@JsonIgnoreProperties(ignoreUnknown = true)
public class QueryResult
{
    private final List<Map<String, Object>> data;
    private final ResultAnnotation annotation;
    private final Optional<String> lastRefreshTime;

    @JsonCreator
    public QueryResult(
            @JsonProperty("data") List<Map<String, Object>> data,
            @JsonProperty("annotation") @Nullable ResultAnnotation annotation,
            @JsonProperty("lastRefreshTime") @Nullable String lastRefreshTime)
    {
        requireNonNull(data, "data is null");
        ImmutableList.Builder<Map<String, Object>> rows = ImmutableList.builder();
        for (Map<String, Object> row : data) {
            checkArgument(row != null, "data contains a null row");
            // values may be null, so ImmutableMap does not fit
            rows.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        this.data = rows.build();
        this.annotation = annotation == null ? ResultAnnotation.EMPTY : annotation;
        this.lastRefreshTime = Optional.ofNullable(lastRefreshTime);
    }

    @JsonProperty
    public List<Map<String, Object>> getData()
    {
        return data;
    }

    @JsonProperty
    public ResultAnnotation getAnnotation()
    {
        return annotation;
    }

    public Optional<String> getLastRefreshTime()
    {
        return lastRefreshTime;
    }

    @Nullable
    @JsonProperty("lastRefreshTime")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String getLastRefreshTimeValue()
    {
        return lastRefreshTime.orElse(null);
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
        QueryResult that = (QueryResult) o;
        return data.equals(that.data) &&
                annotation.equals(that.annotation) &&
                lastRefreshTime.equals(that.lastRefreshTime);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(data, annotation, lastRefreshTime);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("rows", data.size())
                .add("annotation", annotation)
                .add("lastRefreshTime", lastRefreshTime.orElse(null))
                .omitNullValues()
                .toString();
    }
}
