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
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import java.util.List;
import java.util.Objects;

import static com.cubejs.client.ValidationException.checkField;
import static com.cubejs.client.ValidationException.checkNotBlank;
import static com.google.common.base.MoreObjects.toStringHelper;

/**
 * Restricts a dimension (before aggregation) or a measure (after aggregation).
 */
@Immutable
@JsonDeserialize(using = JsonDeserializer.None.class)
public final class Filter
        implements FilterExpression
{
    private final String member;
    private final FilterOperator operator;
    private final List<String> values;

    @JsonCreator
    public Filter(
            @JsonProperty("member") String member,
            @JsonProperty("operator") FilterOperator operator,
            @JsonProperty("values") @Nullable List<String> values)
    {
        this.member = checkNotBlank(member, "filters.member");
        checkField(operator != null, "filters.operator", "must not be null");
        List<String> filterValues = values == null ? ImmutableList.of() : values;
        checkField(filterValues.stream().allMatch(Objects::nonNull), "filters.values", "must not contain null values");
        checkField(operator.getArity().accepts(filterValues.size()), "filters.values",
                "operator " + operator.getValue() + " " + operator.getArity().getDescription() + ", found " + filterValues.size());
        this.operator = operator;
        this.values = ImmutableList.copyOf(filterValues);
    }

    public static Filter of(String member, FilterOperator operator, String... values)
    {
        return new Filter(member, operator, ImmutableList.copyOf(values));
    }

    @JsonProperty
    public String getMember()
    {
        return member;
    }

    @JsonProperty
    public FilterOperator getOperator()
    {
        return operator;
    }

    @JsonProperty
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public List<String> getValues()
    {
        return values;
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
        Filter that = (Filter) o;
        return member.equals(that.member) &&
                operator == that.operator &&
                values.equals(that.values);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(member, operator, values);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("member", member)
                .add("operator", operator)
                .add("values", values)
                .toString();
    }
}
