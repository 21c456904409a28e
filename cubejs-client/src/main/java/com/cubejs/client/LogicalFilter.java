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

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import static com.cubejs.client.ValidationException.checkField;
import static com.google.common.base.MoreObjects.toStringHelper;

/**
 * Combines filters with boolean logic. Dimension and measure filters cannot be mixed
 * inside one logical filter; the server enforces that.
 */
@Immutable
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonDeserialize(using = JsonDeserializer.None.class)
public final class LogicalFilter
        implements FilterExpression
{
    public enum Operator
    {
        OR,
        AND,
    }

    private final Operator operator;
    private final List<FilterExpression> operands;

    @JsonCreator
    public LogicalFilter(
            @JsonProperty("or") @Nullable List<FilterExpression> or,
            @JsonProperty("and") @Nullable List<FilterExpression> and)
    {
        checkField(or == null ^ and == null, "filters", "logical filter must have exactly one of 'or' and 'and'");
        List<FilterExpression> operands = or != null ? or : and;
        checkField(!operands.isEmpty(), "filters", "logical filter must not be empty");
        checkField(operands.stream().allMatch(Objects::nonNull), "filters", "logical filter must not contain null filters");
        this.operator = or != null ? Operator.OR : Operator.AND;
        this.operands = ImmutableList.copyOf(operands);
    }

    public static LogicalFilter or(FilterExpression... operands)
    {
        return new LogicalFilter(Arrays.asList(operands), null);
    }

    public static LogicalFilter and(FilterExpression... operands)
    {
        return new LogicalFilter(null, Arrays.asList(operands));
    }

    public Operator getOperator()
    {
        return operator;
    }

    public List<FilterExpression> getOperands()
    {
        return operands;
    }

    @Nullable
    @JsonProperty("or")
    public List<FilterExpression> getOr()
    {
        return operator == Operator.OR ? operands : null;
    }

    @Nullable
    @JsonProperty("and")
    public List<FilterExpression> getAnd()
    {
        return operator == Operator.AND ? operands : null;
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
        LogicalFilter that = (LogicalFilter) o;
        return operator == that.operator && operands.equals(that.operands);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(operator, operands);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("operator", operator)
                .add("operands", operands)
                .toString();
    }
}
