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

import static com.cubejs.client.FilterOperator.Arity.AT_LEAST_ONE;
import static com.cubejs.client.FilterOperator.Arity.EXACTLY_ONE;
import static com.cubejs.client.FilterOperator.Arity.EXACTLY_TWO;
import static com.cubejs.client.FilterOperator.Arity.NONE;
import static java.util.Objects.requireNonNull;

/**
 * Filter operators accepted by the load endpoint. Which operators apply depends on the
 * member type (string, number or time dimension, or measure); the server checks that,
 * the client only checks how many values each operator takes.
 */
public enum FilterOperator
{
    EQUALS("equals", AT_LEAST_ONE),
    NOT_EQUALS("notEquals", AT_LEAST_ONE),
    CONTAINS("contains", AT_LEAST_ONE),
    NOT_CONTAINS("notContains", AT_LEAST_ONE),
    STARTS_WITH("startsWith", AT_LEAST_ONE),
    NOT_STARTS_WITH("notStartsWith", AT_LEAST_ONE),
    ENDS_WITH("endsWith", AT_LEAST_ONE),
    NOT_ENDS_WITH("notEndsWith", AT_LEAST_ONE),
    GREATER_THAN("gt", AT_LEAST_ONE),
    GREATER_THAN_OR_EQUAL("gte", AT_LEAST_ONE),
    LESS_THAN("lt", AT_LEAST_ONE),
    LESS_THAN_OR_EQUAL("lte", AT_LEAST_ONE),
    SET("set", NONE),
    NOT_SET("notSet", NONE),
    IN_DATE_RANGE("inDateRange", EXACTLY_TWO),
    NOT_IN_DATE_RANGE("notInDateRange", EXACTLY_TWO),
    BEFORE_DATE("beforeDate", EXACTLY_ONE),
    BEFORE_OR_ON_DATE("beforeOrOnDate", EXACTLY_ONE),
    AFTER_DATE("afterDate", EXACTLY_ONE),
    AFTER_OR_ON_DATE("afterOrOnDate", EXACTLY_ONE),
    MEASURE_FILTER("measureFilter", NONE);

    private final String value;
    private final Arity arity;

    FilterOperator(String value, Arity arity)
    {
        this.value = requireNonNull(value, "value is null");
        this.arity = requireNonNull(arity, "arity is null");
    }

    @JsonValue
    public String getValue()
    {
        return value;
    }

    public Arity getArity()
    {
        return arity;
    }

    @JsonCreator
    public static FilterOperator fromValue(String value)
    {
        for (FilterOperator operator : values()) {
            if (operator.value.equals(value)) {
                return operator;
            }
        }
        throw new ValidationException("operator", "unknown filter operator: " + value);
    }

    public enum Arity
    {
        NONE("takes no values"),
        EXACTLY_ONE("takes exactly one value"),
        EXACTLY_TWO("takes exactly two values"),
        AT_LEAST_ONE("takes at least one value");

        private final String description;

        Arity(String description)
        {
            this.description = description;
        }

        public boolean accepts(int count)
        {
            switch (this) {
                case NONE:
                    return count == 0;
                case EXACTLY_ONE:
                    return count == 1;
                case EXACTLY_TWO:
                    return count == 2;
                case AT_LEAST_ONE:
                    return count >= 1;
                default:
                    throw new AssertionError("Unknown arity: " + this);
            }
        }

        public String getDescription()
        {
            return description;
        }
    }
}
