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

import java.util.Locale;

/**
 * Time bucket used to group a time dimension.
 */
public enum Granularity
{
    SECOND,
    MINUTE,
    HOUR,
    DAY,
    WEEK,
    MONTH,
    QUARTER,
    YEAR;

    @JsonValue
    public String getValue()
    {
        return name().toLowerCase(Locale.ENGLISH);
    }

    @JsonCreator
    public static Granularity fromValue(String value)
    {
        for (Granularity granularity : values()) {
            if (granularity.getValue().equals(value)) {
                return granularity;
            }
        }
        throw new ValidationException("granularity", "unknown granularity: " + value);
    }
}
