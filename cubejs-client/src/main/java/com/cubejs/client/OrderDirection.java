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

public enum OrderDirection
{
    ASC,
    DESC;

    @JsonValue
    public String getValue()
    {
        return name().toLowerCase(Locale.ENGLISH);
    }

    @JsonCreator
    public static OrderDirection fromValue(String value)
    {
        for (OrderDirection direction : values()) {
            if (direction.getValue().equals(value)) {
                return direction;
            }
        }
        throw new ValidationException("order", "unknown direction: " + value);
    }
}
