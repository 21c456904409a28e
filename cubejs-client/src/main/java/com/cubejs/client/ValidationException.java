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

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Raised while constructing a model value that violates one of its invariants.
 * Such values never reach the wire.
 */
public class ValidationException
        extends ClientException
{
    private final String field;
    private final String constraint;

    public ValidationException(String field, String constraint)
    {
        super(format("Invalid value for '%s': %s", requireNonNull(field, "field is null"), requireNonNull(constraint, "constraint is null")));
        this.field = field;
        this.constraint = constraint;
    }

    public String getField()
    {
        return field;
    }

    public String getConstraint()
    {
        return constraint;
    }

    static void checkField(boolean expression, String field, String constraint)
    {
        if (!expression) {
            throw new ValidationException(field, constraint);
        }
    }

    static String checkNotBlank(String value, String field)
    {
        checkField(value != null && !value.trim().isEmpty(), field, "must not be blank");
        return value;
    }
}
