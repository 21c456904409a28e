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

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;

/**
 * Picks the concrete {@link FilterExpression} from the shape of the JSON object:
 * objects with an {@code or} or {@code and} key are logical filters.
 */
public class FilterExpressionDeserializer
        extends JsonDeserializer<FilterExpression>
{
    @Override
    public FilterExpression deserialize(JsonParser parser, DeserializationContext context)
            throws IOException
    {
        ObjectCodec codec = parser.getCodec();
        JsonNode node = codec.readTree(parser);
        if (node.has("or") || node.has("and")) {
            return codec.treeToValue(node, LogicalFilter.class);
        }
        return codec.treeToValue(node, Filter.class);
    }
}
