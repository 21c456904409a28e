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
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import javax.annotation.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Raw body of a load response, before it is classified. Every field is optional here;
 * {@link ResponseInterpreter} decides which combinations are valid.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LoadResponse
{
    private final JsonNode error;
    private final List<Map<String, Object>> data;
    private final ResultAnnotation annotation;
    private final String lastRefreshTime;

    @JsonCreator
    public LoadResponse(
            @JsonProperty("error") @Nullable JsonNode error,
            @JsonProperty("data") @Nullable List<Map<String, Object>> data,
            @JsonProperty("annotation") @Nullable ResultAnnotation annotation,
            @JsonProperty("lastRefreshTime") @Nullable String lastRefreshTime)
    {
        this.error = error;
        this.data = data;
        this.annotation = annotation;
        this.lastRefreshTime = lastRefreshTime;
    }

    @Nullable
    @JsonProperty
    public JsonNode getError()
    {
        return error;
    }

    @Nullable
    @JsonProperty
    public List<Map<String, Object>> getData()
    {
        return data;
    }

    @Nullable
    @JsonProperty
    public ResultAnnotation getAnnotation()
    {
        return annotation;
    }

    @Nullable
    @JsonProperty
    public String getLastRefreshTime()
    {
        return lastRefreshTime;
    }
}
