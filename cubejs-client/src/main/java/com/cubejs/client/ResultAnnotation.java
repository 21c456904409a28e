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
import com.google.common.collect.ImmutableMap;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import java.util.Map;
import java.util.Objects;

import static com.google.common.base.MoreObjects.toStringHelper;

/**
 * Per-member metadata of a result, keyed by member name within each section.
 */
@Immutable
@JsonIgnoreProperties(ignoreUnknown = true)
public class ResultAnnotation
{
    public static final ResultAnnotation EMPTY = new ResultAnnotation(null, null, null, null);

    private final Map<String, MemberAnnotation> measures;
    private final Map<String, MemberAnnotation> dimensions;
    private final Map<String, MemberAnnotation> segments;
    private final Map<String, MemberAnnotation> timeDimensions;

    @JsonCreator
    public ResultAnnotation(
            @JsonProperty("measures") @Nullable Map<String, MemberAnnotation> measures,
            @JsonProperty("dimensions") @Nullable Map<String, MemberAnnotation> dimensions,
            @JsonProperty("segments") @Nullable Map<String, MemberAnnotation> segments,
            @JsonProperty("timeDimensions") @Nullable Map<String, MemberAnnotation> timeDimensions)
    {
        this.measures = copy(measures);
        this.dimensions = copy(dimensions);
        this.segments = copy(segments);
        this.timeDimensions = copy(timeDimensions);
    }

    @JsonProperty
    public Map<String, MemberAnnotation> getMeasures()
    {
        return measures;
    }

    @JsonProperty
    public Map<String, MemberAnnotation> getDimensions()
    {
        return dimensions;
    }

    @JsonProperty
    public Map<String, MemberAnnotation> getSegments()
    {
        return segments;
    }

    @JsonProperty
    public Map<String, MemberAnnotation> getTimeDimensions()
    {
        return timeDimensions;
    }

    private static Map<String, MemberAnnotation> copy(@Nullable Map<String, MemberAnnotation> annotations)
    {
        if (annotations == null) {
            return ImmutableMap.of();
        }
        ImmutableMap.Builder<String, MemberAnnotation> builder = ImmutableMap.builder();
        annotations.forEach((member, annotation) -> {
            // the server sends null for members it has nothing to say about
            if (annotation != null) {
                builder.put(member, annotation);
            }
        });
        return builder.build();
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
        ResultAnnotation that = (ResultAnnotation) o;
        return measures.equals(that.measures) &&
                dimensions.equals(that.dimensions) &&
                segments.equals(that.segments) &&
                timeDimensions.equals(that.timeDimensions);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(measures, dimensions, segments, timeDimensions);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("measures", measures)
                .add("dimensions", dimensions)
                .add("segments", segments)
                .add("timeDimensions", timeDimensions)
                .toString();
    }
}
