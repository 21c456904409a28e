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

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import java.util.Objects;

import static com.google.common.base.MoreObjects.toStringHelper;

/**
 * Display metadata the server attaches to each member of a result.
 */
@Immutable
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MemberAnnotation
{
    private final String title;
    private final String shortTitle;
    private final String type;
    private final String format;

    @JsonCreator
    public MemberAnnotation(
            @JsonProperty("title") @Nullable String title,
            @JsonProperty("shortTitle") @Nullable String shortTitle,
            @JsonProperty("type") @Nullable String type,
            @JsonProperty("format") @Nullable String format)
    {
        this.title = title;
        this.shortTitle = shortTitle;
        this.type = type;
        this.format = format;
    }

    @Nullable
    @JsonProperty
    public String getTitle()
    {
        return title;
    }

    @Nullable
    @JsonProperty
    public String getShortTitle()
    {
        return shortTitle;
    }

    @Nullable
    @JsonProperty
    public String getType()
    {
        return type;
    }

    @Nullable
    @JsonProperty
    public String getFormat()
    {
        return format;
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
        MemberAnnotation that = (MemberAnnotation) o;
        return Objects.equals(title, that.title) &&
                Objects.equals(shortTitle, that.shortTitle) &&
                Objects.equals(type, that.type) &&
                Objects.equals(format, that.format);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(title, shortTitle, type, format);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("title", title)
                .add("shortTitle", shortTitle)
                .add("type", type)
                .add("format", format)
                .omitNullValues()
                .toString();
    }
}
