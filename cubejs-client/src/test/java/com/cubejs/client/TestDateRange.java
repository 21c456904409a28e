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

import com.google.common.collect.ImmutableList;
import org.testng.annotations.Test;

import java.time.LocalDate;
import java.util.Optional;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.expectThrows;

public class TestDateRange
{
    @Test
    public void testRelativePhrases()
    {
        for (String phrase : ImmutableList.of(
                "today",
                "Yesterday",
                "this month",
                "last quarter",
                "next year",
                "last 7 days",
                "next 1 week",
                "last 12 months",
                "from 3 days ago to now",
                "from now to 2 hours from now")) {
            DateRange range = DateRange.parse(phrase);
            assertTrue(range.isRelative(), phrase);
            assertEquals(range.getExpression(), Optional.of(phrase));
            assertEquals(range.toJson(), phrase);
        }
    }

    @Test
    public void testUnrecognizedPhrase()
    {
        for (String phrase : ImmutableList.of("someday", "last 0 days", "last -3 days", "next fortnight", "from 2 days ago")) {
            ValidationException e = expectThrows(ValidationException.class, () -> DateRange.parse(phrase));
            assertEquals(e.getField(), "dateRange");
        }
        expectThrows(ValidationException.class, () -> DateRange.parse(" "));
    }

    @Test
    public void testSingleDate()
    {
        DateRange range = DateRange.parse("2024-03-01");
        assertFalse(range.isRelative());
        assertEquals(range.toJson(), "2024-03-01");
        expectThrows(ValidationException.class, () -> DateRange.parse("2024-02-30"));
    }

    @Test
    public void testBetween()
    {
        DateRange range = DateRange.between("2024-01-01", "2024-01-31");
        assertFalse(range.isRelative());
        assertEquals(range.getBounds(), ImmutableList.of("2024-01-01", "2024-01-31"));
        assertEquals(range.toJson(), ImmutableList.of("2024-01-01", "2024-01-31"));
        assertEquals(DateRange.between(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31)), range);

        // the end date covers the whole day
        DateRange.between("2024-01-31T23:59:59", "2024-01-31");
        DateRange.between("2024-01-01T10:00:00.000", "2024-01-01T10:00:00.000");
    }

    @Test
    public void testReversedBounds()
    {
        ValidationException e = expectThrows(ValidationException.class, () -> DateRange.between("2024-02-01", "2024-01-01"));
        assertEquals(e.getField(), "dateRange");
        expectThrows(ValidationException.class, () -> DateRange.between("2024-01-01T12:00:00", "2024-01-01T11:59:59"));
    }

    @Test
    public void testMalformedBounds()
    {
        expectThrows(ValidationException.class, () -> DateRange.between("01/01/2024", "2024-01-31"));
        expectThrows(ValidationException.class, () -> DateRange.between("2024-01-01", "2024-13-01"));
    }

    @Test
    public void testFromJson()
    {
        assertEquals(DateRange.fromJson("last week"), DateRange.parse("last week"));
        assertEquals(DateRange.fromJson(ImmutableList.of("2024-01-01", "2024-01-31")), DateRange.between("2024-01-01", "2024-01-31"));
        expectThrows(ValidationException.class, () -> DateRange.fromJson(ImmutableList.of("2024-01-01")));
        expectThrows(ValidationException.class, () -> DateRange.fromJson(42));
    }
}
