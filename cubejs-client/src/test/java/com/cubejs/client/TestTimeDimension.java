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

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.expectThrows;

public class TestTimeDimension
{
    @Test
    public void testGranularityOnly()
    {
        TimeDimension timeDimension = TimeDimension.of("Orders.createdAt", Granularity.MONTH);
        assertEquals(timeDimension.getGranularity(), Granularity.MONTH);
        assertNull(timeDimension.getDateRange());
        assertNull(timeDimension.getCompareDateRange());
    }

    @Test
    public void testCompareDateRange()
    {
        TimeDimension timeDimension = TimeDimension.compare(
                "Orders.createdAt",
                ImmutableList.of(DateRange.parse("this week"), DateRange.parse("last week")),
                null);
        assertEquals(timeDimension.getCompareDateRange().size(), 2);
        assertNull(timeDimension.getGranularity());
    }

    @Test
    public void testInvalid()
    {
        ValidationException e = expectThrows(ValidationException.class, () -> new TimeDimension(
                "Orders.createdAt",
                DateRange.parse("today"),
                ImmutableList.of(DateRange.parse("yesterday")),
                Granularity.DAY));
        assertEquals(e.getField(), "timeDimensions.compareDateRange");

        e = expectThrows(ValidationException.class, () -> TimeDimension.compare("Orders.createdAt", ImmutableList.of(), Granularity.DAY));
        assertEquals(e.getField(), "timeDimensions.compareDateRange");

        e = expectThrows(ValidationException.class, () -> TimeDimension.of("", Granularity.DAY));
        assertEquals(e.getField(), "timeDimensions.dimension");
    }

    @Test
    public void testGranularityValues()
    {
        assertEquals(Granularity.QUARTER.getValue(), "quarter");
        assertEquals(Granularity.fromValue("hour"), Granularity.HOUR);
        expectThrows(ValidationException.class, () -> Granularity.fromValue("fortnight"));
    }
}
