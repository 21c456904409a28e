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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.testng.annotations.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNotEquals;
import static org.testng.Assert.expectThrows;

public class TestQuery
{
    @Test
    public void testBuilder()
    {
        Query query = Query.builder()
                .measures("Orders.count", "Orders.total")
                .dimensions("Orders.status")
                .segments("Orders.completed")
                .timeDimension(TimeDimension.of("Orders.createdAt", DateRange.parse("last 7 days"), Granularity.DAY))
                .filter(Filter.of("Orders.status", FilterOperator.EQUALS, "completed"))
                .orderBy("Orders.count", OrderDirection.DESC)
                .limit(100)
                .offset(20)
                .build();

        assertEquals(ImmutableList.copyOf(query.getMeasures()), ImmutableList.of("Orders.count", "Orders.total"));
        assertEquals(query.getDimensions(), ImmutableSet.of("Orders.status"));
        assertEquals(query.getSegments(), ImmutableSet.of("Orders.completed"));
        assertEquals(query.getTimeDimensions().size(), 1);
        assertEquals(query.getFilters().size(), 1);
        assertEquals(query.getOrder(), ImmutableMap.of("Orders.count", OrderDirection.DESC));
        assertEquals(query.getLimit(), Integer.valueOf(100));
        assertEquals(query.getOffset(), Integer.valueOf(20));
    }

    @Test
    public void testDimensionOnlyQuery()
    {
        Query query = Query.builder().dimensions("Users.city").build();
        assertEquals(query.getMeasures(), ImmutableSet.of());
        assertEquals(query.getDimensions(), ImmutableSet.of("Users.city"));
    }

    @Test
    public void testEmptyQuery()
    {
        ValidationException e = expectThrows(ValidationException.class, () -> Query.builder().build());
        assertEquals(e.getField(), "measures/dimensions");

        // segments and filters alone do not make a query
        expectThrows(ValidationException.class, () -> Query.builder()
                .segments("Orders.completed")
                .filter(Filter.of("Orders.status", FilterOperator.SET))
                .build());
    }

    @Test
    public void testNegativeLimitAndOffset()
    {
        ValidationException e = expectThrows(ValidationException.class, () -> Query.builder().measures("Orders.count").limit(-1).build());
        assertEquals(e.getField(), "limit");

        e = expectThrows(ValidationException.class, () -> Query.builder().measures("Orders.count").offset(-5).build());
        assertEquals(e.getField(), "offset");

        assertEquals(Query.builder().measures("Orders.count").limit(0).offset(0).build().getLimit(), Integer.valueOf(0));
    }

    @Test
    public void testBlankMember()
    {
        ValidationException e = expectThrows(ValidationException.class, () -> Query.builder().measures("Orders.count", " ").build());
        assertEquals(e.getField(), "measures");
        assertEquals(e.getConstraint(), "must not be blank");

        e = expectThrows(ValidationException.class, () -> Query.builder().measures("Orders.count").orderBy("", OrderDirection.ASC).build());
        assertEquals(e.getField(), "order");
    }

    @Test
    public void testMembersKeepFirstOccurrenceOrder()
    {
        Query query = Query.builder()
                .measures("Orders.total", "Orders.count", "Orders.total")
                .build();
        assertEquals(ImmutableList.copyOf(query.getMeasures()), ImmutableList.of("Orders.total", "Orders.count"));
    }

    @Test
    public void testEquality()
    {
        Query first = Query.builder().measures("Orders.count", "Orders.total").dimensions("Orders.status").build();
        Query second = Query.builder().measures("Orders.count").measures("Orders.total", "Orders.count").dimensions("Orders.status").build();
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());

        assertNotEquals(
                Query.builder().measures("Orders.count").limit(10).build(),
                Query.builder().measures("Orders.count").limit(11).build());
    }

    @Test
    public void testMemberOrderIsSignificant()
    {
        assertNotEquals(
                Query.builder().measures("Orders.count", "Orders.total").build(),
                Query.builder().measures("Orders.total", "Orders.count").build());
        assertNotEquals(
                Query.builder().dimensions("Orders.status", "Orders.city").build(),
                Query.builder().dimensions("Orders.city", "Orders.status").build());
        assertNotEquals(
                Query.builder().measures("Orders.count").segments("Orders.completed", "Orders.large").build(),
                Query.builder().measures("Orders.count").segments("Orders.large", "Orders.completed").build());
    }

    @Test
    public void testOrderPrecedenceIsSignificant()
    {
        Map<String, OrderDirection> countFirst = new LinkedHashMap<>();
        countFirst.put("Orders.count", OrderDirection.DESC);
        countFirst.put("Orders.status", OrderDirection.ASC);
        Map<String, OrderDirection> statusFirst = new LinkedHashMap<>();
        statusFirst.put("Orders.status", OrderDirection.ASC);
        statusFirst.put("Orders.count", OrderDirection.DESC);

        Query first = new Query(ImmutableList.of("Orders.count"), ImmutableList.of("Orders.status"), null, null, null, countFirst, null, null);
        Query second = new Query(ImmutableList.of("Orders.count"), ImmutableList.of("Orders.status"), null, null, null, statusFirst, null, null);
        assertNotEquals(first, second);
        assertEquals(ImmutableList.copyOf(first.getOrder().keySet()), ImmutableList.of("Orders.count", "Orders.status"));
    }

    @Test
    public void testNullOrderDirection()
    {
        Map<String, OrderDirection> order = new LinkedHashMap<>();
        order.put("Orders.count", null);
        ValidationException e = expectThrows(ValidationException.class,
                () -> new Query(ImmutableList.of("Orders.count"), null, null, null, null, order, null, null));
        assertEquals(e.getField(), "order");
    }
}
