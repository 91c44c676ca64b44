/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
package oracle.docstore.driver.ops;

import static oracle.docstore.driver.util.CheckNull.requireNonEmpty;
import static oracle.docstore.driver.util.CheckNull.requireNonNull;
import static oracle.docstore.driver.util.CheckNull.requireNonNullIAE;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An immutable query definition over a single collection.
 * <p>
 * Each builder method returns a new Query and leaves the receiver
 * unchanged, so a Query can be shared between result sequences. This is
 * what allows {@link ResultSequence#fetchNext} to resume a query by
 * deriving a copy with a new start cursor.
 * <p>
 * Example:
 * <pre>
 * Query q = handle.col("cities").query()
 *     .where("population", Query.Operator.GREATER_THAN, 1000000L)
 *     .orderBy("population", Query.Direction.DESCENDING)
 *     .limit(20);
 * </pre>
 */
public final class Query {

    /**
     * Comparison operators for {@link #where}.
     */
    public enum Operator {
        LESS_THAN,
        LESS_THAN_OR_EQUAL,
        GREATER_THAN,
        GREATER_THAN_OR_EQUAL,
        EQUAL,
        NOT_EQUAL,
        ARRAY_CONTAINS,
        IN
    }

    /**
     * Sort direction for {@link #orderBy}.
     */
    public enum Direction {
        ASCENDING,
        DESCENDING
    }

    /**
     * A single field filter.
     */
    public static final class Filter {
        private final String field;
        private final Operator op;
        private final Object value;

        Filter(String field, Operator op, Object value) {
            this.field = field;
            this.op = op;
            this.value = value;
        }

        public String getField() {
            return field;
        }

        public Operator getOperator() {
            return op;
        }

        public Object getValue() {
            return value;
        }

        @Override
        public boolean equals(Object other) {
            if (!(other instanceof Filter)) {
                return false;
            }
            Filter o = (Filter) other;
            return field.equals(o.field) && op == o.op &&
                Objects.deepEquals(value, o.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(field, op);
        }
    }

    /**
     * A single sort order.
     */
    public static final class Order {
        private final String field;
        private final Direction direction;

        Order(String field, Direction direction) {
            this.field = field;
            this.direction = direction;
        }

        public String getField() {
            return field;
        }

        public Direction getDirection() {
            return direction;
        }

        @Override
        public boolean equals(Object other) {
            if (!(other instanceof Order)) {
                return false;
            }
            Order o = (Order) other;
            return field.equals(o.field) && direction == o.direction;
        }

        @Override
        public int hashCode() {
            return Objects.hash(field, direction);
        }
    }

    private final String parentName;
    private final String collectionId;
    private final List<String> select;
    private final List<Filter> filters;
    private final List<Order> orders;
    private final Integer limit;
    private final Integer offset;
    private final Cursor startCursor;
    private final Cursor endCursor;

    private Query(String parentName,
                  String collectionId,
                  List<String> select,
                  List<Filter> filters,
                  List<Order> orders,
                  Integer limit,
                  Integer offset,
                  Cursor startCursor,
                  Cursor endCursor) {
        this.parentName = parentName;
        this.collectionId = collectionId;
        this.select = select;
        this.filters = filters;
        this.orders = orders;
        this.limit = limit;
        this.offset = offset;
        this.startCursor = startCursor;
        this.endCursor = endCursor;
    }

    /**
     * Creates a query over all documents of a collection.
     *
     * @param collection the collection
     * @return the query
     */
    public static Query from(CollectionReference collection) {
        requireNonNull(collection, "Query: collection must be non-null");
        return new Query(collection.getParentName(),
                         collection.getCollectionId(),
                         Collections.emptyList(),
                         Collections.emptyList(),
                         Collections.emptyList(),
                         null, null, null, null);
    }

    /**
     * Returns a query that projects only the given fields.
     *
     * @param fields the field paths
     * @return a new query
     */
    public Query select(String... fields) {
        requireNonNullIAE(fields, "Query.select: fields must be non-null");
        List<String> list = new ArrayList<>(select);
        for (String field : fields) {
            requireNonEmpty(field, "Query.select: field must be non-empty");
            list.add(field);
        }
        return new Query(parentName, collectionId,
                         Collections.unmodifiableList(list), filters, orders,
                         limit, offset, startCursor, endCursor);
    }

    /**
     * Returns a query with an additional filter. Filters are combined with
     * AND.
     *
     * @param field the field path
     * @param op the operator
     * @param value the value to compare against
     * @return a new query
     */
    public Query where(String field, Operator op, Object value) {
        requireNonEmpty(field, "Query.where: field must be non-empty");
        requireNonNullIAE(op, "Query.where: operator must be non-null");
        List<Filter> list = new ArrayList<>(filters);
        list.add(new Filter(field, op, value));
        return new Query(parentName, collectionId, select,
                         Collections.unmodifiableList(list), orders,
                         limit, offset, startCursor, endCursor);
    }

    /**
     * Returns a query with an additional ascending sort order.
     *
     * @param field the field path
     * @return a new query
     */
    public Query orderBy(String field) {
        return orderBy(field, Direction.ASCENDING);
    }

    /**
     * Returns a query with an additional sort order.
     *
     * @param field the field path
     * @param direction the direction
     * @return a new query
     */
    public Query orderBy(String field, Direction direction) {
        requireNonEmpty(field, "Query.orderBy: field must be non-empty");
        requireNonNullIAE(direction,
                          "Query.orderBy: direction must be non-null");
        List<Order> list = new ArrayList<>(orders);
        list.add(new Order(field, direction));
        return new Query(parentName, collectionId, select, filters,
                         Collections.unmodifiableList(list),
                         limit, offset, startCursor, endCursor);
    }

    /**
     * Returns a query that returns at most the given number of documents.
     *
     * @param num the limit, must be non-negative
     * @return a new query
     */
    public Query limit(int num) {
        if (num < 0) {
            throw new IllegalArgumentException("limit must be >= 0");
        }
        return new Query(parentName, collectionId, select, filters, orders,
                         num, offset, startCursor, endCursor);
    }

    /**
     * Returns a query that skips the given number of documents. Prefer
     * cursors for paging: an offset is not stable when documents are
     * written between requests.
     * <p>
     * The offset is kept when a query is resumed from a cursor, so
     * {@link ResultSequence#fetchNext} and {@link ResultSequence#exhaustAll}
     * skip that many documents again at the start of every following page.
     *
     * @param num the offset, must be non-negative
     * @return a new query
     */
    public Query offset(int num) {
        if (num < 0) {
            throw new IllegalArgumentException("offset must be >= 0");
        }
        return new Query(parentName, collectionId, select, filters, orders,
                         limit, num, startCursor, endCursor);
    }

    /**
     * Returns a copy of this query that starts immediately after the given
     * cursor. The receiver is not modified.
     *
     * @param cursor the start cursor, or null to clear it
     * @return a new query
     */
    public Query withStartCursor(Cursor cursor) {
        return new Query(parentName, collectionId, select, filters, orders,
                         limit, offset, cursor, endCursor);
    }

    /**
     * Returns a copy of this query that ends at the given cursor.
     *
     * @param cursor the end cursor, or null to clear it
     * @return a new query
     */
    public Query withEndCursor(Cursor cursor) {
        return new Query(parentName, collectionId, select, filters, orders,
                         limit, offset, startCursor, cursor);
    }

    /**
     * Returns the resource name under which the query runs.
     *
     * @return the parent resource name
     */
    public String getParentName() {
        return parentName;
    }

    public String getCollectionId() {
        return collectionId;
    }

    public List<String> getSelect() {
        return select;
    }

    public List<Filter> getFilters() {
        return filters;
    }

    public List<Order> getOrders() {
        return orders;
    }

    /**
     * @return the limit, or null if not set
     */
    public Integer getLimit() {
        return limit;
    }

    /**
     * @return the offset, or null if not set
     */
    public Integer getOffset() {
        return offset;
    }

    public Cursor getStartCursor() {
        return startCursor;
    }

    public Cursor getEndCursor() {
        return endCursor;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Query)) {
            return false;
        }
        Query o = (Query) other;
        return parentName.equals(o.parentName) &&
            collectionId.equals(o.collectionId) &&
            select.equals(o.select) &&
            filters.equals(o.filters) &&
            orders.equals(o.orders) &&
            Objects.equals(limit, o.limit) &&
            Objects.equals(offset, o.offset) &&
            Objects.equals(startCursor, o.startCursor) &&
            Objects.equals(endCursor, o.endCursor);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parentName, collectionId, select, filters, orders,
                            limit, offset, startCursor, endCursor);
    }

    @Override
    public String toString() {
        return "Query: [parent=" + parentName +
            ", collection=" + collectionId +
            ", select=" + select +
            ", filters=" + filters.size() +
            ", orders=" + orders.size() +
            ", limit=" + limit +
            ", offset=" + offset +
            ", startCursor=" + startCursor + "]";
    }
}
