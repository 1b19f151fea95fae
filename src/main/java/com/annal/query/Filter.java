package com.annal.query;

import com.annal.store.Document;
import com.annal.store.Documents;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Predicate;

/**
 * Functional interface representing a filter that selects documents of a
 * collection. Field paths use dot notation and numbers compare by value.
 */
@FunctionalInterface
public interface Filter {
    boolean matches(Document document);

    enum Operator {
        EQ,
        NE,
        GT,
        GTE,
        LT,
        LTE
    }

    static Filter all() {
        return document -> true;
    }

    @SuppressWarnings({"rawtypes", "unchecked"})
    static Filter field(String path, Operator op, Object value) {
        if (path == null || op == null) {
            throw new IllegalArgumentException("path and operator must be non-null");
        }
        return document -> {
            Object actual = document.getPath(path);
            return switch (op) {
                case EQ -> Documents.valuesEqual(actual, value);
                case NE -> !Documents.valuesEqual(actual, value);
                case GT, GTE, LT, LTE -> {
                    Comparable left = Documents.normalizeComparable(actual);
                    Comparable right = Documents.normalizeComparable(value);
                    if (left == null || right == null || !left.getClass().equals(right.getClass())) {
                        yield false;
                    }
                    int cmp = left.compareTo(right);
                    yield switch (op) {
                        case GT -> cmp > 0;
                        case GTE -> cmp >= 0;
                        case LT -> cmp < 0;
                        default -> cmp <= 0;
                    };
                }
            };
        };
    }

    static Filter eq(String path, Object value) {
        return field(path, Operator.EQ, value);
    }

    static Filter byId(String id) {
        return eq(Document.ID_FIELD, id);
    }

    static Filter in(String path, Collection<?> values) {
        List<Object> candidates = new ArrayList<>(values);
        return document -> {
            Object actual = document.getPath(path);
            for (Object candidate : candidates) {
                if (Documents.valuesEqual(actual, candidate)) {
                    return true;
                }
            }
            return false;
        };
    }

    /** Matches when the path is missing or holds {@code null}. */
    static Filter isNull(String path) {
        return document -> document.getPath(path) == null;
    }

    static Filter exists(String path) {
        return document -> document.getPath(path) != null;
    }

    static Filter and(Filter... filters) {
        return and(List.of(filters));
    }

    static Filter and(List<Filter> filters) {
        List<Filter> parts = List.copyOf(filters);
        return document -> {
            for (Filter f : parts) {
                if (!f.matches(document)) {
                    return false;
                }
            }
            return true;
        };
    }

    /** An empty disjunction matches nothing. */
    static Filter or(Filter... filters) {
        return or(List.of(filters));
    }

    static Filter or(List<Filter> filters) {
        List<Filter> parts = List.copyOf(filters);
        return document -> {
            for (Filter f : parts) {
                if (f.matches(document)) {
                    return true;
                }
            }
            return false;
        };
    }

    static Filter not(Filter filter) {
        return document -> !filter.matches(document);
    }

    static Filter fromPredicate(Predicate<Document> predicate) {
        return predicate::test;
    }
}
