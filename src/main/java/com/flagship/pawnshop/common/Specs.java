package com.flagship.pawnshop.common;

import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.util.Arrays;
import java.util.Collection;
import java.util.Locale;

/**
 * Small building blocks for the search endpoints' JPA specifications.
 * A null argument yields a null specification, which {@code Specification.where}/{@code and} ignore.
 */
public final class Specs {

    private Specs() {
        // Utility class
    }

    /**
     * Case-insensitive substring match of {@code term} against any of the given string attributes.
     */
    public static <T> Specification<T> textSearch(String term, String... attributes) {
        if (term == null || term.isBlank()) {
            return null;
        }
        String pattern = "%" + term.trim().toLowerCase(Locale.ROOT) + "%";
        return (root, query, cb) -> cb.or(Arrays.stream(attributes)
            .map(attribute -> cb.like(cb.lower(root.<String>get(attribute)), pattern))
            .toArray(Predicate[]::new));
    }

    public static <T> Specification<T> equal(String attribute, Object value) {
        if (value == null) {
            return null;
        }
        return (root, query, cb) -> cb.equal(root.get(attribute), value);
    }

    public static <T, Y extends Comparable<? super Y>> Specification<T> atLeast(String attribute, Y value) {
        if (value == null) {
            return null;
        }
        return (root, query, cb) -> cb.greaterThanOrEqualTo(root.<Y>get(attribute), value);
    }

    public static <T, Y extends Comparable<? super Y>> Specification<T> atMost(String attribute, Y value) {
        if (value == null) {
            return null;
        }
        return (root, query, cb) -> cb.lessThanOrEqualTo(root.<Y>get(attribute), value);
    }

    /**
     * Strictly-before comparison, used for half-open date windows.
     */
    public static <T, Y extends Comparable<? super Y>> Specification<T> before(String attribute, Y value) {
        if (value == null) {
            return null;
        }
        return (root, query, cb) -> cb.lessThan(root.<Y>get(attribute), value);
    }

    public static <T> Specification<T> in(String attribute, Collection<?> values) {
        if (values == null || values.isEmpty()) {
            return null;
        }
        return (root, query, cb) -> root.get(attribute).in(values);
    }
}
