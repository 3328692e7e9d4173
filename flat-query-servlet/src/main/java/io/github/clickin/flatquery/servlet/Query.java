package io.github.clickin.flatquery.servlet;

import io.github.clickin.flatquery.core.FlatQuery;
import io.github.clickin.flatquery.core.FlatQueryException;
import io.github.clickin.flatquery.core.Shape;
import jakarta.servlet.http.HttpServletRequest;

import java.util.Objects;

/**
 * Value decoded from the query component of a request.
 *
 * @param value the decoded value
 */
public record Query<T>(T value) {

    public Query {
        Objects.requireNonNull(value, "value");
    }

    /**
     * Decodes the raw query string of {@code req}. A request without a query string decodes the
     * empty text. No percent-decoding is applied.
     *
     * @throws FlatQueryException if the query does not decode into {@code shape}
     */
    public static <T> Query<T> from(HttpServletRequest req, Shape<T> shape, FlatQuery codec) {
        Objects.requireNonNull(req, "req");
        String raw = req.getQueryString();
        return new Query<>(codec.decode(shape, raw == null ? "" : raw));
    }
}
