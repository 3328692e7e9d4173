package io.github.clickin.flatquery.servlet;

import io.github.clickin.flatquery.core.FlatQuery;
import io.github.clickin.flatquery.core.FlatQueryException;
import io.github.clickin.flatquery.core.Shape;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;

/**
 * HttpServlet that decodes the query string before handing the request to {@link #handle}.
 *
 * <p>A query that does not decode is answered with {@code 400 Bad Request}, the failure message in
 * the {@code X-Error} header and as a plain-text body; {@link #handle} is not called.
 */
public abstract class QueryServlet<T> extends HttpServlet {
    private static final Logger LOG = LoggerFactory.getLogger(QueryServlet.class);

    public static final String H_ERROR = "X-Error";

    private final transient Shape<T> shape;
    private final transient FlatQuery codec;

    protected QueryServlet(Shape<T> shape, FlatQuery codec) {
        this.shape = Objects.requireNonNull(shape, "shape");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    @Override
    protected void service(HttpServletRequest req, HttpServletResponse resp) throws ServletException, IOException {
        Query<T> query;
        try {
            query = Query.from(req, shape, codec);
        } catch (FlatQueryException e) {
            LOG.debug("Rejecting query for {}: {}", req.getRequestURI(), e.toString());
            badRequest(resp, e);
            return;
        }
        handle(query.value(), req, resp);
    }

    /**
     * Handles a request whose query decoded into {@code query}.
     */
    protected abstract void handle(T query, HttpServletRequest req, HttpServletResponse resp)
            throws ServletException, IOException;

    private static void badRequest(HttpServletResponse resp, FlatQueryException e) throws IOException {
        String message = e.key() == null ? e.getMessage() : e.getMessage() + ": " + e.key();
        resp.setStatus(HttpServletResponse.SC_BAD_REQUEST);
        resp.setHeader(H_ERROR, message);
        resp.setContentType("text/plain; charset=utf-8");
        resp.getWriter().write(message);
    }
}
