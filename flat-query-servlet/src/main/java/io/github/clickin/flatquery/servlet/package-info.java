/**
 * Jakarta Servlet binding for flat-query.
 *
 * <p>{@link io.github.clickin.flatquery.servlet.QueryServlet} decodes the raw query string of each
 * request and rejects undecodable ones with {@code 400}; {@link io.github.clickin.flatquery.servlet.FormResponse}
 * writes encoded values back as form bodies.
 */
package io.github.clickin.flatquery.servlet;
