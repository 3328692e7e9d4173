package io.github.clickin.flatquery.servlet;

import io.github.clickin.flatquery.core.FlatQuery;
import io.github.clickin.flatquery.core.Shape;
import jakarta.servlet.http.HttpServletResponse;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Writes encoded values as form response bodies.
 */
public final class FormResponse {
    public static final String CT_FORM = "application/x-www-form-urlencoded";

    private FormResponse() {}

    public static <T> void write(HttpServletResponse resp, Shape<T> shape, T value, FlatQuery codec) throws IOException {
        byte[] body = codec.encode(shape, value).getBytes(StandardCharsets.UTF_8);
        resp.setContentType(CT_FORM);
        resp.setContentLength(body.length);
        resp.getOutputStream().write(body);
    }
}
