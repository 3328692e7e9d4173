package io.github.clickin.flatquery.servlet;

import io.github.clickin.flatquery.core.Field;
import io.github.clickin.flatquery.core.FlatQuery;
import io.github.clickin.flatquery.core.FlatQueryException;
import io.github.clickin.flatquery.core.RecordShape;
import io.github.clickin.flatquery.core.Scalars;
import io.github.clickin.flatquery.core.Shape;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryServletTest {

    record Search(String q, Optional<Integer> page, List<String> tags) {
        static final Field<Search, String> Q = Field.of("q", Scalars.STRING, Search::q);
        static final Field<Search, Optional<Integer>> PAGE = Field.of("page", Shape.optional(Scalars.I32), Search::page);
        static final Field<Search, List<String>> TAGS = Field.of("tag", Shape.repeated(Scalars.STRING), Search::tags);

        static final RecordShape<Search> SHAPE = RecordShape.<Search>builder("Search")
                .field(Q)
                .field(PAGE)
                .field(TAGS)
                .build(v -> new Search(v.get(Q), v.get(PAGE), v.get(TAGS)));
    }

    private final FlatQuery codec = FlatQuery.defaults();

    @Test
    void decodedQueryReachesHandler() throws Exception {
        RecordingServlet servlet = new RecordingServlet(codec);
        ServletFakes.RecordedResponse resp = new ServletFakes.RecordedResponse();

        servlet.service(ServletFakes.request("tag=a&q=java&tag=b"), resp.proxy());

        assertThat(servlet.seen.get()).isEqualTo(new Search("java", Optional.empty(), List.of("a", "b")));
        assertThat(resp.status).isEqualTo(200);
        assertThat(resp.body()).isEqualTo("q=java&tag=a&tag=b");
        assertThat(resp.contentType).isEqualTo(FormResponse.CT_FORM);
        assertThat(resp.contentLength).isEqualTo("q=java&tag=a&tag=b".length());
    }

    @Test
    void undecodableQueryIsBadRequest() throws Exception {
        RecordingServlet servlet = new RecordingServlet(codec);
        ServletFakes.RecordedResponse resp = new ServletFakes.RecordedResponse();

        servlet.service(ServletFakes.request("q=java&page=two"), resp.proxy());

        assertThat(servlet.seen.get()).isNull();
        assertThat(resp.status).isEqualTo(400);
        assertThat(resp.headers).containsEntry(QueryServlet.H_ERROR, "invalid i32 literal: page");
        assertThat(resp.body()).isEqualTo("invalid i32 literal: page");
    }

    @Test
    void malformedPairIsBadRequest() throws Exception {
        RecordingServlet servlet = new RecordingServlet(codec);
        ServletFakes.RecordedResponse resp = new ServletFakes.RecordedResponse();

        servlet.service(ServletFakes.request("q=a=b"), resp.proxy());

        assertThat(resp.status).isEqualTo(400);
        assertThat(resp.headers.get(QueryServlet.H_ERROR)).startsWith("invalid pair");
    }

    @Test
    void missingQueryStringDecodesEmptyText() throws Exception {
        RecordingServlet servlet = new RecordingServlet(codec);
        ServletFakes.RecordedResponse resp = new ServletFakes.RecordedResponse();

        servlet.service(ServletFakes.request(null), resp.proxy());

        assertThat(resp.status).isEqualTo(400);
        assertThat(resp.headers).containsEntry(QueryServlet.H_ERROR, "no value: q");
    }

    @Test
    void queryFromRequestDoesNotPercentDecode() {
        Query<Search> query = Query.from(ServletFakes.request("q=a%20b"), Search.SHAPE, codec);

        assertThat(query.value().q()).isEqualTo("a%20b");
    }

    @Test
    void queryFromRequestPropagatesFailure() {
        assertThatThrownBy(() -> Query.from(ServletFakes.request("page=1"), Search.SHAPE, codec))
                .isInstanceOf(FlatQueryException.MissingValue.class);
    }

    private static final class RecordingServlet extends QueryServlet<Search> {
        private final AtomicReference<Search> seen = new AtomicReference<>();
        private final transient FlatQuery codec;

        RecordingServlet(FlatQuery codec) {
            super(Search.SHAPE, codec);
            this.codec = codec;
        }

        @Override
        protected void handle(Search query, HttpServletRequest req, HttpServletResponse resp) throws java.io.IOException {
            seen.set(query);
            FormResponse.write(resp, Search.SHAPE, query, codec);
        }
    }
}
