package taskclock.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import taskclock.api.Controller;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RouterHandlerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private EmbeddedChannel channel;

    @BeforeEach
    void setup() {
        RouterHandler router = new RouterHandler()
                .registerController(new FixedController("/ok",
                        Controller.ControllerResponse.ok(Map.of("value", "a \"quoted\"\nline"))))
                .registerController(new FailingController());
        channel = new EmbeddedChannel(router);
    }

    @AfterEach
    void teardown() {
        channel.finishAndReleaseAll();
    }

    private FullHttpResponse get(String uri) {
        FullHttpRequest request = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, uri);
        channel.writeInbound(request);
        FullHttpResponse response = channel.readOutbound();
        assertNotNull(response, "no response for " + uri);
        return response;
    }

    private static JsonNode body(FullHttpResponse response) throws Exception {
        try {
            return MAPPER.readTree(response.content().toString(StandardCharsets.UTF_8));
        } finally {
            response.release();
        }
    }

    @Test
    void serializesControllerBody() throws Exception {
        FullHttpResponse response = get("/ok?verbose=1");

        assertEquals(HttpResponseStatus.OK, response.status());
        assertEquals("application/json; charset=utf-8", response.headers().get(HttpHeaderNames.CONTENT_TYPE));
        assertEquals("a \"quoted\"\nline", body(response).get("value").asText());
    }

    @Test
    void unknownPathIsJsonNotFound() throws Exception {
        FullHttpResponse response = get("/missing");

        assertEquals(HttpResponseStatus.NOT_FOUND, response.status());
        assertEquals("not found", body(response).get("error").asText());
    }

    @Test
    void handlerFailureIsJsonServerError() throws Exception {
        FullHttpResponse response = get("/fail");

        assertEquals(HttpResponseStatus.INTERNAL_SERVER_ERROR, response.status());
        assertEquals("java.lang.IllegalStateException: bad \"state\"", body(response).get("error").asText());
    }

    private record FixedController(String path, ControllerResponse response) implements Controller {
        @Override
        public boolean matches(HttpMethod method, String requestPath) {
            return path.equals(requestPath);
        }

        @Override
        public ControllerResponse handle(FullHttpRequest req, String requestPath) {
            return response;
        }
    }

    private static class FailingController implements Controller {
        @Override
        public boolean matches(HttpMethod method, String path) {
            return "/fail".equals(path);
        }

        @Override
        public ControllerResponse handle(FullHttpRequest req, String path) {
            throw new IllegalStateException("bad \"state\"");
        }
    }
}
