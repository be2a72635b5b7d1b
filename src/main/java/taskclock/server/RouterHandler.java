package taskclock.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskclock.api.Controller;
import taskclock.api.Controller.ControllerResponse;
import taskclock.api.Controller.ErrorBody;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Central router that dispatches HTTP requests to registered controllers and
 * writes their responses as JSON. Unmatched requests get a 404, handler
 * failures a 500, both with an {@code error} field.
 *
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndRegisterModules();

    private final List<Controller> controllers = new CopyOnWriteArrayList<>();

    /**
     * Register a controller to handle requests.
     * Controllers are checked in order of registration.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        HttpMethod method = req.method();

        // Extract path without query string
        String path = uri.contains("?") ? uri.substring(0, uri.indexOf("?")) : uri;

        ControllerResponse response;
        try {
            response = route(req, method, path);
        } catch (RuntimeException e) {
            log.error("Handler error: {} {}", method, path, e);
            response = new ControllerResponse(INTERNAL_SERVER_ERROR, new ErrorBody(e.toString()));
        }
        write(ctx, response);
    }

    private ControllerResponse route(FullHttpRequest req, HttpMethod method, String path) {
        for (Controller controller : controllers) {
            if (controller.matches(method, path)) {
                return controller.handle(req, path);
            }
        }
        log.debug("No handler for: {} {}", method, path);
        return ControllerResponse.notFound("not found");
    }

    private void write(ChannelHandlerContext ctx, ControllerResponse response) {
        HttpResponseStatus status = response.status();
        byte[] bytes;
        try {
            bytes = MAPPER.writeValueAsBytes(response.body());
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} response", status, e);
            status = INTERNAL_SERVER_ERROR;
            bytes = "{\"error\":\"failed to serialize response\"}".getBytes(StandardCharsets.UTF_8);
        }
        FullHttpResponse httpResponse = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
        httpResponse.headers().set(CONTENT_TYPE, "application/json; charset=utf-8");
        httpResponse.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
        ctx.writeAndFlush(httpResponse);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        ctx.close();
    }
}
