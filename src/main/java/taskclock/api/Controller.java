package taskclock.api;

import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

/**
 * A read-only HTTP endpoint. The router asks each registered controller in
 * turn whether it {@link #matches} a request and serializes the body of the
 * first one's {@link ControllerResponse} as JSON.
 */
public interface Controller {

    /**
     * @param path request path without query string
     */
    boolean matches(HttpMethod method, String path);

    ControllerResponse handle(FullHttpRequest req, String path);

    /**
     * Status plus a body object for the router to write as JSON.
     */
    record ControllerResponse(HttpResponseStatus status, Object body) {

        public static ControllerResponse ok(Object body) {
            return new ControllerResponse(HttpResponseStatus.OK, body);
        }

        public static ControllerResponse notFound(String message) {
            return new ControllerResponse(HttpResponseStatus.NOT_FOUND, new ErrorBody(message));
        }
    }

    /** {@code {"error": "..."}}. */
    record ErrorBody(String error) {
    }
}
