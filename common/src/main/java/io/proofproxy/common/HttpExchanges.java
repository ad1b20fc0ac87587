package io.proofproxy.common;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import io.proofproxy.model.ErrorCode;
import io.proofproxy.model.ErrorResponse;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Response helpers shared by the proxy and worker HTTP servers.
 */
@Slf4j
public final class HttpExchanges {
    private HttpExchanges() {
    }

    /**
     * Returns false and answers 405 if the request method differs from the expected one.
     */
    public static boolean requireMethod(HttpExchange exchange, String method, ObjectMapper mapper) throws IOException {
        if (method.equals(exchange.getRequestMethod())) {
            return true;
        }
        sendError(exchange, 405, ErrorResponse.of(ErrorCode.INVALID_REQUEST, "Method not allowed"), mapper);
        return false;
    }

    /**
     * Wraps a handler so that an unexpected exception is logged and answered with 500 instead of resetting
     * the connection.
     */
    public static HttpHandler guarded(HttpHandler handler, ObjectMapper mapper) {
        return exchange -> {
            try {
                handler.handle(exchange);
            } catch (RuntimeException e) {
                log.error("Unhandled error serving {} {}", exchange.getRequestMethod(), exchange.getRequestURI(), e);
                try {
                    sendError(exchange, 500, ErrorResponse.of(ErrorCode.INTERNAL_ERROR,
                            "Internal error: " + e.getMessage()), mapper);
                } catch (IOException | RuntimeException sendFailure) {
                    log.debug("Could not send error response: {}", sendFailure.getMessage());
                }
            } finally {
                exchange.close();
            }
        };
    }

    public static void sendJson(HttpExchange exchange, int statusCode, Object body, ObjectMapper mapper) throws IOException {
        sendResponse(exchange, statusCode, mapper.writeValueAsBytes(body));
    }

    public static void sendError(HttpExchange exchange, int statusCode, ErrorResponse error, ObjectMapper mapper)
            throws IOException {
        if (error.getMessage() != null) {
            exchange.getResponseHeaders().set("X-Error-Message", sanitizeHeader(error.getMessage()));
        }
        sendJson(exchange, statusCode, error, mapper);
    }

    public static void sendResponse(HttpExchange exchange, int statusCode, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, body.length == 0 ? -1 : body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    public static void sendResponse(HttpExchange exchange, int statusCode, String body) throws IOException {
        sendResponse(exchange, statusCode, body.getBytes(StandardCharsets.UTF_8));
    }

    private static String sanitizeHeader(String value) {
        return value.replace('\r', ' ').replace('\n', ' ');
    }
}
