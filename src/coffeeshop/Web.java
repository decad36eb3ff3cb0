package coffeeshop;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import coffeeshop.auth.AuthException;
import coffeeshop.auth.Authorizer;
import coffeeshop.auth.Claims;

import java.io.*;
import java.net.InetSocketAddress;
import java.util.*;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static coffeeshop.Json.JSON_MAPPER;
import static java.nio.charset.StandardCharsets.UTF_8;

class Web {
    private static final Logger log = Logger.getLogger(Web.class.getName());

    interface Handler {
        Response handle(Request request) throws Exception;
    }

    /**
     * A handler that only runs once the caller's token has been verified.
     */
    interface ProtectedHandler {
        Response handle(Request request, Claims claims) throws Exception;
    }

    enum Method {
        GET, POST, PATCH, DELETE, OPTIONS
    }

    public static class Status {
        public static final int OK = 200, NO_CONTENT = 204,
                BAD_REQUEST = 400, UNAUTHORIZED = 401, FORBIDDEN = 403, NOT_FOUND = 404,
                METHOD_NOT_ALLOWED = 405, UNPROCESSABLE_ENTITY = 422,
                INTERNAL_ERROR = 500;
    }

    interface IStreamer {
        void stream(OutputStream out) throws IOException;
    }

    public static class Response {
        private final int status;
        private final Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private final byte[] body;

        public Response(int status, String mime, String body) {
            this.status = status;
            this.body = body.getBytes(UTF_8);
            if (mime != null) addHeader("Content-Type", mime);
        }

        public void addHeader(String name, String value) {
            headers.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
        }

        public int getStatus() {
            return status;
        }

        public Map<String, List<String>> getHeaders() {
            return headers;
        }

        public long getBodyLength() {
            return body.length;
        }

        public IStreamer getBodyWriter() {
            return out -> out.write(body);
        }
    }

    /**
     * Adapts the JDK's built-in HTTP server to our {@link Handler}.
     */
    static class SHandler implements HttpHandler {
        private final Handler handler;
        private final boolean verbose;

        SHandler(Handler handler, boolean verbose) {
            this.handler = handler;
            this.verbose = verbose;
        }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            try {
                SRequest request = new SRequest(exchange);
                Response response = dispatch(handler, request);
                if (verbose) {
                    log.info(request.method() + " " + request.path() + " " + response.getStatus());
                }
                exchange.getResponseHeaders().putAll(response.headers);
                exchange.sendResponseHeaders(response.status, response.getBodyLength() == 0 ? -1 : response.getBodyLength());
                response.getBodyWriter().stream(exchange.getResponseBody());
            } finally {
                exchange.close();
            }
        }
    }

    static class Server implements Closeable {
        private final HttpServer httpServer;

        Server(String host, int port, String contextPath, Handler handler, Executor executor, boolean verbose) throws IOException {
            InetSocketAddress address = host == null ? new InetSocketAddress(port) : new InetSocketAddress(host, port);
            httpServer = HttpServer.create(address, 0);
            httpServer.createContext(contextPath.isEmpty() ? "/" : contextPath, new SHandler(handler, verbose));
            httpServer.setExecutor(executor);
        }

        public void start() {
            httpServer.start();
        }

        public int port() {
            return httpServer.getAddress().getPort();
        }

        @Override
        public void close() {
            httpServer.stop(0);
        }
    }

    /**
     * Runs a handler and turns any failure into a JSON error response.
     * Shared by both server implementations.
     */
    static Response dispatch(Handler handler, Request request) {
        try {
            return handler.handle(request);
        } catch (ResponseException e) {
            return e.response;
        } catch (AuthException e) {
            return errorResponse(e.statusCode(), e.getMessage());
        } catch (Exception e) {
            log.log(Level.SEVERE, "Error handling " + request.method() + " " + request.path(), e);
            return errorResponse(Status.INTERNAL_ERROR, "internal server error");
        }
    }

    static class SRequest implements Request {
        private final HttpExchange exchange;
        private final Map<String, String> params = new HashMap<>();

        SRequest(HttpExchange exchange) {
            this.exchange = exchange;
        }

        @Override
        public String method() {
            return exchange.getRequestMethod();
        }

        @Override
        public String path() {
            return exchange.getRequestURI().getPath();
        }

        @Override
        public String contextPath() {
            String contextPath = exchange.getHttpContext().getPath();
            return contextPath.equals("/") ? "" : contextPath;
        }

        @Override
        public Map<String, String> params() {
            return params;
        }

        @Override
        public String header(String name) {
            return exchange.getRequestHeaders().getFirst(name);
        }

        @Override
        public InputStream inputStream() {
            return exchange.getRequestBody();
        }
    }

    public static class ResponseException extends Exception {
        final Response response;

        ResponseException(Response response) {
            this.response = response;
        }
    }

    static Response jsonResponse(Object data) throws JsonProcessingException {
        return jsonResponse(Status.OK, data);
    }

    static Response jsonResponse(int status, Object data) throws JsonProcessingException {
        Response response = new Response(status, "application/json", JSON_MAPPER.writeValueAsString(data));
        response.addHeader("Access-Control-Allow-Origin", "*");
        return response;
    }

    /**
     * The error body every failure is rendered as:
     * {@code {"success": false, "error": status, "message": message}}.
     */
    static Response errorResponse(int status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", status);
        body.put("message", message);
        try {
            return jsonResponse(status, body);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    static Response notFound() {
        return errorResponse(Status.NOT_FOUND, "resource not found");
    }

    static Response badRequest() {
        return errorResponse(Status.BAD_REQUEST, "bad request");
    }

    static Response unprocessable() {
        return errorResponse(Status.UNPROCESSABLE_ENTITY, "unprocessable");
    }

    static class Router implements Handler {
        private final List<Route> routes = new ArrayList<>();
        private final Authorizer authorizer;

        Router(Authorizer authorizer) {
            this.authorizer = authorizer;
        }

        @Override
        public Response handle(Request request) throws Exception {
            Set<String> allowed = new LinkedHashSet<>();
            for (Route route : routes) {
                Matcher match = route.match(request);
                if (match == null) continue;
                if (route.accepts(request)) {
                    return route.handle(request, match, authorizer);
                }
                allowed.add(route.method.name());
            }
            if (allowed.isEmpty()) {
                return Web.notFound();
            }
            if (request.method().equalsIgnoreCase(Method.OPTIONS.name())) {
                return preflight(allowed);
            }
            return errorResponse(Status.METHOD_NOT_ALLOWED, "method not allowed");
        }

        /**
         * CORS preflight. Not authorized, as preflights carry no credentials.
         */
        private static Response preflight(Set<String> allowed) {
            allowed.add(Method.OPTIONS.name());
            Response response = new Response(Status.NO_CONTENT, null, "");
            response.addHeader("Access-Control-Allow-Origin", "*");
            response.addHeader("Access-Control-Allow-Methods", String.join(", ", allowed));
            response.addHeader("Access-Control-Allow-Headers", "Authorization, Content-Type");
            return response;
        }

        public Router on(Method method, String pathPattern, Handler handler) {
            routes.add(new Route(method, pathPattern, (request, claims) -> handler.handle(request), null));
            return this;
        }

        /**
         * Registers a route that requires {@code permission}. The caller's bearer
         * token is extracted and verified before the handler is invoked.
         */
        public Router on(Method method, String pathPattern, ProtectedHandler handler, String permission) {
            Objects.requireNonNull(permission, "permission");
            routes.add(new Route(method, pathPattern, handler, permission));
            return this;
        }
    }

    private static class Route {
        private final static Pattern KEY_PATTERN = Pattern.compile("<([a-z_][a-zA-Z0-9_]*)(?::([^>]*))?>");

        private final Method method;
        private final ProtectedHandler handler;
        private final String pattern;
        private final Pattern re;
        private final List<String> keys = new ArrayList<>();
        private final String permission;

        Route(Method method, String pattern, ProtectedHandler handler, String permission) {
            this.method = method;
            this.handler = handler;
            this.pattern = pattern;
            this.permission = permission;
            this.re = compile();
        }

        private Pattern compile() {
            StringBuilder out = new StringBuilder();
            Matcher m = KEY_PATTERN.matcher(pattern);
            int pos = 0;
            while (m.find(pos)) {
                String key = m.group(1);
                String regex = m.group(2);
                if (regex == null) {
                    regex = "[^/,;?]+";
                }

                out.append(Pattern.quote(pattern.substring(pos, m.start())));
                out.append('(').append(regex).append(')');

                keys.add(key);
                pos = m.end();
            }

            out.append(Pattern.quote(pattern.substring(pos)));
            return Pattern.compile(out.toString());
        }

        Matcher match(Request request) {
            Matcher match = re.matcher(request.relativePath());
            return match.matches() ? match : null;
        }

        boolean accepts(Request request) {
            return method == null || request.method().equalsIgnoreCase(method.name());
        }

        Response handle(Request request, Matcher match, Authorizer authorizer) throws Exception {
            Claims claims = null;
            if (permission != null) {
                claims = authorizer.authorize(request.header("Authorization"), permission);
            }

            for (int i = 0; i < match.groupCount(); i++) {
                request.params().put(keys.get(i), match.group(i + 1));
            }

            return handler.handle(request, claims);
        }

        @Override
        public String toString() {
            return method + " " + pattern;
        }
    }

    public interface Request {
        String method();

        /**
         * The full request path including the context path.
         */
        String path();

        /**
         * The request path relative to the context path.
         */
        default String relativePath() {
            return path().substring(contextPath().length());
        }

        String contextPath();

        /**
         * Path parameters captured by the matched route.
         */
        Map<String, String> params();

        String header(String name);

        InputStream inputStream();

        default String param(String name) {
            return params().get(name);
        }
    }
}
