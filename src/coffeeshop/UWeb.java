package coffeeshop;

import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.HttpString;

import java.io.*;
import java.net.InetSocketAddress;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Undertow alternative to the JDK server in {@link Web}.
 */
public class UWeb {
    private static final Logger log = Logger.getLogger(UWeb.class.getName());

    static class UServer implements Closeable {
        private final Undertow undertow;
        private final Web.Handler handler;
        private final String contextPath;
        private final boolean verbose;

        UServer(String host, int port, String contextPath, Web.Handler handler, int workerThreads, boolean verbose) {
            this.handler = handler;
            this.contextPath = contextPath;
            this.verbose = verbose;
            undertow = Undertow.builder()
                    .setHandler(new BlockingHandler(this::dispatch))
                    .setWorkerThreads(workerThreads)
                    .addHttpListener(port, host == null ? "0.0.0.0" : host)
                    .build();
        }

        private void dispatch(HttpServerExchange exchange) throws IOException {
            URequest request = new URequest(exchange, contextPath);
            Web.Response response;
            if (!request.path().startsWith(contextPath)) {
                response = Web.notFound();
            } else {
                response = Web.dispatch(handler, request);
            }
            if (verbose) {
                log.info(request.method() + " " + request.path() + " " + response.getStatus());
            }
            sendResponse(exchange, response);
        }

        private void sendResponse(HttpServerExchange exchange, Web.Response response) throws IOException {
            exchange.setStatusCode(response.getStatus());
            response.getHeaders().forEach((name, values) -> {
                for (String value : values) {
                    exchange.getResponseHeaders().add(HttpString.tryFromString(name), value);
                }
            });
            exchange.setResponseContentLength(response.getBodyLength());
            OutputStream outputStream = exchange.getOutputStream();
            response.getBodyWriter().stream(outputStream);
            outputStream.close();
        }

        public void start() {
            undertow.start();
        }

        public void close() {
            undertow.stop();
        }

        public int port() {
            return ((InetSocketAddress)undertow.getListenerInfo().get(0).getAddress()).getPort();
        }
    }

    static class URequest implements Web.Request {
        private final HttpServerExchange exchange;
        private final Map<String, String> params = new HashMap<>();
        private final String contextPath;

        URequest(HttpServerExchange exchange, String contextPath) {
            this.exchange = exchange;
            this.contextPath = contextPath;
        }

        @Override
        public String method() {
            return exchange.getRequestMethod().toString();
        }

        @Override
        public String path() {
            return exchange.getRequestPath();
        }

        @Override
        public String contextPath() {
            return contextPath;
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
            return exchange.getInputStream();
        }
    }
}
