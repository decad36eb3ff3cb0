package coffeeshop;

import coffeeshop.auth.AuthConfig;
import coffeeshop.auth.Authorizer;
import coffeeshop.auth.JwksCache;
import coffeeshop.auth.NullAuthorizer;
import com.nimbusds.jose.JWSAlgorithm;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

public class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    public static void usage() {
        System.err.println("Usage: java " + Main.class.getName() + " [options...]");
        System.err.println();
        System.err.println("  -a, --auth-domain domain  Identity provider domain (env AUTH_DOMAIN)");
        System.err.println("  --audience audience       Expected token audience (env API_AUDIENCE)");
        System.err.println("  --algorithms RS256,...    Accepted token signing algorithms (env ALGORITHMS, default RS256)");
        System.err.println("  --jwks-ttl secs           How long to cache the provider's signing keys (default " + JwksCache.DEFAULT_TTL.getSeconds() + ")");
        System.err.println("  --jwks-timeout millis     Connect and read timeout for fetching signing keys (default " + JwksCache.DEFAULT_TIMEOUT_MILLIS + ")");
        System.err.println("  -b bindaddr               Bind to a particular IP address");
        System.err.println("  -c, --context-path url-prefix");
        System.err.println("                            Set a URL prefix for the application to be mounted under");
        System.err.println("  -d datadir                Directory to store the drinks database under");
        System.err.println("  -p port                   Local port to listen on (default 5000)");
        System.err.println("  --reset                   Drop all drinks and recreate the database on start-up");
        System.err.println("  -t count                  Number of web server threads");
        System.err.println("  -u                        Use the Undertow web server");
        System.err.println("  -v                        Verbose logging");
        System.err.println();
        System.err.println("Without an auth domain every request is allowed. Don't do that in production.");
        System.exit(1);
    }

    public static void main(String[] args) {
        boolean undertow = false;
        String host = null;
        int port = 5000;
        String contextPath = "";
        int webThreads = Runtime.getRuntime().availableProcessors();
        File dataPath = new File("data");
        boolean verbose = false;
        boolean reset = false;
        String authDomain = System.getenv("AUTH_DOMAIN");
        String audience = System.getenv("API_AUDIENCE");
        String algorithms = System.getenv("ALGORITHMS");
        Duration jwksTtl = null;
        Integer jwksTimeout = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "-a":
                case "--auth-domain":
                    authDomain = args[++i];
                    break;
                case "--audience":
                    audience = args[++i];
                    break;
                case "--algorithms":
                    algorithms = args[++i];
                    break;
                case "--jwks-ttl":
                    jwksTtl = Duration.ofSeconds(Long.parseLong(args[++i]));
                    break;
                case "--jwks-timeout":
                    jwksTimeout = Integer.parseInt(args[++i]);
                    break;
                case "-u":
                    undertow = true;
                    break;
                case "-p":
                    port = Integer.parseInt(args[++i]);
                    break;
                case "-b":
                    host = args[++i];
                    break;
                case "-c":
                case "--context-path":
                    contextPath = args[++i].replaceFirst("/+$", "");
                    if (!contextPath.startsWith("/")) {
                        throw new IllegalArgumentException("context path (-c) must start with /");
                    }
                    break;
                case "-d":
                    dataPath = new File(args[++i]);
                    break;
                case "--reset":
                    reset = true;
                    break;
                case "-v":
                    verbose = true;
                    break;
                case "-t":
                    webThreads = Integer.parseInt(args[++i]);
                    break;
                default:
                    usage();
                    break;
            }
        }

        Authorizer authorizer;
        if (authDomain == null || authDomain.isEmpty()) {
            log.warning("No auth domain configured: all requests will be allowed");
            authorizer = new NullAuthorizer();
        } else {
            Set<JWSAlgorithm> accepted = AuthConfig.parseAlgorithms(algorithms == null ? "RS256" : algorithms);
            AuthConfig authConfig = new AuthConfig(authDomain, audience, accepted);
            if (jwksTtl != null) authConfig.setJwksTtl(jwksTtl);
            if (jwksTimeout != null) authConfig.setJwksTimeoutMillis(jwksTimeout);
            authorizer = authConfig.toAuthorizer();
            log.info("Verifying tokens issued by " + authConfig.issuer() + " for audience " + authConfig.getAudience());
        }

        try (DataStore dataStore = new DataStore(dataPath)) {
            if (reset) {
                log.info("Resetting drinks database in " + dataPath);
                dataStore.reset();
            }
            Webapp controller = new Webapp(dataStore, authorizer);
            if (undertow) {
                UWeb.UServer server = new UWeb.UServer(host, port, contextPath, controller, webThreads, verbose);
                server.start();
                Runtime.getRuntime().addShutdownHook(new Thread(server::close));
                System.out.println("Coffee shop http://" + (host == null ? "localhost" : host) + ":" + port + contextPath);
                synchronized (Main.class) {
                    Main.class.wait();
                }
            } else {
                ExecutorService threadPool = Executors.newFixedThreadPool(webThreads);
                try (Web.Server server = new Web.Server(host, port, contextPath, controller, threadPool, verbose)) {
                    server.start();
                    Runtime.getRuntime().addShutdownHook(new Thread(server::close));
                    System.out.println("Coffee shop http://" + (host == null ? "localhost" : host) + ":" + port + contextPath);
                    synchronized (Main.class) {
                        Main.class.wait();
                    }
                } finally {
                    threadPool.shutdown();
                }
            }
        } catch (InterruptedException | IOException e) {
            log.log(Level.SEVERE, "Server failed", e);
            System.exit(1);
        }
    }
}
