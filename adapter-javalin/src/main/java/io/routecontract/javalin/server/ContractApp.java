package io.routecontract.javalin.server;

import io.javalin.Javalin;
import io.javalin.http.HandlerType;
import io.routecontract.core.doc.DocumentationCompiler;
import io.routecontract.core.doc.OpenApiWriter;
import io.routecontract.core.route.Route;
import io.routecontract.core.route.RouteTable;
import io.routecontract.core.route.RouteTree;
import io.routecontract.javalin.config.ConfigLoader;
import io.routecontract.javalin.config.ServiceConfig;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hosts a compiled {@link RouteTree} on a Javalin server.
 *
 * <p>
 * Lifecycle:
 * <ol>
 * <li>Load configuration from YAML plus env overlay (when started from
 * arguments)</li>
 * <li>Configure Logback</li>
 * <li>Build and compile the route tree into a {@link RouteTable}</li>
 * <li>Register the health endpoint and one Javalin handler per route</li>
 * <li>Start the server</li>
 * </ol>
 *
 * <p>
 * The route table is built before the server starts and never changes.
 */
public final class ContractApp {

    private static final Logger LOG = LoggerFactory.getLogger(ContractApp.class);

    private final Javalin app;
    private final RouteTable routes;
    private final ServiceConfig config;

    private ContractApp(Javalin app, RouteTable routes, ServiceConfig config) {
        this.app = app;
        this.routes = routes;
        this.config = config;
    }

    /**
     * Loads configuration from {@code --config} (default
     * {@code route-contract.yaml}), configures logging and starts serving the
     * tree built by {@code routes}.
     *
     * @param args   command-line arguments
     * @param routes builds the route tree from the loaded configuration
     */
    public static ContractApp start(String[] args, Function<ServiceConfig, RouteTree> routes) {
        Path configPath = ConfigLoader.resolveConfigPath(args);
        ServiceConfig config = ConfigLoader.load(configPath);
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        LOG.info("Configuration loaded from {}", configPath);
        return start(config, routes.apply(config));
    }

    /**
     * Compiles {@code tree} and starts serving it.
     *
     * @throws io.routecontract.core.error.ContractDefinitionException if the
     *         tree is malformed
     */
    public static ContractApp start(ServiceConfig config, RouteTree tree) {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(tree, "tree must not be null");
        long startTime = System.nanoTime();

        RouteTable table = DocumentationCompiler.inject(tree, config.apiInfo());

        Javalin app = Javalin.create();
        if (config.healthEnabled()) {
            app.get(config.healthPath(), new HealthHandler());
        }
        for (Route route : table.routes()) {
            app.addHttpHandler(
                    HandlerType.valueOf(route.method().name()),
                    OpenApiWriter.toOpenApiPath(route.path()),
                    new ExchangeHandler(route, table.document()));
            LOG.debug("Registered {}", route);
        }

        app.start(config.serverHost(), config.serverPort());

        long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
        LOG.info(
                "route-contract started: host={}, port={}, routes={}, documented={}, startupMs={}",
                config.serverHost(),
                app.port(),
                table.routes().size(),
                table.document().operationCount(),
                elapsedMs);

        return new ContractApp(app, table, config);
    }

    /** Returns the port the server is listening on. */
    public int port() {
        return app.port();
    }

    public Javalin javalin() {
        return app;
    }

    /** Returns the compiled routes and document. */
    public RouteTable routes() {
        return routes;
    }

    public ServiceConfig config() {
        return config;
    }

    public void stop() {
        app.stop();
        LOG.info("route-contract stopped");
    }
}
