package io.routecontract.core.interceptor;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.routecontract.core.SampleApi;
import io.routecontract.core.doc.DocumentationCompiler;
import io.routecontract.core.model.ApiRequest;
import io.routecontract.core.model.Exchange;
import io.routecontract.core.model.HttpMethod;
import io.routecontract.core.route.InterceptorChain;
import io.routecontract.core.route.Route;
import io.routecontract.core.route.RouteTable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/**
 * Log entries emitted while compiling routes and rejecting exchanges.
 */
@DisplayName("ContractLoggingTest")
class ContractLoggingTest {

    private ListAppender<ILoggingEvent> appender;
    private Logger compilerLogger;
    private Logger coercionLogger;
    private Level coercionLevel;

    @BeforeEach
    void setUp() {
        appender = new ListAppender<>();
        appender.start();
        compilerLogger = (Logger) LoggerFactory.getLogger(DocumentationCompiler.class);
        coercionLogger = (Logger) LoggerFactory.getLogger(CoerceRequestInterceptor.class);
        coercionLevel = coercionLogger.getLevel();
        coercionLogger.setLevel(Level.DEBUG);
        compilerLogger.addAppender(appender);
        coercionLogger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        compilerLogger.detachAppender(appender);
        coercionLogger.detachAppender(appender);
        coercionLogger.setLevel(coercionLevel);
        appender.stop();
    }

    @Test
    @DisplayName("compilation logs a summary at INFO")
    void compilationSummary() {
        DocumentationCompiler.inject(SampleApi.tree(), SampleApi.INFO);

        assertThat(appender.list)
                .filteredOn(event -> event.getLevel() == Level.INFO)
                .extracting(ILoggingEvent::getFormattedMessage)
                .containsExactly("Compiled 5 route(s), 3 documented operation(s) across 2 path(s) for 'Test' 0.1");
    }

    @Test
    @DisplayName("rejected request logs the route and the error tree at DEBUG")
    void rejectionIsLogged() {
        RouteTable table = DocumentationCompiler.inject(SampleApi.tree(), SampleApi.INFO);
        Route route = table.find(HttpMethod.GET, "/").orElseThrow();
        ApiRequest request = ApiRequest.builder(HttpMethod.GET, "/")
                .headers(JsonNodeFactory.instance.objectNode().put("auth", "y"))
                .build();
        appender.list.clear();

        InterceptorChain.execute(new Exchange(route, table.document(), request));

        assertThat(appender.list)
                .filteredOn(event -> event.getLevel() == Level.DEBUG)
                .extracting(ILoggingEvent::getFormattedMessage)
                .singleElement()
                .asString()
                .startsWith("Request for route 'get-handler' rejected:")
                .contains("missing-required-key");
    }
}
