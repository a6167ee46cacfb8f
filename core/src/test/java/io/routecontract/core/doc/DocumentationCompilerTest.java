package io.routecontract.core.doc;

import static org.assertj.core.api.Assertions.assertThat;

import io.routecontract.core.SampleApi;
import io.routecontract.core.contract.Contract;
import io.routecontract.core.contract.ResponseSpec;
import io.routecontract.core.model.HttpMethod;
import io.routecontract.core.route.Route;
import io.routecontract.core.route.RouteTable;
import io.routecontract.core.route.RouteTree;
import java.util.Map;
import java.util.SortedMap;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("DocumentationCompiler")
class DocumentationCompilerTest {

    private static final Contract ROOT_GET = Contract.builder()
            .consumes("application/json")
            .description("Requires auth as header")
            .summary("Get all resources")
            .query(SampleApi.Q_QUERY)
            .headers(SampleApi.AUTH_HEADERS)
            .response(200, SampleApi.STATUS_BODY)
            .response(400, ResponseSpec.empty())
            .response(422, ResponseSpec.empty())
            .response(500, ResponseSpec.empty())
            .defaultResponse(ResponseSpec.body(SampleApi.RESULT_BODY).withHeaders(SampleApi.LOCATION_HEADERS))
            .build();

    private static final Contract PUT = Contract.builder()
            .consumes("application/json")
            .description("Requires id on path")
            .summary("Put resource with id")
            .path(SampleApi.ID_PATH)
            .headers(SampleApi.AUTH_HEADERS)
            .body(SampleApi.NAME_BODY)
            .response(400, ResponseSpec.empty())
            .response(422, ResponseSpec.empty())
            .response(500, ResponseSpec.empty())
            .build();

    private static final Contract DELETE = Contract.builder()
            .consumes("application/json")
            .description("Requires id on path")
            .summary("Delete resource with id")
            .path(SampleApi.ID_PATH)
            .headers(SampleApi.AUTH_HEADERS)
            .query(SampleApi.NOTIFY_QUERY)
            .response(400, ResponseSpec.empty())
            .response(422, ResponseSpec.empty())
            .response(500, ResponseSpec.empty())
            .build();

    @Nested
    @DisplayName("generatePaths")
    class GeneratePaths {

        @Test
        @DisplayName("documents annotated handlers with their merged contracts")
        void mergedContracts() {
            SortedMap<String, Map<HttpMethod, Contract>> paths = DocumentationCompiler.generatePaths(SampleApi.tree());

            assertThat(paths).containsOnlyKeys("/", "/x/:id");
            assertThat(paths.get("/")).containsOnly(Map.entry(HttpMethod.GET, ROOT_GET));
            assertThat(paths.get("/x/:id"))
                    .containsOnly(Map.entry(HttpMethod.PUT, PUT), Map.entry(HttpMethod.DELETE, DELETE));
        }

        @Test
        @DisplayName("undocumented handlers and the documentation endpoint are left out")
        void undocumentedOmitted() {
            SortedMap<String, Map<HttpMethod, Contract>> paths = DocumentationCompiler.generatePaths(SampleApi.tree());

            assertThat(paths.get("/x/:id")).doesNotContainKey(HttpMethod.HEAD);
            assertThat(paths).doesNotContainKey("/doc");
        }
    }

    @Nested
    @DisplayName("compile and inject")
    class CompileAndInject {

        @Test
        @DisplayName("compiling the same tree twice yields equal documents")
        void idempotent() {
            RouteTree tree = SampleApi.tree();

            assertThat(DocumentationCompiler.compile(tree, SampleApi.INFO))
                    .isEqualTo(DocumentationCompiler.compile(tree, SampleApi.INFO));
        }

        @Test
        @DisplayName("inject attaches merged contracts to every route, documented or not")
        void injectAttachesContracts() {
            RouteTable table = DocumentationCompiler.inject(SampleApi.tree(), SampleApi.INFO);

            Route head = table.find(HttpMethod.HEAD, "/x/:id").orElseThrow();
            Route doc = table.find(HttpMethod.GET, "/doc").orElseThrow();
            assertThat(head.contract().parameters()).containsKeys(
                    io.routecontract.core.contract.ParameterLocation.HEADER,
                    io.routecontract.core.contract.ParameterLocation.PATH);
            assertThat(doc.contract().description()).isEqualTo("Requires auth as header");
            assertThat(table.find(HttpMethod.PUT, "/x/:id").orElseThrow().contract()).isEqualTo(PUT);
            assertThat(table.document().operationCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("merged contract of a route without annotations is empty")
        void unannotatedRouteIsEmpty() {
            Route route = io.routecontract.core.TestExchanges.route(
                    null,
                    io.routecontract.core.route.Interceptors.before("plain", null, exchange -> {}));

            assertThat(DocumentationCompiler.mergedContract(route)).isEqualTo(Contract.EMPTY);
        }
    }
}
