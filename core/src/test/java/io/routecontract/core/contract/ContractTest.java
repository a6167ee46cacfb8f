package io.routecontract.core.contract;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.routecontract.core.error.ContractDefinitionException;
import io.routecontract.core.schema.MapSchema;
import io.routecontract.core.schema.NamedSchema;
import io.routecontract.core.schema.Schema;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Contract")
class ContractTest {

    private static final MapSchema AUTH = Schema.map().required("auth", Schema.string()).build();
    private static final MapSchema NAME = Schema.map().required("name", Schema.string()).build();

    @Nested
    @DisplayName("merge")
    class Merge {

        private final Contract ambient = Contract.builder()
                .description("Requires auth as header")
                .summary("ambient summary")
                .tags("secured")
                .consumes("application/json")
                .headers(AUTH)
                .response(401, ResponseSpec.described("Unauthorized"))
                .build();

        private final Contract leaf = Contract.builder()
                .summary("Put resource")
                .tags("pets", "secured")
                .consumes("application/yaml", "application/json")
                .body(NAME)
                .response(200, Schema.any())
                .build();

        @Test
        @DisplayName("inner scalar fields override, outer ones fill gaps")
        void scalarFields() {
            Contract merged = ambient.merge(leaf);

            assertThat(merged.summary()).isEqualTo("Put resource");
            assertThat(merged.description()).isEqualTo("Requires auth as header");
            assertThat(merged.operationId()).isNull();
        }

        @Test
        @DisplayName("parameters and responses are unions across levels")
        void unions() {
            Contract merged = ambient.merge(leaf);

            assertThat(merged.parameters())
                    .containsEntry(ParameterLocation.HEADER, AUTH)
                    .containsEntry(ParameterLocation.BODY, NAME);
            assertThat(merged.responses()).containsOnlyKeys(ResponseCode.of(200), ResponseCode.of(401));
        }

        @Test
        @DisplayName("tags and media types are order-preserving set unions")
        void setUnions() {
            Contract merged = ambient.merge(leaf);

            assertThat(merged.tags()).containsExactly("secured", "pets");
            assertThat(merged.consumes()).containsExactly("application/json", "application/yaml");
        }

        @Test
        @DisplayName("same location on two levels unions map entries, inner entry wins")
        void sameLocationUnion() {
            Contract outer = Contract.builder()
                    .query(Schema.map()
                            .required("page", Schema.integer())
                            .required("q", Schema.integer())
                            .build())
                    .build();
            Contract inner = Contract.builder()
                    .query(Schema.map().optional("q", Schema.string()).build())
                    .build();

            MapSchema query = (MapSchema) outer.merge(inner).parameters().get(ParameterLocation.QUERY);

            assertThat(query.entries()).containsOnlyKeys("page", "q");
            assertThat(query.entries().get("q")).isEqualTo(new MapSchema.Entry(false, Schema.string()));
        }

        @Test
        @DisplayName("same response code on two levels goes to the inner spec")
        void sameResponseInnerWins() {
            Contract outer = Contract.builder().response(200, Schema.string()).build();
            Contract inner = Contract.builder().response(200, Schema.integer()).build();

            assertThat(outer.merge(inner).responses().get(ResponseCode.of(200)).schema())
                    .isEqualTo(Schema.integer());
        }

        @Test
        @DisplayName("named and plain maps at one location are unioned under the name")
        void namedMapsUnion() {
            Contract named = Contract.builder()
                    .headers(Schema.named("auth-headers", AUTH))
                    .build();
            Contract trace = Contract.builder()
                    .headers(Schema.map().optional("x-trace", Schema.string()).build())
                    .build();

            Schema merged = named.merge(trace).parameters().get(ParameterLocation.HEADER);
            Schema reversed = trace.merge(named).parameters().get(ParameterLocation.HEADER);

            assertThat(merged).isInstanceOf(NamedSchema.class);
            assertThat(((NamedSchema) merged).name()).isEqualTo("auth-headers");
            assertThat(((MapSchema) ((NamedSchema) merged).schema()).entries()).containsOnlyKeys("auth", "x-trace");
            assertThat(((MapSchema) ((NamedSchema) reversed).schema()).entries().get("auth").required())
                    .isTrue();
        }

        @Test
        @DisplayName("a named non-map schema is replaced by the inner schema")
        void namedScalarReplaced() {
            Contract outer = Contract.builder().body(Schema.named("label", Schema.string())).build();
            Contract inner = Contract.builder().body(NAME).build();

            assertThat(outer.merge(inner).parameters()).containsEntry(ParameterLocation.BODY, NAME);
        }

        @Test
        @DisplayName("merging with the empty contract is neutral")
        void emptyIsNeutral() {
            assertThat(Contract.EMPTY.merge(leaf)).isEqualTo(leaf);
            assertThat(leaf.merge(Contract.EMPTY)).isEqualTo(leaf);
            assertThat(Contract.EMPTY.isEmpty()).isTrue();
        }
    }

    @Nested
    @DisplayName("Parameter locations")
    class Locations {

        @Test
        @DisplayName("location tags resolve to request fields")
        void tagsResolve() {
            assertThat(ParameterLocation.fromTag("formData").field()).isEqualTo("form-params");
            assertThat(ParameterLocation.fromTag("header").loose()).isTrue();
            assertThat(ParameterLocation.fromTag("path").loose()).isFalse();
        }

        @Test
        @DisplayName("unknown location tag → ContractDefinitionException")
        void unknownTagRejected() {
            assertThatThrownBy(() -> Contract.builder().parameter("cookie", Schema.string()))
                    .isInstanceOf(ContractDefinitionException.class)
                    .hasMessageContaining("cookie");
        }
    }

    @Nested
    @DisplayName("Response codes")
    class Codes {

        @Test
        @DisplayName("numeric ascending with default last")
        void ordering() {
            Contract contract = Contract.builder()
                    .defaultResponse(ResponseSpec.empty())
                    .response(500, ResponseSpec.empty())
                    .response(200, ResponseSpec.empty())
                    .response(422, ResponseSpec.empty())
                    .build();

            assertThat(contract.responses().keySet())
                    .extracting(ResponseCode::key)
                    .containsExactly("200", "422", "500", "default");
        }

        @Test
        @DisplayName("out-of-range status is rejected")
        void invalidStatus() {
            assertThatThrownBy(() -> ResponseCode.of(42)).isInstanceOf(IllegalArgumentException.class);
        }
    }
}
