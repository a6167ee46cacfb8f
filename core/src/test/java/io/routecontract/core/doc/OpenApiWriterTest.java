package io.routecontract.core.doc;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import io.routecontract.core.SampleApi;
import io.routecontract.core.contract.Contract;
import io.routecontract.core.contract.ResponseSpec;
import io.routecontract.core.model.HttpMethod;
import io.routecontract.core.schema.Schema;
import java.util.Map;
import java.util.TreeMap;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("OpenApiWriter")
class OpenApiWriterTest {

    private static JsonNode sampleJson() {
        return OpenApiWriter.toJson(DocumentationCompiler.compile(SampleApi.tree(), SampleApi.INFO));
    }

    @Test
    @DisplayName("path templates use braces; info and version are set")
    void pathsAndInfo() {
        JsonNode json = sampleJson();

        assertThat(json.path("openapi").asText()).isEqualTo(OpenApiWriter.OPENAPI_VERSION);
        assertThat(json.path("info").path("title").asText()).isEqualTo("Test");
        assertThat(json.path("info").path("version").asText()).isEqualTo("0.1");
        assertThat(json.path("paths").has("/x/{id}")).isTrue();
        assertThat(json.path("paths").has("/doc")).isFalse();
    }

    @Test
    @DisplayName("map entries become parameters with their required flag and type")
    void parameters() {
        JsonNode delete = sampleJson().path("paths").path("/x/{id}").path("delete");

        assertThat(delete.path("summary").asText()).isEqualTo("Delete resource with id");
        assertThat(delete.path("parameters")).hasSize(3);
        assertThat(delete.path("parameters").findValuesAsText("in")).containsExactly("path", "query", "header");
        JsonNode id = delete.path("parameters").get(0);
        assertThat(id.path("name").asText()).isEqualTo("id");
        assertThat(id.path("required").asBoolean()).isTrue();
        assertThat(id.path("schema").path("type").asText()).isEqualTo("integer");
        assertThat(id.path("schema").path("format").asText()).isEqualTo("int64");
    }

    @Test
    @DisplayName("body becomes the request body under each consumed media type")
    void requestBody() {
        JsonNode put = sampleJson().path("paths").path("/x/{id}").path("put");

        JsonNode schema = put.path("requestBody").path("content").path("application/json").path("schema");
        assertThat(schema.path("type").asText()).isEqualTo("object");
        assertThat(schema.path("required").get(0).asText()).isEqualTo("name");
        assertThat(schema.path("additionalProperties").asBoolean(true)).isFalse();
    }

    @Test
    @DisplayName("responses carry reason phrases, schemas and headers; default sorts last")
    void responses() {
        JsonNode responses = sampleJson().path("paths").path("/").path("get").path("responses");

        assertThat(responses.fieldNames())
                .toIterable()
                .containsExactly("200", "400", "422", "500", "default");
        assertThat(responses.path("422").path("description").asText()).isEqualTo("Unprocessable Entity");
        JsonNode fallback = responses.path("default");
        assertThat(fallback.path("headers").path("Location").path("required").asBoolean()).isTrue();
        assertThat(fallback.path("content")
                        .path("application/json")
                        .path("schema")
                        .path("properties")
                        .path("result")
                        .path("type")
                        .asText())
                .isEqualTo("array");
    }

    @Test
    @DisplayName("serializing the same document twice gives identical JSON")
    void deterministic() {
        assertThat(sampleJson().toString()).isEqualTo(sampleJson().toString());
    }

    @Test
    @DisplayName("form data goes under application/x-www-form-urlencoded")
    void formData() {
        Contract contract = Contract.builder()
                .formData(Schema.map().required("name", Schema.string()).build())
                .response(201, Schema.nullable(Schema.oneOf("created", "queued")))
                .build();
        ApiDocument document = new ApiDocument(
                new ApiInfo("Forms", "1", "Form handling"),
                new TreeMap<>(Map.of("/forms", Map.of(HttpMethod.POST, contract))));

        JsonNode post = OpenApiWriter.toJson(document).path("paths").path("/forms").path("post");

        assertThat(post.path("requestBody").path("content").has("application/x-www-form-urlencoded"))
                .isTrue();
        JsonNode created = post.path("responses").path("201").path("content").path("application/json").path("schema");
        assertThat(created.path("enum")).hasSize(2);
        assertThat(created.path("nullable").asBoolean()).isTrue();
    }

    @Test
    @DisplayName("declared descriptions and produced media types are used")
    void producesAndDescriptions() {
        Contract contract = Contract.builder()
                .produces("application/json", "application/yaml")
                .response(200, ResponseSpec.body(Schema.string()).withDescription("The item name"))
                .build();
        ApiDocument document = new ApiDocument(
                new ApiInfo("Items", "1"),
                new TreeMap<>(Map.of("/items", Map.of(HttpMethod.GET, contract))));

        JsonNode ok = OpenApiWriter.toJson(document)
                .path("paths")
                .path("/items")
                .path("get")
                .path("responses")
                .path("200");

        assertThat(ok.path("description").asText()).isEqualTo("The item name");
        assertThat(ok.path("content").fieldNames())
                .toIterable()
                .containsExactly("application/json", "application/yaml");
    }

    @Test
    @DisplayName("map schemas keep property order, required keys and closed extras")
    void objectSchema() {
        Schema map = Schema.map()
                .required("name", Schema.string())
                .optional("tags", Schema.sequence(Schema.oneOf("a", "b")))
                .optional("extra", Schema.any())
                .build();

        io.swagger.v3.oas.models.media.Schema<?> object = OpenApiWriter.toSchema(Schema.named("item", map));

        assertThat(object.getTitle()).isEqualTo("item");
        assertThat(object.getProperties()).containsOnlyKeys("name", "tags", "extra");
        assertThat(object.getProperties().keySet()).containsExactly("name", "tags", "extra");
        assertThat(object.getRequired()).containsExactly("name");
        assertThat(object.getAdditionalProperties()).isEqualTo(Boolean.FALSE);
        assertThat(object.getProperties().get("tags").getItems().getEnum()).containsExactly("a", "b");
        assertThat(object.getProperties().get("extra").getType()).isNull();
    }
}
