package io.routecontract.core.doc;

import com.fasterxml.jackson.databind.JsonNode;
import io.routecontract.core.contract.Contract;
import io.routecontract.core.contract.ParameterLocation;
import io.routecontract.core.contract.ResponseCode;
import io.routecontract.core.contract.ResponseSpec;
import io.routecontract.core.model.HttpMethod;
import io.routecontract.core.schema.AnySchema;
import io.routecontract.core.schema.EnumSchema;
import io.routecontract.core.schema.MapSchema;
import io.routecontract.core.schema.NamedSchema;
import io.routecontract.core.schema.NullableSchema;
import io.routecontract.core.schema.ScalarSchema;
import io.routecontract.core.schema.SequenceSchema;
import io.swagger.v3.core.util.Json;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.Paths;
import io.swagger.v3.oas.models.headers.Header;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.media.ArraySchema;
import io.swagger.v3.oas.models.media.BooleanSchema;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.IntegerSchema;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.NumberSchema;
import io.swagger.v3.oas.models.media.ObjectSchema;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.media.StringSchema;
import io.swagger.v3.oas.models.parameters.Parameter;
import io.swagger.v3.oas.models.parameters.RequestBody;
import io.swagger.v3.oas.models.responses.ApiResponse;
import io.swagger.v3.oas.models.responses.ApiResponses;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Renders an {@link ApiDocument} as an OpenAPI 3.0 document using the
 * swagger-core model.
 *
 * <p>
 * Path templates are rewritten from {@code /pets/:id} to {@code /pets/{id}}.
 * Path, query and header map schemas become one parameter per entry;
 * {@code body} becomes the request body under each consumed media type and
 * {@code formData} under {@code application/x-www-form-urlencoded}.
 * Responses without a description get the HTTP reason phrase.
 */
public final class OpenApiWriter {

    public static final String OPENAPI_VERSION = "3.0.3";

    static final String JSON = "application/json";
    static final String FORM = "application/x-www-form-urlencoded";

    private static final Pattern PATH_PARAM = Pattern.compile(":([A-Za-z_][A-Za-z0-9_]*)");

    private static final Map<Integer, String> REASONS = Map.ofEntries(
            Map.entry(200, "OK"),
            Map.entry(201, "Created"),
            Map.entry(202, "Accepted"),
            Map.entry(204, "No Content"),
            Map.entry(301, "Moved Permanently"),
            Map.entry(302, "Found"),
            Map.entry(304, "Not Modified"),
            Map.entry(400, "Bad Request"),
            Map.entry(401, "Unauthorized"),
            Map.entry(403, "Forbidden"),
            Map.entry(404, "Not Found"),
            Map.entry(405, "Method Not Allowed"),
            Map.entry(409, "Conflict"),
            Map.entry(415, "Unsupported Media Type"),
            Map.entry(422, "Unprocessable Entity"),
            Map.entry(429, "Too Many Requests"),
            Map.entry(500, "Internal Server Error"),
            Map.entry(502, "Bad Gateway"),
            Map.entry(503, "Service Unavailable"));

    private OpenApiWriter() {
        // utility class
    }

    /** Maps the document onto the swagger-core model. */
    public static OpenAPI toOpenApi(ApiDocument document) {
        Info info = new Info().title(document.info().title()).version(document.info().version());
        if (document.info().description() != null) {
            info.setDescription(document.info().description());
        }

        Paths paths = new Paths();
        document.paths().forEach((path, operations) -> {
            PathItem item = new PathItem();
            operations.forEach((method, contract) -> item.operation(toSwaggerMethod(method), toOperation(contract)));
            paths.addPathItem(toOpenApiPath(path), item);
        });

        return new OpenAPI().openapi(OPENAPI_VERSION).info(info).paths(paths);
    }

    /** Serializes the document with swagger-core's Jackson mapper. */
    public static JsonNode toJson(ApiDocument document) {
        return Json.mapper().valueToTree(toOpenApi(document));
    }

    /** {@code /pets/:id} to {@code /pets/{id}}. */
    public static String toOpenApiPath(String template) {
        return PATH_PARAM.matcher(template).replaceAll("{$1}");
    }

    /**
     * Maps a contract schema to a swagger schema.
     */
    public static Schema<?> toSchema(io.routecontract.core.schema.Schema schema) {
        if (schema instanceof AnySchema) {
            return new Schema<Object>();
        }
        if (schema instanceof ScalarSchema scalar) {
            return switch (scalar) {
                case STRING -> new StringSchema();
                case INTEGER -> new IntegerSchema().format("int64");
                case NUMBER -> new NumberSchema().format("double");
                case BOOLEAN -> new BooleanSchema();
            };
        }
        if (schema instanceof EnumSchema enumeration) {
            StringSchema string = new StringSchema();
            string.setEnum(new ArrayList<>(enumeration.values()));
            return string;
        }
        if (schema instanceof NullableSchema nullable) {
            return toSchema(nullable.schema()).nullable(Boolean.TRUE);
        }
        if (schema instanceof SequenceSchema sequence) {
            return new ArraySchema().items(toSchema(sequence.element()));
        }
        if (schema instanceof NamedSchema named) {
            return toSchema(named.schema()).title(named.name());
        }
        if (schema instanceof MapSchema map) {
            return toObjectSchema(map);
        }
        throw new IllegalArgumentException("Unsupported schema type: " + schema.getClass().getName());
    }

    // --- Private helpers ---

    private static Operation toOperation(Contract contract) {
        Operation operation = new Operation();
        if (contract.summary() != null) {
            operation.setSummary(contract.summary());
        }
        if (contract.description() != null) {
            operation.setDescription(contract.description());
        }
        if (contract.operationId() != null) {
            operation.setOperationId(contract.operationId());
        }
        contract.tags().forEach(operation::addTagsItem);

        for (ParameterLocation location : List.of(ParameterLocation.PATH, ParameterLocation.QUERY, ParameterLocation.HEADER)) {
            io.routecontract.core.schema.Schema schema = contract.parameters().get(location);
            MapSchema map = schema != null ? asMap(schema) : null;
            if (map == null) {
                continue;
            }
            map.entries().forEach((name, entry) -> operation.addParametersItem(new Parameter()
                    .name(name)
                    .in(location.tag())
                    .required(entry.required() || location == ParameterLocation.PATH)
                    .schema(toSchema(entry.schema()))));
        }

        RequestBody requestBody = toRequestBody(contract);
        if (requestBody != null) {
            operation.setRequestBody(requestBody);
        }

        ApiResponses responses = new ApiResponses();
        Set<String> produces = contract.produces().isEmpty() ? Set.of(JSON) : contract.produces();
        contract.responses().forEach((code, spec) -> responses.addApiResponse(code.key(), toResponse(code, spec, produces)));
        operation.setResponses(responses);
        return operation;
    }

    private static RequestBody toRequestBody(Contract contract) {
        io.routecontract.core.schema.Schema body = contract.parameters().get(ParameterLocation.BODY);
        io.routecontract.core.schema.Schema form = contract.parameters().get(ParameterLocation.FORM_DATA);
        if (body == null && form == null) {
            return null;
        }
        Content content = new Content();
        if (body != null) {
            Set<String> types = new LinkedHashSet<>(contract.consumes());
            if (form != null) {
                types.remove(FORM);
            }
            if (types.isEmpty()) {
                types.add(JSON);
            }
            types.forEach(type -> content.addMediaType(type, new MediaType().schema(toSchema(body))));
        }
        if (form != null) {
            content.addMediaType(FORM, new MediaType().schema(toSchema(form)));
        }
        return new RequestBody().content(content).required(body != null && !(body instanceof NullableSchema));
    }

    private static ApiResponse toResponse(ResponseCode code, ResponseSpec spec, Set<String> produces) {
        ApiResponse response = new ApiResponse().description(
                spec.description() != null ? spec.description() : reasonPhrase(code));
        if (spec.schema() != null) {
            Content content = new Content();
            produces.forEach(type -> content.addMediaType(type, new MediaType().schema(toSchema(spec.schema()))));
            response.setContent(content);
        }
        MapSchema headers = spec.headers() != null ? asMap(spec.headers()) : null;
        if (headers != null) {
            headers.entries().forEach((name, entry) -> response.addHeaderObject(
                    name, new Header().required(entry.required()).schema(toSchema(entry.schema()))));
        }
        return response;
    }

    private static ObjectSchema toObjectSchema(MapSchema map) {
        ObjectSchema object = new ObjectSchema();
        List<String> required = new ArrayList<>();
        map.entries().forEach((name, entry) -> {
            object.addProperty(name, toSchema(entry.schema()));
            if (entry.required()) {
                required.add(name);
            }
        });
        if (!required.isEmpty()) {
            object.setRequired(required);
        }
        if (!map.isLoose()) {
            object.setAdditionalProperties(Boolean.FALSE);
        } else if (!(map.extraValues() instanceof AnySchema)) {
            object.setAdditionalProperties(toSchema(map.extraValues()));
        }
        return object;
    }

    private static MapSchema asMap(io.routecontract.core.schema.Schema schema) {
        if (schema instanceof MapSchema map) {
            return map;
        }
        if (schema instanceof NamedSchema named) {
            return asMap(named.schema());
        }
        return null;
    }

    private static String reasonPhrase(ResponseCode code) {
        if (code.isDefault()) {
            return "Default response";
        }
        return REASONS.getOrDefault(code.status(), "Status " + code.status());
    }

    private static PathItem.HttpMethod toSwaggerMethod(HttpMethod method) {
        return PathItem.HttpMethod.valueOf(method.name());
    }
}
