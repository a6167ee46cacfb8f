package io.routecontract.core.doc;

import io.routecontract.core.contract.Contract;
import io.routecontract.core.model.HttpMethod;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The aggregate API document: metadata plus the merged contract of every
 * documented route, sorted by path and then by method. Immutable; compiling
 * the same tree twice yields equal documents.
 *
 * @param info  document metadata
 * @param paths path template to method to merged contract
 */
public record ApiDocument(ApiInfo info, SortedMap<String, Map<HttpMethod, Contract>> paths) {

    public ApiDocument {
        Objects.requireNonNull(info, "info must not be null");
        SortedMap<String, Map<HttpMethod, Contract>> copy = new TreeMap<>();
        paths.forEach((path, operations) -> {
            Map<HttpMethod, Contract> sorted = new EnumMap<>(HttpMethod.class);
            sorted.putAll(operations);
            copy.put(path, Collections.unmodifiableMap(sorted));
        });
        paths = Collections.unmodifiableSortedMap(copy);
    }

    /** The merged contract documented for {@code method} on {@code path}. */
    public Optional<Contract> contract(String path, HttpMethod method) {
        Map<HttpMethod, Contract> operations = paths.get(path);
        return operations == null ? Optional.empty() : Optional.ofNullable(operations.get(method));
    }

    /** Number of documented operations across all paths. */
    public int operationCount() {
        return paths.values().stream().mapToInt(Map::size).sum();
    }
}
