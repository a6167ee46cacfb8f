package io.routecontract.core.doc;

import java.util.Objects;

/**
 * Top-level metadata of an aggregate document.
 *
 * @param title       API title
 * @param version     API version
 * @param description optional description, or {@code null}
 */
public record ApiInfo(String title, String version, String description) {

    public ApiInfo {
        Objects.requireNonNull(title, "title must not be null");
        Objects.requireNonNull(version, "version must not be null");
    }

    public ApiInfo(String title, String version) {
        this(title, version, null);
    }
}
