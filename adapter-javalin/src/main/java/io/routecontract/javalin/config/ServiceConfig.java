package io.routecontract.javalin.config;

import io.routecontract.core.doc.ApiInfo;
import io.routecontract.core.interceptor.ContractStatuses;

/**
 * Root configuration of a contract-enforcing Javalin service.
 *
 * <p>
 * Every field has a default; use {@link #builder()} to construct instances.
 *
 * @param serverHost          bind address
 * @param serverPort          listen port; {@code 0} picks an ephemeral port
 * @param apiTitle            document title
 * @param apiVersion          document version
 * @param apiDescription      document description, nullable
 * @param badRequestStatus    status for undecodable request bodies
 * @param unprocessableStatus status for requests that break their contract
 * @param internalErrorStatus status for responses that break their contract
 * @param healthEnabled       register the liveness endpoint
 * @param healthPath          liveness endpoint path
 * @param loggingFormat       {@code json} or {@code text}
 * @param loggingLevel        root log level
 */
public record ServiceConfig(
        String serverHost,
        int serverPort,
        String apiTitle,
        String apiVersion,
        String apiDescription,
        int badRequestStatus,
        int unprocessableStatus,
        int internalErrorStatus,
        boolean healthEnabled,
        String healthPath,
        String loggingFormat,
        String loggingLevel) {

    /** Creates a new builder with defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Document metadata for the compiled route tree. */
    public ApiInfo apiInfo() {
        return new ApiInfo(apiTitle, apiVersion, apiDescription);
    }

    /** Statuses for the built-in interceptors. */
    public ContractStatuses statuses() {
        return new ContractStatuses(badRequestStatus, unprocessableStatus, internalErrorStatus);
    }

    /** Builder for {@link ServiceConfig}. */
    public static final class Builder {
        private String serverHost = "0.0.0.0";
        private int serverPort = 8080;
        private String apiTitle = "API";
        private String apiVersion = "1.0.0";
        private String apiDescription;
        private int badRequestStatus = ContractStatuses.DEFAULT.badRequest();
        private int unprocessableStatus = ContractStatuses.DEFAULT.unprocessable();
        private int internalErrorStatus = ContractStatuses.DEFAULT.internalError();
        private boolean healthEnabled = true;
        private String healthPath = "/health";
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        Builder() {}

        public Builder serverHost(String serverHost) {
            this.serverHost = serverHost;
            return this;
        }

        public Builder serverPort(int serverPort) {
            this.serverPort = serverPort;
            return this;
        }

        public Builder apiTitle(String apiTitle) {
            this.apiTitle = apiTitle;
            return this;
        }

        public Builder apiVersion(String apiVersion) {
            this.apiVersion = apiVersion;
            return this;
        }

        public Builder apiDescription(String apiDescription) {
            this.apiDescription = apiDescription;
            return this;
        }

        public Builder badRequestStatus(int badRequestStatus) {
            this.badRequestStatus = badRequestStatus;
            return this;
        }

        public Builder unprocessableStatus(int unprocessableStatus) {
            this.unprocessableStatus = unprocessableStatus;
            return this;
        }

        public Builder internalErrorStatus(int internalErrorStatus) {
            this.internalErrorStatus = internalErrorStatus;
            return this;
        }

        public Builder healthEnabled(boolean healthEnabled) {
            this.healthEnabled = healthEnabled;
            return this;
        }

        public Builder healthPath(String healthPath) {
            this.healthPath = healthPath;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        /**
         * Builds the config.
         *
         * @throws ConfigLoadException if a value is out of range
         */
        public ServiceConfig build() {
            if (serverPort < 0 || serverPort > 65535) {
                throw new ConfigLoadException("server.port must be between 0 and 65535, got " + serverPort);
            }
            if (!"json".equalsIgnoreCase(loggingFormat) && !"text".equalsIgnoreCase(loggingFormat)) {
                throw new ConfigLoadException("logging.format must be 'json' or 'text', got '" + loggingFormat + "'");
            }
            if (!healthPath.startsWith("/")) {
                throw new ConfigLoadException("health.path must start with '/', got '" + healthPath + "'");
            }
            ServiceConfig config = new ServiceConfig(
                    serverHost,
                    serverPort,
                    apiTitle,
                    apiVersion,
                    apiDescription,
                    badRequestStatus,
                    unprocessableStatus,
                    internalErrorStatus,
                    healthEnabled,
                    healthPath,
                    loggingFormat,
                    loggingLevel);
            try {
                config.statuses();
            } catch (IllegalArgumentException e) {
                throw new ConfigLoadException("Invalid status configuration: " + e.getMessage(), e);
            }
            return config;
        }
    }
}
