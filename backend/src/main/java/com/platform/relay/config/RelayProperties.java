package com.platform.relay.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the relay.
 */
@Data
@ConfigurationProperties(prefix = "relay")
public class RelayProperties {

    private KeyStore keystore = new KeyStore();

    private Commands commands = new Commands();

    private Agents agents = new Agents();

    private Scripts scripts = new Scripts();

    private Network network = new Network();

    private Security security = new Security();

    private Tracing tracing = new Tracing();

    @Data
    public static class KeyStore {
        /**
         * Fixed window during which a resolved tenant key is served from memory.
         */
        private Duration cacheTtl = Duration.ofMinutes(5);

        /**
         * Interval of the background purge of expired cache entries.
         */
        private Duration sweepInterval = Duration.ofSeconds(60);
    }

    @Data
    public static class Commands {
        /**
         * Default time a caller waits for an agent reply.
         */
        private Duration timeout = Duration.ofSeconds(60);

        /**
         * Default number of log lines requested by container.logs.
         */
        private int defaultLogTail = 100;
    }

    @Data
    public static class Agents {
        /**
         * Connections silent for longer than this are closed.
         */
        private Duration staleAfter = Duration.ofSeconds(120);

        private Duration livenessCheckInterval = Duration.ofSeconds(30);

        /**
         * Size limit of a single outbound frame buffered per connection.
         */
        private int sendBufferSizeBytes = 4 * 1024 * 1024;

        private Duration sendTimeLimit = Duration.ofSeconds(10);

        private String allowedOrigins = "*";
    }

    @Data
    public static class Scripts {
        /**
         * Trusted directory holding the automation scripts.
         */
        private String directory = "classpath:scripts/";

        /**
         * Tool name to definition. Empty means the built-in catalog.
         */
        private Map<String, Tool> tools = new LinkedHashMap<>();

        @Data
        public static class Tool {
            private String script;
            private String description;
            private List<String> helpers = new ArrayList<>();
            private String kind = "SCRIPT";

            /**
             * Values used when the caller omits an argument.
             */
            private Map<String, Object> defaults = new LinkedHashMap<>();

            /**
             * Argument name to the flag the script expects.
             */
            private Map<String, String> flags = new LinkedHashMap<>();

            /**
             * Argument name to the environment variable that carries it.
             */
            private Map<String, String> environment = new LinkedHashMap<>();
        }
    }

    @Data
    public static class Network {
        private boolean enabled = true;

        /**
         * Address range from which tenant subnets are carved.
         */
        private String poolCidr = "10.64.0.0/10";

        private int tenantPrefix = 24;

        /**
         * Ranges used by the control plane itself. Tenant subnets never overlap them.
         */
        private List<String> controlPlaneCidrs = new ArrayList<>(List.of("172.16.0.0/12", "192.168.0.0/16"));

        /**
         * Container name or id of the relay, attached to every tenant network.
         */
        private String relayContainer = "tools-relay";

        private String namePrefix = "relay-tenant-";

        private String dockerHost = "unix:///var/run/docker.sock";
    }

    @Data
    public static class Security {
        /**
         * Shared token expected in X-Internal-Token on /internal/** routes.
         */
        private String internalToken;

        private int requestsPerMinute = 100;

        private boolean rateLimitEnabled = true;
    }

    @Data
    public static class Tracing {
        /**
         * Ship finished spans to the OTLP collector. Spans are created either way.
         */
        private boolean exportEnabled = false;

        private String otlpEndpoint = "http://localhost:4317";

        private Duration exportTimeout = Duration.ofSeconds(10);

        /**
         * Fraction of new traces sampled. Remote parents decide for their children.
         */
        private double sampleRatio = 1.0;

        /**
         * Open a server span for every HTTP request.
         */
        private boolean httpEnabled = true;
    }
}
