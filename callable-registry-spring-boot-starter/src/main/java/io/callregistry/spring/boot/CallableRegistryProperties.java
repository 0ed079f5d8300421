package io.callregistry.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the callable registry.
 *
 * @see CallableRegistryAutoConfiguration
 */
@ConfigurationProperties(prefix = "callable-registry")
public class CallableRegistryProperties {

    /**
     * Registry name, shown in its string form.
     */
    private String name = "default";

    /**
     * Pass each registration's metadata to its implementation as invocation options.
     */
    private boolean bindMetadata = false;

    private final Trace trace = new Trace();
    private final Metrics metrics = new Metrics();

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public boolean isBindMetadata() {
        return bindMetadata;
    }

    public void setBindMetadata(boolean bindMetadata) {
        this.bindMetadata = bindMetadata;
    }

    public Trace getTrace() {
        return trace;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Trace {
        /**
         * Log every dispatch through a LoggingDispatchInterceptor.
         */
        private boolean enabled = false;

        /**
         * java.util.logging level name used for dispatch traces.
         */
        private String level = "FINE";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getLevel() {
            return level;
        }

        public void setLevel(String level) {
            this.level = level;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "callable.registry";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
