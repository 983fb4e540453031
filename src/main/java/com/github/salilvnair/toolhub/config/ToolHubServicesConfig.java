package com.github.salilvnair.toolhub.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "toolhub.services")
@Getter
@Setter
public class ToolHubServicesConfig {

    private Service github = new Service("https://api.github.com", "GITHUB_API_KEY");
    private Service linear = new Service("https://api.linear.app", "LINEAR_API_KEY");

    @Getter
    @Setter
    public static class Service {
        private boolean enabled = true;
        private String baseEndpoint;
        /**
         * Name of the environment variable holding the API credential. Only the name is kept
         * in configuration; the value is read on demand.
         */
        private String credentialEnv;

        public Service() {
        }

        public Service(String baseEndpoint, String credentialEnv) {
            this.baseEndpoint = baseEndpoint;
            this.credentialEnv = credentialEnv;
        }
    }
}
