package com.starscape.mediareaper.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Connection settings for the downloader integrations.
 * Binds to app.integrations.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.integrations")
public class IntegrationProperties {
    
    private Endpoint sonarr = new Endpoint();
    private Endpoint radarr = new Endpoint();
    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration readTimeout = Duration.ofSeconds(30);
    
    public Endpoint getSonarr() { return sonarr; }
    public void setSonarr(Endpoint sonarr) { this.sonarr = sonarr; }
    public Endpoint getRadarr() { return radarr; }
    public void setRadarr(Endpoint radarr) { this.radarr = radarr; }
    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }
    public Duration getReadTimeout() { return readTimeout; }
    public void setReadTimeout(Duration readTimeout) { this.readTimeout = readTimeout; }
    
    public static class Endpoint {
        
        private String url;
        private String apiKey;
        
        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
        
        /**
         * Both url and API key are required to talk to the service.
         */
        public boolean isConfigured() {
            return url != null && !url.isBlank() && apiKey != null && !apiKey.isBlank();
        }
    }
}
