package com.starscape.mediareaper.common.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * WebSocket configuration for execution progress updates.
 * Uses STOMP protocol over WebSocket with SockJS fallback.
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {
    
    private final String[] allowedOrigins;
    
    /**
     * @param allowedOriginsConfig Comma-separated list of allowed origin patterns.
     *                             Defaults to "http://localhost:*,http://127.0.0.1:*" for development.
     */
    public WebSocketConfig(
            @Value("${app.websocket.allowed-origins:http://localhost:*,http://127.0.0.1:*}") String allowedOriginsConfig) {
        if (allowedOriginsConfig != null && !allowedOriginsConfig.trim().isEmpty() && !allowedOriginsConfig.equals("*")) {
            this.allowedOrigins = allowedOriginsConfig.split(",");
        } else {
            this.allowedOrigins = new String[]{"http://localhost:*", "http://127.0.0.1:*"};
        }
    }
    
    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        registry.enableSimpleBroker("/topic");
        registry.setApplicationDestinationPrefixes("/app");
    }
    
    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws")
                .setAllowedOriginPatterns(allowedOrigins)
                .withSockJS();
    }
}
