package com.alertrouter.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketTransportRegistration;

/**
 * STOMP broker for the realtime channel. Dashboards connect to {@code /ws} and subscribe to
 * {@code /topic/alerts}.
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    @Value("${alerting.cors.allowed-origin:*}")
    private String allowedOrigin;

    /** A dashboard session that cannot take a frame within this time is closed. */
    @Value("${alerting.channels.websocket.send-time-limit-ms:5000}")
    private int sendTimeLimitMs;

    @Value("${alerting.channels.websocket.send-buffer-size-limit:524288}")
    private int sendBufferSizeLimit;

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws").setAllowedOriginPatterns(allowedOrigin);
    }

    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        registry.enableSimpleBroker("/topic");
        registry.setApplicationDestinationPrefixes("/app");
    }

    @Override
    public void configureWebSocketTransport(WebSocketTransportRegistration registration) {
        registration.setSendTimeLimit(sendTimeLimitMs).setSendBufferSizeLimit(sendBufferSizeLimit);
    }
}
