package com.phillippitts.graphicrecorder.config;

import com.phillippitts.graphicrecorder.config.properties.WebSocketProperties;
import com.phillippitts.graphicrecorder.presentation.ws.RecordingWebSocketHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * Registers the recording endpoint. An empty origin list allows any origin.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final RecordingWebSocketHandler handler;
    private final WebSocketProperties properties;

    public WebSocketConfig(RecordingWebSocketHandler handler, WebSocketProperties properties) {
        this.handler = handler;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        String[] origins = properties.getAllowedOrigins().isEmpty()
                ? new String[] {"*"}
                : properties.getAllowedOrigins().toArray(new String[0]);
        registry.addHandler(handler, properties.getPath()).setAllowedOriginPatterns(origins);
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxBinaryMessageBufferSize(properties.getMaxBinaryMessageBytes());
        container.setMaxTextMessageBufferSize(properties.getMaxBinaryMessageBytes());
        return container;
    }
}
