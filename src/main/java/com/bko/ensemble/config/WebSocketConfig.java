package com.bko.ensemble.config;

import com.bko.ensemble.stream.ModeStreamWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final ModeStreamWebSocketHandler modeStreamHandler;
    private final EnsembleProperties.StreamConfig stream;

    public WebSocketConfig(ModeStreamWebSocketHandler modeStreamHandler, EnsembleProperties properties) {
        this.modeStreamHandler = modeStreamHandler;
        this.stream = properties.getStream();
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(modeStreamHandler, stream.getPath())
                .setAllowedOrigins(stream.getAllowedOrigins().toArray(String[]::new));
    }
}
