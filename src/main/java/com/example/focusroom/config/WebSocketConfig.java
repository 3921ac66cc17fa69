package com.example.focusroom.config;

import com.example.focusroom.handler.FocusWebSocketHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import java.util.Arrays;

/** Registers the focus room handler on {@code app.websocket.path}. */
@Configuration
@EnableWebSocket
@EnableConfigurationProperties(WebSocketProperties.class)
public class WebSocketConfig implements WebSocketConfigurer {

    private static final Logger log = LoggerFactory.getLogger(WebSocketConfig.class);

    private final FocusWebSocketHandler handler;
    private final WebSocketProperties props;

    public WebSocketConfig(FocusWebSocketHandler handler, WebSocketProperties props) {
        this.handler = handler;
        this.props = props;
    }

    @Override
    public void registerWebSocketHandlers(@NonNull WebSocketHandlerRegistry registry) {
        String[] patterns = props.originPatterns();
        log.info("WS endpoint {} origins={}", props.path(), Arrays.toString(patterns));
        registry.addHandler(handler, props.path())
                .setAllowedOriginPatterns(patterns);
    }
}
