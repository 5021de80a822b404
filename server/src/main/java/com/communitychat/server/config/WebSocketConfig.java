package com.communitychat.server.config;

import com.communitychat.server.handler.ChatWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    // inline image attachments arrive as base64 data URLs, so text frames can be large
    private static final int MAX_TEXT_MESSAGE_BUFFER_SIZE = 8 * 1024 * 1024;

    private final ChatWebSocketHandler chatWebSocketHandler;

    @Value("${chat.websocket.path:/ws}")
    private String path;

    @Value("${chat.websocket.allowed-origins:*}")
    private String[] allowedOrigins;

    @Value("${chat.websocket.idle-timeout-ms:300000}")
    private long idleTimeoutMs;

    public WebSocketConfig(ChatWebSocketHandler chatWebSocketHandler) {
        this.chatWebSocketHandler = chatWebSocketHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(chatWebSocketHandler, path)
                .setAllowedOriginPatterns(allowedOrigins);
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(MAX_TEXT_MESSAGE_BUFFER_SIZE);
        container.setMaxSessionIdleTimeout(idleTimeoutMs);
        return container;
    }
}
