package com.alibou.deliverychat.config;

import com.alibou.deliverychat.ws.ChatHandshakeInterceptor;
import com.alibou.deliverychat.ws.ChatWebSocketHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final ChatWebSocketHandler     chatHandler;
    private final ChatHandshakeInterceptor handshakeInterceptor;
    private final ChatProperties           properties;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(chatHandler, "/ws/chat/*", "/ws/chat/*/")
                .addInterceptors(handshakeInterceptor)
                .setAllowedOriginPatterns(properties.getAllowedOrigins().toArray(String[]::new));
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        // кадр должен вместить самое длинное сообщение вместе с JSON-обвязкой
        container.setMaxTextMessageBufferSize(Math.max(8192, properties.getMaxMessageLength() * 4 + 1024));
        return container;
    }
}
