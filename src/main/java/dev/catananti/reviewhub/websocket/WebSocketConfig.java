package dev.catananti.reviewhub.websocket;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;

import java.util.Map;

@Configuration
public class WebSocketConfig {

    /** Ahead of the annotated controllers */
    @Bean
    public HandlerMapping commentWebSocketMapping(CommentWebSocketHandler handler) {
        return new SimpleUrlHandlerMapping(Map.of("/ws/posts/*/comments", handler), -1);
    }
}
