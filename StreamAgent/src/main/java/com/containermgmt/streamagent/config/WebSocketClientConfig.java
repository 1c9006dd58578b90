package com.containermgmt.streamagent.config;

import jakarta.websocket.ContainerProvider;
import jakarta.websocket.WebSocketContainer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

/**
 * WebSocket client used to reach the gateway.
 */
@Configuration
@Slf4j
public class WebSocketClientConfig {

    @Bean
    public WebSocketClient gatewayWebSocketClient(AgentProperties agentProperties) {
        int maxFrameBytes = (int) Math.min(Integer.MAX_VALUE, agentProperties.getMaxFrameBytes().toBytes());

        WebSocketContainer container = ContainerProvider.getWebSocketContainer();
        container.setDefaultMaxTextMessageBufferSize(maxFrameBytes);
        container.setDefaultMaxSessionIdleTimeout(0);

        log.info("WebSocket client configured: maxFrameBytes={}", maxFrameBytes);
        return new StandardWebSocketClient(container);
    }
}
