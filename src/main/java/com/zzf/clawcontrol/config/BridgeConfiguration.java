package com.zzf.clawcontrol.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.clawcontrol.loop.ScheduledEventLoop;
import com.zzf.clawcontrol.protocol.FrameCodec;
import com.zzf.clawcontrol.session.HealthProbe;
import com.zzf.clawcontrol.transport.JdkWebSocketTransportFactory;
import com.zzf.clawcontrol.transport.TransportFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;

@Configuration
public class BridgeConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(BridgeConfiguration.class);

    @Bean(destroyMethod = "close")
    public ScheduledEventLoop clawControlEventLoop() {
        return new ScheduledEventLoop("clawcontrol-loop");
    }

    @Bean
    public FrameCodec frameCodec(ObjectMapper mapper) {
        return new FrameCodec(mapper);
    }

    @Bean
    public HttpClient clawControlHttpClient(BridgeProperties properties) {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(Math.max(1_000L, properties.getConnectTimeoutMs())))
                .build();
    }

    @Bean
    public TransportFactory transportFactory(HttpClient clawControlHttpClient, BridgeProperties properties) {
        logger.info("transport selected=jdk-websocket connectTimeoutMs={}", properties.getConnectTimeoutMs());
        return new JdkWebSocketTransportFactory(clawControlHttpClient,
                Duration.ofMillis(Math.max(1_000L, properties.getConnectTimeoutMs())));
    }

    @Bean
    public HealthProbe healthProbe(HttpClient clawControlHttpClient, BridgeProperties properties) {
        return new HealthProbe(clawControlHttpClient, Duration.ofMillis(Math.max(500L, properties.getProbeTimeoutMs())));
    }
}
