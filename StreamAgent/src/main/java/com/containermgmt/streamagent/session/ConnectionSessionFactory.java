package com.containermgmt.streamagent.session;

import com.containermgmt.streamagent.codec.EventCodec;
import com.containermgmt.streamagent.config.AgentProperties;
import com.containermgmt.streamagent.dto.SubscriptionDescriptor;
import com.containermgmt.streamagent.store.IngestErrorRecorder;
import com.containermgmt.streamagent.store.StoreApplier;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Builds a fresh {@link ConnectionSession} for every connection attempt.
 */
@Component
public class ConnectionSessionFactory {

    private final GatewayTransport transport;
    private final EventCodec codec;
    private final StoreApplier storeApplier;
    private final IngestErrorRecorder errorRecorder;
    private final AgentProperties properties;

    private final AtomicLong sessionIds = new AtomicLong();

    public ConnectionSessionFactory(GatewayTransport transport,
                                    EventCodec codec,
                                    StoreApplier storeApplier,
                                    IngestErrorRecorder errorRecorder,
                                    AgentProperties properties) {
        this.transport = transport;
        this.codec = codec;
        this.storeApplier = storeApplier;
        this.errorRecorder = errorRecorder;
        this.properties = properties;
    }

    public ConnectionSession create(SessionListener listener) {
        return new ConnectionSession(sessionIds.incrementAndGet(), streamUri(), transport, codec,
                storeApplier, errorRecorder, properties, listener);
    }

    /** {gateway-url}/stream?subject=..&durable=..&batch=.. */
    public URI streamUri() {
        SubscriptionDescriptor descriptor = properties.descriptor();
        return UriComponentsBuilder.fromUriString(properties.getGatewayUrl())
                .path("/stream")
                .queryParam("subject", descriptor.subject())
                .queryParam("durable", descriptor.durable())
                .queryParam("batch", descriptor.batchSize())
                .encode()
                .build()
                .toUri();
    }
}
