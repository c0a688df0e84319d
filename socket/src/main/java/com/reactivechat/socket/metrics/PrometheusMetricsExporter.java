package com.reactivechat.socket.metrics;

import com.reactivechat.socket.config.SocketConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.Metrics;

/**
 * Exposes every meter of a chat node in Prometheus text format.
 * <p>
 * Chat meters and Reactor Netty's transport meters share one registry, so a single
 * {@code /metrics} scrape returns both, tagged with the node id.
 */
public class PrometheusMetricsExporter {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsExporter.class);
    static final String SERVICE_TAG = "chat-node";

    @Getter
    private final MeterRegistry registry;
    private final PrometheusMeterRegistry prometheusRegistry;

    public PrometheusMetricsExporter(SocketConfig config) {
        this.prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        if (Metrics.REGISTRY instanceof CompositeMeterRegistry composite) {
            composite.add(prometheusRegistry);
            this.registry = composite;
        } else {
            this.registry = prometheusRegistry;
        }
        registry.config().commonTags("node_id", config.getNodeId(), "service", SERVICE_TAG);
        log.info("Prometheus exporter ready, {} meters registered", registry.getMeters().size());
    }

    public String scrape() {
        String body = prometheusRegistry.scrape();
        log.debug("Prometheus scrape produced {} bytes", body.length());
        return body;
    }
}
