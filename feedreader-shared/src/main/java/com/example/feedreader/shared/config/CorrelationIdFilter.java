package com.example.feedreader.shared.config;

import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Tags each request with a correlation id. The id is in the MDC only while the
 * filter chain is assembled, on the calling thread; reactive code further
 * downstream reads it from the Reactor context under {@link #CORRELATION_ID_KEY}.
 */
@Component
public class CorrelationIdFilter implements WebFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_KEY = "correlation_id";

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String header = exchange.getRequest().getHeaders().getFirst(CORRELATION_ID_HEADER);
        String correlationId = header == null || header.isEmpty() ? UUID.randomUUID().toString() : header;

        exchange.getResponse().getHeaders().set(CORRELATION_ID_HEADER, correlationId);
        MDC.put(CORRELATION_ID_KEY, correlationId);
        try {
            return chain.filter(exchange)
                    .contextWrite(context -> context.put(CORRELATION_ID_KEY, correlationId));
        } finally {
            MDC.remove(CORRELATION_ID_KEY);
        }
    }
}
