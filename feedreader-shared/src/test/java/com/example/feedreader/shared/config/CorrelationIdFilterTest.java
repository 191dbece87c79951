package com.example.feedreader.shared.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void filter_afterAssembly_leavesNoCorrelationIdOnThread() {
        // given
        var exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/sse/notifications")
                .header(CorrelationIdFilter.CORRELATION_ID_HEADER, "corr-1"));
        var duringAssembly = new AtomicReference<String>();
        var inContext = new AtomicReference<String>();
        WebFilterChain chain = ex -> {
            duringAssembly.set(MDC.get(CorrelationIdFilter.CORRELATION_ID_KEY));
            return Mono.deferContextual(context -> {
                inContext.set(context.get(CorrelationIdFilter.CORRELATION_ID_KEY));
                return Mono.<Void>empty();
            });
        };

        // when
        var result = filter.filter(exchange, chain);

        // then
        assertThat(MDC.get(CorrelationIdFilter.CORRELATION_ID_KEY)).isNull();
        StepVerifier.create(result).verifyComplete();
        assertThat(duringAssembly.get()).isEqualTo("corr-1");
        assertThat(inContext.get()).isEqualTo("corr-1");
        assertThat(exchange.getResponse().getHeaders().getFirst(CorrelationIdFilter.CORRELATION_ID_HEADER))
                .isEqualTo("corr-1");
    }

    @Test
    void filter_withoutHeader_generatesId() {
        var exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/v1/jobs/j1"));

        StepVerifier.create(filter.filter(exchange, ex -> Mono.empty())).verifyComplete();

        assertThat(exchange.getResponse().getHeaders().getFirst(CorrelationIdFilter.CORRELATION_ID_HEADER))
                .isNotBlank();
    }
}
