package com.example.feedreader.notification.auth;

import com.example.feedreader.shared.config.AppProperties;
import com.example.feedreader.shared.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpCookie;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * Resolves the session cookie into a user id exchange attribute. Requests
 * without a valid cookie pass through unauthenticated; each endpoint decides
 * how to answer them.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
@Slf4j
@RequiredArgsConstructor
public class SessionAuthenticationFilter implements WebFilter {

    private final SessionTokenVerifier sessionTokenVerifier;
    private final AppProperties appProperties;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        HttpCookie cookie = exchange.getRequest().getCookies().getFirst(appProperties.getAuth().getCookieName());
        if (cookie == null || cookie.getValue().isBlank()) {
            return chain.filter(exchange);
        }
        return sessionTokenVerifier.verify(cookie.getValue())
                .doOnNext(userId -> exchange.getAttributes().put(Constants.SESSION_USER_ATTRIBUTE, userId))
                .switchIfEmpty(Mono.fromRunnable(() ->
                        log.debug("Rejected session cookie on {}", exchange.getRequest().getPath())))
                .then(Mono.defer(() -> chain.filter(exchange)));
    }
}
