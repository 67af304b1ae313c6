package com.wagerdesk.warehouse;

import com.wagerdesk.common.data.DataAccess;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.util.concurrent.TimeUnit;

/**
 * Wires the warehouse {@link WebClient} and the {@link DataAccess} built on it.
 * Services pull this in with {@code @Import(WarehouseClientConfig.class)}.
 */
@Configuration
@EnableConfigurationProperties(WarehouseProperties.class)
public class WarehouseClientConfig {

    private static final Logger log = LoggerFactory.getLogger(WarehouseClientConfig.class);

    @Bean
    public WebClient warehouseWebClient(WebClient.Builder builder, WarehouseProperties props) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) props.connectTimeout().toMillis())
            .responseTimeout(props.responseTimeout())
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(props.responseTimeout().toMillis(), TimeUnit.MILLISECONDS))
            );

        return builder
            .baseUrl(props.baseUrl())
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public DataAccess warehouseDataAccess(@Qualifier("warehouseWebClient") WebClient warehouseWebClient, WarehouseProperties props) {
        return new WarehouseDataAccess(warehouseWebClient, props.headToHeadLimit(), props.responseTimeout());
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(request -> {
            log.debug("[Warehouse] Outbound request. method={} url={}", request.method(), request.url());
            return Mono.just(request);
        });
    }
}
