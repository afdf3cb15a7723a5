package com.chicu.candlecollector.exchange.config;

import com.chicu.candlecollector.common.time.Sleeper;
import com.chicu.candlecollector.exchange.binance.BinanceExchangeClient;
import com.chicu.candlecollector.exchange.bybit.BybitExchangeClient;
import com.chicu.candlecollector.exchange.client.ExchangeClientFactory;
import com.chicu.candlecollector.exchange.client.RetryPolicy;
import com.chicu.candlecollector.exchange.gate.GateExchangeClient;
import com.chicu.candlecollector.exchange.okx.OkxExchangeClient;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * Регистрирует адаптеры всех бирж в ExchangeClientFactory.
 */
@Slf4j
@Configuration
public class ExchangeClientConfig {

    private final ExchangeClientFactory factory;
    private final RestTemplate rest;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;

    public ExchangeClientConfig(ExchangeClientFactory factory,
                                @Qualifier("marketRestTemplate") RestTemplate rest,
                                RetryPolicy retryPolicy,
                                Sleeper sleeper) {
        this.factory = factory;
        this.rest = rest;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
    }

    @PostConstruct
    public void register() {
        log.info("🔧 Регистрация адаптеров бирж…");

        factory.register(BinanceExchangeClient.CODE,
                (network, rpm) -> new BinanceExchangeClient(rest, network, rpm, retryPolicy, sleeper));

        factory.register(BybitExchangeClient.CODE,
                (network, rpm) -> new BybitExchangeClient(rest, network, rpm, retryPolicy, sleeper));

        factory.register(OkxExchangeClient.CODE,
                (network, rpm) -> new OkxExchangeClient(rest, network, rpm, retryPolicy, sleeper));

        factory.register(GateExchangeClient.CODE,
                (network, rpm) -> new GateExchangeClient(rest, network, rpm, retryPolicy, sleeper));

        log.info("✅ Адаптеры бирж зарегистрированы: {}", factory.supportedExchanges());
    }
}
