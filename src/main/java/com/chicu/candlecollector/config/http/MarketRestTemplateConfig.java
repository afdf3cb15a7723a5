package com.chicu.candlecollector.config.http;

import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP до бирж: общий пул соединений, жёсткие таймауты.
 * Таймаут ответа превращается в ResourceAccessException → Transient.
 */
@Configuration
public class MarketRestTemplateConfig {

    @Bean
    public PoolingHttpClientConnectionManager marketConnManager() {
        PoolingHttpClientConnectionManager cm = new PoolingHttpClientConnectionManager();
        cm.setMaxTotal(64);
        cm.setDefaultMaxPerRoute(16);   // на одну биржу
        return cm;
    }

    @Bean(destroyMethod = "close")
    public CloseableHttpClient marketHttpClient(PoolingHttpClientConnectionManager marketConnManager) {

        RequestConfig cfg = RequestConfig.custom()
                .setConnectTimeout(Timeout.ofSeconds(5))
                .setConnectionRequestTimeout(Timeout.ofSeconds(5))
                .setResponseTimeout(Timeout.ofSeconds(20))          // страница на 1000 свечей бывает тяжёлой
                .build();

        return HttpClients.custom()
                .setConnectionManager(marketConnManager)
                .setDefaultRequestConfig(cfg)
                .evictExpiredConnections()
                .evictIdleConnections(Timeout.ofSeconds(30))
                .build();
    }

    @Bean
    @Qualifier("marketRestTemplate")
    public RestTemplate marketRestTemplate(CloseableHttpClient marketHttpClient) {
        return new RestTemplate(new HttpComponentsClientHttpRequestFactory(marketHttpClient));
    }
}
