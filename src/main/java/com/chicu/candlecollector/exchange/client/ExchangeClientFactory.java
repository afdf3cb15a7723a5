package com.chicu.candlecollector.exchange.client;

import com.chicu.candlecollector.common.enums.NetworkType;
import com.chicu.candlecollector.domain.Exchange;
import com.chicu.candlecollector.exchange.exception.FatalExchangeException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Реестр адаптеров бирж.
 *
 * Один клиент (и один лимитер) на (биржа, сеть, лимит): все пары и таймфреймы
 * одной биржи делят общий бюджет запросов.
 */
@Slf4j
@Component
public class ExchangeClientFactory {

    private static final String TESTNET_SUFFIX = "_testnet";

    /** Создаёт клиента под сеть и лимит (null: лимит по умолчанию адаптера). */
    @FunctionalInterface
    public interface Creator {
        ExchangeClient create(NetworkType network, Integer requestsPerMinute);
    }

    private final Map<String, Creator> creators = new ConcurrentHashMap<>();
    private final Map<Key, ExchangeClient> clients = new ConcurrentHashMap<>();

    // ============================
    // РЕГИСТРАЦИЯ
    // ============================
    public void register(String exchange, Creator creator) {
        String normalized = normalize(exchange);
        creators.put(normalized, creator);
        log.info("🔌 Зарегистрирован адаптер: {}", normalized);
    }

    public Set<String> supportedExchanges() {
        return Set.copyOf(creators.keySet());
    }

    // ============================
    // ПОЛУЧЕНИЕ ПО EXCHANGE
    // ============================

    /**
     * Клиент для записи exchanges. Код "binance_testnet" всегда даёт тестовую сеть.
     *
     * @throws FatalExchangeException адаптера для биржи нет
     */
    public ExchangeClient get(Exchange exchange) throws FatalExchangeException {
        String code = exchange.normalizedCode();

        NetworkType network = exchange.getEnvironment() == null ? NetworkType.MAINNET : exchange.getEnvironment();
        String venue = code;
        if (code.endsWith(TESTNET_SUFFIX)) {
            venue = code.substring(0, code.length() - TESTNET_SUFFIX.length());
            network = NetworkType.TESTNET;
        }

        Creator creator = creators.get(venue);
        if (creator == null) {
            throw new FatalExchangeException(code, "❌ Нет адаптера для биржи: " + code);
        }

        Key key = new Key(venue, network, exchange.getRateLimitPerMinute());
        NetworkType net = network;
        return clients.computeIfAbsent(key, k -> {
            log.info("🆕 Клиент {} / {} (rpm={})", k.exchange(), net, k.requestsPerMinute() == null ? "default" : k.requestsPerMinute());
            return creator.create(net, k.requestsPerMinute());
        });
    }

    // ============================
    // ВСПОМОГАТЕЛЬНЫЕ
    // ============================
    private String normalize(String exchange) {
        return exchange.trim().toLowerCase(Locale.ROOT);
    }

    private record Key(String exchange, NetworkType networkType, Integer requestsPerMinute) {}
}
