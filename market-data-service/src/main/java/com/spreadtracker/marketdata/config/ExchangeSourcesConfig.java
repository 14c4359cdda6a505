package com.spreadtracker.marketdata.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.spreadtracker.marketdata.source.ExchangeResponseFormat;
import com.spreadtracker.marketdata.source.HttpPriceSourceAdapter;
import com.spreadtracker.marketdata.source.MarketGroup;
import com.spreadtracker.marketdata.source.PriceSourceAdapter;
import com.spreadtracker.marketdata.source.PriceSourceGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Declares the exchange adapters of each {@link MarketGroup}.
 *
 * <p>Endpoints default to the public ticker URLs below; any of them can be replaced via
 * {@code exchanges.url-overrides} (SpEL map keyed by exchange name), e.g. to point at a
 * sandbox or a local stub.
 */
@Configuration
public class ExchangeSourcesConfig {

    private static final Logger log = LoggerFactory.getLogger(ExchangeSourcesConfig.class);

    private record SourceDefinition(String name, String defaultUrl, ExchangeResponseFormat format) {}

    private static final List<SourceDefinition> INTERNATIONAL = List.of(
        new SourceDefinition("Bitstamp", "https://www.bitstamp.net/api/v2/ticker/btcusd/",
                             ExchangeResponseFormat.BITSTAMP),
        new SourceDefinition("Bitfinex", "https://api-pub.bitfinex.com/v2/ticker/tBTCUSD",
                             ExchangeResponseFormat.BITFINEX),
        new SourceDefinition("Binance",  "https://api.binance.us/api/v3/ticker/price?symbol=BTCUSD",
                             ExchangeResponseFormat.BINANCE),
        new SourceDefinition("Kraken",   "https://api.kraken.com/0/public/Ticker?pair=XBTUSD",
                             ExchangeResponseFormat.KRAKEN),
        new SourceDefinition("KuCoin",   "https://api.kucoin.com/api/v1/market/stats?symbol=BTC-USDT",
                             ExchangeResponseFormat.KUCOIN)
    );

    private static final List<SourceDefinition> LOCAL = List.of(
        new SourceDefinition("LUNO",          "https://api.luno.com/api/1/ticker?pair=XBTZAR",
                             ExchangeResponseFormat.LUNO),
        new SourceDefinition("VALR",          "https://api.valr.com/v1/public/BTCZAR/marketsummary",
                             ExchangeResponseFormat.VALR),
        new SourceDefinition("AltcoinTrader", "https://api.altcointrader.co.za/v3/live-stats",
                             ExchangeResponseFormat.ALTCOIN_TRADER)
    );

    @Value("#{${exchanges.url-overrides:{:}}}")
    private Map<String, String> urlOverrides;

    @Bean
    public PriceSourceGroup internationalSources(WebClient exchangeWebClient, ObjectMapper objectMapper, Clock clock) {
        return buildGroup(MarketGroup.INTERNATIONAL, INTERNATIONAL, exchangeWebClient, objectMapper, clock);
    }

    @Bean
    public PriceSourceGroup localSources(WebClient exchangeWebClient, ObjectMapper objectMapper, Clock clock) {
        return buildGroup(MarketGroup.LOCAL, LOCAL, exchangeWebClient, objectMapper, clock);
    }

    private PriceSourceGroup buildGroup(MarketGroup group, List<SourceDefinition> definitions,
                                        WebClient webClient, ObjectMapper objectMapper, Clock clock) {
        List<PriceSourceAdapter> adapters = definitions.stream()
            .<PriceSourceAdapter>map(def -> new HttpPriceSourceAdapter(
                def.name(), group.currency(),
                urlOverrides.getOrDefault(def.name(), def.defaultUrl()),
                def.format(), webClient, objectMapper, clock))
            .toList();
        PriceSourceGroup sourceGroup = new PriceSourceGroup(group, adapters);
        log.info("Price sources configured. group={} exchanges={}", group, sourceGroup.exchangeNames());
        return sourceGroup;
    }
}
