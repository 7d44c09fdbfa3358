package com.vtrates.application.service;

import com.vtrates.application.port.in.RateQueryUseCase.RateListing;
import com.vtrates.application.port.in.RateQueryUseCase.RateQuote;
import com.vtrates.application.port.out.RateCache;
import com.vtrates.domain.exception.CurrencyNotFoundException;
import com.vtrates.domain.exception.RateNotFoundException;
import com.vtrates.domain.exception.RateOutOfBoundsException;
import com.vtrates.domain.exception.StaleRateException;
import com.vtrates.domain.model.CurrencyPair;
import com.vtrates.domain.model.CurrencyRegistry;
import com.vtrates.domain.model.HistoryFilter;
import com.vtrates.domain.model.RateRecord;
import com.vtrates.domain.model.RateTable;
import io.vertx.core.Future;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static com.vtrates.TestFutures.awaitFailure;
import static com.vtrates.TestFutures.awaitResult;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit test for RateQueryService
 */
class RateQueryServiceTest {

    private static final Instant NOW = Instant.parse("2025-01-01T12:00:00Z");
    private static final Duration TTL = Duration.ofMinutes(5);
    private static final CurrencyPair BTC_USD = new CurrencyPair("BTC", "USD");

    @Mock
    private RateCache cache;

    private AutoCloseable mocks;
    private RateQueryService service;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        service = new RateQueryService(
                cache,
                CurrencyRegistry.of("USD", List.of("EUR"), List.of("BTC")),
                new FreshnessGate(Clock.fixed(NOW, ZoneOffset.UTC)),
                new RateValidator(1e-9, 1e9),
                TTL);
    }

    @AfterEach
    void tearDown() throws Exception {
        mocks.close();
    }

    @Test
    void getRate_shouldAnnotateFreshRate() throws InterruptedException {
        RateRecord record = RateRecord.direct(BTC_USD, 59337.21, NOW.minusSeconds(60), "coingecko");
        when(cache.get(BTC_USD)).thenReturn(Future.succeededFuture(Optional.of(record)));

        RateQuote quote = awaitResult(service.getRate("btc", "usd"));

        assertSame(record, quote.record());
        assertTrue(quote.fresh());
        assertEquals(Duration.ofSeconds(60), quote.age());
        assertEquals(1.0 / 59337.21, quote.inverseRate(), 1e-15);
    }

    @Test
    void getRate_shouldFlagStaleRate() throws InterruptedException {
        RateRecord record = RateRecord.direct(BTC_USD, 59337.21, NOW.minus(TTL), "coingecko");
        when(cache.get(BTC_USD)).thenReturn(Future.succeededFuture(Optional.of(record)));

        RateQuote quote = awaitResult(service.getRate("BTC", "USD"));

        assertFalse(quote.fresh());
        assertInstanceOf(StaleRateException.class, awaitFailure(service.getUsableRate("BTC", "USD")));
    }

    @Test
    void getRate_shouldFailWhenMissing() throws InterruptedException {
        when(cache.get(any())).thenReturn(Future.succeededFuture(Optional.empty()));

        assertInstanceOf(RateNotFoundException.class, awaitFailure(service.getRate("EUR", "BTC")));
    }

    @Test
    void getRate_shouldRejectUnknownCurrencyWithoutReadingCache() throws InterruptedException {
        assertInstanceOf(CurrencyNotFoundException.class, awaitFailure(service.getRate("XYZ", "USD")));
        assertInstanceOf(IllegalArgumentException.class, awaitFailure(service.getRate("USD", "USD")));
        verify(cache, never()).get(any());
    }

    @Test
    void getRate_shouldRejectCachedRateOutsideBounds() throws InterruptedException {
        RateQueryService strict = new RateQueryService(cache,
                CurrencyRegistry.of("USD", List.of("EUR"), List.of("BTC")),
                new FreshnessGate(Clock.fixed(NOW, ZoneOffset.UTC)),
                new RateValidator(0.001, 1000),
                TTL);
        when(cache.get(BTC_USD)).thenReturn(Future.succeededFuture(
                Optional.of(RateRecord.direct(BTC_USD, 59337.21, NOW, "coingecko"))));

        assertInstanceOf(RateOutOfBoundsException.class, awaitFailure(strict.getRate("BTC", "USD")));
    }

    @Test
    void getUsableRate_shouldReturnFreshRecord() throws InterruptedException {
        RateRecord record = RateRecord.direct(BTC_USD, 59337.21, NOW.minusSeconds(10), "coingecko");
        when(cache.get(BTC_USD)).thenReturn(Future.succeededFuture(Optional.of(record)));

        assertSame(record, awaitResult(service.getUsableRate("BTC", "USD")));
    }

    @Test
    void listRates_shouldReturnFilteredListing() throws InterruptedException {
        RateRecord btc = RateRecord.direct(BTC_USD, 59337.21, NOW, "coingecko");
        RateRecord eur = RateRecord.direct(new CurrencyPair("EUR", "USD"), 1.0786, NOW, "exchangerate");
        when(cache.load()).thenReturn(Future.succeededFuture(
                RateTable.of(List.of(btc, btc.invert(), eur, eur.invert()), NOW.minusSeconds(30))));

        RateListing listing = awaitResult(service.listRates("BTC", 1));

        assertEquals(List.of(btc), listing.records());
        assertEquals(4, listing.totalPairs());
        assertTrue(listing.fresh());
        assertEquals(NOW.minusSeconds(30), listing.lastRefresh());
    }

    @Test
    void listRates_shouldReportEmptyCacheAsNotFresh() throws InterruptedException {
        when(cache.load()).thenReturn(Future.succeededFuture(RateTable.empty()));

        RateListing listing = awaitResult(service.listRates(null, null));

        assertTrue(listing.records().isEmpty());
        assertFalse(listing.fresh());
        assertNull(listing.lastRefresh());
    }

    @Test
    void listRates_shouldValidateArguments() throws InterruptedException {
        assertInstanceOf(CurrencyNotFoundException.class, awaitFailure(service.listRates("XYZ", null)));
        assertInstanceOf(IllegalArgumentException.class, awaitFailure(service.listRates(null, -1)));
    }

    @Test
    void history_shouldDelegateToCache() throws InterruptedException {
        when(cache.history(any(), anyInt())).thenReturn(Future.succeededFuture(List.of()));

        assertTrue(awaitResult(service.history(null, 10)).isEmpty());
        verify(cache).history(eq(HistoryFilter.all()), eq(10));
        assertInstanceOf(IllegalArgumentException.class, awaitFailure(service.history(HistoryFilter.all(), -1)));
    }
}
