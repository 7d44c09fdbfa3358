package com.vtrates.adapter.in.web;

import com.vtrates.application.port.in.RateQueryUseCase;
import com.vtrates.application.port.in.RateQueryUseCase.RateListing;
import com.vtrates.application.port.in.RateQueryUseCase.RateQuote;
import com.vtrates.application.port.in.RateRefreshSchedulerUseCase;
import com.vtrates.application.port.in.RateRefreshSchedulerUseCase.SchedulerStatus;
import com.vtrates.application.port.in.RateUpdateUseCase;
import com.vtrates.domain.exception.CurrencyNotFoundException;
import com.vtrates.domain.exception.PersistenceException;
import com.vtrates.domain.exception.RateNotFoundException;
import com.vtrates.domain.exception.RateOutOfBoundsException;
import com.vtrates.domain.exception.StaleRateException;
import com.vtrates.domain.model.CurrencyClass;
import com.vtrates.domain.model.CurrencyPair;
import com.vtrates.domain.model.HistoryEntry;
import com.vtrates.domain.model.HistoryFilter;
import com.vtrates.domain.model.RateCounts;
import com.vtrates.domain.model.RateRecord;
import com.vtrates.domain.model.SourceReport;
import com.vtrates.domain.model.UpdateResult;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpServer;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.vtrates.TestFutures.awaitResult;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests the HTTP command surface with mocked use cases
 */
class WebRouterTest {

    private static final Instant NOW = Instant.parse("2025-01-01T12:00:00Z");
    private static final CurrencyPair BTC_USD = new CurrencyPair("BTC", "USD");

    @Mock
    private RateUpdateUseCase updateUseCase;

    @Mock
    private RateQueryUseCase queryUseCase;

    @Mock
    private RateRefreshSchedulerUseCase scheduler;

    private AutoCloseable mocks;
    private Vertx vertx;
    private WebClient client;
    private int port;

    @BeforeEach
    void setUp() throws InterruptedException {
        mocks = MockitoAnnotations.openMocks(this);
        vertx = Vertx.vertx();

        when(updateUseCase.sourceNames()).thenReturn(List.of("exchangerate", "coingecko"));
        when(scheduler.status()).thenReturn(new SchedulerStatus(true, false, 3, 2, 1, 0,
                NOW, NOW.plusSeconds(300), null, Duration.ofSeconds(300), Duration.ofSeconds(300)));

        Router router = Router.router(vertx);
        new WebRouter(router, updateUseCase, queryUseCase, scheduler).setupRoutes();
        HttpServer server = awaitResult(vertx.createHttpServer().requestHandler(router).listen(0));
        port = server.actualPort();
        client = WebClient.create(vertx);
    }

    @AfterEach
    void tearDown() throws Exception {
        client.close();
        CountDownLatch latch = new CountDownLatch(1);
        vertx.close().onComplete(ar -> latch.countDown());
        latch.await(5, TimeUnit.SECONDS);
        mocks.close();
    }

    private HttpResponse<Buffer> get(String uri) throws InterruptedException {
        return awaitResult(client.get(port, "localhost", uri).send());
    }

    private HttpResponse<Buffer> post(String uri) throws InterruptedException {
        return awaitResult(client.post(port, "localhost", uri).send());
    }

    private static UpdateResult result(boolean success) {
        Map<CurrencyClass, RateCounts> counts = Map.of(CurrencyClass.CRYPTO, new RateCounts(1, 4, 0));
        List<SourceReport> reports = List.of(SourceReport.success("coingecko", 1, 15));
        return success
                ? new UpdateResult("ab12cd34", true, counts, reports, 4, 20, NOW, null)
                : UpdateResult.failed("ab12cd34", counts, reports, 20, "All 2 rate sources failed");
    }

    @Test
    void postUpdate_shouldRunThroughScheduler() throws InterruptedException {
        when(scheduler.runNow()).thenReturn(Future.succeededFuture(result(true)));

        HttpResponse<Buffer> response = post("/api/rates/update");

        assertEquals(200, response.statusCode());
        JsonObject body = response.bodyAsJsonObject();
        assertEquals("success", body.getString("status"));
        assertEquals(4, body.getInteger("totalSaved"));
        assertEquals("2025-01-01T12:00:00Z", body.getString("lastRefresh"));
        assertEquals(4, body.getJsonObject("counts").getJsonObject("CRYPTO").getInteger("saved"));
        assertEquals("coingecko", body.getJsonArray("sources").getJsonObject(0).getString("source"));
        verify(updateUseCase, never()).run(any());
    }

    @Test
    void postUpdate_shouldPassSourceFilter() throws InterruptedException {
        when(updateUseCase.run("coingecko")).thenReturn(Future.succeededFuture(result(true)));

        assertEquals(200, post("/api/rates/update?source=coingecko").statusCode());
        verify(scheduler, never()).runNow();
    }

    @Test
    void postUpdate_shouldAnswer503WhenAllSourcesFailed() throws InterruptedException {
        when(scheduler.runNow()).thenReturn(Future.succeededFuture(result(false)));

        HttpResponse<Buffer> response = post("/api/rates/update?source=all");

        assertEquals(503, response.statusCode());
        assertEquals("error", response.bodyAsJsonObject().getString("status"));
        assertEquals("All 2 rate sources failed", response.bodyAsJsonObject().getString("message"));
    }

    @Test
    void postUpdate_shouldMapErrors() throws InterruptedException {
        when(updateUseCase.run("yahoo")).thenReturn(Future.failedFuture(new IllegalArgumentException("Unknown rate source")));
        when(updateUseCase.run("coingecko")).thenReturn(Future.failedFuture(
                new PersistenceException("Failed to write rates.json", new RuntimeException("disk full"))));

        assertEquals(400, post("/api/rates/update?source=yahoo").statusCode());
        assertEquals(500, post("/api/rates/update?source=coingecko").statusCode());
    }

    @Test
    void getRates_shouldListWithFilters() throws InterruptedException {
        RateRecord record = RateRecord.direct(BTC_USD, 59337.21, NOW, "coingecko");
        when(queryUseCase.listRates("BTC", 5)).thenReturn(Future.succeededFuture(
                new RateListing(List.of(record), NOW, true, 12)));

        HttpResponse<Buffer> response = get("/api/rates?currency=BTC&top=5");

        assertEquals(200, response.statusCode());
        JsonObject body = response.bodyAsJsonObject();
        assertEquals(1, body.getInteger("count"));
        assertEquals(12, body.getInteger("totalPairs"));
        assertTrue(body.getBoolean("fresh"));
        JsonObject rate = body.getJsonArray("rates").getJsonObject(0);
        assertEquals("BTC_USD", rate.getString("pair"));
        assertEquals(59337.21, rate.getDouble("rate"));
        assertEquals("DIRECT", rate.getString("origin"));
    }

    @Test
    void getRates_shouldRejectBadTopAndUnknownCurrency() throws InterruptedException {
        when(queryUseCase.listRates(eq("XYZ"), any())).thenReturn(Future.failedFuture(new CurrencyNotFoundException("XYZ")));

        assertEquals(400, get("/api/rates?top=many").statusCode());
        assertEquals(400, get("/api/rates?currency=XYZ").statusCode());
    }

    @Test
    void getRate_shouldReturnAnnotatedQuote() throws InterruptedException {
        RateRecord record = RateRecord.direct(BTC_USD, 50000.0, NOW.minusSeconds(600), "coingecko");
        when(queryUseCase.getRate("btc", "usd")).thenReturn(Future.succeededFuture(
                new RateQuote(record, false, Duration.ofSeconds(600), Duration.ofSeconds(300))));

        HttpResponse<Buffer> response = get("/api/rates/btc/usd");

        assertEquals(200, response.statusCode());
        JsonObject body = response.bodyAsJsonObject();
        assertEquals(50000.0, body.getDouble("rate"));
        assertEquals(0.00002, body.getDouble("inverseRate"), 1e-12);
        assertFalse(body.getBoolean("fresh"));
        assertEquals(600L, body.getLong("ageSeconds"));
        assertEquals(300L, body.getLong("ttlSeconds"));
    }

    @Test
    void getRate_strictShouldAnswer409WhenStale() throws InterruptedException {
        when(queryUseCase.getUsableRate("BTC", "USD")).thenReturn(Future.failedFuture(
                new StaleRateException(BTC_USD, Duration.ofSeconds(600), Duration.ofSeconds(300))));

        HttpResponse<Buffer> response = get("/api/rates/BTC/USD?strict=true");

        assertEquals(409, response.statusCode());
        assertEquals("error", response.bodyAsJsonObject().getString("status"));
    }

    @Test
    void getRate_shouldAnswer409WhenStoredRateIsOutOfBounds() throws InterruptedException {
        when(queryUseCase.getRate("BTC", "USD")).thenReturn(Future.failedFuture(
                new RateOutOfBoundsException(BTC_USD, 5e9, 1e-9, 1e9)));

        HttpResponse<Buffer> response = get("/api/rates/BTC/USD");

        assertEquals(409, response.statusCode());
        assertTrue(response.bodyAsJsonObject().getString("message").contains("BTC_USD"));
    }

    @Test
    void getRate_shouldAnswer404WhenNoRate() throws InterruptedException {
        when(queryUseCase.getRate("GBP", "JPY")).thenReturn(Future.failedFuture(
                new RateNotFoundException(new CurrencyPair("GBP", "JPY"))));

        assertEquals(404, get("/api/rates/GBP/JPY").statusCode());
    }

    @Test
    void getHistory_shouldBuildFilter() throws InterruptedException {
        HistoryEntry entry = new HistoryEntry("BTC_USD_x_1", BTC_USD, 59337.21, NOW, "coingecko", Map.of("origin", "DIRECT"));
        when(queryUseCase.history(any(), anyInt())).thenReturn(Future.succeededFuture(List.of(entry)));

        HttpResponse<Buffer> response = get("/api/rates/history?pair=btc_usd&source=coingecko&since=2024-12-31T00:00:00Z&limit=5");

        assertEquals(200, response.statusCode());
        assertEquals(1, response.bodyAsJsonObject().getInteger("count"));
        assertEquals("BTC_USD_x_1", response.bodyAsJsonObject().getJsonArray("entries").getJsonObject(0).getString("id"));

        ArgumentCaptor<HistoryFilter> filter = ArgumentCaptor.forClass(HistoryFilter.class);
        verify(queryUseCase).history(filter.capture(), eq(5));
        assertEquals(BTC_USD, filter.getValue().pair());
        assertEquals("coingecko", filter.getValue().source());
        assertEquals(Instant.parse("2024-12-31T00:00:00Z"), filter.getValue().since());
    }

    @Test
    void getHistory_shouldRejectBadParameters() throws InterruptedException {
        assertEquals(400, get("/api/rates/history?pair=BTCUSD").statusCode());
        assertEquals(400, get("/api/rates/history?since=yesterday").statusCode());
        verify(queryUseCase, never()).history(any(), anyInt());
    }

    @Test
    void getScheduler_shouldReturnStatus() throws InterruptedException {
        HttpResponse<Buffer> response = get("/api/scheduler");

        JsonObject body = response.bodyAsJsonObject();
        assertEquals(200, response.statusCode());
        assertTrue(body.getBoolean("running"));
        assertEquals(3, body.getInteger("scheduledRuns"));
        assertEquals(300, body.getInteger("updateIntervalSeconds"));
        assertNull(body.getValue("lastResult"));
    }

    @Test
    void healthAndRoot_shouldDescribeService() throws InterruptedException {
        JsonObject health = get("/health").bodyAsJsonObject();
        assertEquals("UP", health.getString("status"));
        assertEquals("RUNNING", health.getString("scheduler"));

        JsonObject root = get("/").bodyAsJsonObject();
        assertEquals(List.of("exchangerate", "coingecko"), root.getJsonArray("sources").getList());
    }

    @Test
    void unknownPath_shouldAnswer404() throws InterruptedException {
        HttpResponse<Buffer> response = get("/api/unknown");

        assertEquals(404, response.statusCode());
        assertEquals("Endpoint not found", response.bodyAsJsonObject().getString("message"));
    }
}
