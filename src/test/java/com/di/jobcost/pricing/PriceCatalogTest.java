package com.di.jobcost.pricing;

import ch.qos.logback.classic.Level;
import com.di.jobcost.support.FakePricingCatalogClient;
import com.di.jobcost.support.LogCapture;
import com.di.jobcost.support.TestPricing;
import com.di.jobcost.usage.JobEnvironment;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PriceCatalog Tests")
class PriceCatalogTest {

    private PricingProperties properties;
    private LogCapture logs;

    @BeforeEach
    void setUp() {
        properties = TestPricing.pricingProperties();
        logs = LogCapture.forClass(PriceCatalog.class);
    }

    @AfterEach
    void tearDown() {
        logs.close();
    }

    private PriceCatalog catalog(PricingCatalogClient client) {
        return new PriceCatalog(properties, client, TestPricing.retryTemplate(3), new OnDemandPriceExtractor(new ObjectMapper()));
    }

    // ============================================================================
    // Worker-type (static) pricing
    // ============================================================================

    @Test
    @DisplayName("Worker type price comes from the region table")
    void workerTypeStaticPrice() {
        UnitPrice price = catalog(FakePricingCatalogClient.failing()).getWorkerTypePrice("us-west-1", "G.2X");

        assertEquals(0.50, price.getPricePerHour(), 1e-9);
        assertEquals(0.0, price.getFeePerHour());
        assertEquals(PriceSource.STATIC_TABLE, price.getSource());
        assertFalse(price.isDegraded());
    }

    @Test
    @DisplayName("Unknown region falls back to the baseline DPU-hour rate with a warning")
    void workerTypeUnknownRegionDefaults() {
        UnitPrice price = catalog(FakePricingCatalogClient.failing()).getWorkerTypePrice("eu-central-1", "G.1X");

        assertEquals(0.44, price.getPricePerHour(), 1e-9);
        assertEquals(PriceSource.DEFAULT_RATE, price.getSource());
        assertTrue(logs.hasMessage(Level.WARN, "eu-central-1"));
    }

    @Test
    @DisplayName("Worker type lookups are cached per (region, worker type)")
    void workerTypeCached() {
        PriceCatalog catalog = catalog(FakePricingCatalogClient.failing());

        UnitPrice first = catalog.getWorkerTypePrice("eu-central-1", "G.1X");
        UnitPrice second = catalog.getWorkerTypePrice("eu-central-1", "G.1X");

        assertSame(first, second);
        assertEquals(1, logs.messages(Level.WARN).size(), "default-rate warning logged once");
    }

    // ============================================================================
    // Instance (catalog) pricing
    // ============================================================================

    @Test
    @DisplayName("Instance price comes from the catalog with the service fee attached")
    void instanceCatalogPrice() {
        FakePricingCatalogClient client = FakePricingCatalogClient.returning(FakePricingCatalogClient.product("0.1980000000"));

        UnitPrice price = catalog(client).getInstancePrice("us-east-1", "m5.xlarge");

        assertEquals(0.198, price.getPricePerHour(), 1e-9);
        assertEquals(0.022, price.getFeePerHour(), 1e-9);
        assertEquals(PriceSource.CATALOG, price.getSource());
        assertEquals(1, client.callCount());
    }

    @Test
    @DisplayName("Catalog filter carries location, instance type and the fixed OS/tenancy/software terms")
    void catalogFilter() {
        FakePricingCatalogClient client = FakePricingCatalogClient.returning(FakePricingCatalogClient.product("0.2"));

        catalog(client).getInstancePrice("us-west-1", "m5.2xlarge");

        ProductFilter filter = client.calls().get(0);
        assertEquals("AmazonEC2", filter.getServiceCode());
        assertEquals("US West (N. California)", filter.getLocation());
        assertEquals("m5.2xlarge", filter.getInstanceType());
        assertEquals("Linux", filter.getOperatingSystem());
        assertEquals("NA", filter.getPreInstalledSoftware());
        assertEquals("Shared", filter.getTenancy());
    }

    @Test
    @DisplayName("Unmapped region uses the default catalog location")
    void catalogDefaultLocation() {
        FakePricingCatalogClient client = FakePricingCatalogClient.returning(FakePricingCatalogClient.product("0.2"));

        catalog(client).getInstancePrice("ap-south-1", "m5.xlarge");

        assertEquals("US East (N. Virginia)", client.calls().get(0).getLocation());
    }

    @Test
    @DisplayName("Second lookup of the same instance type is served from cache")
    void instanceCached() {
        FakePricingCatalogClient client = FakePricingCatalogClient.returning(FakePricingCatalogClient.product("0.192"));
        PriceCatalog catalog = catalog(client);

        UnitPrice first = catalog.getInstancePrice("us-east-1", "m5.xlarge");
        UnitPrice second = catalog.getInstancePrice("us-east-1", "m5.xlarge");

        assertSame(first, second);
        assertEquals(1, client.callCount());
    }

    @Test
    @DisplayName("Different regions are cached separately")
    void instanceCacheKeyIncludesRegion() {
        FakePricingCatalogClient client = FakePricingCatalogClient.returning(FakePricingCatalogClient.product("0.192"));
        PriceCatalog catalog = catalog(client);

        catalog.getInstancePrice("us-east-1", "m5.xlarge");
        catalog.getInstancePrice("us-west-1", "m5.xlarge");

        assertEquals(2, client.callCount());
    }

    @Test
    @DisplayName("Three failed attempts fall back to the static table; no fourth attempt is made")
    void catalogFailureFallsBackToStaticTable() {
        FakePricingCatalogClient client = FakePricingCatalogClient.failing();

        UnitPrice price = catalog(client).getInstancePrice("us-east-1", "m5.xlarge");

        assertEquals(3, client.callCount());
        assertEquals(0.192, price.getPricePerHour(), 1e-9);
        assertEquals(PriceSource.STATIC_FALLBACK, price.getSource());
        assertTrue(price.isDegraded());
        assertTrue(logs.hasMessage(Level.WARN, "degraded for m5.xlarge in us-east-1 after 3 attempt(s)"));
    }

    @Test
    @DisplayName("A transient failure is retried and the catalog price used")
    void catalogRecoversWithinBudget() {
        FakePricingCatalogClient client = FakePricingCatalogClient.failingTimes(2, FakePricingCatalogClient.product("0.21"));

        UnitPrice price = catalog(client).getInstancePrice("us-east-1", "m5.xlarge");

        assertEquals(3, client.callCount());
        assertEquals(0.21, price.getPricePerHour(), 1e-9);
        assertEquals(PriceSource.CATALOG, price.getSource());
        assertTrue(logs.messages(Level.WARN).isEmpty());
    }

    @Test
    @DisplayName("No static entry after catalog failure resolves to 0.0 with a warning")
    void priceUnavailable() {
        UnitPrice price = catalog(FakePricingCatalogClient.failing()).getInstancePrice("us-east-1", "x9.metal");

        assertEquals(0.0, price.getPricePerHour());
        assertEquals(0.0, price.getFeePerHour());
        assertEquals(PriceSource.UNAVAILABLE, price.getSource());
        assertTrue(logs.hasMessage(Level.WARN, "Price unavailable for x9.metal"));
    }

    @Test
    @DisplayName("Empty catalog answer falls back without retrying")
    void emptyCatalogAnswer() {
        FakePricingCatalogClient client = FakePricingCatalogClient.returning();

        UnitPrice price = catalog(client).getInstancePrice("us-west-1", "m5.xlarge");

        assertEquals(1, client.callCount());
        assertEquals(0.200, price.getPricePerHour(), 1e-9);
        assertEquals(PriceSource.STATIC_FALLBACK, price.getSource());
    }

    @Test
    @DisplayName("Unparseable product falls back to the static table after a single call")
    void extractionFailure() {
        FakePricingCatalogClient client = FakePricingCatalogClient.returning("{\"terms\":{}}");

        UnitPrice price = catalog(client).getInstancePrice("us-east-1", "m5.2xlarge");

        assertEquals(1, client.callCount());
        assertEquals(0.768, price.getPricePerHour(), 1e-9);
        assertEquals(PriceSource.STATIC_FALLBACK, price.getSource());
        assertTrue(logs.hasMessage(Level.WARN, "Catalog price unreadable for m5.2xlarge in us-east-1"));
        assertFalse(logs.hasMessage(Level.WARN, "attempt(s)"));
    }

    @Test
    @DisplayName("Disabled catalog reads the static table directly")
    void catalogDisabled() {
        properties.getCatalog().setEnabled(false);
        FakePricingCatalogClient client = FakePricingCatalogClient.returning(FakePricingCatalogClient.product("9.99"));

        UnitPrice price = catalog(client).getInstancePrice("us-east-1", "m5.xlarge");

        assertEquals(0, client.callCount());
        assertEquals(0.192, price.getPricePerHour(), 1e-9);
        assertEquals(PriceSource.STATIC_TABLE, price.getSource());
    }

    @Test
    @DisplayName("Concurrent first lookups of one key share a single catalog call")
    void concurrentLookupsShareOneFetch() throws Exception {
        FakePricingCatalogClient client = FakePricingCatalogClient.returning(FakePricingCatalogClient.product("0.192"));
        PriceCatalog catalog = catalog(client);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<UnitPrice>> tasks = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                tasks.add(() -> catalog.getInstancePrice("us-east-1", "m5.xlarge"));
            }
            List<Future<UnitPrice>> results = pool.invokeAll(tasks);
            UnitPrice first = results.get(0).get();
            for (Future<UnitPrice> f : results) {
                assertSame(first, f.get());
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, client.callCount());
    }

    // ============================================================================
    // Service fees and dispatch
    // ============================================================================

    @Test
    @DisplayName("Service fee defaults to 0.0 for unknown combinations")
    void serviceFee() {
        PriceCatalog catalog = catalog(FakePricingCatalogClient.failing());
        assertEquals(0.05, catalog.getServiceFee("us-east-1", "m5.2xlarge"), 1e-9);
        assertEquals(0.0, catalog.getServiceFee("us-east-1", "r5.large"));
        assertEquals(0.0, catalog.getServiceFee("eu-west-1", "m5.xlarge"));
    }

    @Test
    @DisplayName("Unit price dispatches by environment")
    void unitPriceDispatch() {
        FakePricingCatalogClient client = FakePricingCatalogClient.returning(FakePricingCatalogClient.product("0.192"));
        PriceCatalog catalog = catalog(client);

        assertEquals(0.44, catalog.getUnitPrice(JobEnvironment.GLUE, "us-east-1", "G.1X").getPricePerHour(), 1e-9);
        assertEquals(0, client.callCount());
        assertEquals(0.214, catalog.getUnitPrice(JobEnvironment.EMR, "us-east-1", "m5.xlarge").getTotalPerHour(), 1e-9);
        assertEquals(1, client.callCount());
    }
}
