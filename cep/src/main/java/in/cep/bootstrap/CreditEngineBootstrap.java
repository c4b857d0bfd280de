package in.cep.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.cep.application.port.output.AttestationPublisher;
import in.cep.application.port.output.CreditStore;
import in.cep.application.port.output.LiquidityPayments;
import in.cep.application.service.CreditEnvelopeService;
import in.cep.config.CreditPolicyConfig;
import in.cep.infrastructure.lightning.Bolt11AmountDecoder;
import in.cep.infrastructure.metrics.PrometheusCreditMetrics;
import in.cep.infrastructure.metrics.PrometheusMetricsHandler;
import in.cep.infrastructure.persistence.CreditSchemaMigration;
import in.cep.infrastructure.persistence.InMemoryCreditStore;
import in.cep.infrastructure.persistence.PostgresCreditStore;
import in.cep.security.ReceiptSigner;
import in.cep.util.Env;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Undertow;
import io.undertow.server.handlers.PathHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the credit engine from the environment.
 *
 * The HTTP surface of the protocol lives with the embedding service; this class only builds the
 * engine, its store and the optional Prometheus endpoint. The payment and attestation collaborators
 * are supplied by the caller.
 */
public final class CreditEngineBootstrap implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CreditEngineBootstrap.class);

    private final CreditPolicyConfig policy;
    private final ReceiptSigner signer;
    private final CollectorRegistry registry;
    private final PrometheusCreditMetrics metrics;
    private final CreditStore store;
    private final HikariDataSource dataSource;     // null for the in-memory store
    private final ExecutorService executor;
    private final Undertow metricsServer;          // null when CEP_METRICS_PORT is unset

    private CreditEngineBootstrap(CreditPolicyConfig policy, ReceiptSigner signer, CollectorRegistry registry,
                                  CreditStore store, HikariDataSource dataSource, ExecutorService executor,
                                  Undertow metricsServer) {
        this.policy = policy;
        this.signer = signer;
        this.registry = registry;
        this.metrics = new PrometheusCreditMetrics(registry);
        this.store = store;
        this.dataSource = dataSource;
        this.executor = executor;
        this.metricsServer = metricsServer;
    }

    /**
     * Load configuration, validate it, and bring up the store and metrics endpoint.
     *
     * @throws IllegalStateException if configuration is invalid
     */
    public static CreditEngineBootstrap fromEnv() {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("Credit Envelope engine starting");
        log.info("═══════════════════════════════════════════════════════════════");

        CreditPolicyConfig policy = CreditPolicyConfig.fromEnv();
        ReceiptSigner signer = ReceiptSigner.fromBase64(
            Env.get("CEP_RECEIPT_SIGNING_PRIVATE_KEY", null),
            Env.get("CEP_RECEIPT_SIGNING_PUBLIC_KEY", null));
        StartupConfigValidator.validate(policy, signer);

        HikariDataSource dataSource = null;
        CreditStore store;
        String dbUrl = Env.get("CEP_DB_URL", null);
        if (dbUrl != null) {
            dataSource = createDataSource(dbUrl);
            new CreditSchemaMigration(dataSource).migrate();
            store = new PostgresCreditStore(dataSource);
            log.info("✓ Credit store: PostgreSQL");
        } else {
            store = new InMemoryCreditStore();
            log.warn("⚠️  CEP_DB_URL not set - using in-memory credit store (state is lost on restart)");
        }

        CollectorRegistry registry = new CollectorRegistry(true);
        ExecutorService executor = createExecutor(Env.getInt("CEP_WORKER_THREADS", 8));
        Undertow metricsServer = startMetricsServer(Env.getInt("CEP_METRICS_PORT", 0), registry);

        return new CreditEngineBootstrap(policy, signer, registry, store, dataSource, executor, metricsServer);
    }

    /**
     * Build the engine around the caller's payment and attestation collaborators.
     */
    public CreditEnvelopeService start(LiquidityPayments payments, AttestationPublisher attestations) {
        CreditEnvelopeService service = new CreditEnvelopeService(
            store,
            payments,
            attestations == null ? AttestationPublisher.none() : attestations,
            new Bolt11AmountDecoder(),
            signer,
            policy,
            metrics,
            Clock.systemUTC(),
            executor);
        log.info("✓ Credit engine ready (signing={}, exclusive_offer_acceptance={})",
            signer.isEnabled(), policy.exclusiveOfferAcceptance());
        return service;
    }

    public CreditPolicyConfig policy() {
        return policy;
    }

    public CreditStore store() {
        return store;
    }

    public CollectorRegistry registry() {
        return registry;
    }

    @Override
    public void close() {
        log.info("Credit engine shutting down");
        if (metricsServer != null) {
            metricsServer.stop();
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Credit workers did not finish within 10s, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        if (dataSource != null) {
            dataSource.close();
        }
    }

    private static HikariDataSource createDataSource(String url) {
        String user = Env.get("CEP_DB_USER", "postgres");
        String pass = Env.get("CEP_DB_PASSWORD", "postgres");
        int maxPool = Env.getInt("CEP_DB_POOL_SIZE", 10);

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setUsername(user);
        config.setPassword(pass);
        config.setMaximumPoolSize(maxPool);
        config.setMinimumIdle(2);
        config.setConnectionTimeout(5000);
        config.setPoolName("cep-hikari");

        log.info("DB: url={}, user={}, pool={}", url, user, maxPool);
        return new HikariDataSource(config);
    }

    private static ExecutorService createExecutor(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(threads, 1), r -> {
            Thread t = new Thread(r, "cep-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    private static Undertow startMetricsServer(int port, CollectorRegistry registry) {
        if (port <= 0) {
            log.info("Metrics endpoint disabled (CEP_METRICS_PORT not set)");
            return null;
        }
        Undertow server = Undertow.builder()
            .addHttpListener(port, "0.0.0.0")
            .setHandler(new PathHandler().addExactPath("/metrics", new PrometheusMetricsHandler(registry)))
            .build();
        server.start();
        log.info("✓ Metrics endpoint started on http://localhost:{}/metrics", port);
        return server;
    }
}
