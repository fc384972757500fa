package com.franchise.resolution.cdi;

import com.franchise.resolution.api.BatchResolver;
import com.franchise.resolution.api.ResolverOptions;
import com.franchise.resolution.health.BackfillHealthCheck;
import com.franchise.resolution.health.HealthCheckRegistry;
import com.franchise.resolution.health.LookupServiceHealthCheck;
import com.franchise.resolution.lookup.HttpFranchiseLookupClient;
import com.franchise.resolution.metrics.MetricsService;
import com.franchise.resolution.metrics.MicrometerMetricsService;
import com.franchise.resolution.metrics.NoOpMetricsService;
import com.franchise.resolution.rules.KeyNormalizer;
import com.franchise.resolution.tracing.NoOpTracingService;
import com.franchise.resolution.tracing.OpenTelemetryTracingService;
import com.franchise.resolution.tracing.TracingService;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Tracer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * CDI producer wiring the resolver from MicroProfile Config properties.
 *
 * <pre>
 * franchise-resolution:
 *   lookup:
 *     base-url: https://franchise.example.com
 *     email: support-bot@example.com
 *     password: ${FRANCHISE_API_PASSWORD}
 *   resolver:
 *     max-concurrent-lookups: 8
 *     backfill-mode: await
 * </pre>
 *
 * <p>A {@link MeterRegistry} or OpenTelemetry {@link Tracer} bean, when present, is picked up
 * for metrics and tracing; otherwise the no-op implementations are used.</p>
 */
@ApplicationScoped
public class FranchiseResolutionProducer {

    private static final Logger log = LoggerFactory.getLogger(FranchiseResolutionProducer.class);

    // ── Lookup service ────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "franchise-resolution.lookup.base-url")
    String lookupBaseUrl;

    @Inject
    @ConfigProperty(name = "franchise-resolution.lookup.email")
    Optional<String> lookupEmail;

    @Inject
    @ConfigProperty(name = "franchise-resolution.lookup.password")
    Optional<String> lookupPassword;

    @Inject
    @ConfigProperty(name = "franchise-resolution.lookup.timeout-seconds", defaultValue = "10")
    int lookupTimeoutSeconds;

    @Inject
    @ConfigProperty(name = "franchise-resolution.lookup.digits-only", defaultValue = "true")
    boolean digitsOnlyIds;

    // ── Resolver ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "franchise-resolution.resolver.max-concurrent-lookups", defaultValue = "8")
    int maxConcurrentLookups;

    @Inject
    @ConfigProperty(name = "franchise-resolution.resolver.max-concurrent-backfills", defaultValue = "4")
    int maxConcurrentBackfills;

    @Inject
    @ConfigProperty(name = "franchise-resolution.resolver.lookup-timeout-millis", defaultValue = "10000")
    long lookupTimeoutMillis;

    @Inject
    @ConfigProperty(name = "franchise-resolution.resolver.backfill-mode", defaultValue = "await")
    String backfillMode;

    @Inject
    @ConfigProperty(name = "franchise-resolution.resolver.backfill-timeout-millis", defaultValue = "30000")
    long backfillTimeoutMillis;

    @Inject
    @ConfigProperty(name = "franchise-resolution.resolver.max-batch-size", defaultValue = "10000")
    int maxBatchSize;

    @Inject
    @ConfigProperty(name = "franchise-resolution.resolver.unresolved-placeholder", defaultValue = "No Outlet Found")
    String unresolvedPlaceholder;

    // ── Observability ─────────────────────────────────────────

    @Inject
    Instance<MeterRegistry> meterRegistry;

    @Inject
    Instance<Tracer> tracer;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public KeyNormalizer keyNormalizer() {
        return KeyNormalizer.of(digitsOnlyIds);
    }

    @Produces
    @ApplicationScoped
    public ResolverOptions resolverOptions() {
        ResolverOptions options = ResolverOptions.builder()
                .maxConcurrentLookups(maxConcurrentLookups)
                .maxConcurrentBackfills(maxConcurrentBackfills)
                .lookupTimeout(Duration.ofMillis(lookupTimeoutMillis))
                .backfillMode(parseBackfillMode(backfillMode))
                .backfillTimeout(Duration.ofMillis(backfillTimeoutMillis))
                .maxBatchSize(maxBatchSize)
                .unresolvedPlaceholder(unresolvedPlaceholder)
                .build();
        log.info("Resolver options: {}", options);
        return options;
    }

    @Produces
    @ApplicationScoped
    public HttpFranchiseLookupClient franchiseLookupClient(KeyNormalizer normalizer) {
        if (lookupEmail.isEmpty() || lookupPassword.isEmpty()) {
            log.warn("Franchise API credentials missing; lookups will fail until configured");
        }
        log.info("Producing HttpFranchiseLookupClient: baseUrl={}", lookupBaseUrl);
        return HttpFranchiseLookupClient.builder()
                .baseUrl(lookupBaseUrl)
                .email(lookupEmail.orElse(null))
                .password(lookupPassword.orElse(null))
                .timeout(Duration.ofSeconds(lookupTimeoutSeconds))
                .normalizer(normalizer)
                .build();
    }

    @Produces
    @ApplicationScoped
    public BatchResolver batchResolver(ResolverOptions options) {
        return BatchResolver.builder()
                .options(options)
                .metricsService(metricsService())
                .tracingService(tracingService())
                .build();
    }

    public void closeResolver(@Disposes BatchResolver resolver) {
        log.info("Closing BatchResolver");
        resolver.close();
    }

    @Produces
    @ApplicationScoped
    public HealthCheckRegistry healthCheckRegistry(HttpFranchiseLookupClient lookupClient, BatchResolver resolver) {
        HealthCheckRegistry registry = new HealthCheckRegistry();
        registry.register(new LookupServiceHealthCheck(lookupClient));
        registry.register(new BackfillHealthCheck(resolver));
        return registry;
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    MetricsService metricsService() {
        if (meterRegistry != null && meterRegistry.isResolvable()) {
            return new MicrometerMetricsService(meterRegistry.get());
        }
        return new NoOpMetricsService();
    }

    TracingService tracingService() {
        if (tracer != null && tracer.isResolvable()) {
            return new OpenTelemetryTracingService(tracer.get());
        }
        return new NoOpTracingService();
    }

    static ResolverOptions.BackfillMode parseBackfillMode(String value) {
        try {
            return ResolverOptions.BackfillMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Unknown backfill mode '{}', falling back to AWAIT", value);
            return ResolverOptions.BackfillMode.AWAIT;
        }
    }
}
