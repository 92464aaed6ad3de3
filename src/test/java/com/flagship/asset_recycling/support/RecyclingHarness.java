package com.flagship.asset_recycling.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.asset_recycling.admin.AdminService;
import com.flagship.asset_recycling.admin.PauseSwitch;
import com.flagship.asset_recycling.admin.SingleAdminAuthorizer;
import com.flagship.asset_recycling.collaborator.InMemoryAssetClassDirectory;
import com.flagship.asset_recycling.common.StateLock;
import com.flagship.asset_recycling.config.JacksonConfig;
import com.flagship.asset_recycling.config.RecyclingSettings;
import com.flagship.asset_recycling.ledger.RecyclingLedger;
import com.flagship.asset_recycling.observability.RecyclingMetrics;
import com.flagship.asset_recycling.outbox.OutboxEventStore;
import com.flagship.asset_recycling.outbox.OutboxService;
import com.flagship.asset_recycling.query.QueryService;
import com.flagship.asset_recycling.recycle.BatchCoordinator;
import com.flagship.asset_recycling.recycle.RecycleProcessor;
import com.flagship.asset_recycling.registry.AssetClassRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Wires the recycling services by hand, without a Spring context.
 */
public class RecyclingHarness {

    public static final String ADMIN = "admin";
    public static final String CUSTODY = "recycling-custody";
    public static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    public final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final ObjectMapper objectMapper = new JacksonConfig().objectMapper();
    public final StateLock stateLock = new StateLock();
    public final InMemoryAssetClassDirectory directory = new InMemoryAssetClassDirectory();
    public final OutboxEventStore outboxStore = new OutboxEventStore();
    public final OutboxService outboxService = new OutboxService(outboxStore, objectMapper, clock);
    public final PauseSwitch pauseSwitch = new PauseSwitch();
    public final RecyclingMetrics metrics = new RecyclingMetrics(meterRegistry);
    public final RecyclingSettings settings;
    public final AssetClassRegistry registry;
    public final RecyclingLedger ledger;
    public final RecycleProcessor processor;
    public final BatchCoordinator batch;
    public final AdminService admin;
    public final QueryService query;

    public RecyclingHarness() {
        this(RecyclingSettings.DEFAULT_MAX_POINTS_PER_UNIT);
    }

    public RecyclingHarness(long maxPointsPerUnit) {
        settings = RecyclingSettings.builder()
            .adminAddress(ADMIN)
            .custodyAddress(CUSTODY)
            .maxPointsPerUnit(maxPointsPerUnit)
            .build();
        registry = new AssetClassRegistry(directory, outboxService, stateLock, settings, clock);
        ledger = new RecyclingLedger(stateLock);
        processor = new RecycleProcessor(registry, ledger, outboxService, pauseSwitch, stateLock,
                settings, metrics, clock);
        batch = new BatchCoordinator(processor, pauseSwitch, outboxService, metrics, clock);
        admin = new AdminService(new SingleAdminAuthorizer(ADMIN), registry, pauseSwitch, outboxService,
                settings, metrics, clock);
        query = new QueryService(registry, ledger, directory, pauseSwitch, stateLock);
    }

    /** Binds the collaborator and registers it as an active class. */
    public FakeAssetClass activate(String classId, long pointsPerUnit, FakeAssetClass fake) {
        directory.bind(classId, fake);
        registry.register(classId, pointsPerUnit);
        return fake;
    }

    /** Sum of per-class counters across every registered class. */
    public long sumOfClassCounters() {
        return registry.findAll().stream().mapToLong(c -> c.getTotalRecycled()).sum();
    }

    /** Sum of points over every record in the ledger. */
    public long sumOfRecordPoints() {
        return ledger.snapshot().stream().mapToLong(r -> r.getPointsGenerated()).sum();
    }
}
