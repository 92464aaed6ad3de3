package com.flagship.asset_recycling.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.asset_recycling.event.AssetRecycledEvent;
import com.flagship.asset_recycling.event.RecyclingEvent;
import com.flagship.asset_recycling.support.FakeAssetClass;
import com.flagship.asset_recycling.support.RecyclingHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox persistence and publish bookkeeping, without a broker.
 */
class OutboxServiceTest {

    private RecyclingHarness harness;
    private OutboxService outboxService;

    @BeforeEach
    void setUp() {
        harness = new RecyclingHarness();
        outboxService = harness.outboxService;
    }

    private OutboxEvent recycleOne() {
        harness.activate("GEMS", 100, FakeAssetClass.destructible().mint(1, "alice"));
        harness.processor.recycleByDestruction("alice", "GEMS", BigInteger.ONE);
        return outboxService.getEventsOfType(AssetRecycledEvent.EVENT_TYPE).get(0);
    }

    @Test
    @DisplayName("A recycle commit writes an AssetRecycled event with a JSON payload")
    void recycleWritesEvent() throws Exception {
        OutboxEvent event = recycleOne();

        assertEquals(RecyclingEvent.AGGREGATE_RECYCLING, event.getAggregateType());
        assertEquals("GEMS", event.getAggregateKey());
        assertEquals(0, event.getRetryCount());
        assertEquals(RecyclingHarness.NOW, event.getCreatedAt());

        JsonNode payload = harness.objectMapper.readTree(event.getPayload());
        assertEquals("alice", payload.get("actor").asText());
        assertEquals(100, payload.get("pointsGenerated").asLong());
        assertTrue(payload.get("unitId").isTextual(), "unit ids are written as strings");
        assertEquals("1", payload.get("unitId").asText());
    }

    @Test
    @DisplayName("Events keep the order in which they were written")
    void eventsAreOrdered() {
        recycleOne();

        List<OutboxEvent> pending = outboxService.findUnpublishedEvents(10);
        assertEquals(2, pending.size());
        assertEquals("AssetClassRegistered", pending.get(0).getEventType());
        assertEquals(AssetRecycledEvent.EVENT_TYPE, pending.get(1).getEventType());
        assertTrue(pending.get(0).getSequenceNumber() < pending.get(1).getSequenceNumber());
    }

    @Test
    @DisplayName("Events can be looked up by aggregate")
    void eventsByAggregate() {
        recycleOne();
        harness.registry.updateRate("GEMS", 120);

        List<OutboxEvent> classEvents =
                outboxService.getEventsForAggregate(RecyclingEvent.AGGREGATE_ASSET_CLASS, "GEMS");
        assertEquals(List.of("AssetClassRegistered", "AssetClassRateUpdated"),
                classEvents.stream().map(OutboxEvent::getEventType).toList());
        assertEquals(1, outboxService.getEventsForAggregate(RecyclingEvent.AGGREGATE_RECYCLING, "GEMS").size());
    }

    @Test
    @DisplayName("Published events are removed from the outbox")
    void markPublished() {
        OutboxEvent event = recycleOne();

        outboxService.markPublished(event.getId());

        assertTrue(harness.outboxStore.findById(event.getId()).isEmpty());
        assertEquals(1, outboxService.countUnpublished());
        assertTrue(outboxService.getEventsOfType(AssetRecycledEvent.EVENT_TYPE).isEmpty());
    }

    @Test
    @DisplayName("Without a publisher the outbox keeps only the newest events up to the retention limit")
    void retentionLimitWithoutPublisher() {
        ReflectionTestUtils.setField(harness.outboxStore, "maxRetainedEvents", 3);
        FakeAssetClass gems = FakeAssetClass.transferOnly();
        for (int i = 1; i <= 5; i++) {
            gems.mint(i, "alice");
        }
        harness.activate("GEMS", 10, gems);
        for (int i = 1; i <= 5; i++) {
            harness.processor.recycleByTransfer("alice", "GEMS", BigInteger.valueOf(i));
        }

        assertEquals(5, harness.ledger.getTotalRecyclings());
        assertEquals(3, outboxService.countUnpublished());
        List<OutboxEvent> kept = outboxService.findUnpublishedEvents(10);
        assertTrue(kept.stream().allMatch(e -> e.getEventType().equals(AssetRecycledEvent.EVENT_TYPE)),
                "the registration event is the oldest and goes first");
        assertEquals(List.of("3", "4", "5"), kept.stream()
                .map(this::readUnitId)
                .toList());
    }

    @Test
    @DisplayName("With the publisher enabled nothing is evicted before it is sent")
    void noRetentionLimitWithPublisher() {
        ReflectionTestUtils.setField(harness.outboxStore, "maxRetainedEvents", 1);
        ReflectionTestUtils.setField(harness.outboxStore, "publisherEnabled", true);

        recycleOne();

        assertEquals(2, outboxService.countUnpublished());
    }

    private String readUnitId(OutboxEvent event) {
        try {
            return harness.objectMapper.readTree(event.getPayload()).get("unitId").asText();
        } catch (Exception e) {
            throw new AssertionError("unreadable payload " + event.getPayload(), e);
        }
    }

    @Test
    @DisplayName("Events past the retry limit are dead-lettered and no longer fetched")
    void deadLetter() {
        OutboxEvent event = recycleOne();

        for (int i = 0; i < outboxService.getMaxRetries(); i++) {
            outboxService.markFailed(event.getId(), "broker down");
        }

        OutboxEvent failed = harness.outboxStore.findById(event.getId()).orElseThrow();
        assertEquals(outboxService.getMaxRetries(), failed.getRetryCount());
        assertEquals("broker down", failed.getLastError());
        assertEquals(1, outboxService.countDeadLettered());
        assertTrue(outboxService.findUnpublishedEvents(10).stream()
                .noneMatch(e -> e.getId().equals(event.getId())));
    }
}
