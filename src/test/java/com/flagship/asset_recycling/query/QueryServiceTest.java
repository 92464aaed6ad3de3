package com.flagship.asset_recycling.query;

import com.flagship.asset_recycling.exception.NotRegisteredException;
import com.flagship.asset_recycling.exception.ValidationException;
import com.flagship.asset_recycling.support.FakeAssetClass;
import com.flagship.asset_recycling.support.RecyclingHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class QueryServiceTest {

    private static final String ALICE = "alice";
    private static final String BOB = "bob";

    private RecyclingHarness harness;
    private QueryService query;

    @BeforeEach
    void setUp() {
        harness = new RecyclingHarness();
        query = harness.query;
    }

    @Test
    @DisplayName("Points preview multiplies the current rate")
    void calculatePoints() {
        harness.activate("GEMS", 100, FakeAssetClass.destructible());

        assertEquals(0, query.calculatePoints("GEMS", 0));
        assertEquals(500, query.calculatePoints("GEMS", 5));
        assertThrows(ValidationException.class, () -> query.calculatePoints("GEMS", -1));
        assertThrows(ValidationException.class, () -> query.calculatePoints("GEMS", Long.MAX_VALUE));
        assertThrows(NotRegisteredException.class, () -> query.calculatePoints("NOPE", 1));
    }

    @Test
    @DisplayName("Inactive classes still have a points preview but are not accepted")
    void inactiveClassPreview() {
        harness.activate("GEMS", 100, FakeAssetClass.destructible());
        harness.registry.setActive("GEMS", false);

        assertFalse(query.isAccepted("GEMS"));
        assertFalse(query.isAccepted("NOPE"));
        assertEquals(200, query.calculatePoints("GEMS", 2));
    }

    @Test
    @DisplayName("Eligibility reports the first failing precondition")
    void eligibility() {
        harness.activate("GEMS", 100, FakeAssetClass.destructible().mint(1, ALICE).mint(2, BOB));

        assertTrue(query.canRecycle(ALICE, "GEMS", BigInteger.ONE).isEligible());
        assertNull(query.canRecycle(ALICE, "GEMS", BigInteger.ONE).getReason());
        assertEquals("not owner", query.canRecycle(ALICE, "GEMS", BigInteger.TWO).getReason());
        assertEquals("unit not found", query.canRecycle(ALICE, "GEMS", BigInteger.TEN).getReason());
        assertEquals("not registered", query.canRecycle(ALICE, "NOPE", BigInteger.ONE).getReason());
        assertEquals("invalid input", query.canRecycle(null, "GEMS", BigInteger.ONE).getReason());

        harness.registry.setActive("GEMS", false);
        assertEquals("not active", query.canRecycle(ALICE, "GEMS", BigInteger.ONE).getReason());

        harness.registry.setActive("GEMS", true);
        harness.pauseSwitch.pause();
        assertEquals("paused", query.canRecycle(ALICE, "GEMS", BigInteger.ONE).getReason());
    }

    @Test
    @DisplayName("Eligibility checks have no side effects")
    void eligibilityIsReadOnly() {
        FakeAssetClass gems = harness.activate("GEMS", 100, FakeAssetClass.destructible().mint(1, ALICE));

        query.canRecycle(ALICE, "GEMS", BigInteger.ONE);

        assertTrue(gems.exists(1));
        assertEquals(0, gems.getDestroyCalls());
        assertEquals(0, query.getHistorySize());
    }

    @Test
    @DisplayName("Stats reflect ledger totals and active classes")
    void stats() {
        harness.activate("GEMS", 100, FakeAssetClass.destructible().mint(1, ALICE));
        harness.activate("COINS", 25, FakeAssetClass.transferOnly().mint(2, ALICE));
        harness.processor.recycleByDestruction(ALICE, "GEMS", BigInteger.ONE);
        harness.processor.recycleByTransfer(ALICE, "COINS", BigInteger.TWO);
        harness.registry.deactivate("COINS");

        RecyclingStats stats = query.getStats();

        assertEquals(2, stats.getTotalRecyclings());
        assertEquals(125, stats.getTotalPointsGenerated());
        assertEquals(1, stats.getActiveClassCount());
        assertEquals(2, query.listClasses().size());
        assertTrue(query.getRecord(1).isPresent());
        assertTrue(query.getRecord(2).isEmpty());
    }
}
