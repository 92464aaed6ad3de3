package com.flagship.asset_recycling.query;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.asset_recycling.admin.dto.AssetClassResponse;
import com.flagship.asset_recycling.recycle.dto.RecordResponse;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;
import java.util.List;

/**
 * Public read endpoints. No actor header needed.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class QueryController {

    private static final String DEFAULT_PAGE_SIZE = "100";

    private final QueryService queryService;

    @GetMapping("/asset-classes")
    public List<AssetClassResponse> listClasses() {
        return queryService.listClasses().stream().map(AssetClassResponse::from).toList();
    }

    @GetMapping("/asset-classes/{classId}")
    public ResponseEntity<AssetClassResponse> getAssetClass(@PathVariable("classId") String classId) {
        return queryService.getClassConfig(classId)
            .map(config -> ResponseEntity.ok(AssetClassResponse.from(config)))
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/asset-classes/{classId}/points")
    public PointsResponse calculatePoints(@PathVariable("classId") String classId,
                                          @RequestParam("quantity") long quantity) {
        return new PointsResponse(classId, quantity, queryService.calculatePoints(classId, quantity),
                queryService.isAccepted(classId));
    }

    @GetMapping("/asset-classes/{classId}/history")
    public List<RecordResponse> historyForClass(
            @PathVariable("classId") String classId,
            @RequestParam(name = "offset", defaultValue = "0") int offset,
            @RequestParam(name = "limit", defaultValue = DEFAULT_PAGE_SIZE) int limit) {
        return queryService.getHistoryForClass(classId, offset, limit).stream()
            .map(RecordResponse::from)
            .toList();
    }

    @GetMapping("/actors/{actor}/history")
    public List<RecordResponse> historyForActor(
            @PathVariable("actor") String actor,
            @RequestParam(name = "offset", defaultValue = "0") int offset,
            @RequestParam(name = "limit", defaultValue = DEFAULT_PAGE_SIZE) int limit) {
        return queryService.getHistoryForActor(actor, offset, limit).stream()
            .map(RecordResponse::from)
            .toList();
    }

    @GetMapping("/actors/{actor}/eligibility")
    public Eligibility canRecycle(@PathVariable("actor") String actor,
                                  @RequestParam("class_id") String classId,
                                  @RequestParam("unit_id") BigInteger unitId) {
        return queryService.canRecycle(actor, classId, unitId);
    }

    @GetMapping("/stats")
    public StatsResponse stats() {
        RecyclingStats stats = queryService.getStats();
        return new StatsResponse(stats.getTotalRecyclings(), stats.getTotalPointsGenerated(),
                stats.getActiveClassCount());
    }

    @GetMapping("/ledger/{sequence}")
    public ResponseEntity<RecordResponse> getRecord(@PathVariable("sequence") long sequence) {
        return queryService.getRecord(sequence)
            .map(record -> ResponseEntity.ok(RecordResponse.from(record)))
            .orElse(ResponseEntity.notFound().build());
    }

    @Value
    public static class PointsResponse {
        @JsonProperty("class_id")
        String classId;
        @JsonProperty("quantity")
        long quantity;
        @JsonProperty("points")
        long points;
        @JsonProperty("accepted")
        boolean accepted;
    }

    @Value
    public static class StatsResponse {
        @JsonProperty("total_recyclings")
        long totalRecyclings;
        @JsonProperty("total_points_generated")
        long totalPointsGenerated;
        @JsonProperty("active_class_count")
        long activeClassCount;
    }
}
