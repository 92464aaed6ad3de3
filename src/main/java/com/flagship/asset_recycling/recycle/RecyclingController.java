package com.flagship.asset_recycling.recycle;

import com.flagship.asset_recycling.observability.CorrelationContext;
import com.flagship.asset_recycling.recycle.dto.BatchRecycleRequest;
import com.flagship.asset_recycling.recycle.dto.BatchResponse;
import com.flagship.asset_recycling.recycle.dto.RecordResponse;
import com.flagship.asset_recycling.recycle.dto.RecycleRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST endpoints for exchanges. The caller identity comes from the
 * {@code X-Actor-Id} header; establishing that identity is the gateway's job.
 */
@RestController
@RequestMapping("/api/recycling")
@RequiredArgsConstructor
@Slf4j
public class RecyclingController {

    private final RecycleProcessor recycleProcessor;
    private final BatchCoordinator batchCoordinator;

    @PostMapping("/destruction")
    public ResponseEntity<RecordResponse> recycleByDestruction(
            @Valid @RequestBody RecycleRequest request,
            @RequestHeader(CorrelationContext.ACTOR_HEADER) String actor) {

        log.info("Received destruction exchange: actor={}, classId={}, unitId={}",
                actor, request.getClassId(), request.getUnitId());

        var record = recycleProcessor.recycleByDestruction(actor, request.getClassId(), request.getUnitId());
        return ResponseEntity.status(HttpStatus.CREATED).body(RecordResponse.from(record));
    }

    @PostMapping("/custody")
    public ResponseEntity<RecordResponse> recycleByTransfer(
            @Valid @RequestBody RecycleRequest request,
            @RequestHeader(CorrelationContext.ACTOR_HEADER) String actor) {

        log.info("Received custody exchange: actor={}, classId={}, unitId={}",
                actor, request.getClassId(), request.getUnitId());

        var record = recycleProcessor.recycleByTransfer(actor, request.getClassId(), request.getUnitId());
        return ResponseEntity.status(HttpStatus.CREATED).body(RecordResponse.from(record));
    }

    /**
     * Always 200 once the batch ran, even if every item failed; item
     * outcomes are in the body.
     */
    @PostMapping("/batch")
    public ResponseEntity<BatchResponse> recycleBatch(
            @Valid @RequestBody BatchRecycleRequest request,
            @RequestHeader(CorrelationContext.ACTOR_HEADER) String actor) {

        log.info("Received batch exchange: actor={}, items={}", actor, request.getItems().size());

        List<BatchItem> items = request.getItems().stream()
            .map(item -> item == null
                ? new BatchItem(null, null, null)
                : new BatchItem(item.getClassId(), item.getUnitId(), item.getUseDestruction()))
            .toList();

        BatchOutcome outcome = batchCoordinator.recycleBatch(actor, items);
        return ResponseEntity.ok(BatchResponse.from(outcome));
    }
}
