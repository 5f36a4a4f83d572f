package com.flagship.contribution_ledger.web;

import com.flagship.contribution_ledger.archive.ArchiveMetadata;
import com.flagship.contribution_ledger.archive.ArchiveService;
import com.flagship.contribution_ledger.ledger.AdjustmentRequest;
import com.flagship.contribution_ledger.ledger.EventKind;
import com.flagship.contribution_ledger.ledger.EventReference;
import com.flagship.contribution_ledger.ledger.LedgerService;
import com.flagship.contribution_ledger.ledger.RedistributionRequest;
import com.flagship.contribution_ledger.web.dto.AdjustInventoryRequest;
import com.flagship.contribution_ledger.web.dto.AdjustmentResponse;
import com.flagship.contribution_ledger.web.dto.ArchiveResponse;
import com.flagship.contribution_ledger.web.dto.BulkRemovalRequest;
import com.flagship.contribution_ledger.web.dto.BulkRemovalResponse;
import com.flagship.contribution_ledger.web.dto.ContributionRequest;
import com.flagship.contribution_ledger.web.dto.CreateArchiveRequest;
import com.flagship.contribution_ledger.web.dto.CreatedResponse;
import com.flagship.contribution_ledger.web.dto.EventResponse;
import com.flagship.contribution_ledger.web.dto.QuantityOverrideRequest;
import com.flagship.contribution_ledger.web.dto.RedistributeRequest;
import com.flagship.contribution_ledger.web.dto.RedistributionResponse;
import com.flagship.contribution_ledger.web.dto.StatisticsResponse;
import com.flagship.contribution_ledger.web.dto.StockResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/**
 * REST adapter over the ledger. Every route is scoped to one guild.
 */
@RestController
@RequestMapping("/api/guilds/{guildId}")
@RequiredArgsConstructor
@Slf4j
public class LedgerController {

    private final LedgerService ledgerService;
    private final ArchiveService archiveService;

    @PostMapping("/contributions")
    public ResponseEntity<CreatedResponse> addContribution(
            @PathVariable("guildId") long guildId,
            @Valid @RequestBody ContributionRequest request) {
        long id = ledgerService.addContribution(
            guildId, request.getActorId(), request.getCategory(), request.getItemName(), request.getQuantity());
        return ResponseEntity.status(HttpStatus.CREATED).body(new CreatedResponse(id));
    }

    @PostMapping("/quantity-changes")
    public ResponseEntity<CreatedResponse> recordQuantityOverride(
            @PathVariable("guildId") long guildId,
            @Valid @RequestBody QuantityOverrideRequest request) {
        long id = ledgerService.recordQuantityOverride(
            guildId,
            request.getItemName(),
            request.getCategory(),
            request.getNewQuantity(),
            request.getReason(),
            request.getNotes(),
            request.getActorId());
        return ResponseEntity.status(HttpStatus.CREATED).body(new CreatedResponse(id));
    }

    @PostMapping("/redistributions")
    public ResponseEntity<RedistributionResponse> redistribute(
            @PathVariable("guildId") long guildId,
            @Valid @RequestBody RedistributeRequest request) {
        RedistributionRequest.RedistributionRequestBuilder builder = RedistributionRequest.builder()
            .guildId(guildId)
            .category(request.getCategory())
            .itemName(request.getItemName())
            .newTotal(request.getNewTotal())
            .notes(request.getNotes());
        if (request.getReason() != null) {
            builder.reason(request.getReason());
        }
        if (request.getActorId() != null) {
            builder.actorId(request.getActorId());
        }
        return ResponseEntity.ok(RedistributionResponse.from(ledgerService.redistribute(builder.build())));
    }

    @PostMapping("/adjustments")
    public ResponseEntity<AdjustmentResponse> adjustInventory(
            @PathVariable("guildId") long guildId,
            @Valid @RequestBody AdjustInventoryRequest request) {
        AdjustmentRequest adjustment = AdjustmentRequest.builder()
            .guildId(guildId)
            .category(request.getCategory())
            .itemName(request.getItemName())
            .operation(request.getOperation())
            .amount(request.getAmount())
            .reason(request.getReason())
            .notes(request.getNotes())
            .actorId(request.getActorId())
            .build();
        return ResponseEntity.ok(AdjustmentResponse.from(ledgerService.adjustInventory(adjustment)));
    }

    /**
     * Replayed stock of one item, or its stock as of {@code at} (ISO-8601) when given.
     */
    @GetMapping("/stock")
    public ResponseEntity<StockResponse> currentStock(
            @PathVariable("guildId") long guildId,
            @RequestParam("category") String category,
            @RequestParam("item") String itemName,
            @RequestParam(value = "at", required = false) Instant at) {
        long quantity = at == null
            ? ledgerService.currentStock(guildId, itemName, category)
            : ledgerService.stockAt(guildId, itemName, category, at);
        return ResponseEntity.ok(new StockResponse(category, itemName, quantity));
    }

    @GetMapping("/inventory")
    public ResponseEntity<List<StockResponse>> inventorySummary(@PathVariable("guildId") long guildId) {
        return ResponseEntity.ok(ledgerService.inventorySummary(guildId).stream()
            .map(StockResponse::from)
            .toList());
    }

    /**
     * Audit trail in replay order. {@code limit} keeps the most recent events.
     */
    @GetMapping("/events")
    public ResponseEntity<List<EventResponse>> auditTrail(
            @PathVariable("guildId") long guildId,
            @RequestParam(value = "item", required = false) String itemName,
            @RequestParam(value = "category", required = false) String category,
            @RequestParam(value = "limit", required = false) Integer limit) {
        return ResponseEntity.ok(ledgerService.auditTrail(guildId, itemName, category, limit).stream()
            .map(EventResponse::from)
            .toList());
    }

    @GetMapping("/events/balances")
    public ResponseEntity<List<EventResponse>> auditTrailWithBalances(
            @PathVariable("guildId") long guildId,
            @RequestParam(value = "item", required = false) String itemName,
            @RequestParam(value = "category", required = false) String category) {
        return ResponseEntity.ok(ledgerService.auditTrailWithBalances(guildId, itemName, category).stream()
            .map(EventResponse::from)
            .toList());
    }

    @GetMapping("/events/{kind}/{id}")
    public ResponseEntity<EventResponse> findEvent(
            @PathVariable("guildId") long guildId,
            @PathVariable("kind") EventKind kind,
            @PathVariable("id") long id) {
        return ledgerService.findEvent(guildId, kind, id)
            .map(event -> ResponseEntity.ok(EventResponse.from(event)))
            .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/events/{kind}/{id}")
    public ResponseEntity<Void> removeEvent(
            @PathVariable("guildId") long guildId,
            @PathVariable("kind") EventKind kind,
            @PathVariable("id") long id) {
        if (ledgerService.findEvent(guildId, kind, id).isEmpty() || !ledgerService.removeEvent(kind, id)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/events/bulk-removal")
    public ResponseEntity<BulkRemovalResponse> bulkRemoveEvents(
            @PathVariable("guildId") long guildId,
            @Valid @RequestBody BulkRemovalRequest request) {
        List<EventReference> references = request.getEvents().stream()
            .map(entry -> EventReference.of(entry.getKind(), entry.getId()))
            .toList();
        return ResponseEntity.ok(BulkRemovalResponse.from(
            ledgerService.bulkRemoveEvents(guildId, references, request.getRemovedBy())));
    }

    @GetMapping("/statistics")
    public ResponseEntity<StatisticsResponse> contributionStatistics(@PathVariable("guildId") long guildId) {
        return ResponseEntity.ok(StatisticsResponse.from(ledgerService.contributionStatistics(guildId)));
    }

    @PostMapping("/archives")
    public ResponseEntity<CreatedResponse> archiveEpoch(
            @PathVariable("guildId") long guildId,
            @Valid @RequestBody CreateArchiveRequest request) {
        long id = archiveService.archiveEpoch(guildId, ArchiveMetadata.builder()
            .name(request.getName())
            .description(request.getDescription())
            .notes(request.getNotes())
            .createdBy(request.getCreatedBy())
            .build());
        return ResponseEntity.status(HttpStatus.CREATED).body(new CreatedResponse(id));
    }

    @GetMapping("/archives")
    public ResponseEntity<List<ArchiveResponse>> listArchives(@PathVariable("guildId") long guildId) {
        return ResponseEntity.ok(archiveService.listArchives(guildId).stream()
            .map(ArchiveResponse::from)
            .toList());
    }

    @GetMapping("/archives/{archiveId}")
    public ResponseEntity<ArchiveResponse> getArchive(
            @PathVariable("guildId") long guildId,
            @PathVariable("archiveId") long archiveId) {
        return archiveService.getArchive(archiveId)
            .filter(archive -> archive.getSummary().getGuildId() == guildId)
            .map(archive -> ResponseEntity.ok(ArchiveResponse.from(archive)))
            .orElse(ResponseEntity.notFound().build());
    }
}
