package com.flagship.contribution_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.contribution_ledger.ledger.BalancePoint;
import com.flagship.contribution_ledger.ledger.ContributionEvent;
import com.flagship.contribution_ledger.ledger.EventKind;
import com.flagship.contribution_ledger.ledger.LedgerEvent;
import com.flagship.contribution_ledger.ledger.QuantityChangeEvent;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One audit-trail row. Kind-specific fields are omitted when not applicable.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EventResponse {

    @JsonProperty("kind")
    EventKind kind;

    @JsonProperty("id")
    long id;

    @JsonProperty("sequence_number")
    long sequenceNumber;

    @JsonProperty("category")
    String category;

    @JsonProperty("item_name")
    String itemName;

    @JsonProperty("actor_id")
    long actorId;

    @JsonProperty("occurred_at")
    Instant occurredAt;

    @JsonProperty("quantity")
    Long quantity;

    @JsonProperty("old_quantity")
    Long oldQuantity;

    @JsonProperty("new_quantity")
    Long newQuantity;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("balance")
    Long balance;

    public static EventResponse from(LedgerEvent event) {
        return builderFor(event).build();
    }

    public static EventResponse from(BalancePoint point) {
        return builderFor(point.getEvent()).balance(point.getBalance()).build();
    }

    private static EventResponseBuilder builderFor(LedgerEvent event) {
        EventResponseBuilder builder = EventResponse.builder()
            .kind(event.getKind())
            .id(event.getId())
            .sequenceNumber(event.getSequenceNumber())
            .category(event.getCategory())
            .itemName(event.getItemName())
            .actorId(event.getActorId())
            .occurredAt(event.getOccurredAt());

        if (event instanceof ContributionEvent contribution) {
            builder.quantity(contribution.getQuantity());
        } else if (event instanceof QuantityChangeEvent change) {
            builder.oldQuantity(change.getOldQuantity())
                .newQuantity(change.getNewQuantity())
                .reason(change.getReason())
                .notes(change.getNotes());
        }
        return builder;
    }
}
