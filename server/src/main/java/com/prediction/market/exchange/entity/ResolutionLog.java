package com.prediction.market.exchange.entity;

import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.MongoId;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Audit trail of the two-phase resolution flow.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
@Document(collection = "resolution_log")
public class ResolutionLog {

    @MongoId
    private String id;

    @Indexed
    private String marketId;

    private ResolutionAction action;

    private Side outcome;

    /**
     * Earliest time a non-emergency confirmation is accepted (INITIATED only).
     */
    private Long scheduledAt;

    private String notes;

    private long timestamp;

    public ResolutionLog copy() {
        return toBuilder().build();
    }
}
