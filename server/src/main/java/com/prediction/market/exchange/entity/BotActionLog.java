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

@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
@Document(collection = "bot_log")
public class BotActionLog {

    @MongoId
    private String id;

    private BotAction action;

    private String details;

    private Long exposureBefore;
    private Long exposureAfter;

    @Indexed
    private long timestamp;

    public BotActionLog copy() {
        return toBuilder().build();
    }
}
