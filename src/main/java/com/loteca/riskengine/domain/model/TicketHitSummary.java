package com.loteca.riskengine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TicketHitSummary {

    private int ticketIndex;
    private String picks;
    private double weight;
    private long combinations;
    private int fallbackCells;
    private double expectedHits;
    private double fullHitProbability;
    private double oneMissProbability;
    private double meanPayout;
    private double cost;
    private double expectedValue;
    private double suggestedStake;
}
