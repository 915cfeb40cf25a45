package com.loteca.riskengine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RiskReport {

    private String roundId;
    private double alpha;
    private String varLabel;
    private String esLabel;
    private double valueAtRisk;
    private double expectedShortfall;
    private int simulationCount;
    private int matchCount;
    private int ticketCount;
    private long seed;
    private String payTableKind;
    private double costPerTicket;
    private double kellyFraction;
    private ReturnDistribution returns;
    private List<TicketHitSummary> tickets;
    private List<String> warnings;
    private long timestamp;
    private long calcDurationMicros;

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ReturnDistribution {
        private double mean;
        private double min;
        private double max;
        private double percentile5;
        private double percentile25;
        private double median;
        private double percentile75;
        private double percentile95;
    }
}
