package com.loteca.riskengine.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RiskEvaluationRequest {

    private String roundId;
    private List<MatchRow> probabilities;
    private List<TicketRow> tickets;
    private Map<String, Object> payTable;
    private Integer simulations;
    private Double alpha;
    private Long seed;

    @JsonAlias("cost_per_ticket")
    private Double costPerTicket;

    @JsonAlias("kelly_fraction")
    private Double kellyFraction;

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MatchRow {
        @JsonAlias("match_id")
        private String matchId;

        @JsonProperty("pHome")
        @JsonAlias("p_home")
        private double pHome;

        @JsonProperty("pDraw")
        @JsonAlias("p_draw")
        private double pDraw;

        @JsonProperty("pAway")
        @JsonAlias("p_away")
        private double pAway;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TicketRow {
        private List<String> picks;

        @JsonAlias("stake_weight")
        private Double stakeWeight;
    }
}
