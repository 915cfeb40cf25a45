package com.loteca.riskengine.domain.service;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "risk")
public class RiskEngineProperties {

    private int simulations = 50_000;
    private double alpha = 0.95;
    private Long seed = 2025L;
    private int chunkSize = 10_000;
    private boolean parallel = true;
    private String dataDir = "data/out";
    private int expectedMatches = 14;
    private String payTableJson = "";
    private double costPerTicket = 1.5;
    private double kellyFraction = 0.25;
    private List<ProbabilitySource> probabilitySources = new ArrayList<>(List.of(
            new ProbabilitySource("joined_stacked_bivar.csv", "p_home_final", "p_draw_final", "p_away_final"),
            new ProbabilitySource("joined_stacked.csv", "p_home_final", "p_draw_final", "p_away_final"),
            new ProbabilitySource("joined.csv", "p_home", "p_draw", "p_away")));
    private Batch batch = new Batch();

    @Getter
    @Setter
    public static class ProbabilitySource {
        private String file;
        private String homeColumn;
        private String drawColumn;
        private String awayColumn;

        public ProbabilitySource() {
        }

        public ProbabilitySource(String file, String homeColumn, String drawColumn, String awayColumn) {
            this.file = file;
            this.homeColumn = homeColumn;
            this.drawColumn = drawColumn;
            this.awayColumn = awayColumn;
        }
    }

    @Getter
    @Setter
    public static class Batch {
        private boolean enabled = false;
        private String roundId;
    }
}
