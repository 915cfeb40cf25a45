package com.loteca.riskengine.domain.service;

import com.loteca.riskengine.domain.model.PayTable;
import com.loteca.riskengine.domain.model.ProbabilityMatrix;
import com.loteca.riskengine.domain.model.Ticket;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;

@Getter
@Builder
public class EvaluationInput {

    private final String roundId;
    private final ProbabilityMatrix probabilities;
    private final List<Ticket> tickets;
    private final PayTable payTable;

    private final Integer simulations;
    private final Double alpha;
    private final Long seed;
    private final Double costPerTicket;
    private final Double kellyFraction;

    private final boolean payTableFallback;

    @Singular
    private final List<String> warnings;
}
