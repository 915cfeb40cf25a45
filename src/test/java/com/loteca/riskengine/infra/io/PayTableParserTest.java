package com.loteca.riskengine.infra.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.loteca.riskengine.domain.model.PayTable;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PayTableParserTest {

    private final PayTableParser parser = new PayTableParser(new ObjectMapper());

    @Test
    void blankInputMeansDefaultSchemeWithoutWarning() {
        PayTableParser.Resolution resolution = parser.parse("  ");

        assertThat(resolution.payTable()).isSameAs(PayTable.defaultScheme());
        assertThat(resolution.fellBack()).isFalse();
    }

    @Test
    void parsesHitCountMapping() {
        PayTableParser.Resolution resolution = parser.parse("{\"14\": 500000, \"13\": \"1200.5\"}");

        assertThat(resolution.fellBack()).isFalse();
        assertThat(resolution.payTable()).isInstanceOf(PayTable.ExplicitTable.class);
        assertThat(resolution.payTable().payout(14, 14)).isEqualTo(500_000.0);
        assertThat(resolution.payTable().payout(13, 14)).isEqualTo(1_200.5);
        assertThat(resolution.payTable().payout(12, 14)).isZero();
    }

    @Test
    void malformedInputFallsBackToDefaultScheme() {
        assertThat(parser.parse("{14: oops").fellBack()).isTrue();
        assertThat(parser.parse("[1, 2]").fellBack()).isTrue();
        assertThat(parser.parse("{\"fourteen\": 1}").fellBack()).isTrue();
        assertThat(parser.parse("{\"14\": -5}").fellBack()).isTrue();
        assertThat(parser.parse("{}").payTable()).isSameAs(PayTable.defaultScheme());
    }

    @Test
    void acceptsInlineMap() {
        PayTableParser.Resolution resolution = parser.fromMap(Map.of("2", 3.0));

        assertThat(resolution.payTable().kind()).isEqualTo("EXPLICIT_TABLE");
        assertThat(resolution.payTable().payout(2, 2)).isEqualTo(3.0);
        assertThat(parser.fromMap(null).payTable()).isSameAs(PayTable.defaultScheme());
    }
}
