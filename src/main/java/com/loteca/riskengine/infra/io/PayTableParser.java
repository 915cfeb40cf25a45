package com.loteca.riskengine.infra.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.loteca.riskengine.domain.model.PayTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;

@Slf4j
@Component
@RequiredArgsConstructor
public class PayTableParser {

    private final ObjectMapper objectMapper;

    public Resolution parse(String json) {
        if (json == null || json.isBlank()) {
            return new Resolution(PayTable.defaultScheme(), null);
        }
        try {
            return fromNode(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            return rejected("JSON 파싱 실패: " + e.getOriginalMessage());
        }
    }

    public Resolution fromMap(Map<String, ?> raw) {
        if (raw == null) {
            return new Resolution(PayTable.defaultScheme(), null);
        }
        return fromNode(objectMapper.valueToTree(raw));
    }

    private Resolution fromNode(JsonNode node) {
        if (node == null || !node.isObject()) {
            return rejected("JSON 객체가 아닙니다");
        }
        if (node.isEmpty()) {
            return rejected("항목이 없습니다");
        }

        Map<Integer, Double> mapping = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            Integer hits = parseHits(field.getKey());
            if (hits == null) {
                return rejected("적중 수 키가 정수가 아닙니다: " + field.getKey());
            }
            Double value = parseValue(field.getValue());
            if (value == null) {
                return rejected("지급액이 올바르지 않습니다: " + field.getKey() + "=" + field.getValue());
            }
            mapping.put(hits, value);
        }
        return new Resolution(PayTable.explicit(mapping), null);
    }

    private Integer parseHits(String key) {
        try {
            int hits = Integer.parseInt(key.trim());
            return hits >= 0 ? hits : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private Double parseValue(JsonNode value) {
        double v;
        if (value.isNumber()) {
            v = value.asDouble();
        } else if (value.isTextual()) {
            try {
                v = Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return Double.isFinite(v) && v >= 0 ? v : null;
    }

    private Resolution rejected(String reason) {
        String warning = "지급표 무시, 기본 이진 지급 사용: " + reason;
        log.warn("[PayTable] {}", warning);
        return new Resolution(PayTable.defaultScheme(), warning);
    }

    public record Resolution(PayTable payTable, String warning) {

        public boolean fellBack() {
            return warning != null;
        }
    }
}
