package com.loteca.riskengine.infra.io;

import java.util.List;

public record LoadResult<T>(T value, String source, List<String> warnings) {

    public LoadResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
