package com.loteca.riskengine.infra.io;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

public final class CsvTable {

    private final List<String> header;
    private final List<String[]> rows;

    private CsvTable(List<String> header, List<String[]> rows) {
        this.header = header;
        this.rows = rows;
    }

    public static CsvTable read(Path path) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            List<String> header = null;
            List<String[]> rows = new ArrayList<>();
            String line;
            while ((line = reader.readLine()) != null) {
                if (header == null && line.startsWith("\uFEFF")) {
                    line = line.substring(1);
                }
                if (line.isBlank()) continue;
                List<String> fields = splitLine(line);
                if (header == null) {
                    List<String> trimmed = new ArrayList<>(fields.size());
                    for (String f : fields) trimmed.add(f.trim());
                    header = Collections.unmodifiableList(trimmed);
                } else {
                    rows.add(fields.toArray(new String[0]));
                }
            }
            return new CsvTable(header != null ? header : List.of(), rows);
        }
    }

    public List<String> header() {
        return header;
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnIndex(String name) {
        for (int i = 0; i < header.size(); i++) {
            if (header.get(i).equalsIgnoreCase(name)) return i;
        }
        return -1;
    }

    public String cell(int row, int column) {
        if (column < 0) return null;
        String[] fields = rows.get(row);
        if (column >= fields.length) return null;
        String value = fields[column].trim();
        return value.isEmpty() || isMissingMarker(value) ? null : value;
    }

    static List<String> splitLine(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (quoted) {
                if (ch == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        current.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    current.append(ch);
                }
            } else if (ch == '"') {
                quoted = true;
            } else if (ch == ',') {
                fields.add(current.toString());
                current.setLength(0);
            } else {
                current.append(ch);
            }
        }
        fields.add(current.toString());
        return fields;
    }

    private static boolean isMissingMarker(String value) {
        String lower = value.toLowerCase(Locale.ROOT);
        return lower.equals("nan") || lower.equals("null") || lower.equals("none");
    }
}
