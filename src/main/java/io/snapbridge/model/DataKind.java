package io.snapbridge.model;

import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

public enum DataKind {
    HTML("html", "dom-html"),
    CONSOLE("console", "console-log"),
    NETWORK("network", "network-log"),
    PERF("perf", "performance-entries"),
    SCREENSHOT_DOM("screenshotDom", "dom-screenshot");

    private final String wireName;
    private final String alias;

    DataKind(String wireName, String alias) {
        this.wireName = wireName;
        this.alias = alias;
    }

    public String wireName() {
        return wireName;
    }

    public static Set<DataKind> all() {
        return EnumSet.allOf(DataKind.class);
    }

    public static DataKind fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("data kind cannot be empty");
        }
        String value = raw.trim();
        for (DataKind kind : values()) {
            if (kind.wireName.equalsIgnoreCase(value)
                    || kind.alias.equalsIgnoreCase(value)
                    || kind.name().equalsIgnoreCase(value.replace('-', '_'))) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown data kind: " + raw);
    }

    /**
     * Parses a list of kind names. A null or empty input means every kind.
     */
    public static Set<DataKind> parseAll(Collection<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return all();
        }
        EnumSet<DataKind> out = EnumSet.noneOf(DataKind.class);
        for (String value : raw) {
            out.add(fromString(value));
        }
        return out;
    }

    public static Set<DataKind> parseCsv(String csv) {
        if (csv == null || csv.isBlank() || "all".equalsIgnoreCase(csv.trim())) {
            return all();
        }
        return parseAll(List.of(csv.trim().split("\\s*,\\s*")));
    }

    public static List<String> wireNames(Collection<DataKind> kinds) {
        return kinds.stream().sorted().map(DataKind::wireName).toList();
    }
}
