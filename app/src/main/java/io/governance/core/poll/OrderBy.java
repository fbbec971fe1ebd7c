package io.governance.core.poll;

public enum OrderBy {
    ASC,
    DESC;

    public static OrderBy fromWire(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        if ("asc".equalsIgnoreCase(value)) return ASC;
        if ("desc".equalsIgnoreCase(value)) return DESC;
        throw new IllegalArgumentException("Unknown order: " + value);
    }
}
