package at.sv.sun;

public enum OutputFormat {
    TEXT,
    JSON
}
