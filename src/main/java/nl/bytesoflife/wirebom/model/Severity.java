package nl.bytesoflife.wirebom.model;

public enum Severity {
    ERROR,
    WARNING
}
