package alertquery.model;

public enum Severity {
    NONE,
    NOTIFY,
    WARNING,
    ALARM
}
