package io.recur4j.core;

public enum RecurrenceType {
    HOURLY(Recurrence.Hourly.class),
    DAILY(Recurrence.Daily.class),
    WEEKLY(Recurrence.Weekly.class);

    private final Class<? extends Recurrence> ruleClass;

    RecurrenceType(Class<? extends Recurrence> ruleClass) {
        this.ruleClass = ruleClass;
    }

    public Class<? extends Recurrence> ruleClass() {
        return ruleClass;
    }
}
