package io.github.hotbrkm.autobulk.dispatcher.job;

public enum ScheduleKind {
    IMMEDIATE,
    DELAYED,
    RECURRING;

    public boolean isOneShot() {
        return this != RECURRING;
    }
}
