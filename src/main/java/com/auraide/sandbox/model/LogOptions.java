package com.auraide.sandbox.model;

import java.time.Instant;

public record LogOptions(Instant since, Instant until, Integer tail) {

    public static LogOptions all() {
        return new LogOptions(null, null, null);
    }

    public static LogOptions tail(int lines) {
        return new LogOptions(null, null, lines);
    }
}
