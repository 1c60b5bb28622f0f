package com.gatewayadmin.admin.store;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

final class Timestamps {
    private Timestamps() {}

    // column precision is microseconds; returned models must equal what a re-read gives
    static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MICROS);
    }
}
