package com.kmg.blend.service;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;

@Service
public class TimeService {
    private final Clock clock;

    @Autowired
    public TimeService() {
        this(Clock.systemDefaultZone());
    }

    public TimeService(Clock clock) {
        this.clock = clock;
    }

    public OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
