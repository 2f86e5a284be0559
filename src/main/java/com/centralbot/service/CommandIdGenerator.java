package com.centralbot.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Builds command ids of the form {@code <action>_<epochSeconds>_<sequence>}.
 * The sequence keeps ids unique when the same action is issued twice within a second.
 */
@Component
@RequiredArgsConstructor
public class CommandIdGenerator {

    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();

    public String nextId(String action) {
        return action + "_" + clock.instant().getEpochSecond() + "_" + sequence.incrementAndGet();
    }
}
