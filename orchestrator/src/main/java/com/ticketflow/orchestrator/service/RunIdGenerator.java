package com.ticketflow.orchestrator.service;

import com.ticketflow.orchestrator.model.FlowKind;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Allocates run ids of the form {@code yyyyMMdd-HHmmss-SSS-<flow>[-<project>]-<suffix>}.
 * Ids sort by creation time and are safe to use as directory names.
 */
@Component
public class RunIdGenerator {

    private static final DateTimeFormatter PREFIX = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS");

    private final Clock        clock;
    private final SecureRandom random = new SecureRandom();

    public RunIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public String next(FlowKind flow, String project) {
        byte[] suffix = new byte[3];
        random.nextBytes(suffix);
        StringBuilder id = new StringBuilder(LocalDateTime.now(clock).format(PREFIX))
                .append('-').append(flow.id());
        if (project != null && !project.isBlank()) {
            id.append('-').append(project.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", ""));
        }
        return id.append('-').append(HexFormat.of().formatHex(suffix)).toString();
    }
}
