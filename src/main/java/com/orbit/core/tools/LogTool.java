package com.orbit.core.tools;

import com.orbit.core.model.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;

/**
 * Records a step's action in the application log. Selected by steps that say "use log".
 */
@Component
public class LogTool implements AgentTool {

    private static final Logger log = LoggerFactory.getLogger(LogTool.class);

    public static final String NAME = "log";

    private final Clock clock;

    public LogTool(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Write the step action to the application log";
    }

    @Override
    public ToolResult execute(Map<String, Object> params) {
        log.info("[plan {}] {}", params.get("planId"), params.get("action"));
        return ToolResult.success(params.get("action"), 0, clock.instant());
    }
}
