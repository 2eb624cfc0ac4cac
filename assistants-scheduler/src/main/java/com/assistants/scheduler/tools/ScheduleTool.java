package com.assistants.scheduler.tools;

import com.assistants.common.config.AssistantsConfig;
import com.assistants.common.config.ConfigPaths;
import com.assistants.common.config.ConfigService;
import com.assistants.common.infra.ErrorUtils;
import com.assistants.scheduler.ScheduleDraft;
import com.assistants.scheduler.ScheduleValidator;
import com.assistants.scheduler.SchedulerService;
import com.assistants.scheduler.cron.CronParse;
import com.assistants.scheduler.model.ScheduleRecord;
import com.assistants.scheduler.model.ScheduleSpec;
import com.assistants.scheduler.model.ScheduleTypes.ActionType;
import com.assistants.scheduler.model.ScheduleTypes.CreatedBy;
import com.assistants.scheduler.model.ScheduleTypes.IntervalUnit;
import com.assistants.scheduler.store.ScheduleValidationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * The {@code schedule} tool: create, list, delete, pause and resume scheduled
 * commands in the project given by {@code cwd}.
 */
@Slf4j
public class ScheduleTool implements AgentTool {

    static final String[] ACTIONS = { "create", "list", "delete", "pause", "resume" };

    private final Clock clock;
    private final Map<Path, ConfigService> configServices = new ConcurrentHashMap<>();

    public ScheduleTool() {
        this(Clock.systemUTC());
    }

    public ScheduleTool(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "schedule";
    }

    @Override
    public String getDescription() {
        return "Create and manage scheduled commands (once, cron, fixed or random interval).";
    }

    @Override
    public JsonNode getParameterSchema() {
        ObjectNode schema = JsonNodeFactory.instance.objectNode();
        schema.put("type", "object");
        ObjectNode properties = schema.putObject("properties");

        ToolParamUtils.addEnum(
                ToolParamUtils.addString(properties, "action", "Action to perform: create, list, delete, pause, resume"),
                ACTIONS);
        ToolParamUtils.addString(properties, "command", "Command to schedule (required for create)");
        ToolParamUtils.addString(properties, "at", "ISO 8601 timestamp for a one-time schedule");
        ToolParamUtils.addString(properties, "cron", "Cron expression for recurring schedule (5 fields)");
        ToolParamUtils.addNumber(properties, "every",
                "Fixed interval for a recurring schedule, in unit. Minimum 1 second.");
        ToolParamUtils.addNumber(properties, "minInterval", "Minimum interval for random scheduling");
        ToolParamUtils.addNumber(properties, "maxInterval", "Maximum interval for random scheduling");
        ToolParamUtils.addEnum(
                ToolParamUtils.addString(properties, "unit", "Time unit for interval/random scheduling"),
                "seconds", "minutes", "hours");
        ToolParamUtils.addString(properties, "timezone", "IANA timezone name for at/cron");
        ToolParamUtils.addString(properties, "description", "Optional description for this schedule");
        ToolParamUtils.addEnum(
                ToolParamUtils.addString(properties, "actionType",
                        "\"command\" runs the command, \"message\" injects message into the session"),
                "command", "message");
        ToolParamUtils.addString(properties, "message", "Message to inject when actionType is \"message\"");
        ToolParamUtils.addString(properties, "sessionId", "Session id to scope the schedule to");
        ToolParamUtils.addString(properties, "id", "Schedule id (for delete/pause/resume)");
        ToolParamUtils.addString(properties, "cwd", "Project working directory (optional)");

        schema.putArray("required").add("action");
        return schema;
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolContext context) {
        return CompletableFuture.supplyAsync(() -> doExecute(context));
    }

    /**
     * Synchronous body of {@link #execute(ToolContext)}.
     */
    public ToolResult doExecute(ToolContext context) {
        JsonNode params = context.getParameters();
        String action = ToolParamUtils.readStringParam(params, "action");
        if (action == null)
            action = "";

        try {
            SchedulerService service = serviceFor(context);
            switch (action) {
                case "list":
                    return list(service);
                case "create":
                    return create(service, params, context.getSessionId());
                case "delete":
                    return delete(service, params);
                case "pause":
                case "resume":
                    return pauseOrResume(service, params, "pause".equals(action));
                default:
                    return ToolResult.fail("Error: unknown action \"" + action + "\".");
            }
        } catch (ScheduleValidationException e) {
            return ToolResult.fail("Error: " + e.getMessage());
        } catch (IOException | RuntimeException e) {
            log.error("schedule-tool: action={} failed: {}", action, e.getMessage(), e);
            return ToolResult.fail("Error: " + ErrorUtils.formatErrorMessage(e));
        }
    }

    // --- Actions ---

    private ToolResult list(SchedulerService service) {
        List<ScheduleRecord> schedules = service.list();
        if (schedules.isEmpty())
            return ToolResult.ok("No schedules found.");
        String rows = schedules.stream()
                .sorted(Comparator.comparingLong(s -> s.getNextRunAt() != null ? s.getNextRunAt() : 0L))
                .map(ScheduleTool::formatRow)
                .collect(Collectors.joining("\n"));
        return ToolResult.ok(rows);
    }

    private ToolResult create(SchedulerService service, JsonNode params, String contextSessionId)
            throws IOException {
        String command = ToolParamUtils.readStringParam(params, "command");
        if (command == null)
            return ToolResult.fail("Error: command is required.");

        String at = ToolParamUtils.readStringParam(params, "at");
        String cron = ToolParamUtils.readStringParam(params, "cron");
        Double every = ToolParamUtils.readNumberParam(params, "every");
        Double minInterval = ToolParamUtils.readNumberParam(params, "minInterval");
        Double maxInterval = ToolParamUtils.readNumberParam(params, "maxInterval");
        IntervalUnit unit = IntervalUnit.orDefault(
                IntervalUnit.fromKey(ToolParamUtils.readStringParam(params, "unit")));
        String timezone = ToolParamUtils.readStringParam(params, "timezone");

        boolean hasRandom = minInterval != null && maxInterval != null;
        boolean hasInterval = every != null;
        if (at == null && cron == null && !hasRandom && !hasInterval) {
            return ToolResult.fail("Error: provide at (ISO time), cron, every (fixed interval), "
                    + "or minInterval+maxInterval for random scheduling.");
        }

        ScheduleSpec spec;
        if (hasInterval) {
            spec = new ScheduleSpec.Interval(every, unit);
        } else if (hasRandom) {
            spec = new ScheduleSpec.RandomInterval(minInterval, maxInterval, unit);
        } else if (cron != null) {
            spec = new ScheduleSpec.Cron(cron, timezone);
        } else {
            spec = new ScheduleSpec.Once(at, timezone);
        }
        ScheduleValidator.validateSpec(spec);
        if (timezone != null && !CronParse.isValidTimeZone(timezone)) {
            return ToolResult.fail("Error: invalid timezone \"" + timezone + "\".");
        }

        ActionType actionType = ActionType.fromKey(ToolParamUtils.readStringParam(params, "actionType"));
        String sessionId = ToolParamUtils.readStringParam(params, "sessionId");
        ScheduleRecord created = service.create(ScheduleDraft.builder()
                .createdBy(CreatedBy.AGENT)
                .sessionId(sessionId != null ? sessionId : contextSessionId)
                .actionType(actionType)
                .command(command)
                .message(actionType == ActionType.MESSAGE ? ToolParamUtils.readStringParam(params, "message") : null)
                .description(ToolParamUtils.readStringParam(params, "description"))
                .schedule(spec)
                .build());

        String next = Instant.ofEpochMilli(created.getNextRunAt()).toString();
        String head = "Scheduled " + created.getCommand() + " (" + created.getId() + ")";
        if (spec instanceof ScheduleSpec.Interval) {
            return ToolResult.ok(head + " every " + formatNumber(every) + " " + unit.key() + ", next run: " + next);
        }
        if (spec instanceof ScheduleSpec.RandomInterval) {
            return ToolResult.ok(head + " randomly every " + formatNumber(minInterval) + "-"
                    + formatNumber(maxInterval) + " " + unit.key() + ", next run: " + next);
        }
        return ToolResult.ok(head + " for " + next);
    }

    private ToolResult delete(SchedulerService service, JsonNode params) throws IOException {
        String id = ToolParamUtils.readStringParam(params, "id");
        if (id == null)
            return ToolResult.fail("Error: id is required.");
        return service.delete(id)
                ? ToolResult.ok("Deleted schedule " + id + ".")
                : ToolResult.fail("Schedule " + id + " not found.");
    }

    private ToolResult pauseOrResume(SchedulerService service, JsonNode params, boolean pause) throws IOException {
        String id = ToolParamUtils.readStringParam(params, "id");
        if (id == null)
            return ToolResult.fail("Error: id is required.");
        Optional<ScheduleRecord> updated = pause ? service.pause(id) : service.resume(id);
        if (updated.isEmpty())
            return ToolResult.fail("Schedule " + id + " not found.");
        return ToolResult.ok((pause ? "Paused" : "Resumed") + " schedule " + id + ".");
    }

    // --- Helpers ---

    private SchedulerService serviceFor(ToolContext context) {
        String cwdParam = ToolParamUtils.readStringParam(context.getParameters(), "cwd");
        Path cwd;
        if (cwdParam != null) {
            cwd = Path.of(cwdParam);
        } else if (context.getCwd() != null) {
            cwd = Path.of(context.getCwd());
        } else {
            cwd = ConfigPaths.currentDir();
        }
        AssistantsConfig config = configServiceFor(cwd).loadConfig();
        return SchedulerService.forRoot(ConfigPaths.resolveProjectDir(cwd), config.getScheduler(), clock);
    }

    /** One config service per project, so its load cache is shared across calls. */
    ConfigService configServiceFor(Path cwd) {
        return configServices.computeIfAbsent(cwd.toAbsolutePath().normalize(), ConfigService::forProject);
    }

    static String formatRow(ScheduleRecord s) {
        String next = s.getNextRunAt() != null ? Instant.ofEpochMilli(s.getNextRunAt()).toString() : "n/a";
        String status = s.getStatus() != null ? s.getStatus().key() : "unknown";
        return "- " + s.getId() + " [" + status + "] " + s.getCommand() + scheduleInfo(s.getSchedule())
                + " (next: " + next + ")";
    }

    private static String scheduleInfo(ScheduleSpec spec) {
        if (spec instanceof ScheduleSpec.Interval interval) {
            return " (every " + formatNumber(interval.interval()) + " " + interval.effectiveUnit().key() + ")";
        }
        if (spec instanceof ScheduleSpec.RandomInterval random) {
            return " (random: " + formatNumber(random.minInterval()) + "-" + formatNumber(random.maxInterval())
                    + " " + random.effectiveUnit().key() + ")";
        }
        if (spec instanceof ScheduleSpec.Cron cron) {
            return " (cron: " + cron.cron() + ")";
        }
        return "";
    }

    /** Whole numbers without a trailing ".0". */
    static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value))
            return String.valueOf((long) value);
        return String.valueOf(value);
    }
}
