package jobrelay.relay.api.v1;

import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;
import jobrelay.relay.api.Controller;
import jobrelay.relay.api.v1.dto.JobStatusResponse;
import jobrelay.relay.api.v1.dto.StopResponse;
import jobrelay.relay.model.JobKind;
import jobrelay.relay.model.StartOptions;
import jobrelay.relay.process.JobCommand;
import jobrelay.relay.process.JobCommands;
import jobrelay.relay.server.RouterHandler;
import jobrelay.relay.server.SseSubscriber;
import jobrelay.relay.slot.JobSlot;
import jobrelay.relay.slot.JobSlotRegistry;
import jobrelay.relay.slot.StartResult;
import jobrelay.relay.slot.StopOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for long-running jobs (admin API).
 *
 * POST /api/v1/jobs/{kind}/start  - Start or join a run, streamed as Server-Sent Events
 * GET  /api/v1/jobs/{kind}/stream - Join the current run without starting one
 * POST /api/v1/jobs/{kind}/stop   - Cancel the current run
 * GET  /api/v1/jobs/{kind}/status - Slot state and event history
 *
 * Closing a stream only detaches that client; the job keeps running.
 */
public class JobStreamController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(JobStreamController.class);

    private static final Pattern JOB_ACTION_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)/(start|stream|stop|status)$");

    static final String USER_HEADER = "X-User-Id";

    private final JobSlotRegistry registry;
    private final JobCommands commands;

    public JobStreamController(JobSlotRegistry registry, JobCommands commands) {
        this.registry = registry;
        this.commands = commands;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        Matcher m = JOB_ACTION_PATTERN.matcher(path);
        if (!m.matches()) {
            return false;
        }
        switch (m.group(2)) {
            case "start":
            case "stop":
                return method.equals(HttpMethod.POST);
            default:
                return method.equals(HttpMethod.GET);
        }
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        Matcher m = JOB_ACTION_PATTERN.matcher(path);
        if (!m.matches()) {
            return ControllerResponse.notFound("unknown job endpoint");
        }

        // IllegalArgumentException for an unknown kind becomes a 400 in the router
        JobKind kind = JobKind.fromId(m.group(1));

        try {
            switch (m.group(2)) {
                case "start":
                    return handleStart(ctx, req, kind);
                case "stream":
                    return handleStream(ctx, kind);
                case "stop":
                    return handleStop(kind);
                default:
                    return handleStatus(kind);
            }
        } catch (Exception e) {
            log.error("Job controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /api/v1/jobs/{kind}/start
     */
    private ControllerResponse handleStart(ChannelHandlerContext ctx, FullHttpRequest req, JobKind kind) {
        StartOptions options = new StartOptions(forceRegenerate(req), req.headers().get(USER_HEADER));
        JobCommand command = commands.commandFor(kind, options);

        SseSubscriber subscriber = openStream(ctx.channel());
        StartResult result = registry.start(kind, command, subscriber, options.userId());
        watchDisconnect(ctx.channel(), result.slot(), subscriber);

        log.info("[{}] start requested by {}: {}", kind, userOf(options), result.outcome());
        return ControllerResponse.streaming();
    }

    /**
     * GET /api/v1/jobs/{kind}/stream
     */
    private ControllerResponse handleStream(ChannelHandlerContext ctx, JobKind kind) {
        Optional<JobSlot> slot = registry.find(kind);
        if (slot.isEmpty()) {
            return ControllerResponse.notFound("no " + kind.id() + " job");
        }

        SseSubscriber subscriber = openStream(ctx.channel());
        if (slot.get().attach(subscriber)) {
            watchDisconnect(ctx.channel(), slot.get(), subscriber);
        }
        return ControllerResponse.streaming();
    }

    /**
     * POST /api/v1/jobs/{kind}/stop
     */
    private ControllerResponse handleStop(JobKind kind) throws Exception {
        StopOutcome outcome = registry.stop(kind);
        StopResponse response = StopResponse.from(kind, outcome);
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * GET /api/v1/jobs/{kind}/status
     */
    private ControllerResponse handleStatus(JobKind kind) throws Exception {
        JobStatusResponse response = registry.find(kind)
                .map(slot -> JobStatusResponse.from(slot.snapshot()))
                .orElseGet(() -> JobStatusResponse.idle(kind));
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    private static SseSubscriber openStream(Channel channel) {
        channel.writeAndFlush(SseSubscriber.streamHeaders());
        return new SseSubscriber(channel);
    }

    private static void watchDisconnect(Channel channel, JobSlot slot, SseSubscriber subscriber) {
        channel.closeFuture().addListener(future -> slot.detach(subscriber));
    }

    private static boolean forceRegenerate(FullHttpRequest req) {
        List<String> values = new QueryStringDecoder(req.uri()).parameters().get("forceRegenerate");
        return values != null && values.stream().anyMatch("true"::equalsIgnoreCase);
    }

    private static String userOf(StartOptions options) {
        return options.userId() == null ? "anonymous" : options.userId();
    }
}
