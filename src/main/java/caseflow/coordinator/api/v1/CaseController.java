package caseflow.coordinator.api.v1;

import caseflow.coordinator.api.Controller;
import caseflow.coordinator.api.v1.dto.CaseStatusResponse;
import caseflow.coordinator.api.v1.dto.StageResponse;
import caseflow.coordinator.api.v1.dto.WebhookResponse;
import caseflow.coordinator.server.RouterHandler;
import caseflow.coordinator.service.CaseIntakeService;
import caseflow.coordinator.service.CaseStatusService;
import caseflow.coordinator.service.CaseStatusService.CaseStatusView;
import caseflow.coordinator.service.IntakeResult;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for case progress.
 * GET /api/v1/cases/{id}/status - processing status and stage progress
 * GET /api/v1/cases/{id}/stages - stage records
 * POST /api/v1/cases/{id}/process - start a new run (service credentials required)
 */
public class CaseController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(CaseController.class);

    private static final Pattern STATUS_PATTERN = Pattern.compile("^/api/v1/cases/([^/]+)/status$");
    private static final Pattern STAGES_PATTERN = Pattern.compile("^/api/v1/cases/([^/]+)/stages$");
    public static final Pattern PROCESS_PATTERN = Pattern.compile("^/api/v1/cases/([^/]+)/process$");

    private final CaseStatusService statusService;
    private final CaseIntakeService intake;

    public CaseController(CaseStatusService statusService, CaseIntakeService intake) {
        this.statusService = statusService;
        this.intake = intake;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.GET)) {
            return STATUS_PATTERN.matcher(path).matches() || STAGES_PATTERN.matcher(path).matches();
        }
        return method.equals(HttpMethod.POST) && PROCESS_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            Matcher status = STATUS_PATTERN.matcher(path);
            if (status.matches()) {
                return handleStatus(status.group(1));
            }

            Matcher stages = STAGES_PATTERN.matcher(path);
            if (stages.matches()) {
                return handleStages(stages.group(1));
            }

            Matcher process = PROCESS_PATTERN.matcher(path);
            if (process.matches()) {
                return handleProcess(process.group(1));
            }

            return ControllerResponse.notFound("unknown case endpoint");

        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Case controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    private ControllerResponse handleStatus(String caseId) throws Exception {
        Optional<CaseStatusView> view = statusService.status(caseId);
        if (view.isEmpty()) {
            return ControllerResponse.notFound("case not found");
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(CaseStatusResponse.from(view.get())));
    }

    private ControllerResponse handleStages(String caseId) throws Exception {
        List<StageResponse> stages = statusService.stages(caseId).stream()
                .map(StageResponse::from)
                .toList();
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(stages));
    }

    private ControllerResponse handleProcess(String caseId) throws Exception {
        IntakeResult result;
        try {
            result = intake.reprocess(caseId);
        } catch (IllegalArgumentException e) {
            return ControllerResponse.notFound(e.getMessage());
        }
        HttpResponseStatus status = result.isEnqueued() ? HttpResponseStatus.ACCEPTED : HttpResponseStatus.CONFLICT;
        return ControllerResponse.json(status, RouterHandler.mapper().writeValueAsString(WebhookResponse.from(result)));
    }
}
