package caseflow.coordinator.api.v1;

import caseflow.coordinator.api.Controller;
import caseflow.coordinator.api.v1.dto.WebhookResponse;
import caseflow.coordinator.error.AuthenticationException;
import caseflow.coordinator.error.PermanentValidationException;
import caseflow.coordinator.model.ChangeEvent;
import caseflow.coordinator.server.RouterHandler;
import caseflow.coordinator.service.CaseIntakeService;
import caseflow.coordinator.service.IntakeResult;
import caseflow.coordinator.service.SignatureVerifier;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;

import java.io.IOException;

/**
 * Inbound change events.
 * POST /api/v1/webhooks/cases - first-party, HMAC-signed
 * POST /api/v1/webhooks/external/cases - third-party, structurally validated
 */
public class WebhookController implements Controller {

    static final String FIRST_PARTY_PATH = "/api/v1/webhooks/cases";
    static final String EXTERNAL_PATH = "/api/v1/webhooks/external/cases";
    public static final String SIGNATURE_HEADER = "X-Webhook-Signature";

    private final CaseIntakeService intake;
    private final SignatureVerifier verifier;

    /**
     * @param verifier null when no webhook secret is configured; signed events are then refused
     */
    public WebhookController(CaseIntakeService intake, SignatureVerifier verifier) {
        this.intake = intake;
        this.verifier = verifier;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && (FIRST_PARTY_PATH.equals(path) || EXTERNAL_PATH.equals(path));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        byte[] body = ByteBufUtil.getBytes(req.content());
        IntakeResult result;
        if (FIRST_PARTY_PATH.equals(path)) {
            if (verifier == null) {
                throw new AuthenticationException("Webhook signing is not configured");
            }
            verifier.verify(body, req.headers().get(SIGNATURE_HEADER));
            result = intake.acceptFirstParty(parse(body));
        } else {
            result = intake.acceptExternal(parse(body));
        }

        try {
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(WebhookResponse.from(result)));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode webhook response", e);
        }
    }

    static ChangeEvent parse(byte[] body) {
        if (body.length == 0) {
            throw new PermanentValidationException("Request body is required");
        }
        try {
            ChangeEvent event = RouterHandler.mapper().readValue(body, ChangeEvent.class);
            if (event == null) {
                throw new PermanentValidationException("Request body is required");
            }
            return event;
        } catch (IOException e) {
            throw new PermanentValidationException("Malformed event body");
        }
    }
}
