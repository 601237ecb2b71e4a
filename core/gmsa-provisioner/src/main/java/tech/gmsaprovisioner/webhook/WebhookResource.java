package tech.gmsaprovisioner.webhook;

import io.vertx.core.http.HttpServerRequest;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.ExampleObject;
import org.eclipse.microprofile.openapi.annotations.parameters.RequestBody;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.gmsaprovisioner.common.CancellationSignal;
import tech.gmsaprovisioner.common.ExecutionContext;
import tech.gmsaprovisioner.common.TracingContext;
import tech.gmsaprovisioner.common.errors.ErrorKind;
import tech.gmsaprovisioner.provisioning.ProvisioningResult;
import tech.gmsaprovisioner.reporting.ResultReporter;

@Path("/api/webhooks/gmsa")
@Tag(name = "Webhooks", description = "gMSA provisioning webhook")
public class WebhookResource {

    static final long ROOT_KEY_RETRY_AFTER_SECONDS = 3600;

    @Inject
    WebhookGateway gateway;

    @Inject
    ResultReporter reporter;

    @Inject
    TracingContext tracingContext;

    @POST
    @Consumes({MediaType.APPLICATION_JSON, MediaType.TEXT_PLAIN, MediaType.WILDCARD})
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Provision a gMSA",
        description = "Creates the group managed service account if it does not exist yet. Safe to redeliver.")
    @RequestBody(content = @Content(mediaType = MediaType.APPLICATION_JSON, examples = @ExampleObject(
        name = "Minimal request",
        value = """
            {
              "AccountName": "gmsa-app-service",
              "DNSHostName": "appserver.contoso.com",
              "PrincipalsAllowedToRetrieve": ["APPSERVERS"]
            }
            """)))
    @APIResponses({
        @APIResponse(responseCode = "201", description = "Account created and verified"),
        @APIResponse(responseCode = "200", description = "Account already exists"),
        @APIResponse(responseCode = "400", description = "Invalid or malformed request"),
        @APIResponse(responseCode = "401", description = "Webhook token missing or invalid"),
        @APIResponse(responseCode = "403", description = "Directory refused the operation"),
        @APIResponse(responseCode = "500", description = "Account could not be verified after creation"),
        @APIResponse(responseCode = "503", description = "Secret store or directory unavailable, or KDS root key not yet effective")
    })
    public Response provision(String body, @Context HttpHeaders headers, @Context HttpServerRequest httpRequest) {
        CancellationSignal cancellation = CancellationSignal.create();
        if (httpRequest != null && httpRequest.connection() != null) {
            httpRequest.connection().closeHandler(v -> cancellation.cancel());
        }

        ExecutionContext context = ExecutionContext.from(tracingContext, cancellation);
        ProvisioningResult result = gateway.handle(body, headers::getHeaderString, context);

        Response.ResponseBuilder response = Response.status(statusOf(result))
            .type(MediaType.APPLICATION_JSON)
            .entity(reporter.render(result));
        if (result instanceof ProvisioningResult.Failed failed && failed.errorKind() == ErrorKind.ROOT_KEY_PENDING) {
            response.header(HttpHeaders.RETRY_AFTER, ROOT_KEY_RETRY_AFTER_SECONDS);
        }
        return response.build();
    }

    static int statusOf(ProvisioningResult result) {
        if (result instanceof ProvisioningResult.Success) {
            return Response.Status.CREATED.getStatusCode();
        }
        if (result instanceof ProvisioningResult.AlreadyExists) {
            return Response.Status.OK.getStatusCode();
        }
        return ((ProvisioningResult.Failed) result).errorKind().httpStatus();
    }
}
