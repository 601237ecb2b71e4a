package tech.gmsaprovisioner.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import jakarta.enterprise.context.ApplicationScoped;
import tech.gmsaprovisioner.common.errors.ErrorKind;
import tech.gmsaprovisioner.common.errors.ProvisioningException;
import tech.gmsaprovisioner.provisioning.ProvisioningRequest;

import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * Parses webhook bodies into {@link ProvisioningRequest}s.
 *
 * <p>Accepts either the request object itself or an automation webhook
 * envelope:
 * <pre>
 * {"WebhookName": "...", "RequestBody": "{\"AccountName\": ...}", "RequestHeader": {...}}
 * </pre>
 * Property names are matched case-insensitively, unknown properties are
 * ignored, and a single string is accepted where a list is expected.
 */
@ApplicationScoped
public class WebhookPayloadParser {

    static final String ENVELOPE_BODY = "RequestBody";
    static final String ENVELOPE_HEADERS = "RequestHeader";

    private final ObjectMapper mapper = JsonMapper.builder()
        .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
        .enable(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();

    /**
     * @throws ProvisioningException {@link ErrorKind#MALFORMED_PAYLOAD} if the body is
     *         not a JSON object or does not map onto a request
     */
    public ProvisioningRequest parse(String body) {
        JsonNode root = readObject(body);

        JsonNode inner = field(root, ENVELOPE_BODY);
        if (inner != null && !inner.isNull()) {
            root = inner.isTextual() ? readObject(inner.asText()) : inner;
            if (!root.isObject()) {
                throw malformed(ENVELOPE_BODY + " is not a JSON object", null);
            }
        }

        try {
            return mapper.treeToValue(root, ProvisioningRequest.class);
        } catch (JsonProcessingException e) {
            throw malformed(e.getOriginalMessage(), e);
        }
    }

    /**
     * Header value carried inside an envelope's {@code RequestHeader} object.
     * Empty if the body is not an envelope or does not carry the header.
     */
    public Optional<String> envelopeHeader(String body, String headerName) {
        JsonNode root;
        try {
            root = readObject(body);
        } catch (ProvisioningException e) {
            return Optional.empty();
        }
        JsonNode headers = field(root, ENVELOPE_HEADERS);
        if (headers == null || !headers.isObject()) {
            return Optional.empty();
        }
        JsonNode value = field(headers, headerName);
        return value != null && value.isValueNode() ? Optional.of(value.asText()) : Optional.empty();
    }

    private JsonNode readObject(String body) {
        if (body == null || body.isBlank()) {
            throw malformed("Request body is empty", null);
        }
        JsonNode node;
        try {
            node = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw malformed(e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw malformed("Request body is not a JSON object", null);
        }
        return node;
    }

    private static JsonNode field(JsonNode node, String name) {
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static ProvisioningException malformed(String detail, Throwable cause) {
        return new ProvisioningException(ErrorKind.MALFORMED_PAYLOAD, "Malformed payload: " + detail, cause);
    }
}
