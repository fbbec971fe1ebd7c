package io.governance.core.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.governance.core.gov.GovernanceError;
import io.governance.core.gov.GovernanceException;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * JSON codec for the opaque messages governance receives: deposit-notification hooks
 * ({@code stake_voting_tokens}, {@code create_poll}) and self-calls ({@code update_config}).
 * Each message is a single-key object naming the variant; binary payloads are base64.
 */
public final class MessageCodec {
    private static final ObjectMapper JSON = new ObjectMapper();

    private MessageCodec() {}

    // -------------------- decode --------------------

    public static HookMessage decodeHook(byte[] bytes) {
        Map.Entry<String, JsonNode> variant = variant(bytes);
        switch (variant.getKey()) {
            case "stake_voting_tokens":
                return new HookMessage.StakeVotingTokens();
            case "create_poll":
                return new HookMessage.CreatePoll(readCreatePoll(variant.getValue()));
            default:
                throw invalid("Unknown hook message: " + variant.getKey(), null);
        }
    }

    public static UpdateConfigRequest decodeUpdateConfig(byte[] bytes) {
        Map.Entry<String, JsonNode> variant = variant(bytes);
        if (!"update_config".equals(variant.getKey())) {
            throw invalid("Unsupported call: " + variant.getKey(), null);
        }
        JsonNode body = variant.getValue();
        try {
            return new UpdateConfigRequest(
                    text(body, "owner"),
                    decimal(body, "quorum"),
                    decimal(body, "threshold"),
                    number(body, "voting_period"),
                    number(body, "timelock_period"),
                    number(body, "expiration_period"),
                    number(body, "proposal_deposit"),
                    number(body, "snapshot_period"));
        } catch (RuntimeException e) {
            throw invalid("Malformed update_config message", e);
        }
    }

    // -------------------- encode --------------------

    public static byte[] encodeStake() {
        ObjectNode root = JSON.createObjectNode();
        root.putObject("stake_voting_tokens");
        return bytes(root);
    }

    public static byte[] encodeCreatePoll(CreatePollRequest request) {
        ObjectNode root = JSON.createObjectNode();
        ObjectNode body = root.putObject("create_poll");
        body.put("title", request.title());
        body.put("description", request.description());
        if (request.link() != null) {
            body.put("link", request.link());
        }
        if (request.executeMsgs() != null) {
            ArrayNode msgs = body.putArray("execute_msgs");
            for (DelegatedCall call : request.executeMsgs()) {
                msgs.addObject()
                        .put("order", call.order())
                        .put("contract", call.contract())
                        .put("msg", call.msg());
            }
        }
        return bytes(root);
    }

    public static byte[] encodeUpdateConfig(UpdateConfigRequest request) {
        ObjectNode root = JSON.createObjectNode();
        ObjectNode body = root.putObject("update_config");
        if (request.owner() != null) body.put("owner", request.owner());
        if (request.quorum() != null) body.put("quorum", request.quorum().toPlainString());
        if (request.threshold() != null) body.put("threshold", request.threshold().toPlainString());
        if (request.votingPeriod() != null) body.put("voting_period", request.votingPeriod());
        if (request.timelockPeriod() != null) body.put("timelock_period", request.timelockPeriod());
        if (request.expirationPeriod() != null) body.put("expiration_period", request.expirationPeriod());
        if (request.proposalDeposit() != null) body.put("proposal_deposit", request.proposalDeposit());
        if (request.snapshotPeriod() != null) body.put("snapshot_period", request.snapshotPeriod());
        return bytes(root);
    }

    // -------------------- helpers --------------------

    private static CreatePollRequest readCreatePoll(JsonNode body) {
        try {
            List<DelegatedCall> calls = null;
            JsonNode msgs = body.get("execute_msgs");
            if (msgs != null && !msgs.isNull()) {
                if (!msgs.isArray()) {
                    throw new IllegalArgumentException("execute_msgs must be an array");
                }
                calls = new ArrayList<>();
                for (JsonNode m : msgs) {
                    calls.add(new DelegatedCall(
                            m.path("order").asLong(),
                            m.path("contract").asText(null),
                            m.path("msg").binaryValue()));
                }
            }
            return new CreatePollRequest(text(body, "title"), text(body, "description"), text(body, "link"), calls);
        } catch (IOException | RuntimeException e) {
            throw invalid("Malformed create_poll message", e);
        }
    }

    private static Map.Entry<String, JsonNode> variant(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw invalid("Missing message", null);
        }
        JsonNode root;
        try {
            root = JSON.readTree(bytes);
        } catch (IOException e) {
            throw invalid("Message is not valid JSON", e);
        }
        if (root == null || !root.isObject() || root.size() != 1) {
            throw invalid("Message must be an object with exactly one variant", null);
        }
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        return fields.next();
    }

    private static String text(JsonNode body, String field) {
        JsonNode n = body.get(field);
        return n == null || n.isNull() ? null : n.asText();
    }

    private static Long number(JsonNode body, String field) {
        JsonNode n = body.get(field);
        if (n == null || n.isNull()) {
            return null;
        }
        if (!n.canConvertToLong() && !n.isTextual()) {
            throw new IllegalArgumentException(field + " must be an integer");
        }
        return n.isTextual() ? Long.parseLong(n.asText()) : n.asLong();
    }

    private static BigDecimal decimal(JsonNode body, String field) {
        JsonNode n = body.get(field);
        return n == null || n.isNull() ? null : new BigDecimal(n.asText());
    }

    private static byte[] bytes(JsonNode node) {
        try {
            return JSON.writeValueAsBytes(node);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to encode message", e);
        }
    }

    private static GovernanceException invalid(String message, Throwable cause) {
        return new GovernanceException(GovernanceError.INVALID_MESSAGE, message, cause);
    }
}
