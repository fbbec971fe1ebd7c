package io.governance.core.token;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory stand-in for the external fungible token contract.
 * Tracks balances of a single token in a HashMap. Not persistent.
 *
 * <p>Delegated calls addressed to the token are JSON commands:
 * {@code {"transfer":{"recipient":..,"amount":..}}} and {@code {"burn":{"amount":..}}}.
 */
public final class InMemoryTokenLedger implements TokenQuerier {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String address;
    private final Map<String, Long> balances = new HashMap<>();

    public InMemoryTokenLedger(String address) {
        this.address = Objects.requireNonNull(address, "address");
    }

    public String address() {
        return address;
    }

    @Override
    public synchronized long balanceOf(String token, String holder) {
        if (!address.equals(token)) {
            throw new IllegalArgumentException("Unknown token: " + token);
        }
        return balances.getOrDefault(holder, 0L);
    }

    public synchronized long balanceOf(String holder) {
        return balances.getOrDefault(holder, 0L);
    }

    public synchronized void credit(String holder, long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("amount must be >= 0");
        }
        balances.put(holder, Math.addExact(balanceOf(holder), amount));
    }

    public synchronized void transfer(String from, String to, long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("amount must be > 0");
        }
        long fromBal = balanceOf(from);
        if (fromBal < amount) {
            throw new IllegalStateException("Insufficient balance: " + from + " has " + fromBal + ", needs " + amount);
        }
        // debit sender
        balances.put(from, fromBal - amount);
        // credit recipient
        balances.put(to, Math.addExact(balanceOf(to), amount));
    }

    public synchronized void burn(String holder, long amount) {
        long bal = balanceOf(holder);
        if (amount <= 0 || bal < amount) {
            throw new IllegalStateException("Cannot burn " + amount + " from " + holder);
        }
        balances.put(holder, bal - amount);
    }

    /** Copy of every holder balance. */
    public synchronized Map<String, Long> balances() {
        return new HashMap<>(balances);
    }

    /** Replaces all balances, e.g. with the ones a store recorded before a restart. */
    public synchronized void restore(Map<String, Long> saved) {
        balances.clear();
        for (Map.Entry<String, Long> e : saved.entrySet()) {
            if (e.getValue() < 0) {
                throw new IllegalArgumentException("Negative balance for " + e.getKey());
            }
            balances.put(e.getKey(), e.getValue());
        }
    }

    /** Runs a JSON command on behalf of {@code sender}. */
    public void execute(String sender, byte[] payload) {
        JsonNode root;
        try {
            root = MAPPER.readTree(payload);
        } catch (IOException e) {
            throw new IllegalArgumentException("Token command is not valid JSON", e);
        }
        if (root == null || !root.isObject() || root.size() != 1) {
            throw new IllegalArgumentException("Token command must have exactly one variant");
        }
        String variant = root.fieldNames().next();
        JsonNode body = root.get(variant);
        switch (variant) {
            case "transfer" -> transfer(sender, requireText(body, "recipient"), requireAmount(body));
            case "burn" -> burn(sender, requireAmount(body));
            default -> throw new IllegalArgumentException("Unsupported token command: " + variant);
        }
    }

    public static byte[] transferPayload(String recipient, long amount) {
        ObjectNode root = MAPPER.createObjectNode();
        root.putObject("transfer").put("recipient", recipient).put("amount", Long.toString(amount));
        return bytes(root);
    }

    public static byte[] burnPayload(long amount) {
        ObjectNode root = MAPPER.createObjectNode();
        root.putObject("burn").put("amount", Long.toString(amount));
        return bytes(root);
    }

    private static byte[] bytes(JsonNode node) {
        try {
            return MAPPER.writeValueAsBytes(node);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to encode token command", e);
        }
    }

    private static String requireText(JsonNode body, String field) {
        JsonNode n = body == null ? null : body.get(field);
        if (n == null || !n.isTextual() || n.asText().isBlank()) {
            throw new IllegalArgumentException("Missing field: " + field);
        }
        return n.asText();
    }

    private static long requireAmount(JsonNode body) {
        JsonNode n = body == null ? null : body.get("amount");
        if (n == null || n.isNull()) {
            throw new IllegalArgumentException("Missing field: amount");
        }
        try {
            return n.isNumber() ? n.longValue() : Long.parseLong(n.asText());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid amount: " + n.asText(), e);
        }
    }
}
