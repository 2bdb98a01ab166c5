package cz.cas.jhinst.qsource3.protocol.mqtt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Encodes command payloads and decodes device reports.
 * <p>
 * Every payload is a UTF-8 JSON object. Commands carry a single
 * {@code "value"} key, or nothing at all to request the current value.
 */
public final class PayloadCodec
{
    public static final String VALUE_KEY = "value";

    private final ObjectMapper mapper;

    public PayloadCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * @param value canonical setting value; calibration curves are written as
     *              the full ordered list of {@code [x, y]} pairs
     */
    public byte[] encodeValue(Object value) {
        ObjectNode root = mapper.createObjectNode();
        root.set(VALUE_KEY, mapper.valueToTree(value));
        return toBytes(root);
    }

    public byte[] encodeRequest() {
        return toBytes(mapper.createObjectNode());
    }

    /**
     * Parses a report payload.
     *
     * @throws IOException if the payload is not JSON or not a JSON object
     */
    public ObjectNode decodeRecord(byte[] payload) throws IOException {
        Objects.requireNonNull(payload, "payload");

        JsonNode root = mapper.readTree(payload);
        if (root == null || root.isMissingNode()) {
            throw new IOException("Empty payload");
        }
        if (!(root instanceof ObjectNode record)) {
            throw new IOException("Payload is a JSON " + root.getNodeType() + ", not an object");
        }
        return record;
    }

    /**
     * Converts one report value into the plain Java form validators accept
     * (numbers, booleans, strings, lists, maps).
     */
    public Object toCandidate(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return mapper.treeToValue(node, Object.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot convert report value " + node, e);
        }
    }

    private byte[] toBytes(JsonNode node) {
        try {
            return mapper.writeValueAsString(node).getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize payload", e);
        }
    }
}
