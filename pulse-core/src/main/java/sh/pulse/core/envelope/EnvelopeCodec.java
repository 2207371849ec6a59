// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.core.envelope;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ObjectNode;

import sh.pulse.core.error.CodecException;

/**
 * JSON codec for the push protocol's envelopes.
 *
 * <p>
 * Decoding is total: it never throws. Syntactically broken JSON, a missing or
 * non-string {@code type}, and missing or mistyped required fields all yield a
 * {@link DecodeResult.DecodeFailure} whose reason is meant for the connection
 * log. A well-formed message with an unrecognised type decodes to
 * {@link InboundEnvelope.Unknown}.
 *
 * <p>
 * Encoding produces:
 * <pre>
 * {"type":"events","subscriptionId":1,"batch":[...]}
 * {"type":"error","subscriptionId":1,"error":{"code":404,"message":"Not found"}}
 * {"type":"complete","subscriptionId":1}
 * </pre>
 *
 * <p><b>Thread Safety:</b> instances are immutable and may be shared across
 * connections.
 */
public final class EnvelopeCodec {

    static final String PARSE_ERROR = "Error parsing JSON";
    static final String MISSING_TYPE = "Received message without a type";

    private final ObjectMapper mapper;
    private final ObjectReader reader;

    /**
     * Creates a codec with a default {@link ObjectMapper}.
     */
    public EnvelopeCodec() {
        this(new ObjectMapper());
    }

    /**
     * Creates a codec backed by the given mapper. The mapper also serializes
     * batch items, so custom modules registered on it apply to stream payloads.
     *
     * @param mapper the Jackson mapper to use
     */
    public EnvelopeCodec(final ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.reader = mapper.reader().with(
                DeserializationFeature.FAIL_ON_TRAILING_TOKENS,
                DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    }

    /**
     * Decodes one inbound text frame.
     *
     * @param text the raw frame payload
     * @return the decoded envelope or the reason it was rejected
     */
    public DecodeResult decode(final String text) {
        if (text == null) {
            return DecodeResult.failure(PARSE_ERROR);
        }

        final JsonNode node;
        try {
            node = reader.readTree(text);
        } catch (JsonProcessingException e) {
            return DecodeResult.failure(PARSE_ERROR + ": " + e.getOriginalMessage());
        }
        if (node == null || node.isMissingNode() || node.isNull()) {
            return DecodeResult.failure(PARSE_ERROR);
        }

        JsonNode typeNode = node.isObject() ? node.get("type") : null;
        if (typeNode == null || !typeNode.isTextual()) {
            return DecodeResult.failure(MISSING_TYPE);
        }

        String type = typeNode.asText();
        return switch (type) {
            case "hello" -> decodeHello(node);
            case "subscribe" -> decodeSubscribe(node);
            case "unsubscribe" -> decodeUnsubscribe(node);
            default -> DecodeResult.decoded(new InboundEnvelope.Unknown(type));
        };
    }

    private static DecodeResult decodeHello(final JsonNode node) {
        JsonNode sessionId = node.get("sessionId");
        if (sessionId == null || !sessionId.isTextual()) {
            return DecodeResult.failure("expected sessionId");
        }
        return DecodeResult.decoded(new InboundEnvelope.Hello(sessionId.asText()));
    }

    private static DecodeResult decodeSubscribe(final JsonNode node) {
        JsonNode offsetNode = node.get("offset");
        if (offsetNode == null || !offsetNode.isNumber()) {
            return DecodeResult.failure("expected offset number");
        }
        Optional<BigDecimal> offset = numericValue(offsetNode);
        if (offset.isEmpty()) {
            return DecodeResult.failure("expected finite offset, got: " + offsetNode);
        }

        JsonNode idNode = node.get("subscriptionId");
        if (idNode == null || !idNode.isNumber()) {
            return DecodeResult.failure("expected subscriptionId number");
        }
        Optional<BigDecimal> id = numericValue(idNode);
        if (id.isEmpty()) {
            return DecodeResult.failure("expected finite subscriptionId, got: " + idNode);
        }

        JsonNode nameNode = node.get("name");
        if (nameNode == null || !nameNode.isTextual()) {
            return DecodeResult.failure("expected name string");
        }

        return DecodeResult.decoded(new InboundEnvelope.Subscribe(
                SubscriptionId.of(id.get()), nameNode.asText(), offset.get()));
    }

    private static DecodeResult decodeUnsubscribe(final JsonNode node) {
        JsonNode idNode = node.get("subscriptionId");
        if (idNode == null || !idNode.isNumber()) {
            return DecodeResult.failure("expected subscriptionId number");
        }
        Optional<BigDecimal> id = numericValue(idNode);
        if (id.isEmpty()) {
            return DecodeResult.failure("expected finite subscriptionId, got: " + idNode);
        }
        return DecodeResult.decoded(new InboundEnvelope.Unsubscribe(SubscriptionId.of(id.get())));
    }

    /**
     * Returns the exact value of a JSON number, or empty for NaN and the
     * infinities, which only a mapper with non-numeric numbers enabled produces.
     */
    static Optional<BigDecimal> numericValue(final JsonNode number) {
        if ((number.isDouble() || number.isFloat()) && !Double.isFinite(number.doubleValue())) {
            return Optional.empty();
        }
        return Optional.of(number.decimalValue());
    }

    /**
     * Encodes one outbound envelope.
     *
     * @param envelope the envelope to send
     * @return the JSON text frame payload
     * @throws CodecException if a batch item cannot be serialized
     */
    public String encode(final OutboundEnvelope envelope) {
        Objects.requireNonNull(envelope, "envelope");

        ObjectNode node = mapper.createObjectNode();
        node.put("type", envelope.type());
        putSubscriptionId(node, envelope.subscriptionId());

        if (envelope instanceof OutboundEnvelope.Events events) {
            try {
                node.set("batch", mapper.valueToTree(events.batch()));
            } catch (IllegalArgumentException e) {
                throw new CodecException(
                        "Failed to serialize batch for subscription " + envelope.subscriptionId(), e);
            }
        } else if (envelope instanceof OutboundEnvelope.Failure failure) {
            ObjectNode error = node.putObject("error");
            error.put("code", failure.error().code());
            error.put("message", failure.error().message());
        }

        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new CodecException("Failed to serialize " + envelope.type() + " envelope", e);
        }
    }

    // Whole ids are written as plain integers, so 1e20 goes out as 100000000000000000000.
    private static void putSubscriptionId(final ObjectNode node, final SubscriptionId id) {
        if (id.isIntegral()) {
            node.put("subscriptionId", id.value().toBigIntegerExact());
        } else {
            node.put("subscriptionId", id.value());
        }
    }
}
