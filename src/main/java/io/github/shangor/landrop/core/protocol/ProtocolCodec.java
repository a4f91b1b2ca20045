package io.github.shangor.landrop.core.protocol;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * JSON encoding of the discovery datagram and the two transfer control records.
 */
public final class ProtocolCodec {
    private static final Logger log = LoggerFactory.getLogger(ProtocolCodec.class);

    private static final Gson GSON = new GsonBuilder()
            .disableHtmlEscaping()
            .create();

    private ProtocolCodec() {
    }

    public static byte[] encodeAnnouncement(AnnounceMessage message) {
        return GSON.toJson(message).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Parses a datagram payload. Anything that is not a well-formed announcement yields empty.
     */
    public static Optional<AnnounceMessage> decodeAnnouncement(byte[] data) {
        try {
            JsonObject json = parseObject(new String(data, StandardCharsets.UTF_8), MessageKind.ANNOUNCE);
            AnnounceMessage message = GSON.fromJson(json, AnnounceMessage.class);
            if (isBlank(message.deviceId())) {
                return Optional.empty();
            }
            if (message.transferPort() <= 0 || message.transferPort() > 0xFFFF) {
                return Optional.empty();
            }
            if (isBlank(message.deviceName())) {
                message = new AnnounceMessage(message.kind(), message.deviceId(), message.deviceId(),
                        message.platform(), message.transferPort(), message.timestamp());
            }
            return Optional.of(message);
        } catch (ProtocolException | JsonParseException | NumberFormatException e) {
            log.debug("Dropping malformed announcement: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public static String encode(TransferRequestMessage message) {
        return GSON.toJson(message);
    }

    public static String encode(TransferResponseMessage message) {
        return GSON.toJson(message);
    }

    /**
     * Parses and validates a transfer request line: every entry must be named, file sizes must be
     * non-negative and {@code totalSize} must equal the sum of the file sizes.
     */
    public static TransferRequestMessage decodeRequest(String line) throws ProtocolException {
        JsonObject json = parseObject(line, MessageKind.TRANSFER_REQUEST);
        TransferRequestMessage message;
        try {
            message = GSON.fromJson(json, TransferRequestMessage.class);
        } catch (JsonParseException | NumberFormatException e) {
            throw new ProtocolException("Malformed transfer request", e);
        }
        if (message.totalSize() == null || message.totalSize() < 0) {
            throw new ProtocolException("Missing or negative totalSize");
        }
        if (message.files() == null) {
            throw new ProtocolException("Missing file manifest");
        }
        long sum = 0;
        for (ManifestEntry entry : message.files()) {
            if (entry == null || isBlank(entry.name())) {
                throw new ProtocolException("Manifest entry without a name");
            }
            if (Boolean.TRUE.equals(entry.isDirectory())) {
                continue;
            }
            if (entry.size() == null || entry.size() < 0) {
                throw new ProtocolException("Missing or negative size for " + entry.name());
            }
            try {
                sum = Math.addExact(sum, entry.size());
            } catch (ArithmeticException e) {
                throw new ProtocolException("manifest size overflow", e);
            }
        }
        if (sum != message.totalSize()) {
            throw new ProtocolException("Declared totalSize " + message.totalSize() + " does not match manifest sum " + sum);
        }
        return message;
    }

    public static TransferResponseMessage decodeResponse(String line) throws ProtocolException {
        JsonObject json = parseObject(line, MessageKind.TRANSFER_RESPONSE);
        TransferResponseMessage message;
        try {
            message = GSON.fromJson(json, TransferResponseMessage.class);
        } catch (JsonParseException e) {
            throw new ProtocolException("Malformed transfer response", e);
        }
        if (message.accepted() == null) {
            throw new ProtocolException("Transfer response without an accepted flag");
        }
        return message;
    }

    private static JsonObject parseObject(String text, String expectedKind) throws ProtocolException {
        JsonElement element;
        try {
            element = JsonParser.parseString(text);
        } catch (JsonParseException e) {
            throw new ProtocolException("Invalid JSON", e);
        }
        if (element == null || !element.isJsonObject()) {
            throw new ProtocolException("Expected a JSON object");
        }
        JsonObject json = element.getAsJsonObject();
        JsonElement kind = json.get("kind");
        if (kind == null || !kind.isJsonPrimitive() || !expectedKind.equals(kind.getAsString())) {
            throw new ProtocolException("Expected kind '" + expectedKind + "' but got " + kind);
        }
        return json;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
