package in.pilottraders.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.pilottraders.domain.relay.RelayChannel;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory RelayChannel that keeps every frame it accepts.
 */
public class RecordingChannel implements RelayChannel {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<String> sent = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;
    private volatile boolean rejectWrites = false;

    @Override
    public boolean send(String text) {
        if (rejectWrites) {
            return false;
        }
        sent.add(text);
        return true;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        open = false;
    }

    public void rejectWrites() {
        this.rejectWrites = true;
    }

    public List<String> sent() {
        return sent;
    }

    public List<JsonNode> frames() {
        List<JsonNode> out = new ArrayList<>();
        for (String s : sent) {
            try {
                out.add(MAPPER.readTree(s));
            } catch (Exception e) {
                throw new AssertionError("Channel received invalid JSON: " + s, e);
            }
        }
        return out;
    }

    public List<JsonNode> framesOfType(String type) {
        List<JsonNode> out = new ArrayList<>();
        for (JsonNode f : frames()) {
            if (type.equals(f.path("type").asText())) {
                out.add(f);
            }
        }
        return out;
    }
}
