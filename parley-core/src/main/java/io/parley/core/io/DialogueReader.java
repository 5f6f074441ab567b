package io.parley.core.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.parley.core.config.model.IngestionConfig;
import io.parley.core.model.Dialogue;
import io.parley.core.model.DialogueAct;
import io.parley.core.model.GenerationError;
import io.parley.core.model.SpeakerRole;
import io.parley.core.model.Turn;
import io.parley.core.model.Utterance;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads stored dialogue transcripts.
 *
 * <p>A path is either a JSON file or a directory of {@code *.json} files (read in name order). A
 * file holds a dialogue array, an object with a {@code dialogues} array, or a single dialogue:
 * <pre>
 * {
 *   "conversation_id": "d-1",
 *   "conversation": [
 *     {"participant": "simulator", "utterance": "Hi", "intent": "greet"},
 *     {"participant": "agent", "utterance": "Hello!", "intent": "greet+elicit", "slot_values": [["genre", "comedy"]]}
 *   ],
 *   "metadata": {"error": {"error_type": "KeyError", "error_message": "...", "turn": 2}}
 * }
 * </pre>
 * Composite intents joined with {@code +} become separate dialogue acts.
 */
public final class DialogueReader {
    private static final Logger LOG = LoggerFactory.getLogger(DialogueReader.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;
    private final IngestionConfig config;

    public DialogueReader() {
        this(IngestionConfig.defaults());
    }

    public DialogueReader(IngestionConfig config) {
        this.mapper = new ObjectMapper();
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public List<Dialogue> read(Path path) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        if (Files.isDirectory(path)) {
            List<Path> files;
            try (Stream<Path> listing = Files.list(path)) {
                files = listing
                    .filter(Files::isRegularFile)
                    .filter(file -> file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json"))
                    .sorted()
                    .toList();
            }
            List<Dialogue> dialogues = new ArrayList<>();
            for (Path file : files) {
                dialogues.addAll(readFile(file));
            }
            LOG.info("Loaded {} dialogues from {} file(s) in {}", dialogues.size(), files.size(), path);
            return dialogues;
        }
        if (!Files.isRegularFile(path)) {
            throw new DialogueFormatException("Dialogue source not found: " + path);
        }
        List<Dialogue> dialogues = readFile(path);
        LOG.info("Loaded {} dialogues from {}", dialogues.size(), path);
        return dialogues;
    }

    public List<Dialogue> parse(String json) {
        return parse(json, "<inline>");
    }

    private List<Dialogue> readFile(Path file) throws IOException {
        return parse(Files.readString(file), file.toString());
    }

    private List<Dialogue> parse(String json, String source) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new DialogueFormatException("Invalid JSON in " + source + ": " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            return List.of();
        }

        JsonNode array = root.isObject() && root.has("dialogues") ? root.get("dialogues") : root;
        List<Dialogue> dialogues = new ArrayList<>();
        if (array.isArray()) {
            int position = 0;
            for (JsonNode node : array) {
                dialogues.add(toDialogue(node, source, position++));
            }
        } else if (array.isObject()) {
            dialogues.add(toDialogue(array, source, 0));
        } else {
            throw new DialogueFormatException("Expected a dialogue or a dialogue array in " + source);
        }
        return dialogues;
    }

    private Dialogue toDialogue(JsonNode node, String source, int position) {
        if (!node.isObject()) {
            throw new DialogueFormatException("Dialogue #" + position + " in " + source + " is not an object");
        }
        String id = firstText(node, "conversation_id", "dialogue_id", "id");
        if (id == null || id.isBlank()) {
            throw new DialogueFormatException("Dialogue #" + position + " in " + source + " has no id");
        }
        String where = "dialogue " + id + " in " + source;

        JsonNode turnsNode = node.has("conversation") ? node.get("conversation") : node.path("turns");
        if (!turnsNode.isArray()) {
            throw new DialogueFormatException("No conversation array for " + where);
        }
        List<Turn> turns = new ArrayList<>();
        for (JsonNode turnNode : turnsNode) {
            turns.add(toTurn(turnNode, turns.size(), where));
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        GenerationError error = null;
        JsonNode metadataNode = node.path("metadata");
        if (metadataNode.isObject()) {
            metadata.putAll(mapper.convertValue(metadataNode, MAP_TYPE));
            metadata.remove("error");
            metadata.values().removeIf(Objects::isNull);
            error = toError(metadataNode.get("error"), where);
        }
        try {
            return new Dialogue(id, turns, error, metadata);
        } catch (IllegalArgumentException e) {
            throw new DialogueFormatException("Invalid " + where + ": " + e.getMessage(), e);
        }
    }

    private Turn toTurn(JsonNode node, int index, String where) {
        String at = "turn " + index + " of " + where;
        if (!node.isObject()) {
            throw new DialogueFormatException("Malformed " + at);
        }
        SpeakerRole speaker = speaker(firstText(node, "participant", "speaker", "role"), at);
        String text = firstText(node, "utterance", "text");
        List<DialogueAct> acts = acts(node, at);
        Map<String, String> slots = slotValues(node.get("slot_values"), at);
        Integer replyTo = index(node.get("reply_to"), "reply_to", at);
        try {
            return new Turn(index, new Utterance(text, speaker, slots), acts, replyTo);
        } catch (IllegalArgumentException e) {
            throw new DialogueFormatException("Invalid " + at + ": " + e.getMessage(), e);
        }
    }

    private SpeakerRole speaker(String participant, String at) {
        if (participant == null) {
            throw new DialogueFormatException("Missing participant in " + at);
        }
        if (participant.equalsIgnoreCase(config.agentId())) {
            return SpeakerRole.AGENT;
        }
        if (participant.equalsIgnoreCase(config.userId())) {
            return SpeakerRole.USER;
        }
        try {
            return SpeakerRole.parse(participant);
        } catch (IllegalArgumentException e) {
            throw new DialogueFormatException("Unknown participant '" + participant + "' in " + at, e);
        }
    }

    private List<DialogueAct> acts(JsonNode node, String at) {
        List<String> labels = new ArrayList<>();
        JsonNode actsNode = node.get("dialogue_acts");
        if (actsNode != null && actsNode.isArray()) {
            for (JsonNode act : actsNode) {
                String label = act.isObject() ? firstText(act, "intent", "label") : act.asText();
                addComposite(labels, label);
            }
        } else {
            addComposite(labels, firstText(node, "intent", "act"));
        }
        if (labels.isEmpty()) {
            throw new DialogueFormatException("No dialogue act in " + at);
        }
        return labels.stream().map(DialogueAct::of).toList();
    }

    private void addComposite(List<String> labels, String label) {
        if (label == null) {
            return;
        }
        for (String part : label.split("\\+")) {
            if (!part.isBlank()) {
                labels.add(part.trim());
            }
        }
    }

    private Map<String, String> slotValues(JsonNode node, String at) {
        if (node == null || node.isNull()) {
            return Map.of();
        }
        Map<String, String> slots = new LinkedHashMap<>();
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                slots.put(field.getKey(), field.getValue().asText());
            }
        } else if (node.isArray()) {
            for (JsonNode pair : node) {
                if (pair.isArray() && pair.size() == 2) {
                    slots.put(pair.get(0).asText(), pair.get(1).asText());
                } else if (pair.isObject() && pair.has("slot")) {
                    slots.put(pair.get("slot").asText(), pair.path("value").asText());
                } else {
                    throw new DialogueFormatException("Malformed slot value in " + at);
                }
            }
        } else {
            throw new DialogueFormatException("Malformed slot values in " + at);
        }
        return slots;
    }

    private GenerationError toError(JsonNode node, String where) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return GenerationError.of(node.asText(), "");
        }
        if (!node.isObject()) {
            throw new DialogueFormatException("Malformed error metadata for " + where);
        }
        String type = firstText(node, "error_type", "type");
        if (type == null && !node.has("error_message")) {
            return null;
        }
        Integer turn = index(node.get("turn"), "turn", "error metadata for " + where);
        try {
            return new GenerationError(type, firstText(node, "error_message", "message"), turn);
        } catch (IllegalArgumentException e) {
            throw new DialogueFormatException("Invalid error metadata for " + where + ": " + e.getMessage(), e);
        }
    }

    private static Integer index(JsonNode node, String field, String at) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isIntegralNumber() && node.canConvertToInt()) {
            return node.intValue();
        }
        if (node.isTextual()) {
            try {
                return Integer.valueOf(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new DialogueFormatException(
                    "'" + field + "' must be a turn number in " + at + ", got \"" + node.asText() + "\"", e);
            }
        }
        throw new DialogueFormatException("'" + field + "' must be a turn number in " + at + ", got " + node);
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull()) {
                return value.asText();
            }
        }
        return null;
    }
}
