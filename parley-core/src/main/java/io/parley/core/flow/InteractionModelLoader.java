package io.parley.core.flow;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads an interaction model from JSON.
 *
 * <p>Accepts the node-link layout ({@code nodes} plus {@code links} or {@code edges}, each edge
 * with {@code source} and {@code target}) and a plain adjacency layout
 * ({@code {"transitions": {"request": ["inform"]}}}).
 */
public final class InteractionModelLoader {
    private static final Logger LOG = LoggerFactory.getLogger(InteractionModelLoader.class);

    private final ObjectMapper mapper;

    public InteractionModelLoader() {
        this(new ObjectMapper());
    }

    public InteractionModelLoader(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    public InteractionModel load(Path path) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        if (!Files.isRegularFile(path)) {
            throw new InteractionModelException("Interaction model not found: " + path);
        }
        InteractionModel model = parse(Files.readString(path), path.toString());
        LOG.info("Interaction model loaded from {}: {} acts, {} transitions",
            path, model.nodes().size(), model.edgeCount());
        return model;
    }

    public InteractionModel parse(String json) {
        return parse(json, "<inline>");
    }

    private InteractionModel parse(String json, String source) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InteractionModelException("Invalid interaction model JSON in " + source + ": " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new InteractionModelException("Interaction model in " + source + " must be a JSON object");
        }

        InteractionModel.Builder builder = InteractionModel.builder();
        if (root.has("transitions")) {
            readAdjacency(root.get("transitions"), builder, source);
        } else if (root.has("nodes") || root.has("links") || root.has("edges")) {
            readNodeLink(root, builder, source);
        } else {
            throw new InteractionModelException(
                "Interaction model in " + source + " needs either 'transitions' or 'nodes'/'links'");
        }
        return builder.build();
    }

    private void readAdjacency(JsonNode transitions, InteractionModel.Builder builder, String source) {
        if (!transitions.isObject()) {
            throw new InteractionModelException("'transitions' in " + source + " must be an object");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = transitions.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            builder.node(entry.getKey());
            JsonNode targets = entry.getValue();
            if (!targets.isArray()) {
                throw new InteractionModelException(
                    "Successors of '" + entry.getKey() + "' in " + source + " must be an array");
            }
            for (JsonNode target : targets) {
                builder.edge(entry.getKey(), text(target, source));
            }
        }
    }

    private void readNodeLink(JsonNode root, InteractionModel.Builder builder, String source) {
        JsonNode nodes = root.path("nodes");
        if (nodes.isArray()) {
            for (JsonNode node : nodes) {
                builder.node(node.isObject() ? text(node.get("id"), source) : text(node, source));
            }
        }
        JsonNode links = root.has("links") ? root.get("links") : root.path("edges");
        if (!links.isMissingNode() && !links.isArray()) {
            throw new InteractionModelException("Edges in " + source + " must be an array");
        }
        for (JsonNode link : links) {
            builder.edge(text(link.get("source"), source), text(link.get("target"), source));
        }
    }

    private String text(JsonNode node, String source) {
        if (node == null || node.isNull() || !node.isValueNode() || node.asText().isBlank()) {
            throw new InteractionModelException("Missing act label in " + source);
        }
        return node.asText();
    }
}
