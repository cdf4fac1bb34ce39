package com.pharmaforecast.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pharmaforecast.exception.ModelLoadException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a model artifact document into a {@link DemandModel}.
 *
 * <pre>
 * { "format": "gbtree", "base_score": 0.5, "trees": [ &lt;xgboost json dump&gt;, ... ] }
 * { "format": "linear", "intercept": 2.0, "coefficients": { "usage_lag_1": 0.4, ... } }
 * </pre>
 */
public class ModelArtifactReader {

    private final ObjectMapper mapper;

    public ModelArtifactReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public DemandModel read(ModelArtifact artifact) {
        JsonNode root;
        try (InputStream in = artifact.resource().getInputStream()) {
            root = mapper.readTree(in);
        } catch (IOException ex) {
            throw new ModelLoadException(artifact.name(), "unreadable artifact", ex);
        }
        if (root == null || !root.isObject()) {
            throw new ModelLoadException(artifact.name(), "artifact is not a JSON object");
        }
        String format = root.path("format").asText("gbtree");
        return switch (format) {
            case "gbtree" -> readTrees(artifact.name(), root);
            case "linear" -> readLinear(artifact.name(), root);
            default -> throw new ModelLoadException(artifact.name(), "unsupported model format '" + format + "'");
        };
    }

    private TreeEnsembleModel readTrees(String name, JsonNode root) {
        JsonNode trees = root.get("trees");
        if (trees == null || !trees.isArray() || trees.isEmpty()) {
            throw new ModelLoadException(name, "'trees' must be a non-empty array");
        }
        List<TreeEnsembleModel.Node> roots = new ArrayList<>();
        for (JsonNode tree : trees) {
            Map<Integer, JsonNode> byId = new HashMap<>();
            index(tree, byId);
            Set<Integer> claimed = new HashSet<>();
            if (tree.has("nodeid")) {
                claimed.add(tree.get("nodeid").asInt());
            }
            roots.add(build(name, tree, byId, claimed, 0));
        }
        return new TreeEnsembleModel(root.path("base_score").asDouble(0.0), roots);
    }

    private void index(JsonNode node, Map<Integer, JsonNode> byId) {
        if (node.has("nodeid")) {
            byId.put(node.get("nodeid").asInt(), node);
        }
        JsonNode children = node.get("children");
        if (children != null && children.isArray()) {
            for (JsonNode child : children) {
                index(child, byId);
            }
        }
    }

    private TreeEnsembleModel.Node build(String name, JsonNode node, Map<Integer, JsonNode> byId,
                                         Set<Integer> claimed, int depth) {
        if (depth > 64) {
            throw new ModelLoadException(name, "tree deeper than 64 levels");
        }
        if (node.has("leaf")) {
            return new TreeEnsembleModel.Leaf(node.get("leaf").asDouble());
        }
        String split = node.path("split").asText(null);
        int feature = FeatureVector.indexOf(split);
        if (feature < 0) {
            throw new ModelLoadException(name, "unknown split feature '" + split + "'");
        }
        if (!node.has("split_condition") || !node.has("yes") || !node.has("no")) {
            throw new ModelLoadException(name, "split node " + node.path("nodeid").asText("?") + " is incomplete");
        }
        int yesId = node.get("yes").asInt();
        int noId = node.get("no").asInt();
        TreeEnsembleModel.Node yes = child(name, yesId, byId, claimed, depth);
        TreeEnsembleModel.Node no = child(name, noId, byId, claimed, depth);
        TreeEnsembleModel.Node missing = yes;
        if (node.has("missing")) {
            int missingId = node.get("missing").asInt();
            if (missingId == noId) {
                missing = no;
            } else if (missingId != yesId) {
                missing = child(name, missingId, byId, claimed, depth);
            }
        }
        return new TreeEnsembleModel.Split(feature, node.get("split_condition").asDouble(), yes, no, missing);
    }

    // Each node has exactly one parent; a shared or cyclic reference is a corrupt dump.
    private TreeEnsembleModel.Node child(String name, int id, Map<Integer, JsonNode> byId,
                                         Set<Integer> claimed, int depth) {
        JsonNode child = byId.get(id);
        if (child == null) {
            throw new ModelLoadException(name, "dangling reference to node " + id);
        }
        if (!claimed.add(id)) {
            throw new ModelLoadException(name, "node " + id + " is referenced more than once");
        }
        return build(name, child, byId, claimed, depth + 1);
    }

    private LinearDemandModel readLinear(String name, JsonNode root) {
        JsonNode coefficients = root.get("coefficients");
        if (coefficients == null || !coefficients.isObject()) {
            throw new ModelLoadException(name, "'coefficients' must be an object");
        }
        double[] weights = new double[FeatureVector.FEATURE_NAMES.size()];
        Iterator<Map.Entry<String, JsonNode>> fields = coefficients.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            int idx = FeatureVector.indexOf(entry.getKey());
            if (idx < 0) {
                throw new ModelLoadException(name, "unknown coefficient '" + entry.getKey() + "'");
            }
            weights[idx] = entry.getValue().asDouble();
        }
        return new LinearDemandModel(root.path("intercept").asDouble(0.0), weights);
    }
}
