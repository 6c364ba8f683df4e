package io.tryjob4j.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Transport-neutral encoding of a {@link Job}, shared by the mailbox files and the network frames.
 *
 * <p>Layout (version 1), fields always written in this order:
 * <pre>
 * {"version":1,"jobid":"...","branch":null,"revision":"...",
 *  "patch":{"level":0,"body":"..."},"repository":null,"project":null,
 *  "who":null,"comment":null,"builderNames":["a"],"properties":{}}
 * </pre>
 * {@code patch} is {@code null} when the job uses the revision as-is.
 */
public class JobCodec {

    public static final int VERSION = 1;

    private final ObjectMapper objectMapper;

    public JobCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    public byte[] encode(Job job) {
        Objects.requireNonNull(job, "job must not be null");

        ObjectNode root = objectMapper.createObjectNode();
        root.put("version", VERSION);
        root.put("jobid", job.jobId());

        SourceStamp ss = job.sourceStamp();
        root.put("branch", ss.branch());
        root.put("revision", ss.revision());
        if (ss.patch() != null) {
            ObjectNode patch = root.putObject("patch");
            patch.put("level", ss.patch().level());
            patch.put("body", ss.patch().body());
        } else {
            root.putNull("patch");
        }
        root.put("repository", ss.repository());
        root.put("project", ss.project());
        root.put("who", job.who());
        root.put("comment", job.comment());

        ArrayNode builders = root.putArray("builderNames");
        job.builderNames().forEach(builders::add);

        ObjectNode props = root.putObject("properties");
        job.properties().forEach(props::put);

        try {
            return objectMapper.writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            throw new TryJobException("failed to encode job " + job.jobId(), e);
        }
    }

    public String encodeToString(Job job) {
        return new String(encode(job), StandardCharsets.UTF_8);
    }

    /**
     * @throws MalformedJobException when the bytes do not describe a valid version-1 job
     */
    public Job decode(byte[] encoded) {
        Objects.requireNonNull(encoded, "encoded must not be null");

        JsonNode root;
        try {
            root = objectMapper.readTree(encoded);
        } catch (IOException e) {
            throw new MalformedJobException("job is not valid JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedJobException("job must be a JSON object");
        }

        JsonNode version = root.get("version");
        if (version == null || !version.isInt() || version.intValue() != VERSION) {
            throw new MalformedJobException("unsupported job version: " + version);
        }

        String jobId = requiredText(root, "jobid");
        String revision = requiredText(root, "revision");
        String branch = optionalText(root, "branch");
        String repository = optionalText(root, "repository");
        String project = optionalText(root, "project");
        String who = optionalText(root, "who");
        String comment = optionalText(root, "comment");

        Patch patch = decodePatch(root.get("patch"));
        List<String> builderNames = decodeBuilderNames(root.get("builderNames"));
        Map<String, String> properties = decodeProperties(root.get("properties"));

        try {
            return new Job(
                    jobId,
                    new SourceStamp(branch, revision, patch, repository, project),
                    builderNames,
                    who,
                    comment,
                    properties
            );
        } catch (IllegalArgumentException e) {
            throw new MalformedJobException(e.getMessage(), e);
        }
    }

    public Job decode(String encoded) {
        Objects.requireNonNull(encoded, "encoded must not be null");
        return decode(encoded.getBytes(StandardCharsets.UTF_8));
    }

    private static Patch decodePatch(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            throw new MalformedJobException("patch must be an object");
        }
        JsonNode level = node.get("level");
        if (level == null || !level.isIntegralNumber() || !level.canConvertToInt()) {
            throw new MalformedJobException("patch level must be an integer: " + level);
        }
        if (level.intValue() < 0) {
            throw new MalformedJobException("patch level must not be negative: " + level.intValue());
        }
        JsonNode body = node.get("body");
        if (body == null || !body.isTextual()) {
            throw new MalformedJobException("patch body must be a string");
        }
        return new Patch(level.intValue(), body.textValue());
    }

    private static List<String> decodeBuilderNames(JsonNode node) {
        if (node == null || !node.isArray()) {
            throw new MalformedJobException("builderNames must be an array");
        }
        List<String> names = new ArrayList<>(node.size());
        for (JsonNode n : node) {
            if (!n.isTextual() || n.textValue().isBlank()) {
                throw new MalformedJobException("builderNames must contain non-blank strings only");
            }
            names.add(n.textValue());
        }
        if (new LinkedHashSet<>(names).size() != names.size()) {
            throw new MalformedJobException("builderNames contains duplicates: " + names);
        }
        return names;
    }

    private static Map<String, String> decodeProperties(JsonNode node) {
        if (node == null || node.isNull()) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw new MalformedJobException("properties must be an object");
        }
        Map<String, String> properties = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if (!e.getValue().isTextual()) {
                throw new MalformedJobException("property '" + e.getKey() + "' must be a string");
            }
            properties.put(e.getKey(), e.getValue().textValue());
        }
        return properties;
    }

    private static String requiredText(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || !node.isTextual()) {
            throw new MalformedJobException("missing required field '" + field + "'");
        }
        return node.textValue();
    }

    private static String optionalText(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw new MalformedJobException("field '" + field + "' must be a string");
        }
        return node.textValue();
    }
}
