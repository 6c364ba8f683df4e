package io.tryjob4j.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.result.UpdateResult;
import io.tryjob4j.BuildsetStore;
import io.tryjob4j.core.BuildCompletion;
import io.tryjob4j.core.Buildset;
import io.tryjob4j.core.BuildsetRequest;
import io.tryjob4j.core.Patch;
import io.tryjob4j.core.SourceStamp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * MongoDB persistence layer for buildsets.
 *
 * <p>Each buildset is one document in {@code buildsets}; build results are appended to its
 * {@code results} array by the build engine through {@link #recordCompletion(String, BuildCompletion)}.
 */
public class MongoBuildsetStore implements BuildsetStore {
    private static final Logger log = LoggerFactory.getLogger(MongoBuildsetStore.class);

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;

    public MongoBuildsetStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public String createBuildset(BuildsetRequest request) {
        Objects.requireNonNull(request, "request must not be null");

        BuildsetDocument saved = mongoTemplate.insert(toDocument(request, Instant.now()));
        log.debug("Buildset created id={} scheduler={} builders={}",
                saved.getId(), saved.getSchedulerName(), saved.getBuilderNames());
        return saved.getId();
    }

    @Override
    public Optional<Buildset> getBuildset(String buildsetId) {
        Objects.requireNonNull(buildsetId, "buildsetId must not be null");
        return Optional.ofNullable(mongoTemplate.findById(buildsetId, BuildsetDocument.class))
                .map(this::toBuildset);
    }

    @Override
    public List<Buildset> getBuildsets() {
        Query q = new Query().with(Sort.by(Sort.Order.asc("submittedAt"), Sort.Order.asc("_id")));
        q.fields().exclude("results");

        List<BuildsetDocument> docs = mongoTemplate.find(q, BuildsetDocument.class);
        List<Buildset> out = new ArrayList<>(docs.size());
        for (BuildsetDocument d : docs) {
            out.add(toBuildset(d));
        }
        return out;
    }

    /**
     * Appends a build status to the buildset.
     *
     * @throws IllegalArgumentException when the buildset is unknown
     */
    public void recordCompletion(String buildsetId, BuildCompletion completion) {
        Objects.requireNonNull(buildsetId, "buildsetId must not be null");
        Objects.requireNonNull(completion, "completion must not be null");

        BuildsetDocument.ResultEntry entry = new BuildsetDocument.ResultEntry();
        entry.setBuilderName(completion.builderName());
        entry.setBuildNumber(completion.buildNumber());
        entry.setResult(completion.result());
        entry.setDetail(completion.detail());
        entry.setReportedAt(Instant.now());

        UpdateResult r = mongoTemplate.updateFirst(
                new Query(Criteria.where("_id").is(buildsetId)),
                new Update().push("results", entry),
                BuildsetDocument.class
        );
        if (r.getMatchedCount() == 0) {
            throw new IllegalArgumentException("unknown buildset: " + buildsetId);
        }
    }

    /**
     * Results reported so far, in report order. Empty for unknown buildsets.
     */
    public List<BuildCompletion> getCompletions(String buildsetId) {
        Objects.requireNonNull(buildsetId, "buildsetId must not be null");

        Query q = new Query(Criteria.where("_id").is(buildsetId));
        q.fields().include("results");
        BuildsetDocument doc = mongoTemplate.findOne(q, BuildsetDocument.class);
        if (doc == null || doc.getResults() == null) {
            return List.of();
        }

        List<BuildCompletion> out = new ArrayList<>(doc.getResults().size());
        for (BuildsetDocument.ResultEntry e : doc.getResults()) {
            out.add(new BuildCompletion(e.getBuilderName(), e.getBuildNumber(), e.getResult(), e.getDetail()));
        }
        return out;
    }

    public boolean exists(String buildsetId) {
        return mongoTemplate.exists(new Query(Criteria.where("_id").is(buildsetId)), BuildsetDocument.class);
    }

    private BuildsetDocument toDocument(BuildsetRequest request, Instant submittedAt) {
        BuildsetDocument doc = new BuildsetDocument();
        doc.setSchedulerName(request.schedulerName());

        SourceStamp ss = request.sourceStamp();
        doc.setBranch(ss.branch());
        doc.setRevision(ss.revision());
        if (ss.patch() != null) {
            doc.setPatchLevel(ss.patch().level());
            doc.setPatchBody(ss.patch().body());
        }
        doc.setRepository(ss.repository());
        doc.setProject(ss.project());

        doc.setBuilderNames(request.builderNames());
        doc.setReason(request.reason());
        doc.setComment(request.comment());
        doc.setWho(request.who());
        doc.setExternalJobId(request.externalJobId());
        if (!request.properties().isEmpty()) {
            doc.setProperties(objectMapper.convertValue(request.properties(), new TypeReference<>() {
            }));
        }
        doc.setSubmittedAt(submittedAt);
        return doc;
    }

    private Buildset toBuildset(BuildsetDocument doc) {
        Patch patch = doc.getPatchLevel() == null ? null : new Patch(doc.getPatchLevel(), doc.getPatchBody());
        SourceStamp ss = new SourceStamp(doc.getBranch(), doc.getRevision(), patch, doc.getRepository(), doc.getProject());

        Map<String, String> properties = doc.getProperties() == null
                ? Map.of()
                : objectMapper.convertValue(doc.getProperties(), new TypeReference<TreeMap<String, String>>() {
                });

        return new Buildset(
                doc.getId(),
                doc.getSchedulerName(),
                ss,
                doc.getBuilderNames() == null ? List.of() : List.copyOf(doc.getBuilderNames()),
                doc.getReason(),
                doc.getComment(),
                doc.getWho(),
                doc.getExternalJobId(),
                properties,
                doc.getSubmittedAt()
        );
    }
}
