package io.tryjob4j.config;

import io.tryjob4j.internal.mongo.BuildsetDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for the buildset store.
 *
 * <p>Indexes are <b>not</b> created at startup unless {@code tryjob.ensure-indexes-on-startup=true};
 * production deployments usually manage them through migrations.
 *
 * <h3>Indexes (collection: {@code buildsets})</h3>
 * <ul>
 *   <li><b>idx_scheduler_submitted</b>: { schedulerName: 1, submittedAt: -1 }
 *       <br/>Listing the buildsets of one scheduler, newest first.</li>
 *   <li><b>idx_external_job_id</b>: { externalJobId: 1 }
 *       <br/>Finding the buildset created for a client job id.</li>
 * </ul>
 *
 * <pre>
 * db.buildsets.createIndex({ schedulerName: 1, submittedAt: -1 }, { name: "idx_scheduler_submitted" });
 * db.buildsets.createIndex({ externalJobId: 1 }, { name: "idx_external_job_id" });
 * </pre>
 */
public class BuildsetMongoIndexConfig {

    public static final String IDX_SCHEDULER_SUBMITTED = "idx_scheduler_submitted";
    public static final String IDX_EXTERNAL_JOB_ID = "idx_external_job_id";

    private final MongoTemplate mongoTemplate;

    public BuildsetMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(BuildsetDocument.class).ensureIndex(schedulerSubmittedIndex());
        mongoTemplate.indexOps(BuildsetDocument.class).ensureIndex(externalJobIdIndex());
    }

    public static Index schedulerSubmittedIndex() {
        return new Index()
                .on("schedulerName", Sort.Direction.ASC)
                .on("submittedAt", Sort.Direction.DESC)
                .named(IDX_SCHEDULER_SUBMITTED);
    }

    public static Index externalJobIdIndex() {
        return new Index()
                .on("externalJobId", Sort.Direction.ASC)
                .named(IDX_EXTERNAL_JOB_ID);
    }
}
