package io.tryjob4j.internal.mongo;

import io.tryjob4j.core.BuildResult;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Mongo document model for buildsets and the build results reported against them.
 */
@Document(collection = "buildsets")
public class BuildsetDocument {

    @Id
    private String id;

    private String schedulerName;

    private String branch;
    private String revision;
    private Integer patchLevel;
    private String patchBody;
    private String repository;
    private String project;

    private List<String> builderNames;
    private String reason;
    private String comment;
    private String who;
    private String externalJobId;
    private Map<String, Object> properties;
    private Instant submittedAt;

    // appended in report order
    private List<ResultEntry> results = new ArrayList<>();

    public BuildsetDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getSchedulerName() {
        return schedulerName;
    }

    public void setSchedulerName(String schedulerName) {
        this.schedulerName = schedulerName;
    }

    public String getBranch() {
        return branch;
    }

    public void setBranch(String branch) {
        this.branch = branch;
    }

    public String getRevision() {
        return revision;
    }

    public void setRevision(String revision) {
        this.revision = revision;
    }

    public Integer getPatchLevel() {
        return patchLevel;
    }

    public void setPatchLevel(Integer patchLevel) {
        this.patchLevel = patchLevel;
    }

    public String getPatchBody() {
        return patchBody;
    }

    public void setPatchBody(String patchBody) {
        this.patchBody = patchBody;
    }

    public String getRepository() {
        return repository;
    }

    public void setRepository(String repository) {
        this.repository = repository;
    }

    public String getProject() {
        return project;
    }

    public void setProject(String project) {
        this.project = project;
    }

    public List<String> getBuilderNames() {
        return builderNames;
    }

    public void setBuilderNames(List<String> builderNames) {
        this.builderNames = builderNames;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    public String getComment() {
        return comment;
    }

    public void setComment(String comment) {
        this.comment = comment;
    }

    public String getWho() {
        return who;
    }

    public void setWho(String who) {
        this.who = who;
    }

    public String getExternalJobId() {
        return externalJobId;
    }

    public void setExternalJobId(String externalJobId) {
        this.externalJobId = externalJobId;
    }

    public Map<String, Object> getProperties() {
        return properties;
    }

    public void setProperties(Map<String, Object> properties) {
        this.properties = properties;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public void setSubmittedAt(Instant submittedAt) {
        this.submittedAt = submittedAt;
    }

    public List<ResultEntry> getResults() {
        return results;
    }

    public void setResults(List<ResultEntry> results) {
        this.results = results;
    }

    /**
     * One status report of one build.
     */
    public static class ResultEntry {
        private String builderName;
        private int buildNumber;
        private BuildResult result;
        private String detail;
        private Instant reportedAt;

        public ResultEntry() {
        }

        public String getBuilderName() {
            return builderName;
        }

        public void setBuilderName(String builderName) {
            this.builderName = builderName;
        }

        public int getBuildNumber() {
            return buildNumber;
        }

        public void setBuildNumber(int buildNumber) {
            this.buildNumber = buildNumber;
        }

        public BuildResult getResult() {
            return result;
        }

        public void setResult(BuildResult result) {
            this.result = result;
        }

        public String getDetail() {
            return detail;
        }

        public void setDetail(String detail) {
            this.detail = detail;
        }

        public Instant getReportedAt() {
            return reportedAt;
        }

        public void setReportedAt(Instant reportedAt) {
            this.reportedAt = reportedAt;
        }
    }
}
