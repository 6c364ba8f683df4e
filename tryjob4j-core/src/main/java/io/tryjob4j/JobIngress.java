package io.tryjob4j;

import io.tryjob4j.core.Job;

/**
 * Capability shared by every scheduler: accept one job, create exactly one buildset.
 */
public interface JobIngress {

    /**
     * @param job       decoded job
     * @param submitter authenticated user, or null when the transport has none
     * @return id of the created buildset
     * @throws io.tryjob4j.core.UnknownBuilderException when the job names builders outside the whitelist
     */
    String ingest(Job job, String submitter);
}
