package com.company.jobmonitor.source;

import com.company.jobmonitor.domain.ExecutionInfo;
import com.company.jobmonitor.domain.JobSpec;
import com.company.jobmonitor.exception.SourceUnavailableException;

/**
 * Remote system that knows when each job last ran and how it ended.
 */
public interface ExecutionSource {

    /**
     * Latest execution of {@code job}.
     *
     * @throws SourceUnavailableException if the source cannot be reached or its answer is unusable
     */
    ExecutionInfo fetchLatestExecution(JobSpec job);

    /**
     * Cheap reachability probe used at startup.
     *
     * @throws SourceUnavailableException if the source cannot be reached
     */
    void verifyConnection();
}
