package github.sarthakdev143.hdr_merge.service;

import github.sarthakdev143.hdr_merge.model.MergeJobStatus;
import github.sarthakdev143.hdr_merge.model.MergePlan;

import java.util.Optional;

public interface MergeProcessingService {

    String submitJob(MergePlan plan);

    Optional<MergeJobStatus> getJobStatus(String jobId);
}
