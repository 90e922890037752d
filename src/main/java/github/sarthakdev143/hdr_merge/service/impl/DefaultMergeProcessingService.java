package github.sarthakdev143.hdr_merge.service.impl;

import github.sarthakdev143.hdr_merge.factory.ExposureLoaderFactory;
import github.sarthakdev143.hdr_merge.model.ExposureParameters;
import github.sarthakdev143.hdr_merge.model.LoadOptions;
import github.sarthakdev143.hdr_merge.model.LoadResult;
import github.sarthakdev143.hdr_merge.model.MergeJobState;
import github.sarthakdev143.hdr_merge.model.MergeJobStatus;
import github.sarthakdev143.hdr_merge.model.MergePlan;
import github.sarthakdev143.hdr_merge.model.SaveOptions;
import github.sarthakdev143.hdr_merge.model.SaveReport;
import github.sarthakdev143.hdr_merge.service.ExposureStack;
import github.sarthakdev143.hdr_merge.service.MergeProcessingService;
import github.sarthakdev143.hdr_merge.service.ProgressListener;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class DefaultMergeProcessingService implements MergeProcessingService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultMergeProcessingService.class);

    private final ExposureLoaderFactory loaderFactory;
    private final ExposureSaver exposureSaver;
    private final BracketSetPlanner bracketSetPlanner;
    private final TaskExecutor taskExecutor;
    private final Map<String, MergeJobStatus> jobs = new ConcurrentHashMap<>();
    private final Counter batchJobsCounter;
    private final Counter decodeFailureCounter;
    private final Counter formatFailureCounter;
    private final Counter skippedSetsCounter;
    private final Counter metadataFailureCounter;

    public DefaultMergeProcessingService(
            ExposureLoaderFactory loaderFactory,
            ExposureSaver exposureSaver,
            BracketSetPlanner bracketSetPlanner,
            TaskExecutor taskExecutor,
            MeterRegistry meterRegistry) {
        this.loaderFactory = loaderFactory;
        this.exposureSaver = exposureSaver;
        this.bracketSetPlanner = bracketSetPlanner;
        this.taskExecutor = taskExecutor;
        this.batchJobsCounter = meterRegistry.counter("hdr_merge.jobs.batch");
        this.decodeFailureCounter = meterRegistry.counter("hdr_merge.load.failures", "reason", "decode");
        this.formatFailureCounter = meterRegistry.counter("hdr_merge.load.failures", "reason", "format");
        this.skippedSetsCounter = meterRegistry.counter("hdr_merge.sets.skipped");
        this.metadataFailureCounter = meterRegistry.counter("hdr_merge.metadata.failures");
    }

    @Override
    public String submitJob(MergePlan plan) {
        String jobId = UUID.randomUUID().toString();
        if (plan.loadOptions().batch()) {
            batchJobsCounter.increment();
        }

        Instant now = Instant.now();
        jobs.put(jobId, new MergeJobStatus(
                jobId,
                MergeJobState.QUEUED,
                "Job queued.",
                0,
                now,
                now,
                List.of(),
                List.of(),
                null));

        logger.info(
                "Accepted merge job {} files={} batch={} bps={}",
                jobId,
                plan.loadOptions().fileNames().size(),
                plan.loadOptions().batch(),
                plan.saveOptions().bps());

        taskExecutor.execute(() -> processJob(jobId, plan));
        return jobId;
    }

    @Override
    public Optional<MergeJobStatus> getJobStatus(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    private void processJob(String jobId, MergePlan plan) {
        updateJobState(jobId, MergeJobState.PROCESSING, "Planning bracketed sets.", 0);
        List<String> outputFiles = new ArrayList<>();
        List<String> skippedFiles = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        try {
            LoadOptions loadOptions = plan.loadOptions();
            List<LoadOptions> sets = loadOptions.batch()
                    ? bracketSetPlanner.plan(loadOptions)
                    : List.of(loadOptions);

            for (int setIndex = 0; setIndex < sets.size(); setIndex++) {
                LoadOptions set = sets.get(setIndex);
                if (!set.withSingles() && set.fileNames().size() == 1) {
                    logger.info("Skipping single image {}", set.fileNames().get(0));
                    skippedSetsCounter.increment();
                    skippedFiles.add(set.fileNames().get(0));
                    continue;
                }

                String failure = mergeSet(jobId, set, plan.saveOptions(), setIndex, sets.size(), outputFiles, warnings);
                if (failure != null) {
                    warnings.add(failure);
                }
            }

            finishJob(jobId, outputFiles, skippedFiles, warnings);
        } catch (Exception e) {
            logger.error("Merge job {} failed", jobId, e);
            markJobFailed(jobId, "Merge failed. Check server logs.", outputFiles, skippedFiles, warnings);
        }
    }

    /**
     * Loads and saves one set.
     *
     * @return a failure message, or {@code null} when the set was written
     */
    private String mergeSet(
            String jobId,
            LoadOptions set,
            SaveOptions saveOptions,
            int setIndex,
            int setCount,
            List<String> outputFiles,
            List<String> warnings) {
        if (set.fileNames().size() > ExposureStack.MAX_EXPOSURES) {
            return "Cannot merge " + set.fileNames().size() + " files starting at " + set.fileNames().get(0)
                    + ", at most " + ExposureStack.MAX_EXPOSURES + " exposures fit in one set.";
        }
        ExposureLoader loader = loaderFactory.create();
        try {
            LoadResult result = loader.load(set, progressFor(jobId, setIndex * 2, setCount * 2));
            if (!result.isSuccess()) {
                return describeLoadFailure(set, result);
            }
            if (!result.hasImages()) {
                return "No usable frames in " + String.join(", ", set.fileNames()) + ".";
            }

            List<String> loadedFiles = loader.parameters().stream().map(ExposureParameters::getFileName).toList();
            String outputFileName = new OutputPathResolver(loadedFiles).outputFileName(saveOptions.fileName());
            SaveReport report;
            try {
                report = exposureSaver.save(
                        loader,
                        saveOptions.withFileName(outputFileName),
                        progressFor(jobId, setIndex * 2 + 1, setCount * 2));
            } catch (IOException e) {
                logger.error("Writing {} failed for job {}", outputFileName, jobId, e);
                return "Error writing " + outputFileName + ".";
            }
            if (!report.fusion().failures().isEmpty()) {
                metadataFailureCounter.increment();
            }
            outputFiles.add(report.outputFile());
            warnings.addAll(report.warnings());
            return null;
        } finally {
            loader.clear();
        }
    }

    private String describeLoadFailure(LoadOptions set, LoadResult result) {
        List<String> fileNames = set.fileNames();
        String fileName = fileNames.get(Math.min(result.index(), fileNames.size() - 1));
        if (result.kind() == LoadResult.Kind.FORMAT_MISMATCH) {
            formatFailureCounter.increment();
            return "Error loading " + fileName + ", it has a different format.";
        }
        decodeFailureCounter.increment();
        if (fileNames.size() == 1 && result.index() > 0) {
            return "Error loading " + fileName + ", frame " + result.index() + " cannot be decoded.";
        }
        return "Error loading " + fileName + ", file not found.";
    }

    private ProgressListener progressFor(String jobId, int phase, int phaseCount) {
        return (percent, message, argument) -> {
            int overall = (phase * 100 + Math.max(0, Math.min(100, percent))) / phaseCount;
            updateJobState(jobId, MergeJobState.PROCESSING, ProgressListener.format(message, argument), overall);
        };
    }

    private void finishJob(String jobId, List<String> outputFiles, List<String> skippedFiles, List<String> warnings) {
        String warningMessage = warnings.isEmpty() ? null : String.join(" ", warnings);
        if (outputFiles.isEmpty()) {
            String message = skippedFiles.isEmpty()
                    ? "No output was written."
                    : "No output was written; single images were skipped.";
            markJobFailed(jobId, message, outputFiles, skippedFiles, warnings);
            logger.warn("Merge job {} wrote no output: {}", jobId, warningMessage);
            return;
        }

        String message = warningMessage == null
                ? "Merged " + outputFiles.size() + " bracketed sets successfully."
                : "Merged " + outputFiles.size() + " bracketed sets with warnings.";
        jobs.computeIfPresent(jobId, (ignored, current) -> new MergeJobStatus(
                current.jobId(),
                MergeJobState.COMPLETED,
                message,
                100,
                current.createdAt(),
                Instant.now(),
                outputFiles,
                skippedFiles,
                warningMessage));
        logger.info("Completed merge job {} outputs={} skipped={} warning={}",
                jobId, outputFiles.size(), skippedFiles.size(), warningMessage != null);
    }

    private void updateJobState(String jobId, MergeJobState state, String message, int progressPercent) {
        jobs.computeIfPresent(jobId, (ignored, current) -> new MergeJobStatus(
                current.jobId(),
                state,
                message,
                Math.max(current.progressPercent(), progressPercent),
                current.createdAt(),
                Instant.now(),
                current.outputFiles(),
                current.skippedFiles(),
                current.warningMessage()));
    }

    private void markJobFailed(
            String jobId,
            String message,
            List<String> outputFiles,
            List<String> skippedFiles,
            List<String> warnings) {
        String warningMessage = warnings.isEmpty() ? null : String.join(" ", warnings);
        jobs.computeIfPresent(jobId, (ignored, current) -> new MergeJobStatus(
                current.jobId(),
                MergeJobState.FAILED,
                message,
                current.progressPercent(),
                current.createdAt(),
                Instant.now(),
                outputFiles,
                skippedFiles,
                warningMessage));
    }
}
