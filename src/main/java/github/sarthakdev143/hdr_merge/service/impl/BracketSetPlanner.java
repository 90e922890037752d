package github.sarthakdev143.hdr_merge.service.impl;

import github.sarthakdev143.hdr_merge.model.CreationInterval;
import github.sarthakdev143.hdr_merge.model.LoadOptions;
import github.sarthakdev143.hdr_merge.service.RawDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Splits a batch of files into bracketed sets by capture time. Files taken less than the batch
 * gap apart belong to the same set; files without a capture time each form their own set, ahead
 * of the timed ones.
 */
@Component
public class BracketSetPlanner {

    private static final Logger logger = LoggerFactory.getLogger(BracketSetPlanner.class);

    private final RawDecoder rawDecoder;

    public BracketSetPlanner(RawDecoder rawDecoder) {
        this.rawDecoder = rawDecoder;
    }

    public List<LoadOptions> plan(LoadOptions options) {
        List<LoadOptions> sets = new ArrayList<>();
        List<TimedFile> timedFiles = new ArrayList<>();
        for (String fileName : options.fileNames()) {
            Optional<CreationInterval> interval = rawDecoder.probeCreationInterval(Path.of(fileName));
            if (interval.isPresent()) {
                timedFiles.add(new TimedFile(interval.get(), fileName));
            } else {
                logger.debug("{} has no capture time; merging it on its own", fileName);
                sets.add(options.withFileNames(List.of(fileName)));
            }
        }

        timedFiles.sort(Comparator.comparing(TimedFile::interval).thenComparing(TimedFile::fileName));
        List<String> current = new ArrayList<>();
        CreationInterval previous = null;
        for (TimedFile file : timedFiles) {
            if (previous != null && previous.secondsUntil(file.interval()) > options.batchGap()) {
                sets.add(options.withFileNames(current));
                current = new ArrayList<>();
            }
            current.add(file.fileName());
            previous = file.interval();
        }
        if (!current.isEmpty()) {
            sets.add(options.withFileNames(current));
        }

        logger.info("Planned {} bracketed sets from {} files", sets.size(), options.fileNames().size());
        return sets;
    }

    private record TimedFile(CreationInterval interval, String fileName) {
    }
}
