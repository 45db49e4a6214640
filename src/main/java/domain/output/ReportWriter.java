package domain.output;

import domain.model.IdMapSummary;
import domain.model.RemapWarning;
import domain.model.TaskRunResult;

import java.nio.file.Path;
import java.util.List;

/** Stores the run report. */
public interface ReportWriter {

    void write(
            Path reportFile,
            List<TaskRunResult> results,
            List<IdMapSummary> idMaps,
            List<RemapWarning> warnings
    );
}
