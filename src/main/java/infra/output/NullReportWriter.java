package infra.output;

import domain.model.IdMapSummary;
import domain.model.RemapWarning;
import domain.model.TaskRunResult;
import domain.output.ReportWriter;

import java.nio.file.Path;
import java.util.List;

/**
 * No-op implementation (feature toggle).
 */
public final class NullReportWriter implements ReportWriter {
    @Override
    public void write(
            Path reportFile,
            List<TaskRunResult> results,
            List<IdMapSummary> idMaps,
            List<RemapWarning> warnings
    ) {
        // intentionally no-op
    }
}
