package app;

import domain.model.RemapWarningSink;
import domain.output.ReportWriter;
import domain.pipeline.TaskExecutor;
import domain.pipeline.TaskListener;
import domain.remap.RemapOrchestrator;
import domain.remap.RemapSettings;
import domain.remap.SourceTable;
import domain.table.MissingValues;
import domain.table.TableFormat;
import infra.output.NullReportWriter;
import infra.output.RemapReportXlsxWriter;
import infra.table.CsvTableFormat;

import java.nio.file.Path;
import java.util.List;

/**
 * Object-assembly factory for {@link RemapCliApp}.
 * <p>
 * Keeps the CLI app focused on orchestration/logging; object creation lives here.
 */
final class RemapComponentsFactory {

    TableFormat createTableFormat(char delimiter) {
        return new CsvTableFormat(delimiter);
    }

    MissingValues createMissingValues(List<String> naValues) {
        if (naValues == null || naValues.isEmpty()) return MissingValues.defaults();
        return MissingValues.of(naValues);
    }

    RemapSettings createSettings(Path saveDir, TableFormat format, MissingValues missingValues, RemapWarningSink sink) {
        return RemapSettings.builder(saveDir, format)
                .missingValues(missingValues)
                .warningSink(sink)
                .build();
    }

    SourceTable createSourceTable(Path tablePath, String name, TableFormat format) {
        if (name == null) return SourceTable.of(tablePath, format);
        return new SourceTable(tablePath, name, format);
    }

    RemapOrchestrator createOrchestrator(SourceTable table, List<String> columns, String outName, RemapSettings settings) {
        return new RemapOrchestrator(table, columns, outName, settings);
    }

    TaskExecutor createExecutor(int workers, RemapWarningSink sink, TaskListener listener) {
        return new TaskExecutor(workers, sink, listener);
    }

    ReportWriter createReportWriter(boolean enable) {
        if (!enable) return new NullReportWriter();
        return new RemapReportXlsxWriter();
    }
}
