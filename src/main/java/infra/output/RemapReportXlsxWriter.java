package infra.output;

import domain.model.IdMapSummary;
import domain.model.RemapWarning;
import domain.model.TaskRunResult;
import domain.output.ReportWriter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * XLSX run report writer.
 *
 * <p>Sheets:
 * <ul>
 *   <li>tasks: one row per task (status, id, type, output, elapsed, message)</li>
 *   <li>idmaps: cardinality of every built id map</li>
 *   <li>warnings: non-fatal warnings (standard codes)</li>
 * </ul>
 */
public final class RemapReportXlsxWriter implements ReportWriter {

    private static void writeTasksSheet(Workbook wb, List<TaskRunResult> results) {
        Sheet sh = wb.createSheet("tasks");
        int r = 0;
        Row header = sh.createRow(r++);
        header.createCell(0)
                .setCellValue("status");
        header.createCell(1)
                .setCellValue("task");
        header.createCell(2)
                .setCellValue("type");
        header.createCell(3)
                .setCellValue("output");
        header.createCell(4)
                .setCellValue("elapsedMs");
        header.createCell(5)
                .setCellValue("message");

        for (TaskRunResult it : results) {
            Row row = sh.createRow(r++);
            row.createCell(0)
                    .setCellValue(it.getStatus()
                            .name());
            row.createCell(1)
                    .setCellValue(nullToEmpty(it.getTaskId()));
            row.createCell(2)
                    .setCellValue(nullToEmpty(it.getTaskType()));
            row.createCell(3)
                    .setCellValue(nullToEmpty(it.getOutput()));
            row.createCell(4)
                    .setCellValue(it.getElapsedMs());
            row.createCell(5)
                    .setCellValue(nullToEmpty(it.getMessage()));
        }
    }

    private static void writeIdMapsSheet(Workbook wb, List<IdMapSummary> idMaps) {
        Sheet sh = wb.createSheet("idmaps");
        int r = 0;
        Row header = sh.createRow(r++);
        header.createCell(0)
                .setCellValue("column");
        header.createCell(1)
                .setCellValue("cardinality");
        header.createCell(2)
                .setCellValue("hasMissing");
        header.createCell(3)
                .setCellValue("path");

        for (IdMapSummary it : idMaps) {
            Row row = sh.createRow(r++);
            row.createCell(0)
                    .setCellValue(nullToEmpty(it.getColumn()));
            row.createCell(1)
                    .setCellValue(it.getCardinality());
            row.createCell(2)
                    .setCellValue(it.isHasMissing());
            row.createCell(3)
                    .setCellValue(nullToEmpty(it.getPath()));
        }
    }

    private static void writeWarningsSheet(Workbook wb, List<RemapWarning> warnings) {
        Sheet sh = wb.createSheet("warnings");
        int r = 0;
        Row header = sh.createRow(r++);
        header.createCell(0)
                .setCellValue("code");
        header.createCell(1)
                .setCellValue("task");
        header.createCell(2)
                .setCellValue("message");
        header.createCell(3)
                .setCellValue("detail");

        for (RemapWarning w : warnings) {
            Row row = sh.createRow(r++);
            row.createCell(0)
                    .setCellValue(w.getCode()
                            .name());
            row.createCell(1)
                    .setCellValue(nullToEmpty(w.getTaskId()));
            row.createCell(2)
                    .setCellValue(nullToEmpty(w.getMessage()));
            row.createCell(3)
                    .setCellValue(nullToEmpty(w.getDetail()));
        }
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    @Override
    public void write(
            Path reportFile,
            List<TaskRunResult> results,
            List<IdMapSummary> idMaps,
            List<RemapWarning> warnings
    ) {
        if (reportFile == null) throw new IllegalArgumentException("reportFile is null");
        if (results == null) throw new IllegalArgumentException("results is null");
        if (idMaps == null) throw new IllegalArgumentException("idMaps is null");
        if (warnings == null) throw new IllegalArgumentException("warnings is null");

        try {
            Path parent = reportFile.toAbsolutePath()
                    .normalize()
                    .getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to create report parent dir: " + reportFile, e);
        }

        try (Workbook wb = new XSSFWorkbook()) {
            writeTasksSheet(wb, results);
            writeIdMapsSheet(wb, idMaps);
            writeWarningsSheet(wb, warnings);

            try (OutputStream os = Files.newOutputStream(reportFile)) {
                wb.write(os);
            }
        } catch (Exception e) {
            throw new IllegalStateException("Failed to write xlsx: " + reportFile, e);
        }
    }
}
