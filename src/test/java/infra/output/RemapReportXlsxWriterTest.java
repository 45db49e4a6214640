package infra.output;

import domain.model.IdMapSummary;
import domain.model.RemapWarning;
import domain.model.TaskRunResult;
import domain.model.TaskStatus;
import domain.model.WarningCode;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RemapReportXlsxWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void should_write_tasks_idmaps_and_warnings_sheets() throws Exception {
        Path xlsx = tempDir.resolve("reports/run-report.xlsx");

        new RemapReportXlsxWriter().write(
                xlsx,
                List.of(
                        new TaskRunResult(TaskStatus.DONE, "IdMapBuilder[students.grade]", "IdMapBuilder", "/out/a", 12L, ""),
                        new TaskRunResult(TaskStatus.FAILED, "ValueSubstituter[students.grade]", "ValueSubstituter", "/out/b", 3L, "boom")
                ),
                List.of(new IdMapSummary("grade", 4, true, "/out/a")),
                List.of(RemapWarning.of(WarningCode.CLEANUP_TARGET_MISSING, "x", "/out/c"))
        );

        assertTrue(Files.exists(xlsx), "report not written: " + xlsx);
        try (InputStream in = Files.newInputStream(xlsx); Workbook wb = new XSSFWorkbook(in)) {
            Sheet tasks = wb.getSheet("tasks");
            assertNotNull(tasks);
            assertEquals("status", tasks.getRow(0).getCell(0).getStringCellValue());
            assertEquals("FAILED", tasks.getRow(2).getCell(0).getStringCellValue());
            assertEquals("boom", tasks.getRow(2).getCell(5).getStringCellValue());
            assertEquals(12.0, tasks.getRow(1).getCell(4).getNumericCellValue());

            Sheet idmaps = wb.getSheet("idmaps");
            assertEquals("grade", idmaps.getRow(1).getCell(0).getStringCellValue());
            assertEquals(4.0, idmaps.getRow(1).getCell(1).getNumericCellValue());
            assertTrue(idmaps.getRow(1).getCell(2).getBooleanCellValue());

            Sheet warnings = wb.getSheet("warnings");
            assertEquals("CLEANUP_TARGET_MISSING", warnings.getRow(1).getCell(0).getStringCellValue());
            assertEquals(1, warnings.getLastRowNum());
        }
    }

    @Test
    void null_writer_should_not_create_anything() {
        Path xlsx = tempDir.resolve("none.xlsx");
        new NullReportWriter().write(xlsx, List.of(), List.of(), List.of());
        assertFalse(Files.exists(xlsx));
    }
}
