package domain.remap;

import domain.model.RemapWarningSink;
import infra.table.CsvTableFormat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

final class RemapFixtures {

    static final String STUDENTS_CSV = "name,grade,gpa,rank\n"
            + "ann,A,3.5,1\n"
            + "bob,B,,2\n"
            + "cid,A,3.5,3\n"
            + "dan,C,2.0,1\n"
            + "eve,NA,3.9,2\n";

    private RemapFixtures() {
    }

    static SourceTable students(Path dir) throws IOException {
        Path csv = dir.resolve("students.csv");
        Files.writeString(csv, STUDENTS_CSV);
        return SourceTable.of(csv, new CsvTableFormat());
    }

    static RemapSettings settings(Path saveDir) {
        return RemapSettings.builder(saveDir, new CsvTableFormat()).build();
    }

    static RemapSettings settings(Path saveDir, RemapWarningSink sink) {
        return RemapSettings.builder(saveDir, new CsvTableFormat())
                .warningSink(sink)
                .build();
    }
}
