package infra.table;

import domain.table.Table;
import domain.table.TableFormat;
import domain.table.TableReadException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Delimited-text {@link TableFormat} (UTF-8, BOM tolerated).
 *
 * <p>The first record is the header. Header handling is done here instead of commons-csv's
 * header support so that an index column with an empty header name is accepted.
 * Rows shorter than the header are padded with empty fields; longer rows are an error.
 * Records are written with {@code \n} separators and minimal quoting.</p>
 */
public final class CsvTableFormat implements TableFormat {

    private final CSVFormat csv;

    public CsvTableFormat() {
        this(',');
    }

    public CsvTableFormat(char delimiter) {
        this.csv = CSVFormat.DEFAULT
                .builder()
                .setDelimiter(delimiter)
                .setRecordSeparator("\n")
                .build();
    }

    public char getDelimiter() {
        return csv.getDelimiterString().charAt(0);
    }

    @Override
    public Table read(Path path, String tableName, boolean indexed) {
        List<List<String>> records = readRecords(path, tableName);
        if (records.isEmpty()) throw new TableReadException(tableName, path, "table has no header");

        List<String> header = records.get(0);
        int skip = indexed ? 1 : 0;
        if (header.size() < skip) throw new TableReadException(tableName, path, "indexed table has no index column");

        List<String> columns = new ArrayList<>(header.subList(skip, header.size()));
        Set<String> seen = new HashSet<>();
        for (String c : columns) {
            if (!seen.add(c)) throw new TableReadException(tableName, path, "duplicate column '" + c + "'");
        }

        List<String> index = new ArrayList<>(records.size() - 1);
        List<List<String>> rows = new ArrayList<>(records.size() - 1);
        for (int r = 1; r < records.size(); r++) {
            List<String> rec = records.get(r);
            if (rec.size() > header.size()) {
                throw new TableReadException(tableName, path, "record " + r + " has " + rec.size()
                        + " fields, header has " + header.size());
            }
            List<String> cells = new ArrayList<>(columns.size());
            for (int c = skip; c < header.size(); c++) {
                cells.add(c < rec.size() ? rec.get(c) : "");
            }
            index.add(indexed ? (rec.isEmpty() ? "" : rec.get(0)) : String.valueOf(r - 1));
            rows.add(cells);
        }
        return new Table(tableName, columns, index, rows);
    }

    @Override
    public List<List<String>> readRecords(Path path) {
        return readRecords(path, path == null ? "" : String.valueOf(path.getFileName()));
    }

    private List<List<String>> readRecords(Path path, String tableName) {
        if (path == null) throw new IllegalArgumentException("path is null");
        if (!Files.isRegularFile(path)) throw new TableReadException(tableName, path, "table file not found");

        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser parser = csv.parse(reader)) {

            List<List<String>> out = new ArrayList<>();
            boolean first = true;
            for (CSVRecord rec : parser) {
                List<String> fields = new ArrayList<>(rec.size());
                for (int i = 0; i < rec.size(); i++) {
                    String v = rec.get(i);
                    // handle UTF-8 BOM in the first header cell
                    if (first && i == 0) v = stripBom(v);
                    fields.add(v);
                }
                first = false;
                out.add(fields);
            }
            return out;
        } catch (IOException | UncheckedIOException | IllegalStateException e) {
            throw new TableReadException(tableName, path, "failed to read table", e);
        }
    }

    @Override
    public void write(Table table, Writer out, boolean includeIndex) throws IOException {
        if (table == null) throw new IllegalArgumentException("table is null");
        if (out == null) throw new IllegalArgumentException("out is null");

        CSVPrinter printer = new CSVPrinter(out, csv);

        List<String> header = new ArrayList<>(table.getColumnNames().size() + 1);
        if (includeIndex) header.add("");
        header.addAll(table.getColumnNames());
        printer.printRecord(header);

        List<String> index = table.getIndex();
        for (int r = 0; r < table.rowCount(); r++) {
            List<String> rec = new ArrayList<>(header.size());
            if (includeIndex) rec.add(index.get(r));
            for (String v : table.row(r)) rec.add(v == null ? "" : v);
            printer.printRecord(rec);
        }
        // the caller owns the writer
        printer.flush();
    }

    private static String stripBom(String s) {
        if (s == null || s.isEmpty()) return s;
        if (s.charAt(0) == '\uFEFF') return s.substring(1);
        return s;
    }
}
