package app;

import cli.CliArgParser;
import cli.CliPathResolver;
import cli.CliProgressMonitor;
import cli.RemapCli;
import domain.model.IdMapSummary;
import domain.model.ListRemapWarningSink;
import domain.model.RemapWarning;
import domain.model.RemapWarningSink;
import domain.model.TaskRunResult;
import domain.model.TaskStatus;
import domain.output.AbbreviationException;
import domain.output.ArtifactNamePolicy;
import domain.output.ReportWriter;
import domain.pipeline.ExecutionReport;
import domain.pipeline.TaskExecutor;
import domain.remap.IdMap;
import domain.remap.RemapChain;
import domain.remap.RemapOrchestrator;
import domain.remap.RemapSettings;
import domain.remap.SourceTable;
import domain.table.MissingValues;
import domain.table.TableInputException;
import domain.table.TableFormat;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** CLI entry (invoked by {@link RemapCli}). */
public final class RemapCliApp {

    public static final int EXIT_OK = 0;
    public static final int EXIT_TASK_FAILED = 1;
    public static final int EXIT_INVALID_ARGS = 2;

    private RemapCliApp() {}

    /**
     * Runs the whole remap and returns the process exit code.
     */
    public static int run(String[] args) {

        long t0 = System.nanoTime();
        Map<String, String> argv = CliArgParser.parseArgs(args);

        // ------------------------------------------------------------
        // baseDir + inputs
        // ------------------------------------------------------------
        CliPathResolver.applyBaseDirPropertyIfPresent(argv);
        Path baseDir = CliPathResolver.resolveBaseDir();

        RemapComponentsFactory factory = new RemapComponentsFactory();
        List<RemapWarning> warnings = new ArrayList<>(32);
        RemapWarningSink warningSink = new ListRemapWarningSink(warnings);

        Path tablePath;
        List<String> columns;
        Path outDir;
        Path reportXlsx;
        int workers;
        boolean cleanup;
        boolean noResult;
        RemapOrchestrator orchestrator;
        RemapSettings settings;
        try {
            tablePath = CliPathResolver.resolvePath(baseDir, argv.get("table"));
            CliPathResolver.validateFileExists(tablePath, "input table (--table)");

            columns = CliArgParser.parseList(argv.get("columns"));
            char delimiter = CliArgParser.parseDelimiter(argv.get("delimiter"), ',');
            workers = CliArgParser.parseInt(argv.get("workers"), 1);
            cleanup = CliArgParser.flag(argv, "cleanup");
            noResult = CliArgParser.flag(argv, "noResult");

            String name = CliPathResolver.trimToNull(argv.get("name"));
            String outName = CliPathResolver.trimToNull(argv.get("outName"));

            TableFormat format = factory.createTableFormat(delimiter);
            SourceTable table = factory.createSourceTable(tablePath, name, format);

            String defaultOut = "output/" + table.tableName();
            outDir = CliPathResolver.resolvePath(baseDir, firstNonBlank(argv.get("out"), defaultOut));

            MissingValues missingValues = factory.createMissingValues(
                    argv.containsKey("naValues") ? CliArgParser.parseList(argv.get("naValues")) : null);
            settings = factory.createSettings(outDir, format, missingValues, warningSink);

            orchestrator = factory.createOrchestrator(table, columns, outName, settings);

            String defaultResult = outDir.resolve(ArtifactNamePolicy.reportName(orchestrator.getFinalName())).toString();
            reportXlsx = CliPathResolver.resolvePath(baseDir, firstNonBlank(argv.get("result"), defaultResult));

            if (workers < 1) throw new IllegalArgumentException("--workers must be >= 1: " + workers);

            System.out.println("==================================================");
            System.out.println("[START] Column remap");
            System.out.println("[CONF] baseDir        = " + baseDir);
            System.out.println("[CONF] table          = " + tablePath);
            System.out.println("[CONF] name           = " + table.tableName());
            System.out.println("[CONF] columns        = " + columns);
            System.out.println("[CONF] out            = " + outDir);
            System.out.println("[CONF] final          = " + orchestrator.getFinalName());
            System.out.println("[CONF] workers        = " + workers);
            System.out.println("[CONF] delimiter      = " + printable(delimiter));
            System.out.println("[CONF] naValues       = " + missingValues.getTokens().size() + " token(s)");
            System.out.println("[CONF] cleanup        = " + cleanup + " (use --cleanup)");
            System.out.println("[CONF] result         = " + (noResult ? "(disabled)" : reportXlsx.toString()));
            System.out.println("==================================================");

        } catch (IllegalArgumentException | AbbreviationException e) {
            System.out.println("[ERROR] invalid arguments: " + e.getMessage());
            printUsage();
            return EXIT_INVALID_ARGS;
        } catch (IllegalStateException e) {
            // graph validation: two tasks writing one file, or a cycle
            System.out.println("[ERROR] invalid task graph: " + e.getMessage());
            return EXIT_INVALID_ARGS;
        }

        CliPathResolver.mkdirs(outDir);

        // ------------------------------------------------------------
        // execute
        // ------------------------------------------------------------
        TaskExecutor executor = factory.createExecutor(workers, warningSink, new CliProgressMonitor());
        ReportWriter reportWriter = factory.createReportWriter(!noResult);

        long tRun0 = System.nanoTime();
        System.out.println("[STEP1] running graph. tasks=" + orchestrator.getGraph().size());
        ExecutionReport report = executor.execute(orchestrator.getGraph());
        System.out.println("[STEP1] graph finished. elapsed=" + ms(tRun0) + "ms");

        System.out.println("[STAT] done=" + report.count(TaskStatus.DONE)
                + ", skipped=" + report.count(TaskStatus.SKIPPED)
                + ", failed=" + report.count(TaskStatus.FAILED)
                + ", upstreamFailed=" + report.count(TaskStatus.UPSTREAM_FAILED));
        for (TaskRunResult f : report.failures()) {
            System.out.println("[ERROR] " + f.getTaskId() + " : " + f.getMessage());
        }

        List<IdMapSummary> idMaps = summarizeIdMaps(orchestrator);
        for (IdMapSummary s : idMaps) {
            System.out.println("[STAT] idmap " + s.getColumn() + " cardinality=" + s.getCardinality()
                    + (s.isHasMissing() ? " (incl. missing)" : ""));
        }

        if (report.isSuccess() && cleanup) {
            long tClean0 = System.nanoTime();
            int deleted = orchestrator.deleteIntermediates(warningSink);
            System.out.println("[STEP2] intermediates deleted=" + deleted + ". elapsed=" + ms(tClean0) + "ms");
        } else if (cleanup) {
            System.out.println("[STEP2] cleanup skipped: run did not succeed");
        }

        System.out.println("[STAT] warnings=" + warnings.size());

        int exit = report.isSuccess() ? EXIT_OK : EXIT_TASK_FAILED;
        if (!noResult) {
            long tXlsx0 = System.nanoTime();
            System.out.println("[STEP3] writing result xlsx... rows=" + report.getResults().size());
            try {
                reportWriter.write(reportXlsx, report.getResults(), idMaps, warnings);
                System.out.println("[STEP3] result xlsx written. elapsed=" + ms(tXlsx0) + "ms");
            } catch (IllegalStateException e) {
                System.out.println("[ERROR] " + e.getMessage());
                exit = EXIT_TASK_FAILED;
            }
        } else {
            System.out.println("[STEP3] result xlsx skipped (--noResult).");
        }

        System.out.println("==================================================");
        if (exit == EXIT_OK) {
            System.out.println("[DONE] output=" + orchestrator.output() + " totalElapsed=" + ms(t0) + "ms");
        } else {
            System.out.println("[DONE] FAILED totalElapsed=" + ms(t0) + "ms");
        }
        System.out.println("==================================================");
        return exit;
    }

    private static List<IdMapSummary> summarizeIdMaps(RemapOrchestrator orchestrator) {
        List<IdMapSummary> out = new ArrayList<>();
        for (RemapChain chain : orchestrator.getChains()) {
            if (!chain.getIdMapBuilder().complete()) continue;
            try {
                IdMap map = chain.getIdMapBuilder().readIdMap();
                out.add(new IdMapSummary(chain.getColumn(), map.size(), map.hasMissing(),
                        chain.getIdMapBuilder().output().toString()));
            } catch (IllegalStateException | TableInputException e) {
                System.out.println("[WARN] idmap " + chain.getColumn() + " not readable: " + e.getMessage());
            }
        }
        return out;
    }

    private static void printUsage() {
        System.out.println("usage: --table=<csv> --columns=<c1,c2,...> [--name=<table name>] [--out=<dir>]");
        System.out.println("       [--outName=<final name>] [--workers=<n>] [--delimiter=<char|tab>]");
        System.out.println("       [--naValues=<v1,v2,...>] [--cleanup] [--result=<xlsx> | --noResult] [--baseDir=<dir>]");
    }

    private static String printable(char c) {
        return c == '\t' ? "\\t" : String.valueOf(c);
    }

    private static long ms(long nanoStart) {
        return (System.nanoTime() - nanoStart) / 1_000_000L;
    }

    private static String firstNonBlank(String... values) {
        if (values == null) return null;
        for (String v : values) {
            if (v != null && !v.isBlank()) return v;
        }
        return null;
    }
}
