package cli;

import app.RemapCliApp;

/**
 * Entry point.
 *
 * <pre>
 * java -jar column-remapper.jar --table=data/students.csv --columns=grade,gpa,rank
 * </pre>
 */
public final class RemapCli {

    private RemapCli() {
    }

    public static void main(String[] args) {
        System.exit(RemapCliApp.run(args));
    }
}
