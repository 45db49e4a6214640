package domain.remap;

import domain.model.RemapWarningSink;
import domain.table.MissingValues;
import domain.table.TableFormat;

import java.nio.file.Path;

/**
 * Shared configuration of the tasks of one pipeline: where artifacts go, how tables are
 * stored, which values count as missing and where warnings are reported.
 */
public final class RemapSettings {

    private final Path saveDir;
    private final TableFormat format;
    private final MissingValues missingValues;
    private final RemapWarningSink warningSink;

    private RemapSettings(Builder b) {
        this.saveDir = b.saveDir.toAbsolutePath().normalize();
        this.format = b.format;
        this.missingValues = b.missingValues;
        this.warningSink = b.warningSink;
    }

    public static Builder builder(Path saveDir, TableFormat format) {
        return new Builder(saveDir, format);
    }

    public Path getSaveDir() {
        return saveDir;
    }

    public TableFormat getFormat() {
        return format;
    }

    public MissingValues getMissingValues() {
        return missingValues;
    }

    public RemapWarningSink getWarningSink() {
        return warningSink;
    }

    public static final class Builder {

        private final Path saveDir;
        private final TableFormat format;
        private MissingValues missingValues = MissingValues.defaults();
        private RemapWarningSink warningSink = RemapWarningSink.none();

        private Builder(Path saveDir, TableFormat format) {
            if (saveDir == null) throw new IllegalArgumentException("saveDir is null");
            if (format == null) throw new IllegalArgumentException("format is null");
            this.saveDir = saveDir;
            this.format = format;
        }

        public Builder missingValues(MissingValues missingValues) {
            if (missingValues == null) throw new IllegalArgumentException("missingValues is null");
            this.missingValues = missingValues;
            return this;
        }

        public Builder warningSink(RemapWarningSink warningSink) {
            this.warningSink = warningSink == null ? RemapWarningSink.none() : warningSink;
            return this;
        }

        public RemapSettings build() {
            return new RemapSettings(this);
        }
    }
}
