package org.janelia.seaflow.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.google.common.base.Preconditions;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.janelia.seaflow.filter.FilterParams;

/**
 * Immutable settings of one filter run. All recognized options are listed here with their defaults and
 * invalid combinations are rejected when the configuration is built.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class FilterRunConfig {

    public static final int DEFAULT_WORKERS = 1;
    public static final double DEFAULT_PROGRESS_PERCENT = 10.0;

    public static class Builder {
        private String cruise;
        private FilterParams filterParams = FilterParams.defaults();
        private int workers = DEFAULT_WORKERS;
        private double progressPercent = DEFAULT_PROGRESS_PERCENT;
        private Integer limit;
        private boolean remote;
        private String db;
        private String binaryDir;
        private boolean saveParticles = true;
        private boolean createIndexes = true;
        private boolean gzipDb;
        private boolean gzipBinary;

        private Builder() {
        }

        public Builder cruise(String cruise) {
            this.cruise = cruise;
            return this;
        }

        public Builder filterParams(FilterParams filterParams) {
            this.filterParams = filterParams;
            return this;
        }

        public Builder workers(int workers) {
            this.workers = workers;
            return this;
        }

        public Builder progressPercent(double progressPercent) {
            this.progressPercent = progressPercent;
            return this;
        }

        public Builder limit(Integer limit) {
            this.limit = limit;
            return this;
        }

        public Builder remote(boolean remote) {
            this.remote = remote;
            return this;
        }

        public Builder db(String db) {
            this.db = StringUtils.defaultIfBlank(db, null);
            return this;
        }

        public Builder binaryDir(String binaryDir) {
            this.binaryDir = StringUtils.defaultIfBlank(binaryDir, null);
            return this;
        }

        public Builder saveParticles(boolean saveParticles) {
            this.saveParticles = saveParticles;
            return this;
        }

        public Builder createIndexes(boolean createIndexes) {
            this.createIndexes = createIndexes;
            return this;
        }

        public Builder gzipDb(boolean gzipDb) {
            this.gzipDb = gzipDb;
            return this;
        }

        public Builder gzipBinary(boolean gzipBinary) {
            this.gzipBinary = gzipBinary;
            return this;
        }

        /**
         * @throws org.janelia.seaflow.filter.FilterConfigException if filter width or offset is missing
         * @throws IllegalArgumentException for any other invalid setting
         */
        public FilterRunConfig build() {
            Preconditions.checkArgument(StringUtils.isNotBlank(cruise), "Cruise name is required");
            Preconditions.checkArgument(filterParams != null, "Filter parameters are required");
            filterParams.requireFixedParams();
            Preconditions.checkArgument(db != null || binaryDir != null, "At least one of a database or a binary output directory is required");
            Preconditions.checkArgument(workers >= 1, "Number of workers must be at least 1 but was %s", workers);
            Preconditions.checkArgument(progressPercent > 0 && progressPercent <= 100,
                    "Progress resolution must be in (0, 100] but was %s", progressPercent);
            Preconditions.checkArgument(limit == null || limit >= 0, "Limit must not be negative but was %s", limit);
            return new FilterRunConfig(this);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    private final String cruise;
    private final FilterParams filterParams;
    private final int workers;
    private final double progressPercent;
    private final Integer limit;
    private final boolean remote;
    private final String db;
    private final String binaryDir;
    private final boolean saveParticles;
    private final boolean createIndexes;
    private final boolean gzipDb;
    private final boolean gzipBinary;

    private FilterRunConfig(Builder builder) {
        this.cruise = builder.cruise;
        this.filterParams = builder.filterParams;
        this.workers = builder.workers;
        this.progressPercent = builder.progressPercent;
        this.limit = builder.limit;
        this.remote = builder.remote;
        this.db = builder.db;
        this.binaryDir = builder.binaryDir;
        this.saveParticles = builder.saveParticles;
        this.createIndexes = builder.createIndexes;
        this.gzipDb = builder.gzipDb;
        this.gzipBinary = builder.gzipBinary;
    }

    public String getCruise() {
        return cruise;
    }

    public FilterParams getFilterParams() {
        return filterParams;
    }

    public int getWorkers() {
        return workers;
    }

    public double getProgressPercent() {
        return progressPercent;
    }

    /**
     * @return the maximum number of files to process; empty when all files should be processed
     */
    public Optional<Integer> getLimit() {
        return limit == null || limit == 0 ? Optional.empty() : Optional.of(limit);
    }

    public boolean isRemote() {
        return remote;
    }

    public Optional<Path> getDbFile() {
        return Optional.ofNullable(db).map(Paths::get);
    }

    public Optional<Path> getBinaryDir() {
        return Optional.ofNullable(binaryDir).map(Paths::get);
    }

    public boolean isSaveParticles() {
        return saveParticles;
    }

    public boolean isCreateIndexes() {
        return createIndexes;
    }

    public boolean isGzipDb() {
        return gzipDb;
    }

    public boolean isGzipBinary() {
        return gzipBinary;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("cruise", cruise)
                .append("filterParams", filterParams)
                .append("workers", workers)
                .append("progressPercent", progressPercent)
                .append("limit", limit)
                .append("remote", remote)
                .append("db", db)
                .append("binaryDir", binaryDir)
                .append("saveParticles", saveParticles)
                .append("createIndexes", createIndexes)
                .append("gzipDb", gzipDb)
                .append("gzipBinary", gzipBinary)
                .toString();
    }
}
