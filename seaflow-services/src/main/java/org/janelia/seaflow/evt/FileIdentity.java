package org.janelia.seaflow.evt;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Identity of an EVT file derived from its name: an optional julian day directory (e.g. "2014_185") and the base
 * file name, either an ISO-like timestamp ("2014-07-04T00-00-02+00-00") or a legacy "&lt;digits&gt;.evt" name.
 */
public class FileIdentity {

    private static final Pattern EVT_NAME_PATTERN = Pattern.compile(
            "^.*?/?" +
            "(?<julian>\\d{4}_\\d{1,3})?/?" +
            "(?<file>\\d{4}-\\d{2}-\\d{2}T\\d{2}-\\d{2}-\\d{2}[+-]\\d{2}-?\\d{2}|\\d+\\.evt)" +
            "(?<gz>\\.gz)?$");

    private final String julianDir;
    private final String baseName;
    private final boolean compressed;

    public FileIdentity(String julianDir, String baseName, boolean compressed) {
        this.julianDir = StringUtils.defaultIfBlank(julianDir, null);
        this.baseName = baseName;
        this.compressed = compressed;
    }

    public static Optional<FileIdentity> parse(String name) {
        if (StringUtils.isBlank(name)) {
            return Optional.empty();
        }
        Matcher m = EVT_NAME_PATTERN.matcher(name);
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(new FileIdentity(m.group("julian"), m.group("file"), m.group("gz") != null));
    }

    public static boolean isEvtFile(String name) {
        return parse(name).isPresent();
    }

    /**
     * The key under which data from the given reference is stored: the identity's relative path when the name parses,
     * the reference itself otherwise.
     */
    public static String fileKey(String reference) {
        return parse(reference).map(FileIdentity::relativePath).orElse(reference);
    }

    public Optional<String> getJulianDir() {
        return Optional.ofNullable(julianDir);
    }

    public String getBaseName() {
        return baseName;
    }

    public boolean isCompressed() {
        return compressed;
    }

    /**
     * @return "julian/base" or just "base" when there is no julian directory; never has a compression suffix
     */
    public String relativePath() {
        return julianDir == null ? baseName : julianDir + "/" + baseName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FileIdentity that = (FileIdentity) o;
        return compressed == that.compressed &&
                Objects.equals(julianDir, that.julianDir) &&
                Objects.equals(baseName, that.baseName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(julianDir, baseName, compressed);
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("julianDir", julianDir)
                .append("baseName", baseName)
                .append("compressed", compressed)
                .toString();
    }
}
