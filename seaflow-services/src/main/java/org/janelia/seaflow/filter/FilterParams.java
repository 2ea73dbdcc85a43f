package org.janelia.seaflow.filter;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Filter parameters. <code>width</code> and <code>offset</code> must always be set before filtering;
 * <code>notch1</code>, <code>notch2</code> and <code>origin</code> are derived from the data when they are not set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FilterParams {

    public static final double DEFAULT_WIDTH = 0.5;
    public static final double DEFAULT_OFFSET = 0.0;

    public static class Builder {
        private Double notch1;
        private Double notch2;
        private Double width;
        private Double offset;
        private Double origin;

        private Builder() {
        }

        public Builder notch1(Double notch1) {
            this.notch1 = notch1;
            return this;
        }

        public Builder notch2(Double notch2) {
            this.notch2 = notch2;
            return this;
        }

        public Builder width(Double width) {
            this.width = width;
            return this;
        }

        public Builder offset(Double offset) {
            this.offset = offset;
            return this;
        }

        public Builder origin(Double origin) {
            this.origin = origin;
            return this;
        }

        public FilterParams build() {
            return new FilterParams(notch1, notch2, width, offset, origin);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static FilterParams defaults() {
        return builder().width(DEFAULT_WIDTH).offset(DEFAULT_OFFSET).build();
    }

    private final Double notch1;
    private final Double notch2;
    private final Double width;
    private final Double offset;
    private final Double origin;

    private FilterParams(Double notch1, Double notch2, Double width, Double offset, Double origin) {
        this.notch1 = notch1;
        this.notch2 = notch2;
        this.width = width;
        this.offset = offset;
        this.origin = origin;
    }

    public Double getNotch1() {
        return notch1;
    }

    public Double getNotch2() {
        return notch2;
    }

    public Double getWidth() {
        return width;
    }

    public Double getOffset() {
        return offset;
    }

    public Double getOrigin() {
        return origin;
    }

    /**
     * @throws FilterConfigException if width or offset is missing
     */
    public FilterParams requireFixedParams() {
        if (width == null || offset == null) {
            throw new FilterConfigException("Filter width and offset must be set (width=" + width + ", offset=" + offset + ")");
        }
        return this;
    }

    public Builder toBuilder() {
        return builder()
                .notch1(notch1)
                .notch2(notch2)
                .width(width)
                .offset(offset)
                .origin(origin);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FilterParams that = (FilterParams) o;
        return Objects.equals(notch1, that.notch1) &&
                Objects.equals(notch2, that.notch2) &&
                Objects.equals(width, that.width) &&
                Objects.equals(offset, that.offset) &&
                Objects.equals(origin, that.origin);
    }

    @Override
    public int hashCode() {
        return Objects.hash(notch1, notch2, width, offset, origin);
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("notch1", notch1)
                .append("notch2", notch2)
                .append("width", width)
                .append("offset", offset)
                .append("origin", origin)
                .toString();
    }
}
