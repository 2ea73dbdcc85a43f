package org.janelia.seaflow.fetch;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import com.google.common.collect.ImmutableList;

/**
 * One page of an S3 ListObjectsV2 response.
 */
@JacksonXmlRootElement(localName = "ListBucketResult")
@JsonIgnoreProperties(ignoreUnknown = true)
class ObjectListing {

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ObjectEntry {
        @JacksonXmlProperty(localName = "Key")
        String key;

        String getKey() {
            return key;
        }
    }

    @JacksonXmlProperty(localName = "IsTruncated")
    boolean truncated;

    @JacksonXmlProperty(localName = "NextContinuationToken")
    String nextContinuationToken;

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "Contents")
    List<ObjectEntry> contents;

    List<String> getKeys() {
        if (contents == null) {
            return ImmutableList.of();
        }
        return contents.stream().map(ObjectEntry::getKey).collect(Collectors.toList());
    }

    /**
     * @return the token of the next page, empty when this is the last page
     */
    Optional<String> getNextPageToken() {
        return truncated ? Optional.ofNullable(nextContinuationToken) : Optional.empty();
    }
}
