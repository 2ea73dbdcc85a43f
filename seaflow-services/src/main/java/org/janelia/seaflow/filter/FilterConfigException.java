package org.janelia.seaflow.filter;

/**
 * A required filter setting is missing or invalid. This is a usage error and it stops the whole run.
 */
public class FilterConfigException extends IllegalArgumentException {

    public FilterConfigException(String message) {
        super(message);
    }
}
