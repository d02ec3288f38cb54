package com.indicationscout.evidence.domain.exception;

/**
 * A lookup by name or identifier matched nothing in the source.
 */
public class EntityNotFoundException extends DataSourceException {

    private final String identifier;

    public EntityNotFoundException(String source, String operation, String identifier) {
        super(source, operation, "No match for '" + identifier + "'");
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}
