package org.unicitylabs.hydrator.projection.record;

/**
 * Kind family a projected record belongs to. Stored as the record_type column.
 */
public enum RecordType {
    ARTICLE,
    COMMENT,
    HIGHLIGHT,
    MEDIA,
    GENERIC
}
