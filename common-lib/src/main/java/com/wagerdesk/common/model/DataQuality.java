package com.wagerdesk.common.model;

/**
 * Completeness of the context an evaluation was built from.
 *
 * <ul>
 *   <li>{@link #FRESH}: every DataAccess call returned a record</li>
 *   <li>{@link #PARTIAL}: at least one lookup failed or came back empty; the pipeline continued</li>
 *   <li>{@link #UNAVAILABLE}: no usable context after the retry budget was spent</li>
 * </ul>
 */
public enum DataQuality {
    FRESH,
    PARTIAL,
    UNAVAILABLE
}
