package com.triagesentinel.analyzer.analysis;

/**
 * Why an analysis node ended {@code failed}.
 *
 * @author Naveed Gung
 */
public enum FailureKind {

    /** The node sits deeper than the configured nesting limit. */
    RECURSION_LIMIT_EXCEEDED,

    /** The container could not be unpacked safely. */
    EXTRACTION_FAILED,

    /** Anything else, including unreadable files. */
    ANALYSIS_FAILED
}
