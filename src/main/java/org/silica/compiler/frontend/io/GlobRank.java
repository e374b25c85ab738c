package org.silica.compiler.frontend.io;

/**
 * The specificity of a path pattern, most specific first. When two library
 * declarations claim the same file, the one whose pattern has the lower rank wins.
 */
public enum GlobRank {
    /** The pattern names one file literally. */
    EXACT_PATH,
    /** The file name is literal but some directory segment contains wildcards. */
    SIMPLE_NAME,
    /** The file name itself contains wildcards. */
    WILDCARD_NAME,
    /** The pattern names whole directories. */
    DIRECTORY
}
