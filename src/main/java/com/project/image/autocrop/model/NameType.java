package com.project.image.autocrop.model;

/** How an output file name is chosen. */
public enum NameType {
    /** Stem of the input file's own name. */
    ORIGINAL,
    /** User supplied name; comparison images get their position appended. */
    CUSTOM
}
