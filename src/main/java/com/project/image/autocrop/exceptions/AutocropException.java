package com.project.image.autocrop.exceptions;

/** Base type for failures of a crop run. */
public class AutocropException extends RuntimeException {
    public AutocropException(String message) { super(message); }
    public AutocropException(String message, Throwable cause) { super(message, cause); }
}
