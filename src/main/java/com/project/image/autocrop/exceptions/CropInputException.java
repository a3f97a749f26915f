package com.project.image.autocrop.exceptions;

/** The image batch cannot be cropped: too few images, unreadable files or mismatched sizes. */
public class CropInputException extends AutocropException {
    public CropInputException(String message) { super(message); }
    public CropInputException(String message, Throwable cause) { super(message, cause); }
}
