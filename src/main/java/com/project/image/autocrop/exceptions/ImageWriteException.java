package com.project.image.autocrop.exceptions;

/** Creating, writing or PNG-encoding an output file failed. */
public class ImageWriteException extends AutocropException {
    public ImageWriteException(String message) { super(message); }
    public ImageWriteException(String message, Throwable cause) { super(message, cause); }
}
