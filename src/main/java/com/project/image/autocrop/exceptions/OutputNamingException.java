package com.project.image.autocrop.exceptions;

public class OutputNamingException extends AutocropException {
    public OutputNamingException(String message) { super(message); }
}
