package com.project.image.autocrop.DTOs;

public record ErrorResponse(int status, String error, String message) {}
