package com.project.image.edges.DTOs;

public record ErrorResponse(String error, String message) {}
