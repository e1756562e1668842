package com.example.admission;

public record ErrorBody(String code, String message) {}
