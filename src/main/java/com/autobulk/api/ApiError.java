package com.autobulk.api;

public record ApiError(int status, String error, String message) {
}
