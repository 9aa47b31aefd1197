package com.octate.collab.document;

public record DocumentStats(int contentLength, int operationCount, int pendingCount, long version) {}
