package com.octate.collab.document;

public record DocumentChange(String content, long version) {}
