package com.github.salilvnair.researchengine.engine.model;

public enum ToolStatus {
    OK,
    ERROR,
    TIMEOUT
}
