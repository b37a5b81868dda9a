package com.github.salilvnair.researchengine.engine.model;

public enum TurnRole {
    USER,
    ASSISTANT
}
