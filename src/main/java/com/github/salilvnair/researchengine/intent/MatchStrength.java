package com.github.salilvnair.researchengine.intent;

/**
 * How specifically a query matched an intent pattern, weakest first.
 */
public enum MatchStrength {
    WEAK,
    STRONG,
    EXACT
}
