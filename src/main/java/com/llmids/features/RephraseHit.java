package com.llmids.features;

public record RephraseHit(int originalTurn, int refusalTurn, int rephraseTurn, double similarity) {
}
