package com.wordchains.dailypuzzle.generation;

public enum ReviewDecision {
    APPROVE,
    REJECT,
    QUIT
}
