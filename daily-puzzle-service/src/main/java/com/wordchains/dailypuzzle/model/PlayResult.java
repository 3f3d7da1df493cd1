package com.wordchains.dailypuzzle.model;

public enum PlayResult {
    WIN,
    LOSS
}
