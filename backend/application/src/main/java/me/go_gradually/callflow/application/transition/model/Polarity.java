package me.go_gradually.callflow.application.transition.model;

public enum Polarity {
    AFFIRMATIVE,
    NEGATIVE,
    NEUTRAL
}
