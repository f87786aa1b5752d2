package com.autopilot.action.model;

/**
 * Уровень автономии действия
 */
public enum ActionLevel {
    /** агент выполняет сам, человек видит результат */
    A,
    /** агент готовит, человек подтверждает */
    B,
    /** агент готовит бриф, человек действует сам */
    C
}
