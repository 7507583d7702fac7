package com.orbit.core.model;

/**
 * IMMEDIATE goals plan to a single step, COMPLEX goals to a chain of steps.
 */
public enum GoalType {
    IMMEDIATE,
    COMPLEX
}
