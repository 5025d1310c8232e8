package com.planview.core.model;

/**
 * A task together with the phase that currently holds it.
 */
public record TaskLocation(Phase phase, Task task) {
}
