package com.refinement_copilot.service.observability;

import java.util.ArrayList;
import java.util.List;

/**
 * Observer that keeps everything it is told, for assertions
 */
public class RecordingPipelineObserver implements PipelineObserver {

    private final List<PipelineState> transitions = new ArrayList<>();
    private final List<String> events = new ArrayList<>();
    private final List<FailureKind> failures = new ArrayList<>();

    @Override
    public void onTransition(PipelineState state) {
        transitions.add(state);
    }

    @Override
    public void onEvent(PipelineState stage, String message, Object... args) {
        events.add(stage + ": " + message);
    }

    @Override
    public void onFailure(FailureKind kind, String message, Throwable cause) {
        failures.add(kind);
    }

    public List<PipelineState> getTransitions() {
        return transitions;
    }

    public List<String> getEvents() {
        return events;
    }

    public List<FailureKind> getFailures() {
        return failures;
    }

    public PipelineState lastState() {
        return transitions.isEmpty() ? PipelineState.INIT : transitions.get(transitions.size() - 1);
    }
}
