package io.tiller.core.release;

import io.tiller.core.release.v1.Hook;
import io.tiller.core.release.v1.HookExecution;
import java.time.Instant;
import java.util.List;

final class V1HookAccessor implements HookAccessor {

    private final Hook hook;

    V1HookAccessor(Hook hook) {
        this.hook = hook;
    }

    @Override
    public String path() {
        return hook.getPath();
    }

    @Override
    public String manifest() {
        return hook.getManifest();
    }

    @Override
    public String name() {
        return hook.getName();
    }

    @Override
    public String kind() {
        return hook.getKind();
    }

    @Override
    public int weight() {
        return hook.getWeight();
    }

    @Override
    public boolean hasEvent(String event) {
        for (Hook.Event e : hook.getEvents()) {
            if (e.value().equals(event)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean hasDeletePolicy(String policy) {
        for (Hook.DeletePolicy p : hook.getDeletePolicies()) {
            if (p.value().equals(policy)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public void setDefaultDeletePolicy() {
        if (hook.getDeletePolicies().isEmpty()) {
            hook.setDeletePolicies(List.of(Hook.DeletePolicy.BEFORE_HOOK_CREATION));
        }
    }

    @Override
    public boolean hasOutputLogPolicy(String policy) {
        for (Hook.OutputLogPolicy p : hook.getOutputLogPolicies()) {
            if (p.value().equals(policy)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public void setLastRunStarted() {
        hook.setLastRun(new HookExecution(Instant.now(), HookExecution.Phase.RUNNING));
    }

    @Override
    public void setLastRunPhase(HookPhase phase) {
        hook.getLastRun().setPhase(HookExecution.Phase.fromValue(phase.value()));
    }

    @Override
    public void setLastRunCompleted() {
        hook.getLastRun().setCompletedAt(Instant.now());
    }

    @Override
    public LastRun lastRun() {
        HookExecution run = hook.getLastRun();
        return new LastRun(
                run.getStartedAt(), run.getCompletedAt(), HookPhase.fromValue(run.getPhase().value()));
    }

    @Override
    public String toString() {
        return "v1 hook " + hook.getName();
    }
}
