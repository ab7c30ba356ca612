package io.tiller.core.release;

import io.tiller.core.release.v2.Hook;
import io.tiller.core.release.v2.HookExecution;
import java.time.Instant;

final class V2HookAccessor implements HookAccessor {

    private final Hook hook;

    V2HookAccessor(Hook hook) {
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
        return hook.getEvents().stream().anyMatch(e -> e.value().equals(event));
    }

    @Override
    public boolean hasDeletePolicy(String policy) {
        return hook.getDeletePolicies().stream().anyMatch(p -> p.value().equals(policy));
    }

    @Override
    public void setDefaultDeletePolicy() {
        if (hook.getDeletePolicies().isEmpty()) {
            hook.getDeletePolicies().add(Hook.DeletePolicy.BEFORE_HOOK_CREATION);
        }
    }

    @Override
    public boolean hasOutputLogPolicy(String policy) {
        return hook.getOutputLogPolicies().stream().anyMatch(p -> p.value().equals(policy));
    }

    @Override
    public void setLastRunStarted() {
        HookExecution run = new HookExecution();
        run.setStartedAt(Instant.now());
        run.setPhase(HookExecution.Phase.RUNNING);
        hook.setLastRun(run);
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
        return "v2 hook " + hook.getName();
    }
}
