package io.tiller.core.release;

import io.tiller.core.chart.Chart;
import io.tiller.core.release.v1.Hook;
import io.tiller.core.release.v1.Release;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

final class V1ReleaseAccessor implements ReleaseAccessor {

    private final Release release;

    V1ReleaseAccessor(Release release) {
        this.release = release;
    }

    @Override
    public String name() {
        return release.getName();
    }

    @Override
    public String namespace() {
        return release.getNamespace();
    }

    @Override
    public int version() {
        return release.getVersion();
    }

    @Override
    public List<HookAccessor> hooks() {
        List<HookAccessor> hooks = new ArrayList<>(release.getHooks().size());
        for (Hook hook : release.getHooks()) {
            hooks.add(new V1HookAccessor(hook));
        }
        return hooks;
    }

    @Override
    public String manifest() {
        return release.getManifest();
    }

    @Override
    public String notes() {
        return release.getNotes();
    }

    @Override
    public Map<String, String> labels() {
        return release.getLabels();
    }

    @Override
    public Chart chart() {
        return release.getChart();
    }

    @Override
    public String status() {
        return release.getStatus().value();
    }

    @Override
    public String applyMethod() {
        return release.getApplyMethod();
    }

    @Override
    public Instant deployedAt() {
        return release.getLastDeployed();
    }
}
