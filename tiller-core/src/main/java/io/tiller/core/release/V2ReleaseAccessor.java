package io.tiller.core.release;

import io.tiller.core.chart.Chart;
import io.tiller.core.release.v2.Release;
import java.time.Instant;
import java.util.List;
import java.util.Map;

final class V2ReleaseAccessor implements ReleaseAccessor {

    private final Release release;

    V2ReleaseAccessor(Release release) {
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
        return release.getHooks().stream()
                .<HookAccessor>map(V2HookAccessor::new)
                .toList();
    }

    @Override
    public String manifest() {
        return release.getManifest();
    }

    @Override
    public String notes() {
        return release.getInfo().getNotes();
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
        return release.getInfo().getStatus().value();
    }

    @Override
    public String applyMethod() {
        return release.getApplyMethod();
    }

    @Override
    public Instant deployedAt() {
        return release.getInfo().getLastDeployed();
    }
}
