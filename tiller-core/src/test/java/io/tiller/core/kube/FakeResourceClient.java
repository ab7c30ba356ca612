package io.tiller.core.kube;

import java.io.IOException;
import java.io.Writer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/// Recording in-memory {@link ResourceClient} for tests.
///
/// Manifests are "built" by reading the `kind:` and `name:` lines of each document.
/// Every call is appended to {@link #calls()} as a short string such as
/// `create:[Job/a, Job/b]` or `watch:[Job/a]`; failures are injected by resource name.
public class FakeResourceClient implements ResourceClient {

    private final List<String> calls = Collections.synchronizedList(new ArrayList<>());
    private final Set<String> failBuild = Collections.synchronizedSet(new HashSet<>());
    private final Set<String> failCreate = Collections.synchronizedSet(new HashSet<>());
    private final Set<String> failReady = Collections.synchronizedSet(new HashSet<>());
    private final Set<String> failDelete = Collections.synchronizedSet(new HashSet<>());
    private final List<PodList.Pod> pods = Collections.synchronizedList(new ArrayList<>());
    private final Map<String, ReadinessGate> gates = new ConcurrentHashMap<>();

    /// Blocking step run while a resource is awaited, for timing tests.
    @FunctionalInterface
    public interface ReadinessGate {
        void pass() throws Exception;
    }

    public FakeResourceClient failBuildOf(String name) {
        failBuild.add(name);
        return this;
    }

    public FakeResourceClient failCreateOf(String name) {
        failCreate.add(name);
        return this;
    }

    /// Makes both readiness waits fail for resources with this name.
    public FakeResourceClient failReadinessOf(String name) {
        failReady.add(name);
        return this;
    }

    /// Runs the gate whenever a readiness wait covers a resource with this name. A gate
    /// interrupted while blocking records `interrupted:<name>`.
    public FakeResourceClient gateReadinessOf(String name, ReadinessGate gate) {
        gates.put(name, gate);
        return this;
    }

    public FakeResourceClient failDeleteOf(String name) {
        failDelete.add(name);
        return this;
    }

    /// Adds a pod returned by every pod list call.
    public FakeResourceClient withPod(String name, String namespace, String... containers) {
        pods.add(new PodList.Pod(name, namespace, List.of(containers)));
        return this;
    }

    /// @return snapshot of recorded calls in call order
    public List<String> calls() {
        synchronized (calls) {
            return List.copyOf(calls);
        }
    }

    /// @return recorded calls starting with the given prefix
    public List<String> calls(String prefix) {
        return calls().stream().filter(c -> c.startsWith(prefix)).toList();
    }

    @Override
    public ResourceList build(String manifest, boolean validate) throws ResourceException {
        List<Resource> resources = new ArrayList<>();
        for (String document : manifest.split("(?m)^---[ \\t]*$")) {
            String kind = null;
            String name = null;
            String namespace = "";
            for (String line : document.split("\n")) {
                String trimmed = line.strip();
                if (line.startsWith("kind:")) {
                    kind = trimmed.substring("kind:".length()).strip();
                } else if (name == null && trimmed.startsWith("name:") && line.startsWith(" ")) {
                    name = trimmed.substring("name:".length()).strip();
                } else if (trimmed.startsWith("namespace:") && line.startsWith(" ")) {
                    namespace = trimmed.substring("namespace:".length()).strip();
                }
            }
            if (kind == null || name == null) {
                continue;
            }
            if (failBuild.contains(name)) {
                throw new ResourceException("cannot build " + name);
            }
            resources.add(new Resource("v1", kind, name, namespace));
        }
        ResourceList list = ResourceList.of(resources);
        calls.add("build" + (validate ? "" : "-novalidate") + ":" + list);
        return list;
    }

    @Override
    public ResourceResult create(ResourceList resources, CreateOptions options)
            throws ResourceException {
        calls.add("create" + (options.serverSideApply() ? "-ssa" : "") + ":" + resources);
        for (Resource resource : resources) {
            if (failCreate.contains(resource.name())) {
                throw new ResourceException("create rejected for " + resource.name());
            }
        }
        return ResourceResult.created(resources);
    }

    @Override
    public List<ResourceException> delete(ResourceList resources, DeletionPropagation propagation) {
        calls.add("delete:" + resources);
        List<ResourceException> errors = new ArrayList<>();
        for (Resource resource : resources) {
            if (failDelete.contains(resource.name())) {
                errors.add(new ResourceException("delete failed for " + resource.name()));
            }
        }
        return errors;
    }

    @Override
    public Waiter getWaiter(WaitStrategy strategy) {
        return new Waiter() {
            @Override
            public void waitUntilReady(ResourceList resources, Duration timeout)
                    throws ResourceException {
                calls.add("ready:" + resources);
                checkReady(resources);
            }

            @Override
            public void watchUntilReady(ResourceList resources, Duration timeout)
                    throws ResourceException {
                calls.add("watch:" + resources);
                checkReady(resources);
            }

            @Override
            public void waitForDelete(ResourceList resources, Duration timeout) {
                calls.add("waitForDelete:" + resources);
            }
        };
    }

    private void checkReady(ResourceList resources) throws ResourceException {
        for (Resource resource : resources) {
            ReadinessGate gate = gates.get(resource.name());
            if (gate == null) {
                continue;
            }
            try {
                gate.pass();
            } catch (InterruptedException e) {
                calls.add("interrupted:" + resource.name());
                Thread.currentThread().interrupt();
                throw new ResourceException("interrupted waiting for " + resource.name(), e);
            } catch (Exception e) {
                throw new ResourceException(
                        "timed out waiting for " + resource.name() + ": " + e.getMessage(), e);
            }
        }
        for (Resource resource : resources) {
            if (failReady.contains(resource.name())) {
                throw new ResourceException("timed out waiting for " + resource.name());
            }
        }
    }

    @Override
    public PodList getPodList(String namespace, PodSelector selector) {
        String filter =
                selector.labelSelector().isEmpty()
                        ? selector.fieldSelector()
                        : selector.labelSelector();
        calls.add("pods:" + namespace + ":" + filter);
        return new PodList(pods);
    }

    @Override
    public void outputContainerLogsForPodList(PodList podList, String namespace, LogSink sink)
            throws ResourceException {
        calls.add(
                "logs:"
                        + namespace
                        + ":"
                        + podList.items().stream()
                                .map(PodList.Pod::name)
                                .collect(Collectors.joining(",")));
        for (PodList.Pod pod : podList.items()) {
            for (String container : pod.containers()) {
                try (Writer writer = sink.writerFor(namespace, pod.name(), container)) {
                    writer.write("log of " + pod.name() + "/" + container + "\n");
                } catch (IOException e) {
                    throw new ResourceException("cannot write logs", e);
                }
            }
        }
    }
}
