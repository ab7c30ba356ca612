package io.tiller.core.dependency;

import static io.tiller.core.chart.TestCharts.chart;
import static io.tiller.core.chart.TestCharts.deployment;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

import io.tiller.core.chart.Chart;
import io.tiller.core.chart.ManifestRenderer;
import io.tiller.core.chart.Manifests;
import io.tiller.core.chart.RenderException;
import io.tiller.core.chart.TestCharts;
import io.tiller.core.kube.FakeResourceClient;
import io.tiller.core.kube.WaitStrategy;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class OrderedInstallerTest {

    private static final Duration TIMEOUT = Duration.ofMinutes(1);

    private FakeResourceClient client;
    private ExecutorService executorService;
    private OrderedInstaller installer;

    @BeforeEach
    void setUp() {
        client = new FakeResourceClient();
        executorService = Executors.newCachedThreadPool();
        installer =
                new OrderedInstaller(
                        client,
                        ManifestRenderer.verbatim(),
                        executorService,
                        WaitStrategy.WATCHER,
                        false);
    }

    @AfterEach
    void tearDown() {
        executorService.shutdownNow();
    }

    @Nested
    class Tiers {

        @Test
        void shouldInstallTiersInDependencyOrderWithOwnResourcesLast() throws Exception {
            // When
            String manifest = installer.installOrdered(TestCharts.foo(), true, TIMEOUT);

            // Then
            assertThat(client.calls("create"))
                    .containsExactly(
                            "create:[Deployment/nginx, Deployment/rabbitmq]",
                            "create:[Deployment/bar]",
                            "create:[Deployment/orphaned, Deployment/foo]");
            assertThat(client.calls())
                    .containsSubsequence(
                            "create:[Deployment/nginx, Deployment/rabbitmq]",
                            "ready:[Deployment/nginx, Deployment/rabbitmq]",
                            "create:[Deployment/bar]",
                            "ready:[Deployment/bar]",
                            "create:[Deployment/orphaned, Deployment/foo]",
                            "ready:[Deployment/orphaned, Deployment/foo]");
            assertThat(manifest)
                    .isEqualTo(
                            Manifests.join(
                                    List.of(
                                            deployment("nginx"),
                                            deployment("rabbitmq"),
                                            deployment("bar"),
                                            deployment("orphaned"),
                                            deployment("foo"))));
        }

        @Test
        void shouldNotWaitWhenWaitingIsDisabled() throws Exception {
            // When
            installer.installOrdered(TestCharts.foo(), false, TIMEOUT);

            // Then
            assertThat(client.calls("create")).hasSize(3);
            assertThat(client.calls("ready")).isEmpty();
        }

        @Test
        void shouldApplyWithServerSideApplyWhenRequested() throws Exception {
            // When
            installer.installOrdered(chart("solo").build(), false, TIMEOUT, true);

            // Then
            assertThat(client.calls("create")).containsExactly("create-ssa:[Deployment/solo]");
        }

        @Test
        void shouldSkipCreateForEmptyFinalTier() throws Exception {
            // Given
            Chart umbrella =
                    Chart.builder("umbrella")
                            .subchart(chart("a").build())
                            .subchart(chart("b").dependsOn("a").build())
                            .build();

            // When
            installer.installOrdered(umbrella, true, TIMEOUT);

            // Then
            assertThat(client.calls("create"))
                    .containsExactly("create:[Deployment/a]", "create:[Deployment/b]");
        }
    }

    @Nested
    class Recursion {

        @Test
        void shouldInstallNestedSubchartsThroughTheirOwnTiers() throws Exception {
            // Given
            Chart api =
                    chart("api")
                            .dependsOn("db")
                            .subchart(chart("cache").build())
                            .subchart(chart("worker").dependsOn("cache").build())
                            .build();
            Chart app = chart("app").subchart(chart("db").build()).subchart(api).build();

            // When
            String manifest = installer.installOrdered(app, true, TIMEOUT);

            // Then
            assertThat(client.calls("create"))
                    .containsExactly(
                            "create:[Deployment/db]",
                            "create:[Deployment/cache]",
                            "create:[Deployment/worker]",
                            "create:[Deployment/api]",
                            "create:[Deployment/app]");
            assertThat(manifest)
                    .isEqualTo(
                            Manifests.join(
                                    List.of(
                                            deployment("db"),
                                            deployment("cache"),
                                            deployment("worker"),
                                            deployment("api"),
                                            deployment("app"))));
        }
    }

    @Nested
    class Failures {

        @Test
        void shouldRejectCycleBeforeAnyClusterCall() {
            // Given
            Chart parent =
                    chart("parent")
                            .subchart(chart("x").dependsOn("y").build())
                            .subchart(chart("y").dependsOn("x").build())
                            .build();

            // When / Then
            assertThatThrownBy(() -> installer.installOrdered(parent, true, TIMEOUT))
                    .isInstanceOf(DependencyCycleException.class)
                    .hasMessageContaining("x -> y -> x");
            assertThat(client.calls()).isEmpty();
        }

        @Test
        void shouldRejectNestedCycleBeforeAnyClusterCall() {
            // Given
            Chart nested =
                    chart("nested")
                            .subchart(chart("x").dependsOn("y").build())
                            .subchart(chart("y").dependsOn("x").build())
                            .build();
            Chart parent =
                    chart("parent")
                            .subchart(chart("first").build())
                            .subchart(nested)
                            .build();

            // When / Then
            assertThatThrownBy(() -> installer.installOrdered(parent, true, TIMEOUT))
                    .isInstanceOf(DependencyCycleException.class)
                    .extracting(e -> ((InstallException) e).getChartName())
                    .isEqualTo("nested");
            assertThat(client.calls()).isEmpty();
        }

        @Test
        void shouldStopAtFailingTier() {
            // Given
            client.failReadinessOf("rabbitmq");

            // When / Then
            assertThatThrownBy(() -> installer.installOrdered(TestCharts.foo(), true, TIMEOUT))
                    .isInstanceOfSatisfying(
                            TierInstallException.class,
                            e -> {
                                assertThat(e.getTierIndex()).isZero();
                                assertThat(e.getChartName()).isEqualTo("foo");
                            })
                    .hasMessageContaining("tier 0 of chart foo failed");
            assertThat(client.calls("create"))
                    .containsExactly("create:[Deployment/nginx, Deployment/rabbitmq]");
        }

        @Test
        void shouldReportFinalTierIndexWhenOwnResourcesFail() {
            // Given
            client.failCreateOf("foo");

            // When / Then
            assertThatThrownBy(() -> installer.installOrdered(TestCharts.foo(), true, TIMEOUT))
                    .isInstanceOfSatisfying(
                            TierInstallException.class,
                            e -> assertThat(e.getTierIndex()).isEqualTo(2));
        }

        @Test
        void shouldAbortWhenNodeCannotBeRendered() {
            // Given
            ManifestRenderer failing =
                    chart -> {
                        if (chart.getName().equals("bar")) {
                            throw new RenderException("template error in bar");
                        }
                        return ManifestRenderer.verbatim().render(chart);
                    };
            OrderedInstaller failingInstaller =
                    new OrderedInstaller(client, failing, executorService, WaitStrategy.WATCHER, false);

            // When / Then
            assertThatThrownBy(
                            () -> failingInstaller.installOrdered(TestCharts.foo(), true, TIMEOUT))
                    .isInstanceOfSatisfying(
                            TierInstallException.class,
                            e -> {
                                assertThat(e.getTierIndex()).isEqualTo(1);
                                assertThat(e.getCause()).isInstanceOf(RenderException.class);
                            });
            assertThat(client.calls("create")).hasSize(1);
        }
    }

    @Nested
    class Concurrency {

        @Test
        void shouldRunNodesOfOneTierConcurrently() throws Exception {
            // Given: both nested installs must be awaiting readiness at the same time
            CyclicBarrier bothWaiting = new CyclicBarrier(2);
            client.gateReadinessOf("a1", () -> bothWaiting.await(5, TimeUnit.SECONDS))
                    .gateReadinessOf("b1", () -> bothWaiting.await(5, TimeUnit.SECONDS));
            Chart root =
                    chart("root")
                            .subchart(chart("a").subchart(chart("a1").build()).build())
                            .subchart(chart("b").subchart(chart("b1").build()).build())
                            .build();

            // When
            installer.installOrdered(root, true, TIMEOUT);

            // Then
            assertThat(client.calls("create"))
                    .containsExactlyInAnyOrder(
                            "create:[Deployment/a1, Deployment/a]",
                            "create:[Deployment/b1, Deployment/b]",
                            "create:[Deployment/root]")
                    .endsWith("create:[Deployment/root]");
        }

        @Test
        void shouldCancelInFlightSiblingsOnFirstFailure() throws Exception {
            // Given: a blocks on a1 until cancelled, b fails once a is blocked
            CountDownLatch aBlocked = new CountDownLatch(1);
            client.gateReadinessOf(
                            "a1",
                            () -> {
                                aBlocked.countDown();
                                Thread.sleep(Duration.ofSeconds(30).toMillis());
                            })
                    .gateReadinessOf(
                            "b1",
                            () -> {
                                aBlocked.await(5, TimeUnit.SECONDS);
                                throw new IllegalStateException("b1 never became ready");
                            });
            Chart root =
                    chart("root")
                            .subchart(
                                    chart("a")
                                            .subchart(chart("a1").build())
                                            .subchart(chart("a2").dependsOn("a1").build())
                                            .build())
                            .subchart(chart("b").subchart(chart("b1").build()).build())
                            .build();

            // When
            Throwable thrown =
                    assertTimeoutPreemptively(
                            Duration.ofSeconds(10),
                            () -> catchThrowable(() -> installer.installOrdered(root, true, TIMEOUT)));

            // Then
            executorService.shutdown();
            assertThat(executorService.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
            assertThat(thrown)
                    .isInstanceOf(TierInstallException.class)
                    .hasMessageContaining("chart root")
                    .hasRootCauseMessage("b1 never became ready");
            assertThat(client.calls()).contains("interrupted:a1");
            assertThat(client.calls("create"))
                    .noneMatch(call -> call.contains("Deployment/a2"))
                    .noneMatch(call -> call.contains("Deployment/a]"))
                    .noneMatch(call -> call.contains("Deployment/root"));
        }
    }

    @Nested
    class PoolCapacity {

        private final Chart nested =
                chart("root").subchart(chart("a").subchart(chart("a1").build()).build()).build();

        @Test
        void shouldCountThreadsHeldByNestedInstalls() throws Exception {
            assertThat(OrderedInstaller.requiredThreads(chart("leaf").build())).isZero();
            assertThat(OrderedInstaller.requiredThreads(nested)).isEqualTo(2);
            assertThat(OrderedInstaller.requiredThreads(TestCharts.foo())).isEqualTo(2);
        }

        @Test
        void shouldRejectPoolTooSmallForNestedCharts() {
            // Given
            ExecutorService single = Executors.newFixedThreadPool(1);
            OrderedInstaller bounded =
                    new OrderedInstaller(
                            client, ManifestRenderer.verbatim(), single, WaitStrategy.WATCHER, false);

            try {
                // When / Then
                assertThatThrownBy(() -> bounded.installOrdered(nested, true, TIMEOUT))
                        .isInstanceOf(InstallException.class)
                        .isNotInstanceOf(TierInstallException.class)
                        .hasMessageContaining("needs up to 2")
                        .hasMessageContaining("bounded to 1");
                assertThat(client.calls()).isEmpty();
            } finally {
                single.shutdownNow();
            }
        }

        @Test
        void shouldInstallWithFixedPoolLargeEnough() throws Exception {
            // Given
            ExecutorService pool = Executors.newFixedThreadPool(2);
            OrderedInstaller bounded =
                    new OrderedInstaller(
                            client, ManifestRenderer.verbatim(), pool, WaitStrategy.WATCHER, false);

            try {
                // When
                assertTimeoutPreemptively(
                        Duration.ofSeconds(10), () -> bounded.installOrdered(nested, true, TIMEOUT));

                // Then
                assertThat(client.calls("create"))
                        .containsExactly(
                                "create:[Deployment/a1, Deployment/a]", "create:[Deployment/root]");
            } finally {
                pool.shutdownNow();
            }
        }
    }
}
