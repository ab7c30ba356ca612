package io.tiller.core.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tiller.core.release.Releaser;
import io.tiller.core.release.v1.Release;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryReleaseStoreTest {

    private InMemoryReleaseStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryReleaseStore();
    }

    private static Release revision(int version) {
        return Release.builder().name("demo").namespace("apps").version(version).build();
    }

    @Test
    void shouldReturnRevisionsOldestFirst() throws Exception {
        // Given
        Release second = revision(2);
        Release first = revision(1);
        store.create(second);
        store.create(first);

        // Then
        assertThat(store.history("apps", "demo")).containsExactly(first, second);
        assertThat(store.last("apps", "demo")).contains(second);
        assertThat(store.get("apps", "demo", 1)).contains(first);
    }

    @Test
    void shouldRejectDuplicateRevision() throws Exception {
        store.create(revision(1));

        assertThatThrownBy(() -> store.create(revision(1)))
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("already exists");
    }

    @Test
    void shouldReplaceOnUpdate() throws Exception {
        // Given
        store.create(revision(1));
        Release replacement = revision(1);

        // When
        store.update(replacement);

        // Then
        assertThat(store.get("apps", "demo", 1)).containsSame(replacement);
    }

    @Test
    void shouldRejectUpdateOfUnknownRevision() {
        assertThatThrownBy(() -> store.update(revision(3)))
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void shouldRejectUnsupportedSchema() {
        assertThatThrownBy(() -> store.create(new Releaser() {}))
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("unsupported release type");
    }

    @Test
    void shouldBeEmptyForUnknownRelease() {
        assertThat(store.history("apps", "none")).isEmpty();
        assertThat(store.last("apps", "none")).isEmpty();
        assertThat(store.get("other", "demo", 1)).isEmpty();
    }

    @Test
    void shouldClearAllData() throws Exception {
        store.create(revision(1));

        store.clear();

        assertThat(store.history("apps", "demo")).isEmpty();
    }
}
