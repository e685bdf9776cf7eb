package com.agilab.model_ingestion.data;

import com.agilab.model_ingestion.exception.UnknownDatasetException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParsedDataStoreTest {

    private final ParsedDataStore store = new ParsedDataStore();

    @Test
    void shouldFailLoudlyOnUnknownKey() {
        store.put("capacity", Table.of(List.of("a"), new Object[]{1L}));

        assertThatThrownBy(() -> store.get("capcity"))
                .isInstanceOf(UnknownDatasetException.class)
                .hasMessage("Key `capcity` not found in parsed data.");
    }

    @Test
    void shouldOverwriteAndReturnPreviousValue() {
        store.put("load", "first");

        var previous = store.put("load", "second");

        assertThat(previous).contains("first");
        assertThat(store.get("load")).isEqualTo("second");
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void shouldKeepInsertionOrder() {
        store.put("zeta", 1);
        store.put("alpha", 2);
        store.put("mid", 3);

        assertThat(store.names()).containsExactly("zeta", "alpha", "mid");
        assertThat(store.snapshot()).containsOnlyKeys("zeta", "alpha", "mid");
    }

    @Test
    void shouldCheckTypeOnTypedLookup() {
        store.put("marker", EmptyDataset.INSTANCE);

        assertThat(store.get("marker", EmptyDataset.class)).isSameAs(EmptyDataset.INSTANCE);
        assertThatThrownBy(() -> store.get("marker", Table.class))
                .isInstanceOf(ClassCastException.class)
                .hasMessageContaining("not a Table");
    }

    @Test
    void shouldExposeSnapshotThatDoesNotTrackLaterWrites() {
        store.put("a", 1);
        var snapshot = store.snapshot();

        store.put("b", 2);

        assertThat(snapshot).containsOnlyKeys("a");
        assertThat(store.find("b")).contains(2);
        assertThat(store.find("c")).isEmpty();
        assertThat(store).hasToString("ParsedDataStore(Files parsed: 2)");
    }
}
