package com.agilab.model_ingestion.filter;

import com.agilab.model_ingestion.config.IngestionProperties;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultFilterPolicyTest {

    private final RenameColumnsFilter rename = new RenameColumnsFilter();
    private final YearFilter year = new YearFilter();
    private final IngestionProperties properties = new IngestionProperties();

    @Test
    void shouldUseFamilyDefaultsWhenNoStepsGiven() {
        var policy = new DefaultFilterPolicy(List.of(year, rename), properties);

        assertThat(policy.stepsFor("reeds-US", null)).containsExactly(rename, year);
        assertThat(policy.stepsFor("ReEDS-us", null)).containsExactly(rename, year);
    }

    @Test
    void shouldReplaceDefaultsWithExplicitSteps() {
        var policy = new DefaultFilterPolicy(List.of(year, rename), properties);

        assertThat(policy.stepsFor("reeds-US", List.of(year))).containsExactly(year);
        assertThat(policy.stepsFor("reeds-US", List.of())).isEmpty();
    }

    @Test
    void shouldApplyNoStepsForUnknownFamily() {
        var policy = new DefaultFilterPolicy(List.of(year, rename), properties);

        assertThat(policy.stepsFor("sienna", null)).isEmpty();
        assertThat(policy.stepsFor(null, null)).isEmpty();
    }

    @Test
    void shouldFailOnMisconfiguredStepName() {
        properties.setDefaultFilters(Map.of("plexos", List.of("rename", "pivot")));
        var policy = new DefaultFilterPolicy(List.of(year, rename), properties);

        assertThatThrownBy(() -> policy.stepsFor("plexos", null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("'pivot'");
    }

    @Test
    void shouldLookUpStepsByName() {
        var policy = new DefaultFilterPolicy(List.of(year, rename), properties);

        assertThat(policy.step("filter_year")).isSameAs(year);
        assertThatThrownBy(() -> policy.step("pivot")).isInstanceOf(IllegalArgumentException.class);
    }
}
