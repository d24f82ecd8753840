package dev.labelflow.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WorkflowPropertiesTest {

    @Test
    @DisplayName("unset values fall back to defaults")
    void defaults() {
        WorkflowProperties properties = new WorkflowProperties(null, 0, 0);

        assertThat(properties.completionRejectionNote()).contains("automatically rejected");
        assertThat(properties.maxPageSize()).isEqualTo(100);
        assertThat(properties.defaultPageSize()).isEqualTo(20);
    }

    @Test
    @DisplayName("page sizes are clamped into range")
    void clamp() {
        WorkflowProperties properties = new WorkflowProperties("note", 50, 10);

        assertThat(properties.clampPageSize(0)).isEqualTo(10);
        assertThat(properties.clampPageSize(-3)).isEqualTo(10);
        assertThat(properties.clampPageSize(25)).isEqualTo(25);
        assertThat(properties.clampPageSize(500)).isEqualTo(50);
    }

    @Test
    @DisplayName("the default page never exceeds the maximum")
    void defaultWithinMax() {
        assertThat(new WorkflowProperties("note", 5, 20).defaultPageSize()).isEqualTo(5);
    }
}
