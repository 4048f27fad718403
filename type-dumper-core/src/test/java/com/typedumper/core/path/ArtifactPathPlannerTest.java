package com.typedumper.core.path;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ArtifactPathPlanner}.
 */
class ArtifactPathPlannerTest {

    @Test
    void planPath_firstImage_returnsBasePathUnchanged() {
        assertThat(ArtifactPathPlanner.planPath("types.cs", 0)).isEqualTo("types.cs");
        assertThat(ArtifactPathPlanner.planPath("out/dir", 0)).isEqualTo("out/dir");
    }

    @Test
    void planPath_laterImage_insertsSuffixBeforeExtension() {
        assertThat(ArtifactPathPlanner.planPath("types.cs", 1)).isEqualTo("types-1.cs");
        assertThat(ArtifactPathPlanner.planPath("C:\\dump\\ida.py", 12)).isEqualTo("C:\\dump\\ida-12.py");
    }

    @Test
    void planPath_withoutExtension_appendsSuffix() {
        assertThat(ArtifactPathPlanner.planPath("output", 2)).isEqualTo("output-2");
        assertThat(ArtifactPathPlanner.planPath("out.v2/types", 1)).isEqualTo("out.v2/types-1");
    }

    @Test
    void planPath_distinctIndices_yieldDistinctPaths() {
        assertThat(ArtifactPathPlanner.planPath("types.cs", 1))
            .isNotEqualTo(ArtifactPathPlanner.planPath("types.cs", 2))
            .isNotEqualTo(ArtifactPathPlanner.planPath("types.cs", 0));
    }

    @Test
    void planPath_negativeIndex_throwsIllegalArgument() {
        assertThatThrownBy(() -> ArtifactPathPlanner.planPath("types.cs", -1))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
