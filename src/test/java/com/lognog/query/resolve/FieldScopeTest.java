package com.lognog.query.resolve;

import com.lognog.query.CompilePhase;
import com.lognog.query.ast.FieldName;
import com.lognog.query.schema.FieldSchema;
import com.lognog.query.schema.FieldType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for FieldScope
 */
@DisplayName("FieldScope Tests")
class FieldScopeTest {

    private final FieldScope scope = FieldScope.of(FieldSchema.defaultLogSchema());

    @Test
    @DisplayName("select should keep the named fields in the given order")
    void shouldSelectInGivenOrder() {
        // When
        FieldScope selected = scope.select(List.of(new FieldName("severity", 0), new FieldName("hostname", 10)));

        // Then
        assertThat(selected.names()).containsExactly("severity", "hostname");
        assertThat(selected.typeOf("severity")).isEqualTo(FieldType.INTEGER);
    }

    @Test
    @DisplayName("select should fail at the first missing field with its position")
    void shouldRejectMissingField() {
        assertThatThrownBy(() -> scope.select(List.of(new FieldName("hostname", 0), new FieldName("nosuch", 12))))
            .isInstanceOf(ResolveException.class)
            .hasMessageContaining("Field 'nosuch' is not available here")
            .satisfies(e -> {
                ResolveException error = (ResolveException) e;
                assertThat(error.getStage()).isEqualTo(CompilePhase.RESOLVE);
                assertThat(error.getPosition()).isEqualTo(12);
            });
    }
}
