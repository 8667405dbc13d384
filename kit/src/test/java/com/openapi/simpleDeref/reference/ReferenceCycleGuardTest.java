package com.openapi.simpleDeref.reference;

import com.openapi.simpleDeref.components.ComponentCategory;
import com.openapi.simpleDeref.components.ComponentKey;
import com.openapi.simpleDeref.reference.exceptions.RecursiveReferenceException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReferenceCycleGuardTest {

    private static final ComponentKey A = new ComponentKey(ComponentCategory.SCHEMAS, "A");
    private static final ComponentKey B = new ComponentKey(ComponentCategory.SCHEMAS, "B");

    @Test
    void testReenteringOpenKeyFails() throws Exception {
        ReferenceCycleGuard guard = new ReferenceCycleGuard();
        guard.enter(A);
        guard.enter(B);

        assertThatThrownBy(() -> guard.enter(A))
            .isInstanceOfSatisfying(RecursiveReferenceException.class, e -> {
                assertThat(e.getCategory()).isEqualTo(ComponentCategory.SCHEMAS);
                assertThat(e.getName()).isEqualTo("A");
                assertThat(e.getChain()).containsExactly(A, B);
                assertThat(e.getMessage()).contains("schemas/A -> schemas/B -> schemas/A");
            });
    }

    @Test
    void testExitAllowsKeyAgain() throws Exception {
        ReferenceCycleGuard guard = new ReferenceCycleGuard();
        guard.enter(A);
        guard.exit(A);
        guard.enter(A);

        assertThat(guard.isInProgress(A)).isTrue();
        assertThat(guard.depth()).isEqualTo(1);
    }

    @Test
    void testSameNameInAnotherCategoryIsDistinct() throws Exception {
        ReferenceCycleGuard guard = new ReferenceCycleGuard();
        guard.enter(A);
        guard.enter(new ComponentKey(ComponentCategory.HEADERS, "A"));

        assertThat(guard.inProgress()).hasSize(2);
    }

    @Test
    void testExitWithoutEnterIsAProgrammingError() {
        assertThatThrownBy(() -> new ReferenceCycleGuard().exit(A)).isInstanceOf(IllegalStateException.class);
    }
}
