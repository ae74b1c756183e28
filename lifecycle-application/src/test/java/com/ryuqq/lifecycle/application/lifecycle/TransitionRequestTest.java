package com.ryuqq.lifecycle.application.lifecycle;

import com.ryuqq.lifecycle.application.authorization.Caller;
import com.ryuqq.lifecycle.application.authorization.CallerRole;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * TransitionRequest 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class TransitionRequestTest {

    @Test
    void 컨텍스트_없는_요청_생성() {
        // given
        Caller caller = new Caller("teacher-1", CallerRole.TEACHER);

        // when
        TransitionRequest request = TransitionRequest.of(caller, "LESSON", "lesson-1", "ACCEPTED");

        // then
        assertThat(request.caller()).isEqualTo(caller);
        assertThat(request.entityKind()).isEqualTo("LESSON");
        assertThat(request.ownerId()).isEqualTo("lesson-1");
        assertThat(request.requestedStatus()).isEqualTo("ACCEPTED");
        assertThat(request.context()).isNull();
    }

    @Test
    void 원시_값은_서비스에서_검증하므로_그대로_보존() {
        TransitionRequest request = new TransitionRequest(Caller.system(), "lesson", " x ", "confirmed", "{oops");

        assertThat(request.entityKind()).isEqualTo("lesson");
        assertThat(request.requestedStatus()).isEqualTo("confirmed");
        assertThat(request.context()).isEqualTo("{oops");
    }

    @Test
    void 호출자_null_예외() {
        assertThatThrownBy(() -> TransitionRequest.of(null, "LESSON", "lesson-1", "ACCEPTED"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("caller");
    }
}
