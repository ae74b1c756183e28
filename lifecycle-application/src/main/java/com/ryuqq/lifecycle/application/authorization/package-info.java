/**
 * 호출자 정보와 전이 인가 훅.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.lifecycle.application.authorization;
