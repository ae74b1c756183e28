package com.ryuqq.lifecycle.core.model;

import com.ryuqq.lifecycle.core.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

/**
 * 상태 전이에 첨부되는 불투명 JSON 값.
 *
 * <p>거절 사유, 요청자 메모 등 호출자가 원하는 구조화 데이터를 담으며,
 * 코어는 내용을 해석하지 않습니다. 객체, 배열, 스칼라 모두 허용됩니다.</p>
 *
 * <p><strong>파싱 규칙:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열: 빈 context</li>
 *   <li>{@link #parse(String)}: 잘못된 JSON이면 {@link ValidationException} (쓰기 경로)</li>
 *   <li>{@link #parseLenient(String)}: 잘못된 JSON이면 원문을 JSON 문자열 값으로 보존하고 WARN 로그 (읽기 경로)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StatusContext {

    private static final Logger log = LoggerFactory.getLogger(StatusContext.class);

    private static final ObjectMapper MAPPER = JsonMapper.builder().build();

    private static final StatusContext EMPTY = new StatusContext(null);

    private final JsonNode value;

    private StatusContext(JsonNode value) {
        this.value = value == null || value.isNull() || value.isMissingNode() ? null : value;
    }

    /**
     * 빈 context.
     *
     * @return 빈 StatusContext
     */
    public static StatusContext empty() {
        return EMPTY;
    }

    /**
     * JSON 트리로 context 생성.
     *
     * @param value JSON 값 (null이면 빈 context)
     * @return StatusContext 인스턴스
     */
    public static StatusContext of(JsonNode value) {
        return value == null ? EMPTY : new StatusContext(value.deepCopy());
    }

    /**
     * Java 값(Map, List, 문자열, 숫자 등)으로 context 생성.
     *
     * @param value 변환할 값 (null이면 빈 context)
     * @return StatusContext 인스턴스
     * @throws ValidationException JSON으로 변환할 수 없는 값인 경우
     */
    public static StatusContext fromValue(Object value) {
        if (value == null) {
            return EMPTY;
        }
        if (value instanceof JsonNode) {
            return of((JsonNode) value);
        }
        try {
            return new StatusContext(MAPPER.valueToTree(value));
        } catch (JacksonException | IllegalArgumentException e) {
            throw new ValidationException("Context value cannot be converted to JSON: " + value.getClass().getName(), e);
        }
    }

    /**
     * JSON 문자열을 엄격하게 파싱.
     *
     * @param json JSON 문자열 (null 또는 빈 문자열이면 빈 context)
     * @return StatusContext 인스턴스
     * @throws ValidationException 잘못된 JSON인 경우
     */
    public static StatusContext parse(String json) {
        if (json == null || json.isBlank()) {
            return EMPTY;
        }
        try {
            return new StatusContext(MAPPER.readTree(json));
        } catch (JacksonException e) {
            throw new ValidationException("Context is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * 저장된 JSON 문자열을 관대하게 파싱.
     *
     * <p>파싱에 실패하면 원문을 JSON 문자열 값으로 보존합니다. 데이터는 버려지지 않습니다.</p>
     *
     * @param json 저장된 JSON 문자열
     * @return StatusContext 인스턴스
     */
    public static StatusContext parseLenient(String json) {
        if (json == null || json.isBlank()) {
            return EMPTY;
        }
        try {
            return new StatusContext(MAPPER.readTree(json));
        } catch (JacksonException e) {
            log.warn("Failed to parse stored status context, keeping raw text: {}", e.getOriginalMessage());
            return new StatusContext(MAPPER.valueToTree(json));
        }
    }

    /**
     * JSON 값 조회.
     *
     * @return JSON 트리 복사본, 빈 context이면 null
     */
    public JsonNode getValue() {
        return value == null ? null : value.deepCopy();
    }

    public boolean isEmpty() {
        return value == null;
    }

    /**
     * 저장용 JSON 문자열.
     *
     * @return JSON 문자열, 빈 context이면 null
     */
    public String toJson() {
        if (value == null) {
            return null;
        }
        return MAPPER.writeValueAsString(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StatusContext that = (StatusContext) o;
        if (value == null) return that.value == null;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value == null ? 0 : value.hashCode();
    }

    @Override
    public String toString() {
        return "StatusContext{" + (value == null ? "empty" : toJson()) + '}';
    }
}
