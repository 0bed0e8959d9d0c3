package com.ryuqq.result.core.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 실패를 설명하는 구조화된 오류.
 *
 * <p>메시지, 숫자 코드, 선택적 원인(cause), 그리고 확장 가능한 메타데이터로 구성됩니다.</p>
 *
 * <p><strong>불변성:</strong> message, code, cause는 생성 후 변경 불가.
 * metadata만 {@link #addMetadata(String, Object)}로 추가할 수 있습니다.</p>
 *
 * <p><strong>동시성:</strong> {@link #addMetadata(String, Object)}는 같은 인스턴스에 대해
 * 동시에 호출하면 안 됩니다. 소유자가 생성 직후 채우고, 이후에는 읽기 전용으로 사용합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * ResultError error = ResultError.of("Payment declined", 402)
 *     .addMetadata("orderId", "ORD-001");
 *
 * ResultError fromIo = ResultError.fromCause(ioException, "Upload failed");
 * </pre>
 *
 * @author Result Team
 * @since 1.0.0
 */
public final class ResultError {

    /**
     * 메시지 없이 실패를 만들 때 쓰이는 기본 오류 ("Default", 코드 0).
     *
     * <p>공유 인스턴스이므로 메타데이터는 읽기 전용입니다.</p>
     */
    public static final ResultError DEFAULT = new ResultError("Default", 0, null, Collections.emptyMap());

    /**
     * bindTryCatch가 잡은 예외를 담는 메타데이터 키.
     */
    public static final String EXCEPTION_METADATA_KEY = "exception";

    private final String message;
    private final int code;
    private final Throwable cause;
    private final Map<String, Object> metadata;

    private ResultError(String message, int code, Throwable cause, Map<String, Object> metadata) {
        this.message = message;
        this.code = code;
        this.cause = cause;
        this.metadata = metadata;
    }

    /**
     * 메시지만으로 오류 생성 (코드 0).
     *
     * @param message 오류 메시지
     */
    public ResultError(String message) {
        this(message, 0, null);
    }

    /**
     * 메시지와 코드로 오류 생성.
     *
     * @param message 오류 메시지
     * @param code 오류 코드
     */
    public ResultError(String message, int code) {
        this(message, code, null);
    }

    /**
     * 메시지, 코드, 원인으로 오류 생성.
     *
     * @param message 오류 메시지
     * @param code 오류 코드
     * @param cause 원인 (선택, null 가능)
     * @throws IllegalArgumentException message가 null인 경우
     */
    public ResultError(String message, int code, Throwable cause) {
        this(requireMessage(message), code, cause, new LinkedHashMap<>());
    }

    /**
     * 메시지만으로 오류 생성.
     *
     * @param message 오류 메시지
     * @return ResultError 인스턴스
     */
    public static ResultError of(String message) {
        return new ResultError(message);
    }

    /**
     * 메시지와 코드로 오류 생성.
     *
     * @param message 오류 메시지
     * @param code 오류 코드
     * @return ResultError 인스턴스
     */
    public static ResultError of(String message, int code) {
        return new ResultError(message, code);
    }

    /**
     * 예외로부터 오류 생성.
     *
     * <p>메시지는 예외 메시지(없으면 예외 클래스 이름), 코드는 {@link #codeOf(Throwable)}를 사용합니다.</p>
     *
     * @param cause 원인 예외
     * @return ResultError 인스턴스
     * @throws IllegalArgumentException cause가 null인 경우
     */
    public static ResultError fromCause(Throwable cause) {
        requireCause(cause);
        return new ResultError(messageOf(cause), codeOf(cause), cause);
    }

    /**
     * 예외로부터 메시지를 지정하여 오류 생성. 코드는 예외에서 유도됩니다.
     *
     * @param cause 원인 예외
     * @param message 오류 메시지
     * @return ResultError 인스턴스
     * @throws IllegalArgumentException cause가 null인 경우
     */
    public static ResultError fromCause(Throwable cause, String message) {
        requireCause(cause);
        return new ResultError(message, codeOf(cause), cause);
    }

    /**
     * 예외로부터 메시지와 코드를 지정하여 오류 생성.
     *
     * @param cause 원인 예외
     * @param message 오류 메시지
     * @param code 오류 코드
     * @return ResultError 인스턴스
     * @throws IllegalArgumentException cause가 null인 경우
     */
    public static ResultError fromCause(Throwable cause, String message, int code) {
        requireCause(cause);
        return new ResultError(message, code, cause);
    }

    /**
     * 예외 메시지를 그대로 쓰고 코드만 지정하여 오류 생성.
     *
     * @param cause 원인 예외
     * @param code 오류 코드
     * @return ResultError 인스턴스
     * @throws IllegalArgumentException cause가 null인 경우
     */
    public static ResultError fromCause(Throwable cause, int code) {
        requireCause(cause);
        return new ResultError(messageOf(cause), code, cause);
    }

    /**
     * 예외 종류에서 유도한 오류 코드.
     *
     * <p>같은 예외 클래스는 항상 같은 코드를 갖습니다.</p>
     *
     * @param cause 원인 예외
     * @return 예외 클래스 이름의 해시 코드
     */
    public static int codeOf(Throwable cause) {
        requireCause(cause);
        return cause.getClass().getName().hashCode();
    }

    /**
     * 메타데이터 추가.
     *
     * <p>이미 존재하는 키는 덮어쓰지 않고 예외를 발생시킵니다.
     * 메타데이터는 {@link #equals(Object)}에는 반영되지만 {@link #hashCode()}에는 반영되지 않으므로,
     * 해시 기반 컬렉션에 넣은 뒤 추가해도 해시 코드는 바뀌지 않습니다.</p>
     *
     * @param key 메타데이터 키
     * @param value 메타데이터 값
     * @return 현재 인스턴스
     * @throws IllegalArgumentException key가 null이거나 이미 존재하는 경우
     * @throws UnsupportedOperationException {@link #DEFAULT}에 추가하려는 경우
     */
    public ResultError addMetadata(String key, Object value) {
        if (key == null) {
            throw new IllegalArgumentException("Metadata key cannot be null");
        }
        if (metadata.containsKey(key)) {
            throw new IllegalArgumentException("Metadata key already exists: " + key);
        }
        metadata.put(key, value);
        return this;
    }

    /**
     * 메타데이터 항목 하나를 더한 복사본 생성.
     *
     * <p>현재 인스턴스는 변경되지 않습니다.</p>
     *
     * @param key 메타데이터 키
     * @param value 메타데이터 값
     * @return 새 ResultError 인스턴스
     * @throws IllegalArgumentException key가 null이거나 이미 존재하는 경우
     */
    public ResultError withMetadata(String key, Object value) {
        ResultError copy = new ResultError(message, code, cause, new LinkedHashMap<>(metadata));
        return copy.addMetadata(key, value);
    }

    public String getMessage() {
        return message;
    }

    public int getCode() {
        return code;
    }

    /**
     * 원인 조회.
     *
     * @return 원인 예외 (없으면 null)
     */
    public Throwable getCause() {
        return cause;
    }

    public boolean hasCause() {
        return cause != null;
    }

    /**
     * 메타데이터 조회.
     *
     * @return 읽기 전용 메타데이터 뷰
     */
    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    private static String requireMessage(String message) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        return message;
    }

    private static void requireCause(Throwable cause) {
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
    }

    private static String messageOf(Throwable cause) {
        String message = cause.getMessage();
        return message != null ? message : cause.getClass().getName();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResultError that = (ResultError) o;
        return code == that.code
            && message.equals(that.message)
            && cause == that.cause
            && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        // metadata is mutable, so it stays out of the hash
        return Objects.hash(message, code, System.identityHashCode(cause));
    }

    @Override
    public String toString() {
        return "ResultError{message='" + message + "', code=" + code
            + (cause != null ? ", cause=" + cause.getClass().getName() : "")
            + (metadata.isEmpty() ? "" : ", metadata=" + metadata.keySet())
            + '}';
    }
}
