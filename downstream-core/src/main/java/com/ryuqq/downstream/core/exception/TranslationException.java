package com.ryuqq.downstream.core.exception;

/**
 * downstream 응답을 결과로 변환할 수 없을 때 발생.
 *
 * <p>인식할 수 없는 응답 형태(shape)이거나, 형태는 맞지만 내용이 규약을 어긴 경우입니다.
 * 메시지에 예상하지 못한 형태의 이름이 포함됩니다.</p>
 *
 * @author Downstream Team
 * @since 1.0.0
 */
public class TranslationException extends QueryExecutionException {

    public TranslationException(String message) {
        super(message);
    }

    /**
     * 인식할 수 없는 응답 형태에 대한 예외 생성.
     *
     * @param shape 응답 객체 (null 허용)
     * @return TranslationException ("cannot decode (Shape)")
     */
    public static TranslationException cannotDecode(Object shape) {
        String name = shape == null ? "null" : shape.getClass().getSimpleName();
        return new TranslationException("cannot decode (" + name + ")");
    }
}
