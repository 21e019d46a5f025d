package com.ryuqq.downstream.core.model;

/**
 * 시계열 라벨 (name=value).
 *
 * @param name 라벨 이름
 * @param value 라벨 값
 *
 * @author Downstream Team
 * @since 1.0.0
 */
public record Label(String name, String value) {

    public Label {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("label name cannot be null or empty");
        }
        if (value == null) {
            throw new IllegalArgumentException("label value cannot be null");
        }
    }

    public static Label of(String name, String value) {
        return new Label(name, value);
    }

    @Override
    public String toString() {
        return name + "=\"" + value + "\"";
    }
}
