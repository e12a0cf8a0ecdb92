package com.tightzone.core;

/**
 * 模块说明：FailureKind（enum）。
 * 主要职责：区分扫描失败的类别，供调用方按类别决定提示与退出码。
 */
public enum FailureKind {
    INVALID_INPUT("invalid_input"),
    TRANSPORT("transport"),
    DECODE("decode"),
    PROVIDER_ERROR("provider_error"),
    CANCELLED("cancelled");

    private final String label;

    FailureKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
