package com.rusticlang.compiler.stdlib;

/**
 * 映射表缺失或格式错误（配置错误，由调用方处理）
 */
public class MappingTableException extends RuntimeException {

    public MappingTableException(String message) {
        super(message);
    }

    public MappingTableException(String message, Throwable cause) {
        super(message, cause);
    }
}
