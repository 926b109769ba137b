package org.vmapconv.converter;

/**
 * 不可恢复的转换错误（缺少必需的数据集、无法归属部件的节点或面等）。
 * <p>
 * 可恢复的问题不抛异常，而是记入结果中的 warnings。
 */
public class ConversionException extends RuntimeException {

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
