package com.pivotcalc.common;

/**
 * 定义求值结果到字节输出的转换，便于不同客户端实现自定义格式。
 */
public interface ResultFormatter {

    byte[] format(EvalResult result);
}
