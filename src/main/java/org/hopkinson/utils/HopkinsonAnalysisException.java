package org.hopkinson.utils;

/**
 * Базовое (проверяемое) исключение обработки эксперимента на разрезном стержне Гопкинсона.
 * <br>Всё, что ядро не может исправить самостоятельно и обязано отдать вызывающей
 * стороне, наследуется отсюда.</br>
 * @see PulseDetectionException
 */
public class HopkinsonAnalysisException extends Exception {

    public HopkinsonAnalysisException(String message) {
        super(message);
    }

    public HopkinsonAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
