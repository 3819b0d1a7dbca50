package org.smtbridge.smtlib;

import lombok.Getter;
import org.smtbridge.core.SmtLibException;

/**
 * 问题需要的特性不被所选求解器支持。在生成任何文本之前抛出。
 */
@Getter
public class UnsupportedFeatureException extends SmtLibException {

    private final String feature;

    public UnsupportedFeatureException(String feature, String message) {
        super(message);
        this.feature = feature;
    }
}
