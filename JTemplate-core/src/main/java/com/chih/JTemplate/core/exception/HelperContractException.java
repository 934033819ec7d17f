package com.chih.JTemplate.core.exception;

/**
 * 已注册的 Helper 收到了它不接受的参数（数量或类型不符）
 */
public class HelperContractException extends UnknownHelperException {
    public HelperContractException(String helperName, String reason) {
        super(helperName, "Helper '" + helperName + "' contract violation: " + reason);
    }

    public HelperContractException(String helperName, String reason, Throwable cause) {
        super(helperName, "Helper '" + helperName + "' contract violation: " + reason, cause);
    }
}
