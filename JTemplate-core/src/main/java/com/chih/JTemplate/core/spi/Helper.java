package com.chih.JTemplate.core.spi;

import java.util.List;

/**
 * 模板 Helper 函数 SPI
 * <p>
 * Helper 必须是纯函数：只读取传入的参数，不做 I/O，不阻塞。
 * 引擎只把已解析的参数交给 Helper，Helper 拿不到作用域或引擎本身。
 * </p>
 * <p>
 * 参数中的 List / Map 是只读视图，未定义的变量以 null 传入。
 * 返回值应为 String、Number、Boolean、null、List 或 Map。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/13
 */
@FunctionalInterface
public interface Helper {

    /**
     * @param args 已解析的参数，不可修改
     * @return Helper 结果
     * @throws com.chih.JTemplate.core.exception.HelperContractException 参数数量或类型不符
     */
    Object apply(List<Object> args);
}
