package com.chih.JTemplate.core.spi;

import java.util.Map;

/**
 * 项目自定义 Helper 的提供者，在构建 HelperRegistry 时一次性注册
 */
public interface HelperProvider {

    /**
     * @return Helper 名称 -> 实现
     */
    Map<String, Helper> helpers();
}
