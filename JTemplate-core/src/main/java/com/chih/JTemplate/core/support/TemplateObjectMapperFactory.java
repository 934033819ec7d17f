package com.chih.JTemplate.core.support;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JTemplate ObjectMapper 工厂类。
 * <p>
 * 统一 Jackson 配置，供绑定文件解析（YAML / JSON）和 Map 值的 JSON 输出使用。
 * </p>
 *
 * <h3>配置策略说明：</h3>
 * <ul>
 *   <li>FAIL_ON_EMPTY_BEANS: false - 空对象不抛异常</li>
 *   <li>WRITE_DATES_AS_TIMESTAMPS: disabled - 日期输出为 ISO-8601</li>
 *   <li>USE_BIG_DECIMAL_FOR_FLOATS: false - 小数保持 Double，与模板字面量一致</li>
 * </ul>
 *
 * @author lizhiyuan
 * @since 2026/10/13
 */
public class TemplateObjectMapperFactory {

    /**
     * 创建用于 YAML 绑定文件的 ObjectMapper
     *
     * @return 配置好的 YAML ObjectMapper，线程安全可重用
     */
    public static ObjectMapper createYamlMapper() {
        return configure(new ObjectMapper(new YAMLFactory()));
    }

    /**
     * 创建用于 JSON 绑定文件和 JSON 输出的 ObjectMapper
     *
     * @return 配置好的 JSON ObjectMapper，线程安全可重用
     */
    public static ObjectMapper createJsonMapper() {
        return configure(new ObjectMapper());
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        /* 支持绑定值中出现 LocalDate 等时间类型 */
        mapper.registerModule(new JavaTimeModule());

        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, false);

        return mapper;
    }
}
