package com.nei10u.panchanga.config;

import com.alibaba.fastjson2.JSONWriter;
import com.alibaba.fastjson2.support.config.FastJsonConfig;
import com.alibaba.fastjson2.support.spring6.http.converter.FastJsonHttpMessageConverter;
import org.springframework.boot.autoconfigure.http.HttpMessageConverters;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;

import java.util.List;

/**
 * 排盘接口的 JSON 读写交给 fastjson2：
 * <ul>
 *   <li>{@code PanchangaRequest} 按字段反序列化；</li>
 *   <li>结果里的名称 record（TithiName、VaraName 等）按组件名输出；</li>
 *   <li>{@code LocalTime}（日出日落、月出月落）输出为 "HH:mm:ss" 字符串；</li>
 *   <li>Paksha、Planet 等枚举按 toString 输出展示名，如 "Shukla Paksha"；</li>
 *   <li>月出月落缺失时保留 null 字段，前端据此判断当天无该事件。</li>
 * </ul>
 */
@Configuration
public class FastJsonConfiguration {

    @Bean
    public HttpMessageConverters fastJsonHttpMessageConverters() {
        FastJsonConfig config = new FastJsonConfig();
        // 结果里只有时刻（LocalTime），默认的 "yyyy-MM-dd HH:mm:ss" 会带上无意义的日期
        config.setDateFormat("HH:mm:ss");
        config.setWriterFeatures(
                JSONWriter.Feature.WriteMapNullValue,
                JSONWriter.Feature.WriteEnumUsingToString
        );

        FastJsonHttpMessageConverter converter = new FastJsonHttpMessageConverter();
        converter.setFastJsonConfig(config);
        converter.setSupportedMediaTypes(List.of(
                MediaType.APPLICATION_JSON,
                new MediaType("application", "*+json")
        ));

        return new HttpMessageConverters(converter);
    }
}
