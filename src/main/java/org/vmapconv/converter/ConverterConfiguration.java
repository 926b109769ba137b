package org.vmapconv.converter;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 转换服务的 Bean 装配。
 * <p>
 * 说明：转换全部在内存中完成，只在开始与结束时读写本地文件，不引入其它外部依赖。
 */
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(ConverterProperties.class)
public class ConverterConfiguration {

    @Bean
    public DataPathResolver dataPathResolver(ConverterProperties properties) {
        return new DataPathResolver(properties);
    }

    @Bean
    public PermasToVmapConverter permasToVmapConverter(ConverterProperties properties, DataPathResolver resolver) {
        return new PermasToVmapConverter(properties, resolver, Clock.systemDefaultZone());
    }

    @Bean
    public VmapToPermasAsciiConverter vmapToPermasAsciiConverter(ConverterProperties properties, DataPathResolver resolver) {
        return new VmapToPermasAsciiConverter(properties, resolver);
    }
}
