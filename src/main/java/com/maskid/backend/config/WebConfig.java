package com.maskid.backend.config;

import com.maskid.backend.common.storage.LocalObjectStorage;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

    private final LocalObjectStorage storage;

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        // 必須是 file: URI，尾巴要有 /
        String location = storage.root().toAbsolutePath().normalize().toUri().toString();

        registry.addResourceHandler(LocalObjectStorage.PUBLIC_PREFIX + "**")
                .addResourceLocations(location)
                .setCachePeriod(3600);

        // 內建圖示（client 沒上傳 icon 時的預設）
        registry.addResourceHandler("/static/*.svg")
                .addResourceLocations("classpath:/static/")
                .setCachePeriod(86400);
    }
}
