package org.iceforge.hugin.semantic.config;

import org.iceforge.hugin.semantic.compiler.CompileOptions;
import org.iceforge.hugin.semantic.compiler.QueryCompiler;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
@EnableConfigurationProperties(HuginProperties.class)
public class AppConfig {

    @Bean
    public QueryCompiler queryCompiler(HuginProperties props) {
        return new QueryCompiler(new CompileOptions(props.getUnresolvedDimensionPolicy(), props.getLiteralPolicy()));
    }

    @Bean
    public WebClient warehouseWebClient(HuginProperties props) {
        WebClient.Builder builder = WebClient.builder()
                .baseUrl(props.getWarehouseBaseUrl());
        if (StringUtils.hasText(props.getWarehouseToken())) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + props.getWarehouseToken());
        }
        return builder.build();
    }
}
