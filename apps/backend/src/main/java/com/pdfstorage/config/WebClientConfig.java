package com.pdfstorage.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

@Slf4j
@Configuration
public class WebClientConfig {

    static final String GITHUB_JSON = "application/vnd.github+json";

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // GitHub 响应字段很多，只映射用得到的
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * GitHub REST API 专用 WebClient。token 按请求携带，这里只固定 baseUrl 与 Accept。
     * 不设置超时，沿用底层连接器默认行为。
     */
    @Bean
    public WebClient githubWebClient(WebClient.Builder builder, GitHubProperties props) {
        ExchangeFilterFunction logRequest = ExchangeFilterFunction.ofRequestProcessor(request -> {
            log.debug("[github] {} {}", request.method(), request.url());
            return Mono.just(request);
        });

        return builder.clone()
                .baseUrl(props.getApiBaseUrl())
                .defaultHeader(HttpHeaders.ACCEPT, GITHUB_JSON)
                .defaultHeader(HttpHeaders.USER_AGENT, "pdf-storage-backend")
                .codecs(c -> c.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                .filter(logRequest)
                .build();
    }
}
