package com.indicationscout.evidence.infrastructure.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.indicationscout.evidence.infrastructure.http.EvidenceHttpApi;
import com.indicationscout.evidence.infrastructure.http.RequestConfig;
import com.indicationscout.evidence.infrastructure.http.RequestExecutor;
import com.indicationscout.evidence.infrastructure.http.RetryingRequestExecutor;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import retrofit2.Retrofit;
import retrofit2.converter.jackson.JacksonConverterFactory;

import java.time.Duration;

/**
 * One Retrofit transport and one request executor per external source.
 */
@Configuration
public class RetrofitDataSourceConfig {

    public static final String OPEN_TARGETS = "open_targets";
    public static final String CLINICAL_TRIALS = "clinical_trials";

    @Bean
    public RequestConfig requestConfig(HttpClientConfig httpClientConfig) {
        return RequestConfig.from(httpClientConfig);
    }

    @Bean
    public OkHttpClient okHttpClient(RequestConfig requestConfig) {
        Duration timeout = requestConfig.timeout();
        return new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .callTimeout(timeout)
                .build();
    }

    @Bean
    public RequestExecutor openTargetsExecutor(DataSourceEndpoints endpoints, OkHttpClient okHttpClient,
                                               RequestConfig requestConfig, ObjectMapper objectMapper) {
        return createExecutor(OPEN_TARGETS, endpoints.getOpenTargetsBaseUrl(), okHttpClient,
                requestConfig, objectMapper);
    }

    @Bean
    public RequestExecutor clinicalTrialsExecutor(DataSourceEndpoints endpoints, OkHttpClient okHttpClient,
                                                  RequestConfig requestConfig, ObjectMapper objectMapper) {
        return createExecutor(CLINICAL_TRIALS, endpoints.getClinicalTrialsBaseUrl(), okHttpClient,
                requestConfig, objectMapper);
    }

    public static RequestExecutor createExecutor(String source, String baseUrl, OkHttpClient okHttpClient,
                                                 RequestConfig requestConfig, ObjectMapper objectMapper) {
        Retrofit retrofit = new Retrofit.Builder()
                .baseUrl(baseUrl)
                .client(okHttpClient)
                .addConverterFactory(JacksonConverterFactory.create(objectMapper))
                .build();

        return new RetryingRequestExecutor(source, retrofit.create(EvidenceHttpApi.class), requestConfig,
                objectMapper, markupMapper());
    }

    // Not a bean: an XmlMapper in the context would replace the JSON ObjectMapper.
    private static XmlMapper markupMapper() {
        XmlMapper xmlMapper = new XmlMapper();
        xmlMapper.registerModule(new JavaTimeModule());
        xmlMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return xmlMapper;
    }
}
