package com.snubalink.service.core.config;

import com.snubalink.client.transport.SnubaTransport;
import com.snubalink.client.transport.okhttp.OkHttpSnubaTransport;
import com.snubalink.service.core.cache.CaffeineQueryCacheStore;
import com.snubalink.service.core.cache.QueryCacheStore;
import com.snubalink.service.core.cache.TimeQuantizer;
import com.snubalink.service.core.dispatch.SnubaDispatcher;
import com.snubalink.service.core.health.ReleaseHealth;
import com.snubalink.service.core.lookup.EntityLookupService;
import com.snubalink.service.core.options.QueryOptionOverrides;
import com.snubalink.service.core.params.OrganizationResolver;
import com.snubalink.service.core.params.QueryParamsPreparer;
import com.snubalink.service.core.query.SnubaQueryService;
import com.snubalink.service.core.response.SnubaResponseParser;
import com.snubalink.service.core.telemetry.SnubaTelemetry;
import com.snubalink.service.core.telemetry.SnubaTelemetryRegistry;
import com.snubalink.service.core.translate.SnubaTranslatorFactory;
import java.time.Clock;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Wires the query layer. The application supplies the {@link EntityLookupService}; everything else
 * has a default that can be replaced by declaring a bean of the same type.
 */
@AutoConfiguration
@EnableConfigurationProperties(SnubaProperties.class)
public class SnubaClientAutoConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(SnubaTransport.class)
    public SnubaTransport snubaTransport(SnubaProperties properties) {
        SnubaProperties.Http http = properties.getHttp();
        return OkHttpSnubaTransport.builder()
                .baseUrl(properties.getUrl())
                .connectTimeout(http.getConnectTimeout())
                .readTimeout(http.getReadTimeout())
                .maxRetries(http.getMaxRetries())
                .retryBackoff(http.getRetryBackoff())
                .maxIdleConnections(http.getMaxIdleConnections())
                .preferIpv4(http.isPreferIpv4())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean(QueryCacheStore.class)
    public QueryCacheStore queryCacheStore(SnubaProperties properties) {
        return new CaffeineQueryCacheStore(properties.getCache().getMaximumSize());
    }

    @Bean
    @ConditionalOnMissingBean(SnubaTelemetry.class)
    public SnubaTelemetry snubaTelemetry() {
        return new SnubaTelemetryRegistry();
    }

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock snubaClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public QueryOptionOverrides queryOptionOverrides() {
        return new QueryOptionOverrides();
    }

    @Bean
    @ConditionalOnMissingBean
    public TimeQuantizer timeQuantizer(SnubaProperties properties) {
        return new TimeQuantizer(properties.getCache().getQuantizeDuration());
    }

    @Bean
    @ConditionalOnMissingBean
    public SnubaResponseParser snubaResponseParser() {
        return new SnubaResponseParser();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public SnubaDispatcher snubaDispatcher(
            SnubaTransport transport, SnubaTelemetry telemetry, SnubaProperties properties) {
        return new SnubaDispatcher(transport, telemetry, properties.getQuery().getPoolSize());
    }

    @Bean
    @ConditionalOnBean(EntityLookupService.class)
    @ConditionalOnMissingBean
    public SnubaTranslatorFactory snubaTranslatorFactory(EntityLookupService lookup) {
        return new SnubaTranslatorFactory(lookup);
    }

    @Bean
    @ConditionalOnBean(EntityLookupService.class)
    @ConditionalOnMissingBean
    public OrganizationResolver organizationResolver(EntityLookupService lookup) {
        return new OrganizationResolver(lookup);
    }

    @Bean
    @ConditionalOnBean(EntityLookupService.class)
    @ConditionalOnMissingBean
    public QueryParamsPreparer queryParamsPreparer(
            SnubaTranslatorFactory translatorFactory,
            OrganizationResolver organizationResolver,
            EntityLookupService lookup,
            QueryOptionOverrides overrides,
            Clock clock) {
        return new QueryParamsPreparer(translatorFactory, organizationResolver, lookup, overrides, clock);
    }

    @Bean
    @ConditionalOnBean(EntityLookupService.class)
    @ConditionalOnMissingBean
    public SnubaQueryService snubaQueryService(
            QueryParamsPreparer preparer,
            SnubaDispatcher dispatcher,
            SnubaResponseParser parser,
            QueryCacheStore cacheStore,
            SnubaTelemetry telemetry,
            SnubaProperties properties) {
        return new SnubaQueryService(
                preparer,
                dispatcher,
                parser,
                cacheStore,
                telemetry,
                properties.getCache().getTtl(),
                properties.getQuery().isUseSnql());
    }

    @Bean
    @ConditionalOnBean(EntityLookupService.class)
    @ConditionalOnMissingBean
    public ReleaseHealth releaseHealth(SnubaQueryService queries, TimeQuantizer quantizer, Clock clock) {
        return new ReleaseHealth(queries, quantizer, clock);
    }
}
