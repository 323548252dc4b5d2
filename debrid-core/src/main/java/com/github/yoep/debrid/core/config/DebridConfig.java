package com.github.yoep.debrid.core.config;

import com.github.yoep.debrid.adapter.DebridProvider;
import com.github.yoep.debrid.adapter.cache.ResolvedUrlCache;
import com.github.yoep.debrid.core.DebridService;
import com.github.yoep.debrid.core.DebridServiceImpl;
import com.github.yoep.debrid.core.config.properties.DebridProperties;
import com.github.yoep.debrid.core.credentials.CredentialBlacklist;
import com.github.yoep.debrid.core.credentials.CredentialGuard;
import com.github.yoep.debrid.core.errors.ErrorClassifier;
import com.github.yoep.debrid.core.meta.ItemMetaEnricher;
import com.github.yoep.debrid.core.providers.ProviderRegistry;
import com.github.yoep.debrid.core.resolve.CaffeineResolvedUrlCache;
import com.github.yoep.debrid.core.resolve.SingleFlightResolver;
import com.github.yoep.debrid.core.streams.StreamAggregator;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.stream.Collectors;

@Configuration
@EnableConfigurationProperties(DebridProperties.class)
public class DebridConfig {
    public static final String RESOLVE_EXECUTOR = "debridResolveExecutor";

    @Bean
    @ConditionalOnMissingBean
    public CredentialBlacklist credentialBlacklist() {
        return new CredentialBlacklist();
    }

    @Bean
    @ConditionalOnMissingBean
    public CredentialGuard credentialGuard(CredentialBlacklist credentialBlacklist, DebridProperties properties) {
        return new CredentialGuard(credentialBlacklist, properties.getMinCredentialLength());
    }

    @Bean
    @ConditionalOnMissingBean
    public ProviderRegistry providerRegistry(ObjectProvider<DebridProvider> providers) {
        return new ProviderRegistry(providers.orderedStream()
                .collect(Collectors.toList()));
    }

    @Bean
    @ConditionalOnMissingBean
    public ResolvedUrlCache resolvedUrlCache(DebridProperties properties) {
        var resolve = properties.getResolve();
        return new CaffeineResolvedUrlCache(resolve.getCacheSize(), resolve.getCacheTtl(), resolve.getStaticCacheTtl());
    }

    @Bean(RESOLVE_EXECUTOR)
    @ConditionalOnMissingBean(name = RESOLVE_EXECUTOR)
    public ThreadPoolTaskExecutor debridResolveExecutor(DebridProperties properties) {
        var maxConcurrent = properties.getResolve().getMaxConcurrent();
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(maxConcurrent);
        executor.setMaxPoolSize(maxConcurrent);
        executor.setThreadNamePrefix("debrid-resolve-");
        executor.setDaemon(true);
        return executor;
    }

    @Bean
    @ConditionalOnMissingBean
    public SingleFlightResolver singleFlightResolver(ResolvedUrlCache resolvedUrlCache,
                                                     CredentialGuard credentialGuard,
                                                     @Qualifier(RESOLVE_EXECUTOR) Executor resolveExecutor,
                                                     DebridProperties properties) {
        return new SingleFlightResolver(resolvedUrlCache, credentialGuard, resolveExecutor, properties.getResolve().getTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public ErrorClassifier errorClassifier(DebridProperties properties) {
        return new ErrorClassifier(properties.getProductName());
    }

    @Bean
    @ConditionalOnMissingBean
    public StreamAggregator streamAggregator(ProviderRegistry providerRegistry,
                                             CredentialGuard credentialGuard,
                                             ErrorClassifier errorClassifier) {
        return new StreamAggregator(providerRegistry, credentialGuard, errorClassifier);
    }

    @Bean
    @ConditionalOnMissingBean
    public ItemMetaEnricher itemMetaEnricher() {
        return ItemMetaEnricher.passThrough();
    }

    @Bean
    @ConditionalOnMissingBean
    public DebridService debridService(ProviderRegistry providerRegistry,
                                       CredentialGuard credentialGuard,
                                       StreamAggregator streamAggregator,
                                       SingleFlightResolver singleFlightResolver,
                                       ItemMetaEnricher itemMetaEnricher) {
        return new DebridServiceImpl(providerRegistry, credentialGuard, streamAggregator, singleFlightResolver, itemMetaEnricher);
    }
}
