package io.lighting.zweig.starter;

import io.lighting.zweig.Zweig;
import io.lighting.zweig.observe.RenderLog;
import io.lighting.zweig.observe.RenderObserver;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@ConditionalOnClass(Zweig.class)
@EnableConfigurationProperties(ZweigProperties.class)
public class ZweigAutoConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(ZweigAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public List<RenderObserver> renderObservers(ZweigProperties properties) {
        RenderLog renderLog = properties.getLog().build(LOGGER::info);
        if (renderLog == null) {
            return List.of();
        }
        List<RenderObserver> observers = new ArrayList<>();
        observers.add(renderLog);
        return observers;
    }

    @Bean
    @ConditionalOnMissingBean
    public Zweig zweig(ZweigProperties properties, List<RenderObserver> renderObservers) {
        return Zweig.builder()
            .indent(properties.getIndent())
            .observers(renderObservers)
            .build();
    }
}
