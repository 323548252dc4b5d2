package com.github.yoep.debrid.core;

import com.github.yoep.debrid.core.config.DebridConfig;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

@Configuration
@Import({
        DebridConfig.class
})
public class AutoConfiguration {
}
