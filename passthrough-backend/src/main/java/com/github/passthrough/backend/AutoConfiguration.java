package com.github.passthrough.backend;

import com.github.passthrough.backend.config.PassthroughConfig;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

@Configuration
@Import({
        PassthroughConfig.class
})
public class AutoConfiguration {
}
