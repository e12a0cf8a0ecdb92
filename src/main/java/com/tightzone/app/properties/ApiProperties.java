package com.tightzone.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "api")
public class ApiProperties {
    private int port = 5000;
    private String cacheFile = "vcp_stocks_cache.json";
}
