package com.tightzone.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "news")
public class NewsProperties {
    private String endpoint = "https://query1.finance.yahoo.com/v1/finance/search";
    private int limit = 3;
    private int days = 3;
    private int cacheTtlMin = 30;
    private int timeoutSec = 5;
}
