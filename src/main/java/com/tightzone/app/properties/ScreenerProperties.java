package com.tightzone.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ConfigurationProperties(prefix = "screener")
public class ScreenerProperties {
    private String market = "america";
    private String endpoint = "https://scanner.tradingview.com/%s/scan";
    private int pageSize = 150;
    private String lang = "en";
    private int timeoutSec = 20;
    private List<String> columns = new ArrayList<>();
}
