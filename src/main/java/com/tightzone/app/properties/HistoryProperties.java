package com.tightzone.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "history")
public class HistoryProperties {
    private String endpoint = "https://query1.finance.yahoo.com/v8/finance/chart/";
    private String period = "6mo";
    private String interval = "1d";
    private int timeoutSec = 10;
}
