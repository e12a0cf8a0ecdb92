package com.tightzone.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "chart")
public class ChartProperties {
    private String dir = "charts";
    private int threads = 4;
    private int width = 1200;
    private int height = 720;
}
