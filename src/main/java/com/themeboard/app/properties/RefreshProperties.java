package com.themeboard.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ConfigurationProperties(prefix = "refresh")
public class RefreshProperties {
    private boolean enabled = false;
    private String token = "";
    private List<String> command = new ArrayList<>();
    private long timeoutSec = 1800L;
}
