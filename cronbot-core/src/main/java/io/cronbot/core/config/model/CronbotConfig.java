package io.cronbot.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CronbotConfig(SchedulerConfig scheduler, StoreConfig store) {

    public static CronbotConfig defaults() {
        return new CronbotConfig(SchedulerConfig.defaults(), StoreConfig.defaults());
    }
}
