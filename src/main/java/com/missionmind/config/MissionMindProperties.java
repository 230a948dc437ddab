package com.missionmind.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "missionmind")
public class MissionMindProperties {

    private String taskIdPrefix = "T";
    private EngineProperties engine = new EngineProperties();

    public String getTaskIdPrefix() {
        return taskIdPrefix;
    }

    public void setTaskIdPrefix(String taskIdPrefix) {
        if (taskIdPrefix == null || taskIdPrefix.isBlank()) {
            return;
        }
        this.taskIdPrefix = taskIdPrefix;
    }

    public EngineProperties getEngine() {
        return engine;
    }

    public void setEngine(EngineProperties engine) {
        this.engine = engine != null ? engine : new EngineProperties();
    }
}
