package com.polishfootball.network.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Node sizing for the graph view: size = min(base + connections * step, max).
 */
@Component
@ConfigurationProperties(prefix = "football.graph")
public class GraphProperties {

    private int nodeBaseSize = 20;
    private int nodeSizeStep = 2;
    private int nodeMaxSize = 100;

    public int getNodeBaseSize() {
        return nodeBaseSize;
    }

    public void setNodeBaseSize(int nodeBaseSize) {
        this.nodeBaseSize = nodeBaseSize;
    }

    public int getNodeSizeStep() {
        return nodeSizeStep;
    }

    public void setNodeSizeStep(int nodeSizeStep) {
        this.nodeSizeStep = nodeSizeStep;
    }

    public int getNodeMaxSize() {
        return nodeMaxSize;
    }

    public void setNodeMaxSize(int nodeMaxSize) {
        this.nodeMaxSize = nodeMaxSize;
    }
}
