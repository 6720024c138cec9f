package com.enterprise.taskengine.monitoring;

import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

/**
 * SLF4J markers shared by the engine's loggers
 */
public final class Markers {
    
    /**
     * Tags ERROR records that leave the worker in a degraded or unusable state
     */
    public static final Marker CRITICAL = MarkerFactory.getMarker("CRITICAL");
    
    private Markers() {
    }
}
