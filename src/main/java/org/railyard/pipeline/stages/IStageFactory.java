package org.railyard.pipeline.stages;

import java.util.Map;

/**
 * Creates stage instances. Implemented by constructor references of concrete stages.
 */
@FunctionalInterface
public interface IStageFactory {

    AbstractStage create(String instanceName, Map<String, Object> options, StageContext context);
}
