package com.enterprise.taskengine.core;

import com.enterprise.taskengine.exception.TaskNotRegisteredException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Task definitions known to a worker, by name
 */
public class TaskRegistry {
    
    private static final Logger logger = LoggerFactory.getLogger(TaskRegistry.class);
    
    private final Map<String, TaskDefinition> tasks = new ConcurrentHashMap<>();
    
    public void register(TaskDefinition task) {
        TaskDefinition previous = tasks.put(task.getName(), task);
        if (previous != null) {
            logger.warn("Replaced task definition: {}", task.getName());
        } else {
            logger.info("Registered task: {}", task.getName());
        }
    }
    
    public boolean unregister(String name) {
        boolean removed = tasks.remove(name) != null;
        if (removed) {
            logger.info("Unregistered task: {}", name);
        }
        return removed;
    }
    
    public Optional<TaskDefinition> find(String name) {
        return Optional.ofNullable(tasks.get(name));
    }
    
    public TaskDefinition get(String name) throws TaskNotRegisteredException {
        TaskDefinition task = tasks.get(name);
        if (task == null) {
            throw new TaskNotRegisteredException(name);
        }
        return task;
    }
    
    public boolean contains(String name) {
        return tasks.containsKey(name);
    }
    
    public Set<String> names() {
        return Collections.unmodifiableSet(tasks.keySet());
    }
    
    public int size() {
        return tasks.size();
    }
}
